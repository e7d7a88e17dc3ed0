package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.Bufs;
import io.github.mandar2812.PlasmaML.hdf5.record.DatatypeMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.MessageFactory;
import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;
import io.github.mandar2812.PlasmaML.hdf5.record.Superblock;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Examines an HDF5 file and provides access to its groups and datasets
 * by path.
 *
 * <p>Constructing an instance of this class reads enough of a file
 * to identify it as HDF5 and locate its root group.
 * Everything else is read from the data buffer as required;
 * nothing read is cached between calls, so an instance may be used
 * from several threads at once.
 *
 * <p>Paths are <code>/</code>-separated names starting from the root
 * group.  A leading slash is optional, and "." and ".." segments
 * are understood.
 *
 * @author   Mark Taylor
 * @since    19 Jun 2013
 */
public class Hdf5File implements Closeable {

    private final Buf buf_;
    private final Superblock superblock_;
    private final MessageFactory msgFact_;
    private final ObjectHeader rootHeader_;
    private final LinkResolver resolver_;
    private final Closeable closer_;
    private volatile boolean closed_;

    private static final Logger logger_ =
        Logger.getLogger( Hdf5File.class.getName() );

    /**
     * Constructs an Hdf5File from a buffer containing its byte data.
     *
     * @param   buf  buffer containing HDF5 file
     * @throws  Hdf5FormatException  if the buffer is not HDF5
     */
    public Hdf5File( Buf buf ) throws IOException {
        this( buf, null );
    }

    /**
     * Constructs an Hdf5File from a buffer, with a resource to release
     * on close.
     *
     * @param   buf  buffer containing HDF5 file
     * @param   closer  resource closed by {@link #close}, or null
     */
    private Hdf5File( Buf buf, Closeable closer ) throws IOException {
        long sbOffset = Superblock.locate( buf );
        if ( sbOffset < 0 ) {
            throw new Hdf5FormatException( "Not an HDF5 file: "
                                         + "no signature found" );
        }
        superblock_ = new Superblock( buf, sbOffset );

        // All addresses in the file are relative to the base address.
        long base = superblock_.baseAddress;
        buf_ = base > 0 && base != Buf.UNDEFINED_ADDRESS ? buf.subBuf( base )
                                                         : buf;
        msgFact_ = new MessageFactory();
        rootHeader_ = readHeader( superblock_.rootHeaderAddress );
        resolver_ = new LinkResolver( this );
        closer_ = closer;
    }

    /**
     * Opens an HDF5 file on disk.  The file is memory-mapped.
     *
     * @param  file  HDF5 file
     * @return  new file object, which should be closed after use
     */
    public static Hdf5File open( File file ) throws IOException {
        FileChannel channel = new RandomAccessFile( file, "r" ).getChannel();
        try {
            return new Hdf5File( Bufs.createBuf( channel, file ), channel );
        }
        catch ( IOException e ) {
            channel.close();
            throw e;
        }
    }

    /**
     * Opens HDF5 content held in memory.
     *
     * @param  bytes  file content
     * @return  new file object
     */
    public static Hdf5File open( byte[] bytes ) throws IOException {
        return new Hdf5File( Bufs.createBuf( bytes ) );
    }

    /**
     * Examines a byte array to see if it looks like the start of an
     * HDF5 file without a user block.
     *
     * @param   intro  byte array, at least 8 bytes if available
     * @return  true iff the first 8 bytes are the HDF5 signature
     */
    public static boolean isSignature( byte[] intro ) {
        return Superblock.isSignature( intro );
    }

    /**
     * Returns the buffer containing the file data, addressed from the
     * file's base address.
     *
     * @return  buffer
     */
    public Buf getBuf() {
        return buf_;
    }

    /**
     * Returns the superblock.
     *
     * @return  superblock
     */
    public Superblock getSuperblock() {
        return superblock_;
    }

    /**
     * Returns a summary of file-level information from the superblock.
     *
     * @return  ordered map of items
     */
    public Map<String,Object> getFileInfo() {
        Map<String,Object> map = new LinkedHashMap<String,Object>();
        map.put( "superblockVersion", Integer.valueOf( superblock_.version ) );
        map.put( "superblockOffset",
                 Long.valueOf( superblock_.superblockOffset ) );
        map.put( "offsetSize", Integer.valueOf( superblock_.offsetSize ) );
        map.put( "lengthSize", Integer.valueOf( superblock_.lengthSize ) );
        map.put( "baseAddress", Long.valueOf( superblock_.baseAddress ) );
        map.put( "rootAddress",
                 Long.valueOf( superblock_.rootHeaderAddress ) );
        map.put( "eofAddress", Long.valueOf( superblock_.eofAddress ) );
        return map;
    }

    /**
     * Returns the root group.
     *
     * @return  root group
     */
    public Group getRoot() throws IOException {
        checkOpen();
        return new Group( this, "/", rootHeader_ );
    }

    /**
     * Returns the dataset at a given path.
     *
     * @param  path  dataset path
     * @return  dataset
     * @throws  DatasetNotFoundException  if there is nothing at the path
     * @throws  NotADatasetException  if the object there is not a dataset
     */
    public Dataset dataset( String path ) throws IOException {
        checkOpen();
        ObjectHeader header = resolver_.resolve( path, ObjectType.DATASET );
        ObjectType type = ObjectType.forHeader( header );
        if ( type != ObjectType.DATASET ) {
            throw new NotADatasetException( path, type.getName() );
        }
        return new Dataset( this, canonicalPath( path ), header );
    }

    /**
     * Returns the group at a given path.
     *
     * @param  path  group path
     * @return  group
     * @throws  GroupNotFoundException  if there is nothing at the path
     * @throws  NotAGroupException  if the object there is not a group
     */
    public Group group( String path ) throws IOException {
        checkOpen();
        ObjectHeader header = resolver_.resolve( path, ObjectType.GROUP );
        ObjectType type = ObjectType.forHeader( header );
        if ( type != ObjectType.GROUP ) {
            throw new NotAGroupException( path, type.getName() );
        }
        return new Group( this, canonicalPath( path ), header );
    }

    /**
     * Returns the names of the children of the group at a given path.
     *
     * @param  path  group path
     * @return  child names in storage order
     */
    public List<String> list( String path ) throws IOException {
        return group( path ).getChildren();
    }

    /**
     * Returns the type of the object at a given path.
     * Paths that cannot be resolved give UNKNOWN.
     *
     * @param  path  object path
     * @return  object type
     * @throws  Hdf5FormatException  if the file structure is corrupt
     */
    public ObjectType getObjectType( String path ) throws IOException {
        checkOpen();
        try {
            return ObjectType.forHeader( resolver_.resolve( path,
                                                            ObjectType
                                                           .UNKNOWN ) );
        }
        catch ( Hdf5FormatException e ) {
            throw e;
        }
        catch ( DataReadException e ) {
            throw e;
        }
        catch ( Hdf5Exception e ) {
            logger_.config( "Cannot resolve " + path + ": "
                          + e.getMessage() );
            return ObjectType.UNKNOWN;
        }
    }

    /**
     * Returns the type of every object reachable from the root group.
     * Groups are descended through hard links only, each group once.
     * Soft link targets are reported but not descended into,
     * and external links are reported as UNKNOWN.
     *
     * @return  ordered map from path to object type, depth first
     */
    public Map<String,ObjectType> listRecursive() throws IOException {
        Map<String,ObjectType> map = new LinkedHashMap<String,ObjectType>();
        Set<Long> seen = new HashSet<Long>();
        seen.add( Long.valueOf( rootHeader_.getAddress() ) );
        addChildren( getRoot(), map, seen );
        return map;
    }

    /**
     * Reads and decodes the whole of the dataset at a given path.
     *
     * @param  path  dataset path
     * @return  elements in row-major order
     */
    public Object[] readDataset( String path ) throws IOException {
        return dataset( path ).readData();
    }

    /**
     * Releases the resources of this file.
     * Subsequent reads will fail.
     */
    public void close() throws IOException {
        if ( ! closed_ ) {
            closed_ = true;
            if ( closer_ != null ) {
                closer_.close();
            }
        }
    }

    /**
     * Reads the object header at a given address.
     *
     * @param  address  header address
     * @return  header
     */
    public ObjectHeader readHeader( long address ) throws IOException {
        return ObjectHeader.readHeader( buf_, address, msgFact_ );
    }

    /**
     * Returns the header of the root group.
     *
     * @return  root header
     */
    ObjectHeader getRootHeader() {
        return rootHeader_;
    }

    /**
     * Returns the datatype described by an object header,
     * following a shared datatype message if necessary.
     *
     * @param  header  object header
     * @return  datatype, or null if the header has none
     */
    Datatype getDatatype( ObjectHeader header ) throws IOException {
        Set<Long> seen = new HashSet<Long>();
        while ( true ) {
            DatatypeMessage dmsg = header.getMessage( DatatypeMessage.class );
            if ( dmsg == null ) {
                return null;
            }
            else if ( dmsg.datatype != null ) {
                return dmsg.datatype;
            }
            else if ( ! seen.add( Long.valueOf( dmsg.sharedAddress ) ) ) {
                throw new Hdf5FormatException( "Shared datatype loop at 0x"
                                             + Long.toHexString(
                                                   dmsg.sharedAddress ) );
            }
            else {
                logger_.config( "Shared datatype at 0x"
                              + Long.toHexString( dmsg.sharedAddress ) );
                header = readHeader( dmsg.sharedAddress );
            }
        }
    }

    /**
     * Throws an exception if this file has been closed.
     */
    void checkOpen() throws IOException {
        if ( closed_ ) {
            throw new IOException( "HDF5 file closed" );
        }
    }

    /**
     * Adds the descendants of a group to a path-type map.
     */
    private void addChildren( Group group, Map<String,ObjectType> map,
                              Set<Long> seen )
            throws IOException {
        String prefix = "/".equals( group.getPath() ) ? "/"
                                                      : group.getPath() + "/";
        for ( Link link : group.getLinks() ) {
            String path = prefix + link.getName();
            switch ( link.getKind() ) {
                case HARD:
                    ObjectHeader header = readHeader( link.getAddress() );
                    ObjectType type = ObjectType.forHeader( header );
                    map.put( path, type );
                    if ( type == ObjectType.GROUP
                         && seen.add( Long.valueOf( header.getAddress() ) ) ) {
                        addChildren( new Group( this, path, header ), map,
                                     seen );
                    }
                    break;
                case SOFT:
                    map.put( path, getObjectType( path ) );
                    break;
                default:
                    map.put( path, ObjectType.UNKNOWN );
            }
        }
    }

    private static String canonicalPath( String path ) {
        return LinkResolver
              .toPath( LinkResolver.normalize( new ArrayList<String>(),
                                               path ) );
    }
}
