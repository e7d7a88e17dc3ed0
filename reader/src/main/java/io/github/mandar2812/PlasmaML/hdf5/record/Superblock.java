package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Field data for the HDF5 superblock, which starts the file proper
 * and gives the address widths and the location of the root group.
 *
 * <p>The superblock may be preceded by a user block, so it is looked for
 * at offset 0 and then at 512, 1024, 2048, ... bytes.
 *
 * @author   Mark Taylor
 * @since    19 Jun 2013
 */
public class Superblock {

    public final long superblockOffset;
    public final int version;
    public final int offsetSize;
    public final int lengthSize;
    public final int flags;
    public final int groupLeafK;
    public final int groupInternalK;
    public final long baseAddress;
    public final long extensionAddress;
    public final long eofAddress;
    public final long rootHeaderAddress;

    /** Eight-byte format signature. */
    public static final byte[] SIGNATURE = new byte[] {
        (byte) 0x89, 'H', 'D', 'F', '\r', '\n', 0x1a, '\n',
    };

    private static final Logger logger_ =
        Logger.getLogger( Superblock.class.getName() );

    /**
     * Constructor.  The offset and length sizes of the buffer are set
     * as a side effect.
     *
     * @param  buf  buffer containing the whole file
     * @param  superblockOffset  position of the signature in buf
     */
    public Superblock( Buf buf, long superblockOffset ) throws IOException {
        this.superblockOffset = superblockOffset;
        Pointer ptr = new Pointer( superblockOffset + SIGNATURE.length );
        this.version = buf.readUnsignedByte( ptr );
        if ( version == 0 || version == 1 ) {
            ptr.skip( 3 );  // freespace, root symbol table, reserved versions
            ptr.skip( 1 );  // shared header message format version
            this.offsetSize = checkSize( buf.readUnsignedByte( ptr ),
                                         "offset" );
            this.lengthSize = checkSize( buf.readUnsignedByte( ptr ),
                                         "length" );
            ptr.skip( 1 );
            this.groupLeafK = buf.readUnsignedShort( ptr );
            this.groupInternalK = buf.readUnsignedShort( ptr );
            this.flags = buf.readInt( ptr );
            if ( version == 1 ) {
                ptr.skip( 4 );  // indexed storage K, reserved
            }
            buf.setOffsetSize( offsetSize );
            buf.setLengthSize( lengthSize );
            this.baseAddress = buf.readOffset( ptr );
            this.extensionAddress = buf.readOffset( ptr );  // free space
            this.eofAddress = buf.readOffset( ptr );
            buf.readOffset( ptr );  // driver information block

            // Root group symbol table entry.
            buf.readOffset( ptr );  // link name offset
            this.rootHeaderAddress = buf.readOffset( ptr );
        }
        else if ( version == 2 || version == 3 ) {
            this.offsetSize = checkSize( buf.readUnsignedByte( ptr ),
                                         "offset" );
            this.lengthSize = checkSize( buf.readUnsignedByte( ptr ),
                                         "length" );
            this.flags = buf.readUnsignedByte( ptr );
            this.groupLeafK = 0;
            this.groupInternalK = 0;
            buf.setOffsetSize( offsetSize );
            buf.setLengthSize( lengthSize );
            this.baseAddress = buf.readOffset( ptr );
            this.extensionAddress = buf.readOffset( ptr );
            this.eofAddress = buf.readOffset( ptr );
            this.rootHeaderAddress = buf.readOffset( ptr );
        }
        else {
            throw new UnsupportedFeatureException( "superblock version "
                                                 + version, null );
        }
        if ( rootHeaderAddress == Buf.UNDEFINED_ADDRESS ) {
            throw new Hdf5FormatException( "No root group address "
                                         + "in superblock" );
        }
        logger_.config( new StringBuffer()
                       .append( "Superblock v" )
                       .append( version )
                       .append( " at 0x" )
                       .append( Long.toHexString( superblockOffset ) )
                       .append( ", offsets " )
                       .append( offsetSize )
                       .append( ", lengths " )
                       .append( lengthSize )
                       .append( ", root 0x" )
                       .append( Long.toHexString( rootHeaderAddress ) )
                       .toString() );
    }

    /**
     * Returns the position of the format signature in a buffer.
     *
     * @param  buf  buffer containing file
     * @return  signature offset, or -1 if none is found
     */
    public static long locate( Buf buf ) throws IOException {
        long leng = buf.getLength();
        for ( long off = 0; off + SIGNATURE.length <= leng;
              off = off == 0 ? 512 : off * 2 ) {
            if ( isSignature( buf.readBytes( new Pointer( off ),
                                             SIGNATURE.length ) ) ) {
                return off;
            }
        }
        return -1;
    }

    /**
     * Examines a byte array to see if it starts with the HDF5 signature.
     *
     * @param  intro  byte array, at least 8 bytes if available
     * @return  true iff the first 8 bytes are the signature
     */
    public static boolean isSignature( byte[] intro ) {
        if ( intro.length < SIGNATURE.length ) {
            return false;
        }
        for ( int i = 0; i < SIGNATURE.length; i++ ) {
            if ( intro[ i ] != SIGNATURE[ i ] ) {
                return false;
            }
        }
        return true;
    }

    private static int checkSize( int size, String txt )
            throws Hdf5FormatException {
        if ( size == 2 || size == 4 || size == 8 ) {
            return size;
        }
        else {
            throw new Hdf5FormatException( "Bad " + txt + " size " + size
                                         + " in superblock" );
        }
    }
}
