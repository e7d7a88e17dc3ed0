package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A global heap collection, which holds the bodies of variable-length
 * data elements such as variable-length strings.
 * Each object in the collection is identified by a small integer index.
 *
 * @author   Mark Taylor
 * @since    14 Feb 2024
 */
public class GlobalHeap {

    private final long address_;
    private final Map<Integer,byte[]> objects_;

    private static final String SIGNATURE = "GCOL";
    private static final Logger logger_ =
        Logger.getLogger( GlobalHeap.class.getName() );

    /**
     * Constructor.
     *
     * @param  address  address of collection
     * @param  objects  map from object index to object content
     */
    private GlobalHeap( long address, Map<Integer,byte[]> objects ) {
        address_ = address;
        objects_ = objects;
    }

    /**
     * Returns the address of this collection.
     *
     * @return  collection address
     */
    public long getAddress() {
        return address_;
    }

    /**
     * Returns the number of objects in this collection.
     *
     * @return  object count
     */
    public int getObjectCount() {
        return objects_.size();
    }

    /**
     * Returns the content of an object in this collection.
     *
     * @param  index  heap object index
     * @return  object bytes
     * @throws  DataReadException  if there is no such object
     */
    public byte[] getObject( int index ) throws DataReadException {
        byte[] obj = objects_.get( Integer.valueOf( index ) );
        if ( obj == null ) {
            throw new DataReadException( "No object " + index
                                       + " in global heap at 0x"
                                       + Long.toHexString( address_ ) );
        }
        return obj;
    }

    /**
     * Reads a global heap collection from a buffer.
     *
     * @param  buf  buffer
     * @param  address  collection address
     * @return  heap collection
     */
    public static GlobalHeap readHeap( Buf buf, long address )
            throws IOException {
        Pointer ptr = new Pointer( address );
        String sig = buf.readAsciiString( ptr, 4 );
        if ( ! SIGNATURE.equals( sig ) ) {
            throw new Hdf5FormatException( "Bad global heap signature \""
                                         + sig + "\" at 0x"
                                         + Long.toHexString( address ) );
        }
        int version = buf.readUnsignedByte( ptr );
        if ( version != 1 ) {
            throw new UnsupportedFeatureException( "global heap version "
                                                 + version, null );
        }
        ptr.skip( 3 );
        long collSize = buf.readLength( ptr );
        long end = address + collSize;
        int objHeadSize = 8 + buf.getLengthSize();
        Map<Integer,byte[]> objects = new HashMap<Integer,byte[]>();
        while ( ptr.get() + objHeadSize <= end ) {
            int index = buf.readUnsignedShort( ptr );
            ptr.skip( 2 + 4 );  // reference count, reserved
            long objSize = buf.readLength( ptr );

            // Index 0 marks the free space at the end of the collection.
            if ( index == 0 ) {
                break;
            }
            if ( ptr.get() + objSize > end ) {
                throw new Hdf5FormatException( "Global heap object " + index
                                             + " overruns collection" );
            }
            long dataStart = ptr.get();
            objects.put( Integer.valueOf( index ),
                         buf.readBytes( ptr, (int) objSize ) );
            ptr.align( dataStart, 8 );
        }
        logger_.config( "Global heap at 0x" + Long.toHexString( address )
                      + ": " + objects.size() + " objects" );
        return new GlobalHeap( address, objects );
    }
}
