package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Field data for a local heap, which holds the link names
 * (and soft link values) of an old-style group.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class LocalHeap {

    public final long address;
    public final long dataSize;
    public final long freeListOffset;
    public final long dataAddress;
    private final Buf buf_;

    private static final String SIGNATURE = "HEAP";
    private static final Logger logger_ =
        Logger.getLogger( LocalHeap.class.getName() );

    /**
     * Constructor.
     *
     * @param  buf  buffer
     * @param  address  heap address
     */
    public LocalHeap( Buf buf, long address ) throws IOException {
        Pointer ptr = new Pointer( address );
        String sig = buf.readAsciiString( ptr, 4 );
        if ( ! SIGNATURE.equals( sig ) ) {
            throw new Hdf5FormatException( "Bad local heap signature \""
                                         + sig + "\" at 0x"
                                         + Long.toHexString( address ) );
        }
        int version = buf.readUnsignedByte( ptr );
        if ( version != 0 ) {
            throw new UnsupportedFeatureException( "local heap version "
                                                 + version, null );
        }
        ptr.skip( 3 );
        this.address = address;
        this.dataSize = buf.readLength( ptr );
        this.freeListOffset = buf.readLength( ptr );
        this.dataAddress = buf.readOffset( ptr );
        buf_ = buf;
        logger_.config( "Local heap at 0x" + Long.toHexString( address )
                      + ": " + dataSize + " bytes at 0x"
                      + Long.toHexString( dataAddress ) );
    }

    /**
     * Reads a null-terminated string from the heap's data segment.
     *
     * @param  offset  offset into data segment
     * @return  string
     */
    public String getString( long offset ) throws IOException {
        if ( offset < 0 || offset >= dataSize ) {
            throw new Hdf5FormatException( "Local heap offset " + offset
                                         + " outside data segment of "
                                         + dataSize + " bytes" );
        }
        return buf_.readNullTerminatedString(
                   new Pointer( dataAddress + offset ) );
    }
}
