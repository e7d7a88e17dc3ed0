package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Buf implementation based on a single NIO ByteBuffer.
 * This works fine as long as it doesn't need to be more than 2^31 bytes (2Gb),
 * which is the maximum length of a ByteBuffer.
 *
 * <p>Reads which would run off the end of the buffer provoke a
 * {@link DataReadException} rather than a runtime exception,
 * since in practice they signal a truncated or corrupt file.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 * @see      java.nio.ByteBuffer
 */
public class SimpleNioBuf implements Buf {

    private final ByteBuffer byteBuf_;
    private int offsetSize_;
    private int lengthSize_;

    /**
     * Constructor.
     *
     * @param  byteBuf  NIO byte buffer containing the byte data
     * @param  offsetSize  number of bytes in a file address
     * @param  lengthSize  number of bytes in an object size
     */
    public SimpleNioBuf( ByteBuffer byteBuf, int offsetSize, int lengthSize ) {

        // Work on a private duplicate so that the byte order and
        // position of the caller's buffer are not disturbed.
        byteBuf_ = byteBuf.duplicate();
        byteBuf_.order( ByteOrder.LITTLE_ENDIAN );
        setOffsetSize( offsetSize );
        setLengthSize( lengthSize );
    }

    public long getLength() {
        return byteBuf_.capacity();
    }

    public int readUnsignedByte( Pointer ptr ) throws IOException {
        return byteBuf_.get( index( ptr, 1 ) ) & 0xff;
    }

    public int readUnsignedShort( Pointer ptr ) throws IOException {
        return byteBuf_.getShort( index( ptr, 2 ) ) & 0xffff;
    }

    public int readInt( Pointer ptr ) throws IOException {
        return byteBuf_.getInt( index( ptr, 4 ) );
    }

    public long readUnsignedInt( Pointer ptr ) throws IOException {
        return byteBuf_.getInt( index( ptr, 4 ) ) & 0xffffffffL;
    }

    public long readLong( Pointer ptr ) throws IOException {
        return byteBuf_.getLong( index( ptr, 8 ) );
    }

    public long readUnsigned( Pointer ptr, int nbyte ) throws IOException {
        switch ( nbyte ) {
            case 1:
                return readUnsignedByte( ptr );
            case 2:
                return readUnsignedShort( ptr );
            case 4:
                return readUnsignedInt( ptr );
            case 8:
                return readLong( ptr );
            default:
                if ( nbyte < 1 || nbyte > 8 ) {
                    throw new IllegalArgumentException( "Bad integer width "
                                                      + nbyte );
                }
                int ioff = index( ptr, nbyte );
                long value = 0;
                for ( int i = nbyte - 1; i >= 0; i-- ) {
                    value = ( value << 8 ) | ( byteBuf_.get( ioff + i ) & 0xff );
                }
                return value;
        }
    }

    public long readOffset( Pointer ptr ) throws IOException {
        long addr = readUnsigned( ptr, offsetSize_ );
        return isAllOnes( addr, offsetSize_ ) ? UNDEFINED_ADDRESS : addr;
    }

    public long readLength( Pointer ptr ) throws IOException {
        return readUnsigned( ptr, lengthSize_ );
    }

    public byte[] readBytes( Pointer ptr, int nbyte ) throws IOException {
        byte[] array = new byte[ nbyte ];
        Bufs.readBytes( byteBuf_, index( ptr, nbyte ), nbyte, array );
        return array;
    }

    public String readAsciiString( Pointer ptr, int nbyte )
            throws IOException {
        return Bufs.readAsciiString( byteBuf_, index( ptr, nbyte ), nbyte );
    }

    public String readNullTerminatedString( Pointer ptr ) throws IOException {
        int start = toInt( ptr.get() );
        int limit = byteBuf_.capacity();
        int end = start;
        while ( end < limit && byteBuf_.get( end ) != 0 ) {
            end++;
        }
        if ( end >= limit ) {
            throw new DataReadException( "Unterminated string at 0x"
                                       + Long.toHexString( start ) );
        }
        byte[] abuf = new byte[ end - start ];
        Bufs.readBytes( byteBuf_, start, abuf.length, abuf );
        ptr.set( end + 1 );
        return Bufs.decodeUtf8( abuf, 0, abuf.length );
    }

    public synchronized void setOffsetSize( int offsetSize ) {
        offsetSize_ = offsetSize;
    }

    public int getOffsetSize() {
        return offsetSize_;
    }

    public synchronized void setLengthSize( int lengthSize ) {
        lengthSize_ = lengthSize;
    }

    public int getLengthSize() {
        return lengthSize_;
    }

    public void readDataBytes( long offset, int count, byte[] array )
            throws IOException {
        checkRange( offset, count );
        Bufs.readBytes( byteBuf_, toInt( offset ), count, array );
    }

    public InputStream createInputStream( long offset, long count )
            throws IOException {
        checkRange( offset, count );
        ByteBuffer strmBuf = byteBuf_.duplicate();
        strmBuf.position( toInt( offset ) );
        strmBuf.limit( toInt( offset + count ) );
        return Bufs.createByteBufferInputStream( strmBuf );
    }

    public Buf subBuf( long offset ) throws IOException {
        checkRange( offset, 0 );
        ByteBuffer sub;
        synchronized ( byteBuf_ ) {
            byteBuf_.position( toInt( offset ) );
            sub = byteBuf_.slice();
            byteBuf_.position( 0 );
        }
        return new SimpleNioBuf( sub, offsetSize_, lengthSize_ );
    }

    /**
     * Returns the buffer index at the pointer position and advances the
     * pointer, checking that the requested bytes are present.
     *
     * @param  ptr  pointer
     * @param  nbyte  number of bytes about to be read
     * @return  index of first byte
     */
    private int index( Pointer ptr, int nbyte ) throws DataReadException {
        long off = ptr.getAndIncrement( nbyte );
        checkRange( off, nbyte );
        return (int) off;
    }

    /**
     * Checks that a byte range lies within this buffer.
     *
     * @param  offset  start of range
     * @param  count   number of bytes in range
     * @throws  DataReadException  if any part of the range is missing
     */
    private void checkRange( long offset, long count )
            throws DataReadException {
        if ( offset < 0 || count < 0 || offset + count > getLength() ) {
            throw new DataReadException( "Read out of range: "
                                       + count + " bytes at 0x"
                                       + Long.toHexString( offset )
                                       + " in " + getLength()
                                       + "-byte buffer" );
        }
    }

    /**
     * Indicates whether the low <code>nbyte</code> bytes of a value
     * are all set.
     *
     * @param  value  value
     * @param  nbyte  width in bytes
     * @return  true iff value is the all-ones pattern for its width
     */
    private static boolean isAllOnes( long value, int nbyte ) {
        return nbyte >= 8 ? value == -1L
                          : value == ( 1L << ( 8 * nbyte ) ) - 1;
    }

    /**
     * Downcasts a long to an int.
     * If the value is too large, an unchecked exception is thrown.
     * That shouldn't happen because the only values this is invoked on
     * are offsets into a ByteBuffer.
     *
     * @param  lvalue  long value
     * @return   integer with the same value as <code>lvalue</code>
     */
    private static int toInt( long lvalue ) {
        int ivalue = (int) lvalue;
        if ( ivalue != lvalue ) {
            throw new IllegalArgumentException( "Pointer out of range: "
                                              + lvalue + " >32 bits" );
        }
        return ivalue;
    }
}
