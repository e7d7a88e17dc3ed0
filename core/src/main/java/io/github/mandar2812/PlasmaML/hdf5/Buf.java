package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.Pointer;

import java.io.IOException;
import java.io.InputStream;

/**
 * Represents a sequence of bytes along with operations to read
 * primitive values from it.
 * This interface abstracts away implementation details such as storage
 * mechanism and the widths of file addresses and lengths.
 *
 * <p>All structural fields in an HDF5 file are little-endian, so the
 * multi-byte <code>read*</code> methods here are little-endian too.
 * The number of bytes used for addresses ("offsets") and for object
 * sizes ("lengths") is declared per file in the superblock, and must
 * be configured using {@link #setOffsetSize} and {@link #setLengthSize}
 * before the corresponding read methods are used.
 *
 * <p>All of the <code>read*</code> methods are safe for use from multiple
 * threads concurrently, as long as each thread uses its own
 * {@link Pointer}.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public interface Buf {

    /**
     * Address value returned by {@link #readOffset readOffset}
     * when the stored address has all bits set,
     * which the format uses to mean "undefined".
     */
    public static final long UNDEFINED_ADDRESS = -1L;

    /**
     * Returns the extent of this buf in bytes.
     *
     * @return  buffer length
     */
    long getLength();

    /**
     * Reads a single byte from the pointer position,
     * returning a value in the range 0..255.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr   pointer
     * @return   byte value
     */
    int readUnsignedByte( Pointer ptr ) throws IOException;

    /**
     * Reads an unsigned little-endian 2-byte integer from the
     * pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  value in the range 0..65535
     */
    int readUnsignedShort( Pointer ptr ) throws IOException;

    /**
     * Reads a signed little-endian 4-byte integer from the pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  integer value
     */
    int readInt( Pointer ptr ) throws IOException;

    /**
     * Reads an unsigned little-endian 4-byte integer from the
     * pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  value in the range 0..2^32-1
     */
    long readUnsignedInt( Pointer ptr ) throws IOException;

    /**
     * Reads a little-endian 8-byte integer from the pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  long value
     */
    long readLong( Pointer ptr ) throws IOException;

    /**
     * Reads an unsigned little-endian integer of a given width
     * from the pointer position.
     * Widths of 8 bytes may yield negative values for large inputs.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @param  nbyte  number of bytes, in the range 1..8
     * @return  value
     */
    long readUnsigned( Pointer ptr, int nbyte ) throws IOException;

    /**
     * Reads a file address from the pointer position.
     * This occupies the number of bytes given by {@link #getOffsetSize}.
     * An address with all bits set is returned as
     * {@link #UNDEFINED_ADDRESS}.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  address, or UNDEFINED_ADDRESS
     */
    long readOffset( Pointer ptr ) throws IOException;

    /**
     * Reads an object size from the pointer position.
     * This occupies the number of bytes given by {@link #getLengthSize}.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  length value
     */
    long readLength( Pointer ptr ) throws IOException;

    /**
     * Reads a fixed number of bytes from the pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @param  nbyte  number of bytes to read
     * @return  new array of length <code>nbyte</code>
     */
    byte[] readBytes( Pointer ptr, int nbyte ) throws IOException;

    /**
     * Reads a fixed number of bytes interpreting them as ASCII characters
     * and returns the result as a string.
     * If a character 0x00 appears before <code>nbyte</code> bytes have
     * been read, it is taken as the end of the string.
     * Pointer position is moved on appropriately.
     *
     * @param   ptr    pointer
     * @param  nbyte   maximum number of bytes in string
     * @return  ASCII string
     */
    String readAsciiString( Pointer ptr, int nbyte ) throws IOException;

    /**
     * Reads bytes up to and including the next 0x00 byte,
     * and returns the preceding bytes decoded as UTF-8.
     * Pointer position is moved on to just after the terminator.
     *
     * @param  ptr  pointer
     * @return  string without its terminator
     */
    String readNullTerminatedString( Pointer ptr ) throws IOException;

    /**
     * Sets the number of bytes used for file addresses.
     *
     * @param  offsetSize  2, 4 or 8
     */
    void setOffsetSize( int offsetSize );

    /**
     * Returns the number of bytes used for file addresses.
     *
     * @return  address width in bytes
     */
    int getOffsetSize();

    /**
     * Sets the number of bytes used for object sizes.
     *
     * @param  lengthSize  2, 4 or 8
     */
    void setLengthSize( int lengthSize );

    /**
     * Returns the number of bytes used for object sizes.
     *
     * @return  length width in bytes
     */
    int getLengthSize();

    /**
     * Reads a sequence of byte values from this buf into an array.
     *
     * @param  offset  position sequence start in this buffer in bytes
     * @param  count   number of byte values to read
     * @param  array   array to receive values, starting at array element 0
     */
    void readDataBytes( long offset, int count, byte[] array )
            throws IOException;

    /**
     * Returns an input stream consisting of <code>count</code> bytes
     * of this buf starting from the given offset.
     *
     * @param  offset  position of first byte in buf that will appear in
     *                 the returned stream
     * @param  count   number of bytes available from the stream
     * @return  input stream
     */
    InputStream createInputStream( long offset, long count )
            throws IOException;

    /**
     * Returns a buf that views the bytes of this one starting at
     * a given offset, so that offset 0 in the result corresponds to
     * <code>offset</code> in this buf.
     * The result has the same address and length widths as this one.
     *
     * @param  offset  start of the new view
     * @return  new buf sharing this one's content
     */
    Buf subBuf( long offset ) throws IOException;
}
