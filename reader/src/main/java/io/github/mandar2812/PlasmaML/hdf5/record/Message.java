package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Abstract superclass for an object header message.
 * An object header is an ordered sequence of typed messages,
 * each describing one aspect of the object.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public abstract class Message {

    private final MessagePlan plan_;
    private final MessageType type_;
    private static final Logger logger_ =
        Logger.getLogger( Message.class.getName() );

    /**
     * Constructor.
     *
     * @param  plan   basic message information
     * @param  type   message type
     */
    protected Message( MessagePlan plan, MessageType type ) {
        plan_ = plan;
        type_ = type;
    }

    /**
     * Returns the type of this message.
     *
     * @return  message type
     */
    public MessageType getMessageType() {
        return type_;
    }

    /**
     * Returns the type code read from the header.
     *
     * @return  type code
     */
    public int getTypeCode() {
        return plan_.getTypeCode();
    }

    /**
     * Returns the size of the message body in bytes.
     *
     * @return  body size
     */
    public int getMessageSize() {
        return plan_.getMessageSize();
    }

    /**
     * Returns the message flags.
     *
     * @return  flags
     */
    public int getFlags() {
        return plan_.getFlags();
    }

    /**
     * Indicates whether the body of this message is a reference to
     * a message stored elsewhere.
     *
     * @return  true iff the shared flag is set
     */
    public boolean isShared() {
        return hasBit( plan_.getFlags(), 1 );
    }

    /**
     * Returns the buffer containing the message data.
     *
     * @return  buffer
     */
    public Buf getBuf() {
        return plan_.getBuf();
    }

    /**
     * Checks that a pointer has not read past the end of this message.
     * If it has, a warning is emitted.
     *
     * @param   ptr   pointer notionally positioned at end of content
     */
    protected void checkEndMessage( Pointer ptr ) {
        long readCount = plan_.getReadCount( ptr );
        long size = getMessageSize();
        if ( readCount > size ) {
            logger_.warning( type_.getAbbreviation() + " message read "
                           + readCount + " bytes, size only " + size );
        }
    }

    /**
     * Reads an array of unsigned 4-byte integers.
     * Pointer position is moved on appropriately.
     *
     * @param   buf  buffer
     * @param   ptr  pointer
     * @param   count  number of values to read
     * @return  <code>count</code>-element array of values
     */
    public static int[] readIntArray( Buf buf, Pointer ptr, int count )
            throws IOException {
        int[] array = new int[ count ];
        for ( int i = 0; i < count; i++ ) {
            array[ i ] = buf.readInt( ptr );
        }
        return array;
    }

    /**
     * Reads an array of length-sized values.
     * Pointer position is moved on appropriately.
     *
     * @param   buf  buffer
     * @param   ptr  pointer
     * @param   count  number of values to read
     * @return  <code>count</code>-element array of values
     */
    public static long[] readLengthArray( Buf buf, Pointer ptr, int count )
            throws IOException {
        long[] array = new long[ count ];
        for ( int i = 0; i < count; i++ ) {
            array[ i ] = buf.readLength( ptr );
        }
        return array;
    }

    /**
     * Indicates whether a given bit of a flags mask is set.
     *
     * @param  flags  flags mask
     * @param  ibit   bit index; 0 is the least significant
     * @return  true iff bit is set
     */
    public static boolean hasBit( int flags, int ibit ) {
        return ( ( flags >> ibit ) & 1 ) == 1;
    }

    @Override
    public String toString() {
        return type_.getAbbreviation();
    }
}
