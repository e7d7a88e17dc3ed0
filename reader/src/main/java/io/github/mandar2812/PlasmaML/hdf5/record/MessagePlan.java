package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

/**
 * Records basic information about the position, extent and type of
 * a header message.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public class MessagePlan {

    private final long start_;
    private final int size_;
    private final int typeCode_;
    private final int flags_;
    private final Buf buf_;

    /**
     * Constructor.
     *
     * @param   start   offset into buffer of message body start
     * @param   size    number of bytes in message body
     * @param   typeCode  integer message type field
     * @param   flags   message flags field
     * @param   buf     buffer containing message bytes
     */
    public MessagePlan( long start, int size, int typeCode, int flags,
                        Buf buf ) {
        start_ = start;
        size_ = size;
        typeCode_ = typeCode;
        flags_ = flags;
        buf_ = buf;
    }

    /**
     * Returns the size of the message body in bytes.
     *
     * @return  body size
     */
    public int getMessageSize() {
        return size_;
    }

    /**
     * Returns the type code identifying what kind of message it is.
     *
     * @return   message type code
     */
    public int getTypeCode() {
        return typeCode_;
    }

    /**
     * Returns the message flags.
     *
     * @return  flags byte
     */
    public int getFlags() {
        return flags_;
    }

    /**
     * Returns the buffer containing the message data.
     *
     * @return  buffer
     */
    public Buf getBuf() {
        return buf_;
    }

    /**
     * Returns the buffer offset of the message body.
     *
     * @return  body start
     */
    public long getStart() {
        return start_;
    }

    /**
     * Returns a pointer initially pointing at the first byte of
     * the message body.
     *
     * @return  pointer to message content
     */
    public Pointer createContentPointer() {
        return new Pointer( start_ );
    }

    /**
     * Returns the number of bytes in this message read (or skipped) by the
     * current state of a given pointer.
     *
     * @param   ptr  pointer
     * @return  number of bytes between body start and pointer value
     */
    public long getReadCount( Pointer ptr ) {
        return ptr.get() - start_;
    }
}
