package io.github.mandar2812.PlasmaML.hdf5.record;

/**
 * Keeps track of a file offset.
 * This is the seekable cursor position used with a
 * {@link io.github.mandar2812.PlasmaML.hdf5.Buf};
 * since a Buf holds no position state of its own, a single buf can be
 * read through several independent pointers.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public class Pointer {

    private long value_;

    /**
     * Constructor.
     *
     * @param  value  initial value
     */
    public Pointer( long value ) {
        value_ = value;
    }

    /**
     * Returns this pointer's current value.
     *
     * @return  value
     */
    public long get() {
        return value_;
    }

    /**
     * Returns this pointer's current value and increments it by a given step.
     *
     * @param   increment  amount to increase value by
     * @return   pre-increment value
     */
    public long getAndIncrement( int increment ) {
        long v = value_;
        value_ += increment;
        return v;
    }

    /**
     * Sets this pointer's current value.
     *
     * @param   value  new value
     */
    public void set( long value ) {
        value_ = value;
    }

    /**
     * Moves this pointer on by a given number of bytes.
     *
     * @param  nbyte  number of bytes to skip
     */
    public void skip( long nbyte ) {
        value_ += nbyte;
    }

    /**
     * Moves this pointer forward, if necessary, so that its distance
     * from a given origin is a multiple of a given block size.
     *
     * @param  origin  position from which alignment is measured
     * @param  blockSize  alignment boundary in bytes
     */
    public void align( long origin, int blockSize ) {
        long rem = ( value_ - origin ) % blockSize;
        if ( rem != 0 ) {
            value_ += blockSize - rem;
        }
    }
}
