package io.github.mandar2812.PlasmaML.hdf5;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decompression stream for the LZF format, as used by the LZF filter
 * that h5py and PyTables register for HDF5 chunk compression.
 *
 * <p>The compressed stream is a sequence of instructions, each starting
 * with a control byte <code>ctrl</code>:
 * <ul>
 * <li>ctrl &lt; 32: a literal run; the next ctrl+1 bytes are copied
 *     to the output</li>
 * <li>otherwise: a back reference.
 *     The length field is ctrl&gt;&gt;5, extended by the following byte
 *     if it is 7; the distance back from the current output position is
 *     ((ctrl&amp;0x1f)&lt;&lt;8) plus the next byte plus one.
 *     length+2 bytes are copied from that position,
 *     one at a time so that overlapping copies repeat a pattern</li>
 * </ul>
 * This format was deduced from reading the lzf_d.c source file from the
 * liblzf distribution.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class LzfInputStream extends InputStream {

    private final InputStream base_;
    private byte[] out_;
    private int outLeng_;
    private int readPos_;

    /** Largest distance a back reference can reach. */
    private static final int MAX_DISTANCE = ( 0x1f << 8 ) + 0xff + 1;

    /**
     * Constructor.
     *
     * @param  base   input stream containing LZF-compressed data
     */
    public LzfInputStream( InputStream base ) {
        base_ = base;
        out_ = new byte[ 4 * MAX_DISTANCE ];
    }

    @Override
    public int read() throws IOException {
        if ( readPos_ >= outLeng_ && ! decodeNext() ) {
            return -1;
        }
        return out_[ readPos_++ ] & 0xff;
    }

    @Override
    public int read( byte[] b, int off, int len ) throws IOException {
        if ( len == 0 ) {
            return 0;
        }
        if ( readPos_ >= outLeng_ && ! decodeNext() ) {
            return -1;
        }
        int n = Math.min( len, outLeng_ - readPos_ );
        System.arraycopy( out_, readPos_, b, off, n );
        readPos_ += n;
        return n;
    }

    @Override
    public int available() {
        return outLeng_ - readPos_;
    }

    @Override
    public void close() throws IOException {
        base_.close();
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /**
     * Decodes the next instruction from the base stream into the
     * output buffer.
     *
     * @return  false if the base stream is exhausted
     */
    private boolean decodeNext() throws IOException {
        int ctrl = base_.read();
        if ( ctrl < 0 ) {
            return false;
        }
        if ( ctrl < 32 ) {
            int n = ctrl + 1;
            makeRoom( n );
            for ( int i = 0; i < n; i++ ) {
                out_[ outLeng_++ ] = (byte) readBaseByte();
            }
        }
        else {
            int len = ctrl >> 5;
            int ref = outLeng_ - ( ( ctrl & 0x1f ) << 8 ) - 1;
            if ( len == 7 ) {
                len += readBaseByte();
            }
            ref -= readBaseByte();
            len += 2;
            if ( ref < 0 ) {
                throw new DataReadException( "LZF back reference before "
                                           + "start of data" );
            }
            int shift = makeRoom( len );
            ref -= shift;
            for ( int i = 0; i < len; i++ ) {
                out_[ outLeng_++ ] = out_[ ref++ ];
            }
        }
        return true;
    }

    /**
     * Reads a byte from the base stream, failing at end of stream.
     *
     * @return  byte value 0..255
     */
    private int readBaseByte() throws IOException {
        int b = base_.read();
        if ( b < 0 ) {
            throw new DataReadException( "Truncated LZF data" );
        }
        return b;
    }

    /**
     * Ensures there is space in the output buffer for a given number of
     * further bytes.  Bytes which have been read and are too far back
     * to be referenced again are discarded.
     *
     * @param  n  number of bytes about to be appended
     * @return  number of bytes by which existing content was shifted down
     */
    private int makeRoom( int n ) {
        if ( outLeng_ + n <= out_.length ) {
            return 0;
        }
        int keepFrom = Math.max( 0, Math.min( readPos_,
                                              outLeng_ - MAX_DISTANCE ) );
        int keep = outLeng_ - keepFrom;
        byte[] dest = keep + n <= out_.length
                    ? out_
                    : new byte[ Math.max( 2 * out_.length, keep + n ) ];
        System.arraycopy( out_, keepFrom, dest, 0, keep );
        out_ = dest;
        outLeng_ = keep;
        readPos_ -= keepFrom;
        return keepFrom;
    }
}
