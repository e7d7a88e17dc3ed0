package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Factory and utility methods for use with Bufs.
 *
 * @author   Mark Taylor
 * @since    21 Jun 2013
 */
public class Bufs {

    /** Address and length width assumed before the superblock is read. */
    public static final int DEFAULT_SIZE = 8;

    private static final Logger logger_ =
        Logger.getLogger( Bufs.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private Bufs() {
    }

    /**
     * Creates a buf based on a single NIO buffer.
     *
     * @param   byteBuffer  NIO buffer containing data
     * @return  new buf with default address and length widths
     */
    public static Buf createBuf( ByteBuffer byteBuffer ) {
        return new SimpleNioBuf( byteBuffer, DEFAULT_SIZE, DEFAULT_SIZE );
    }

    /**
     * Creates a buf based on a byte array.
     * The array is not copied.
     *
     * @param   bytes  byte content
     * @return  new buf with default address and length widths
     */
    public static Buf createBuf( byte[] bytes ) {
        return createBuf( ByteBuffer.wrap( bytes ) );
    }

    /**
     * Creates a buf by mapping the content of an open file channel.
     * The channel may be closed once it is no longer required;
     * the mapping itself is released when it is garbage collected.
     *
     * @param  channel  channel open for reading
     * @param  file   file, used for reporting
     * @return  new buf with default address and length widths
     */
    public static Buf createBuf( FileChannel channel, File file )
            throws IOException {
        long leng = channel.size();
        if ( leng > Integer.MAX_VALUE ) {
            throw new UnsupportedFeatureException( "files larger than 2Gb",
                                                   file + " is " + leng
                                                 + " bytes" );
        }
        logger_.config( "Mapping " + leng + " bytes of " + file );
        ByteBuffer bbuf =
            channel.map( FileChannel.MapMode.READ_ONLY, 0, (int) leng );
        return createBuf( bbuf );
    }

    /**
     * Reads the whole content of an input stream into a byte array,
     * and closes the stream.
     *
     * @param  in  input stream
     * @param  sizeHint  expected number of bytes, used for the
     *                   initial allocation only
     * @return  stream content
     */
    public static byte[] readAll( InputStream in, int sizeHint )
            throws IOException {
        return readAll( in, sizeHint, Integer.MAX_VALUE );
    }

    /**
     * Reads the whole content of an input stream into a byte array,
     * failing as soon as it exceeds a given size, and closes the stream.
     *
     * @param  in  input stream
     * @param  sizeHint  expected number of bytes, used for the
     *                   initial allocation only
     * @param  maxSize  maximum permitted number of bytes
     * @return  stream content
     * @throws  DataReadException  if the stream holds more than
     *                             <code>maxSize</code> bytes
     */
    public static byte[] readAll( InputStream in, int sizeHint, int maxSize )
            throws IOException {
        ByteArrayOutputStream out =
            new ByteArrayOutputStream( Math.max( Math.min( sizeHint,
                                                           maxSize ), 32 ) );
        byte[] block = new byte[ 8192 ];
        try {
            for ( int nr; ( nr = in.read( block ) ) >= 0; ) {
                if ( nr > maxSize - out.size() ) {
                    throw new DataReadException( "Decoded data exceeds "
                                               + maxSize + " bytes" );
                }
                out.write( block, 0, nr );
            }
        }
        finally {
            in.close();
        }
        return out.toByteArray();
    }

    /**
     * Utility method to acquire the data from an NIO buffer in the form
     * of an InputStream.
     *
     * @param   bbuf  NIO buffer
     * @return  stream
     */
    public static InputStream createByteBufferInputStream( ByteBuffer bbuf ) {
        return new ByteBufferInputStream( bbuf );
    }

    /**
     * Decodes UTF-8 bytes as a string.
     * Malformed input is replaced rather than rejected.
     *
     * @param  bytes  byte array
     * @param  off   start of string in array
     * @param  leng  number of bytes
     * @return  string
     */
    public static String decodeUtf8( byte[] bytes, int off, int leng ) {
        return new String( bytes, off, leng, StandardCharsets.UTF_8 );
    }

    /**
     * Utility method to read a fixed length ASCII string from an NIO buffer.
     * If a character 0x00 is encountered before the end of the byte sequence,
     * it is considered to terminate the string.
     *
     * @param  bbuf  NIO buffer
     * @param  ioff  offset into buffer of start of string
     * @param  nbyte  number of bytes in string
     */
    static String readAsciiString( ByteBuffer bbuf, int ioff, int nbyte ) {
        byte[] abuf = new byte[ nbyte ];
        readBytes( bbuf, ioff, nbyte, abuf );
        StringBuffer sbuf = new StringBuffer( nbyte );
        for ( int i = 0; i < nbyte; i++ ) {
            byte b = abuf[ i ];
            if ( b == 0 ) {
                break;
            }
            else {
                sbuf.append( (char) ( b & 0xff ) );
            }
        }
        return sbuf.toString();
    }

    /**
     * Utility method to read an array of byte values from an NIO buffer
     * into an array.
     * NIO buffers only provide relative bulk reads, so the buffer is
     * repositioned under synchronization.
     *
     * @param  bbuf  buffer
     * @param  ioff  offset into bbuf of data start
     * @param  count  number of values to read
     * @param  a    array into which values will be read, starting at element 0
     */
    static void readBytes( ByteBuffer bbuf, int ioff, int count, byte[] a ) {
        if ( count == 1 ) {
            a[ 0 ] = bbuf.get( ioff );
        }
        else if ( count > 1 ) {
            synchronized ( bbuf ) {
                bbuf.position( ioff );
                bbuf.get( a, 0, count );
            }
        }
    }

    /**
     * Input stream that reads from an NIO buffer.
     * You'd think there was an implementation of this in the J2SE somewhere,
     * but I can't see one.
     */
    private static class ByteBufferInputStream extends InputStream {
        private final ByteBuffer bbuf_;

        /**
         * Constructor.
         *
         * @param  bbuf  NIO buffer supplying data
         */
        ByteBufferInputStream( ByteBuffer bbuf ) {
            bbuf_ = bbuf;
        }

        @Override
        public int read() {
            return bbuf_.remaining() > 0 ? bbuf_.get() & 0xff : -1;
        }

        @Override
        public int read( byte[] b, int off, int len ) {
            if ( len == 0 ) {
                return 0;
            }
            int remain = bbuf_.remaining();
            if ( remain == 0 ) {
                return -1;
            }
            else {
                int nr = Math.min( remain, len );
                bbuf_.get( b, off, nr );
                return nr;
            }
        }

        @Override
        public long skip( long n ) {
            int nsk = (int) Math.max( 0, Math.min( n, bbuf_.remaining() ) );
            bbuf_.position( bbuf_.position() + nsk );
            return nsk;
        }

        @Override
        public int available() {
            return bbuf_.remaining();
        }
    }
}
