package io.github.mandar2812.PlasmaML.hdf5.record;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.LzfInputStream;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

/**
 * Defines a byte transform that may be applied to HDF5 chunk data
 * at write time, and knows how to reverse it.
 *
 * @author   Mark Taylor
 * @since    19 Jun 2013
 */
public abstract class Filter {

    /** Filter identifier for deflate (zlib) compression. */
    public static final int DEFLATE_ID = 1;

    /** Filter identifier for byte shuffling. */
    public static final int SHUFFLE_ID = 2;

    /** Filter identifier for the Fletcher32 checksum. */
    public static final int FLETCHER32_ID = 3;

    /** Filter identifier for SZIP compression. */
    public static final int SZIP_ID = 4;

    /** Filter identifier for N-bit packing. */
    public static final int NBIT_ID = 5;

    /** Filter identifier for scale-offset packing. */
    public static final int SCALEOFFSET_ID = 6;

    /** Filter identifier registered for LZF compression. */
    public static final int LZF_ID = 32000;

    /** Deflate decompression. */
    public static final Filter DEFLATE = new Filter( DEFLATE_ID, "deflate" ) {
        public byte[] decode( byte[] data, int[] clientData, int elSize,
                              int maxSize )
                throws IOException {
            InputStream in =
                new InflaterInputStream( new ByteArrayInputStream( data ) );
            try {
                return Bufs.readAll( in, data.length * 4, maxSize );
            }
            catch ( DataReadException e ) {
                throw e;
            }
            catch ( ZipException e ) {
                throw new DataReadException( "Bad deflate data", e );
            }
            catch ( EOFException e ) {
                throw new DataReadException( "Truncated deflate data ("
                                           + data.length + " bytes)", e );
            }
            catch ( IOException e ) {
                throw new DataReadException( "Unreadable deflate data", e );
            }
        }
    };

    /** Byte shuffle reversal. */
    public static final Filter SHUFFLE = new Filter( SHUFFLE_ID, "shuffle" ) {
        public byte[] decode( byte[] data, int[] clientData, int elSize,
                              int maxSize ) {
            int size = clientData.length > 0 && clientData[ 0 ] > 0
                     ? clientData[ 0 ]
                     : elSize;
            return unshuffle( data, size );
        }
    };

    /** Fletcher32 checksum verification and removal. */
    public static final Filter FLETCHER32 =
            new Filter( FLETCHER32_ID, "fletcher32" ) {
        public byte[] decode( byte[] data, int[] clientData, int elSize,
                              int maxSize )
                throws IOException {
            int n = data.length - 4;
            if ( n < 0 ) {
                throw new DataReadException( "Chunk too short for "
                                           + "Fletcher32 checksum" );
            }
            long stored = ( data[ n ] & 0xffL )
                        | ( data[ n + 1 ] & 0xffL ) << 8
                        | ( data[ n + 2 ] & 0xffL ) << 16
                        | ( data[ n + 3 ] & 0xffL ) << 24;
            long sum = fletcher32( data, n );

            // Some old library versions stored the checksum with the
            // bytes of each half swapped.
            long swapped = ( ( sum >> 8 ) & 0xff ) << 24
                         | ( sum & 0xff ) << 16
                         | ( ( sum >> 24 ) & 0xff ) << 8
                         | ( ( sum >> 16 ) & 0xff );
            if ( stored != sum && stored != swapped ) {
                throw new DataReadException( "Fletcher32 checksum mismatch: "
                                           + "stored 0x"
                                           + Long.toHexString( stored )
                                           + ", computed 0x"
                                           + Long.toHexString( sum ) );
            }
            byte[] out = new byte[ n ];
            System.arraycopy( data, 0, out, 0, n );
            return out;
        }
    };

    /** LZF decompression. */
    public static final Filter LZF = new Filter( LZF_ID, "lzf" ) {
        public byte[] decode( byte[] data, int[] clientData, int elSize,
                              int maxSize )
                throws IOException {
            return Bufs.readAll( new LzfInputStream(
                                     new ByteArrayInputStream( data ) ),
                                 data.length * 2, maxSize );
        }
    };

    private final int id_;
    private final String name_;

    /**
     * Constructor.
     *
     * @param   id   filter identifier
     * @param   name   filter name
     */
    protected Filter( int id, String name ) {
        id_ = id;
        name_ = name;
    }

    /**
     * Reverses this filter's transform, failing if the output would
     * exceed a given size.
     *
     * @param  data  filtered bytes
     * @param  clientData  filter parameters recorded in the pipeline
     * @param  elSize   size in bytes of a dataset element
     * @param  maxSize  maximum permitted number of unfiltered bytes
     * @return  unfiltered bytes
     * @throws  DataReadException  if the data cannot be unfiltered
     *                             within <code>maxSize</code> bytes
     */
    public abstract byte[] decode( byte[] data, int[] clientData, int elSize,
                                   int maxSize )
            throws IOException;

    /**
     * Reverses this filter's transform with no limit on the output size.
     *
     * @param  data  filtered bytes
     * @param  clientData  filter parameters recorded in the pipeline
     * @param  elSize   size in bytes of a dataset element
     * @return  unfiltered bytes
     */
    public byte[] decode( byte[] data, int[] clientData, int elSize )
            throws IOException {
        return decode( data, clientData, elSize, Integer.MAX_VALUE );
    }

    /**
     * Returns this filter's identifier.
     *
     * @return  id
     */
    public int getId() {
        return id_;
    }

    /**
     * Returns this filter's name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    @Override
    public String toString() {
        return name_;
    }

    /**
     * Returns a Filter object corresponding to a given filter identifier.
     *
     * @param  id  filter identifier from a filter pipeline message
     * @return  filter object
     * @throws  UnsupportedFeatureException  if the filter is not built in
     */
    public static Filter getFilter( int id )
            throws UnsupportedFeatureException {
        switch ( id ) {
            case DEFLATE_ID: return DEFLATE;
            case SHUFFLE_ID: return SHUFFLE;
            case FLETCHER32_ID: return FLETCHER32;
            case LZF_ID: return LZF;
            default:
                throw new UnsupportedFeatureException( "filter "
                                                     + getFilterName( id ),
                                                       "id " + id );
        }
    }

    /**
     * Returns a conventional name for a filter identifier,
     * whether or not it is supported.
     *
     * @param  id  filter identifier
     * @return  name
     */
    public static String getFilterName( int id ) {
        switch ( id ) {
            case DEFLATE_ID: return "deflate";
            case SHUFFLE_ID: return "shuffle";
            case FLETCHER32_ID: return "fletcher32";
            case SZIP_ID: return "szip";
            case NBIT_ID: return "nbit";
            case SCALEOFFSET_ID: return "scaleoffset";
            case LZF_ID: return "lzf";
            default: return "filter" + id;
        }
    }

    /**
     * Reverses the shuffle transform.
     * A shuffled buffer holds the first byte of every element, then the
     * second byte of every element, and so on.  Trailing bytes which do
     * not make up a whole element are left in place.
     *
     * @param  data  shuffled bytes
     * @param  elSize  element size in bytes
     * @return  unshuffled bytes
     */
    public static byte[] unshuffle( byte[] data, int elSize ) {
        if ( elSize <= 1 ) {
            return data;
        }
        int nel = data.length / elSize;
        byte[] out = new byte[ data.length ];
        for ( int j = 0; j < elSize; j++ ) {
            int plane = j * nel;
            for ( int i = 0; i < nel; i++ ) {
                out[ i * elSize + j ] = data[ plane + i ];
            }
        }
        int done = nel * elSize;
        System.arraycopy( data, done, out, done, data.length - done );
        return out;
    }

    /**
     * Calculates the Fletcher32 checksum in the form used by HDF5,
     * which takes big-endian 16-bit words.
     *
     * @param  data  byte array
     * @param  leng  number of bytes from the start of data to include
     * @return  checksum as an unsigned 32-bit value
     */
    public static long fletcher32( byte[] data, int leng ) {
        long sum1 = 0;
        long sum2 = 0;
        int nword = leng / 2;
        int ip = 0;
        while ( nword > 0 ) {
            int tlen = Math.min( nword, 360 );
            nword -= tlen;
            for ( int i = 0; i < tlen; i++ ) {
                sum1 += ( ( data[ ip ] & 0xff ) << 8 ) | ( data[ ip + 1 ] & 0xff );
                ip += 2;
                sum2 += sum1;
            }
            sum1 = ( sum1 & 0xffff ) + ( sum1 >> 16 );
            sum2 = ( sum2 & 0xffff ) + ( sum2 >> 16 );
        }
        if ( leng % 2 != 0 ) {
            sum1 += ( data[ ip ] & 0xff ) << 8;
            sum2 += sum1;
            sum1 = ( sum1 & 0xffff ) + ( sum1 >> 16 );
            sum2 = ( sum2 & 0xffff ) + ( sum2 >> 16 );
        }
        sum1 = ( sum1 & 0xffff ) + ( sum1 >> 16 );
        sum2 = ( sum2 & 0xffff ) + ( sum2 >> 16 );
        return ( sum2 << 16 ) | sum1;
    }
}
