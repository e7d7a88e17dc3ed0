package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.DataReadException;

/**
 * Places decoded chunk buffers into the byte array for a selection of
 * an N-dimensional dataset.
 *
 * <p>Chunk <em>c</em> covers dataset indices from
 * <code>c[i]*chunkShape[i]</code> in each dimension <em>i</em>.
 * Elements are row-major both in the chunk and in the output.
 * Chunks at the upper edge of the dataset may overhang its shape;
 * the overhanging elements are dropped.
 * Output elements not covered by any placed chunk keep the fill value.
 *
 * @author   Mark Taylor
 * @since    20 Feb 2024
 */
public class ChunkAssembler {

    private final long[] shape_;
    private final int[] chunkShape_;
    private final int elSize_;
    private final Hyperslab slab_;
    private final int chunkBytes_;
    private final long[] chunkStrides_;
    private final long[] outStrides_;
    private final byte[] output_;

    /**
     * Constructor.
     *
     * @param  shape   dataset shape
     * @param  chunkShape   chunk shape, same rank as dataset
     * @param  elSize   element size in bytes
     * @param  slab    selection to assemble
     * @param  fillValue  element bytes for positions without data,
     *                    or null for zeros
     */
    public ChunkAssembler( long[] shape, int[] chunkShape, int elSize,
                           Hyperslab slab, byte[] fillValue )
            throws DataReadException {
        int rank = shape.length;
        if ( chunkShape.length != rank || slab.getRank() != rank ) {
            throw new DataReadException( "Chunk rank " + chunkShape.length
                                       + " does not match dataset rank "
                                       + rank );
        }
        shape_ = shape;
        chunkShape_ = chunkShape;
        elSize_ = elSize;
        slab_ = slab;
        long nChunkEl = 1;
        chunkStrides_ = new long[ rank ];
        for ( int i = rank - 1; i >= 0; i-- ) {
            if ( chunkShape[ i ] <= 0 ) {
                throw new DataReadException( "Bad chunk dimension "
                                           + chunkShape[ i ] );
            }
            chunkStrides_[ i ] = nChunkEl;
            nChunkEl *= chunkShape[ i ];
        }
        long[] counts = slab.getCounts();
        outStrides_ = new long[ rank ];
        long nOutEl = 1;
        for ( int i = rank - 1; i >= 0; i-- ) {
            outStrides_[ i ] = nOutEl;
            nOutEl *= counts[ i ];
        }
        long chunkBytes = nChunkEl * elSize;
        long outBytes = nOutEl * elSize;
        if ( chunkBytes > Integer.MAX_VALUE || outBytes > Integer.MAX_VALUE ) {
            throw new DataReadException( "Selection too large: " + outBytes
                                       + " bytes" );
        }
        chunkBytes_ = (int) chunkBytes;
        output_ = new byte[ (int) outBytes ];
        if ( fillValue != null && ! isZero( fillValue ) ) {
            for ( int off = 0; off < output_.length; off += elSize ) {
                System.arraycopy( fillValue, 0, output_, off, elSize );
            }
        }
    }

    /**
     * Returns the number of bytes in a decoded chunk.
     *
     * @return  chunk size in bytes
     */
    public int getChunkByteCount() {
        return chunkBytes_;
    }

    /**
     * Returns the number of chunks along each dimension needed to
     * cover the dataset shape.
     *
     * @return  chunk grid extents
     */
    public long[] getChunkGridShape() {
        long[] grid = new long[ shape_.length ];
        for ( int i = 0; i < shape_.length; i++ ) {
            grid[ i ] = ( shape_[ i ] + chunkShape_[ i ] - 1 ) / chunkShape_[ i ];
        }
        return grid;
    }

    /**
     * Indicates whether a chunk contributes any element to the selection.
     *
     * @param  chunkCoord  chunk indices
     * @return  true iff the chunk overlaps the selection
     */
    public boolean isSelected( long[] chunkCoord ) {
        for ( int i = 0; i < shape_.length; i++ ) {
            if ( selectLocals( i, chunkCoord[ i ] ).length == 0 ) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies the selected elements of one decoded chunk into the output.
     *
     * @param  chunkCoord  chunk indices
     * @param  chunkData   decoded chunk bytes
     */
    public void placeChunk( long[] chunkCoord, byte[] chunkData )
            throws DataReadException {
        if ( chunkData.length < chunkBytes_ ) {
            throw new DataReadException( "Chunk has " + chunkData.length
                                       + " bytes, expected " + chunkBytes_ );
        }
        int rank = shape_.length;
        if ( rank == 0 ) {
            System.arraycopy( chunkData, 0, output_, 0, elSize_ );
            return;
        }
        int[][] locals = new int[ rank ][];
        for ( int i = 0; i < rank; i++ ) {
            locals[ i ] = selectLocals( i, chunkCoord[ i ] );
            if ( locals[ i ].length == 0 ) {
                return;
            }
        }

        // With unit stride in the last dimension, selected elements
        // along it are contiguous in both chunk and output.
        int last = rank - 1;
        boolean runs = slab_.getStep( last ) == 1;
        int ndimIter = runs ? last : rank;
        int runBytes = runs ? locals[ last ].length * elSize_ : elSize_;
        int[] k = new int[ ndimIter ];
        while ( true ) {
            long cIdx = 0;
            long oIdx = 0;
            for ( int i = 0; i < ndimIter; i++ ) {
                int local = locals[ i ][ k[ i ] ];
                cIdx += local * chunkStrides_[ i ];
                oIdx += outIndex( i, chunkCoord[ i ], local ) * outStrides_[ i ];
            }
            if ( runs ) {
                int local = locals[ last ][ 0 ];
                cIdx += local;
                oIdx += outIndex( last, chunkCoord[ last ], local );
            }
            System.arraycopy( chunkData, (int) ( cIdx * elSize_ ),
                              output_, (int) ( oIdx * elSize_ ), runBytes );
            int d = ndimIter - 1;
            while ( d >= 0 ) {
                if ( ++k[ d ] < locals[ d ].length ) {
                    break;
                }
                k[ d ] = 0;
                d--;
            }
            if ( d < 0 ) {
                break;
            }
        }
    }

    /**
     * Returns the assembled bytes.
     *
     * @return  output array, row-major over the selection
     */
    public byte[] getOutput() {
        return output_;
    }

    /**
     * Returns the local indices along one dimension of a chunk
     * whose dataset positions are inside the shape and the selection.
     *
     * @param  idim  dimension index
     * @param  chunkIndex  chunk coordinate in that dimension
     * @return  selected local indices, ascending
     */
    private int[] selectLocals( int idim, long chunkIndex ) {
        long origin = chunkIndex * chunkShape_[ idim ];
        int n = 0;
        int[] buf = new int[ chunkShape_[ idim ] ];
        for ( int l = 0; l < chunkShape_[ idim ]; l++ ) {
            long g = origin + l;
            if ( g < shape_[ idim ] && slab_.getSelectionIndex( idim, g ) >= 0 ) {
                buf[ n++ ] = l;
            }
        }
        int[] result = new int[ n ];
        System.arraycopy( buf, 0, result, 0, n );
        return result;
    }

    private long outIndex( int idim, long chunkIndex, int local ) {
        return slab_.getSelectionIndex( idim,
                                        chunkIndex * chunkShape_[ idim ]
                                        + local );
    }

    private static boolean isZero( byte[] bytes ) {
        for ( byte b : bytes ) {
            if ( b != 0 ) {
                return false;
            }
        }
        return true;
    }
}
