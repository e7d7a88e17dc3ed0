package io.github.mandar2812.PlasmaML.hdf5.record;

/**
 * Rectangular, possibly strided, selection of elements from an
 * N-dimensional array.
 * In each dimension the selected indices are
 * <code>start, start+step, ...</code> up to but excluding
 * <code>end</code>.
 *
 * @author   Mark Taylor
 * @since    20 Feb 2024
 */
public class Hyperslab {

    private final long[] start_;
    private final long[] end_;
    private final long[] step_;
    private final long[] count_;

    /**
     * Constructor.
     *
     * @param  start  first index in each dimension
     * @param  end    exclusive upper index in each dimension
     * @param  step   stride in each dimension
     */
    private Hyperslab( long[] start, long[] end, long[] step ) {
        start_ = start;
        end_ = end;
        step_ = step;
        count_ = new long[ start.length ];
        for ( int i = 0; i < start.length; i++ ) {
            count_[ i ] = ( end[ i ] - start[ i ] + step[ i ] - 1 ) / step[ i ];
        }
    }

    /**
     * Returns a hyperslab selecting every element of an array.
     *
     * @param  shape  array shape
     * @return  full selection
     */
    public static Hyperslab createFull( long[] shape ) {
        int rank = shape.length;
        long[] step = new long[ rank ];
        for ( int i = 0; i < rank; i++ ) {
            step[ i ] = 1;
        }
        return new Hyperslab( new long[ rank ], shape.clone(), step );
    }

    /**
     * Returns a hyperslab with given bounds, checking them against
     * an array shape.
     *
     * @param  shape  array shape
     * @param  start  first index per dimension, or null for all zeros
     * @param  end    exclusive end index per dimension,
     *                or null for the shape
     * @param  step   stride per dimension, or null for all ones
     * @return  selection
     * @throws  IllegalArgumentException  if the bounds are inconsistent
     *          with the shape
     */
    public static Hyperslab create( long[] shape, long[] start, long[] end,
                                    long[] step ) {
        Hyperslab full = createFull( shape );
        int rank = shape.length;
        long[] st = start == null ? full.start_ : start.clone();
        long[] en = end == null ? full.end_ : end.clone();
        long[] sp = step == null ? full.step_ : step.clone();
        if ( st.length != rank || en.length != rank || sp.length != rank ) {
            throw new IllegalArgumentException( "Slice dimensions must match "
                                              + "dataset rank " + rank );
        }
        for ( int i = 0; i < rank; i++ ) {
            if ( st[ i ] < 0 || st[ i ] >= shape[ i ] ) {
                throw new IllegalArgumentException( "Start index " + st[ i ]
                                                  + " out of range for "
                                                  + "dimension " + i );
            }
            if ( en[ i ] <= st[ i ] || en[ i ] > shape[ i ] ) {
                throw new IllegalArgumentException( "End index " + en[ i ]
                                                  + " out of range for "
                                                  + "dimension " + i );
            }
            if ( sp[ i ] < 1 ) {
                throw new IllegalArgumentException( "Step " + sp[ i ]
                                                  + " not positive for "
                                                  + "dimension " + i );
            }
        }
        return new Hyperslab( st, en, sp );
    }

    /**
     * Returns the number of dimensions.
     *
     * @return  rank
     */
    public int getRank() {
        return start_.length;
    }

    /**
     * Returns the start index in a dimension.
     *
     * @param  idim  dimension index
     * @return  first selected index
     */
    public long getStart( int idim ) {
        return start_[ idim ];
    }

    /**
     * Returns the exclusive end index in a dimension.
     *
     * @param  idim  dimension index
     * @return  end index
     */
    public long getEnd( int idim ) {
        return end_[ idim ];
    }

    /**
     * Returns the stride in a dimension.
     *
     * @param  idim  dimension index
     * @return  step
     */
    public long getStep( int idim ) {
        return step_[ idim ];
    }

    /**
     * Returns the number of selected indices in each dimension.
     *
     * @return  shape of the selection
     */
    public long[] getCounts() {
        return count_.clone();
    }

    /**
     * Returns the total number of selected elements.
     *
     * @return  element count
     */
    public long getElementCount() {
        long n = 1;
        for ( long c : count_ ) {
            n *= c;
        }
        return n;
    }

    /**
     * Returns the position in the selection of an index in one dimension.
     *
     * @param  idim  dimension index
     * @param  index  array index in that dimension
     * @return  index into the selection, or -1 if not selected
     */
    public long getSelectionIndex( int idim, long index ) {
        if ( index < start_[ idim ] || index >= end_[ idim ] ) {
            return -1;
        }
        long off = index - start_[ idim ];
        return off % step_[ idim ] == 0 ? off / step_[ idim ] : -1;
    }
}
