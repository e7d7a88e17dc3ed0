package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.DataReadException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered sequence of filters applied to the chunks of a dataset
 * when they were written.
 * Decoding applies the inverse filters in reverse order.
 *
 * <p>Each stored chunk carries a filter mask in which bit <em>i</em>
 * is set if stage <em>i</em> was not applied to that chunk
 * (for instance because an optional compression filter would have
 * enlarged it).  Masked stages are not reversed.
 *
 * @author   Mark Taylor
 * @since    15 Feb 2024
 */
public class FilterPipeline {

    private final List<Stage> stages_;

    /** Pipeline with no stages. */
    public static final FilterPipeline EMPTY =
        new FilterPipeline( new ArrayList<Stage>() );

    private static final Logger logger_ =
        Logger.getLogger( FilterPipeline.class.getName() );

    /**
     * Constructor.
     *
     * @param  stages  filter stages in the order they were applied on write
     */
    public FilterPipeline( List<Stage> stages ) {
        stages_ = Collections.unmodifiableList( new ArrayList<Stage>( stages ) );
    }

    /**
     * Returns the stages of this pipeline.
     *
     * @return  stages in write order
     */
    public List<Stage> getStages() {
        return stages_;
    }

    /**
     * Indicates whether this pipeline has no stages.
     *
     * @return  true iff empty
     */
    public boolean isEmpty() {
        return stages_.isEmpty();
    }

    /**
     * Reverses the filters applied to one stored chunk.
     *
     * @param  raw   stored chunk bytes
     * @param  filterMask  mask of stages skipped for this chunk
     * @param  elSize   dataset element size in bytes
     * @param  expectedSize   number of bytes the decoded chunk must have
     * @return  decoded chunk bytes
     * @throws  DataReadException  if the decoded size is wrong,
     *          or any stage expands beyond what the decoded size permits
     */
    public byte[] decode( byte[] raw, int filterMask, int elSize,
                          int expectedSize )
            throws IOException {
        byte[] data = raw;
        for ( int is = stages_.size() - 1; is >= 0; is-- ) {
            if ( ( filterMask & ( 1 << is ) ) != 0 ) {
                if ( logger_.isLoggable( Level.FINE ) ) {
                    logger_.fine( "Filter " + stages_.get( is ).getName()
                                + " masked off for chunk" );
                }
            }
            else {
                Stage stage = stages_.get( is );
                Filter filter = Filter.getFilter( stage.getId() );
                data = filter.decode( data, stage.getClientData(), elSize,
                                      getMaxSize( is, filterMask,
                                                  expectedSize ) );
            }
        }
        if ( data.length != expectedSize ) {
            throw new DataReadException( "Decoded chunk size mismatch: "
                                       + "expected " + expectedSize
                                       + " bytes, got " + data.length
                                       + " (filters " + this + ")" );
        }
        return data;
    }

    /**
     * Returns the largest output the given stage may legitimately produce.
     * Stages still to be reversed after it can only strip a checksum
     * or permute bytes, unless one of them decompresses, in which case
     * no bound is known.
     *
     * @param  is   index of stage being reversed
     * @param  filterMask  mask of stages skipped for this chunk
     * @param  expectedSize   final decoded chunk size
     * @return  maximum output size in bytes
     */
    private int getMaxSize( int is, int filterMask, int expectedSize ) {
        long max = expectedSize;
        for ( int js = is - 1; js >= 0; js-- ) {
            if ( ( filterMask & ( 1 << js ) ) == 0 ) {
                int id = stages_.get( js ).getId();
                if ( id == Filter.FLETCHER32_ID ) {
                    max += 4;
                }
                else if ( id != Filter.SHUFFLE_ID ) {
                    return Integer.MAX_VALUE;
                }
            }
        }
        return (int) Math.min( max, Integer.MAX_VALUE );
    }

    @Override
    public String toString() {
        StringBuffer sbuf = new StringBuffer( "[" );
        for ( int i = 0; i < stages_.size(); i++ ) {
            if ( i > 0 ) {
                sbuf.append( ", " );
            }
            sbuf.append( stages_.get( i ).getName() );
        }
        return sbuf.append( ']' ).toString();
    }

    /**
     * One filter entry in a pipeline.
     */
    public static class Stage {
        private final int id_;
        private final String name_;
        private final int flags_;
        private final int[] clientData_;

        /**
         * Constructor.
         *
         * @param  id   filter identifier
         * @param  name  filter name as recorded, or null to use the
         *               conventional name for the identifier
         * @param  flags  filter flags
         * @param  clientData  filter parameters
         */
        public Stage( int id, String name, int flags, int[] clientData ) {
            id_ = id;
            name_ = name == null || name.length() == 0
                  ? Filter.getFilterName( id )
                  : name;
            flags_ = flags;
            clientData_ = clientData.clone();
        }

        /**
         * Returns the filter identifier.
         *
         * @return  id
         */
        public int getId() {
            return id_;
        }

        /**
         * Returns the filter name.
         *
         * @return  name
         */
        public String getName() {
            return name_;
        }

        /**
         * Returns the filter flags.
         *
         * @return  flags
         */
        public int getFlags() {
            return flags_;
        }

        /**
         * Indicates whether this filter was optional on write.
         *
         * @return  true iff optional
         */
        public boolean isOptional() {
            return ( flags_ & 0x1 ) != 0;
        }

        /**
         * Returns the filter parameters.
         *
         * @return  client data values
         */
        public int[] getClientData() {
            return clientData_.clone();
        }
    }
}
