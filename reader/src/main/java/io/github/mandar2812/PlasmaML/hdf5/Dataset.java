package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.ChunkAssembler;
import io.github.mandar2812.PlasmaML.hdf5.record.ChunkIndex;
import io.github.mandar2812.PlasmaML.hdf5.record.ChunkRecord;
import io.github.mandar2812.PlasmaML.hdf5.record.DataspaceMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.FillValueMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.FilterPipeline;
import io.github.mandar2812.PlasmaML.hdf5.record.FilterPipelineMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.Hyperslab;
import io.github.mandar2812.PlasmaML.hdf5.record.LayoutMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.Message;
import io.github.mandar2812.PlasmaML.hdf5.record.MessageType;
import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;
import io.github.mandar2812.PlasmaML.hdf5.record.Pointer;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dataset in an HDF5 file: an N-dimensional array of typed elements.
 *
 * <p>The header messages describing the dataset are read on construction,
 * but element data is only read by the <code>read*</code> methods.
 * Nothing read is cached, so repeated reads give identical results
 * by reading the file again.
 *
 * <p>Decoded elements are returned in row-major order as Java objects;
 * see {@link Datatype} for the object type used for each datatype class.
 *
 * @author   Mark Taylor
 * @since    18 Feb 2024
 */
public class Dataset extends Hdf5Object {

    private final DataspaceMessage space_;
    private final Datatype datatype_;
    private final LayoutMessage layout_;
    private final FilterPipeline pipeline_;
    private final byte[] fillValue_;

    private static final Logger logger_ =
        Logger.getLogger( Dataset.class.getName() );

    /**
     * Constructor.
     *
     * @param  file  file containing dataset
     * @param  path  absolute path of dataset
     * @param  header  dataset header
     * @throws  DataReadException  if a required message is missing
     */
    Dataset( Hdf5File file, String path, ObjectHeader header )
            throws IOException {
        super( file, path, header );
        space_ = requireMessage( header, DataspaceMessage.class,
                                 MessageType.DATASPACE, path );
        layout_ = requireMessage( header, LayoutMessage.class,
                                  MessageType.LAYOUT, path );
        datatype_ = file.getDatatype( header );
        if ( datatype_ == null ) {
            throw new DataReadException( "Dataset " + path
                                       + " has no datatype message" );
        }
        if ( datatype_.getSize() <= 0 ) {
            throw new DataReadException( "Dataset " + path
                                       + " has element size "
                                       + datatype_.getSize() );
        }
        FilterPipelineMessage pmsg =
            header.getMessage( FilterPipelineMessage.class );
        pipeline_ = pmsg == null ? FilterPipeline.EMPTY : pmsg.pipeline;
        fillValue_ = getFillValue( header, datatype_.getSize(), path );
    }

    /**
     * Returns the shape of this dataset.
     *
     * @return  extent in each dimension; empty for a scalar dataset
     */
    public long[] getShape() {
        return space_.dims.clone();
    }

    /**
     * Returns the element type.
     *
     * @return  datatype
     */
    public Datatype getDatatype() {
        return datatype_;
    }

    /**
     * Returns the storage arrangement of the raw data.
     *
     * @return  layout class
     */
    public LayoutMessage.LayoutClass getLayout() {
        return layout_.layoutClass;
    }

    /**
     * Returns the full layout description.
     *
     * @return  layout message
     */
    public LayoutMessage getLayoutMessage() {
        return layout_;
    }

    /**
     * Returns the chunk shape, if chunked.
     *
     * @return  chunk extents, or null for unchunked storage
     */
    public int[] getChunkShape() {
        return layout_.chunkDims == null ? null : layout_.chunkDims.clone();
    }

    /**
     * Returns the filters applied to the stored chunks.
     *
     * @return  filter pipeline, possibly empty
     */
    public FilterPipeline getFilters() {
        return pipeline_;
    }

    /**
     * Returns the bytes used for elements that have not been written.
     *
     * @return  fill value bytes, or null for zeros
     */
    public byte[] getFillValue() {
        return fillValue_ == null ? null : fillValue_.clone();
    }

    /**
     * Returns the number of elements in this dataset.
     *
     * @return  element count
     */
    public long getSize() {
        return space_.getElementCount();
    }

    /**
     * Reads all elements.
     *
     * @return  decoded elements in row-major order
     */
    public Object[] readData() throws IOException {
        Hyperslab slab = Hyperslab.createFull( getShape() );
        return decodeElements( readBytes( slab, true ) );
    }

    /**
     * Reads a rectangular, possibly strided, selection of elements.
     *
     * @param  start  first index per dimension, or null for all zeros
     * @param  end    exclusive end index per dimension, or null for shape
     * @param  step   stride per dimension, or null for all ones
     * @return  decoded selected elements in row-major order
     * @throws  IllegalArgumentException  if the bounds do not fit the shape
     */
    public Object[] readSlice( long[] start, long[] end, long[] step )
            throws IOException {
        Hyperslab slab = Hyperslab.create( getShape(), start, end, step );
        return decodeElements( readBytes( slab, false ) );
    }

    /**
     * Returns a reader which delivers this dataset's elements in blocks
     * of whole rows (slices along the first dimension).
     *
     * @param  elementsPerBlock  approximate number of elements per block;
     *                           at least one row is always delivered
     * @return  block reader
     */
    public BlockReader readChunked( int elementsPerBlock ) {
        if ( elementsPerBlock <= 0 ) {
            throw new IllegalArgumentException( "Block size "
                                              + elementsPerBlock
                                              + " not positive" );
        }
        return new BlockReader( elementsPerBlock );
    }

    /**
     * Reads all elements of a dataset of 1-byte integers as booleans.
     *
     * @return  false for zero elements, true for others
     * @throws  UnsupportedFeatureException  if the datatype is not
     *          a 1-byte integer
     */
    public boolean[] readAsBoolean() throws IOException {
        if ( ! datatype_.isBoolean() ) {
            throw new UnsupportedFeatureException( "boolean view",
                                                   "datatype "
                                                 + datatype_.getName()
                                                 + " of " + getPath()
                                                 + " is not a "
                                                 + "1-byte integer" );
        }
        byte[] bytes = readBytes( Hyperslab.createFull( getShape() ), true );
        boolean[] flags = new boolean[ bytes.length ];
        for ( int i = 0; i < bytes.length; i++ ) {
            flags[ i ] = bytes[ i ] != 0;
        }
        return flags;
    }

    /**
     * Reads all elements of an integer dataset as timestamps
     * counted from the Unix epoch.
     *
     * @param  unit  unit of the stored values
     * @return  instants
     * @throws  UnsupportedFeatureException  if the datatype is not integer
     */
    public Instant[] readAsDateTime( TimestampUnit unit ) throws IOException {
        if ( ! datatype_.isInteger() ) {
            throw new UnsupportedFeatureException( "timestamp view",
                                                   "datatype "
                                                 + datatype_.getName()
                                                 + " of " + getPath()
                                                 + " is not integer" );
        }
        Object[] values = readData();
        Instant[] times = new Instant[ values.length ];
        for ( int i = 0; i < values.length; i++ ) {
            times[ i ] = unit.toInstant( ((Number) values[ i ]).longValue() );
        }
        return times;
    }

    public Map<String,Object> inspect() throws IOException {
        Map<String,Object> map = new LinkedHashMap<String,Object>();
        map.put( "path", getPath() );
        map.put( "type", ObjectType.DATASET.getName() );
        List<Long> shape = new ArrayList<Long>();
        for ( long d : space_.dims ) {
            shape.add( Long.valueOf( d ) );
        }
        map.put( "shape", shape );
        map.put( "dtype", datatype_.getName() );
        map.put( "size", Long.valueOf( getSize() ) );
        map.put( "storage", layout_.layoutClass.name().toLowerCase() );
        if ( layout_.chunkDims != null ) {
            List<Integer> cshape = new ArrayList<Integer>();
            for ( int d : layout_.chunkDims ) {
                cshape.add( Integer.valueOf( d ) );
            }
            map.put( "chunkShape", cshape );
            map.put( "chunkIndex", layout_.getChunkIndexName() );
        }
        if ( ! pipeline_.isEmpty() ) {
            List<String> filters = new ArrayList<String>();
            for ( FilterPipeline.Stage stage : pipeline_.getStages() ) {
                filters.add( stage.getName() );
            }
            map.put( "compression", filters );
        }
        Map<String,Object> atts = getAttributeMap();
        if ( ! atts.isEmpty() ) {
            map.put( "attributes", atts );
        }
        return map;
    }

    /**
     * Reads the raw element bytes of a selection.
     *
     * @param  slab  selection
     * @param  isFull  true if the selection is known to be the whole
     *                 dataset, in which case chunks are enumerated
     *                 rather than looked up
     * @return  element bytes in row-major selection order
     */
    private byte[] readBytes( Hyperslab slab, boolean isFull )
            throws IOException {
        getFile().checkOpen();
        if ( space_.spaceType == DataspaceMessage.SpaceType.NULL
             || slab.getElementCount() == 0 ) {
            return new byte[ 0 ];
        }
        int elSize = datatype_.getSize();
        long[] shape = getShape();
        Buf buf = getFile().getBuf();
        switch ( layout_.layoutClass ) {
            case COMPACT:
                return assembleWhole( slab, layout_.compactData );
            case CONTIGUOUS:
                if ( layout_.address == Buf.UNDEFINED_ADDRESS ) {
                    return new ChunkAssembler( shape, toIntShape( shape ),
                                               elSize, slab, fillValue_ )
                          .getOutput();
                }
                long nbyte = getSize() * elSize;
                if ( nbyte > Integer.MAX_VALUE ) {
                    throw new DataReadException( "Dataset " + getPath()
                                               + " too large: " + nbyte
                                               + " bytes" );
                }
                return assembleWhole( slab,
                                      buf.readBytes( new Pointer( layout_
                                                                 .address ),
                                                     (int) nbyte ) );
            case CHUNKED:
                return readChunks( slab, isFull );
            case VIRTUAL:
                throw new UnsupportedFeatureException( "virtual dataset",
                                                       getPath() );
            default:
                throw new AssertionError( layout_.layoutClass );
        }
    }

    /**
     * Assembles a selection from a buffer holding the whole dataset.
     */
    private byte[] assembleWhole( Hyperslab slab, byte[] data )
            throws IOException {
        long[] shape = getShape();
        long nbyte = getSize() * datatype_.getSize();
        if ( data.length < nbyte ) {
            throw new DataReadException( "Dataset " + getPath() + " has "
                                       + data.length + " bytes of data, "
                                       + "expected " + nbyte );
        }
        ChunkAssembler assembler =
            new ChunkAssembler( shape, toIntShape( shape ),
                                datatype_.getSize(), slab, fillValue_ );
        assembler.placeChunk( new long[ shape.length ], data );
        return assembler.getOutput();
    }

    /**
     * Reads a selection from chunked storage.
     */
    private byte[] readChunks( Hyperslab slab, boolean isFull )
            throws IOException {
        long[] shape = getShape();
        int[] chunkShape = layout_.chunkDims;
        int elSize = datatype_.getSize();
        if ( chunkShape.length != shape.length ) {
            throw new Hdf5FormatException( "Chunk rank " + chunkShape.length
                                         + " does not match rank "
                                         + shape.length + " of "
                                         + getPath() );
        }
        if ( layout_.chunkElementSize != elSize ) {
            logger_.config( "Layout element size "
                          + layout_.chunkElementSize + " != datatype size "
                          + elSize + " for " + getPath() );
        }
        ChunkAssembler assembler =
            new ChunkAssembler( shape, chunkShape, elSize, slab, fillValue_ );
        switch ( layout_.chunkIndexType ) {
            case LayoutMessage.INDEX_BTREE_V1:
                ChunkIndex index =
                    new ChunkIndex( getFile().getBuf(), layout_.address,
                                    chunkShape );
                if ( isFull ) {
                    for ( ChunkRecord rec : index.listChunks() ) {
                        placeChunk( assembler, rec );
                    }
                }
                else {
                    for ( long[] coord : getSelectedChunks( assembler,
                                                            chunkShape,
                                                            slab ) ) {
                        ChunkRecord rec = index.findChunk( coord );
                        if ( rec != null ) {
                            placeChunk( assembler, rec );
                        }
                    }
                }
                break;
            case LayoutMessage.INDEX_SINGLE_CHUNK:
                if ( layout_.address != Buf.UNDEFINED_ADDRESS ) {
                    long size = layout_.singleChunkSize >= 0
                              ? layout_.singleChunkSize
                              : assembler.getChunkByteCount();
                    placeChunk( assembler,
                                new ChunkRecord( new long[ shape.length ],
                                                 layout_.address, size,
                                                 layout_
                                                .singleChunkFilterMask ) );
                }
                break;
            default:
                throw new UnsupportedFeatureException( "chunk index "
                                                     + layout_
                                                      .getChunkIndexName(),
                                                       getPath() );
        }
        return assembler.getOutput();
    }

    /**
     * Reads, decodes and places one stored chunk.
     */
    private void placeChunk( ChunkAssembler assembler, ChunkRecord rec )
            throws IOException {
        int expected = assembler.getChunkByteCount();
        if ( rec.getSize() > Integer.MAX_VALUE ) {
            throw new DataReadException( "Chunk too large: " + rec );
        }
        byte[] raw = getFile().getBuf()
                    .readBytes( new Pointer( rec.getAddress() ),
                                (int) rec.getSize() );
        byte[] data;
        if ( pipeline_.isEmpty() ) {
            if ( raw.length != expected ) {
                throw new DataReadException( "Stored " + rec + " has "
                                           + raw.length + " bytes, expected "
                                           + expected );
            }
            data = raw;
        }
        else {
            data = pipeline_.decode( raw, rec.getFilterMask(),
                                     datatype_.getSize(), expected );
        }
        if ( logger_.isLoggable( Level.FINE ) ) {
            logger_.fine( "Placing " + rec );
        }
        assembler.placeChunk( rec.getCoord(), data );
    }

    /**
     * Returns the coordinates of all chunks that may contribute to
     * a selection.
     */
    private static List<long[]> getSelectedChunks( ChunkAssembler assembler,
                                                   int[] chunkShape,
                                                   Hyperslab slab ) {
        int rank = slab.getRank();
        long[] lo = new long[ rank ];
        long[] hi = new long[ rank ];
        for ( int i = 0; i < rank; i++ ) {
            lo[ i ] = slab.getStart( i ) / chunkShape[ i ];
            hi[ i ] = ( slab.getEnd( i ) - 1 ) / chunkShape[ i ] + 1;
        }
        List<long[]> list = new ArrayList<long[]>();
        long[] coord = lo.clone();
        while ( true ) {
            if ( assembler.isSelected( coord ) ) {
                list.add( coord.clone() );
            }
            int d = rank - 1;
            while ( d >= 0 ) {
                if ( ++coord[ d ] < hi[ d ] ) {
                    break;
                }
                coord[ d ] = lo[ d ];
                d--;
            }
            if ( d < 0 ) {
                break;
            }
        }
        return list;
    }

    /**
     * Decodes the element bytes of a selection.
     */
    private Object[] decodeElements( byte[] bytes )
            throws IOException {
        int elSize = datatype_.getSize();
        int count = bytes.length / elSize;
        DecodeContext context = new DecodeContext( getFile().getBuf() );
        Object[] elements = new Object[ count ];
        for ( int i = 0; i < count; i++ ) {
            elements[ i ] = datatype_.decode( bytes, i * elSize, context );
        }
        return elements;
    }

    private int[] toIntShape( long[] shape ) throws DataReadException {
        int[] ishape = new int[ shape.length ];
        for ( int i = 0; i < shape.length; i++ ) {
            if ( shape[ i ] > Integer.MAX_VALUE ) {
                throw new DataReadException( "Dimension " + shape[ i ]
                                           + " too large for "
                                           + getPath() );
            }
            ishape[ i ] = (int) Math.max( shape[ i ], 1 );
        }
        return ishape;
    }

    private static <M extends Message> M
            requireMessage( ObjectHeader header, Class<M> clazz,
                            MessageType type, String path )
            throws IOException {
        M msg = header.getMessage( clazz );
        if ( msg == null ) {
            if ( header.hasMessage( type ) ) {
                throw new UnsupportedFeatureException( "shared "
                                                     + type.getAbbreviation()
                                                     + " message", path );
            }
            throw new DataReadException( "Dataset " + path + " has no "
                                       + type.getAbbreviation()
                                       + " message" );
        }
        return msg;
    }

    private static byte[] getFillValue( ObjectHeader header, int elSize,
                                        String path ) {
        byte[] value = null;
        for ( FillValueMessage fmsg :
              header.getMessages( FillValueMessage.class ) ) {
            if ( fmsg.value != null
                 && ( value == null
                      || fmsg.getMessageType() == MessageType.FILL_VALUE ) ) {
                value = fmsg.value;
            }
        }
        if ( value != null && value.length != elSize ) {
            logger_.warning( "Ignoring fill value of " + value.length
                           + " bytes for " + elSize + "-byte elements in "
                           + path );
            return null;
        }
        return value;
    }

    /**
     * Delivers a dataset's elements a block of rows at a time.
     * Each block is read from the file when requested.
     */
    public class BlockReader {

        private final long rowsPerBlock_;
        private final long nrow_;
        private long irow_;

        /**
         * Constructor.
         *
         * @param  elementsPerBlock  target block size in elements
         */
        BlockReader( int elementsPerBlock ) {
            long[] shape = getShape();
            if ( shape.length == 0 ) {
                rowsPerBlock_ = 1;
                nrow_ = getSize() > 0 ? 1 : 0;
            }
            else {
                long rowSize = 1;
                for ( int i = 1; i < shape.length; i++ ) {
                    rowSize *= shape[ i ];
                }
                rowsPerBlock_ = Math.max( 1, elementsPerBlock
                                           / Math.max( rowSize, 1 ) );
                nrow_ = getSize() > 0 ? shape[ 0 ] : 0;
            }
        }

        /**
         * Indicates whether there are more rows to read.
         *
         * @return  true iff {@link #next} will return a block
         */
        public boolean hasNext() {
            return irow_ < nrow_;
        }

        /**
         * Reads the next block of rows.
         *
         * @return  decoded elements of the block in row-major order
         */
        public Object[] next() throws IOException {
            if ( ! hasNext() ) {
                throw new NoSuchElementException();
            }
            long[] shape = getShape();
            if ( shape.length == 0 ) {
                irow_ = 1;
                return readData();
            }
            long[] start = new long[ shape.length ];
            long[] end = shape.clone();
            start[ 0 ] = irow_;
            end[ 0 ] = Math.min( nrow_, irow_ + rowsPerBlock_ );
            irow_ = end[ 0 ];
            return readSlice( start, end, null );
        }
    }
}
