package io.github.mandar2812.PlasmaML.hdf5;

import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.ATTRIBUTE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.DATASPACE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.DATATYPE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.FILL_VALUE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.FILTER_PIPELINE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.LAYOUT;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.SYMBOL_TABLE;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.attributeV1;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.chunkedLayout;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.chunkedLayoutV1;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.compactLayout;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.contiguousLayout;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.dataspace;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.deflatePipelineV1;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.fillValue;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.filterPipeline;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.fixedArrayLayout;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.float64Type;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.float64s;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.int32s;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.intType;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.msg;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.nullDataspace;
import static io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.singleChunkLayout;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.Bytes;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.ChunkEntry;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.GroupEntry;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.Msg;
import io.github.mandar2812.PlasmaML.hdf5.record.LayoutMessage;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Reading dataset elements from the various storage layouts.
 */
@Tag("unit")
@DisplayName("Dataset")
class DatasetTest {

    @Test
    @DisplayName("Should read gzip-compressed chunked doubles")
    void readsDeflatedChunks() throws Exception {
        Dataset ds = openDataset( createDeflatedDoubles() );
        assertThat( ds.getShape() ).containsExactly( 100L );
        assertThat( ds.getLayout() )
            .isEqualTo( LayoutMessage.LayoutClass.CHUNKED );
        assertThat( ds.getChunkShape() ).containsExactly( 25 );
        Object[] values = ds.readData();
        assertThat( values ).hasSize( 100 );
        for ( int i = 0; i < 100; i++ ) {
            assertThat( values[ i ] ).isEqualTo( Double.valueOf( i ) );
        }
        assertThat( ds.readSlice( new long[] { 20 }, new long[] { 30 },
                                  new long[] { 4 } ) )
            .containsExactly( 20.0, 24.0, 28.0 );
    }

    @Test
    @DisplayName("Should give identical results for repeated reads")
    void readsDeterministically() throws Exception {
        Dataset ds = openDataset( createDeflatedDoubles() );
        Object[] first = ds.readData();
        Object[] second = ds.readData();
        assertThat( second ).isNotSameAs( first ).isEqualTo( first );
        long[] start = { 3 };
        long[] end = { 97 };
        long[] step = { 7 };
        assertThat( ds.readSlice( start, end, step ) )
            .isEqualTo( ds.readSlice( start, end, step ) );

        Dataset grid = openDataset( createChunkedGrid() );
        assertThat( grid.readData() ).isEqualTo( grid.readData() );
    }

    @Test
    @DisplayName("Should summarise dataset metadata")
    void inspects() throws Exception {
        Map<String,Object> info = openDataset( createDeflatedDoubles() )
                                 .inspect();
        assertThat( info )
            .containsEntry( "path", "/ds" )
            .containsEntry( "type", "dataset" )
            .containsEntry( "shape", Arrays.asList( 100L ) )
            .containsEntry( "dtype", "float64" )
            .containsEntry( "size", 100L )
            .containsEntry( "storage", "chunked" )
            .containsEntry( "chunkShape", Arrays.asList( 25 ) )
            .containsEntry( "chunkIndex", "btree-v1" )
            .containsEntry( "compression", Arrays.asList( "deflate" ) );
        @SuppressWarnings("unchecked")
        Map<String,Object> atts = (Map<String,Object>) info.get( "attributes" );
        assertThat( atts ).containsEntry( "version", 3 );
    }

    @Test
    @DisplayName("Should read and slice contiguous data")
    void readsContiguous() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long addr = b.append( float64s( 0.5, 1.5, 2.5 ) );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 3 ) ),
                                  msg( DATATYPE, float64Type() ),
                                  msg( LAYOUT, contiguousLayout( addr, 24 ) ) );
        assertThat( ds.getLayout() )
            .isEqualTo( LayoutMessage.LayoutClass.CONTIGUOUS );
        assertThat( ds.getChunkShape() ).isNull();
        assertThat( ds.readData() ).containsExactly( 0.5, 1.5, 2.5 );
        assertThat( ds.readSlice( new long[] { 1 }, null, null ) )
            .containsExactly( 1.5, 2.5 );
    }

    @Test
    @DisplayName("Should read compact data held in the header")
    void readsCompact() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 2, 2 ) ),
                                  msg( DATATYPE, intType( 2, true ) ),
                                  msg( LAYOUT,
                                       compactLayout( Hdf5Builder
                                                     .int16s( 1, -2, 3,
                                                              -4 ) ) ) );
        assertThat( ds.readData() )
            .containsExactly( (short) 1, (short) -2, (short) 3, (short) -4 );
        assertThat( ds.readSlice( new long[] { 0, 1 }, null, null ) )
            .containsExactly( (short) -2, (short) -4 );
    }

    @Test
    @DisplayName("Should read scalar and null dataspaces")
    void readsScalarAndNull() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        Dataset scalar = openDataset( b,
                                      msg( DATASPACE, dataspace() ),
                                      msg( DATATYPE, intType( 4, true ) ),
                                      msg( LAYOUT,
                                           compactLayout( int32s( 42 ) ) ) );
        assertThat( scalar.getShape() ).isEmpty();
        assertThat( scalar.getSize() ).isEqualTo( 1 );
        assertThat( scalar.readData() ).containsExactly( 42 );

        Hdf5Builder b2 = new Hdf5Builder();
        Dataset empty = openDataset( b2,
                                     msg( DATASPACE, nullDataspace() ),
                                     msg( DATATYPE, intType( 4, true ) ),
                                     msg( LAYOUT,
                                          compactLayout( new byte[ 0 ] ) ) );
        assertThat( empty.getSize() ).isEqualTo( 0 );
        assertThat( empty.readData() ).isEmpty();
    }

    @Test
    @DisplayName("Should decode enumerations to their integer values")
    void readsEnum() throws Exception {
        byte[] enumType = new Bytes().u8( 0x38 ).u8( 3 ).u8( 0 ).u8( 0 )
                                     .u32( 1 )
                                     .bytes( intType( 1, false ) )
                                     .cstr( "LOW" ).cstr( "MID" )
                                     .cstr( "HIGH" )
                                     .u8( 0 ).u8( 1 ).u8( 2 ).toArray();
        Hdf5Builder b = new Hdf5Builder();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 5 ) ),
                                  msg( DATATYPE, enumType ),
                                  msg( LAYOUT,
                                       compactLayout( new byte[] {
                                           0, 1, 2, 1, 0 } ) ) );
        assertThat( ds.readData() )
            .containsExactly( (short) 0, (short) 1, (short) 2, (short) 1,
                              (short) 0 );
        Datatype.EnumType et = (Datatype.EnumType) ds.getDatatype();
        assertThat( et.getMemberName( 2 ) ).isEqualTo( "HIGH" );
    }

    @Test
    @DisplayName("Should decode compound elements with array members")
    @SuppressWarnings("unchecked")
    void readsCompound() throws Exception {
        byte[] arrayType = new Bytes().u8( 0x3a ).u8( 0 ).u8( 0 ).u8( 0 )
                                      .u32( 12 ).u8( 1 ).u32( 3 )
                                      .bytes( intType( 4, true ) ).toArray();
        byte[] compound = new Bytes().u8( 0x36 ).u8( 2 ).u8( 0 ).u8( 0 )
                                     .u32( 16 )
                                     .cstr( "id" ).u8( 0 )
                                     .bytes( intType( 4, true ) )
                                     .cstr( "vals" ).u8( 4 )
                                     .bytes( arrayType ).toArray();
        Hdf5Builder b = new Hdf5Builder();
        long addr = b.append( int32s( 1, 10, 11, 12, 2, 20, 21, 22 ) );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 2 ) ),
                                  msg( DATATYPE, compound ),
                                  msg( LAYOUT, contiguousLayout( addr, 32 ) ) );
        Object[] values = ds.readData();
        assertThat( values ).hasSize( 2 );
        Map<String,Object> second = (Map<String,Object>) values[ 1 ];
        assertThat( second.get( "id" ) ).isEqualTo( 2 );
        assertThat( (List<Object>) second.get( "vals" ) )
            .containsExactly( 20, 21, 22 );
    }

    @Test
    @DisplayName("Should assemble a 3-d array from partial edge chunks")
    void readsChunked3d() throws Exception {
        long[] shape = { 2, 3, 4 };
        int[] chunk = { 1, 2, 2 };
        Hdf5Builder b = new Hdf5Builder();
        List<long[]> origins = new ArrayList<long[]>();
        for ( long i = 0; i < 2; i++ ) {
            for ( long j = 0; j < 4; j += 2 ) {
                for ( long k = 0; k < 4; k += 2 ) {
                    origins.add( new long[] { i, j, k } );
                }
            }
        }
        long tree = b.chunkTree( origins.toArray( new long[ 0 ][] ),
                                 createChunks( shape, chunk, origins, 2 ) );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( shape ) ),
                                  msg( DATATYPE, intType( 2, true ) ),
                                  msg( LAYOUT, chunkedLayout( tree, 2,
                                                              chunk ) ) );
        Object[] values = ds.readData();
        assertThat( values ).hasSize( 24 );
        for ( int i = 0; i < 24; i++ ) {
            assertThat( values[ i ] ).isEqualTo( Short.valueOf( (short) i ) );
        }
        assertThat( ds.readSlice( new long[] { 1, 2, 1 },
                                  new long[] { 2, 3, 4 }, null ) )
            .containsExactly( (short) 21, (short) 22, (short) 23 );
    }

    @Test
    @DisplayName("Should slice chunked data the same as contiguous data")
    void slicesChunkedLikeContiguous() throws Exception {
        Dataset chunked = openDataset( createChunkedGrid() );
        Hdf5Builder b = new Hdf5Builder();
        long addr = b.append( int32s( range( 100 ) ) );
        Dataset contiguous =
            openDataset( b,
                         msg( DATASPACE, dataspace( 10, 10 ) ),
                         msg( DATATYPE, intType( 4, true ) ),
                         msg( LAYOUT, contiguousLayout( addr, 400 ) ) );
        long[] start = { 1, 2 };
        long[] end = { 8, 7 };
        long[] step = { 3, 4 };
        Object[] slice = chunked.readSlice( start, end, step );
        assertThat( slice ).containsExactly( 12, 16, 42, 46, 72, 76 );
        assertThat( slice )
            .isEqualTo( contiguous.readSlice( start, end, step ) );
        assertThat( chunked.readData() ).isEqualTo( contiguous.readData() );
        assertThat( chunked.readSlice( new long[] { 9, 9 }, null, null ) )
            .containsExactly( 99 );
    }

    @Test
    @DisplayName("Should use the fill value for chunks never written")
    void fillsMissingChunks() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long tree = b.chunkTree( new long[][] { { 2 } },
                                 new byte[][] { int32s( 3, 4 ) } );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 6 ) ),
                                  msg( DATATYPE, intType( 4, true ) ),
                                  msg( FILL_VALUE, fillValue( int32s( -1 ) ) ),
                                  msg( LAYOUT, chunkedLayout( tree, 4, 2 ) ) );
        assertThat( ds.getFillValue() ).isEqualTo( int32s( -1 ) );
        assertThat( ds.readData() ).containsExactly( -1, -1, 3, 4, -1, -1 );
        assertThat( ds.readSlice( new long[] { 1 }, new long[] { 4 }, null ) )
            .containsExactly( -1, 3, 4 );
    }

    @Test
    @DisplayName("Should reject an unfiltered chunk of the wrong size")
    void rejectsShortChunk() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long tree = b.chunkTree( new long[][] { { 0 } },
                                 new byte[][] { int32s( 1 ) } );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 2 ) ),
                                  msg( DATATYPE, intType( 4, true ) ),
                                  msg( LAYOUT, chunkedLayout( tree, 4, 2 ) ) );
        assertThatThrownBy( () -> ds.readData() )
            .isInstanceOf( DataReadException.class )
            .hasMessageContaining( "expected 8" );
    }

    @Test
    @DisplayName("Should read version 1 layout and filter pipeline messages")
    void readsVersion1Messages() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long tree = b.chunkTree( new long[][] { { 0 }, { 2 } },
                                 new byte[][] { deflate( int32s( 1, 2 ) ),
                                                deflate( int32s( 3, 4 ) ) } );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 4 ) ),
                                  msg( DATATYPE, intType( 4, true ) ),
                                  msg( FILTER_PIPELINE, deflatePipelineV1() ),
                                  msg( LAYOUT, chunkedLayoutV1( tree, 4,
                                                                2 ) ) );
        assertThat( ds.getFilters().toString() ).isEqualTo( "[deflate]" );
        assertThat( ds.readData() ).containsExactly( 1, 2, 3, 4 );
    }

    @Test
    @DisplayName("Should read a filtered single-chunk dataset")
    void readsSingleChunk() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        byte[] packed = deflate( int32s( 5, 6, 7, 8 ) );
        long addr = b.append( packed );
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 4 ) ),
                                  msg( DATATYPE, intType( 4, true ) ),
                                  msg( FILTER_PIPELINE,
                                       filterPipeline( 4, 1 ) ),
                                  msg( LAYOUT,
                                       singleChunkLayout( addr, packed.length,
                                                          4, 4 ) ) );
        assertThat( ds.inspect() ).containsEntry( "chunkIndex",
                                                  "single-chunk" );
        assertThat( ds.readData() ).containsExactly( 5, 6, 7, 8 );
    }

    @Test
    @DisplayName("Should refuse chunk indexes it cannot read")
    void rejectsFixedArrayIndex() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 4 ) ),
                                  msg( DATATYPE, intType( 4, true ) ),
                                  msg( LAYOUT,
                                       fixedArrayLayout( 0x100, 4, 2 ) ) );
        assertThat( ds.getShape() ).containsExactly( 4L );
        assertThatThrownBy( () -> ds.readData() )
            .isInstanceOf( UnsupportedFeatureException.class )
            .hasMessageContaining( "fixed-array" );
    }

    @Test
    @DisplayName("Should view 1-byte integers as booleans")
    void readsBooleans() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 4 ) ),
                                  msg( DATATYPE, intType( 1, false ) ),
                                  msg( LAYOUT,
                                       compactLayout( new byte[] {
                                           0, 1, 2, 0 } ) ) );
        assertThat( ds.readAsBoolean() )
            .containsExactly( false, true, true, false );

        Dataset doubles = openDataset( createDeflatedDoubles() );
        assertThatThrownBy( () -> doubles.readAsBoolean() )
            .isInstanceOf( UnsupportedFeatureException.class );
    }

    @Test
    @DisplayName("Should view integers as timestamps")
    void readsTimestamps() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        byte[] data = new Bytes().u64( 0 ).u64( 86400 )
                                 .u64( 1700000000000L ).toArray();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 3 ) ),
                                  msg( DATATYPE, intType( 8, true ) ),
                                  msg( LAYOUT, compactLayout( data ) ) );
        Instant[] secs = ds.readAsDateTime( TimestampUnit.SECONDS );
        assertThat( secs[ 0 ] ).isEqualTo( Instant.EPOCH );
        assertThat( secs[ 1 ] )
            .isEqualTo( Instant.parse( "1970-01-02T00:00:00Z" ) );
        Instant[] auto = ds.readAsDateTime( TimestampUnit.AUTO );
        assertThat( auto[ 1 ] ).isEqualTo( secs[ 1 ] );
        assertThat( auto[ 2 ] )
            .isEqualTo( Instant.ofEpochMilli( 1700000000000L ) );

        Dataset doubles = openDataset( createDeflatedDoubles() );
        assertThatThrownBy( () -> doubles
                                 .readAsDateTime( TimestampUnit.SECONDS ) )
            .isInstanceOf( UnsupportedFeatureException.class );
    }

    @Test
    @DisplayName("Should deliver whole rows in blocks")
    void readsInBlocks() throws Exception {
        Dataset ds = openDataset( createChunkedGrid() );
        Dataset.BlockReader reader = ds.readChunked( 25 );
        List<Object> all = new ArrayList<Object>();
        int nblock = 0;
        while ( reader.hasNext() ) {
            Object[] block = reader.next();
            assertThat( block ).hasSize( 20 );
            all.addAll( Arrays.asList( block ) );
            nblock++;
        }
        assertThat( nblock ).isEqualTo( 5 );
        assertThat( all.toArray() ).isEqualTo( ds.readData() );
        assertThatThrownBy( () -> ds.readChunked( 0 ) )
            .isInstanceOf( IllegalArgumentException.class );
    }

    @Test
    @DisplayName("Should follow a shared datatype to its committed object")
    void readsSharedDatatype() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long committed = b.v1Header( msg( DATATYPE, intType( 4, true ) ) );
        byte[] sharedRef = new Bytes().u8( 1 ).u8( 0 ).zeros( 6 )
                                      .u64( committed ).toArray();
        Dataset ds = openDataset( b,
                                  msg( DATASPACE, dataspace( 2 ) ),
                                  msg( DATATYPE, 0x02, sharedRef ),
                                  msg( LAYOUT,
                                       compactLayout( int32s( 8, 9 ) ) ) );
        assertThat( ds.getDatatype().getName() ).isEqualTo( "int32" );
        assertThat( ds.readData() ).containsExactly( 8, 9 );
        assertThat( ds.getFile().getObjectType( "/ds" ) )
            .isEqualTo( ObjectType.DATASET );
    }

    /**
     * Adds a dataset header and a root group holding it as "ds",
     * and opens the result.
     */
    static Dataset openDataset( Hdf5Builder b, Msg... msgs )
            throws Exception {
        long header = b.v1Header( msgs );
        return openDataset( b, header );
    }

    private static Dataset openDataset( Hdf5Builder b, long header )
            throws Exception {
        byte[] stab = b.symbolTableGroup( GroupEntry.hard( "ds", header ) );
        long root = b.v1Header( msg( SYMBOL_TABLE, stab ) );
        return Hdf5File.open( b.build( root ) ).dataset( "/ds" );
    }

    private static Dataset openDataset( Fixture fixture ) throws Exception {
        return openDataset( fixture.builder_, fixture.header_ );
    }

    /**
     * Doubles 0..99 in chunks of 25, deflated, with an int attribute.
     */
    private static Fixture createDeflatedDoubles() {
        Hdf5Builder b = new Hdf5Builder();
        long[][] offsets = new long[ 4 ][];
        byte[][] chunks = new byte[ 4 ][];
        for ( int ic = 0; ic < 4; ic++ ) {
            double[] vals = new double[ 25 ];
            for ( int i = 0; i < 25; i++ ) {
                vals[ i ] = ic * 25 + i;
            }
            offsets[ ic ] = new long[] { ic * 25 };
            chunks[ ic ] = deflate( float64s( vals ) );
        }
        long tree = b.chunkTree( offsets, chunks );
        long header =
            b.v1Header( msg( DATASPACE, dataspace( 100 ) ),
                        msg( DATATYPE, float64Type() ),
                        msg( FILTER_PIPELINE, filterPipeline( 8, 1 ) ),
                        msg( LAYOUT, chunkedLayout( tree, 8, 25 ) ),
                        msg( ATTRIBUTE,
                             attributeV1( "version", intType( 4, true ),
                                          dataspace(), int32s( 3 ) ) ) );
        return new Fixture( b, header );
    }

    /**
     * Ints 0..99 in a 10x10 array of 3x3 chunks, indexed by a
     * two-level B-tree.
     */
    private static Fixture createChunkedGrid() {
        long[] shape = { 10, 10 };
        int[] chunk = { 3, 3 };
        Hdf5Builder b = new Hdf5Builder();
        List<long[]> origins = new ArrayList<long[]>();
        for ( long i = 0; i < 10; i += 3 ) {
            for ( long j = 0; j < 10; j += 3 ) {
                origins.add( new long[] { i, j } );
            }
        }
        byte[][] chunks = createChunks( shape, chunk, origins, 4 );
        List<ChunkEntry> leaf1 = new ArrayList<ChunkEntry>();
        List<ChunkEntry> leaf2 = new ArrayList<ChunkEntry>();
        for ( int i = 0; i < chunks.length; i++ ) {
            long addr = b.append( chunks[ i ] );
            ( i < 8 ? leaf1 : leaf2 )
               .add( new ChunkEntry( origins.get( i ), addr,
                                     chunks[ i ].length, 0 ) );
        }
        long leaf1Addr = b.chunkNode( 0, leaf1 );
        long leaf2Addr = b.chunkNode( 0, leaf2 );
        List<ChunkEntry> rootEntries = new ArrayList<ChunkEntry>();
        rootEntries.add( new ChunkEntry( origins.get( 0 ), leaf1Addr, 0, 0 ) );
        rootEntries.add( new ChunkEntry( origins.get( 8 ), leaf2Addr, 0, 0 ) );
        long tree = b.chunkNode( 1, rootEntries );
        long header =
            b.v1Header( msg( DATASPACE, dataspace( shape ) ),
                        msg( DATATYPE, intType( 4, true ) ),
                        msg( LAYOUT, chunkedLayout( tree, 4, chunk ) ) );
        return new Fixture( b, header );
    }

    /**
     * Creates stored chunks whose elements hold their row-major index
     * in the whole array, and zero outside it.
     */
    private static byte[][] createChunks( long[] shape, int[] chunk,
                                          List<long[]> origins,
                                          int elSize ) {
        int rank = shape.length;
        int n = 1;
        for ( int c : chunk ) {
            n *= c;
        }
        byte[][] chunks = new byte[ origins.size() ][];
        for ( int ic = 0; ic < chunks.length; ic++ ) {
            long[] origin = origins.get( ic );
            Bytes bytes = new Bytes();
            for ( int i = 0; i < n; i++ ) {
                long[] pos = new long[ rank ];
                int rem = i;
                for ( int d = rank - 1; d >= 0; d-- ) {
                    pos[ d ] = origin[ d ] + rem % chunk[ d ];
                    rem /= chunk[ d ];
                }
                boolean inside = true;
                long index = 0;
                for ( int d = 0; d < rank; d++ ) {
                    inside = inside && pos[ d ] < shape[ d ];
                    index = index * shape[ d ] + pos[ d ];
                }
                bytes.uint( inside ? index : 0, elSize );
            }
            chunks[ ic ] = bytes.toArray();
        }
        return chunks;
    }

    private static int[] range( int n ) {
        int[] values = new int[ n ];
        for ( int i = 0; i < n; i++ ) {
            values[ i ] = i;
        }
        return values;
    }

    static byte[] deflate( byte[] data ) {
        Deflater deflater = new Deflater( 6 );
        deflater.setInput( data );
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[ 256 ];
        while ( ! deflater.finished() ) {
            int n = deflater.deflate( buf );
            out.write( buf, 0, n );
        }
        deflater.end();
        return out.toByteArray();
    }

    /**
     * Builder holding a dataset header not yet linked into a file.
     */
    private static class Fixture {
        final Hdf5Builder builder_;
        final long header_;

        Fixture( Hdf5Builder builder, long header ) {
            builder_ = builder;
            header_ = header;
        }
    }
}
