package io.github.mandar2812.PlasmaML.hdf5.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.Bytes;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5Builder.ChunkEntry;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Chunk lookup in version 1 B-trees.
 */
@Tag("unit")
@DisplayName("ChunkIndex")
class ChunkIndexTest {

    private static final int[] CHUNK = { 4, 5 };

    @Test
    @DisplayName("Should list chunks from a two-level tree in key order")
    void listsChunks() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long root = createTree( b );
        ChunkIndex index = new ChunkIndex( createBuf( b, root ), root, CHUNK );
        List<ChunkRecord> recs = index.listChunks();
        assertThat( recs ).hasSize( 5 );
        List<String> coords = new ArrayList<String>();
        for ( ChunkRecord rec : recs ) {
            coords.add( rec.getCoord()[ 0 ] + "," + rec.getCoord()[ 1 ] );
        }
        assertThat( coords ).containsExactly( "0,0", "0,1", "1,0", "2,1",
                                              "3,0" );
        assertThat( recs.get( 3 ).getSize() ).isEqualTo( 40L + 3 );
        assertThat( recs.get( 3 ).getFilterMask() ).isEqualTo( 1 );
    }

    @Test
    @DisplayName("Should find stored chunks and miss absent ones")
    void findsChunks() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long root = createTree( b );
        ChunkIndex index = new ChunkIndex( createBuf( b, root ), root, CHUNK );
        ChunkRecord rec = index.findChunk( new long[] { 2, 1 } );
        assertThat( rec ).isNotNull();
        assertThat( rec.getAddress() ).isEqualTo( 0x3100L );
        assertThat( index.findChunk( new long[] { 0, 0 } ).getAddress() )
            .isEqualTo( 0x1000L );
        assertThat( index.findChunk( new long[] { 3, 0 } ).getAddress() )
            .isEqualTo( 0x4000L );
        assertThat( index.findChunk( new long[] { 2, 0 } ) ).isNull();
        assertThat( index.findChunk( new long[] { 9, 9 } ) ).isNull();
    }

    @Test
    @DisplayName("Should have no chunks when the tree is undefined")
    void handlesUndefinedRoot() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        ChunkIndex index = new ChunkIndex( createBuf( b, 0 ),
                                           Buf.UNDEFINED_ADDRESS, CHUNK );
        assertThat( index.listChunks() ).isEmpty();
        assertThat( index.findChunk( new long[] { 0, 0 } ) ).isNull();
    }

    @Test
    @DisplayName("Should reject chunk offsets off the chunk grid")
    void rejectsMisalignedOffsets() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        List<ChunkEntry> entries = new ArrayList<ChunkEntry>();
        entries.add( new ChunkEntry( new long[] { 2, 0 }, 0x100, 80, 0 ) );
        long root = b.chunkNode( 0, entries );
        ChunkIndex index = new ChunkIndex( createBuf( b, root ), root, CHUNK );
        assertThatThrownBy( () -> index.listChunks() )
            .isInstanceOf( Hdf5FormatException.class )
            .hasMessageContaining( "not aligned" );
    }

    @Test
    @DisplayName("Should refuse version 2 B-trees")
    void rejectsV2Tree() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long root = b.append( new Bytes().ascii( "BTHD" ).zeros( 60 )
                                         .toArray() );
        ChunkIndex index = new ChunkIndex( createBuf( b, root ), root, CHUNK );
        assertThatThrownBy( () -> index.listChunks() )
            .isInstanceOf( UnsupportedFeatureException.class )
            .hasMessageContaining( "version 2 B-tree" );
    }

    @Test
    @DisplayName("Should refuse a group node where a chunk node belongs")
    void rejectsGroupNode() throws Exception {
        Hdf5Builder b = new Hdf5Builder();
        long root = b.append( new Bytes().ascii( "TREE" ).u8( 0 ).u8( 0 )
                                         .u16( 0 ).u64( -1 ).u64( -1 )
                                         .u64( 0 ).toArray() );
        ChunkIndex index = new ChunkIndex( createBuf( b, root ), root, CHUNK );
        assertThatThrownBy( () -> index.findChunk( new long[] { 0, 0 } ) )
            .isInstanceOf( Hdf5FormatException.class )
            .hasMessageContaining( "not a chunk node" );
    }

    /**
     * Writes a two-level tree over chunk coordinates (0,0), (0,1), (1,0)
     * in one leaf and (2,1), (3,0) in another.
     * Chunk data is not written; addresses are 0x1000 * (row+1)
     * + 0x100 * col.
     */
    private static long createTree( Hdf5Builder b ) {
        long[][] coords = { { 0, 0 }, { 0, 1 }, { 1, 0 }, { 2, 1 },
                            { 3, 0 } };
        List<ChunkEntry> leaf1 = new ArrayList<ChunkEntry>();
        List<ChunkEntry> leaf2 = new ArrayList<ChunkEntry>();
        for ( int i = 0; i < coords.length; i++ ) {
            long[] c = coords[ i ];
            long[] offsets = { c[ 0 ] * CHUNK[ 0 ], c[ 1 ] * CHUNK[ 1 ] };
            long addr = 0x1000 * ( c[ 0 ] + 1 ) + 0x100 * c[ 1 ];
            ( i < 3 ? leaf1 : leaf2 )
               .add( new ChunkEntry( offsets, addr, 40 + i, i == 3 ? 1 : 0 ) );
        }
        long leaf1Addr = b.chunkNode( 0, leaf1 );
        long leaf2Addr = b.chunkNode( 0, leaf2 );
        List<ChunkEntry> top = new ArrayList<ChunkEntry>();
        top.add( new ChunkEntry( new long[] { 0, 0 }, leaf1Addr, 0, 0 ) );
        top.add( new ChunkEntry( new long[] { 8, 5 }, leaf2Addr, 0, 0 ) );
        return b.chunkNode( 1, top );
    }

    private static Buf createBuf( Hdf5Builder b, long root ) {
        return Bufs.createBuf( b.build( root ) );
    }
}
