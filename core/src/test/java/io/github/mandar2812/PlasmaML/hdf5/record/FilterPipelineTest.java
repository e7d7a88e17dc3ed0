package io.github.mandar2812.PlasmaML.hdf5.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("FilterPipeline")
class FilterPipelineTest {

    private static final FilterPipeline SHUFFLE_DEFLATE =
        new FilterPipeline( Arrays.asList(
            new FilterPipeline.Stage( Filter.SHUFFLE_ID, null, 0,
                                      new int[] { 4 } ),
            new FilterPipeline.Stage( Filter.DEFLATE_ID, "", 1,
                                      new int[] { 4 } ) ) );

    @Test
    @DisplayName("Should reverse the stages in reverse order")
    void decodesAllStages() throws Exception {
        byte[] plain = intBytes( 40 );
        byte[] stored = FilterTest.deflate( shuffle( plain, 4 ) );
        assertThat( SHUFFLE_DEFLATE.decode( stored, 0, 4, plain.length ) )
            .isEqualTo( plain );
    }

    @Test
    @DisplayName("Should reverse shuffle followed by LZF")
    void decodesShuffleLzf() throws Exception {
        FilterPipeline pipe = new FilterPipeline( Arrays.asList(
            new FilterPipeline.Stage( Filter.SHUFFLE_ID, null, 0,
                                      new int[] { 4 } ),
            new FilterPipeline.Stage( Filter.LZF_ID, null, 1,
                                      new int[ 0 ] ) ) );
        byte[] plain = intBytes( 25 );
        byte[] stored = FilterTest.lzfLiterals( shuffle( plain, 4 ) );
        assertThat( stored ).isNotEqualTo( plain );
        assertThat( pipe.decode( stored, 0, 4, plain.length ) )
            .isEqualTo( plain );
        assertThat( pipe.toString() ).isEqualTo( "[shuffle, lzf]" );
    }

    @Test
    @DisplayName("Should fail fast when a chunk inflates past its size")
    void limitsExpansion() {
        byte[] stored = FilterTest.deflate( new byte[ 40000 ] );
        assertThatThrownBy( () -> SHUFFLE_DEFLATE.decode( stored, 0, 4, 40 ) )
            .isInstanceOf( DataReadException.class )
            .hasMessageContaining( "exceeds 40 bytes" );
    }

    @Test
    @DisplayName("Should allow room for a checksum still to be stripped")
    void allowsChecksumRoom() throws Exception {
        FilterPipeline pipe = new FilterPipeline( Arrays.asList(
            new FilterPipeline.Stage( Filter.FLETCHER32_ID, null, 0,
                                      new int[ 0 ] ),
            new FilterPipeline.Stage( Filter.DEFLATE_ID, null, 0,
                                      new int[ 0 ] ) ) );
        byte[] plain = intBytes( 10 );
        long sum = Filter.fletcher32( plain, plain.length );
        byte[] summed = new byte[ plain.length + 4 ];
        System.arraycopy( plain, 0, summed, 0, plain.length );
        for ( int i = 0; i < 4; i++ ) {
            summed[ plain.length + i ] = (byte) ( sum >> ( 8 * i ) );
        }
        assertThat( pipe.decode( FilterTest.deflate( summed ), 0, 1,
                                 plain.length ) )
            .isEqualTo( plain );
    }

    @Test
    @DisplayName("Should skip stages masked off for a chunk")
    void honoursMask() throws Exception {
        byte[] plain = intBytes( 10 );
        byte[] stored = shuffle( plain, 4 );
        assertThat( SHUFFLE_DEFLATE.decode( stored, 0x2, 4, plain.length ) )
            .isEqualTo( plain );
        assertThat( SHUFFLE_DEFLATE.decode( plain, 0x3, 4, plain.length ) )
            .isEqualTo( plain );
    }

    @Test
    @DisplayName("Should fail when the decoded size is wrong")
    void checksSize() {
        byte[] plain = intBytes( 10 );
        assertThatThrownBy( () -> FilterPipeline.EMPTY.decode( plain, 0, 4,
                                                               44 ) )
            .isInstanceOf( DataReadException.class )
            .hasMessageContaining( "expected 44" );
    }

    @Test
    @DisplayName("Should fail on a filter it cannot reverse")
    void rejectsUnknownFilter() {
        FilterPipeline pipe = new FilterPipeline( Arrays.asList(
            new FilterPipeline.Stage( 307, "bzip2", 0, new int[ 0 ] ) ) );
        assertThatThrownBy( () -> pipe.decode( new byte[ 4 ], 0, 4, 4 ) )
            .isInstanceOf( UnsupportedFeatureException.class );
    }

    @Test
    @DisplayName("Should describe its stages")
    void describesStages() {
        assertThat( SHUFFLE_DEFLATE.toString() )
            .isEqualTo( "[shuffle, deflate]" );
        assertThat( SHUFFLE_DEFLATE.getStages().get( 1 ).isOptional() )
            .isTrue();
        assertThat( FilterPipeline.EMPTY.isEmpty() ).isTrue();
    }

    private static byte[] intBytes( int n ) {
        byte[] out = new byte[ 4 * n ];
        for ( int i = 0; i < n; i++ ) {
            out[ 4 * i ] = (byte) i;
            out[ 4 * i + 1 ] = (byte) ( i * 3 );
        }
        return out;
    }

    private static byte[] shuffle( byte[] data, int elSize ) {
        int nel = data.length / elSize;
        byte[] out = new byte[ data.length ];
        for ( int i = 0; i < nel; i++ ) {
            for ( int j = 0; j < elSize; j++ ) {
                out[ j * nel + i ] = data[ i * elSize + j ];
            }
        }
        return out;
    }
}
