package io.github.mandar2812.PlasmaML.hdf5.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.Datatype;
import io.github.mandar2812.PlasmaML.hdf5.DecodeContext;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.TestBytes;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Global heap collections and the variable-length elements that
 * refer to them.
 */
@Tag("unit")
@DisplayName("GlobalHeap")
class GlobalHeapTest {

    private static final long HEAP_ADDR = 8;

    /**
     * Returns a buffer with some leading padding followed by a heap
     * collection holding "hello" as object 1 and three int32s
     * as object 2.
     */
    private static Buf createHeapBuf() {
        TestBytes tb = new TestBytes().zeros( (int) HEAP_ADDR );
        tb.ascii( "GCOL" ).u8( 1 ).zeros( 3 ).u64( 88 );
        tb.u16( 1 ).u16( 1 ).u32( 0 ).u64( 5 ).ascii( "hello" ).zeros( 3 );
        tb.u16( 2 ).u16( 1 ).u32( 0 ).u64( 12 )
          .u32( 10 ).u32( 20 ).u32( 30 ).zeros( 4 );
        tb.u16( 0 ).u16( 0 ).u32( 0 ).u64( 0 );
        return Bufs.createBuf( tb.toArray() );
    }

    @Test
    @DisplayName("Should index the objects of a collection")
    void readsCollection() throws Exception {
        GlobalHeap heap = GlobalHeap.readHeap( createHeapBuf(), HEAP_ADDR );
        assertThat( heap.getAddress() ).isEqualTo( HEAP_ADDR );
        assertThat( heap.getObjectCount() ).isEqualTo( 2 );
        assertThat( new String( heap.getObject( 1 ), "US-ASCII" ) )
            .isEqualTo( "hello" );
        assertThat( heap.getObject( 2 ) ).hasSize( 12 );
        assertThatThrownBy( () -> heap.getObject( 3 ) )
            .isInstanceOf( DataReadException.class );
    }

    @Test
    @DisplayName("Should reject a bad signature")
    void rejectsBadSignature() {
        assertThatThrownBy( () -> GlobalHeap.readHeap( createHeapBuf(), 0 ) )
            .isInstanceOf( Hdf5FormatException.class );
    }

    @Test
    @DisplayName("Should decode variable-length strings and sequences")
    @SuppressWarnings("unchecked")
    void decodesVlen() throws Exception {
        Datatype u8 = new Datatype.FixedPointType( 1, 1, false, false, 0, 8 );
        Datatype i32 = new Datatype.FixedPointType( 1, 4, true, false, 0, 32 );
        Datatype vstr =
            new Datatype.VlenType( 1, 16, u8, true,
                                   Datatype.StringPadding.NULL_TERMINATE,
                                   Datatype.StringCharset.UTF8 );
        Datatype vseq =
            new Datatype.VlenType( 1, 16, i32, false,
                                   Datatype.StringPadding.NULL_TERMINATE,
                                   Datatype.StringCharset.ASCII );
        DecodeContext context = new DecodeContext( createHeapBuf() );

        byte[] strRef = new TestBytes().u32( 5 ).u64( HEAP_ADDR ).u32( 1 )
                                       .toArray();
        assertThat( vstr.decode( strRef, 0, context ) ).isEqualTo( "hello" );

        byte[] seqRef = new TestBytes().u32( 3 ).u64( HEAP_ADDR ).u32( 2 )
                                       .toArray();
        assertThat( (List<Object>) vseq.decode( seqRef, 0, context ) )
            .containsExactly( 10, 20, 30 );

        byte[] nullRef = new byte[ 16 ];
        assertThat( vstr.decode( nullRef, 0, context ) ).isEqualTo( "" );
    }

    @Test
    @DisplayName("Should detect a sequence longer than its heap object")
    void detectsOverrun() {
        Datatype i32 = new Datatype.FixedPointType( 1, 4, true, false, 0, 32 );
        Datatype vseq =
            new Datatype.VlenType( 1, 16, i32, false,
                                   Datatype.StringPadding.NULL_TERMINATE,
                                   Datatype.StringCharset.ASCII );
        DecodeContext context = new DecodeContext( createHeapBuf() );
        byte[] seqRef = new TestBytes().u32( 4 ).u64( HEAP_ADDR ).u32( 2 )
                                       .toArray();
        assertThatThrownBy( () -> vseq.decode( seqRef, 0, context ) )
            .isInstanceOf( DataReadException.class );
    }
}
