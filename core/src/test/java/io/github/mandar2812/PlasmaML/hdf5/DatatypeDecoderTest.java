package io.github.mandar2812.PlasmaML.hdf5;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Decoding of datatype descriptions and of elements with the
 * resulting types.
 */
@Tag("unit")
@DisplayName("DatatypeDecoder")
class DatatypeDecoderTest {

    @Test
    @DisplayName("Should decode a signed 32-bit integer type")
    void readsSignedInt() throws Exception {
        Datatype dt = DatatypeDecoder.readDatatype( TestBytes.int32Type() );
        assertThat( dt ).isInstanceOf( Datatype.FixedPointType.class );
        assertThat( dt.getSize() ).isEqualTo( 4 );
        assertThat( dt.getName() ).isEqualTo( "int32" );
        assertThat( dt.isInteger() ).isTrue();
        assertThat( dt.isBoolean() ).isFalse();
        byte[] data = new TestBytes().u32( -2 ).toArray();
        assertThat( dt.decode( data, 0, null ) ).isEqualTo( -2 );
    }

    @Test
    @DisplayName("Should widen unsigned integers to the next signed type")
    void widensUnsigned() throws Exception {
        Datatype u8 = new Datatype.FixedPointType( 1, 1, false, false, 0, 8 );
        Datatype u32 =
            new Datatype.FixedPointType( 1, 4, false, false, 0, 32 );
        Datatype u64 =
            new Datatype.FixedPointType( 1, 8, false, false, 0, 64 );
        byte[] ones = new byte[ 8 ];
        Arrays.fill( ones, (byte) 0xff );
        assertThat( u8.decode( ones, 0, null ) )
            .isEqualTo( Short.valueOf( (short) 255 ) );
        assertThat( u32.decode( ones, 0, null ) )
            .isEqualTo( Long.valueOf( 4294967295L ) );
        assertThat( u64.decode( ones, 0, null ) )
            .isEqualTo( Long.valueOf( -1L ) );
    }

    @Test
    @DisplayName("Should honour big-endian byte order")
    void readsBigEndian() throws Exception {
        Datatype dt = new Datatype.FixedPointType( 1, 2, true, true, 0, 16 );
        byte[] data = { 0x01, 0x02 };
        assertThat( dt.decode( data, 0, null ) )
            .isEqualTo( Short.valueOf( (short) 0x0102 ) );
    }

    @Test
    @DisplayName("Should decode double and half precision floats")
    void readsFloats() throws Exception {
        Datatype dt = DatatypeDecoder.readDatatype( TestBytes.float64Type() );
        assertThat( dt.getName() ).isEqualTo( "float64" );
        byte[] data = ByteBuffer.allocate( 8 )
                                .order( ByteOrder.LITTLE_ENDIAN )
                                .putDouble( 1.5 ).array();
        assertThat( dt.decode( data, 0, null ) ).isEqualTo( 1.5 );

        Datatype half = new Datatype.FloatingPointType( 1, 2, false );
        assertThat( half.decode( new byte[] { 0x00, 0x3c }, 0, null ) )
            .isEqualTo( 1.0f );
        assertThat( half.decode( new byte[] { 0x00, (byte) 0xc0 }, 0, null ) )
            .isEqualTo( -2.0f );
    }

    @Test
    @DisplayName("Should strip padding from fixed-length strings")
    void readsStrings() throws Exception {
        byte[] nullPad = new TestBytes().u8( 0x13 ).u8( 0x01 ).u8( 0 ).u8( 0 )
                                        .u32( 6 ).toArray();
        Datatype dt = DatatypeDecoder.readDatatype( nullPad );
        assertThat( dt.getName() ).isEqualTo( "string[6]" );
        assertThat( dt.decode( new TestBytes().ascii( "abc" ).zeros( 3 )
                                              .toArray(), 0, null ) )
            .isEqualTo( "abc" );

        byte[] spacePad = new TestBytes().u8( 0x13 ).u8( 0x02 ).u8( 0 )
                                         .u8( 0 ).u32( 5 ).toArray();
        Datatype sdt = DatatypeDecoder.readDatatype( spacePad );
        assertThat( sdt.decode( new TestBytes().ascii( "ab   " ).toArray(),
                                0, null ) )
            .isEqualTo( "ab" );
    }

    @Test
    @DisplayName("Should decode an enumeration to its integer codes")
    void readsEnum() throws Exception {
        byte[] desc = new TestBytes().u8( 0x38 ).u8( 3 ).u8( 0 ).u8( 0 )
                                     .u32( 1 )
                                     .bytes( TestBytes.uint8Type() )
                                     .cstr( "RED" ).cstr( "GREEN" )
                                     .cstr( "BLUE" )
                                     .u8( 0 ).u8( 1 ).u8( 2 )
                                     .toArray();
        Datatype dt = DatatypeDecoder.readDatatype( desc );
        assertThat( dt ).isInstanceOf( Datatype.EnumType.class );
        Datatype.EnumType et = (Datatype.EnumType) dt;
        assertThat( et.getMemberNames() )
            .containsExactly( "RED", "GREEN", "BLUE" );
        assertThat( et.getMemberName( 2 ) ).isEqualTo( "BLUE" );
        assertThat( et.getMemberValue( "GREEN" ) ).isEqualTo( 1L );
        assertThat( et.getMemberValue( "PURPLE" ) ).isNull();
        assertThat( dt.decode( new byte[] { 1 }, 0, null ) )
            .isEqualTo( Short.valueOf( (short) 1 ) );
    }

    @Test
    @DisplayName("Should decode a compound with an integer array member")
    @SuppressWarnings("unchecked")
    void readsCompoundWithArray() throws Exception {
        byte[] arrayType = new TestBytes().u8( 0x3a ).u8( 0 ).u8( 0 ).u8( 0 )
                                          .u32( 12 ).u8( 1 ).u32( 3 )
                                          .bytes( TestBytes.int32Type() )
                                          .toArray();
        byte[] desc = new TestBytes().u8( 0x36 ).u8( 2 ).u8( 0 ).u8( 0 )
                                     .u32( 16 )
                                     .cstr( "id" ).u8( 0 )
                                     .bytes( TestBytes.int32Type() )
                                     .cstr( "vals" ).u8( 4 )
                                     .bytes( arrayType )
                                     .toArray();
        Datatype dt = DatatypeDecoder.readDatatype( desc );
        assertThat( dt.getName() )
            .isEqualTo( "compound{id:int32, vals:int32[3]}" );
        byte[] data = new TestBytes().u32( 7 ).u32( 1 ).u32( 2 ).u32( 3 )
                                     .toArray();
        Map<String,Object> value = (Map<String,Object>) dt.decode( data, 0,
                                                                   null );
        assertThat( value ).containsOnlyKeys( "id", "vals" );
        assertThat( value.get( "id" ) ).isEqualTo( 7 );
        assertThat( (List<Object>) value.get( "vals" ) )
            .containsExactly( 1, 2, 3 );
    }

    @Test
    @DisplayName("Should reject a compound member outside the compound")
    void rejectsOverhangingMember() {
        byte[] desc = new TestBytes().u8( 0x36 ).u8( 1 ).u8( 0 ).u8( 0 )
                                     .u32( 16 )
                                     .cstr( "x" ).u8( 14 )
                                     .bytes( TestBytes.int32Type() )
                                     .toArray();
        assertThatThrownBy( () -> DatatypeDecoder.readDatatype( desc ) )
            .isInstanceOf( Hdf5FormatException.class )
            .hasMessageContaining( "\"x\"" );
    }

    @Test
    @DisplayName("Should refuse arrays of compounds")
    void rejectsArrayOfCompound() {
        byte[] compound = new TestBytes().u8( 0x36 ).u8( 1 ).u8( 0 ).u8( 0 )
                                         .u32( 4 ).cstr( "x" ).u8( 0 )
                                         .bytes( TestBytes.int32Type() )
                                         .toArray();
        byte[] desc = new TestBytes().u8( 0x3a ).u8( 0 ).u8( 0 ).u8( 0 )
                                     .u32( 8 ).u8( 1 ).u32( 2 )
                                     .bytes( compound ).toArray();
        assertThatThrownBy( () -> DatatypeDecoder.readDatatype( desc ) )
            .isInstanceOf( UnsupportedFeatureException.class );
    }

    @Test
    @DisplayName("Should refuse description version 0")
    void rejectsBadVersion() {
        byte[] desc = new TestBytes().u8( 0x00 ).u8( 0 ).u8( 0 ).u8( 0 )
                                     .u32( 4 ).u16( 0 ).u16( 32 ).toArray();
        assertThatThrownBy( () -> DatatypeDecoder.readDatatype( desc ) )
            .isInstanceOf( UnsupportedFeatureException.class );
    }

    @Test
    @DisplayName("Should stop at the nesting limit")
    void limitsNesting() {
        TestBytes tb = new TestBytes();
        for ( int i = 0; i < DatatypeDecoder.MAX_DEPTH + 4; i++ ) {
            tb.u8( 0x19 ).u8( 0 ).u8( 0 ).u8( 0 ).u32( 16 );
        }
        byte[] desc = tb.bytes( TestBytes.uint8Type() ).toArray();
        assertThatThrownBy( () -> DatatypeDecoder.readDatatype( desc ) )
            .isInstanceOf( Hdf5FormatException.class )
            .hasMessageContaining( "nesting" );
    }
}
