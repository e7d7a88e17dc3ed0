package io.github.mandar2812.PlasmaML.hdf5.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.TestBytes;

import java.io.InputStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("SimpleNioBuf")
class SimpleNioBufTest {

    @Test
    @DisplayName("Should read little-endian integers of any width")
    void readsIntegers() throws Exception {
        Buf buf = Bufs.createBuf( new TestBytes().u8( 0x81 ).u16( 0x1234 )
                                                 .u8( 1 ).u8( 2 ).u8( 3 )
                                                 .u32( 0xfffffffeL )
                                                 .toArray() );
        Pointer ptr = new Pointer( 0 );
        assertThat( buf.readUnsignedByte( ptr ) ).isEqualTo( 0x81 );
        assertThat( buf.readUnsignedShort( ptr ) ).isEqualTo( 0x1234 );
        assertThat( buf.readUnsigned( ptr, 3 ) ).isEqualTo( 0x030201L );
        assertThat( buf.readUnsignedInt( new Pointer( 6 ) ) )
            .isEqualTo( 0xfffffffeL );
        assertThat( buf.readInt( ptr ) ).isEqualTo( -2 );
        assertThat( ptr.get() ).isEqualTo( 10 );
    }

    @Test
    @DisplayName("Should read addresses and lengths at the configured widths")
    void readsOffsetsAndLengths() throws Exception {
        Buf buf = Bufs.createBuf( new TestBytes().u32( 0xffffffffL )
                                                 .u32( 0x100 ).u16( 7 )
                                                 .toArray() );
        buf.setOffsetSize( 4 );
        buf.setLengthSize( 2 );
        Pointer ptr = new Pointer( 0 );
        assertThat( buf.readOffset( ptr ) ).isEqualTo( Buf.UNDEFINED_ADDRESS );
        assertThat( buf.readOffset( ptr ) ).isEqualTo( 0x100 );
        assertThat( buf.readLength( ptr ) ).isEqualTo( 7 );
        assertThat( buf.getOffsetSize() ).isEqualTo( 4 );
    }

    @Test
    @DisplayName("Should read strings")
    void readsStrings() throws Exception {
        Buf buf = Bufs.createBuf( new TestBytes().cstr( "name" )
                                                 .ascii( "HEAP" ).ascii( "x" )
                                                 .toArray() );
        Pointer ptr = new Pointer( 0 );
        assertThat( buf.readNullTerminatedString( ptr ) ).isEqualTo( "name" );
        assertThat( ptr.get() ).isEqualTo( 5 );
        assertThat( buf.readAsciiString( ptr, 4 ) ).isEqualTo( "HEAP" );
        assertThatThrownBy( () -> buf.readNullTerminatedString( ptr ) )
            .isInstanceOf( DataReadException.class );
    }

    @Test
    @DisplayName("Should refuse reads past the end")
    void checksRange() {
        Buf buf = Bufs.createBuf( new byte[ 4 ] );
        assertThatThrownBy( () -> buf.readLong( new Pointer( 0 ) ) )
            .isInstanceOf( DataReadException.class );
        assertThatThrownBy( () -> buf.readDataBytes( 2, 3, new byte[ 3 ] ) )
            .isInstanceOf( DataReadException.class );
    }

    @Test
    @DisplayName("Should address a sub-buffer from its own origin")
    void createsSubBuf() throws Exception {
        byte[] data = { 0, 1, 2, 3, 4, 5, 6, 7 };
        Buf buf = Bufs.createBuf( data );
        Buf sub = buf.subBuf( 3 );
        assertThat( sub.getLength() ).isEqualTo( 5 );
        assertThat( sub.readUnsignedByte( new Pointer( 0 ) ) ).isEqualTo( 3 );
        byte[] out = new byte[ 2 ];
        sub.readDataBytes( 3, 2, out );
        assertThat( out ).containsExactly( 6, 7 );
    }

    @Test
    @DisplayName("Should stream a byte range")
    void streamsRange() throws Exception {
        byte[] data = { 0, 1, 2, 3, 4, 5, 6, 7 };
        Buf buf = Bufs.createBuf( data );
        InputStream in = buf.createInputStream( 2, 4 );
        assertThat( Bufs.readAll( in, 4 ) ).containsExactly( 2, 3, 4, 5 );
    }

    @Test
    @DisplayName("Should align a pointer to a block boundary")
    void alignsPointer() {
        Pointer ptr = new Pointer( 13 );
        ptr.align( 10, 8 );
        assertThat( ptr.get() ).isEqualTo( 18 );
        ptr.align( 10, 8 );
        assertThat( ptr.get() ).isEqualTo( 18 );
        ptr.skip( 3 );
        assertThat( ptr.get() ).isEqualTo( 21 );
    }
}
