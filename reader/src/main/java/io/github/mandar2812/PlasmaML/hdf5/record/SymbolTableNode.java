package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;

import java.io.IOException;

/**
 * Field data for a symbol table node (<code>SNOD</code>),
 * a leaf of an old-style group's B-tree holding a run of entries.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class SymbolTableNode {

    public final int version;
    public final SymbolTableEntry[] entries;

    private static final String SIGNATURE = "SNOD";

    /**
     * Constructor.
     *
     * @param  buf  buffer
     * @param  address  node address
     */
    public SymbolTableNode( Buf buf, long address ) throws IOException {
        Pointer ptr = new Pointer( address );
        String sig = buf.readAsciiString( ptr, 4 );
        if ( ! SIGNATURE.equals( sig ) ) {
            throw new Hdf5FormatException( "Bad symbol table node signature \""
                                         + sig + "\" at 0x"
                                         + Long.toHexString( address ) );
        }
        this.version = buf.readUnsignedByte( ptr );
        ptr.skip( 1 );
        int nsym = buf.readUnsignedShort( ptr );
        this.entries = new SymbolTableEntry[ nsym ];
        for ( int i = 0; i < nsym; i++ ) {
            entries[ i ] = new SymbolTableEntry( buf, ptr );
        }
    }
}
