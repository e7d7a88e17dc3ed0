package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

import java.io.IOException;

/**
 * Field data for one entry in a symbol table node of an old-style group.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class SymbolTableEntry {

    /** Cache type for an entry with a cached symbol table. */
    public static final int CACHE_GROUP = 1;

    /** Cache type for an entry which is a soft link. */
    public static final int CACHE_SOFT_LINK = 2;

    public final long linkNameOffset;
    public final long objectHeaderAddress;
    public final int cacheType;
    public final long softLinkOffset;

    /**
     * Constructor.  The pointer is left after the entry.
     *
     * @param  buf  buffer
     * @param  ptr  pointer to start of entry
     */
    public SymbolTableEntry( Buf buf, Pointer ptr ) throws IOException {
        this.linkNameOffset = buf.readOffset( ptr );
        this.objectHeaderAddress = buf.readOffset( ptr );
        this.cacheType = buf.readInt( ptr );
        ptr.skip( 4 );
        long scratchStart = ptr.get();
        this.softLinkOffset = cacheType == CACHE_SOFT_LINK
                            ? buf.readUnsignedInt( ptr )
                            : -1;
        ptr.set( scratchStart + 16 );
    }

    /**
     * Returns the size in bytes of an entry.
     *
     * @param  buf  buffer with offset size configured
     * @return  entry size
     */
    public static int getEntrySize( Buf buf ) {
        return 2 * buf.getOffsetSize() + 4 + 4 + 16;
    }
}
