package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Field data for a node of a version 1 B-tree (<code>TREE</code>).
 * Node type 0 trees index the symbol table nodes of old-style groups,
 * and their keys are local heap offsets.
 * Node type 1 trees index the chunks of a chunked dataset,
 * and their keys are {@link ChunkKey}s.
 *
 * <p>A node with <em>n</em> entries has <em>n</em> children and
 * <em>n+1</em> keys; child <em>i</em> covers keys from key <em>i</em>
 * up to key <em>i+1</em>.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public class BTreeNode {

    /** Node type for group trees. */
    public static final int TYPE_GROUP = 0;

    /** Node type for chunk trees. */
    public static final int TYPE_CHUNK = 1;

    public final long address;
    public final int nodeType;
    public final int level;
    public final int entriesUsed;
    public final long leftSibling;
    public final long rightSibling;
    public final long[] children;

    /** Heap offset keys, for group nodes only. */
    public final long[] groupKeys;

    /** Chunk keys, for chunk nodes only. */
    public final ChunkKey[] chunkKeys;

    private static final String SIGNATURE = "TREE";
    private static final String V2_SIGNATURE = "BTHD";
    private static final Logger logger_ =
        Logger.getLogger( BTreeNode.class.getName() );

    /**
     * Constructor.
     *
     * @param  buf  buffer
     * @param  address  node address
     * @param  dimensionality  number of offsets in a chunk key
     *                         (dataset rank + 1); ignored for group nodes
     */
    public BTreeNode( Buf buf, long address, int dimensionality )
            throws IOException {
        Pointer ptr = new Pointer( address );
        String sig = buf.readAsciiString( ptr, 4 );
        if ( V2_SIGNATURE.equals( sig ) ) {
            throw new UnsupportedFeatureException( "version 2 B-tree",
                                                   "at 0x"
                                                 + Long.toHexString(
                                                       address ) );
        }
        if ( ! SIGNATURE.equals( sig ) ) {
            throw new Hdf5FormatException( "Bad B-tree signature \"" + sig
                                         + "\" at 0x"
                                         + Long.toHexString( address ) );
        }
        this.address = address;
        this.nodeType = buf.readUnsignedByte( ptr );
        this.level = buf.readUnsignedByte( ptr );
        this.entriesUsed = buf.readUnsignedShort( ptr );
        this.leftSibling = buf.readOffset( ptr );
        this.rightSibling = buf.readOffset( ptr );
        int n = entriesUsed;
        this.children = new long[ n ];
        if ( nodeType == TYPE_GROUP ) {
            this.groupKeys = new long[ n + 1 ];
            this.chunkKeys = null;
            for ( int i = 0; i < n; i++ ) {
                groupKeys[ i ] = buf.readLength( ptr );
                children[ i ] = buf.readOffset( ptr );
            }
            groupKeys[ n ] = buf.readLength( ptr );
        }
        else if ( nodeType == TYPE_CHUNK ) {
            this.groupKeys = null;
            this.chunkKeys = new ChunkKey[ n + 1 ];
            for ( int i = 0; i < n; i++ ) {
                chunkKeys[ i ] = new ChunkKey( buf, ptr, dimensionality );
                children[ i ] = buf.readOffset( ptr );
            }
            chunkKeys[ n ] = new ChunkKey( buf, ptr, dimensionality );
        }
        else {
            throw new Hdf5FormatException( "Unknown B-tree node type "
                                         + nodeType + " at 0x"
                                         + Long.toHexString( address ) );
        }
        if ( logger_.isLoggable( Level.CONFIG ) ) {
            logger_.config( "B-tree node type " + nodeType + " at 0x"
                          + Long.toHexString( address ) + ": level " + level
                          + ", " + n + " entries" );
        }
    }

    /**
     * Key of a chunk B-tree node.
     */
    public static class ChunkKey {

        /** Stored (filtered) size of the chunk in bytes. */
        public final int size;

        /** Mask of filters not applied to the chunk. */
        public final int filterMask;

        /** Element offsets of the chunk origin, one per dimension plus
         *  a trailing zero for the element size dimension. */
        public final long[] offsets;

        /**
         * Constructor.  The pointer is left after the key.
         *
         * @param  buf  buffer
         * @param  ptr  pointer to key start
         * @param  dimensionality  number of offsets
         */
        ChunkKey( Buf buf, Pointer ptr, int dimensionality )
                throws IOException {
            this.size = buf.readInt( ptr );
            this.filterMask = buf.readInt( ptr );
            this.offsets = new long[ dimensionality ];
            for ( int i = 0; i < dimensionality; i++ ) {
                offsets[ i ] = buf.readLong( ptr );
            }
        }

        /**
         * Compares this key's offsets with a target, lexicographically
         * over the first <code>rank</code> dimensions.
         *
         * @param  target  element offsets
         * @return  negative, zero or positive as this key is before,
         *          equal to or after the target
         */
        public int compareTo( long[] target ) {
            for ( int i = 0; i < target.length; i++ ) {
                if ( offsets[ i ] != target[ i ] ) {
                    return offsets[ i ] < target[ i ] ? -1 : +1;
                }
            }
            return 0;
        }
    }
}
