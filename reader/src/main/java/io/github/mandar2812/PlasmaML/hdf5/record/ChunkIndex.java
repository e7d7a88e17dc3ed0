package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Navigates the version 1 B-tree which indexes the chunks of
 * a chunked dataset.
 * Nothing is cached; each call reads the nodes it needs.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public class ChunkIndex {

    private final Buf buf_;
    private final long rootAddress_;
    private final int[] chunkShape_;

    /**
     * Constructor.
     *
     * @param  buf  buffer
     * @param  rootAddress  address of root node
     * @param  chunkShape  chunk extent in each dataset dimension
     */
    public ChunkIndex( Buf buf, long rootAddress, int[] chunkShape ) {
        buf_ = buf;
        rootAddress_ = rootAddress;
        chunkShape_ = chunkShape.clone();
    }

    /**
     * Returns all the stored chunks, in key order.
     *
     * @return  chunk list
     */
    public List<ChunkRecord> listChunks() throws IOException {
        List<ChunkRecord> list = new ArrayList<ChunkRecord>();
        if ( rootAddress_ != Buf.UNDEFINED_ADDRESS ) {
            addChunks( readNode( rootAddress_, -1 ), list );
        }
        return list;
    }

    /**
     * Locates the stored chunk at a given chunk grid coordinate.
     *
     * @param  coord  chunk indices
     * @return  chunk, or null if none is stored there
     */
    public ChunkRecord findChunk( long[] coord ) throws IOException {
        if ( rootAddress_ == Buf.UNDEFINED_ADDRESS ) {
            return null;
        }
        long[] target = new long[ coord.length ];
        for ( int i = 0; i < coord.length; i++ ) {
            target[ i ] = coord[ i ] * chunkShape_[ i ];
        }
        BTreeNode node = readNode( rootAddress_, -1 );
        while ( true ) {
            int n = node.entriesUsed;
            if ( node.level == 0 ) {
                for ( int i = 0; i < n; i++ ) {
                    if ( node.chunkKeys[ i ].compareTo( target ) == 0 ) {
                        return createRecord( node.chunkKeys[ i ],
                                             node.children[ i ] );
                    }
                }
                return null;
            }

            // Take the last child whose left key does not exceed the target.
            int ichild = -1;
            for ( int i = 0; i < n; i++ ) {
                if ( node.chunkKeys[ i ].compareTo( target ) <= 0 ) {
                    ichild = i;
                }
                else {
                    break;
                }
            }
            if ( ichild < 0 ) {
                return null;
            }
            node = readNode( node.children[ ichild ], node.level - 1 );
        }
    }

    /**
     * Adds the chunks under a node to a list, depth first.
     */
    private void addChunks( BTreeNode node, List<ChunkRecord> list )
            throws IOException {
        for ( int i = 0; i < node.entriesUsed; i++ ) {
            if ( node.level == 0 ) {
                list.add( createRecord( node.chunkKeys[ i ],
                                        node.children[ i ] ) );
            }
            else {
                addChunks( readNode( node.children[ i ], node.level - 1 ),
                           list );
            }
        }
    }

    /**
     * Reads a chunk tree node, checking its type and level.
     *
     * @param  address  node address
     * @param  level   expected level, or -1 for any
     */
    private BTreeNode readNode( long address, int level ) throws IOException {
        BTreeNode node = new BTreeNode( buf_, address, chunkShape_.length + 1 );
        if ( node.nodeType != BTreeNode.TYPE_CHUNK ) {
            throw new Hdf5FormatException( "B-tree node at 0x"
                                         + Long.toHexString( address )
                                         + " is not a chunk node" );
        }
        if ( level >= 0 && node.level != level ) {
            throw new Hdf5FormatException( "B-tree node at 0x"
                                         + Long.toHexString( address )
                                         + " has level " + node.level
                                         + ", expected " + level );
        }
        return node;
    }

    private ChunkRecord createRecord( BTreeNode.ChunkKey key, long address )
            throws Hdf5FormatException {
        int rank = chunkShape_.length;
        long[] coord = new long[ rank ];
        for ( int i = 0; i < rank; i++ ) {
            long off = key.offsets[ i ];
            if ( off % chunkShape_[ i ] != 0 ) {
                throw new Hdf5FormatException( "Chunk offset " + off
                                             + " not aligned to chunk size "
                                             + chunkShape_[ i ] );
            }
            coord[ i ] = off / chunkShape_[ i ];
        }
        return new ChunkRecord( coord, address, key.size & 0xffffffffL,
                                key.filterMask );
    }
}
