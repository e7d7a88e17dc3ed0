package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.Link;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the links of an old-style group, held as symbol table nodes
 * under a group B-tree with names in a local heap.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public class SymbolTable {

    /**
     * Private constructor prevents instantiation.
     */
    private SymbolTable() {
    }

    /**
     * Returns the links listed in a group's symbol table.
     *
     * @param  buf  buffer
     * @param  stab  symbol table message from the group header
     * @return  links in name order
     */
    public static List<Link> readLinks( Buf buf, SymbolTableMessage stab )
            throws IOException {
        LocalHeap heap = new LocalHeap( buf, stab.localHeapAddress );
        List<Link> links = new ArrayList<Link>();
        if ( stab.btreeAddress != Buf.UNDEFINED_ADDRESS ) {
            addLinks( buf, stab.btreeAddress, -1, heap, links );
        }
        return links;
    }

    /**
     * Adds the links under a group B-tree node to a list.
     *
     * @param  buf  buffer
     * @param  address  node address
     * @param  level  expected node level, or -1 for any
     * @param  heap  local heap holding names
     * @param  links  list to extend
     */
    private static void addLinks( Buf buf, long address, int level,
                                  LocalHeap heap, List<Link> links )
            throws IOException {
        BTreeNode node = new BTreeNode( buf, address, 0 );
        if ( node.nodeType != BTreeNode.TYPE_GROUP ) {
            throw new Hdf5FormatException( "B-tree node at 0x"
                                         + Long.toHexString( address )
                                         + " is not a group node" );
        }
        if ( level >= 0 && node.level != level ) {
            throw new Hdf5FormatException( "B-tree node at 0x"
                                         + Long.toHexString( address )
                                         + " has level " + node.level
                                         + ", expected " + level );
        }
        for ( int i = 0; i < node.entriesUsed; i++ ) {
            if ( node.level == 0 ) {
                SymbolTableNode snod =
                    new SymbolTableNode( buf, node.children[ i ] );
                for ( SymbolTableEntry entry : snod.entries ) {
                    links.add( toLink( entry, heap ) );
                }
            }
            else {
                addLinks( buf, node.children[ i ], node.level - 1, heap,
                          links );
            }
        }
    }

    private static Link toLink( SymbolTableEntry entry, LocalHeap heap )
            throws IOException {
        String name = heap.getString( entry.linkNameOffset );
        if ( entry.cacheType == SymbolTableEntry.CACHE_SOFT_LINK ) {
            return Link.createSoftLink( name,
                                        heap.getString( entry
                                                       .softLinkOffset ) );
        }
        else {
            return Link.createHardLink( name, entry.objectHeaderAddress );
        }
    }
}
