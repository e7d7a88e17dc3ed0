package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

import java.io.IOException;

/**
 * Field data for the Symbol Table header message,
 * which marks an old-style group and locates its B-tree and local heap.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class SymbolTableMessage extends Message {

    public final long btreeAddress;
    public final long localHeapAddress;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public SymbolTableMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.SYMBOL_TABLE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.btreeAddress = buf.readOffset( ptr );
        this.localHeapAddress = buf.readOffset( ptr );
        checkEndMessage( ptr );
    }
}
