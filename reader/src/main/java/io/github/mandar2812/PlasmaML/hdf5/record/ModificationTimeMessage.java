package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

import java.io.IOException;

/**
 * Field data for the Object Modification Time header message.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class ModificationTimeMessage extends Message {

    public final int version;

    /** Seconds since the Unix epoch. */
    public final long seconds;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public ModificationTimeMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.MODIFICATION_TIME );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        ptr.skip( 3 );
        this.seconds = buf.readUnsignedInt( ptr );
        checkEndMessage( ptr );
    }
}
