package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;

import java.io.IOException;

/**
 * Field data for the Object Header Continuation message,
 * which locates a further block of header messages.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class ContinuationMessage extends Message {

    public final long blockAddress;
    public final long blockLength;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public ContinuationMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.CONTINUATION );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.blockAddress = buf.readOffset( ptr );
        this.blockLength = buf.readLength( ptr );
        checkEndMessage( ptr );
    }
}
