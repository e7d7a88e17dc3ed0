package io.github.mandar2812.PlasmaML.hdf5.record;

/**
 * Header message whose content is not read.
 * Used for the NIL padding message, for group info, and for any
 * message type the reader does not need.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class UnknownMessage extends Message {

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     * @param  type  message type
     */
    public UnknownMessage( MessagePlan plan, MessageType type ) {
        super( plan, type );
    }

    @Override
    public String toString() {
        return getMessageType() == MessageType.UNKNOWN
             ? "0x" + Integer.toHexString( getTypeCode() )
             : super.toString();
    }
}
