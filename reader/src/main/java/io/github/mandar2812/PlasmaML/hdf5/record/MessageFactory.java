package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * Turns bytes in a buffer into typed and populated header messages.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public class MessageFactory {

    private static final Logger logger_ =
        Logger.getLogger( MessageFactory.class.getName() );

    /**
     * Constructor.
     */
    public MessageFactory() {
    }

    /**
     * Creates a Message object for a message body.
     * The returned object will be an instance of one of the
     * Message subclasses as appropriate for its type.
     *
     * @param  plan  message position, size, type and flags
     * @return  message
     */
    public Message createMessage( MessagePlan plan ) throws IOException {
        MessageType type = MessageType.fromCode( plan.getTypeCode() );
        Message msg = createTypedMessage( type, plan );
        String txt = new StringBuffer()
           .append( "Header message:\t" )
           .append( "0x" )
           .append( Long.toHexString( plan.getStart() ) )
           .append( "\t+" )
           .append( plan.getMessageSize() )
           .append( "\t" )
           .append( msg )
           .toString();
        logger_.config( txt );
        return msg;
    }

    /**
     * Dispatches on message type.
     *
     * @param  type  message type
     * @param  plan  basic message information
     * @return  message
     */
    private Message createTypedMessage( MessageType type, MessagePlan plan )
            throws IOException {

        // Apart from datatypes, shared messages are not followed.
        boolean shared = Message.hasBit( plan.getFlags(), 1 );
        if ( shared && type != MessageType.DATATYPE
                    && type != MessageType.CONTINUATION
                    && type != MessageType.UNKNOWN ) {
            logger_.warning( "Shared " + type.getAbbreviation()
                           + " message not read" );
            return new UnknownMessage( plan, type );
        }
        switch ( type ) {
            case DATASPACE:
                return new DataspaceMessage( plan );
            case LINK_INFO:
                return new LinkInfoMessage( plan );
            case DATATYPE:
                return new DatatypeMessage( plan );
            case FILL_VALUE_OLD:
                return new FillValueMessage( plan, true );
            case FILL_VALUE:
                return new FillValueMessage( plan, false );
            case LINK:
                return new LinkMessage( plan );
            case LAYOUT:
                return new LayoutMessage( plan );
            case FILTER_PIPELINE:
                return new FilterPipelineMessage( plan );
            case ATTRIBUTE:
                return createAttributeMessage( plan );
            case CONTINUATION:
                return new ContinuationMessage( plan );
            case SYMBOL_TABLE:
                return new SymbolTableMessage( plan );
            case MODIFICATION_TIME:
                return new ModificationTimeMessage( plan );
            case ATTRIBUTE_INFO:
                return new AttributeInfoMessage( plan );
            case NIL:
            case GROUP_INFO:
            case UNKNOWN:
                return new UnknownMessage( plan, type );
            default:
                throw new AssertionError( type );
        }
    }

    /**
     * Reads an attribute message, or returns an unknown message
     * if the attribute uses a feature that cannot be read.
     * The object carrying it remains readable.
     *
     * @param  plan  basic message information
     * @return  attribute message, or unknown message
     */
    private Message createAttributeMessage( MessagePlan plan )
            throws IOException {
        try {
            return new AttributeMessage( plan );
        }
        catch ( UnsupportedFeatureException e ) {
            logger_.warning( "Skipping attribute "
                           + AttributeMessage.readName( plan )
                           + " at 0x" + Long.toHexString( plan.getStart() )
                           + ": " + e.getMessage() );
            return new UnknownMessage( plan, MessageType.ATTRIBUTE );
        }
    }
}
