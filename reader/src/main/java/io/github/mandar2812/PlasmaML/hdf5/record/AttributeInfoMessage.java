package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Attribute Info header message.
 * Like {@link LinkInfoMessage}, but for attributes.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class AttributeInfoMessage extends Message {

    public final int version;
    public final int maxCreationIndex;
    public final long fractalHeapAddress;
    public final long nameIndexAddress;
    public final long creationOrderIndexAddress;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public AttributeInfoMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.ATTRIBUTE_INFO );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        if ( version != 0 ) {
            throw new UnsupportedFeatureException( "attribute info version "
                                                 + version, null );
        }
        int iflags = buf.readUnsignedByte( ptr );
        this.maxCreationIndex = hasBit( iflags, 0 )
                              ? buf.readUnsignedShort( ptr )
                              : -1;
        this.fractalHeapAddress = buf.readOffset( ptr );
        this.nameIndexAddress = buf.readOffset( ptr );
        this.creationOrderIndexAddress = hasBit( iflags, 1 )
                                       ? buf.readOffset( ptr )
                                       : Buf.UNDEFINED_ADDRESS;
        checkEndMessage( ptr );
    }

    /**
     * Indicates whether attributes are held in dense storage.
     *
     * @return  true iff a fractal heap address is defined
     */
    public boolean hasDenseStorage() {
        return fractalHeapAddress != Buf.UNDEFINED_ADDRESS;
    }
}
