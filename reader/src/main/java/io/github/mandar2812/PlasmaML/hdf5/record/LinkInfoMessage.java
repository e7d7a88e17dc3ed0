package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Link Info header message.
 * A new-style group whose links are too many to keep in its header
 * stores them in a fractal heap indexed by a version 2 B-tree;
 * this message gives the addresses of those structures.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class LinkInfoMessage extends Message {

    public final int version;
    public final long maxCreationIndex;
    public final long fractalHeapAddress;
    public final long nameIndexAddress;
    public final long creationOrderIndexAddress;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public LinkInfoMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.LINK_INFO );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        if ( version != 0 ) {
            throw new UnsupportedFeatureException( "link info version "
                                                 + version, null );
        }
        int iflags = buf.readUnsignedByte( ptr );
        this.maxCreationIndex = hasBit( iflags, 0 ) ? buf.readLong( ptr )
                                                    : -1;
        this.fractalHeapAddress = buf.readOffset( ptr );
        this.nameIndexAddress = buf.readOffset( ptr );
        this.creationOrderIndexAddress = hasBit( iflags, 1 )
                                       ? buf.readOffset( ptr )
                                       : Buf.UNDEFINED_ADDRESS;
        checkEndMessage( ptr );
    }

    /**
     * Indicates whether links are held in dense storage.
     *
     * @return  true iff a fractal heap address is defined
     */
    public boolean hasDenseStorage() {
        return fractalHeapAddress != Buf.UNDEFINED_ADDRESS;
    }
}
