package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Datatype;
import io.github.mandar2812.PlasmaML.hdf5.DatatypeDecoder;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Datatype header message.
 * If the message is shared, the datatype is held in the header of
 * a committed datatype object, whose address is given instead.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class DatatypeMessage extends Message {

    public final Datatype datatype;
    public final long sharedAddress;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public DatatypeMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.DATATYPE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        if ( isShared() ) {
            this.sharedAddress = readSharedAddress( buf, ptr );
            this.datatype = null;
        }
        else {
            this.sharedAddress = Buf.UNDEFINED_ADDRESS;
            this.datatype = DatatypeDecoder.readDatatype( buf, ptr );
        }
        checkEndMessage( ptr );
    }

    /**
     * Reads the body of a shared message, which locates the header
     * holding the real message.
     *
     * @param  buf  buffer
     * @param  ptr  pointer to start of shared message body
     * @return  object header address of the shared message
     */
    public static long readSharedAddress( Buf buf, Pointer ptr )
            throws IOException {
        int version = buf.readUnsignedByte( ptr );
        int type = buf.readUnsignedByte( ptr );
        if ( version == 1 ) {
            ptr.skip( 6 );
        }
        else if ( version == 3 && type == 1 ) {
            throw new UnsupportedFeatureException( "shared message heap",
                                                   null );
        }
        else if ( version != 2 && version != 3 ) {
            throw new UnsupportedFeatureException( "shared message version "
                                                 + version, null );
        }
        return buf.readOffset( ptr );
    }
}
