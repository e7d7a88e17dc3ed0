package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.DataReadException;
import io.github.mandar2812.PlasmaML.hdf5.Datatype;
import io.github.mandar2812.PlasmaML.hdf5.DatatypeDecoder;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Attribute header message.
 * The message embeds its own datatype and dataspace descriptions
 * followed by the raw attribute value.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class AttributeMessage extends Message {

    public final int version;
    public final String name;
    public final Datatype datatype;
    public final DataspaceMessage dataspace;
    public final byte[] data;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public AttributeMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.ATTRIBUTE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        if ( version < 1 || version > 3 ) {
            throw new UnsupportedFeatureException( "attribute version "
                                                 + version, null );
        }
        int aflags = buf.readUnsignedByte( ptr );
        int nameSize = buf.readUnsignedShort( ptr );
        int dtSize = buf.readUnsignedShort( ptr );
        int dsSize = buf.readUnsignedShort( ptr );
        if ( version == 3 ) {
            ptr.skip( 1 );  // name character set
        }
        if ( version > 1 && ( aflags & 0x3 ) != 0 ) {
            throw new UnsupportedFeatureException( "shared attribute "
                                                 + "datatype or dataspace",
                                                   null );
        }
        boolean pad = version == 1;

        long nameStart = ptr.get();
        this.name = buf.readNullTerminatedString( ptr );
        skipField( ptr, nameStart, nameSize, pad );

        long dtStart = ptr.get();
        this.datatype = DatatypeDecoder.readDatatype( buf, ptr );
        skipField( ptr, dtStart, dtSize, pad );

        long dsStart = ptr.get();
        this.dataspace =
            new DataspaceMessage( new MessagePlan( dsStart, dsSize,
                                                   MessageType.DATASPACE
                                                              .getCode(),
                                                   0, buf ) );
        skipField( ptr, dsStart, dsSize, pad );

        long nbyte = dataspace.getElementCount() * datatype.getSize();
        if ( ptr.get() + nbyte > plan.getStart() + plan.getMessageSize() ) {
            throw new DataReadException( "Attribute " + name + " data ("
                                       + nbyte + " bytes) overruns message" );
        }
        this.data = buf.readBytes( ptr, (int) nbyte );
        checkEndMessage( ptr );
    }

    /**
     * Reads just the name from an attribute message body.
     *
     * @param  plan  basic message information
     * @return  attribute name, or null if the message version is unknown
     */
    public static String readName( MessagePlan plan ) throws IOException {
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        int version = buf.readUnsignedByte( ptr );
        if ( version < 1 || version > 3 ) {
            return null;
        }
        ptr.skip( 7 );
        if ( version == 3 ) {
            ptr.skip( 1 );
        }
        return buf.readNullTerminatedString( ptr );
    }

    private static void skipField( Pointer ptr, long start, int size,
                                   boolean pad ) {
        ptr.set( start + size );
        if ( pad ) {
            ptr.align( start, 8 );
        }
    }
}
