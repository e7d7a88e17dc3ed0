package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.Link;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Link header message, used by new-style groups
 * to store each child link in the group's own header.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class LinkMessage extends Message {

    /** Link type code for hard links. */
    public static final int TYPE_HARD = 0;

    /** Link type code for soft links. */
    public static final int TYPE_SOFT = 1;

    /** Link type code for external links. */
    public static final int TYPE_EXTERNAL = 64;

    public final int version;
    public final long creationOrder;
    public final Link link;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public LinkMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.LINK );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        if ( version != 1 ) {
            throw new UnsupportedFeatureException( "link message version "
                                                 + version, null );
        }
        int lflags = buf.readUnsignedByte( ptr );
        int linkType = hasBit( lflags, 3 ) ? buf.readUnsignedByte( ptr )
                                           : TYPE_HARD;
        this.creationOrder = hasBit( lflags, 2 ) ? buf.readLong( ptr ) : -1;
        if ( hasBit( lflags, 4 ) ) {
            ptr.skip( 1 );  // name character set
        }
        int nameLeng = (int) buf.readUnsigned( ptr, 1 << ( lflags & 0x3 ) );
        String name = Bufs.decodeUtf8( buf.readBytes( ptr, nameLeng ), 0,
                                       nameLeng );
        if ( name.length() == 0 ) {
            throw new Hdf5FormatException( "Empty link name" );
        }
        switch ( linkType ) {
            case TYPE_HARD:
                this.link = Link.createHardLink( name, buf.readOffset( ptr ) );
                break;
            case TYPE_SOFT:
                int pathLeng = buf.readUnsignedShort( ptr );
                byte[] pathBytes = buf.readBytes( ptr, pathLeng );
                this.link =
                    Link.createSoftLink( name,
                                         trimNull( Bufs.decodeUtf8( pathBytes,
                                                                    0,
                                                                    pathLeng
                                                                    ) ) );
                break;
            case TYPE_EXTERNAL:
                int infoLeng = buf.readUnsignedShort( ptr );
                long infoEnd = ptr.get() + infoLeng;
                ptr.skip( 1 );  // version and flags
                String fileName = buf.readNullTerminatedString( ptr );
                String objPath = buf.readNullTerminatedString( ptr );
                ptr.set( infoEnd );
                this.link = Link.createExternalLink( name, fileName,
                                                     objPath );
                break;
            default:
                throw new UnsupportedFeatureException( "user-defined link",
                                                       "type " + linkType
                                                     + " for " + name );
        }
        checkEndMessage( ptr );
    }

    private static String trimNull( String txt ) {
        int inull = txt.indexOf( '\0' );
        return inull >= 0 ? txt.substring( 0, inull ) : txt;
    }
}
