package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Fill Value header messages, old and new styles.
 * The value, if any, gives the element bytes used for parts of a
 * dataset that have not been written.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class FillValueMessage extends Message {

    public final int version;
    public final byte[] value;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     * @param  isOld  true for the old-style message, which has only
     *                a size and value
     */
    public FillValueMessage( MessagePlan plan, boolean isOld )
            throws IOException {
        super( plan, isOld ? MessageType.FILL_VALUE_OLD
                           : MessageType.FILL_VALUE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        if ( isOld ) {
            this.version = 0;
            this.value = readValue( buf, ptr );
        }
        else {
            this.version = buf.readUnsignedByte( ptr );
            if ( version == 1 || version == 2 ) {
                ptr.skip( 2 );  // space allocation time, fill write time
                int defined = buf.readUnsignedByte( ptr );
                this.value = version == 1 || defined != 0
                           ? readValue( buf, ptr )
                           : null;
            }
            else if ( version == 3 ) {
                int flags = buf.readUnsignedByte( ptr );
                this.value = hasBit( flags, 5 ) ? readValue( buf, ptr )
                                                : null;
            }
            else {
                throw new UnsupportedFeatureException( "fill value version "
                                                     + version, null );
            }
        }
        checkEndMessage( ptr );
    }

    /**
     * Reads a size-prefixed value.
     *
     * @return  value bytes, or null if the size is zero
     */
    private static byte[] readValue( Buf buf, Pointer ptr )
            throws IOException {
        int size = buf.readInt( ptr );
        return size > 0 ? buf.readBytes( ptr, size ) : null;
    }
}
