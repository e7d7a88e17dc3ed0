package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field data for the Filter Pipeline header message.
 *
 * @author   Mark Taylor
 * @since    15 Feb 2024
 */
public class FilterPipelineMessage extends Message {

    public final int version;
    public final FilterPipeline pipeline;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public FilterPipelineMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.FILTER_PIPELINE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        if ( version != 1 && version != 2 ) {
            throw new UnsupportedFeatureException( "filter pipeline version "
                                                 + version, null );
        }
        int nfilter = buf.readUnsignedByte( ptr );
        if ( version == 1 ) {
            ptr.skip( 6 );
        }
        List<FilterPipeline.Stage> stages =
            new ArrayList<FilterPipeline.Stage>( nfilter );
        for ( int i = 0; i < nfilter; i++ ) {
            int id = buf.readUnsignedShort( ptr );
            int nameLeng = version == 1 || id >= 256
                         ? buf.readUnsignedShort( ptr )
                         : 0;
            int flags = buf.readUnsignedShort( ptr );
            int nvalue = buf.readUnsignedShort( ptr );
            String name = null;
            if ( nameLeng > 0 ) {
                long nameStart = ptr.get();
                name = buf.readNullTerminatedString( ptr );
                ptr.set( nameStart + nameLeng );
                if ( version == 1 ) {
                    ptr.align( nameStart, 8 );
                }
            }
            int[] clientData = readIntArray( buf, ptr, nvalue );
            if ( version == 1 && nvalue % 2 == 1 ) {
                ptr.skip( 4 );
            }
            stages.add( new FilterPipeline.Stage( id, name, flags,
                                                  clientData ) );
        }
        this.pipeline = new FilterPipeline( stages );
        checkEndMessage( ptr );
    }
}
