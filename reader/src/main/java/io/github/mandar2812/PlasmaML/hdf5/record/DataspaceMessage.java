package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Dataspace header message,
 * which gives the shape of a dataset or attribute.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class DataspaceMessage extends Message {

    public final int version;
    public final SpaceType spaceType;
    public final long[] dims;
    public final long[] maxDims;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public DataspaceMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.DATASPACE );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        int rank = buf.readUnsignedByte( ptr );
        int flags = buf.readUnsignedByte( ptr );
        if ( version == 1 ) {
            ptr.skip( 5 );
            this.spaceType = rank == 0 ? SpaceType.SCALAR : SpaceType.SIMPLE;
        }
        else if ( version == 2 ) {
            int itype = buf.readUnsignedByte( ptr );
            switch ( itype ) {
                case 0:
                    this.spaceType = SpaceType.SCALAR;
                    break;
                case 1:
                    this.spaceType = SpaceType.SIMPLE;
                    break;
                case 2:
                    this.spaceType = SpaceType.NULL;
                    break;
                default:
                    throw new Hdf5FormatException( "Unknown dataspace type "
                                                 + itype );
            }
        }
        else {
            throw new UnsupportedFeatureException( "dataspace version "
                                                 + version, null );
        }
        this.dims = readLengthArray( buf, ptr, rank );
        this.maxDims = hasBit( flags, 0 )
                     ? readLengthArray( buf, ptr, rank )
                     : null;
        for ( long d : dims ) {
            if ( d < 0 ) {
                throw new Hdf5FormatException( "Negative dataspace extent "
                                             + d );
            }
        }
        checkEndMessage( ptr );
    }

    /**
     * Returns the number of elements in this dataspace.
     *
     * @return  element count; 1 for scalar, 0 for null
     */
    public long getElementCount() {
        if ( spaceType == SpaceType.NULL ) {
            return 0;
        }
        long n = 1;
        for ( long d : dims ) {
            n *= d;
        }
        return n;
    }

    /**
     * Kinds of dataspace.
     */
    public enum SpaceType {

        /** Single element, rank 0. */
        SCALAR,

        /** Rectangular array. */
        SIMPLE,

        /** No elements. */
        NULL;
    }
}
