package io.github.mandar2812.PlasmaML.hdf5.record;

import io.github.mandar2812.PlasmaML.hdf5.Buf;
import io.github.mandar2812.PlasmaML.hdf5.Hdf5FormatException;
import io.github.mandar2812.PlasmaML.hdf5.UnsupportedFeatureException;

import java.io.IOException;

/**
 * Field data for the Data Layout header message,
 * which says where and how the raw data of a dataset is stored.
 *
 * <p>For chunked storage the recorded chunk dimensions have one more
 * entry than the dataset rank, the last being the element size;
 * {@link #chunkDims} excludes it.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public class LayoutMessage extends Message {

    /** Chunk index type code for a version 1 B-tree. */
    public static final int INDEX_BTREE_V1 = 0;

    /** Chunk index type code for a single chunk. */
    public static final int INDEX_SINGLE_CHUNK = 1;

    /** Chunk index type code for implicit indexing. */
    public static final int INDEX_IMPLICIT = 2;

    /** Chunk index type code for a fixed array. */
    public static final int INDEX_FIXED_ARRAY = 3;

    /** Chunk index type code for an extensible array. */
    public static final int INDEX_EXTENSIBLE_ARRAY = 4;

    /** Chunk index type code for a version 2 B-tree. */
    public static final int INDEX_BTREE_V2 = 5;

    public final int version;
    public final LayoutClass layoutClass;
    public final long address;
    public final long dataSize;
    public final byte[] compactData;
    public final int[] chunkDims;
    public final int chunkElementSize;
    public final int chunkIndexType;
    public final long singleChunkSize;
    public final int singleChunkFilterMask;

    /**
     * Constructor.
     *
     * @param  plan  basic message information
     */
    public LayoutMessage( MessagePlan plan ) throws IOException {
        super( plan, MessageType.LAYOUT );
        Buf buf = plan.getBuf();
        Pointer ptr = plan.createContentPointer();
        this.version = buf.readUnsignedByte( ptr );
        long addr = Buf.UNDEFINED_ADDRESS;
        long dsize = -1;
        byte[] compact = null;
        int[] cdims = null;
        int elSize = 0;
        int indexType = -1;
        long scSize = -1;
        int scMask = 0;
        if ( version == 1 || version == 2 ) {
            int ndim = buf.readUnsignedByte( ptr );
            this.layoutClass = getLayoutClass( buf.readUnsignedByte( ptr ) );
            ptr.skip( 5 );
            if ( layoutClass != LayoutClass.COMPACT ) {
                addr = buf.readOffset( ptr );
            }
            int[] dims = readIntArray( buf, ptr, ndim );
            if ( layoutClass == LayoutClass.CHUNKED ) {
                cdims = chunkShape( dims );
                elSize = dims[ ndim - 1 ];
                indexType = INDEX_BTREE_V1;
            }
            else if ( layoutClass == LayoutClass.COMPACT ) {
                int size = buf.readInt( ptr );
                compact = buf.readBytes( ptr, size );
                dsize = size;
            }
        }
        else if ( version == 3 || version == 4 ) {
            this.layoutClass = getLayoutClass( buf.readUnsignedByte( ptr ) );
            switch ( layoutClass ) {
                case COMPACT:
                    int size = buf.readUnsignedShort( ptr );
                    compact = buf.readBytes( ptr, size );
                    dsize = size;
                    break;
                case CONTIGUOUS:
                    addr = buf.readOffset( ptr );
                    dsize = buf.readLength( ptr );
                    break;
                case CHUNKED:
                    if ( version == 3 ) {
                        int ndim = buf.readUnsignedByte( ptr );
                        addr = buf.readOffset( ptr );
                        int[] dims = readIntArray( buf, ptr, ndim );
                        cdims = chunkShape( dims );
                        elSize = dims[ ndim - 1 ];
                        indexType = INDEX_BTREE_V1;
                    }
                    else {
                        int cflags = buf.readUnsignedByte( ptr );
                        int ndim = buf.readUnsignedByte( ptr );
                        int dimWidth = buf.readUnsignedByte( ptr );
                        int[] dims = new int[ ndim ];
                        for ( int i = 0; i < ndim; i++ ) {
                            dims[ i ] = (int) buf.readUnsigned( ptr,
                                                                dimWidth );
                        }
                        cdims = chunkShape( dims );
                        elSize = dims[ ndim - 1 ];
                        indexType = buf.readUnsignedByte( ptr );
                        switch ( indexType ) {
                            case INDEX_SINGLE_CHUNK:
                                if ( hasBit( cflags, 1 ) ) {
                                    scSize = buf.readLength( ptr );
                                    scMask = buf.readInt( ptr );
                                }
                                break;
                            case INDEX_IMPLICIT:
                                break;
                            case INDEX_FIXED_ARRAY:
                                ptr.skip( 1 );
                                break;
                            case INDEX_EXTENSIBLE_ARRAY:
                                ptr.skip( 5 );
                                break;
                            case INDEX_BTREE_V2:
                                ptr.skip( 6 );
                                break;
                            default:
                                throw new Hdf5FormatException(
                                    "Unknown chunk index type "
                                  + indexType );
                        }
                        addr = buf.readOffset( ptr );
                    }
                    break;
                case VIRTUAL:
                    addr = buf.readOffset( ptr );
                    ptr.skip( 4 );
                    break;
                default:
                    throw new AssertionError( layoutClass );
            }
        }
        else {
            throw new UnsupportedFeatureException( "layout version "
                                                 + version, null );
        }
        this.address = addr;
        this.dataSize = dsize;
        this.compactData = compact;
        this.chunkDims = cdims;
        this.chunkElementSize = elSize;
        this.chunkIndexType = indexType;
        this.singleChunkSize = scSize;
        this.singleChunkFilterMask = scMask;
        checkEndMessage( ptr );
    }

    /**
     * Returns the name of the chunk index type used by this layout.
     *
     * @return  index type name, or null if not chunked
     */
    public String getChunkIndexName() {
        switch ( chunkIndexType ) {
            case INDEX_BTREE_V1: return "btree-v1";
            case INDEX_SINGLE_CHUNK: return "single-chunk";
            case INDEX_IMPLICIT: return "implicit";
            case INDEX_FIXED_ARRAY: return "fixed-array";
            case INDEX_EXTENSIBLE_ARRAY: return "extensible-array";
            case INDEX_BTREE_V2: return "btree-v2";
            default: return null;
        }
    }

    private static int[] chunkShape( int[] dims ) throws Hdf5FormatException {
        if ( dims.length < 1 ) {
            throw new Hdf5FormatException( "Chunked layout with no "
                                         + "dimensions" );
        }
        int[] shape = new int[ dims.length - 1 ];
        System.arraycopy( dims, 0, shape, 0, shape.length );
        return shape;
    }

    private static LayoutClass getLayoutClass( int code )
            throws Hdf5FormatException {
        switch ( code ) {
            case 0: return LayoutClass.COMPACT;
            case 1: return LayoutClass.CONTIGUOUS;
            case 2: return LayoutClass.CHUNKED;
            case 3: return LayoutClass.VIRTUAL;
            default:
                throw new Hdf5FormatException( "Unknown layout class "
                                             + code );
        }
    }

    /**
     * Storage arrangements for dataset raw data.
     */
    public enum LayoutClass {

        /** Data stored in the object header. */
        COMPACT,

        /** Data stored in one contiguous block. */
        CONTIGUOUS,

        /** Data stored in separately indexed chunks. */
        CHUNKED,

        /** Data mapped from other datasets. */
        VIRTUAL;
    }
}
