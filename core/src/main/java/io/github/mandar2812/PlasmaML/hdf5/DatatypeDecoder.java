package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.Bufs;
import io.github.mandar2812.PlasmaML.hdf5.record.Pointer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the bytes of a datatype description into a {@link Datatype}.
 *
 * <p>A description starts with an 8-byte header: class and version
 * nibbles, 24 bits of class-specific flags, and the element size.
 * Class-specific properties follow.  Compound, array, enumerated and
 * variable-length types contain further nested descriptions, which are
 * read by the same routine up to a fixed nesting depth.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class DatatypeDecoder {

    /** Maximum nesting depth of datatype descriptions. */
    public static final int MAX_DEPTH = 16;

    private static final Logger logger_ =
        Logger.getLogger( DatatypeDecoder.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private DatatypeDecoder() {
    }

    /**
     * Reads a datatype description from a byte array.
     *
     * @param  bytes  datatype description bytes
     * @return  datatype
     */
    public static Datatype readDatatype( byte[] bytes ) throws IOException {
        return readDatatype( Bufs.createBuf( bytes ), new Pointer( 0 ) );
    }

    /**
     * Reads a datatype description from a buffer.
     * The pointer is left just after the description.
     *
     * @param  buf  buffer
     * @param  ptr  pointer to start of description
     * @return  datatype
     */
    public static Datatype readDatatype( Buf buf, Pointer ptr )
            throws IOException {
        return readDatatype( buf, ptr, 0 );
    }

    /**
     * Reads a datatype description at a given nesting depth.
     *
     * @param  buf  buffer
     * @param  ptr  pointer to start of description
     * @param  depth  nesting depth, 0 at top level
     * @return  datatype
     */
    private static Datatype readDatatype( Buf buf, Pointer ptr, int depth )
            throws IOException {
        if ( depth > MAX_DEPTH ) {
            throw new Hdf5FormatException( "Datatype nesting deeper than "
                                         + MAX_DEPTH );
        }
        int classAndVersion = buf.readUnsignedByte( ptr );
        int version = classAndVersion >> 4;
        DatatypeClass dtClass =
            DatatypeClass.fromCode( classAndVersion & 0x0f );
        int flags = (int) buf.readUnsigned( ptr, 3 );
        long lsize = buf.readUnsignedInt( ptr );
        if ( version < 1 || version > 4 ) {
            throw new UnsupportedFeatureException( "datatype version "
                                                 + version, dtClass.name() );
        }
        if ( lsize > Integer.MAX_VALUE ) {
            throw new Hdf5FormatException( "Datatype size too large: "
                                         + lsize );
        }
        int size = (int) lsize;
        boolean bigend = ( flags & 0x1 ) != 0;
        switch ( dtClass ) {
            case FIXED_POINT: {
                int bitOffset = buf.readUnsignedShort( ptr );
                int precision = buf.readUnsignedShort( ptr );
                checkIntegerSize( size, dtClass );
                return new Datatype.FixedPointType( version, size,
                                                    ( flags & 0x8 ) != 0,
                                                    bigend, bitOffset,
                                                    precision );
            }
            case FLOATING_POINT: {
                ptr.skip( 12 );  // bit offset, precision, exponent, mantissa
                if ( ( flags & 0x40 ) != 0 ) {
                    throw new UnsupportedFeatureException( "VAX float order",
                                                           null );
                }
                if ( size != 2 && size != 4 && size != 8 ) {
                    throw new UnsupportedFeatureException( "float size "
                                                         + size, null );
                }
                return new Datatype.FloatingPointType( version, size, bigend );
            }
            case TIME: {
                ptr.skip( 2 );  // bit precision
                checkIntegerSize( size, dtClass );
                return new Datatype.TimeType( version, size, bigend );
            }
            case STRING:
                return new Datatype.StringType( version, size,
                    Datatype.StringPadding.fromCode( flags & 0xf ),
                    Datatype.StringCharset.fromCode( ( flags >> 4 ) & 0xf ) );
            case BITFIELD: {
                ptr.skip( 4 );  // bit offset, precision
                return new Datatype.BitfieldType( version, size, bigend );
            }
            case OPAQUE: {
                String tag = buf.readAsciiString( ptr, flags & 0xff );
                return new Datatype.OpaqueType( version, size, tag );
            }
            case COMPOUND:
                return readCompound( buf, ptr, version, flags, size, depth );
            case REFERENCE:
                return new Datatype.ReferenceType( version, size, flags & 0xf );
            case ENUMERATED:
                return readEnum( buf, ptr, version, flags, depth );
            case VARIABLE_LENGTH: {
                Datatype base = readDatatype( buf, ptr, depth + 1 );
                boolean isString = ( flags & 0xf ) == 1;
                return new Datatype.VlenType( version, size, base, isString,
                    Datatype.StringPadding.fromCode( ( flags >> 4 ) & 0xf ),
                    Datatype.StringCharset.fromCode( ( flags >> 8 ) & 0xf ) );
            }
            case ARRAY:
                return readArray( buf, ptr, version, size, depth );
            default:
                throw new UnsupportedFeatureException( "datatype class "
                                                     + dtClass, null );
        }
    }

    /**
     * Reads the properties of a compound datatype.
     */
    private static Datatype readCompound( Buf buf, Pointer ptr, int version,
                                          int flags, int size, int depth )
            throws IOException {
        int nmember = flags & 0xffff;
        List<Datatype.Member> members = new ArrayList<Datatype.Member>();
        int offsetWidth = getOffsetWidth( size );
        for ( int im = 0; im < nmember; im++ ) {
            long nameStart = ptr.get();
            String name = buf.readNullTerminatedString( ptr );
            if ( version < 3 ) {
                ptr.align( nameStart, 8 );
            }
            int offset;
            Datatype mtype;
            if ( version == 1 ) {
                offset = buf.readInt( ptr );
                int ndim = buf.readUnsignedByte( ptr );
                ptr.skip( 3 + 4 + 4 );  // reserved, permutation, reserved
                int[] dims = new int[ ndim ];
                for ( int i = 0; i < 4; i++ ) {
                    int d = buf.readInt( ptr );
                    if ( i < ndim ) {
                        dims[ i ] = d;
                    }
                }
                mtype = readDatatype( buf, ptr, depth + 1 );
                if ( ndim > 0 ) {
                    mtype = createArray( version, mtype, dims );
                }
            }
            else if ( version == 2 ) {
                offset = buf.readInt( ptr );
                mtype = readDatatype( buf, ptr, depth + 1 );
            }
            else {
                offset = (int) buf.readUnsigned( ptr, offsetWidth );
                mtype = readDatatype( buf, ptr, depth + 1 );
            }
            if ( offset < 0 || (long) offset + mtype.getSize() > size ) {
                throw new Hdf5FormatException( "Compound member \"" + name
                                             + "\" at offset " + offset
                                             + " (size " + mtype.getSize()
                                             + ") outside " + size
                                             + "-byte compound" );
            }
            members.add( new Datatype.Member( name, offset, mtype ) );
        }
        Datatype.CompoundType ctype =
            new Datatype.CompoundType( version, size, members );
        logger_.config( "Compound datatype: " + ctype );
        return ctype;
    }

    /**
     * Reads the properties of an enumerated datatype.
     */
    private static Datatype readEnum( Buf buf, Pointer ptr, int version,
                                      int flags, int depth )
            throws IOException {
        int nmember = flags & 0xffff;
        Datatype base = readDatatype( buf, ptr, depth + 1 );
        if ( ! ( base instanceof Datatype.FixedPointType ) ) {
            throw new Hdf5FormatException( "Enumeration base type is "
                                         + base.getName()
                                         + ", not an integer" );
        }
        Datatype.FixedPointType ibase = (Datatype.FixedPointType) base;
        List<String> names = new ArrayList<String>( nmember );
        for ( int im = 0; im < nmember; im++ ) {
            long nameStart = ptr.get();
            names.add( buf.readNullTerminatedString( ptr ) );
            if ( version < 3 ) {
                ptr.align( nameStart, 8 );
            }
        }
        int bsize = ibase.getSize();
        byte[] valueBytes = buf.readBytes( ptr, nmember * bsize );
        long[] values = new long[ nmember ];
        for ( int im = 0; im < nmember; im++ ) {
            values[ im ] = ibase.decodeLong( valueBytes, im * bsize );
        }
        return new Datatype.EnumType( version, ibase, names, values );
    }

    /**
     * Reads the properties of an array datatype.
     */
    private static Datatype readArray( Buf buf, Pointer ptr, int version,
                                       int size, int depth )
            throws IOException {
        int ndim = buf.readUnsignedByte( ptr );
        if ( version < 3 ) {
            ptr.skip( 3 );
        }
        int[] dims = new int[ ndim ];
        for ( int i = 0; i < ndim; i++ ) {
            dims[ i ] = buf.readInt( ptr );
        }
        if ( version < 3 ) {
            ptr.skip( 4 * ndim );  // permutation indices
        }
        Datatype base = readDatatype( buf, ptr, depth + 1 );
        Datatype.ArrayType atype = createArray( version, base, dims );
        if ( atype.getSize() != size ) {
            throw new Hdf5FormatException( "Array datatype size " + size
                                         + " does not match "
                                         + atype.getName() );
        }
        return atype;
    }

    /**
     * Creates an array type, enforcing restrictions on its base type.
     *
     * @param  version  description version
     * @param  base  element type
     * @param  dims  dimensions
     * @return  array type
     */
    private static Datatype.ArrayType createArray( int version, Datatype base,
                                                   int[] dims )
            throws IOException {
        DatatypeClass bc = base.getDatatypeClass();
        if ( bc == DatatypeClass.ARRAY || bc == DatatypeClass.COMPOUND ) {
            throw new UnsupportedFeatureException( "array of " + bc,
                                                   base.getName() );
        }
        for ( int d : dims ) {
            if ( d < 0 ) {
                throw new Hdf5FormatException( "Negative array dimension "
                                             + d );
            }
        }
        return new Datatype.ArrayType( version, base, dims );
    }

    /**
     * Checks that an integer-like type has a size this implementation
     * can represent.
     */
    private static void checkIntegerSize( int size, DatatypeClass dtClass )
            throws UnsupportedFeatureException {
        if ( size < 1 || size > 8 ) {
            throw new UnsupportedFeatureException( size + "-byte "
                                                 + dtClass, null );
        }
    }

    /**
     * Returns the number of bytes used to store member offsets in a
     * version 3 compound description, which is the minimum number needed
     * to encode the compound size.
     *
     * @param  size  compound size
     * @return  offset width in bytes
     */
    static int getOffsetWidth( int size ) {
        int n = 1;
        for ( long lim = 256; size >= lim && n < 4; lim <<= 8 ) {
            n++;
        }
        return n;
    }
}
