package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.Bufs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes the type of the elements stored in a dataset or attribute.
 * There is one concrete subclass for each HDF5 datatype class,
 * and each knows how to decode one element from its stored bytes.
 *
 * <p>Decoded element values are Java objects as follows:
 * <ul>
 * <li>fixed-point: Byte, Short, Integer or Long for signed 1, 2, 4, 8-byte
 *     values; unsigned values are widened (1 to Short, 2 to Integer,
 *     4 to Long) except 8-byte ones which are Long bit patterns</li>
 * <li>floating-point: Float (2 and 4 byte), Double (8 byte)</li>
 * <li>string: String</li>
 * <li>compound: Map of member name to member value, in member order</li>
 * <li>array: List of base type values, flattened row-major</li>
 * <li>enumerated: the integer code, as for its base type</li>
 * <li>opaque: byte[]</li>
 * <li>bitfield, time: Long</li>
 * <li>variable-length: String for strings, List for sequences</li>
 * <li>reference: Long object address, or byte[] for region references</li>
 * </ul>
 *
 * @author   Mark Taylor
 * @since    20 Jun 2013
 */
public abstract class Datatype {

    private final DatatypeClass dtClass_;
    private final int version_;
    private final int size_;

    /**
     * Constructor.
     *
     * @param  dtClass  datatype class
     * @param  version  datatype description version
     * @param  size   number of bytes to store one element
     */
    protected Datatype( DatatypeClass dtClass, int version, int size ) {
        dtClass_ = dtClass;
        version_ = version;
        size_ = size;
    }

    /**
     * Returns the datatype class.
     *
     * @return  class
     */
    public DatatypeClass getDatatypeClass() {
        return dtClass_;
    }

    /**
     * Returns the version of the datatype description this was read from.
     *
     * @return  version
     */
    public int getVersion() {
        return version_;
    }

    /**
     * Returns the number of bytes used to store one element.
     *
     * @return  size in bytes
     */
    public int getSize() {
        return size_;
    }

    /**
     * Returns a short human-readable name for this type,
     * for instance "int16" or "float64".
     *
     * @return  type name
     */
    public abstract String getName();

    /**
     * Decodes one element of this type.
     *
     * @param  data  byte array containing stored element data
     * @param  off   offset into <code>data</code> of element start
     * @param  context  decoding state for heap access
     * @return  decoded value
     */
    public abstract Object decode( byte[] data, int off,
                                   DecodeContext context )
            throws IOException;

    /**
     * Indicates whether this type stores integer values that can be
     * used as numeric codes.
     *
     * @return  true for fixed-point and enumerated types
     */
    public boolean isInteger() {
        return false;
    }

    /**
     * Indicates whether this is the conventional representation of a
     * boolean value, namely a 1-byte integer.
     *
     * @return  true iff elements can be read as booleans
     */
    public boolean isBoolean() {
        return isInteger() && size_ == 1;
    }

    @Override
    public String toString() {
        return getName();
    }

    /**
     * Reads an unsigned integer of up to 8 bytes from a byte array.
     *
     * @param  data  byte array
     * @param  off   offset of first byte
     * @param  nbyte  number of bytes
     * @param  bigEndian  true for big-endian, false for little-endian
     * @return  bit pattern
     */
    static long readBits( byte[] data, int off, int nbyte,
                          boolean bigEndian ) {
        long value = 0;
        for ( int i = 0; i < nbyte; i++ ) {
            int ib = bigEndian ? i : nbyte - 1 - i;
            value = ( value << 8 ) | ( data[ off + ib ] & 0xff );
        }
        return value;
    }

    /**
     * Sign-extends an integer bit pattern of a given width.
     *
     * @param  bits  bit pattern in the low bytes
     * @param  nbyte  width in bytes
     * @return  signed value
     */
    static long signExtend( long bits, int nbyte ) {
        int shift = 64 - 8 * nbyte;
        return shift <= 0 ? bits : ( bits << shift ) >> shift;
    }

    /**
     * Fixed-point (integer) datatype.
     */
    public static class FixedPointType extends Datatype {
        private final boolean isSigned_;
        private final boolean isBigendian_;
        private final int bitOffset_;
        private final int precision_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  isSigned  true for two's complement, false for unsigned
         * @param  isBigendian  byte order
         * @param  bitOffset  offset of first significant bit
         * @param  precision  number of significant bits
         */
        public FixedPointType( int version, int size, boolean isSigned,
                               boolean isBigendian, int bitOffset,
                               int precision ) {
            super( DatatypeClass.FIXED_POINT, version, size );
            isSigned_ = isSigned;
            isBigendian_ = isBigendian;
            bitOffset_ = bitOffset;
            precision_ = precision;
        }

        /**
         * Indicates whether values are signed.
         *
         * @return  true for signed
         */
        public boolean isSigned() {
            return isSigned_;
        }

        /**
         * Returns the byte order.
         *
         * @return  true for big-endian
         */
        public boolean isBigendian() {
            return isBigendian_;
        }

        /**
         * Returns the offset of the first significant bit.
         *
         * @return  bit offset
         */
        public int getBitOffset() {
            return bitOffset_;
        }

        /**
         * Returns the number of significant bits.
         *
         * @return  bit precision
         */
        public int getPrecision() {
            return precision_;
        }

        @Override
        public boolean isInteger() {
            return true;
        }

        public String getName() {
            return ( isSigned_ ? "int" : "uint" ) + ( getSize() * 8 );
        }

        /**
         * Decodes an element as a long value.
         *
         * @param  data  byte array
         * @param  off  element offset
         * @return  value
         */
        public long decodeLong( byte[] data, int off ) {
            int size = getSize();
            long bits = readBits( data, off, size, isBigendian_ );
            return isSigned_ ? signExtend( bits, size ) : bits;
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            long value = decodeLong( data, off );
            switch ( getSize() ) {
                case 1:
                    return isSigned_ ? (Object) Byte.valueOf( (byte) value )
                                     : (Object) Short.valueOf( (short) value );
                case 2:
                    return isSigned_ ? (Object) Short.valueOf( (short) value )
                                     : (Object) Integer.valueOf( (int) value );
                case 4:
                    return isSigned_ ? (Object) Integer.valueOf( (int) value )
                                     : (Object) Long.valueOf( value );
                default:
                    return Long.valueOf( value );
            }
        }
    }

    /**
     * IEEE floating-point datatype.
     */
    public static class FloatingPointType extends Datatype {
        private final boolean isBigendian_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes, 2, 4 or 8
         * @param  isBigendian  byte order
         */
        public FloatingPointType( int version, int size,
                                  boolean isBigendian ) {
            super( DatatypeClass.FLOATING_POINT, version, size );
            isBigendian_ = isBigendian;
        }

        /**
         * Returns the byte order.
         *
         * @return  true for big-endian
         */
        public boolean isBigendian() {
            return isBigendian_;
        }

        public String getName() {
            return "float" + ( getSize() * 8 );
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            long bits = readBits( data, off, getSize(), isBigendian_ );
            switch ( getSize() ) {
                case 2:
                    return Float.valueOf( halfToFloat( (int) bits ) );
                case 4:
                    return Float.valueOf( Float.intBitsToFloat( (int) bits ) );
                default:
                    return Double.valueOf( Double.longBitsToDouble( bits ) );
            }
        }

        /**
         * Converts an IEEE 754 half-precision bit pattern to a float.
         *
         * @param  hbits  16-bit pattern
         * @return  float value
         */
        static float halfToFloat( int hbits ) {
            int sign = ( hbits >> 15 ) & 0x1;
            int exp = ( hbits >> 10 ) & 0x1f;
            int mant = hbits & 0x3ff;
            float value;
            if ( exp == 0 ) {
                value = mant * (float) Math.pow( 2, -24 );
            }
            else if ( exp == 0x1f ) {
                value = mant == 0 ? Float.POSITIVE_INFINITY : Float.NaN;
            }
            else {
                value = ( 1f + mant / 1024f )
                      * (float) Math.pow( 2, exp - 15 );
            }
            return sign == 0 ? value : -value;
        }
    }

    /**
     * Time datatype; elements are integer tick counts.
     */
    public static class TimeType extends Datatype {
        private final boolean isBigendian_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  isBigendian  byte order
         */
        public TimeType( int version, int size, boolean isBigendian ) {
            super( DatatypeClass.TIME, version, size );
            isBigendian_ = isBigendian;
        }

        @Override
        public boolean isInteger() {
            return true;
        }

        public String getName() {
            return "time" + ( getSize() * 8 );
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            long bits = readBits( data, off, getSize(), isBigendian_ );
            return Long.valueOf( signExtend( bits, getSize() ) );
        }
    }

    /**
     * Padding conventions for fixed-length strings.
     */
    public enum StringPadding {

        /** Terminated by a null byte; remaining bytes undefined. */
        NULL_TERMINATE,

        /** Padded with null bytes. */
        NULL_PAD,

        /** Padded with spaces. */
        SPACE_PAD;

        /**
         * Returns the padding for a code stored in the file.
         *
         * @param  code  padding code
         * @return  padding, null terminated for unknown codes
         */
        static StringPadding fromCode( int code ) {
            switch ( code ) {
                case 1: return NULL_PAD;
                case 2: return SPACE_PAD;
                default: return NULL_TERMINATE;
            }
        }
    }

    /**
     * Character encodings for strings.
     */
    public enum StringCharset {
        ASCII, UTF8;

        /**
         * Returns the charset for a code stored in the file.
         *
         * @param  code  charset code
         * @return  charset, ASCII for unknown codes
         */
        static StringCharset fromCode( int code ) {
            return code == 1 ? UTF8 : ASCII;
        }
    }

    /**
     * Fixed-length string datatype.
     */
    public static class StringType extends Datatype {
        private final StringPadding padding_;
        private final StringCharset charset_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  padding  padding convention
         * @param  charset  character encoding
         */
        public StringType( int version, int size, StringPadding padding,
                           StringCharset charset ) {
            super( DatatypeClass.STRING, version, size );
            padding_ = padding;
            charset_ = charset;
        }

        /**
         * Returns the padding convention.
         *
         * @return  padding
         */
        public StringPadding getPadding() {
            return padding_;
        }

        /**
         * Returns the character encoding.
         *
         * @return  charset
         */
        public StringCharset getCharset() {
            return charset_;
        }

        public String getName() {
            return "string[" + getSize() + "]";
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            return decodeString( data, off, getSize(), padding_, charset_ );
        }

        /**
         * Decodes a string of bytes using given conventions.
         *
         * @param  data  byte array
         * @param  off   start of string
         * @param  leng  maximum number of bytes
         * @param  padding  padding convention
         * @param  charset  character encoding
         * @return  string without padding
         */
        static String decodeString( byte[] data, int off, int leng,
                                    StringPadding padding,
                                    StringCharset charset ) {
            int n = 0;
            while ( n < leng && data[ off + n ] != 0 ) {
                n++;
            }
            if ( padding == StringPadding.SPACE_PAD ) {
                while ( n > 0 && data[ off + n - 1 ] == ' ' ) {
                    n--;
                }
            }
            return charset == StringCharset.UTF8
                 ? Bufs.decodeUtf8( data, off, n )
                 : new String( data, off, n, StandardCharsets.ISO_8859_1 );
        }
    }

    /**
     * Bitfield datatype.
     */
    public static class BitfieldType extends Datatype {
        private final boolean isBigendian_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  isBigendian  byte order
         */
        public BitfieldType( int version, int size, boolean isBigendian ) {
            super( DatatypeClass.BITFIELD, version, size );
            isBigendian_ = isBigendian;
        }

        public String getName() {
            return "bitfield" + ( getSize() * 8 );
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            int size = getSize();
            if ( size <= 8 ) {
                return Long.valueOf( readBits( data, off, size,
                                               isBigendian_ ) );
            }
            else {
                return Arrays.copyOfRange( data, off, off + size );
            }
        }
    }

    /**
     * Opaque datatype; elements are uninterpreted byte sequences.
     */
    public static class OpaqueType extends Datatype {
        private final String tag_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  tag   ASCII tag describing the content
         */
        public OpaqueType( int version, int size, String tag ) {
            super( DatatypeClass.OPAQUE, version, size );
            tag_ = tag;
        }

        /**
         * Returns the descriptive tag.
         *
         * @return  tag
         */
        public String getTag() {
            return tag_;
        }

        public String getName() {
            return "opaque[" + getSize() + "]"
                 + ( tag_.length() > 0 ? "(" + tag_ + ")" : "" );
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            return Arrays.copyOfRange( data, off, off + getSize() );
        }
    }

    /**
     * One named member of a compound datatype.
     */
    public static class Member {
        private final String name_;
        private final int offset_;
        private final Datatype type_;

        /**
         * Constructor.
         *
         * @param  name  member name
         * @param  offset  byte offset of member within compound element
         * @param  type  member type
         */
        public Member( String name, int offset, Datatype type ) {
            name_ = name;
            offset_ = offset;
            type_ = type;
        }

        /**
         * Returns the member name.
         *
         * @return  name
         */
        public String getName() {
            return name_;
        }

        /**
         * Returns the byte offset of this member in the compound element.
         *
         * @return  offset
         */
        public int getOffset() {
            return offset_;
        }

        /**
         * Returns the member datatype.
         *
         * @return  type
         */
        public Datatype getType() {
            return type_;
        }
    }

    /**
     * Compound datatype, a record of named members.
     */
    public static class CompoundType extends Datatype {
        private final List<Member> members_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  members  members in file order
         */
        public CompoundType( int version, int size, List<Member> members ) {
            super( DatatypeClass.COMPOUND, version, size );
            members_ =
                Collections.unmodifiableList( new ArrayList<Member>( members ) );
        }

        /**
         * Returns the members.
         *
         * @return  member list
         */
        public List<Member> getMembers() {
            return members_;
        }

        public String getName() {
            StringBuffer sbuf = new StringBuffer( "compound{" );
            for ( int i = 0; i < members_.size(); i++ ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                Member m = members_.get( i );
                sbuf.append( m.getName() )
                    .append( ':' )
                    .append( m.getType().getName() );
            }
            return sbuf.append( '}' ).toString();
        }

        public Object decode( byte[] data, int off, DecodeContext context )
                throws IOException {
            Map<String,Object> map = new LinkedHashMap<String,Object>();
            for ( Member m : members_ ) {
                map.put( m.getName(),
                         m.getType().decode( data, off + m.getOffset(),
                                             context ) );
            }
            return map;
        }
    }

    /**
     * Reference datatype.
     */
    public static class ReferenceType extends Datatype {
        private final int refType_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes
         * @param  refType  0 for object references, 1 for region references
         */
        public ReferenceType( int version, int size, int refType ) {
            super( DatatypeClass.REFERENCE, version, size );
            refType_ = refType;
        }

        /**
         * Indicates whether this is an object reference.
         *
         * @return  true for object references, false for region references
         */
        public boolean isObjectReference() {
            return refType_ == 0;
        }

        public String getName() {
            return isObjectReference() ? "objref" : "regionref";
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            int size = getSize();
            if ( isObjectReference() && size <= 8 ) {
                return Long.valueOf( readBits( data, off, size, false ) );
            }
            else {
                return Arrays.copyOfRange( data, off, off + size );
            }
        }
    }

    /**
     * Enumerated datatype; named values of an integer base type.
     * Elements decode to their integer code, not the member name.
     */
    public static class EnumType extends Datatype {
        private final FixedPointType base_;
        private final List<String> names_;
        private final long[] values_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  base   integer base type
         * @param  names  member names
         * @param  values  member values, same length as names
         */
        public EnumType( int version, FixedPointType base, List<String> names,
                         long[] values ) {
            super( DatatypeClass.ENUMERATED, version, base.getSize() );
            base_ = base;
            names_ = Collections.unmodifiableList( new ArrayList<String>( names ) );
            values_ = values.clone();
        }

        /**
         * Returns the base type.
         *
         * @return  base integer type
         */
        public FixedPointType getBaseType() {
            return base_;
        }

        /**
         * Returns the member names.
         *
         * @return  names in file order
         */
        public List<String> getMemberNames() {
            return names_;
        }

        /**
         * Returns the value of a named member.
         *
         * @param  name  member name
         * @return  integer value, or null if no such member
         */
        public Long getMemberValue( String name ) {
            int i = names_.indexOf( name );
            return i >= 0 ? Long.valueOf( values_[ i ] ) : null;
        }

        /**
         * Returns the name of the member with a given value.
         *
         * @param  value  integer code
         * @return  member name, or null if no member has that value
         */
        public String getMemberName( long value ) {
            for ( int i = 0; i < values_.length; i++ ) {
                if ( values_[ i ] == value ) {
                    return names_.get( i );
                }
            }
            return null;
        }

        @Override
        public boolean isInteger() {
            return true;
        }

        public String getName() {
            return "enum(" + base_.getName() + ")" + names_;
        }

        public Object decode( byte[] data, int off, DecodeContext context ) {
            return base_.decode( data, off, context );
        }
    }

    /**
     * Variable-length datatype, either a string or a sequence of
     * base type elements.  The element bodies live in a global heap.
     */
    public static class VlenType extends Datatype {
        private final Datatype base_;
        private final boolean isString_;
        private final StringPadding padding_;
        private final StringCharset charset_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  size   size in bytes of the stored heap reference
         * @param  base   base type
         * @param  isString  true for strings, false for sequences
         * @param  padding   string padding
         * @param  charset   string encoding
         */
        public VlenType( int version, int size, Datatype base,
                         boolean isString, StringPadding padding,
                         StringCharset charset ) {
            super( DatatypeClass.VARIABLE_LENGTH, version, size );
            base_ = base;
            isString_ = isString;
            padding_ = padding;
            charset_ = charset;
        }

        /**
         * Returns the base type.
         *
         * @return  base type
         */
        public Datatype getBaseType() {
            return base_;
        }

        /**
         * Indicates whether this is a variable-length string type.
         *
         * @return  true for strings
         */
        public boolean isString() {
            return isString_;
        }

        public String getName() {
            return isString_ ? "vlen string"
                             : "vlen<" + base_.getName() + ">";
        }

        public Object decode( byte[] data, int off, DecodeContext context )
                throws IOException {

            // Sequence length, then global heap ID: collection address
            // and object index.
            int count = (int) readBits( data, off, 4, false );
            int addrSize = getSize() - 8;
            long addr = readBits( data, off + 4, addrSize, false );
            int index = (int) readBits( data, off + 4 + addrSize, 4, false );
            if ( count == 0 || addr == 0 ) {
                return isString_ ? (Object) ""
                                 : (Object) new ArrayList<Object>();
            }
            byte[] obj = context.readHeapObject( addr, index );
            if ( isString_ ) {
                return StringType.decodeString( obj, 0,
                                                Math.min( count, obj.length ),
                                                padding_, charset_ );
            }
            int bsize = base_.getSize();
            if ( (long) count * bsize > obj.length ) {
                throw new DataReadException( "Variable-length sequence of "
                                           + count + " elements overruns "
                                           + obj.length + "-byte heap object" );
            }
            List<Object> list = new ArrayList<Object>( count );
            for ( int i = 0; i < count; i++ ) {
                list.add( base_.decode( obj, i * bsize, context ) );
            }
            return list;
        }
    }

    /**
     * Fixed-size array datatype.
     */
    public static class ArrayType extends Datatype {
        private final Datatype base_;
        private final int[] dims_;
        private final int count_;

        /**
         * Constructor.
         *
         * @param  version  description version
         * @param  base   element type
         * @param  dims   array dimensions
         */
        public ArrayType( int version, Datatype base, int[] dims ) {
            super( DatatypeClass.ARRAY, version,
                   base.getSize() * product( dims ) );
            base_ = base;
            dims_ = dims.clone();
            count_ = product( dims );
        }

        /**
         * Returns the element type.
         *
         * @return  base type
         */
        public Datatype getBaseType() {
            return base_;
        }

        /**
         * Returns the array dimensions.
         *
         * @return  dimension extents
         */
        public int[] getDimensions() {
            return dims_.clone();
        }

        public String getName() {
            StringBuffer sbuf = new StringBuffer( base_.getName() );
            for ( int d : dims_ ) {
                sbuf.append( '[' )
                    .append( d )
                    .append( ']' );
            }
            return sbuf.toString();
        }

        public Object decode( byte[] data, int off, DecodeContext context )
                throws IOException {
            List<Object> list = new ArrayList<Object>( count_ );
            int bsize = base_.getSize();
            for ( int i = 0; i < count_; i++ ) {
                list.add( base_.decode( data, off + i * bsize, context ) );
            }
            return list;
        }

        private static int product( int[] dims ) {
            int n = 1;
            for ( int d : dims ) {
                n *= d;
            }
            return n;
        }
    }
}
