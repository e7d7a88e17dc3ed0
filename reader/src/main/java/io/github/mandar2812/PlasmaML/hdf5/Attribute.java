package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.AttributeMessage;

import java.io.IOException;
import java.util.Arrays;

/**
 * Named metadata item attached to a group or dataset.
 * The value is either a single element or an array of elements.
 *
 * @author   Mark Taylor
 * @since    19 Jun 2013
 */
public class Attribute {

    private final String name_;
    private final Datatype datatype_;
    private final long[] shape_;
    private final Object value_;
    private final boolean isScalar_;

    /**
     * Constructor.
     *
     * @param  name  attribute name
     * @param  datatype  element type
     * @param  shape   dataspace extents
     * @param  value   single element if scalar, else an Object[] array
     * @param  isScalar  true iff there is exactly one element
     */
    public Attribute( String name, Datatype datatype, long[] shape,
                      Object value, boolean isScalar ) {
        name_ = name;
        datatype_ = datatype;
        shape_ = shape.clone();
        value_ = value;
        isScalar_ = isScalar;
    }

    /**
     * Returns this attribute's name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the element type of this attribute.
     *
     * @return  datatype
     */
    public Datatype getDatatype() {
        return datatype_;
    }

    /**
     * Returns the shape of this attribute's dataspace.
     *
     * @return  extents; empty for a scalar dataspace
     */
    public long[] getShape() {
        return shape_.clone();
    }

    /**
     * Returns this attribute's value.
     * That is a single decoded element if {@link #isScalar} is true,
     * and otherwise an <code>Object[]</code> of elements in row-major
     * order.
     *
     * @return  value
     */
    public Object getValue() {
        return value_;
    }

    /**
     * Indicates whether this attribute holds exactly one element.
     *
     * @return  true for a single value
     */
    public boolean isScalar() {
        return isScalar_;
    }

    /**
     * Indicates whether this attribute's value is an array.
     *
     * @return  true iff not scalar
     */
    public boolean isArray() {
        return ! isScalar_;
    }

    @Override
    public String toString() {
        return name_ + "=" + ( value_ instanceof Object[]
                               ? Arrays.deepToString( (Object[]) value_ )
                               : String.valueOf( value_ ) );
    }

    /**
     * Decodes the value held in an attribute message.
     *
     * @param  msg  attribute message
     * @param  context  decoding context
     * @return  attribute
     */
    static Attribute createAttribute( AttributeMessage msg,
                                      DecodeContext context )
            throws IOException {
        Datatype dtype = msg.datatype;
        long count = msg.dataspace.getElementCount();
        int elSize = dtype.getSize();
        Object[] elements = new Object[ (int) count ];
        for ( int i = 0; i < count; i++ ) {
            elements[ i ] = dtype.decode( msg.data, i * elSize, context );
        }
        boolean isScalar = count == 1;
        return new Attribute( msg.name, dtype, msg.dataspace.dims,
                              isScalar ? elements[ 0 ] : elements,
                              isScalar );
    }
}
