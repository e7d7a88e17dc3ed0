package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Enumerates the datatype classes defined by the HDF5 format.
 * The class code is the low nibble of the first byte of a
 * datatype description.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public enum DatatypeClass {

    FIXED_POINT( 0 ),
    FLOATING_POINT( 1 ),
    TIME( 2 ),
    STRING( 3 ),
    BITFIELD( 4 ),
    OPAQUE( 5 ),
    COMPOUND( 6 ),
    REFERENCE( 7 ),
    ENUMERATED( 8 ),
    VARIABLE_LENGTH( 9 ),
    ARRAY( 10 );

    private final int code_;

    /**
     * Constructor.
     *
     * @param  code  class code as stored in the file
     */
    DatatypeClass( int code ) {
        code_ = code;
    }

    /**
     * Returns the class code as stored in the file.
     *
     * @return  class code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns the class with a given code.
     *
     * @param  code  class code
     * @return  datatype class
     * @throws  UnsupportedFeatureException  if the code is not known
     */
    public static DatatypeClass fromCode( int code )
            throws UnsupportedFeatureException {
        for ( DatatypeClass dc : values() ) {
            if ( dc.code_ == code ) {
                return dc;
            }
        }
        throw new UnsupportedFeatureException( "datatype class " + code,
                                               null );
    }
}
