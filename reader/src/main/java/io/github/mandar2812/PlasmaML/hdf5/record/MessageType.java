package io.github.mandar2812.PlasmaML.hdf5.record;

/**
 * Header message types understood by the reader.
 * Any other type code maps to {@link #UNKNOWN}.
 *
 * @author   Mark Taylor
 * @since    13 Feb 2024
 */
public enum MessageType {

    NIL( 0x00, "NIL" ),
    DATASPACE( 0x01, "SPACE" ),
    LINK_INFO( 0x02, "LINFO" ),
    DATATYPE( 0x03, "DTYPE" ),
    FILL_VALUE_OLD( 0x04, "FILL0" ),
    FILL_VALUE( 0x05, "FILL" ),
    LINK( 0x06, "LINK" ),
    LAYOUT( 0x08, "LAYOUT" ),
    GROUP_INFO( 0x0a, "GINFO" ),
    FILTER_PIPELINE( 0x0b, "PLINE" ),
    ATTRIBUTE( 0x0c, "ATTR" ),
    CONTINUATION( 0x10, "CONT" ),
    SYMBOL_TABLE( 0x11, "STAB" ),
    MODIFICATION_TIME( 0x12, "MTIME" ),
    ATTRIBUTE_INFO( 0x15, "AINFO" ),
    UNKNOWN( -1, "?" );

    private final int code_;
    private final String abbrev_;

    /**
     * Constructor.
     *
     * @param  code  type code in the header
     * @param  abbrev  short name for logging
     */
    MessageType( int code, String abbrev ) {
        code_ = code;
        abbrev_ = abbrev;
    }

    /**
     * Returns the type code.
     *
     * @return  code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns a short name for this type.
     *
     * @return  abbreviation
     */
    public String getAbbreviation() {
        return abbrev_;
    }

    /**
     * Returns the message type for a type code.
     *
     * @param  code  header type code
     * @return  type, not null
     */
    public static MessageType fromCode( int code ) {
        for ( MessageType type : values() ) {
            if ( type.code_ == code ) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
