package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.MessageType;
import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;

/**
 * Kind of object an object header describes.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public enum ObjectType {

    /** Array of typed elements. */
    DATASET,

    /** Container of named links. */
    GROUP,

    /** Anything else, or an unresolvable path. */
    UNKNOWN;

    /**
     * Works out the object type from the messages in its header.
     * Group messages take precedence; a dataset needs a layout or
     * dataspace message.  A committed datatype counts as unknown.
     *
     * @param  header  object header
     * @return  object type
     */
    public static ObjectType forHeader( ObjectHeader header ) {
        if ( header.hasMessage( MessageType.SYMBOL_TABLE )
             || header.hasMessage( MessageType.LINK )
             || header.hasMessage( MessageType.LINK_INFO )
             || header.hasMessage( MessageType.GROUP_INFO ) ) {
            return GROUP;
        }
        else if ( header.hasMessage( MessageType.LAYOUT )
                  || header.hasMessage( MessageType.DATASPACE ) ) {
            return DATASET;
        }
        else {
            return UNKNOWN;
        }
    }

    /**
     * Returns a lower-case name for this type.
     *
     * @return  name
     */
    public String getName() {
        return name().toLowerCase();
    }
}
