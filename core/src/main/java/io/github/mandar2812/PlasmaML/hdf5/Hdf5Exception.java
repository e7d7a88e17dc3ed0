package io.github.mandar2812.PlasmaML.hdf5;

import java.io.IOException;

/**
 * Superclass of the exceptions thrown while reading an HDF5 file.
 * Subclasses distinguish malformed input, unresolvable paths,
 * unsupported format features, link cycles and data read failures,
 * so that callers can react to each case separately while still being
 * able to treat them all as I/O failures.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public class Hdf5Exception extends IOException {

    /**
     * Constructs an exception with a message.
     *
     * @param  msg  message
     */
    public Hdf5Exception( String msg ) {
        super( msg );
    }

    /**
     * Constructs an exception with a message and a cause.
     *
     * @param  msg  message
     * @param  cause   upstream exception
     */
    public Hdf5Exception( String msg, Throwable cause ) {
        super( msg );
        initCause( cause );
    }
}
