package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown during HDF5 parsing when the data stream appears
 * to be in contravention of the HDF5 format: a missing signature,
 * a structure with the wrong magic bytes, or an inconsistent header.
 *
 * @author   Mark Taylor
 * @since    18 Jun 2013
 */
public class Hdf5FormatException extends Hdf5Exception {

    /**
     * Constructs an exception with a message.
     *
     * @param  msg  message
     */
    public Hdf5FormatException( String msg ) {
        super( msg );
    }

    /**
     * Constructs an exception with a message and a cause.
     *
     * @param  msg  message
     * @param  cause   upstream exception
     */
    public Hdf5FormatException( String msg, Throwable cause ) {
        super( msg, cause );
    }
}
