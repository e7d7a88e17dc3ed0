package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when the bytes for a structure or a dataset
 * cannot be read as declared: truncated storage, a decompressed chunk
 * of the wrong size, a malformed message body or a missing required
 * message.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class DataReadException extends Hdf5Exception {

    /**
     * Constructs an exception with a message.
     *
     * @param  msg  message
     */
    public DataReadException( String msg ) {
        super( msg );
    }

    /**
     * Constructs an exception with a message and a cause.
     *
     * @param  msg  message
     * @param  cause   upstream exception
     */
    public DataReadException( String msg, Throwable cause ) {
        super( msg, cause );
    }
}
