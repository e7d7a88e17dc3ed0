package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when a path requested as a dataset does not resolve
 * to any object.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class DatasetNotFoundException extends Hdf5Exception {

    private final String path_;

    /**
     * Constructor.
     *
     * @param  path  requested path
     * @param  msg   message
     */
    public DatasetNotFoundException( String path, String msg ) {
        super( msg );
        path_ = path;
    }

    /**
     * Constructs an exception with a standard message.
     *
     * @param  path  requested path
     */
    public DatasetNotFoundException( String path ) {
        this( path, "Dataset not found: " + path );
    }

    /**
     * Returns the path that could not be resolved.
     *
     * @return  dataset path
     */
    public String getPath() {
        return path_;
    }
}
