package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when a path requested as a dataset resolves to
 * an object of some other kind, usually a group.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class NotADatasetException extends DatasetNotFoundException {

    /**
     * Constructor.
     *
     * @param  path  requested path
     * @param  actualType  description of what was found there
     */
    public NotADatasetException( String path, String actualType ) {
        super( path, "Not a dataset: " + path + " is a " + actualType );
    }
}
