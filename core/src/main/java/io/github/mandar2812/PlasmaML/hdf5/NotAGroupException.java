package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when a path requested as a group resolves to
 * an object of some other kind, usually a dataset.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class NotAGroupException extends GroupNotFoundException {

    /**
     * Constructor.
     *
     * @param  path  requested path
     * @param  actualType  description of what was found there
     */
    public NotAGroupException( String path, String actualType ) {
        super( path, "Not a group: " + path + " is a " + actualType );
    }
}
