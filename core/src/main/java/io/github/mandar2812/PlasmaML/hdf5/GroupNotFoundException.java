package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when a group path, or an intermediate path segment
 * on the way to some other object, does not resolve.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class GroupNotFoundException extends Hdf5Exception {

    private final String path_;

    /**
     * Constructor.
     *
     * @param  path  requested path
     * @param  msg   message
     */
    public GroupNotFoundException( String path, String msg ) {
        super( msg );
        path_ = path;
    }

    /**
     * Constructs an exception with a standard message.
     *
     * @param  path  requested path
     */
    public GroupNotFoundException( String path ) {
        this( path, "Group not found: " + path );
    }

    /**
     * Returns the path that could not be resolved.
     *
     * @return  group path
     */
    public String getPath() {
        return path_;
    }
}
