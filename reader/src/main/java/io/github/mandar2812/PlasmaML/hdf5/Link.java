package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Named edge from a group to another object.
 * A hard link gives the target's header address directly,
 * a soft link gives a path in the same file,
 * and an external link gives a path in another file.
 *
 * @author   Mark Taylor
 * @since    16 Feb 2024
 */
public class Link {

    private final String name_;
    private final Kind kind_;
    private final long address_;
    private final String targetPath_;
    private final String fileName_;

    /**
     * Constructor.
     *
     * @param  name  link name within its group
     * @param  kind  link kind
     * @param  address  target header address, for hard links
     * @param  targetPath  target path, for soft and external links
     * @param  fileName  target file name, for external links
     */
    private Link( String name, Kind kind, long address, String targetPath,
                  String fileName ) {
        name_ = name;
        kind_ = kind;
        address_ = address;
        targetPath_ = targetPath;
        fileName_ = fileName;
    }

    /**
     * Returns a hard link.
     *
     * @param  name  link name
     * @param  address  object header address of target
     * @return  new link
     */
    public static Link createHardLink( String name, long address ) {
        return new Link( name, Kind.HARD, address, null, null );
    }

    /**
     * Returns a soft link.
     *
     * @param  name  link name
     * @param  targetPath  absolute or group-relative target path
     * @return  new link
     */
    public static Link createSoftLink( String name, String targetPath ) {
        return new Link( name, Kind.SOFT, Buf.UNDEFINED_ADDRESS, targetPath,
                         null );
    }

    /**
     * Returns an external link.
     *
     * @param  name  link name
     * @param  fileName  name of file containing target
     * @param  targetPath  path of target within that file
     * @return  new link
     */
    public static Link createExternalLink( String name, String fileName,
                                           String targetPath ) {
        return new Link( name, Kind.EXTERNAL, Buf.UNDEFINED_ADDRESS,
                         targetPath, fileName );
    }

    /**
     * Returns the name of this link within its group.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the kind of this link.
     *
     * @return  kind
     */
    public Kind getKind() {
        return kind_;
    }

    /**
     * Returns the target header address of a hard link.
     *
     * @return  address, or {@link Buf#UNDEFINED_ADDRESS} if not hard
     */
    public long getAddress() {
        return address_;
    }

    /**
     * Returns the target path of a soft or external link.
     *
     * @return  path, or null for hard links
     */
    public String getTargetPath() {
        return targetPath_;
    }

    /**
     * Returns the file name of an external link.
     *
     * @return  file name, or null if not external
     */
    public String getFileName() {
        return fileName_;
    }

    @Override
    public String toString() {
        switch ( kind_ ) {
            case HARD:
                return name_ + " -> 0x" + Long.toHexString( address_ );
            case SOFT:
                return name_ + " -> " + targetPath_;
            default:
                return name_ + " -> " + fileName_ + ":" + targetPath_;
        }
    }

    /**
     * Link kinds.
     */
    public enum Kind {
        HARD, SOFT, EXTERNAL;
    }
}
