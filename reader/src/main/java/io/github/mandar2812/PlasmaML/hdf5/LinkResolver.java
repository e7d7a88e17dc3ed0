package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns paths into object headers by walking links from the root group.
 *
 * <p>Soft link targets may be absolute, or relative to the group
 * holding the link, and may use "." and "..".
 * Each soft link being expanded is recorded, identified by the address
 * of its group and its name; meeting one again before its expansion
 * completes means the links form a cycle.
 *
 * @author   Mark Taylor
 * @since    18 Feb 2024
 */
class LinkResolver {

    private final Hdf5File file_;

    private static final Logger logger_ =
        Logger.getLogger( LinkResolver.class.getName() );

    /**
     * Constructor.
     *
     * @param  file  file whose paths are resolved
     */
    LinkResolver( Hdf5File file ) {
        file_ = file;
    }

    /**
     * Locates the header of the object at a path.
     * The type of the final object is not checked, but the requested
     * type determines which exception reports a missing final segment.
     *
     * @param  path  path, absolute or relative to the root
     * @param  wanted  type of object requested
     * @return  header of target object
     * @throws  DatasetNotFoundException  if a requested dataset is missing
     * @throws  GroupNotFoundException  if an intermediate group or a
     *          requested group is missing
     * @throws  CircularLinkException  if soft links form a cycle
     * @throws  UnsupportedFeatureException  if an external link is met
     */
    ObjectHeader resolve( String path, ObjectType wanted )
            throws IOException {
        return resolveSegments( normalize( new ArrayList<String>(), path ),
                                path, wanted, new ArrayList<String>(),
                                new ArrayList<String>() );
    }

    /**
     * Walks a list of segments from the root.
     *
     * @param  segs  normalized path segments
     * @param  requested  path originally requested, for reporting
     * @param  wanted   type of object wanted at the end
     * @param  linkKeys  identifiers of soft links being expanded
     * @param  linkPaths  paths of soft links being expanded
     * @return  header of object at end of path
     */
    private ObjectHeader resolveSegments( List<String> segs, String requested,
                                          ObjectType wanted,
                                          List<String> linkKeys,
                                          List<String> linkPaths )
            throws IOException {
        ObjectHeader header = file_.getRootHeader();
        List<String> current = new ArrayList<String>();
        int nseg = segs.size();
        for ( int is = 0; is < nseg; is++ ) {
            String seg = segs.get( is );
            boolean isLast = is == nseg - 1;
            String groupPath = toPath( current );
            ObjectType groupType = ObjectType.forHeader( header );
            if ( groupType != ObjectType.GROUP ) {
                throw new NotAGroupException( groupPath,
                                              groupType.getName()
                                            + " (resolving " + requested
                                            + ")" );
            }
            Link link =
                Group.findLink( Group.readLinks( file_, header, groupPath ),
                                seg );
            List<String> parent = new ArrayList<String>( current );
            current.add( seg );
            String linkPath = toPath( current );
            if ( link == null ) {
                if ( isLast ) {
                    throw notFound( requested, wanted, linkPath );
                }
                else {
                    throw new GroupNotFoundException( linkPath,
                                                      "Group not found: "
                                                    + linkPath
                                                    + " (resolving "
                                                    + requested + ")" );
                }
            }
            switch ( link.getKind() ) {
                case HARD:
                    header = file_.readHeader( link.getAddress() );
                    break;
                case SOFT:
                    String key = Long.toHexString( header.getAddress() )
                               + "/" + seg;
                    linkPaths.add( linkPath );
                    if ( linkKeys.contains( key ) ) {
                        throw new CircularLinkException( requested,
                                                         linkPaths );
                    }
                    linkKeys.add( key );
                    logger_.config( "Soft link " + linkPath + " -> "
                                  + link.getTargetPath() );
                    List<String> target =
                        normalize( parent, link.getTargetPath() );
                    header = resolveSoft( target, requested,
                                          isLast ? wanted : ObjectType.GROUP,
                                          linkKeys, linkPaths, link,
                                          linkPath );
                    linkKeys.remove( linkKeys.size() - 1 );
                    linkPaths.remove( linkPaths.size() - 1 );
                    break;
                case EXTERNAL:
                    throw new UnsupportedFeatureException( "external link",
                                                           linkPath + " -> "
                                                         + link.getFileName()
                                                         + ":"
                                                         + link
                                                          .getTargetPath() );
                default:
                    throw new AssertionError( link.getKind() );
            }
        }
        return header;
    }

    /**
     * Resolves the target of a soft link, adding the link to the
     * message of any not-found exception.
     */
    private ObjectHeader resolveSoft( List<String> target, String requested,
                                      ObjectType wanted,
                                      List<String> linkKeys,
                                      List<String> linkPaths, Link link,
                                      String linkPath )
            throws IOException {
        String context = "broken soft link " + linkPath + " -> "
                       + link.getTargetPath();
        try {
            return resolveSegments( target, requested, wanted, linkKeys,
                                    linkPaths );
        }
        catch ( NotADatasetException e ) {
            throw e;
        }
        catch ( NotAGroupException e ) {
            throw e;
        }
        catch ( DatasetNotFoundException e ) {
            DatasetNotFoundException e2 =
                new DatasetNotFoundException( requested, e.getMessage()
                                            + "; " + context );
            e2.initCause( e );
            throw e2;
        }
        catch ( GroupNotFoundException e ) {
            GroupNotFoundException e2 =
                new GroupNotFoundException( requested, e.getMessage()
                                          + "; " + context );
            e2.initCause( e );
            throw e2;
        }
    }

    /**
     * Returns the exception for a missing final path segment.
     */
    private static Hdf5Exception notFound( String requested,
                                           ObjectType wanted,
                                           String linkPath ) {
        String where = linkPath.equals( requested )
                     ? requested
                     : requested + " (at " + linkPath + ")";
        switch ( wanted ) {
            case DATASET:
                return new DatasetNotFoundException( requested,
                                                     "Dataset not found: "
                                                   + where );
            case GROUP:
                return new GroupNotFoundException( requested,
                                                   "Group not found: "
                                                 + where );
            default:
                return new GroupNotFoundException( requested,
                                                   "Object not found: "
                                                 + where );
        }
    }

    /**
     * Applies a path to a base list of segments, handling absolute
     * paths, empty segments, "." and "..".
     *
     * @param  base  segments of the group against which relative paths
     *               are resolved
     * @param  path  path text
     * @return  new normalized segment list
     */
    static List<String> normalize( List<String> base, String path ) {
        List<String> segs = path.startsWith( "/" )
                          ? new ArrayList<String>()
                          : new ArrayList<String>( base );
        for ( String seg : path.split( "/" ) ) {
            if ( seg.length() == 0 || ".".equals( seg ) ) {
                continue;
            }
            else if ( "..".equals( seg ) ) {
                if ( ! segs.isEmpty() ) {
                    segs.remove( segs.size() - 1 );
                }
            }
            else {
                segs.add( seg );
            }
        }
        return segs;
    }

    /**
     * Joins segments into an absolute path.
     *
     * @param  segs  segments
     * @return  path starting with "/"
     */
    static String toPath( List<String> segs ) {
        if ( segs.isEmpty() ) {
            return "/";
        }
        StringBuffer sbuf = new StringBuffer();
        for ( String seg : segs ) {
            sbuf.append( '/' ).append( seg );
        }
        return sbuf.toString();
    }
}
