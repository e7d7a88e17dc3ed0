package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.LinkInfoMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.LinkMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;
import io.github.mandar2812.PlasmaML.hdf5.record.SymbolTable;
import io.github.mandar2812.PlasmaML.hdf5.record.SymbolTableMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Group in an HDF5 file: a container of named links to other objects.
 *
 * <p>New-style groups keep their links as messages in the group header;
 * old-style groups keep them in a symbol table.  Links of new-style
 * groups held in dense storage are not visible.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public class Group extends Hdf5Object {

    private final List<Link> links_;

    private static final Logger logger_ =
        Logger.getLogger( Group.class.getName() );

    /**
     * Constructor.
     *
     * @param  file  file containing group
     * @param  path  absolute path of group
     * @param  header  group header
     */
    Group( Hdf5File file, String path, ObjectHeader header )
            throws IOException {
        super( file, path, header );
        links_ = Collections.unmodifiableList( readLinks( file, header,
                                                          path ) );
    }

    /**
     * Returns the names of this group's links, in storage order.
     *
     * @return  child names
     */
    public List<String> getChildren() {
        List<String> names = new ArrayList<String>( links_.size() );
        for ( Link link : links_ ) {
            names.add( link.getName() );
        }
        return names;
    }

    /**
     * Returns this group's links.
     *
     * @return  links in storage order
     */
    public List<Link> getLinks() {
        return links_;
    }

    /**
     * Returns the link with a given name.
     *
     * @param  name  child name
     * @return  link, or null if there is no such child
     */
    public Link getLinkInfo( String name ) {
        return findLink( links_, name );
    }

    /**
     * Indicates whether a child is reached by a soft link.
     *
     * @param  name  child name
     * @return  true iff a soft link of that name exists
     */
    public boolean isSoftLink( String name ) {
        return hasKind( name, Link.Kind.SOFT );
    }

    /**
     * Indicates whether a child is reached by a hard link.
     *
     * @param  name  child name
     * @return  true iff a hard link of that name exists
     */
    public boolean isHardLink( String name ) {
        return hasKind( name, Link.Kind.HARD );
    }

    /**
     * Indicates whether a child is reached by an external link.
     *
     * @param  name  child name
     * @return  true iff an external link of that name exists
     */
    public boolean isExternalLink( String name ) {
        return hasKind( name, Link.Kind.EXTERNAL );
    }

    public Map<String,Object> inspect() throws IOException {
        Map<String,Object> map = new LinkedHashMap<String,Object>();
        map.put( "path", getPath() );
        map.put( "type", ObjectType.GROUP.getName() );
        map.put( "childCount", Integer.valueOf( links_.size() ) );
        map.put( "children", getChildren() );
        Map<String,String> linkMap = new LinkedHashMap<String,String>();
        for ( Link link : links_ ) {
            String target;
            switch ( link.getKind() ) {
                case SOFT:
                    target = "soft -> " + link.getTargetPath();
                    break;
                case EXTERNAL:
                    target = "external -> " + link.getFileName() + ":"
                           + link.getTargetPath();
                    break;
                default:
                    target = "hard";
            }
            linkMap.put( link.getName(), target );
        }
        map.put( "links", linkMap );
        Map<String,Object> atts = getAttributeMap();
        if ( ! atts.isEmpty() ) {
            map.put( "attributes", atts );
        }
        return map;
    }

    private boolean hasKind( String name, Link.Kind kind ) {
        Link link = findLink( links_, name );
        return link != null && link.getKind() == kind;
    }

    /**
     * Returns the link of a given name from a list.
     *
     * @param  links  link list
     * @param  name   link name
     * @return  link, or null
     */
    static Link findLink( List<Link> links, String name ) {
        for ( Link link : links ) {
            if ( link.getName().equals( name ) ) {
                return link;
            }
        }
        return null;
    }

    /**
     * Reads all the visible links from a group header.
     *
     * @param  file  file
     * @param  header  group header
     * @param  path   group path, used for reporting
     * @return  links, compact ones first, then symbol table ones
     */
    static List<Link> readLinks( Hdf5File file, ObjectHeader header,
                                 String path )
            throws IOException {
        List<Link> links = new ArrayList<Link>();
        for ( LinkMessage lmsg : header.getMessages( LinkMessage.class ) ) {
            links.add( lmsg.link );
        }
        SymbolTableMessage stab = header.getMessage( SymbolTableMessage.class );
        if ( stab != null ) {
            links.addAll( SymbolTable.readLinks( file.getBuf(), stab ) );
        }
        LinkInfoMessage linfo = header.getMessage( LinkInfoMessage.class );
        if ( linfo != null && linfo.hasDenseStorage() ) {
            logger_.warning( "Densely stored links of group " + path
                           + " not read" );
        }
        return links;
    }
}
