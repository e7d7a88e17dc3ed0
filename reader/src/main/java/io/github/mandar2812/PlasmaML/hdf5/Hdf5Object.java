package io.github.mandar2812.PlasmaML.hdf5;

import io.github.mandar2812.PlasmaML.hdf5.record.AttributeInfoMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.AttributeMessage;
import io.github.mandar2812.PlasmaML.hdf5.record.ObjectHeader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Superclass for the objects, groups and datasets, that can be
 * reached by path in an HDF5 file.
 *
 * @author   Mark Taylor
 * @since    17 Feb 2024
 */
public abstract class Hdf5Object {

    private final Hdf5File file_;
    private final String path_;
    private final ObjectHeader header_;

    private static final Logger logger_ =
        Logger.getLogger( Hdf5Object.class.getName() );

    /**
     * Constructor.
     *
     * @param  file  file containing this object
     * @param  path  absolute path by which this object was reached
     * @param  header  object header
     */
    protected Hdf5Object( Hdf5File file, String path, ObjectHeader header ) {
        file_ = file;
        path_ = path;
        header_ = header;
    }

    /**
     * Returns the file containing this object.
     *
     * @return  file
     */
    public Hdf5File getFile() {
        return file_;
    }

    /**
     * Returns the path by which this object was reached.
     *
     * @return  absolute path
     */
    public String getPath() {
        return path_;
    }

    /**
     * Returns the last element of this object's path.
     *
     * @return  name, or "/" for the root group
     */
    public String getName() {
        int islash = path_.lastIndexOf( '/' );
        return islash >= 0 && islash < path_.length() - 1
             ? path_.substring( islash + 1 )
             : path_;
    }

    /**
     * Returns the object header.
     *
     * @return  header
     */
    public ObjectHeader getHeader() {
        return header_;
    }

    /**
     * Returns the address of this object's header, which identifies it
     * uniquely within the file.
     *
     * @return  header address
     */
    public long getAddress() {
        return header_.getAddress();
    }

    /**
     * Reads the attributes stored in this object's header.
     * Attributes in dense storage are not read.
     *
     * @return  attributes in header order
     */
    public List<Attribute> findAttributes() throws IOException {
        file_.checkOpen();
        DecodeContext context = new DecodeContext( file_.getBuf() );
        List<Attribute> list = new ArrayList<Attribute>();
        for ( AttributeMessage msg :
              header_.getMessages( AttributeMessage.class ) ) {
            list.add( Attribute.createAttribute( msg, context ) );
        }
        AttributeInfoMessage ainfo =
            header_.getMessage( AttributeInfoMessage.class );
        if ( ainfo != null && ainfo.hasDenseStorage() ) {
            logger_.warning( "Densely stored attributes of " + path_
                           + " not read" );
        }
        return list;
    }

    /**
     * Returns a named attribute.
     *
     * @param  name  attribute name
     * @return  attribute, or null if there is none by that name
     */
    public Attribute getAttribute( String name ) throws IOException {
        for ( Attribute att : findAttributes() ) {
            if ( att.getName().equals( name ) ) {
                return att;
            }
        }
        return null;
    }

    /**
     * Returns a summary of this object's metadata, suitable for display.
     *
     * @return  ordered map of metadata items
     */
    public abstract Map<String,Object> inspect() throws IOException;

    /**
     * Returns a map from attribute name to value.
     *
     * @return  ordered attribute map
     */
    protected Map<String,Object> getAttributeMap() throws IOException {
        Map<String,Object> map = new LinkedHashMap<String,Object>();
        for ( Attribute att : findAttributes() ) {
            map.put( att.getName(), att.getValue() );
        }
        return map;
    }

    @Override
    public String toString() {
        return path_;
    }
}
