package io.github.mandar2812.PlasmaML.hdf5;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when following soft links revisits a link
 * that is already being resolved.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class CircularLinkException extends Hdf5Exception {

    private final List<String> chain_;

    /**
     * Constructor.
     *
     * @param  path  path whose resolution failed
     * @param  chain  link paths visited, in order, ending with the
     *                repeated one
     */
    public CircularLinkException( String path, List<String> chain ) {
        super( "Circular soft link resolving " + path + ": "
             + formatChain( chain ) );
        chain_ = Collections.unmodifiableList( new ArrayList<String>( chain ) );
    }

    /**
     * Returns the sequence of link paths that forms the cycle.
     *
     * @return  visited link paths, last one repeated
     */
    public List<String> getChain() {
        return chain_;
    }

    private static String formatChain( List<String> chain ) {
        StringBuffer sbuf = new StringBuffer();
        for ( String p : chain ) {
            if ( sbuf.length() > 0 ) {
                sbuf.append( " -> " );
            }
            sbuf.append( p );
        }
        return sbuf.toString();
    }
}
