package io.github.mandar2812.PlasmaML.hdf5.util;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Utilities for controlling logging level.
 *
 * <p>The reader classes log the structures they walk at
 * {@link Level#CONFIG} and anything skipped or ignored at
 * {@link Level#WARNING}, so a verbosity of +1 shows a trace of the
 * file layout as it is read.
 * The library itself never calls this class; it is for host
 * applications that want to set the verbosity of the reader's logging
 * from a command line flag or similar.
 *
 * @author   Mark Taylor
 * @since    21 Jun 2013
 */
public class LogUtil {

    /** Name of the logger which is parent to all the reader loggers. */
    public static final String BASE_LOGGER = "io.github.mandar2812.PlasmaML.hdf5";

    /**
     * Private constructor prevents instantiation.
     */
    private LogUtil() {
    }

    /**
     * Converts a verbosity value to a logging level.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, -1=WARNING)
     * @return  corresponding level
     */
    public static Level getLevel( int verbose ) {
        int ilevel = Level.INFO.intValue() - ( verbose * 100 );
        return Level.parse( Integer.toString( ilevel ) );
    }

    /**
     * Sets the logging verbosity of the HDF5 reader loggers and ensures
     * that logging messages at that level are reported to the console.
     * You'd think this would be simple, but it requires jumping through hoops.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, -1=WARNING)
     * @return  the configured base logger
     */
    public static Logger setVerbosity( int verbose ) {
        Level level = getLevel( verbose );
        Logger baseLogger = Logger.getLogger( BASE_LOGGER );
        baseLogger.setLevel( level );

        // By default the root console handler squashes anything below
        // INFO, so give the base logger its own single-line handler
        // and stop records also going to the root handlers.
        Handler handler = null;
        for ( Handler h : baseLogger.getHandlers() ) {
            if ( h instanceof ConsoleHandler ) {
                handler = h;
            }
        }
        if ( handler == null ) {
            handler = new ConsoleHandler();
            handler.setFormatter( new LineFormatter( false ) );
            baseLogger.addHandler( handler );
        }
        handler.setLevel( level );
        baseLogger.setUseParentHandlers( false );
        return baseLogger;
    }

    /**
     * Compact log record formatter.  Unlike the default
     * {@link java.util.logging.SimpleFormatter} this generally uses only
     * a single line for each record.
     */
    public static class LineFormatter extends Formatter {

        private final boolean debug_;

        /**
         * Constructor.
         *
         * @param   debug  iff true, provides more information per log message
         */
        public LineFormatter( boolean debug ) {
            debug_ = debug;
        }

        public String format( LogRecord record ) {
            StringBuffer sbuf = new StringBuffer();
            sbuf.append( record.getLevel().toString() )
                .append( ": " )
                .append( formatMessage( record ) );
            if ( debug_ ) {
                sbuf.append( ' ' )
                    .append( '(' )
                    .append( record.getSourceClassName() )
                    .append( '.' )
                    .append( record.getSourceMethodName() )
                    .append( ')' );
            }
            sbuf.append( '\n' );
            return sbuf.toString();
        }
    }
}
