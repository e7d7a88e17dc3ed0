package io.github.mandar2812.PlasmaML.hdf5;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * Unit in which integer timestamps count time since the Unix epoch.
 *
 * @author   Mark Taylor
 * @since    19 Feb 2024
 */
public enum TimestampUnit {

    /**
     * Decide per value: values greater than {@link #AUTO_THRESHOLD}
     * are milliseconds, others (including all negative values) seconds.
     */
    AUTO,

    /** Seconds since the epoch. */
    SECONDS,

    /** Milliseconds since the epoch. */
    MILLISECONDS;

    /** Values above this are taken as milliseconds in AUTO mode. */
    public static final double AUTO_THRESHOLD = 1e10;

    /**
     * Converts a tick count to an instant.
     *
     * @param  value  integer timestamp
     * @return  instant
     * @throws  DataReadException  if the value is outside the range
     *                             of representable instants
     */
    public Instant toInstant( long value ) throws DataReadException {
        try {
            switch ( this ) {
                case SECONDS:
                    return Instant.ofEpochSecond( value );
                case MILLISECONDS:
                    return Instant.ofEpochMilli( value );
                default:
                    return value > AUTO_THRESHOLD
                         ? Instant.ofEpochMilli( value )
                         : Instant.ofEpochSecond( value );
            }
        }
        catch ( DateTimeException e ) {
            throw new DataReadException( "Timestamp " + value + " ("
                                       + this + ") out of range", e );
        }
    }
}
