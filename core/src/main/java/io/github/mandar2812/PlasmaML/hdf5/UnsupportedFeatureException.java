package io.github.mandar2812.PlasmaML.hdf5;

/**
 * Exception thrown when a file uses a legal feature of the HDF5 format
 * which this implementation does not read, for instance version 2 B-trees,
 * densely stored links or an unknown filter.
 *
 * @author   Mark Taylor
 * @since    12 Feb 2024
 */
public class UnsupportedFeatureException extends Hdf5Exception {

    private final String feature_;

    /**
     * Constructor.
     *
     * @param  feature  short name of the unsupported feature
     * @param  detail   further information, or null
     */
    public UnsupportedFeatureException( String feature, String detail ) {
        super( "Unsupported HDF5 feature: " + feature
             + ( detail == null ? "" : " (" + detail + ")" ) );
        feature_ = feature;
    }

    /**
     * Returns the short name of the feature that could not be handled.
     *
     * @return  feature name
     */
    public String getFeature() {
        return feature_;
    }
}
