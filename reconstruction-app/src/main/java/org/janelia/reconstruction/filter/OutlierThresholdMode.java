package org.janelia.reconstruction.filter;

/**
 * How the camera outlier distance threshold is chosen.
 */
public enum OutlierThresholdMode {

    /** Derive the threshold from the distribution of camera distances. */
    AUTO,

    /** Use an explicitly configured threshold. */
    FIXED

}
