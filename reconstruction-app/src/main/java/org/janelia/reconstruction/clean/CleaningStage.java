package org.janelia.reconstruction.clean;

/**
 * Sequential stages of a cleaning run, in execution order.
 */
public enum CleaningStage {
    DETECT_FORMAT,
    CAMERA_OUTLIERS,
    SPATIAL_FILTER,
    REFERENCE_REPAIR,
    ASSEMBLE_OUTPUT
}
