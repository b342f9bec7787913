package org.janelia.reconstruction.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.janelia.reconstruction.model.CoordinateRanges;

/**
 * Result of a camera outlier analysis: the kept/outlier partition and the diagnostics used to derive it.
 */
public class CameraOutlierAnalysis implements Serializable {

    private final int totalCameras;
    private final int keptCameras;
    private final int outlierCount;
    private final double[] medianPosition;
    private final CoordinateRanges ranges;
    private final OutlierThresholdMode thresholdMode;
    private final double autoThreshold;
    private final double thresholdUsed;
    private final List<CameraOutlier> outliers;
    private final String thresholdWarning;

    @JsonIgnore
    private final Set<Long> outlierImageIds;

    @SuppressWarnings("unused")
    private CameraOutlierAnalysis() {
        this(0, null, null, OutlierThresholdMode.AUTO, 0.0, 0.0, Collections.emptyList(), null);
    }

    public CameraOutlierAnalysis(final int totalCameras,
                                 final double[] medianPosition,
                                 final CoordinateRanges ranges,
                                 final OutlierThresholdMode thresholdMode,
                                 final double autoThreshold,
                                 final double thresholdUsed,
                                 final List<CameraOutlier> outliers,
                                 final String thresholdWarning) {
        this.totalCameras = totalCameras;
        this.keptCameras = totalCameras - outliers.size();
        this.outlierCount = outliers.size();
        this.medianPosition = medianPosition;
        this.ranges = ranges;
        this.thresholdMode = thresholdMode;
        this.autoThreshold = autoThreshold;
        this.thresholdUsed = thresholdUsed;
        this.outliers = Collections.unmodifiableList(new ArrayList<>(outliers));
        this.thresholdWarning = thresholdWarning;

        this.outlierImageIds = new HashSet<>();
        for (final CameraOutlier outlier : outliers) {
            this.outlierImageIds.add(outlier.getImageId());
        }
    }

    public int getTotalCameras() {
        return totalCameras;
    }

    public int getKeptCameras() {
        return keptCameras;
    }

    public int getOutlierCount() {
        return outlierCount;
    }

    public double[] getMedianPosition() {
        return medianPosition.clone();
    }

    public CoordinateRanges getRanges() {
        return ranges;
    }

    public OutlierThresholdMode getThresholdMode() {
        return thresholdMode;
    }

    public double getAutoThreshold() {
        return autoThreshold;
    }

    public double getThresholdUsed() {
        return thresholdUsed;
    }

    /**
     * @return outliers sorted by descending distance from the median position.
     */
    public List<CameraOutlier> getOutliers() {
        return outliers;
    }

    /**
     * @return outlier distances in descending order.
     */
    public List<Double> getOutlierDistances() {
        final List<Double> distances = new ArrayList<>(outliers.size());
        for (final CameraOutlier outlier : outliers) {
            distances.add(outlier.getDistance());
        }
        return distances;
    }

    /**
     * @return description of a threshold sensitivity concern, or null if there is none.
     */
    public String getThresholdWarning() {
        return thresholdWarning;
    }

    public boolean isOutlier(final long imageId) {
        return outlierImageIds.contains(imageId);
    }

    @Override
    public String toString() {
        return "{totalCameras: " + totalCameras + ", outlierCount: " + outlierCount +
               ", thresholdMode: " + thresholdMode + ", thresholdUsed: " + thresholdUsed + "}";
    }
}
