package org.janelia.reconstruction.clean;

import java.io.Serializable;
import java.util.List;

import org.janelia.reconstruction.model.CoordinateRanges;

/**
 * Counts and coordinate ranges for the 3D point table before and after spatial filtering.
 * Reference cloud fields are only populated when a reference cloud was used.
 */
public class PointFilterStatistics
        implements Serializable {

    private boolean spatialFilterApplied;
    private String skippedReason;
    private String referenceCloud;
    private Integer referencePointCount;
    private CoordinateRanges referenceRanges;
    private Double threshold;
    private List<Double> coordinateTransform;

    private long pointsBefore;
    private long pointsAfter;
    private long pointsRemoved;
    private CoordinateRanges rangesBefore;
    private CoordinateRanges rangesAfter;
    private long trackElementsRemoved;

    public PointFilterStatistics() {
    }

    public static PointFilterStatistics skipped(final String reason) {
        final PointFilterStatistics statistics = new PointFilterStatistics();
        statistics.spatialFilterApplied = false;
        statistics.skippedReason = reason;
        return statistics;
    }

    public static PointFilterStatistics applied(final String referenceCloud,
                                                final int referencePointCount,
                                                final CoordinateRanges referenceRanges,
                                                final double threshold,
                                                final List<Double> coordinateTransform) {
        final PointFilterStatistics statistics = new PointFilterStatistics();
        statistics.spatialFilterApplied = true;
        statistics.referenceCloud = referenceCloud;
        statistics.referencePointCount = referencePointCount;
        statistics.referenceRanges = referenceRanges;
        statistics.threshold = threshold;
        statistics.coordinateTransform = coordinateTransform;
        return statistics;
    }

    public boolean isSpatialFilterApplied() {
        return spatialFilterApplied;
    }

    public String getSkippedReason() {
        return skippedReason;
    }

    public String getReferenceCloud() {
        return referenceCloud;
    }

    public Integer getReferencePointCount() {
        return referencePointCount;
    }

    public CoordinateRanges getReferenceRanges() {
        return referenceRanges;
    }

    public Double getThreshold() {
        return threshold;
    }

    public List<Double> getCoordinateTransform() {
        return coordinateTransform;
    }

    public long getPointsBefore() {
        return pointsBefore;
    }

    public long getPointsAfter() {
        return pointsAfter;
    }

    public long getPointsRemoved() {
        return pointsRemoved;
    }

    public CoordinateRanges getRangesBefore() {
        return rangesBefore;
    }

    public CoordinateRanges getRangesAfter() {
        return rangesAfter;
    }

    public long getTrackElementsRemoved() {
        return trackElementsRemoved;
    }

    public void setResults(final long pointsBefore,
                           final long pointsAfter,
                           final CoordinateRanges rangesBefore,
                           final CoordinateRanges rangesAfter,
                           final long trackElementsRemoved) {
        this.pointsBefore = pointsBefore;
        this.pointsAfter = pointsAfter;
        this.pointsRemoved = pointsBefore - pointsAfter;
        this.rangesBefore = rangesBefore;
        this.rangesAfter = rangesAfter;
        this.trackElementsRemoved = trackElementsRemoved;
    }

    @Override
    public String toString() {
        return "{spatialFilterApplied: " + spatialFilterApplied +
               ", pointsBefore: " + pointsBefore +
               ", pointsAfter: " + pointsAfter +
               ", trackElementsRemoved: " + trackElementsRemoved + "}";
    }
}
