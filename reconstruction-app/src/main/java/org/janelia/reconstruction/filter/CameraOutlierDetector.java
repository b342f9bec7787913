package org.janelia.reconstruction.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.janelia.reconstruction.model.CameraPosition;
import org.janelia.reconstruction.model.CoordinateRanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identifies cameras that sit unreasonably far from the rest of a reconstruction.
 *
 * The center is the coordinate-wise median of all camera positions.  A camera is an outlier
 * when its distance to the center is strictly greater than the threshold.  In {@link OutlierThresholdMode#AUTO}
 * mode the threshold is
 * <pre>
 *   max(minThreshold, sortedDistances[floor(n * percentile)] * multiplier)
 * </pre>
 * computed over all cameras, outliers included.  This means the derived threshold grows with the
 * outlier fraction, so analyses with many outliers are flagged with a warning.
 */
public class CameraOutlierDetector {

    public static final double DEFAULT_PERCENTILE = 0.99;
    public static final double DEFAULT_MULTIPLIER = 2.5;
    public static final double DEFAULT_MIN_THRESHOLD = 100.0;

    private final OutlierThresholdMode mode;
    private final Double fixedThreshold;
    private final double percentile;
    private final double multiplier;
    private final double minThreshold;

    public static CameraOutlierDetector withFixedThreshold(final double threshold) {
        return new CameraOutlierDetector(OutlierThresholdMode.FIXED, threshold,
                                         DEFAULT_PERCENTILE, DEFAULT_MULTIPLIER, DEFAULT_MIN_THRESHOLD);
    }

    public static CameraOutlierDetector withAutoThreshold() {
        return withAutoThreshold(DEFAULT_PERCENTILE, DEFAULT_MULTIPLIER, DEFAULT_MIN_THRESHOLD);
    }

    public static CameraOutlierDetector withAutoThreshold(final double percentile,
                                                          final double multiplier,
                                                          final double minThreshold) {
        return new CameraOutlierDetector(OutlierThresholdMode.AUTO, null, percentile, multiplier, minThreshold);
    }

    /**
     * @throws IllegalArgumentException
     *   if any of the settings are out of range or a fixed threshold is missing in FIXED mode.
     */
    public CameraOutlierDetector(final OutlierThresholdMode mode,
                                 final Double fixedThreshold,
                                 final double percentile,
                                 final double multiplier,
                                 final double minThreshold)
            throws IllegalArgumentException {

        if (mode == OutlierThresholdMode.FIXED) {
            if ((fixedThreshold == null) || (! (fixedThreshold >= 0.0))) {
                throw new IllegalArgumentException("FIXED outlier mode requires a non-negative threshold but " +
                                                   fixedThreshold + " was specified");
            }
        }
        if (! ((percentile > 0.0) && (percentile <= 1.0))) {
            throw new IllegalArgumentException("outlier percentile " + percentile + " must be in (0, 1]");
        }
        if (! (multiplier > 0.0)) {
            throw new IllegalArgumentException("outlier multiplier " + multiplier + " must be positive");
        }
        if (! (minThreshold >= 0.0)) {
            throw new IllegalArgumentException("outlier minimum threshold " + minThreshold + " must be non-negative");
        }

        this.mode = mode;
        this.fixedThreshold = fixedThreshold;
        this.percentile = percentile;
        this.multiplier = multiplier;
        this.minThreshold = minThreshold;
    }

    public OutlierThresholdMode getMode() {
        return mode;
    }

    /**
     * @return kept/outlier partition of the specified camera positions.
     *
     * @throws IllegalArgumentException
     *   if no positions are specified.
     */
    public CameraOutlierAnalysis analyze(final List<CameraPosition> positions)
            throws IllegalArgumentException {

        if (positions.isEmpty()) {
            throw new IllegalArgumentException("cannot analyze camera positions because none were specified");
        }

        final CoordinateRanges.Accumulator rangeAccumulator = new CoordinateRanges.Accumulator();
        for (final CameraPosition position : positions) {
            rangeAccumulator.include(position.getX(), position.getY(), position.getZ());
        }

        final double[] center = computeMedianCenter(positions);

        final double[] distances = new double[positions.size()];
        for (int i = 0; i < distances.length; i++) {
            distances[i] = positions.get(i).distanceTo(center);
        }

        final double autoThreshold = computeAutoThreshold(distances, percentile, multiplier, minThreshold);
        final double thresholdUsed = mode == OutlierThresholdMode.FIXED ? fixedThreshold : autoThreshold;

        final List<CameraOutlier> outliers = findOutliers(positions, center, thresholdUsed);

        String thresholdWarning = null;
        if (mode == OutlierThresholdMode.AUTO) {
            final double outlierFraction = outliers.size() / (double) positions.size();
            if (outlierFraction > (1.0 - percentile)) {
                thresholdWarning = String.format(
                        "%d of %d cameras (%.1f%%) are outliers which exceeds the %.1f%% tail covered by the " +
                        "%.2f percentile, the auto threshold is derived from distances that include these " +
                        "outliers and may be too permissive",
                        outliers.size(), positions.size(), outlierFraction * 100.0,
                        (1.0 - percentile) * 100.0, percentile);
                LOG.warn("analyze: {}", thresholdWarning);
            }
        }

        final CameraOutlierAnalysis analysis = new CameraOutlierAnalysis(positions.size(),
                                                                         center,
                                                                         rangeAccumulator.build(),
                                                                         mode,
                                                                         autoThreshold,
                                                                         thresholdUsed,
                                                                         outliers,
                                                                         thresholdWarning);

        LOG.info("analyze: exit, returning {}", analysis);

        return analysis;
    }

    /**
     * @return coordinate-wise median {x, y, z} of the specified positions.
     */
    public static double[] computeMedianCenter(final List<CameraPosition> positions) {
        final double[] xs = new double[positions.size()];
        final double[] ys = new double[positions.size()];
        final double[] zs = new double[positions.size()];
        for (int i = 0; i < xs.length; i++) {
            final CameraPosition position = positions.get(i);
            xs[i] = position.getX();
            ys[i] = position.getY();
            zs[i] = position.getZ();
        }
        return new double[] { median(xs), median(ys), median(zs) };
    }

    /**
     * @return median of the values (mean of the two middle values when the count is even).
     */
    public static double median(final double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("median of empty set is undefined");
        }
        final double[] sorted = values.clone();
        Arrays.sort(sorted);
        final int middle = sorted.length / 2;
        final double median;
        if ((sorted.length % 2) == 1) {
            median = sorted[middle];
        } else {
            median = (sorted[middle - 1] + sorted[middle]) / 2.0;
        }
        return median;
    }

    public static double computeAutoThreshold(final double[] distances,
                                              final double percentile,
                                              final double multiplier,
                                              final double minThreshold) {
        final double[] sorted = distances.clone();
        Arrays.sort(sorted);
        final int index = Math.min((int) (sorted.length * percentile), sorted.length - 1);
        return Math.max(minThreshold, sorted[index] * multiplier);
    }

    /**
     * @return positions farther than threshold from center, sorted by descending distance (ties by image id).
     */
    public static List<CameraOutlier> findOutliers(final List<CameraPosition> positions,
                                                   final double[] center,
                                                   final double threshold) {
        final List<CameraOutlier> outliers = new ArrayList<>();
        for (final CameraPosition position : positions) {
            final double distance = position.distanceTo(center);
            if (distance > threshold) {
                outliers.add(new CameraOutlier(position, distance));
            }
        }
        outliers.sort(Comparator.comparingDouble(CameraOutlier::getDistance).reversed()
                              .thenComparingLong(CameraOutlier::getImageId));
        return outliers;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CameraOutlierDetector.class);
}
