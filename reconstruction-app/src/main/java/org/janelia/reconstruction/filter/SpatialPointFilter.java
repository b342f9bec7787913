package org.janelia.reconstruction.filter;

import java.io.IOException;
import java.nio.file.Path;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.NearestNeighborSearchOnKDTree;

import org.janelia.reconstruction.io.ply.PlyVertexReader;
import org.janelia.reconstruction.model.CoordinateRanges;
import org.janelia.reconstruction.util.BoundedBuffer;
import org.janelia.reconstruction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps candidate points that lie within a distance threshold of a reference point cloud.
 *
 * The reference points are indexed once in a kd-tree, after which each candidate costs one
 * nearest neighbor query.  Instances are not thread safe because the search object holds
 * the state of the most recent query.
 */
public class SpatialPointFilter {

    public static final double DEFAULT_THRESHOLD = 0.001;

    private final NearestNeighborSearchOnKDTree<RealPoint> search;
    private final RealPoint query;
    private final double threshold;
    private final int referencePointCount;
    private final CoordinateRanges referenceRanges;

    /**
     * @param  referencePoints  reference locations, already expressed in the candidate coordinate frame.
     * @param  threshold        maximum (inclusive) distance for a candidate to be kept.
     *
     * @throws IllegalArgumentException
     *   if there are no reference points or the threshold is negative.
     */
    public SpatialPointFilter(final BoundedBuffer<RealPoint> referencePoints,
                              final double threshold)
            throws IllegalArgumentException {

        if (referencePoints.isEmpty()) {
            throw new IllegalArgumentException("reference point cloud is empty, cannot filter points against it");
        }
        validateThreshold(threshold);

        final CoordinateRanges.Accumulator rangeAccumulator = new CoordinateRanges.Accumulator();
        for (final RealPoint point : referencePoints) {
            rangeAccumulator.include(point.getDoublePosition(0),
                                     point.getDoublePosition(1),
                                     point.getDoublePosition(2));
        }

        this.search = new NearestNeighborSearchOnKDTree<>(
                new KDTree<RealPoint>(referencePoints.asList(), referencePoints.asList()));
        this.query = new RealPoint(3);
        this.threshold = threshold;
        this.referencePointCount = referencePoints.size();
        this.referenceRanges = rangeAccumulator.build();
    }

    /**
     * Loads a binary PLY point cloud, transforms its vertices into the reconstruction frame,
     * and builds a filter for it.
     *
     * @throws IllegalArgumentException
     *   if the cloud has no vertices or is too large to materialize.
     */
    public static SpatialPointFilter fromPly(final Path plyPath,
                                             final CoordinateTransform transform,
                                             final double threshold,
                                             final int maxReferencePoints)
            throws IOException, IllegalArgumentException {

        LOG.info("fromPly: entry, plyPath={}, transform={}, threshold={}", plyPath, transform, threshold);

        final ProcessTimer timer = new ProcessTimer();
        final BoundedBuffer<RealPoint> referencePoints = new BoundedBuffer<>("reference point", maxReferencePoints);

        try (final PlyVertexReader reader = new PlyVertexReader(plyPath)) {
            while (reader.hasNext()) {
                referencePoints.add(new RealPoint(transform.apply(reader.next())));
            }
        } catch (final IllegalStateException e) {
            throw new IllegalArgumentException("reference point cloud " + plyPath + " is too large", e);
        }

        final long readMilliseconds = timer.lap();

        final SpatialPointFilter filter = new SpatialPointFilter(referencePoints, threshold);

        LOG.info("fromPly: exit, read {} reference points in {} ms, built index in {} ms, reference ranges are {}",
                 filter.getReferencePointCount(), readMilliseconds, timer.lap(), filter.getReferenceRanges());

        return filter;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getReferencePointCount() {
        return referencePointCount;
    }

    public CoordinateRanges getReferenceRanges() {
        return referenceRanges;
    }

    /**
     * @return Euclidean distance from the specified location to the nearest reference point.
     */
    public double getNearestDistance(final double x,
                                     final double y,
                                     final double z) {
        query.setPosition(x, 0);
        query.setPosition(y, 1);
        query.setPosition(z, 2);
        search.search(query);
        return search.getDistance();
    }

    /**
     * @return true if the nearest reference point is no farther than the threshold.
     */
    public boolean isKept(final double x,
                          final double y,
                          final double z) {
        return getNearestDistance(x, y, z) <= threshold;
    }

    public static void validateThreshold(final double threshold)
            throws IllegalArgumentException {
        if (! (threshold >= 0.0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("spatial filter threshold " + threshold +
                                               " must be a finite non-negative number");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpatialPointFilter.class);
}
