package org.janelia.reconstruction.filter;

import com.google.common.primitives.UnsignedLong;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Rewrites image observations so that every reference either names a surviving point
 * or is the {@link Observation#UNMATCHED} sentinel.  Matches are never added.
 *
 * Repair statistics accumulate across calls to {@link #repair}, so one instance
 * should be used per pass over an image table.
 */
public class ReferenceIntegrityRepairer {

    private final Set<UnsignedLong> survivingPointIds;
    private final ReferenceRepairStatistics statistics;

    public ReferenceIntegrityRepairer(final Set<UnsignedLong> survivingPointIds) {
        this.survivingPointIds = survivingPointIds;
        this.statistics = new ReferenceRepairStatistics();
    }

    /**
     * @return copy of the image with dangling references replaced by the sentinel
     *         (or the image itself if every reference is valid).
     */
    public ImageRecord repair(final ImageRecord image) {

        final ImageReferenceCounts counts = new ImageReferenceCounts(image.getImageId(), image.getName());
        final List<Observation> repairedObservations = new ArrayList<>(image.getObservations().size());
        boolean changed = false;

        for (final Observation observation : image.getObservations()) {
            if (! observation.isMatched()) {
                counts.addCleaned(false);
                repairedObservations.add(observation);
            } else if (survivingPointIds.contains(observation.getReferencedPointId())) {
                counts.addKept();
                repairedObservations.add(observation);
            } else {
                counts.addCleaned(true);
                repairedObservations.add(observation.withoutMatch());
                changed = true;
            }
        }

        statistics.add(counts);

        return changed ? image.withObservations(repairedObservations) : image;
    }

    public ReferenceRepairStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return copy of the point without track elements for images that are not kept
     *         (or the point itself if every element names a kept image).
     */
    public static PointRecord pruneTrack(final PointRecord point,
                                         final Set<Long> keptImageIds) {
        final List<TrackElement> prunedTrack = new ArrayList<>(point.getTrack().size());
        for (final TrackElement element : point.getTrack()) {
            if (keptImageIds.contains(element.getImageId())) {
                prunedTrack.add(element);
            }
        }
        return prunedTrack.size() == point.getTrack().size() ? point : point.withTrack(prunedTrack);
    }
}
