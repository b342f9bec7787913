package org.janelia.reconstruction.filter;

import com.google.common.primitives.UnsignedLong;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.janelia.reconstruction.ReconstructionTestData;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ReferenceIntegrityRepairer} class.
 */
public class ReferenceIntegrityRepairerTest {

    @Test
    public void testRepair() {

        final Set<UnsignedLong> survivors = new HashSet<>(Arrays.asList(UnsignedLong.valueOf(1),
                                                                        UnsignedLong.valueOf(3)));
        final ReferenceIntegrityRepairer repairer = new ReferenceIntegrityRepairer(survivors);

        final ImageRecord image = ReconstructionTestData.buildImage(
                7,
                new double[] { 1.0, 2.0, 3.0 },
                Arrays.asList(new Observation(1.0, 1.5, 1),
                              new Observation(2.0, 2.5, 2),
                              new Observation(3.0, 3.5, Observation.UNMATCHED),
                              new Observation(4.0, 4.5, 3),
                              new Observation(5.0, 5.5, 42)));

        final ImageRecord repaired = repairer.repair(image);

        final List<Observation> observations = repaired.getObservations();
        Assert.assertEquals("observation count should not change", 5, observations.size());
        Assert.assertEquals("surviving reference should be kept", 1, observations.get(0).getPointReference());
        Assert.assertEquals("removed reference should be cleaned",
                            Observation.UNMATCHED, observations.get(1).getPointReference());
        Assert.assertEquals("coordinates of cleaned observation should be kept", 2.5, observations.get(1).getY(), 0.0);
        Assert.assertEquals("sentinel should stay unmatched",
                            Observation.UNMATCHED, observations.get(2).getPointReference());
        Assert.assertEquals("surviving reference should be kept", 3, observations.get(3).getPointReference());
        Assert.assertEquals("never existing reference should be cleaned",
                            Observation.UNMATCHED, observations.get(4).getPointReference());

        Assert.assertEquals("pose should not change", image.getTx(), repaired.getTx(), 0.0);
        Assert.assertEquals("name should not change", image.getName(), repaired.getName());

        for (final Observation observation : observations) {
            Assert.assertTrue("every matched reference must name a surviving point",
                              (! observation.isMatched()) ||
                              survivors.contains(observation.getReferencedPointId()));
        }

        final ReferenceRepairStatistics statistics = repairer.getStatistics();
        Assert.assertEquals("invalid image count", 1, statistics.getImageCount());
        Assert.assertEquals("invalid total", 5, statistics.getTotalReferences());
        Assert.assertEquals("invalid kept", 2, statistics.getKeptReferences());
        Assert.assertEquals("sentinel should be counted as cleaned", 3, statistics.getCleanedReferences());
        Assert.assertEquals("invalid rewritten", 2, statistics.getRewrittenReferences());

        final ImageReferenceCounts counts = statistics.getImages().get(0);
        Assert.assertEquals("invalid image id", 7, counts.getImageId());
        Assert.assertEquals("invalid image name", "image_7.jpg", counts.getName());
    }

    @Test
    public void testUnchangedImageIsReturned() {

        final ReferenceIntegrityRepairer repairer =
                new ReferenceIntegrityRepairer(Collections.singleton(UnsignedLong.valueOf(5)));

        final ImageRecord image = ReconstructionTestData.buildImage(
                1,
                new double[] { 0.0, 0.0, 0.0 },
                Arrays.asList(new Observation(1.0, 1.0, 5),
                              new Observation(2.0, 2.0, Observation.UNMATCHED)));

        Assert.assertSame("image without dangling references should be returned as is",
                          image, repairer.repair(image));

        final ImageRecord emptyImage = ReconstructionTestData.buildImage(2, new double[] { 0.0, 0.0, 0.0 },
                                                                         Collections.emptyList());
        Assert.assertSame("image without observations should be returned as is",
                          emptyImage, repairer.repair(emptyImage));

        final ReferenceRepairStatistics statistics = repairer.getStatistics();
        Assert.assertEquals("statistics should accumulate across images", 2, statistics.getImageCount());
        Assert.assertEquals("invalid total", 2, statistics.getTotalReferences());
        Assert.assertEquals("invalid rewritten", 0, statistics.getRewrittenReferences());
    }

    @Test
    public void testPruneTrack() {

        final PointRecord point = ReconstructionTestData.buildPoint(
                9,
                new double[] { 1.0, 2.0, 3.0 },
                Arrays.asList(new TrackElement(1, 0), new TrackElement(4, 2), new TrackElement(2, 7)));

        final Set<Long> keptImageIds = new HashSet<>(Arrays.asList(1L, 2L, 3L));

        final PointRecord pruned = ReferenceIntegrityRepairer.pruneTrack(point, keptImageIds);
        Assert.assertEquals("track elements of removed images should be dropped",
                            Arrays.asList(new TrackElement(1, 0), new TrackElement(2, 7)), pruned.getTrack());
        Assert.assertEquals("point id should not change", point.getPointId(), pruned.getPointId());
        Assert.assertEquals("location should not change", point.getZ(), pruned.getZ(), 0.0);

        final PointRecord unchanged = ReconstructionTestData.buildPoint(
                10, new double[] { 0.0, 0.0, 0.0 }, Collections.singletonList(new TrackElement(3, 1)));
        Assert.assertSame("point with complete track should be returned as is",
                          unchanged, ReferenceIntegrityRepairer.pruneTrack(unchanged, keptImageIds));
    }
}
