package org.janelia.reconstruction.model;

import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CameraModel} class.
 */
public class CameraModelTest {

    @Test
    public void testParameterCounts() {
        final int[] expectedCounts = { 3, 4, 4, 5, 8, 8, 12, 5, 4, 5, 12 };
        Assert.assertEquals("invalid number of models", expectedCounts.length, CameraModel.values().length);
        for (int modelId = 0; modelId < expectedCounts.length; modelId++) {
            final CameraModel model = CameraModel.fromModelId(modelId);
            Assert.assertEquals("invalid id for " + model, modelId, model.getModelId());
            Assert.assertEquals("invalid parameter count for " + model,
                                expectedCounts[modelId], model.getParameterCount());
        }
    }

    @Test
    public void testLookupIsExhaustive() {
        final Set<Integer> ids = new HashSet<>();
        for (final CameraModel model : CameraModel.values()) {
            Assert.assertEquals("tag lookup failed", model, CameraModel.fromTag(model.name()));
            Assert.assertEquals("id lookup failed", model, CameraModel.fromModelId(model.getModelId()));
            Assert.assertTrue("duplicate id " + model.getModelId(), ids.add(model.getModelId()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownTag() {
        CameraModel.fromTag("PANORAMIC");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownId() {
        CameraModel.fromModelId(11);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParameterCountMismatch() {
        new CameraRecord(1, CameraModel.OPENCV, 100, 100, new double[] { 1.0, 2.0, 3.0, 4.0 });
    }

    @Test
    public void testObservationReferences() {
        Assert.assertFalse("sentinel should be unmatched", new Observation(1, 2, Observation.UNMATCHED).isMatched());
        Assert.assertNull("sentinel should not reference a point",
                          new Observation(1, 2, -1).getReferencedPointId());
        Assert.assertEquals("invalid referenced point id",
                            7L, new Observation(1, 2, 7).getReferencedPointId().longValue());
        try {
            new Observation(1, 2, -2);
            Assert.fail("negative reference other than the sentinel should be rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name the reference", e.getMessage().contains("-2"));
        }
    }
}
