package org.janelia.reconstruction.clean;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.reconstruction.ReconstructionTestData;
import org.janelia.reconstruction.filter.CameraOutlierAnalysis;
import org.janelia.reconstruction.filter.OutlierThresholdMode;
import org.janelia.reconstruction.filter.ReferenceRepairStatistics;
import org.janelia.reconstruction.io.ReconstructionFiles;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link CleaningOrchestrator} class.
 */
public class CleaningOrchestratorTest {

    private Path testDirectory;
    private Path inputDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = Files.createTempDirectory("orchestrator_test_");
        inputDirectory = testDirectory.resolve("input");
        Files.createDirectories(inputDirectory);
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory.toFile());
    }

    @Test
    public void testCameraOutliersWithoutSpatialFilter() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);

        final Path outputDirectory = testDirectory.resolve("output");
        final CleaningReport report = new CleaningOrchestrator(buildFixedParameters()).clean(inputDirectory,
                                                                                            outputDirectory);

        final CameraOutlierAnalysis analysis = report.getCameraOutliers();
        Assert.assertEquals("invalid outlier count", 2, analysis.getOutlierCount());
        Assert.assertTrue("image 4 should be an outlier", analysis.isOutlier(4));
        Assert.assertTrue("image 5 should be an outlier", analysis.isOutlier(5));

        final PointFilterStatistics points = report.getPoints();
        Assert.assertFalse("spatial filter should be skipped", points.isSpatialFilterApplied());
        Assert.assertEquals("all points should be kept", 50, points.getPointsAfter());
        Assert.assertEquals("track elements of outlier images should be removed", 20, points.getTrackElementsRemoved());

        final ReferenceRepairStatistics references = report.getReferences();
        Assert.assertEquals("invalid image count", 3, references.getImageCount());
        Assert.assertEquals("invalid total references", 34, references.getTotalReferences());
        Assert.assertEquals("invalid kept references", 30, references.getKeptReferences());
        Assert.assertEquals("invalid cleaned references", 4, references.getCleanedReferences());
        Assert.assertEquals("only the missing point reference should be rewritten",
                            1, references.getRewrittenReferences());

        final ReconstructionFiles output = new ReconstructionFiles(outputDirectory, ReconstructionFormat.TEXT);
        final List<ImageRecord> images = ReconstructionTestData.readAll(output.openImageReader());
        Assert.assertEquals("invalid kept image ids", Arrays.asList(1L, 2L, 3L), getImageIds(images));
        Assert.assertEquals("missing point reference should be cleaned",
                            Observation.UNMATCHED, images.get(0).getObservations().get(11).getPointReference());

        final List<PointRecord> outputPoints = ReconstructionTestData.readAll(output.openPointReader());
        Assert.assertEquals("invalid output point count", 50, outputPoints.size());
        Assert.assertTrue("points of outlier images should have empty tracks",
                          outputPoints.get(45).getTrack().isEmpty());
        Assert.assertEquals("cameras should be copied",
                            1, ReconstructionTestData.readAll(output.openCameraReader()).size());

        Assert.assertTrue("stats file should be written",
                          Files.exists(outputDirectory.resolve(CleaningOrchestrator.STATS_FILE_NAME)));
        Assert.assertTrue("timings file should be written",
                          Files.exists(outputDirectory.resolve(CleaningOrchestrator.TIMINGS_FILE_NAME)));
        Assert.assertNotNull("assemble stage should be timed",
                             report.getTimings().getMilliseconds(CleaningStage.ASSEMBLE_OUTPUT));
        Assert.assertEquals("input sizes should be recorded", 3, report.getInputFileBytes().size());
        assertNoStagingDirectories();
    }

    @Test
    public void testSpatialFilter() throws Exception {

        final ReconstructionTestData data = ReconstructionTestData.buildStandardScenario();
        data.write(inputDirectory, ReconstructionFormat.TEXT);

        final Path plyPath = testDirectory.resolve("reference.ply");
        writeReferenceCloud(plyPath, 20);

        final CleanParameters parameters = buildFixedParameters();
        parameters.referenceCloud = plyPath.toString();

        final Path outputDirectory = testDirectory.resolve("output");
        final CleaningReport report = new CleaningOrchestrator(parameters).clean(inputDirectory, outputDirectory);

        final PointFilterStatistics points = report.getPoints();
        Assert.assertTrue("spatial filter should be applied", points.isSpatialFilterApplied());
        Assert.assertEquals("invalid reference cloud name", "reference.ply", points.getReferenceCloud());
        Assert.assertEquals("invalid reference point count", Integer.valueOf(20), points.getReferencePointCount());
        Assert.assertEquals("invalid points before", 50, points.getPointsBefore());
        Assert.assertEquals("invalid points after", 20, points.getPointsAfter());
        Assert.assertEquals("invalid points removed", 30, points.getPointsRemoved());
        Assert.assertEquals("kept points only belong to kept images", 0, points.getTrackElementsRemoved());

        final ReferenceRepairStatistics references = report.getReferences();
        Assert.assertEquals("invalid total references", 34, references.getTotalReferences());
        Assert.assertEquals("invalid kept references", 20, references.getKeptReferences());
        Assert.assertEquals("invalid cleaned references", 14, references.getCleanedReferences());
        Assert.assertEquals("invalid rewritten references", 11, references.getRewrittenReferences());

        assertReferentialClosure(outputDirectory, ReconstructionFormat.TEXT);
    }

    @Test
    public void testDiscoveredReferenceCloud() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);
        writeReferenceCloud(inputDirectory.resolve("fused.ply"), 10);

        final CleanParameters parameters = buildFixedParameters();
        parameters.discoverReferenceCloud = true;

        final CleaningReport report =
                new CleaningOrchestrator(parameters).clean(inputDirectory, testDirectory.resolve("output"));

        Assert.assertEquals("invalid reference cloud name", "fused.ply", report.getPoints().getReferenceCloud());
        Assert.assertEquals("invalid points after", 10, report.getPoints().getPointsAfter());
    }

    @Test
    public void testAutoThreshold() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);

        final Path outputDirectory = testDirectory.resolve("output");
        final CleaningReport report =
                new CleaningOrchestrator(new CleanParameters()).clean(inputDirectory, outputDirectory);

        Assert.assertEquals(OutlierThresholdMode.AUTO, report.getCameraOutliers().getThresholdMode());
        Assert.assertEquals("no outliers expected for auto threshold", 0, report.getCameraOutliers().getOutlierCount());
        Assert.assertEquals("no track elements should be removed", 0, report.getPoints().getTrackElementsRemoved());
        Assert.assertEquals("all images should be kept", 5, report.getReferences().getImageCount());
    }

    @Test
    public void testIdempotence() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);
        final Path plyPath = testDirectory.resolve("reference.ply");
        writeReferenceCloud(plyPath, 20);

        final CleanParameters parameters = buildFixedParameters();
        parameters.referenceCloud = plyPath.toString();

        final Path firstOutput = testDirectory.resolve("first");
        final Path secondOutput = testDirectory.resolve("second");
        new CleaningOrchestrator(parameters).clean(inputDirectory, firstOutput);
        new CleaningOrchestrator(parameters).clean(inputDirectory, secondOutput);

        for (final String fileName : new String[] {
                "cameras.txt", "images.txt", "points3D.txt", CleaningOrchestrator.STATS_FILE_NAME }) {
            Assert.assertArrayEquals(fileName + " should be identical for identical runs",
                                     Files.readAllBytes(firstOutput.resolve(fileName)),
                                     Files.readAllBytes(secondOutput.resolve(fileName)));
        }

        // cleaning cleaned output again changes nothing
        final Path thirdOutput = testDirectory.resolve("third");
        final CleaningReport report = new CleaningOrchestrator(parameters).clean(firstOutput, thirdOutput);
        Assert.assertEquals("no outliers expected on second pass", 0, report.getCameraOutliers().getOutlierCount());
        Assert.assertEquals("no points should be removed on second pass", 0, report.getPoints().getPointsRemoved());
        Assert.assertEquals("no references should be rewritten on second pass",
                            0, report.getReferences().getRewrittenReferences());
        for (final String fileName : new String[] { "cameras.txt", "images.txt", "points3D.txt" }) {
            Assert.assertArrayEquals(fileName + " should not change when cleaned again",
                                     Files.readAllBytes(firstOutput.resolve(fileName)),
                                     Files.readAllBytes(thirdOutput.resolve(fileName)));
        }
    }

    @Test
    public void testFormatConversion() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.BINARY);

        final CleanParameters parameters = buildFixedParameters();
        parameters.outputFormat = ReconstructionFormat.TEXT;

        final Path outputDirectory = testDirectory.resolve("output");
        final CleaningReport report = new CleaningOrchestrator(parameters).clean(inputDirectory, outputDirectory);

        Assert.assertEquals(ReconstructionFormat.BINARY, report.getInputFormat());
        Assert.assertEquals(ReconstructionFormat.TEXT, report.getOutputFormat());
        Assert.assertTrue("text images should be written", Files.exists(outputDirectory.resolve("images.txt")));
        Assert.assertFalse("binary images should not be written", Files.exists(outputDirectory.resolve("images.bin")));
        Assert.assertEquals("invalid kept references", 30, report.getReferences().getKeptReferences());

        assertReferentialClosure(outputDirectory, ReconstructionFormat.TEXT);
    }

    @Test
    public void testExistingOutputDirectory() throws Exception {

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);
        Files.createDirectories(inputDirectory.resolve(CleaningOrchestrator.IMAGE_DIRECTORY_NAME));
        Files.createFile(inputDirectory.resolve(CleaningOrchestrator.IMAGE_DIRECTORY_NAME).resolve("image_1.jpg"));

        final Path outputDirectory = testDirectory.resolve("output");
        Files.createDirectories(outputDirectory);
        Files.write(outputDirectory.resolve("cameras.bin"), new byte[] { 1, 2, 3 });
        Files.write(outputDirectory.resolve("notes.md"), "keep me".getBytes("UTF-8"));

        new CleaningOrchestrator(buildFixedParameters()).clean(inputDirectory, outputDirectory);

        Assert.assertFalse("stale tables of other serialization should be removed",
                           Files.exists(outputDirectory.resolve("cameras.bin")));
        Assert.assertTrue("unrelated files should be kept", Files.exists(outputDirectory.resolve("notes.md")));
        Assert.assertTrue("cleaned tables should be published", Files.exists(outputDirectory.resolve("images.txt")));

        final Path imageLink = outputDirectory.resolve(CleaningOrchestrator.IMAGE_DIRECTORY_NAME);
        Assert.assertTrue("images directory should be linked", Files.isSymbolicLink(imageLink));
        Assert.assertTrue("linked image should be visible", Files.exists(imageLink.resolve("image_1.jpg")));
        assertNoStagingDirectories();
    }

    @Test
    public void testPublishIntoExistingDirectory() throws Exception {

        final Path stagingDirectory = Files.createDirectories(testDirectory.resolve(".output.staging-test"));
        Files.write(stagingDirectory.resolve("cameras.txt"), "new cameras".getBytes("UTF-8"));
        Files.write(stagingDirectory.resolve("images.txt"), "new images".getBytes("UTF-8"));
        Files.write(stagingDirectory.resolve("points3D.txt"), "new points".getBytes("UTF-8"));

        final Path outputDirectory = Files.createDirectories(testDirectory.resolve("output"));
        Files.write(outputDirectory.resolve("cameras.txt"), "old cameras".getBytes("UTF-8"));
        Files.write(outputDirectory.resolve("images.bin"), new byte[] { 1 });
        Files.write(outputDirectory.resolve("points3D.bin"), new byte[] { 2 });
        Files.write(outputDirectory.resolve("notes.md"), "keep me".getBytes("UTF-8"));

        CleaningOrchestrator.publish(stagingDirectory, outputDirectory);

        Assert.assertEquals("existing table should be replaced",
                            "new cameras", new String(Files.readAllBytes(outputDirectory.resolve("cameras.txt")), "UTF-8"));
        Assert.assertEquals("new table should be published",
                            "new points", new String(Files.readAllBytes(outputDirectory.resolve("points3D.txt")), "UTF-8"));
        Assert.assertFalse("stale binary images should be removed", Files.exists(outputDirectory.resolve("images.bin")));
        Assert.assertFalse("stale binary points should be removed", Files.exists(outputDirectory.resolve("points3D.bin")));
        Assert.assertTrue("unrelated files should be kept", Files.exists(outputDirectory.resolve("notes.md")));
        try (final Stream<Path> stream = Files.list(stagingDirectory)) {
            Assert.assertEquals("staged files should all be moved", 0, stream.count());
        }
    }

    @Test
    public void testStageFailures() throws Exception {

        final Path outputDirectory = testDirectory.resolve("output");

        assertStageFailure(CleaningStage.DETECT_FORMAT, new CleanParameters(), outputDirectory);

        ReconstructionTestData.buildStandardScenario().write(inputDirectory, ReconstructionFormat.TEXT);

        CleanParameters parameters = buildFixedParameters();
        parameters.referenceCloud = testDirectory.resolve("missing.ply").toString();
        assertStageFailure(CleaningStage.SPATIAL_FILTER, parameters, outputDirectory);

        final Path emptyPlyPath = testDirectory.resolve("empty.ply");
        writeReferenceCloud(emptyPlyPath, 0);
        parameters = buildFixedParameters();
        parameters.referenceCloud = emptyPlyPath.toString();
        assertStageFailure(CleaningStage.SPATIAL_FILTER, parameters, outputDirectory);

        parameters = buildFixedParameters();
        parameters.maxMaterializedRecords = 2;
        assertStageFailure(CleaningStage.CAMERA_OUTLIERS, parameters, outputDirectory);

        try {
            new CleaningOrchestrator(buildFixedParameters()).clean(inputDirectory, inputDirectory);
            Assert.fail("cleaning into the input directory should have been rejected");
        } catch (final CleaningException e) {
            Assert.assertEquals(CleaningStage.DETECT_FORMAT, e.getStage());
        }
    }

    @Test
    public void testMissingCameraReference() throws Exception {

        final ReconstructionTestData data = ReconstructionTestData.buildStandardScenario();
        final List<ImageRecord> images = new ArrayList<>(data.images);
        final ImageRecord image = images.get(2);
        images.set(2, new ImageRecord(image.getImageId(), image.getQw(), image.getQx(), image.getQy(), image.getQz(),
                                      image.getTx(), image.getTy(), image.getTz(),
                                      2, image.getName(), image.getObservations()));
        new ReconstructionTestData(data.cameras, images, data.points).write(inputDirectory,
                                                                            ReconstructionFormat.TEXT);

        assertStageFailure(CleaningStage.CAMERA_OUTLIERS, buildFixedParameters(), testDirectory.resolve("output"));
    }

    private void assertStageFailure(final CleaningStage expectedStage,
                                    final CleanParameters parameters,
                                    final Path outputDirectory)
            throws IOException {
        try {
            new CleaningOrchestrator(parameters).clean(inputDirectory, outputDirectory);
            Assert.fail("cleaning should have failed in " + expectedStage + " stage");
        } catch (final CleaningException e) {
            Assert.assertEquals("failure attributed to wrong stage", expectedStage, e.getStage());
            Assert.assertNotNull("failure should have a cause", e.getCause());
        }
        Assert.assertFalse("output directory should not be created for failed run", Files.exists(outputDirectory));
        assertNoStagingDirectories();
    }

    private void assertNoStagingDirectories()
            throws IOException {
        final List<String> stagingNames;
        try (final Stream<Path> stream = Files.list(testDirectory)) {
            stagingNames = stream.map(p -> p.getFileName().toString())
                    .filter(name -> name.contains(".staging-"))
                    .collect(Collectors.toList());
        }
        Assert.assertTrue("staging directories left behind: " + stagingNames, stagingNames.isEmpty());
    }

    private static void assertReferentialClosure(final Path directory,
                                                 final ReconstructionFormat format)
            throws IOException {
        final ReconstructionFiles files = new ReconstructionFiles(directory, format);
        final List<UnsignedLong> pointIds = new ArrayList<>();
        for (final PointRecord point : ReconstructionTestData.readAll(files.openPointReader())) {
            pointIds.add(point.getPointId());
        }
        for (final ImageRecord image : ReconstructionTestData.readAll(files.openImageReader())) {
            for (final Observation observation : image.getObservations()) {
                if (observation.isMatched()) {
                    Assert.assertTrue(image.getName() + " references removed point " +
                                      observation.getReferencedPointId(),
                                      pointIds.contains(observation.getReferencedPointId()));
                }
            }
        }
    }

    private static CleanParameters buildFixedParameters() {
        final CleanParameters parameters = new CleanParameters();
        parameters.outlierThresholdMode = OutlierThresholdMode.FIXED;
        parameters.outlierThreshold = 100.0;
        return parameters;
    }

    /**
     * Writes a cloud containing the first count standard scenario points, expressed in source coordinates.
     */
    private static void writeReferenceCloud(final Path plyPath,
                                            final int count)
            throws IOException {
        final List<double[]> vertices = new ArrayList<>();
        for (int p = 0; p < count; p++) {
            vertices.add(ReconstructionTestData.toDefaultSourceFrame(
                    ReconstructionTestData.getStandardPointLocation(p)));
        }
        ReconstructionTestData.writePly(plyPath, vertices);
    }

    private static List<Long> getImageIds(final List<ImageRecord> images) {
        final List<Long> ids = new ArrayList<>();
        for (final ImageRecord image : images) {
            ids.add(image.getImageId());
        }
        return ids;
    }
}
