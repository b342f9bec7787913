package org.janelia.reconstruction.client;

import com.google.common.primitives.UnsignedLong;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.reconstruction.clean.CleaningOrchestrator;
import org.janelia.reconstruction.clean.CleaningReport;
import org.janelia.reconstruction.client.parameter.CommandLineParameters;
import org.janelia.reconstruction.filter.OutlierThresholdMode;
import org.janelia.reconstruction.io.ReconstructionFiles;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.io.RecordWriter;
import org.janelia.reconstruction.model.CameraModel;
import org.janelia.reconstruction.model.CameraRecord;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;
import org.janelia.reconstruction.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link CleanReconstructionClient} class.
 */
public class CleanReconstructionClientTest {

    private Path testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = Files.createTempDirectory("clean_client_test_");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory.toFile());
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new CleanReconstructionClient.Parameters());

        final CleanReconstructionClient.Parameters parameters = new CleanReconstructionClient.Parameters();
        parameters.parse(new String[] {
                "--input", "/data/sparse/0",
                "--output", "/data/sparse/clean",
                "--outlierThresholdMode", "FIXED",
                "--outlierThreshold", "250"
        }, CleanReconstructionClient.class, false);

        Assert.assertEquals("/data/sparse/0", parameters.input);
        Assert.assertEquals("delegate mode should be parsed",
                            OutlierThresholdMode.FIXED, parameters.getCleanParameters().outlierThresholdMode);
        Assert.assertEquals("delegate threshold should be parsed",
                            250.0, parameters.getCleanParameters().outlierThreshold, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequiredParameter() {
        new CleanReconstructionClient.Parameters().parse(new String[] { "--input", "/data/sparse/0" },
                                                        CleanReconstructionClient.class,
                                                        false);
    }

    @Test
    public void testCleanReconstruction() throws Exception {

        final Path inputDirectory = Files.createDirectories(testDirectory.resolve("input"));
        writeReconstruction(inputDirectory);

        final Path parametersFile = testDirectory.resolve("clean_parameters.json");
        Files.write(parametersFile,
                    "{ \"outlierThresholdMode\": \"FIXED\", \"outlierThreshold\": 10.0 }".getBytes("UTF-8"));

        final Path outputDirectory = testDirectory.resolve("output");
        final CleanReconstructionClient.Parameters parameters = new CleanReconstructionClient.Parameters();
        parameters.parse(new String[] {
                "--input", inputDirectory.toString(),
                "--output", outputDirectory.toString(),
                "--cleanParametersJson", parametersFile.toString()
        }, CleanReconstructionClient.class, false);

        final CleaningReport report = new CleanReconstructionClient(parameters).cleanReconstruction();

        Assert.assertEquals("far camera should be removed", 1, report.getCameraOutliers().getOutlierCount());
        Assert.assertTrue("far camera should be image 3", report.getCameraOutliers().isOutlier(3));
        Assert.assertEquals("points should not be filtered", 0, report.getPoints().getPointsRemoved());
        Assert.assertTrue("stats file should be written",
                          Files.exists(outputDirectory.resolve(CleaningOrchestrator.STATS_FILE_NAME)));
    }

    static void writeReconstruction(final Path directory)
            throws Exception {

        final ReconstructionFiles files = new ReconstructionFiles(directory, ReconstructionFormat.TEXT);

        try (final RecordWriter<CameraRecord> writer = files.createCameraWriter(null)) {
            writer.write(new CameraRecord(1, CameraModel.SIMPLE_PINHOLE, 640, 480,
                                          new double[] { 500.0, 320.0, 240.0 }));
        }

        final double[] imageX = { 0.0, 1.0, 50.0 };
        try (final RecordWriter<ImageRecord> writer = files.createImageWriter(null)) {
            for (int i = 0; i < imageX.length; i++) {
                final List<Observation> observations = new ArrayList<>();
                observations.add(new Observation(10.0, 20.0, i));
                writer.write(new ImageRecord(i + 1, 1.0, 0.0, 0.0, 0.0, imageX[i], 0.0, 0.0,
                                             1, "frame_" + i + ".png", observations));
            }
        }

        try (final RecordWriter<PointRecord> writer = files.createPointWriter(null)) {
            for (int p = 0; p < imageX.length; p++) {
                writer.write(new PointRecord(UnsignedLong.valueOf(p), p, p, p, 10, 20, 30, 0.5,
                                             Collections.singletonList(new TrackElement(p + 1, 0))));
            }
        }
    }
}
