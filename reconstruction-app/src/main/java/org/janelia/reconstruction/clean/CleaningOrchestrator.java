package org.janelia.reconstruction.clean;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.reconstruction.filter.CameraOutlierAnalysis;
import org.janelia.reconstruction.filter.CameraOutlierDetector;
import org.janelia.reconstruction.filter.CoordinateTransform;
import org.janelia.reconstruction.filter.ReferenceIntegrityRepairer;
import org.janelia.reconstruction.filter.SpatialPointFilter;
import org.janelia.reconstruction.io.FormatDetector;
import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.io.ReconstructionFiles;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.io.ReconstructionTable;
import org.janelia.reconstruction.io.RecordReader;
import org.janelia.reconstruction.io.RecordWriter;
import org.janelia.reconstruction.model.CameraPosition;
import org.janelia.reconstruction.model.CameraRecord;
import org.janelia.reconstruction.model.CoordinateRanges;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.util.BoundedBuffer;
import org.janelia.reconstruction.util.FileUtil;
import org.janelia.reconstruction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleans a reconstruction in five sequential stages (see {@link CleaningStage}):
 * <ol>
 *   <li>detect the input serialization,</li>
 *   <li>copy the camera table and find outlier cameras,</li>
 *   <li>stream the point table, optionally keeping only points near a reference cloud,</li>
 *   <li>stream the image table again, dropping outliers and repairing observation references,</li>
 *   <li>write statistics and publish the output directory.</li>
 * </ol>
 *
 * Tables are written into a staging directory next to the output directory.  The staging directory
 * replaces the output only when every stage succeeds and is deleted otherwise, so a failed run
 * never leaves partial output behind.
 */
public class CleaningOrchestrator {

    public static final String STATS_FILE_NAME = "clean_stats.json";
    public static final String TIMINGS_FILE_NAME = "clean_timings.json";
    public static final String IMAGE_DIRECTORY_NAME = "images";

    private final CleanParameters parameters;

    /**
     * @throws IllegalArgumentException
     *   if the parameters are invalid.
     */
    public CleaningOrchestrator(final CleanParameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
    }

    /**
     * Cleans the reconstruction in the input directory and writes the result to the output directory.
     *
     * @return statistics for the run.
     *
     * @throws CleaningException
     *   if any stage fails, in which case the output directory is left untouched.
     */
    public CleaningReport clean(final Path inputDirectory,
                                final Path outputDirectory)
            throws CleaningException {

        LOG.info("clean: entry, inputDirectory={}, outputDirectory={}, parameters={}",
                 inputDirectory, outputDirectory, parameters.toJson());

        final ProcessTimer timer = new ProcessTimer();
        final CleaningReport report = new CleaningReport();
        report.setParameters(parameters);

        final Run run = runStage(CleaningStage.DETECT_FORMAT, report, () -> detectFormat(inputDirectory,
                                                                                          outputDirectory,
                                                                                          report));
        try {
            runStage(CleaningStage.CAMERA_OUTLIERS, report, () -> {
                findCameraOutliers(run, report);
                return null;
            });
            runStage(CleaningStage.SPATIAL_FILTER, report, () -> {
                filterPoints(run, report);
                return null;
            });
            runStage(CleaningStage.REFERENCE_REPAIR, report, () -> {
                repairImages(run, report);
                return null;
            });
            runStage(CleaningStage.ASSEMBLE_OUTPUT, report, () -> {
                assembleOutput(run, report);
                return null;
            });
        } finally {
            if (Files.exists(run.stagingDirectory)) {
                FileUtil.deleteRecursive(run.stagingDirectory.toFile());
            }
        }

        LOG.info("clean: exit, cleaned {} in {}, report is {}", inputDirectory, timer, report);

        return report;
    }

    private Run detectFormat(final Path inputDirectory,
                             final Path outputDirectory,
                             final CleaningReport report)
            throws IOException {

        if (! Files.isDirectory(inputDirectory)) {
            throw new IllegalArgumentException("input directory " + inputDirectory + " does not exist");
        }

        final Path absoluteInput = inputDirectory.toAbsolutePath().normalize();
        final Path absoluteOutput = outputDirectory.toAbsolutePath().normalize();
        if (absoluteInput.equals(absoluteOutput) ||
            (Files.exists(absoluteOutput) && Files.isSameFile(absoluteInput, absoluteOutput))) {
            throw new IllegalArgumentException("output directory must differ from input directory " +
                                               absoluteInput);
        }

        final ReconstructionFormat inputFormat = FormatDetector.detect(absoluteInput);
        if (! inputFormat.isRecognized()) {
            throw new IllegalArgumentException(
                    "no complete set of text (cameras.txt, images.txt, points3D.txt) or binary " +
                    "(cameras.bin, images.bin, points3D.bin) tables found in " + absoluteInput);
        }
        final ReconstructionFormat outputFormat =
                parameters.outputFormat == null ? inputFormat : parameters.outputFormat;

        report.setInputFormat(inputFormat);
        report.setOutputFormat(outputFormat);

        final ReconstructionFiles input = new ReconstructionFiles(absoluteInput, inputFormat);
        for (final ReconstructionTable table : ReconstructionTable.values()) {
            final Path path = input.getPath(table);
            report.getInputFileBytes().put(path.getFileName().toString(), Files.size(path));
        }

        final Path parentDirectory = absoluteOutput.getParent();
        FileUtil.ensureWritableDirectory(parentDirectory.toFile());
        final Path stagingDirectory =
                Files.createTempDirectory(parentDirectory, "." + absoluteOutput.getFileName() + ".staging-");

        LOG.info("detectFormat: found {}, writing {} tables to staging directory {}",
                 input, outputFormat, stagingDirectory);

        return new Run(input,
                       new ReconstructionFiles(stagingDirectory, outputFormat),
                       absoluteOutput,
                       stagingDirectory);
    }

    private void findCameraOutliers(final Run run,
                                    final CleaningReport report)
            throws IOException {

        try (final RecordReader<CameraRecord> reader = run.input.openCameraReader();
             final RecordWriter<CameraRecord> writer = run.staging.createCameraWriter(null)) {
            while (reader.hasNext()) {
                final CameraRecord camera = reader.next();
                if (! run.cameraIds.add(camera.getCameraId())) {
                    throw new MalformedRecordException(run.input.getPath(ReconstructionTable.CAMERAS),
                                                       "record " + reader.getRecordCount(),
                                                       "duplicate camera id " + camera.getCameraId());
                }
                writer.write(camera);
            }
        }
        report.setCameraCount(run.cameraIds.size());

        final BoundedBuffer<CameraPosition> positions =
                new BoundedBuffer<>("camera position", parameters.maxMaterializedRecords);
        final Path imagePath = run.input.getPath(ReconstructionTable.IMAGES);

        try (final RecordReader<ImageRecord> reader = run.input.openImageReader()) {
            while (reader.hasNext()) {
                final ImageRecord image = reader.next();
                final String position = "record " + reader.getRecordCount();
                if (! run.cameraIds.contains(image.getCameraId())) {
                    throw new MalformedRecordException(imagePath, position,
                                                       image + " references missing camera " +
                                                       image.getCameraId());
                }
                if (! run.imageIds.add(image.getImageId())) {
                    throw new MalformedRecordException(imagePath, position,
                                                       "duplicate image id " + image.getImageId());
                }
                positions.add(image.getCameraPosition());
            }
        } catch (final IllegalStateException e) {
            throw new IllegalArgumentException("too many images in " + imagePath, e);
        }

        if (positions.isEmpty()) {
            throw new IllegalArgumentException("no images found in " + imagePath);
        }

        final CameraOutlierDetector detector = parameters.buildOutlierDetector();
        final CameraOutlierAnalysis analysis = detector.analyze(positions.asList());

        for (final Long imageId : run.imageIds) {
            if (! analysis.isOutlier(imageId)) {
                run.keptImageIds.add(imageId);
            }
        }
        run.analysis = analysis;
        report.setCameraOutliers(analysis);

        LOG.info("findCameraOutliers: found {} outliers in {} cameras using {} threshold {}",
                 analysis.getOutlierCount(), analysis.getTotalCameras(),
                 analysis.getThresholdMode(), analysis.getThresholdUsed());
    }

    private void filterPoints(final Run run,
                              final CleaningReport report)
            throws IOException {

        final Path referenceCloud = parameters.resolveReferenceCloud(run.input.getDirectory());

        final SpatialPointFilter filter;
        final PointFilterStatistics statistics;
        if (referenceCloud == null) {
            filter = null;
            statistics = PointFilterStatistics.skipped("no reference cloud");
        } else {
            final CoordinateTransform transform = parameters.buildCoordinateTransform();
            filter = SpatialPointFilter.fromPly(referenceCloud,
                                                transform,
                                                parameters.spatialFilterThreshold,
                                                parameters.maxMaterializedRecords);
            statistics = PointFilterStatistics.applied(referenceCloud.getFileName().toString(),
                                                       filter.getReferencePointCount(),
                                                       filter.getReferenceRanges(),
                                                       filter.getThreshold(),
                                                       transform.toList());
        }

        final Path pointPath = run.input.getPath(ReconstructionTable.POINTS);
        final Set<UnsignedLong> pointIds = new HashSet<>();
        final CoordinateRanges.Accumulator rangesBefore = new CoordinateRanges.Accumulator();
        final CoordinateRanges.Accumulator rangesAfter = new CoordinateRanges.Accumulator();
        final ProcessTimer timer = new ProcessTimer();
        long trackElementsRemoved = 0;

        try (final RecordReader<PointRecord> reader = run.input.openPointReader();
             final RecordWriter<PointRecord> writer = run.staging.createPointWriter(null)) {

            while (reader.hasNext()) {
                final PointRecord point = reader.next();

                if (! pointIds.add(point.getPointId())) {
                    throw new MalformedRecordException(pointPath,
                                                       "record " + reader.getRecordCount(),
                                                       "duplicate point id " + point.getPointId());
                }

                rangesBefore.include(point.getX(), point.getY(), point.getZ());

                if ((filter == null) || filter.isKept(point.getX(), point.getY(), point.getZ())) {
                    final PointRecord prunedPoint = ReferenceIntegrityRepairer.pruneTrack(point, run.keptImageIds);
                    trackElementsRemoved += point.getTrack().size() - prunedPoint.getTrack().size();
                    writer.write(prunedPoint);
                    run.survivingPointIds.add(point.getPointId());
                    rangesAfter.include(point.getX(), point.getY(), point.getZ());
                }

                if (timer.hasIntervalPassed()) {
                    LOG.info("filterPoints: kept {} of {} points so far",
                             rangesAfter.getCount(), rangesBefore.getCount());
                }
            }
        }

        statistics.setResults(rangesBefore.getCount(),
                              rangesAfter.getCount(),
                              rangesBefore.build(),
                              rangesAfter.build(),
                              trackElementsRemoved);
        report.setPoints(statistics);

        LOG.info("filterPoints: kept {} of {} points, removed {} track elements for removed images",
                 statistics.getPointsAfter(), statistics.getPointsBefore(), trackElementsRemoved);
    }

    private void repairImages(final Run run,
                              final CleaningReport report)
            throws IOException {

        final ReferenceIntegrityRepairer repairer = new ReferenceIntegrityRepairer(run.survivingPointIds);
        long keptImageCount = 0;

        try (final RecordReader<ImageRecord> reader = run.input.openImageReader();
             final RecordWriter<ImageRecord> writer = run.staging.createImageWriter(null)) {
            while (reader.hasNext()) {
                final ImageRecord image = reader.next();
                if (! run.analysis.isOutlier(image.getImageId())) {
                    writer.write(repairer.repair(image));
                    keptImageCount++;
                }
            }
        }

        if (keptImageCount != run.analysis.getKeptCameras()) {
            throw new IllegalStateException("image table changed while cleaning, expected " +
                                            run.analysis.getKeptCameras() + " kept images but found " +
                                            keptImageCount);
        }

        report.setReferences(repairer.getStatistics());

        LOG.info("repairImages: wrote {} images, reference statistics are {}",
                 keptImageCount, repairer.getStatistics());
    }

    private void assembleOutput(final Run run,
                                final CleaningReport report)
            throws IOException {

        final ProcessTimer timer = new ProcessTimer();

        for (final ReconstructionTable table : ReconstructionTable.values()) {
            final Path path = run.staging.getPath(table);
            report.getOutputFileBytes().put(path.getFileName().toString(), Files.size(path));
        }

        FileUtil.saveJsonFile(run.stagingDirectory.resolve(STATS_FILE_NAME), report);

        final Path inputImageDirectory = run.input.getDirectory().resolve(IMAGE_DIRECTORY_NAME);
        if (parameters.linkImageDirectory && Files.isDirectory(inputImageDirectory)) {
            Files.createSymbolicLink(run.stagingDirectory.resolve(IMAGE_DIRECTORY_NAME), inputImageDirectory);
        }

        // timing for this stage covers everything up to the timings file itself
        report.getTimings().add(CleaningStage.ASSEMBLE_OUTPUT, timer.getElapsedMilliseconds());
        FileUtil.saveJsonFile(run.stagingDirectory.resolve(TIMINGS_FILE_NAME), report.getTimings());

        publish(run.stagingDirectory, run.outputDirectory);
    }

    /**
     * Moves staged files into place.  A new output directory is published with a single move.
     * Publishing into an existing directory replaces one file at a time, so readers may briefly
     * see a mix of old and new files there.  Staged files are moved before any stale
     * reconstruction table of the other serialization is deleted, so an interrupted publish
     * never leaves the directory without a complete set of tables.
     */
    static void publish(final Path stagingDirectory,
                        final Path outputDirectory)
            throws IOException {

        if (! Files.exists(outputDirectory)) {
            try {
                Files.move(stagingDirectory, outputDirectory, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                LOG.info("publish: atomic move not supported, moving {} without it", stagingDirectory);
                Files.move(stagingDirectory, outputDirectory);
            }
        } else {
            if (! Files.isDirectory(outputDirectory)) {
                throw new IOException("output path " + outputDirectory + " exists but is not a directory");
            }
            final List<Path> stagedPaths;
            try (final Stream<Path> stream = Files.list(stagingDirectory)) {
                stagedPaths = stream.sorted().collect(Collectors.toList());
            }
            final Set<String> publishedNames = new HashSet<>();
            for (final Path stagedPath : stagedPaths) {
                final Path targetPath = outputDirectory.resolve(stagedPath.getFileName());
                if (Files.isSymbolicLink(targetPath) || (! Files.isDirectory(targetPath))) {
                    Files.move(stagedPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    LOG.info("publish: keeping existing directory {}", targetPath);
                    Files.delete(stagedPath);
                }
                publishedNames.add(stagedPath.getFileName().toString());
            }
            for (final ReconstructionFormat format : new ReconstructionFormat[] {
                    ReconstructionFormat.TEXT, ReconstructionFormat.BINARY }) {
                for (final ReconstructionTable table : ReconstructionTable.values()) {
                    final String tableName = table.getFileName(format);
                    final Path tablePath = outputDirectory.resolve(tableName);
                    if ((! publishedNames.contains(tableName)) && Files.deleteIfExists(tablePath)) {
                        LOG.info("publish: removed stale table {}", tablePath);
                    }
                }
            }
        }

        LOG.info("publish: published {}", outputDirectory);
    }

    private <T> T runStage(final CleaningStage stage,
                           final CleaningReport report,
                           final StageAction<T> action)
            throws CleaningException {

        LOG.info("runStage: entry, stage={}", stage);

        final ProcessTimer timer = new ProcessTimer();
        final T result;
        try {
            result = action.run();
        } catch (final IOException | RuntimeException e) {
            LOG.error("runStage: {} stage failed", stage, e);
            throw new CleaningException(stage, e);
        }

        // assemble stage records its own timing before the timings file is written
        if (stage != CleaningStage.ASSEMBLE_OUTPUT) {
            report.getTimings().add(stage, timer.getElapsedMilliseconds());
        }

        LOG.info("runStage: exit, stage={} completed in {} ms", stage, timer.getElapsedMilliseconds());

        return result;
    }

    @FunctionalInterface
    private interface StageAction<T> {
        T run() throws IOException;
    }

    /**
     * State that crosses stage boundaries during one run.
     */
    private static class Run {

        private final ReconstructionFiles input;
        private final ReconstructionFiles staging;
        private final Path outputDirectory;
        private final Path stagingDirectory;
        private final Set<Long> cameraIds;
        private final Set<Long> imageIds;
        private final Set<Long> keptImageIds;
        private final Set<UnsignedLong> survivingPointIds;
        private CameraOutlierAnalysis analysis;

        private Run(final ReconstructionFiles input,
                    final ReconstructionFiles staging,
                    final Path outputDirectory,
                    final Path stagingDirectory) {
            this.input = input;
            this.staging = staging;
            this.outputDirectory = outputDirectory;
            this.stagingDirectory = stagingDirectory;
            this.cameraIds = new HashSet<>();
            this.imageIds = new HashSet<>();
            this.keptImageIds = new HashSet<>();
            this.survivingPointIds = new HashSet<>();
            this.analysis = null;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CleaningOrchestrator.class);
}
