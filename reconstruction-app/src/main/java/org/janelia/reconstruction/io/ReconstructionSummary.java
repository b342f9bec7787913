package org.janelia.reconstruction.io;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record counts for the tables of a reconstruction directory.
 */
public class ReconstructionSummary
        implements Serializable {

    private final ReconstructionFormat format;
    private final long cameraCount;
    private final long imageCount;
    private final long pointCount;
    private final long observationCount;
    private final long matchedObservationCount;
    private final long trackElementCount;

    @SuppressWarnings("unused")
    private ReconstructionSummary() {
        this(ReconstructionFormat.UNRECOGNIZED, 0, 0, 0, 0, 0, 0);
    }

    public ReconstructionSummary(final ReconstructionFormat format,
                                 final long cameraCount,
                                 final long imageCount,
                                 final long pointCount,
                                 final long observationCount,
                                 final long matchedObservationCount,
                                 final long trackElementCount) {
        this.format = format;
        this.cameraCount = cameraCount;
        this.imageCount = imageCount;
        this.pointCount = pointCount;
        this.observationCount = observationCount;
        this.matchedObservationCount = matchedObservationCount;
        this.trackElementCount = trackElementCount;
    }

    /**
     * Streams every table in the directory (validating each record) to count its contents.
     *
     * @throws IllegalArgumentException
     *   if the directory does not contain a recognized reconstruction or a record is malformed.
     */
    public static ReconstructionSummary summarize(final Path directory)
            throws IOException, IllegalArgumentException {

        final ReconstructionFormat format = FormatDetector.detect(directory);
        if (! format.isRecognized()) {
            throw new IllegalArgumentException("no complete text or binary reconstruction found in " + directory);
        }

        final ReconstructionFiles files = new ReconstructionFiles(directory, format);

        long cameraCount = 0;
        try (final RecordReader<?> reader = files.openCameraReader()) {
            while (reader.hasNext()) {
                reader.next();
                cameraCount++;
            }
        }

        long imageCount = 0;
        long observationCount = 0;
        long matchedObservationCount = 0;
        try (final RecordReader<ImageRecord> reader = files.openImageReader()) {
            while (reader.hasNext()) {
                final ImageRecord image = reader.next();
                imageCount++;
                for (final Observation observation : image.getObservations()) {
                    observationCount++;
                    if (observation.isMatched()) {
                        matchedObservationCount++;
                    }
                }
            }
        }

        long pointCount = 0;
        long trackElementCount = 0;
        try (final RecordReader<PointRecord> reader = files.openPointReader()) {
            while (reader.hasNext()) {
                trackElementCount += reader.next().getTrack().size();
                pointCount++;
            }
        }

        final ReconstructionSummary summary = new ReconstructionSummary(format,
                                                                        cameraCount,
                                                                        imageCount,
                                                                        pointCount,
                                                                        observationCount,
                                                                        matchedObservationCount,
                                                                        trackElementCount);

        LOG.info("summarize: exit, {} contains {}", directory, summary);

        return summary;
    }

    public ReconstructionFormat getFormat() {
        return format;
    }

    public long getCameraCount() {
        return cameraCount;
    }

    public long getImageCount() {
        return imageCount;
    }

    public long getPointCount() {
        return pointCount;
    }

    public long getObservationCount() {
        return observationCount;
    }

    public long getMatchedObservationCount() {
        return matchedObservationCount;
    }

    public long getTrackElementCount() {
        return trackElementCount;
    }

    @Override
    public String toString() {
        return "{format: " + format +
               ", cameraCount: " + cameraCount +
               ", imageCount: " + imageCount +
               ", pointCount: " + pointCount +
               ", observationCount: " + observationCount +
               ", matchedObservationCount: " + matchedObservationCount +
               ", trackElementCount: " + trackElementCount + "}";
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionSummary.class);
}
