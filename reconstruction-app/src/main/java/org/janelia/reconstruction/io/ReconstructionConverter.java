package org.janelia.reconstruction.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.janelia.reconstruction.model.CameraRecord;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.util.FileUtil;
import org.janelia.reconstruction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a reconstruction between serializations by streaming each table
 * from a reader of the source format into a writer of the target format.
 * At most one record is held in memory at a time.
 */
public class ReconstructionConverter {

    /**
     * @return number of records converted for each table.
     *
     * @throws IllegalArgumentException
     *   if the source directory does not contain a recognized reconstruction
     *   or the source and target directories are the same.
     */
    public static Map<ReconstructionTable, Long> convert(final Path sourceDirectory,
                                                         final Path targetDirectory,
                                                         final ReconstructionFormat targetFormat)
            throws IOException, IllegalArgumentException {

        LOG.info("convert: entry, sourceDirectory={}, targetDirectory={}, targetFormat={}",
                 sourceDirectory, targetDirectory, targetFormat);

        final ReconstructionFormat sourceFormat = FormatDetector.detect(sourceDirectory);
        if (! sourceFormat.isRecognized()) {
            throw new IllegalArgumentException("no complete text or binary reconstruction found in " +
                                               sourceDirectory);
        }
        if (Files.exists(targetDirectory) && Files.isSameFile(sourceDirectory, targetDirectory)) {
            throw new IllegalArgumentException("target directory must differ from source directory " +
                                               sourceDirectory);
        }

        FileUtil.ensureWritableDirectory(targetDirectory.toFile());

        final ReconstructionFiles source = new ReconstructionFiles(sourceDirectory, sourceFormat);
        final ReconstructionFiles target = new ReconstructionFiles(targetDirectory, targetFormat);
        final ProcessTimer timer = new ProcessTimer();
        final Map<ReconstructionTable, Long> counts = new EnumMap<>(ReconstructionTable.class);

        try (final RecordReader<CameraRecord> reader = source.openCameraReader();
             final RecordWriter<CameraRecord> writer =
                     target.createCameraWriter(ReconstructionFiles.getHeaderComments(reader))) {
            counts.put(ReconstructionTable.CAMERAS, copy(reader, writer));
        }

        try (final RecordReader<ImageRecord> reader = source.openImageReader();
             final RecordWriter<ImageRecord> writer =
                     target.createImageWriter(ReconstructionFiles.getHeaderComments(reader))) {
            counts.put(ReconstructionTable.IMAGES, copy(reader, writer));
        }

        try (final RecordReader<PointRecord> reader = source.openPointReader();
             final RecordWriter<PointRecord> writer =
                     target.createPointWriter(ReconstructionFiles.getHeaderComments(reader))) {
            counts.put(ReconstructionTable.POINTS, copy(reader, writer));
        }

        LOG.info("convert: exit, converted {} {} to {} in {}", sourceFormat, counts, targetFormat, timer);

        return counts;
    }

    /**
     * Streams every remaining record of the reader into the writer.
     *
     * @return number of records copied.
     */
    public static <T> long copy(final RecordReader<T> reader,
                                final RecordWriter<T> writer)
            throws IOException {
        long count = 0;
        while (reader.hasNext()) {
            writer.write(reader.next());
            count++;
        }
        return count;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionConverter.class);
}
