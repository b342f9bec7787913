package org.janelia.reconstruction.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.janelia.reconstruction.io.binary.BinaryCameraReader;
import org.janelia.reconstruction.io.binary.BinaryCameraWriter;
import org.janelia.reconstruction.io.binary.BinaryImageReader;
import org.janelia.reconstruction.io.binary.BinaryImageWriter;
import org.janelia.reconstruction.io.binary.BinaryPointReader;
import org.janelia.reconstruction.io.binary.BinaryPointWriter;
import org.janelia.reconstruction.io.text.TextCameraReader;
import org.janelia.reconstruction.io.text.TextCameraWriter;
import org.janelia.reconstruction.io.text.TextImageReader;
import org.janelia.reconstruction.io.text.TextImageWriter;
import org.janelia.reconstruction.io.text.TextPointReader;
import org.janelia.reconstruction.io.text.TextPointWriter;
import org.janelia.reconstruction.io.text.TextRecordReader;
import org.janelia.reconstruction.model.CameraRecord;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.PointRecord;

/**
 * Opens format specific readers and writers for the tables of a reconstruction directory,
 * so that callers can process records without caring how they are serialized.
 */
public class ReconstructionFiles {

    private final Path directory;
    private final ReconstructionFormat format;

    /**
     * @throws IllegalArgumentException
     *   if the format is not a concrete serialization.
     */
    public ReconstructionFiles(final Path directory,
                               final ReconstructionFormat format)
            throws IllegalArgumentException {
        if (! format.isRecognized()) {
            throw new IllegalArgumentException("cannot access " + format + " tables in " + directory);
        }
        this.directory = directory;
        this.format = format;
    }

    public Path getDirectory() {
        return directory;
    }

    public ReconstructionFormat getFormat() {
        return format;
    }

    public Path getPath(final ReconstructionTable table) {
        return directory.resolve(table.getFileName(format));
    }

    public RecordReader<CameraRecord> openCameraReader()
            throws IOException {
        final Path path = getPath(ReconstructionTable.CAMERAS);
        return format == ReconstructionFormat.TEXT ? new TextCameraReader(path) : new BinaryCameraReader(path);
    }

    public RecordReader<ImageRecord> openImageReader()
            throws IOException {
        final Path path = getPath(ReconstructionTable.IMAGES);
        return format == ReconstructionFormat.TEXT ? new TextImageReader(path) : new BinaryImageReader(path);
    }

    public RecordReader<PointRecord> openPointReader()
            throws IOException {
        final Path path = getPath(ReconstructionTable.POINTS);
        return format == ReconstructionFormat.TEXT ? new TextPointReader(path) : new BinaryPointReader(path);
    }

    /**
     * @param  headerComments  comments for text tables, or null to use the standard header.
     *                         Ignored for binary tables.
     */
    public RecordWriter<CameraRecord> createCameraWriter(final List<String> headerComments)
            throws IOException {
        final Path path = getPath(ReconstructionTable.CAMERAS);
        final RecordWriter<CameraRecord> writer;
        if (format == ReconstructionFormat.TEXT) {
            writer = new TextCameraWriter(path,
                                          headerComments == null ? TextCameraWriter.DEFAULT_HEADER : headerComments);
        } else {
            writer = new BinaryCameraWriter(path);
        }
        return writer;
    }

    /**
     * @param  headerComments  comments for text tables, or null to use the standard header.
     *                         Ignored for binary tables.
     */
    public RecordWriter<ImageRecord> createImageWriter(final List<String> headerComments)
            throws IOException {
        final Path path = getPath(ReconstructionTable.IMAGES);
        final RecordWriter<ImageRecord> writer;
        if (format == ReconstructionFormat.TEXT) {
            writer = new TextImageWriter(path,
                                         headerComments == null ? TextImageWriter.DEFAULT_HEADER : headerComments);
        } else {
            writer = new BinaryImageWriter(path);
        }
        return writer;
    }

    /**
     * @param  headerComments  comments for text tables, or null to use the standard header.
     *                         Ignored for binary tables.
     */
    public RecordWriter<PointRecord> createPointWriter(final List<String> headerComments)
            throws IOException {
        final Path path = getPath(ReconstructionTable.POINTS);
        final RecordWriter<PointRecord> writer;
        if (format == ReconstructionFormat.TEXT) {
            writer = new TextPointWriter(path,
                                         headerComments == null ? TextPointWriter.DEFAULT_HEADER : headerComments);
        } else {
            writer = new BinaryPointWriter(path);
        }
        return writer;
    }

    /**
     * @return header comments of the specified reader when it is a text reader, otherwise null.
     */
    public static List<String> getHeaderComments(final RecordReader<?> reader) {
        List<String> headerComments = null;
        if (reader instanceof TextRecordReader) {
            headerComments = ((TextRecordReader<?>) reader).getHeaderComments();
        }
        return headerComments;
    }

    @Override
    public String toString() {
        return format + " reconstruction in " + directory;
    }
}
