package org.janelia.reconstruction.io.text;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;

/**
 * Writes image tables in the two-lines-per-image format read by {@link TextImageReader}.
 * An image without observations gets an empty second line.
 * Names that the reader could not return unchanged are rejected.
 */
public class TextImageWriter
        extends TextRecordWriter<ImageRecord> {

    public static final List<String> DEFAULT_HEADER = Arrays.asList(
            "# Image list with two lines of data per image:",
            "#   IMAGE_ID, QW, QX, QY, QZ, TX, TY, TZ, CAMERA_ID, NAME",
            "#   POINTS2D[] as (X, Y, POINT3D_ID)");

    public TextImageWriter(final Path path)
            throws IOException {
        this(path, DEFAULT_HEADER);
    }

    public TextImageWriter(final Path path,
                           final List<String> headerComments)
            throws IOException {
        super(path, headerComments);
    }

    @Override
    protected void appendRecord(final ImageRecord image,
                                final StringBuilder sb) {

        validateName(image);

        sb.append(image.getImageId()).append(' ');
        sb.append(image.getQw()).append(' ');
        sb.append(image.getQx()).append(' ');
        sb.append(image.getQy()).append(' ');
        sb.append(image.getQz()).append(' ');
        sb.append(image.getTx()).append(' ');
        sb.append(image.getTy()).append(' ');
        sb.append(image.getTz()).append(' ');
        sb.append(image.getCameraId()).append(' ');
        sb.append(image.getName()).append('\n');

        boolean isFirst = true;
        for (final Observation observation : image.getObservations()) {
            if (isFirst) {
                isFirst = false;
            } else {
                sb.append(' ');
            }
            sb.append(observation.getX()).append(' ');
            sb.append(observation.getY()).append(' ');
            sb.append(observation.getPointReference());
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if the image name is empty, spans more than one line, or starts or ends with whitespace.
     */
    static void validateName(final ImageRecord image)
            throws IllegalArgumentException {
        final String name = image.getName();
        final String problem;
        if (name.isEmpty()) {
            problem = "is empty";
        } else if ((name.indexOf('\n') >= 0) || (name.indexOf('\r') >= 0)) {
            problem = "contains a line terminator";
        } else if (! name.trim().equals(name)) {
            problem = "starts or ends with whitespace";
        } else {
            problem = null;
        }
        if (problem != null) {
            throw new IllegalArgumentException("name of image " + image.getImageId() + " " + problem +
                                               " and cannot be written to a text image table");
        }
    }

}
