package org.janelia.reconstruction.io.text;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;

/**
 * Reads image tables where each image spans two lines:
 * <pre>
 *   IMAGE_ID QW QX QY QZ TX TY TZ CAMERA_ID NAME
 *   POINTS2D[] as (X Y POINT3D_ID)
 * </pre>
 * The observation line must directly follow its pose line and may be empty.
 */
public class TextImageReader
        extends TextRecordReader<ImageRecord> {

    public TextImageReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected ImageRecord parseRecord(final String line)
            throws IOException, MalformedRecordException {

        // name is everything after the camera id so that embedded spaces are preserved
        final String[] w = splitFields(line, POSE_FIELD_COUNT);
        if (w.length < POSE_FIELD_COUNT) {
            throw malformed("image pose line has " + w.length + " fields but " + POSE_FIELD_COUNT +
                            " are required");
        }

        final long imageId = parseUnsignedInt(w[0], "image id");
        final double qw = parseDouble(w[1], "qw");
        final double qx = parseDouble(w[2], "qx");
        final double qy = parseDouble(w[3], "qy");
        final double qz = parseDouble(w[4], "qz");
        final double tx = parseDouble(w[5], "tx");
        final double ty = parseDouble(w[6], "ty");
        final double tz = parseDouble(w[7], "tz");
        final long cameraId = parseUnsignedInt(w[8], "camera id");
        final String name = w[9];

        final String observationLine = readContinuationLine("observation (POINTS2D) for image " + imageId);
        final List<Observation> observations = parseObservations(observationLine, imageId);

        return new ImageRecord(imageId, qw, qx, qy, qz, tx, ty, tz, cameraId, name, observations);
    }

    private List<Observation> parseObservations(final String observationLine,
                                                final long imageId)
            throws MalformedRecordException {

        if (observationLine.trim().isEmpty()) {
            return Collections.emptyList();
        }

        final String[] w = splitFields(observationLine);
        if ((w.length % 3) != 0) {
            throw malformed("observation line for image " + imageId + " has " + w.length +
                            " fields which is not a multiple of 3");
        }

        final List<Observation> observations = new ArrayList<>(w.length / 3);
        for (int i = 0; i < w.length; i += 3) {
            final double x = parseDouble(w[i], "observation x");
            final double y = parseDouble(w[i + 1], "observation y");
            final long pointReference = parseLong(w[i + 2], "observation point reference");
            try {
                observations.add(new Observation(x, y, pointReference));
            } catch (final IllegalArgumentException e) {
                throw malformed(e.getMessage(), e);
            }
        }

        return observations;
    }

    private static final int POSE_FIELD_COUNT = 10;
}
