package org.janelia.reconstruction.io.text;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Writes 3D point tables in the format read by {@link TextPointReader}.
 */
public class TextPointWriter
        extends TextRecordWriter<PointRecord> {

    public static final List<String> DEFAULT_HEADER = Arrays.asList(
            "# 3D point list with one line of data per point:",
            "#   POINT3D_ID, X, Y, Z, R, G, B, ERROR, TRACK[] as (IMAGE_ID, POINT2D_IDX)");

    public TextPointWriter(final Path path)
            throws IOException {
        this(path, DEFAULT_HEADER);
    }

    public TextPointWriter(final Path path,
                           final List<String> headerComments)
            throws IOException {
        super(path, headerComments);
    }

    @Override
    protected void appendRecord(final PointRecord point,
                                final StringBuilder sb) {
        sb.append(point.getPointId()).append(' ');
        sb.append(point.getX()).append(' ');
        sb.append(point.getY()).append(' ');
        sb.append(point.getZ()).append(' ');
        sb.append(point.getRed()).append(' ');
        sb.append(point.getGreen()).append(' ');
        sb.append(point.getBlue()).append(' ');
        sb.append(point.getError());
        for (final TrackElement element : point.getTrack()) {
            sb.append(' ').append(element.getImageId());
            sb.append(' ').append(element.getObservationIndex());
        }
    }

}
