package org.janelia.reconstruction.io.text;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Reads 3D point tables with one line per point:
 * <pre>
 *   POINT3D_ID X Y Z R G B ERROR TRACK[] as (IMAGE_ID POINT2D_IDX)
 * </pre>
 */
public class TextPointReader
        extends TextRecordReader<PointRecord> {

    public TextPointReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected PointRecord parseRecord(final String line)
            throws MalformedRecordException {

        final String[] w = splitFields(line);
        if (w.length < FIXED_FIELD_COUNT) {
            throw malformed("point line has " + w.length + " fields but at least " + FIXED_FIELD_COUNT +
                            " are required");
        }
        if (((w.length - FIXED_FIELD_COUNT) % 2) != 0) {
            throw malformed("point track has an odd number of values");
        }

        final UnsignedLong pointId = parseUnsignedLong(w[0], "point id");
        final double x = parseDouble(w[1], "x");
        final double y = parseDouble(w[2], "y");
        final double z = parseDouble(w[3], "z");
        final int red = parseInt(w[4], "red");
        final int green = parseInt(w[5], "green");
        final int blue = parseInt(w[6], "blue");
        final double error = parseDouble(w[7], "error");

        final List<TrackElement> track = new ArrayList<>((w.length - FIXED_FIELD_COUNT) / 2);
        for (int i = FIXED_FIELD_COUNT; i < w.length; i += 2) {
            track.add(new TrackElement(parseUnsignedInt(w[i], "track image id"),
                                       parseUnsignedInt(w[i + 1], "track observation index")));
        }

        try {
            return new PointRecord(pointId, x, y, z, red, green, blue, error, track);
        } catch (final IllegalArgumentException e) {
            throw malformed(e.getMessage(), e);
        }
    }

    private static final int FIXED_FIELD_COUNT = 8;
}
