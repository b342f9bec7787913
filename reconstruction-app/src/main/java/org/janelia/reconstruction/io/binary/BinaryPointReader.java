package org.janelia.reconstruction.io.binary;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Reads packed 3D point tables.  Record layout:
 * <pre>
 *   uint64 point3D_id, float64 x y z, uint8 r g b, float64 error,
 *   uint64 track_length, track_length x (uint32 image_id, uint32 point2D_idx)
 * </pre>
 */
public class BinaryPointReader
        extends BinaryRecordReader<PointRecord> {

    public BinaryPointReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected PointRecord readRecord()
            throws IOException, MalformedRecordException {

        final UnsignedLong pointId = readUInt64();
        final double x = readFloat64();
        final double y = readFloat64();
        final double z = readFloat64();
        final int red = readUInt8();
        final int green = readUInt8();
        final int blue = readUInt8();
        final double error = readFloat64();

        final int trackLength = readLength("track of point " + pointId, TRACK_ELEMENT_BYTES);
        final List<TrackElement> track = new ArrayList<>();
        for (int i = 0; i < trackLength; i++) {
            final long imageId = readUInt32();
            final long observationIndex = readUInt32();
            track.add(new TrackElement(imageId, observationIndex));
        }

        return new PointRecord(pointId, x, y, z, red, green, blue, error, track);
    }

    /** Two uint32 values. */
    private static final int TRACK_ELEMENT_BYTES = 8;
}
