package org.janelia.reconstruction.io.binary;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;

/**
 * Reads packed image tables.  Record layout:
 * <pre>
 *   uint32 image_id, float64 qw qx qy qz, float64 tx ty tz, uint32 camera_id, char name[] (null terminated),
 *   uint64 observation_count, observation_count x (float64 x, float64 y, int64 point3D_id)
 * </pre>
 * The per-observation point reference is signed because unmatched observations carry -1.
 */
public class BinaryImageReader
        extends BinaryRecordReader<ImageRecord> {

    public BinaryImageReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected ImageRecord readRecord()
            throws IOException, MalformedRecordException {

        final long imageId = readUInt32();
        final double qw = readFloat64();
        final double qx = readFloat64();
        final double qy = readFloat64();
        final double qz = readFloat64();
        final double tx = readFloat64();
        final double ty = readFloat64();
        final double tz = readFloat64();
        final long cameraId = readUInt32();
        final String name = readNullTerminatedString("name of image " + imageId);

        final int observationCount = readLength("observation list of image " + imageId,
                                                OBSERVATION_BYTES);
        final List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < observationCount; i++) {
            final double x = readFloat64();
            final double y = readFloat64();
            final long pointReference = readInt64();
            try {
                observations.add(new Observation(x, y, pointReference));
            } catch (final IllegalArgumentException e) {
                throw malformed("image " + imageId + " observation " + i + ": " + e.getMessage(), e);
            }
        }

        return new ImageRecord(imageId, qw, qx, qy, qz, tx, ty, tz, cameraId, name, observations);
    }

    /** Two float64 coordinates and an int64 point reference. */
    private static final int OBSERVATION_BYTES = 24;
}
