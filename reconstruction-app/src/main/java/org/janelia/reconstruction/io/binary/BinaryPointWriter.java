package org.janelia.reconstruction.io.binary;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Writes 3D point tables in the layout read by {@link BinaryPointReader}.
 */
public class BinaryPointWriter
        extends BinaryRecordWriter<PointRecord> {

    public BinaryPointWriter(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected void writeRecord(final PointRecord point)
            throws IOException {

        writeUInt64(point.getPointId());
        writeFloat64(point.getX());
        writeFloat64(point.getY());
        writeFloat64(point.getZ());
        writeUInt8(point.getRed());
        writeUInt8(point.getGreen());
        writeUInt8(point.getBlue());
        writeFloat64(point.getError());

        final List<TrackElement> track = point.getTrack();
        writeUInt64(UnsignedLong.valueOf(track.size()));
        for (final TrackElement element : track) {
            writeUInt32(element.getImageId());
            writeUInt32(element.getObservationIndex());
        }
    }

}
