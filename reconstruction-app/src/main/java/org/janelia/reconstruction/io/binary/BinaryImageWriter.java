package org.janelia.reconstruction.io.binary;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;

/**
 * Writes image tables in the layout read by {@link BinaryImageReader}.
 */
public class BinaryImageWriter
        extends BinaryRecordWriter<ImageRecord> {

    public BinaryImageWriter(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected void writeRecord(final ImageRecord image)
            throws IOException {

        writeUInt32(image.getImageId());
        writeFloat64(image.getQw());
        writeFloat64(image.getQx());
        writeFloat64(image.getQy());
        writeFloat64(image.getQz());
        writeFloat64(image.getTx());
        writeFloat64(image.getTy());
        writeFloat64(image.getTz());
        writeUInt32(image.getCameraId());
        writeNullTerminatedString(image.getName());

        final List<Observation> observations = image.getObservations();
        writeUInt64(UnsignedLong.valueOf(observations.size()));
        for (final Observation observation : observations) {
            writeFloat64(observation.getX());
            writeFloat64(observation.getY());
            writeInt64(observation.getPointReference());
        }
    }

}
