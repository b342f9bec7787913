package org.janelia.reconstruction.io.binary;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.reconstruction.model.CameraRecord;

/**
 * Writes camera tables in the layout read by {@link BinaryCameraReader}.
 */
public class BinaryCameraWriter
        extends BinaryRecordWriter<CameraRecord> {

    public BinaryCameraWriter(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected void writeRecord(final CameraRecord camera)
            throws IOException {
        writeUInt32(camera.getCameraId());
        writeInt32(camera.getModel().getModelId());
        writeUInt64(UnsignedLong.fromLongBits(camera.getWidth()));
        writeUInt64(UnsignedLong.fromLongBits(camera.getHeight()));
        for (final double parameter : camera.getParameters()) {
            writeFloat64(parameter);
        }
    }

}
