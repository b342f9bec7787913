package org.janelia.reconstruction.io.binary;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.CameraModel;
import org.janelia.reconstruction.model.CameraRecord;

/**
 * Reads packed camera tables.  Record layout:
 * <pre>
 *   uint32 camera_id, int32 model_id, uint64 width, uint64 height, float64 params[model parameter count]
 * </pre>
 */
public class BinaryCameraReader
        extends BinaryRecordReader<CameraRecord> {

    public BinaryCameraReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected CameraRecord readRecord()
            throws IOException, MalformedRecordException {

        final long cameraId = readUInt32();
        final int modelId = readInt32();

        final CameraModel model;
        try {
            model = CameraModel.fromModelId(modelId);
        } catch (final IllegalArgumentException e) {
            throw malformed(e.getMessage(), e);
        }

        final long width = readUInt64().longValue();
        final long height = readUInt64().longValue();

        final double[] parameters = new double[model.getParameterCount()];
        for (int i = 0; i < parameters.length; i++) {
            parameters[i] = readFloat64();
        }

        return new CameraRecord(cameraId, model, width, height, parameters);
    }

}
