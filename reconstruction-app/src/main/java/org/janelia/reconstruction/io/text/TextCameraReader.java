package org.janelia.reconstruction.io.text;

import java.io.IOException;
import java.nio.file.Path;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.model.CameraModel;
import org.janelia.reconstruction.model.CameraRecord;

/**
 * Reads camera tables with one line per camera:
 * <pre>
 *   CAMERA_ID MODEL WIDTH HEIGHT PARAMS[]
 * </pre>
 */
public class TextCameraReader
        extends TextRecordReader<CameraRecord> {

    public TextCameraReader(final Path path)
            throws IOException {
        super(path);
    }

    @Override
    protected CameraRecord parseRecord(final String line)
            throws MalformedRecordException {

        final String[] w = splitFields(line);
        if (w.length < 4) {
            throw malformed("camera line has " + w.length + " fields but at least 4 are required");
        }

        final long cameraId = parseUnsignedInt(w[0], "camera id");

        final CameraModel model;
        try {
            model = CameraModel.fromTag(w[1]);
        } catch (final IllegalArgumentException e) {
            throw malformed(e.getMessage(), e);
        }

        final int parameterCount = w.length - 4;
        if (parameterCount != model.getParameterCount()) {
            throw malformed(model + " camera " + cameraId + " has " + parameterCount +
                            " parameters but " + model.getParameterCount() + " are required");
        }

        final long width = parseLong(w[2], "width");
        final long height = parseLong(w[3], "height");
        final double[] parameters = new double[parameterCount];
        for (int i = 0; i < parameterCount; i++) {
            parameters[i] = parseDouble(w[i + 4], "camera parameter");
        }

        return new CameraRecord(cameraId, model, width, height, parameters);
    }

}
