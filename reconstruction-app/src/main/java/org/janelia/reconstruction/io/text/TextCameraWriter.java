package org.janelia.reconstruction.io.text;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.janelia.reconstruction.model.CameraRecord;

/**
 * Writes camera tables in the format read by {@link TextCameraReader}.
 */
public class TextCameraWriter
        extends TextRecordWriter<CameraRecord> {

    public static final List<String> DEFAULT_HEADER = Arrays.asList(
            "# Camera list with one line of data per camera:",
            "#   CAMERA_ID, MODEL, WIDTH, HEIGHT, PARAMS[]");

    public TextCameraWriter(final Path path)
            throws IOException {
        this(path, DEFAULT_HEADER);
    }

    public TextCameraWriter(final Path path,
                            final List<String> headerComments)
            throws IOException {
        super(path, headerComments);
    }

    @Override
    protected void appendRecord(final CameraRecord camera,
                                final StringBuilder sb) {
        sb.append(camera.getCameraId()).append(' ');
        sb.append(camera.getModel().name()).append(' ');
        sb.append(camera.getWidth()).append(' ');
        sb.append(camera.getHeight());
        for (final double parameter : camera.getParameters()) {
            sb.append(' ').append(parameter);
        }
    }

}
