package org.janelia.reconstruction.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Intrinsics for one physical camera: lens model, sensor size, and model parameters.
 */
public class CameraRecord {

    private final long cameraId;
    private final CameraModel model;
    private final long width;
    private final long height;
    private final double[] parameters;

    public CameraRecord(final long cameraId,
                        final CameraModel model,
                        final long width,
                        final long height,
                        final double[] parameters)
            throws IllegalArgumentException {

        if (parameters.length != model.getParameterCount()) {
            throw new IllegalArgumentException(
                    model + " camera " + cameraId + " requires " + model.getParameterCount() +
                    " parameters but " + parameters.length + " were specified");
        }

        this.cameraId = cameraId;
        this.model = model;
        this.width = width;
        this.height = height;
        this.parameters = parameters.clone();
    }

    public long getCameraId() {
        return cameraId;
    }

    public CameraModel getModel() {
        return model;
    }

    public long getWidth() {
        return width;
    }

    public long getHeight() {
        return height;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    public double getParameter(final int index) {
        return parameters[index];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final CameraRecord that = (CameraRecord) o;
        return (cameraId == that.cameraId) &&
               (width == that.width) &&
               (height == that.height) &&
               (model == that.model) &&
               Arrays.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(cameraId, model, width, height) + Arrays.hashCode(parameters);
    }

    @Override
    public String toString() {
        return "camera " + cameraId + " (" + model + " " + width + "x" + height + ")";
    }
}
