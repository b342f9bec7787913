package org.janelia.reconstruction.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Standard lens models with their binary model identifiers and parameter counts.
 */
public enum CameraModel {

    SIMPLE_PINHOLE(0, 3),
    PINHOLE(1, 4),
    SIMPLE_RADIAL(2, 4),
    RADIAL(3, 5),
    OPENCV(4, 8),
    OPENCV_FISHEYE(5, 8),
    FULL_OPENCV(6, 12),
    FOV(7, 5),
    SIMPLE_RADIAL_FISHEYE(8, 4),
    RADIAL_FISHEYE(9, 5),
    THIN_PRISM_FISHEYE(10, 12);

    private final int modelId;
    private final int parameterCount;

    CameraModel(final int modelId,
                final int parameterCount) {
        this.modelId = modelId;
        this.parameterCount = parameterCount;
    }

    public int getModelId() {
        return modelId;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    /**
     * @return model with the specified binary identifier.
     *
     * @throws IllegalArgumentException
     *   if the identifier is not recognized.
     */
    public static CameraModel fromModelId(final int modelId)
            throws IllegalArgumentException {
        final CameraModel model = ID_TO_MODEL.get(modelId);
        if (model == null) {
            throw new IllegalArgumentException("unknown camera model id " + modelId);
        }
        return model;
    }

    /**
     * @return model with the specified text tag (e.g. PINHOLE).
     *
     * @throws IllegalArgumentException
     *   if the tag is not recognized.
     */
    public static CameraModel fromTag(final String tag)
            throws IllegalArgumentException {
        final CameraModel model = TAG_TO_MODEL.get(tag);
        if (model == null) {
            throw new IllegalArgumentException("unknown camera model '" + tag + "'");
        }
        return model;
    }

    private static final Map<Integer, CameraModel> ID_TO_MODEL = new HashMap<>();
    private static final Map<String, CameraModel> TAG_TO_MODEL = new HashMap<>();
    static {
        for (final CameraModel model : values()) {
            ID_TO_MODEL.put(model.modelId, model);
            TAG_TO_MODEL.put(model.name(), model);
        }
    }
}
