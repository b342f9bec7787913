package org.janelia.reconstruction.model;

/**
 * Image id, name, and translation vector of a registered camera, used for outlier analysis.
 */
public class CameraPosition {

    private final long imageId;
    private final String name;
    private final double x;
    private final double y;
    private final double z;

    public CameraPosition(final long imageId,
                          final String name,
                          final double x,
                          final double y,
                          final double z) {
        this.imageId = imageId;
        this.name = name;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public long getImageId() {
        return imageId;
    }

    public String getName() {
        return name;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public double distanceTo(final double[] center) {
        final double dx = x - center[0];
        final double dy = y - center[1];
        final double dz = z - center[2];
        return Math.sqrt((dx * dx) + (dy * dy) + (dz * dz));
    }

    @Override
    public String toString() {
        return name + " [" + x + ", " + y + ", " + z + "]";
    }
}
