package org.janelia.reconstruction.filter;

import java.io.Serializable;

import org.janelia.reconstruction.model.CameraPosition;

/**
 * A camera classified as an outlier along with its distance from the robust center.
 */
public class CameraOutlier implements Serializable {

    private final long imageId;
    private final String name;
    private final double distance;
    private final double x;
    private final double y;
    private final double z;

    @SuppressWarnings("unused")
    private CameraOutlier() {
        this(-1, null, 0, 0, 0, 0);
    }

    public CameraOutlier(final CameraPosition position,
                         final double distance) {
        this(position.getImageId(), position.getName(), distance, position.getX(), position.getY(), position.getZ());
    }

    public CameraOutlier(final long imageId,
                         final String name,
                         final double distance,
                         final double x,
                         final double y,
                         final double z) {
        this.imageId = imageId;
        this.name = name;
        this.distance = distance;
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

    public double getDistance() {
        return distance;
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

    @Override
    public String toString() {
        return name + " (image " + imageId + ") at distance " + distance;
    }
}
