package org.janelia.reconstruction.model;

import com.google.common.primitives.UnsignedLong;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Triangulated 3D point with color, mean reprojection error, and the track of images that observed it.
 */
public class PointRecord {

    private final UnsignedLong pointId;
    private final double x;
    private final double y;
    private final double z;
    private final int red;
    private final int green;
    private final int blue;
    private final double error;
    private final List<TrackElement> track;

    public PointRecord(final UnsignedLong pointId,
                       final double x,
                       final double y,
                       final double z,
                       final int red,
                       final int green,
                       final int blue,
                       final double error,
                       final List<TrackElement> track)
            throws IllegalArgumentException {

        validateColor("red", red);
        validateColor("green", green);
        validateColor("blue", blue);

        this.pointId = pointId;
        this.x = x;
        this.y = y;
        this.z = z;
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.error = error;
        this.track = Collections.unmodifiableList(new ArrayList<>(track));
    }

    public UnsignedLong getPointId() {
        return pointId;
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

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public double getError() {
        return error;
    }

    public List<TrackElement> getTrack() {
        return track;
    }

    public PointRecord withTrack(final List<TrackElement> replacementTrack) {
        return new PointRecord(pointId, x, y, z, red, green, blue, error, replacementTrack);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final PointRecord that = (PointRecord) o;
        return pointId.equals(that.pointId) &&
               (Double.compare(that.x, x) == 0) &&
               (Double.compare(that.y, y) == 0) &&
               (Double.compare(that.z, z) == 0) &&
               (red == that.red) &&
               (green == that.green) &&
               (blue == that.blue) &&
               (Double.compare(that.error, error) == 0) &&
               track.equals(that.track);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pointId, x, y, z, red, green, blue, error, track);
    }

    @Override
    public String toString() {
        return "point " + pointId + " (" + x + ", " + y + ", " + z + ")";
    }

    private static void validateColor(final String channel,
                                      final int value)
            throws IllegalArgumentException {
        if ((value < 0) || (value > 255)) {
            throw new IllegalArgumentException(channel + " value " + value + " must be between 0 and 255");
        }
    }
}
