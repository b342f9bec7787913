package org.janelia.reconstruction.model;

import com.google.common.primitives.UnsignedLong;

import java.util.Objects;

/**
 * A 2D keypoint in an image along with the (signed) reference to the 3D point it was matched to.
 * Unmatched keypoints carry {@link #UNMATCHED}.
 */
public class Observation {

    public static final long UNMATCHED = -1L;

    private final double x;
    private final double y;
    private final long pointReference;

    public Observation(final double x,
                       final double y,
                       final long pointReference)
            throws IllegalArgumentException {

        if ((pointReference < 0) && (pointReference != UNMATCHED)) {
            throw new IllegalArgumentException("invalid point reference " + pointReference +
                                               ", the only negative reference allowed is " + UNMATCHED);
        }

        this.x = x;
        this.y = y;
        this.pointReference = pointReference;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public long getPointReference() {
        return pointReference;
    }

    public boolean isMatched() {
        return pointReference != UNMATCHED;
    }

    /**
     * @return the referenced point id, or null if this observation is unmatched.
     */
    public UnsignedLong getReferencedPointId() {
        return isMatched() ? UnsignedLong.fromLongBits(pointReference) : null;
    }

    public Observation withoutMatch() {
        return isMatched() ? new Observation(x, y, UNMATCHED) : this;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final Observation that = (Observation) o;
        return (Double.compare(that.x, x) == 0) &&
               (Double.compare(that.y, y) == 0) &&
               (pointReference == that.pointReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, pointReference);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + pointReference + ")";
    }
}
