package org.janelia.reconstruction.model;

import java.io.Serializable;

/**
 * Per-axis coordinate ranges for a set of 3D locations.
 */
public class CoordinateRanges implements Serializable {

    private final AxisRange x;
    private final AxisRange y;
    private final AxisRange z;

    @SuppressWarnings("unused")
    private CoordinateRanges() {
        this(null, null, null);
    }

    public CoordinateRanges(final AxisRange x,
                            final AxisRange y,
                            final AxisRange z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public AxisRange getX() {
        return x;
    }

    public AxisRange getY() {
        return y;
    }

    public AxisRange getZ() {
        return z;
    }

    @Override
    public String toString() {
        return "{x: " + x + ", y: " + y + ", z: " + z + "}";
    }

    /**
     * Tracks running minimum and maximum values for a stream of locations.
     */
    public static class Accumulator {

        private final double[] min;
        private final double[] max;
        private long count;

        public Accumulator() {
            this.min = new double[] { Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE };
            this.max = new double[] { -Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE };
            this.count = 0;
        }

        public void include(final double xValue,
                            final double yValue,
                            final double zValue) {
            includeAxis(0, xValue);
            includeAxis(1, yValue);
            includeAxis(2, zValue);
            count++;
        }

        public long getCount() {
            return count;
        }

        /**
         * @return ranges for all included locations, or null if nothing was included.
         */
        public CoordinateRanges build() {
            CoordinateRanges ranges = null;
            if (count > 0) {
                ranges = new CoordinateRanges(new AxisRange(min[0], max[0]),
                                              new AxisRange(min[1], max[1]),
                                              new AxisRange(min[2], max[2]));
            }
            return ranges;
        }

        private void includeAxis(final int axis,
                                 final double value) {
            if (value < min[axis]) {
                min[axis] = value;
            }
            if (value > max[axis]) {
                max[axis] = value;
            }
        }
    }
}
