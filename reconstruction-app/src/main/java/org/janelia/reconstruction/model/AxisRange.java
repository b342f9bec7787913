package org.janelia.reconstruction.model;

import java.io.Serializable;

/**
 * Minimum, maximum, and span of values along one coordinate axis.
 */
public class AxisRange implements Serializable {

    private final double min;
    private final double max;
    private final double span;

    @SuppressWarnings("unused")
    private AxisRange() {
        this(0.0, 0.0);
    }

    public AxisRange(final double min,
                     final double max) {
        this.min = min;
        this.max = max;
        this.span = max - min;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
