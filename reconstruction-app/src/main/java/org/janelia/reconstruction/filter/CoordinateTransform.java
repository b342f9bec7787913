package org.janelia.reconstruction.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Linear 3x3 transform (row-major) that maps source coordinates into the reconstruction frame:
 * <pre>
 *   reference = source · M<sup>T</sup>   (i.e. reference[i] = sum_j M[i][j] * source[j])
 * </pre>
 *
 * The default converts a Z-up point cloud into a Y-down, Z-forward reconstruction frame:
 * x' = x, y' = -z, z' = y.
 */
public class CoordinateTransform {

    public static final List<Double> DEFAULT_MATRIX = Arrays.asList(
            1.0, 0.0, 0.0,
            0.0, 0.0, -1.0,
            0.0, 1.0, 0.0);

    public static final CoordinateTransform DEFAULT = new CoordinateTransform(DEFAULT_MATRIX);

    public static final CoordinateTransform IDENTITY = new CoordinateTransform(Arrays.asList(
            1.0, 0.0, 0.0,
            0.0, 1.0, 0.0,
            0.0, 0.0, 1.0));

    private final double[] m;

    /**
     * @param  rowMajorMatrix  nine matrix values in row-major order.
     *
     * @throws IllegalArgumentException
     *   if exactly nine finite values are not specified.
     */
    public CoordinateTransform(final List<Double> rowMajorMatrix)
            throws IllegalArgumentException {
        if ((rowMajorMatrix == null) || (rowMajorMatrix.size() != 9)) {
            throw new IllegalArgumentException("coordinate transform must have 9 values (row-major 3x3) but has " +
                                               (rowMajorMatrix == null ? 0 : rowMajorMatrix.size()));
        }
        this.m = new double[9];
        for (int i = 0; i < 9; i++) {
            final Double value = rowMajorMatrix.get(i);
            if ((value == null) || (! Double.isFinite(value))) {
                throw new IllegalArgumentException("coordinate transform value " + i + " (" + value +
                                                   ") must be a finite number");
            }
            m[i] = value;
        }
    }

    public double[] apply(final double[] source) {
        return apply(source[0], source[1], source[2]);
    }

    public double[] apply(final double x,
                          final double y,
                          final double z) {
        return new double[] {
                (m[0] * x) + (m[1] * y) + (m[2] * z),
                (m[3] * x) + (m[4] * y) + (m[5] * z),
                (m[6] * x) + (m[7] * y) + (m[8] * z)
        };
    }

    public List<Double> toList() {
        final List<Double> list = new ArrayList<>(9);
        for (final double value : m) {
            list.add(value);
        }
        return list;
    }

    @Override
    public String toString() {
        return Arrays.toString(m);
    }
}
