package algorithm;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Normalization and order-statistic helpers shared by the spectrum and scoring stages.
 * <p>
 * Boundary behavior is part of the contract: degenerate ranges return a constant
 * instead of dividing by zero.
 */
public final class NumericUtils {

    private NumericUtils() {}

    /**
     * Min-max normalizes values to [0, 1].
     *
     * @return a new array; all ones if every value is equal, empty if the input is empty
     */
    public static double[] normalize(double[] values) {
        if (values.length == 0) {
            return new double[0];
        }

        double min = StatUtils.min(values);
        double max = StatUtils.max(values);

        double[] result = new double[values.length];
        if (min == max) {
            Arrays.fill(result, 1.0);
            return result;
        }

        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - min) / range;
        }
        return result;
    }

    /**
     * Min-max normalizes a matrix over all of its cells, keeping its shape.
     */
    public static double[][] normalize(double[][] matrix) {
        int total = 0;
        for (double[] row : matrix) {
            total += row.length;
        }

        double[] flat = new double[total];
        int offset = 0;
        for (double[] row : matrix) {
            System.arraycopy(row, 0, flat, offset, row.length);
            offset += row.length;
        }

        double[] normalized = normalize(flat);

        double[][] result = new double[matrix.length][];
        offset = 0;
        for (int y = 0; y < matrix.length; y++) {
            result[y] = Arrays.copyOfRange(normalized, offset, offset + matrix[y].length);
            offset += matrix[y].length;
        }
        return result;
    }

    /**
     * Linearly maps a value from [low, high] onto [0, 1], clamping values outside the range.
     *
     * @param value value to map
     * @param low value mapped to 0
     * @param high value mapped to 1
     * @return mapped value in [0, 1]; 1.0 when low == high
     * @throws IllegalArgumentException if high is below low
     */
    public static double linearNormalize(double value, double low, double high) {
        if (high < low) {
            throw new IllegalArgumentException("Range upper bound " + high + " is below lower bound " + low);
        }
        if (high == low) {
            return 1.0;
        }
        return clamp((value - low) / (high - low), 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Percentile with linear interpolation between closest ranks (the R-7 / numpy "linear" rule).
     *
     * @param values sample, not modified
     * @param q percentile in [0, 100]
     * @return the q-th percentile of the sample
     */
    public static double percentile(double[] values, double q) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty sample");
        }
        if (q < 0 || q > 100) {
            throw new IllegalArgumentException("Percentile out of range: " + q);
        }

        // Percentile rejects p = 0; under R-7 that rank is the minimum
        if (q == 0) {
            return StatUtils.min(values);
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, q);
    }
}
