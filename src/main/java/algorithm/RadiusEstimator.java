package algorithm;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Estimates the radius that encloses the strong frequencies as the mean of the largest
 * surviving center distances.
 */
public final class RadiusEstimator {

    public static final int DEFAULT_TOP_K = 20;

    /** Radius reported when no distances survive outlier removal. */
    public static final double NO_SIGNAL_RADIUS = 0.0;

    private RadiusEstimator() {}

    /**
     * @param distances filtered center distances, not modified
     * @param topK how many of the largest distances to average
     * @return mean of the min(topK, n) largest distances, or {@link #NO_SIGNAL_RADIUS} if empty
     */
    public static double estimate(double[] distances, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }
        if (distances.length == 0) {
            return NO_SIGNAL_RADIUS;
        }

        double[] sorted = distances.clone();
        Arrays.sort(sorted);

        int count = Math.min(topK, sorted.length);
        return StatUtils.mean(sorted, sorted.length - count, count);
    }
}
