package algorithm;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Removes points of a one-dimensional sample whose local density is low compared to their
 * neighbors, using the Local Outlier Factor (Breunig et al., 2000).
 *
 * <p>For a point p with k nearest neighbors N(p):</p>
 * <pre>
 *     reach(p, o) = max(kDistance(o), |p - o|)
 *     lrd(p)      = 1 / (mean over o in N(p) of reach(p, o) + 1e-10)
 *     lof(p)      = mean over o in N(p) of (lrd(o) / lrd(p))
 * </pre>
 *
 * <p>The outlier cut is the {@code contamination} percentile of {@code -lof}; points strictly below
 * it are dropped, so at most {@code ceil(contamination * (n - 1))} of n points are removed.</p>
 */
public class LocalOutlierFilter {

    private static final Logger logger = Logger.getLogger(LocalOutlierFilter.class.getName());

    public static final double DEFAULT_CONTAMINATION = 0.4;
    public static final int DEFAULT_NEIGHBOR_COUNT = 20;

    // Keeps lrd finite when all reachability distances are zero (duplicate values)
    private static final double REACHABILITY_EPSILON = 1e-10;

    private final NeighborSearch neighborSearch;
    private final double contamination;
    private final int neighborCount;

    public LocalOutlierFilter() {
        this(new SortedNeighborSearch(), DEFAULT_CONTAMINATION, DEFAULT_NEIGHBOR_COUNT);
    }

    /**
     * @param neighborSearch strategy used to find nearest neighbors
     * @param contamination maximum fraction of points treated as outliers, in (0, 0.5]
     * @param neighborCount neighbors per point; reduced to n - 1 for small samples
     */
    public LocalOutlierFilter(NeighborSearch neighborSearch, double contamination, int neighborCount) {
        if (neighborSearch == null) {
            throw new NullPointerException("neighborSearch must not be null");
        }
        checkContamination(contamination);
        checkNeighborCount(neighborCount);
        this.neighborSearch = neighborSearch;
        this.contamination = contamination;
        this.neighborCount = neighborCount;
    }

    /**
     * Filters outliers from the sample.
     *
     * @param values sample, not modified
     * @return the inliers in input order; a copy of the input if it has fewer than two points
     */
    public double[] filter(double[] values) {
        int n = values.length;
        int k = Math.min(neighborCount, n - 1);
        if (k < 1) {
            return values.clone();
        }

        double[] lof = localOutlierFactors(values, k);

        double[] negated = new double[n];
        for (int i = 0; i < n; i++) {
            negated[i] = -lof[i];
        }
        double threshold = NumericUtils.percentile(negated, 100.0 * contamination);

        double[] inliers = new double[n];
        int kept = 0;
        for (int i = 0; i < n; i++) {
            if (negated[i] >= threshold) {
                inliers[kept++] = values[i];
            }
        }

        logger.fine(String.format("LOF: kept %d of %d points (k=%d, contamination=%.2f)",
                kept, n, k, contamination));

        return Arrays.copyOf(inliers, kept);
    }

    /**
     * Computes the local outlier factor of every point.
     *
     * @param values sample of at least k + 1 points
     * @param k neighbors per point
     * @return LOF per point; about 1 for inliers, larger for outliers
     */
    double[] localOutlierFactors(double[] values, int k) {
        int n = values.length;
        int[][] neighbors = neighborSearch.kNearest(values, k);

        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            kDistance[i] = Math.abs(values[i] - values[neighbors[i][k - 1]]);
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int o : neighbors[i]) {
                sum += Math.max(kDistance[o], Math.abs(values[i] - values[o]));
            }
            lrd[i] = 1.0 / (sum / k + REACHABILITY_EPSILON);
        }

        double[] lof = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int o : neighbors[i]) {
                sum += lrd[o] / lrd[i];
            }
            lof[i] = sum / k;
        }
        return lof;
    }

    public double getContamination() {
        return contamination;
    }

    public int getNeighborCount() {
        return neighborCount;
    }

    static void checkContamination(double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5] but was " + contamination);
        }
    }

    static void checkNeighborCount(int neighborCount) {
        if (neighborCount < 1) {
            throw new IllegalArgumentException("Neighbor count must be positive but was " + neighborCount);
        }
    }
}
