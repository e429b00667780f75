package algorithm;

import java.util.Locale;

/**
 * {@code NeighborSearch} finds the k nearest neighbors of every point of a one-dimensional sample.
 *
 * <p>It is the hot loop of {@link LocalOutlierFilter}. Implementations trade simplicity for speed
 * but must agree exactly:</p>
 * <ul>
 *     <li>a point is never its own neighbor, duplicates of its value are</li>
 *     <li>neighbors are ordered by distance {@code |v[i] - v[j]|}, ties by lower index {@code j}</li>
 *     <li>exactly {@code k} neighbors are returned per point</li>
 * </ul>
 *
 * <p>The strategy is chosen once when a detector is configured, see
 * {@link PatternDetector#fromSystemProperties()}.</p>
 *
 * @see BruteForceNeighborSearch
 * @see SortedNeighborSearch
 */
public interface NeighborSearch {

    /**
     * @param values sample values, not modified
     * @param k neighbors per point, in [1, values.length - 1]
     * @return for every point i, the indices of its k nearest neighbors, nearest first
     * @throws IllegalArgumentException if k is out of range
     */
    int[][] kNearest(double[] values, int k);

    /**
     * Resolves a strategy by its configuration name.
     *
     * @param name {@code brute} or {@code sorted}, case-insensitive
     * @throws IllegalArgumentException for unknown names
     */
    static NeighborSearch forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Neighbor search name must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "brute":
                return new BruteForceNeighborSearch();
            case "sorted":
                return new SortedNeighborSearch();
            default:
                throw new IllegalArgumentException("Unknown neighbor search: " + name);
        }
    }

    static void checkK(double[] values, int k) {
        if (k < 1 || k > values.length - 1) {
            throw new IllegalArgumentException(
                    "k must be in [1, " + (values.length - 1) + "] but was " + k);
        }
    }
}
