package algorithm;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Reference neighbor search: ranks every other point for each point. O(n^2 log n).
 */
public final class BruteForceNeighborSearch implements NeighborSearch {

    @Override
    public int[][] kNearest(double[] values, int k) {
        NeighborSearch.checkK(values, k);

        int n = values.length;
        int[][] neighbors = new int[n][];
        Integer[] others = new Integer[n - 1];

        for (int i = 0; i < n; i++) {
            int m = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    others[m++] = j;
                }
            }

            double vi = values[i];
            Arrays.sort(others, Comparator
                    .comparingDouble((Integer j) -> Math.abs(vi - values[j]))
                    .thenComparingInt(j -> j));

            neighbors[i] = new int[k];
            for (int r = 0; r < k; r++) {
                neighbors[i][r] = others[r];
            }
        }
        return neighbors;
    }
}
