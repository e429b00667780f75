package algorithm;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Neighbor search over a sorted copy of the sample.
 * <p>
 * In one dimension the k nearest neighbors of a point are contiguous around it in sorted
 * order, so each point only looks at a small window instead of the whole sample.
 */
public final class SortedNeighborSearch implements NeighborSearch {

    @Override
    public int[][] kNearest(double[] values, int k) {
        NeighborSearch.checkK(values, k);

        int n = values.length;
        Integer[] boxed = new Integer[n];
        for (int i = 0; i < n; i++) {
            boxed[i] = i;
        }
        Arrays.sort(boxed, Comparator.comparingDouble((Integer i) -> values[i]).thenComparingInt(i -> i));

        int[] order = new int[n];
        for (int p = 0; p < n; p++) {
            order[p] = boxed[p];
        }

        int[][] neighbors = new int[n][];
        for (int p = 0; p < n; p++) {
            int i = order[p];
            double vi = values[i];

            // Merge outwards to find the distance of the k-th nearest point
            int left = p - 1;
            int right = p + 1;
            double kDistance = 0.0;
            for (int taken = 0; taken < k; taken++) {
                double dl = left >= 0 ? Math.abs(vi - values[order[left]]) : Double.POSITIVE_INFINITY;
                double dr = right < n ? Math.abs(vi - values[order[right]]) : Double.POSITIVE_INFINITY;
                if (dl <= dr) {
                    kDistance = dl;
                    left--;
                } else {
                    kDistance = dr;
                    right++;
                }
            }

            // Widen to every point within k-distance so ties are ranked by index like the reference
            int lo = p;
            while (lo > 0 && Math.abs(vi - values[order[lo - 1]]) <= kDistance) {
                lo--;
            }
            int hi = p;
            while (hi < n - 1 && Math.abs(vi - values[order[hi + 1]]) <= kDistance) {
                hi++;
            }

            Integer[] candidates = new Integer[hi - lo];
            int m = 0;
            for (int q = lo; q <= hi; q++) {
                if (q != p) {
                    candidates[m++] = order[q];
                }
            }
            Arrays.sort(candidates, Comparator
                    .comparingDouble((Integer j) -> Math.abs(vi - values[j]))
                    .thenComparingInt(j -> j));

            neighbors[i] = new int[k];
            for (int r = 0; r < k; r++) {
                neighbors[i][r] = candidates[r];
            }
        }
        return neighbors;
    }
}
