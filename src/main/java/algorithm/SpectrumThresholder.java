package algorithm;

import java.util.Arrays;

/**
 * Marks the high-intensity frequencies of a magnitude spectrum and collects their
 * distances from the spectrum center.
 */
public final class SpectrumThresholder {

    /** Magnitudes strictly above this value count as strong periodic components. */
    public static final double HIGH_INTENSITY_THRESHOLD = 0.7;

    private SpectrumThresholder() {}

    /**
     * @param spectrum magnitude spectrum normalized to [0, 1]
     * @return mask that is true where the spectrum exceeds {@link #HIGH_INTENSITY_THRESHOLD}
     */
    public static boolean[][] mask(double[][] spectrum) {
        boolean[][] mask = new boolean[spectrum.length][];
        for (int y = 0; y < spectrum.length; y++) {
            double[] row = spectrum[y];
            mask[y] = new boolean[row.length];
            for (int x = 0; x < row.length; x++) {
                mask[y][x] = row[x] > HIGH_INTENSITY_THRESHOLD;
            }
        }
        return mask;
    }

    /**
     * Extracts the (unsquared) center distances of all masked cells in row-major order.
     *
     * @param field squared center distances, see {@link DistanceField#compute(int, int)}
     * @param mask high-intensity mask of the same shape
     * @return distances of the masked cells, empty if nothing is masked
     * @throws InvalidSpectrumException if the shapes differ
     */
    public static double[] distances(double[][] field, boolean[][] mask) {
        DistanceField.requireSameShape(field, mask);

        double[] buffer = new double[16];
        int count = 0;
        for (int y = 0; y < field.length; y++) {
            for (int x = 0; x < field[y].length; x++) {
                if (!mask[y][x]) {
                    continue;
                }
                if (count == buffer.length) {
                    buffer = Arrays.copyOf(buffer, count * 2);
                }
                buffer[count++] = Math.sqrt(field[y][x]);
            }
        }
        return Arrays.copyOf(buffer, count);
    }
}
