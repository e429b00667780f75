package algorithm;

/**
 * Measures how densely the strong frequencies fill the disk of the estimated radius.
 */
public final class DensityScorer {

    /** Density reported when the disk contains no cells; scales to a score of 0. */
    public static final double NO_SIGNAL_DENSITY = 1.0;

    private DensityScorer() {}

    /**
     * Result of a density measurement.
     */
    public static class Density {
        public final int intensePoints;  // masked cells inside the disk
        public final int allPoints;      // all cells inside the disk
        public final double ratio;

        Density(int intensePoints, int allPoints, double ratio) {
            this.intensePoints = intensePoints;
            this.allPoints = allPoints;
            this.ratio = ratio;
        }

        /**
         * @return false if the disk was empty and {@link #ratio} is the no-signal fallback
         */
        public boolean hasSignal() {
            return allPoints > 0;
        }
    }

    /**
     * Counts the cells inside the disk (squared distance below radius^2) and the high-intensity
     * cells among them.
     *
     * @param field squared center distances
     * @param mask high-intensity mask of the same shape
     * @param radius estimated radius, non-negative
     * @return the density of masked cells inside the disk
     * @throws InvalidSpectrumException if the shapes differ
     */
    public static Density score(double[][] field, boolean[][] mask, double radius) {
        DistanceField.requireSameShape(field, mask);
        if (Double.isNaN(radius) || radius < 0) {
            throw new IllegalArgumentException("Radius must be a non-negative number but was " + radius);
        }

        double radiusSquared = radius * radius;
        int intense = 0;
        int inner = 0;
        for (int y = 0; y < field.length; y++) {
            for (int x = 0; x < field[y].length; x++) {
                if (field[y][x] < radiusSquared) {
                    inner++;
                    if (mask[y][x]) {
                        intense++;
                    }
                }
            }
        }

        if (inner == 0) {
            return new Density(0, 0, NO_SIGNAL_DENSITY);
        }
        return new Density(intense, inner, intense / (double) inner);
    }
}
