package algorithm;

/**
 * Maps a raw frequency density onto the pattern-likeness score.
 * <p>
 * Sparse strong frequencies mean a regular pattern, so the score falls as density rises:
 * below {@link #SATURATION_DENSITY} the image is fully pattern-like, above {@link #CUTOFF_DENSITY}
 * not at all, and in between the score decreases linearly over [0, CUTOFF_DENSITY].
 */
public final class PredictionScaler {

    public static final double SATURATION_DENSITY = 0.05;
    public static final double CUTOFF_DENSITY = 0.4;

    private PredictionScaler() {}

    /**
     * @param density raw density in [0, 1]
     * @return score in [0, 1]
     * @throws IllegalArgumentException if density is NaN
     */
    public static double scale(double density) {
        if (Double.isNaN(density)) {
            throw new IllegalArgumentException("Density must not be NaN");
        }
        // Strict comparisons: both bounds themselves are interpolated
        if (density < SATURATION_DENSITY) {
            return 1.0;
        }
        if (density > CUTOFF_DENSITY) {
            return 0.0;
        }
        return 1.0 - NumericUtils.linearNormalize(density, 0.0, CUTOFF_DENSITY);
    }
}
