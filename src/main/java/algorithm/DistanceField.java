package algorithm;

/**
 * Squared distance of every cell to the geometric center of a matrix.
 * <p>
 * The center is (width / 2.0, height / 2.0) in continuous coordinates, so odd sizes
 * place it between cells rather than on a rounded index.
 */
public final class DistanceField {

    private DistanceField() {}

    /**
     * Computes the squared center distance for each cell of a height x width matrix.
     *
     * @param height number of rows
     * @param width number of columns
     * @return matrix where cell [y][x] holds (x - width/2)^2 + (y - height/2)^2
     */
    public static double[][] compute(int height, int width) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Negative size: " + height + "x" + width);
        }

        double cy = height / 2.0;
        double cx = width / 2.0;

        double[][] field = new double[height][width];
        for (int y = 0; y < height; y++) {
            double dy = y - cy;
            double dy2 = dy * dy;
            for (int x = 0; x < width; x++) {
                double dx = x - cx;
                field[y][x] = dx * dx + dy2;
            }
        }
        return field;
    }

    /**
     * Fails fast if the mask does not have the field's dimensions.
     */
    static void requireSameShape(double[][] field, boolean[][] mask) {
        if (field == null || mask == null) {
            throw new InvalidSpectrumException("distance field and mask must not be null");
        }
        if (field.length != mask.length) {
            throw new InvalidSpectrumException(String.format(
                    "mask has %d rows but distance field has %d", mask.length, field.length));
        }
        for (int y = 0; y < field.length; y++) {
            if (field[y].length != mask[y].length) {
                throw new InvalidSpectrumException(String.format(
                        "mask row %d has %d columns but distance field has %d",
                        y, mask[y].length, field[y].length));
            }
        }
    }
}
