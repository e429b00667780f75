package algorithm;

import org.opencv.core.Mat;

import java.util.logging.Logger;

/**
 * PatternDetector scores how pattern-like (textile, wallpaper, halftone) an image is from the
 * magnitude spectrum of its two-color grayscale rendition.
 *
 * <p>Regular patterns concentrate their energy in a few strong, evenly spaced frequencies. The
 * detector takes the strong frequencies of the spectrum, drops outlying ones with a local outlier
 * factor filter, derives a radius from the farthest survivors and measures how densely strong
 * frequencies fill that disk. Sparse disks score close to 1, dense ones close to 0.</p>
 *
 * <p>Each call works on fresh arrays only; configure the detector before sharing it between threads.</p>
 */
public class PatternDetector {

    private static final Logger logger = Logger.getLogger(PatternDetector.class.getName());

    public static final String CONTAMINATION_PROPERTY = "pattern.detection.contamination";
    public static final String NEIGHBORS_PROPERTY = "pattern.detection.neighbors";
    public static final String TOP_K_PROPERTY = "pattern.detection.topK";
    public static final String NEIGHBOR_SEARCH_PROPERTY = "pattern.detection.neighborSearch";

    // Outlier filter parameters
    private double contamination = LocalOutlierFilter.DEFAULT_CONTAMINATION;
    private int neighborCount = LocalOutlierFilter.DEFAULT_NEIGHBOR_COUNT;

    // Number of largest distances averaged into the radius
    private int topK = RadiusEstimator.DEFAULT_TOP_K;

    private final NeighborSearch neighborSearch;


    /**
     * Result of one detection run
     */
    public static class PatternDetectionResult {
        public final int distanceCount;      // high-intensity frequencies found
        public final int filteredCount;      // frequencies left after outlier removal
        public final double estimatedRadius;
        public final int intensePoints;      // high-intensity cells inside the radius
        public final int innerPoints;        // all cells inside the radius
        public final double rawDensity;
        public final double score;           // pattern-likeness in [0, 1]
        public final boolean signal;         // false if nothing was inside the radius

        PatternDetectionResult(int distanceCount, int filteredCount, double estimatedRadius,
                               DensityScorer.Density density, double score) {
            this.distanceCount = distanceCount;
            this.filteredCount = filteredCount;
            this.estimatedRadius = estimatedRadius;
            this.intensePoints = density.intensePoints;
            this.innerPoints = density.allPoints;
            this.rawDensity = density.ratio;
            this.score = score;
            this.signal = density.hasSignal();
        }

        @Override
        public String toString() {
            return String.format("score=%.4f, density=%.4f (%d/%d), radius=%.2f, distances=%d->%d%s",
                    score, rawDensity, intensePoints, innerPoints, estimatedRadius,
                    distanceCount, filteredCount, signal ? "" : ", no signal");
        }
    }

    public PatternDetector() {
        this(new SortedNeighborSearch());
    }

    /**
     * @param neighborSearch nearest-neighbor strategy for the outlier filter
     */
    public PatternDetector(NeighborSearch neighborSearch) {
        if (neighborSearch == null) {
            throw new NullPointerException("neighborSearch must not be null");
        }
        this.neighborSearch = neighborSearch;
    }

    /**
     * Creates a detector configured from system properties, falling back to the defaults:
     * {@value #CONTAMINATION_PROPERTY}, {@value #NEIGHBORS_PROPERTY}, {@value #TOP_K_PROPERTY}
     * and {@value #NEIGHBOR_SEARCH_PROPERTY} ({@code sorted} or {@code brute}).
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static PatternDetector fromSystemProperties() {
        String search = System.getProperty(NEIGHBOR_SEARCH_PROPERTY, "sorted");
        PatternDetector detector = new PatternDetector(NeighborSearch.forName(search));

        detector.setContamination(Double.parseDouble(System.getProperty(CONTAMINATION_PROPERTY,
                String.valueOf(LocalOutlierFilter.DEFAULT_CONTAMINATION))));
        detector.setNeighborCount(Integer.parseInt(System.getProperty(NEIGHBORS_PROPERTY,
                String.valueOf(LocalOutlierFilter.DEFAULT_NEIGHBOR_COUNT))));
        detector.setTopK(Integer.parseInt(System.getProperty(TOP_K_PROPERTY,
                String.valueOf(RadiusEstimator.DEFAULT_TOP_K))));

        logger.config(String.format("Pattern detector configured: search=%s, contamination=%.2f, neighbors=%d, topK=%d",
                search, detector.contamination, detector.neighborCount, detector.topK));
        return detector;
    }

    /**
     * Scores a two-color image.
     *
     * @param image two-color image, grayscale or BGR
     * @return detection result
     */
    public PatternDetectionResult detect(Mat image) {
        return detect(MagnitudeSpectrumBuilder.build(image));
    }

    /**
     * Runs the scoring pipeline on a magnitude spectrum.
     *
     * @param spectrum centered magnitude spectrum with values in [0, 1], not modified
     * @return detection result
     * @throws InvalidSpectrumException if the spectrum is null, ragged or out of range
     */
    public PatternDetectionResult detect(double[][] spectrum) {
        validateSpectrum(spectrum);

        int height = spectrum.length;
        int width = height == 0 ? 0 : spectrum[0].length;

        double[][] field = DistanceField.compute(height, width);
        boolean[][] mask = SpectrumThresholder.mask(spectrum);
        double[] distances = SpectrumThresholder.distances(field, mask);

        LocalOutlierFilter outlierFilter = new LocalOutlierFilter(neighborSearch, contamination, neighborCount);
        double[] filtered = outlierFilter.filter(distances);

        double radius = RadiusEstimator.estimate(filtered, topK);
        DensityScorer.Density density = DensityScorer.score(field, mask, radius);
        double score = PredictionScaler.scale(density.ratio);

        PatternDetectionResult result =
                new PatternDetectionResult(distances.length, filtered.length, radius, density, score);

        if (result.signal) {
            logger.info("Pattern detection on " + height + "x" + width + " spectrum: " + result);
        } else {
            logger.warning("Pattern detection on " + height + "x" + width
                    + " spectrum found no frequencies inside the estimated radius, scoring 0");
        }
        return result;
    }

    /**
     * Convenience for {@code detect(spectrum).score}.
     */
    public double score(double[][] spectrum) {
        return detect(spectrum).score;
    }

    private static void validateSpectrum(double[][] spectrum) {
        if (spectrum == null) {
            throw new InvalidSpectrumException("spectrum must not be null");
        }
        for (int y = 0; y < spectrum.length; y++) {
            double[] row = spectrum[y];
            if (row == null) {
                throw new InvalidSpectrumException("row " + y + " is null");
            }
            if (row.length != spectrum[0].length) {
                throw new InvalidSpectrumException(String.format(
                        "row %d has %d columns, expected %d", y, row.length, spectrum[0].length));
            }
            for (int x = 0; x < row.length; x++) {
                // Negated test also rejects NaN
                if (!(row[x] >= 0.0 && row[x] <= 1.0)) {
                    throw new InvalidSpectrumException(String.format(
                            "value %s at (%d, %d) is outside [0, 1]", row[x], y, x));
                }
            }
        }
    }

    // Getter and setter methods for parameters

    /**
     * @param contamination maximum fraction of strong frequencies discarded as outliers, in (0, 0.5]
     */
    public void setContamination(double contamination) {
        LocalOutlierFilter.checkContamination(contamination);
        this.contamination = contamination;
    }

    public double getContamination() {
        return this.contamination;
    }

    public void setNeighborCount(int neighborCount) {
        LocalOutlierFilter.checkNeighborCount(neighborCount);
        this.neighborCount = neighborCount;
    }

    public int getNeighborCount() {
        return this.neighborCount;
    }

    public void setTopK(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }
        this.topK = topK;
    }

    public int getTopK() {
        return this.topK;
    }

    public NeighborSearch getNeighborSearch() {
        return this.neighborSearch;
    }
}
