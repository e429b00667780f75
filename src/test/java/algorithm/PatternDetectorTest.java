package algorithm;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios for the scoring pipeline on synthetic spectra.
 */
class PatternDetectorTest {

    private static double[][] filled(int height, int width, double value) {
        double[][] spectrum = new double[height][width];
        for (double[] row : spectrum) {
            Arrays.fill(row, value);
        }
        return spectrum;
    }

    private static double[][] randomSpectrum(int height, int width, double highFraction, long seed) {
        Random random = new Random(seed);
        double[][] spectrum = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                spectrum[y][x] = random.nextDouble() < highFraction
                        ? 0.75 + 0.25 * random.nextDouble()
                        : 0.6 * random.nextDouble();
            }
        }
        return spectrum;
    }

    @Test
    void testUniformZeroSpectrumHasNoSignal() {
        PatternDetector.PatternDetectionResult result = new PatternDetector().detect(filled(16, 16, 0.0));

        assertEquals(0, result.distanceCount);
        assertEquals(0, result.filteredCount);
        assertEquals(0.0, result.estimatedRadius);
        assertFalse(result.signal);
        assertEquals(0.0, result.score);
    }

    @Test
    void testEmptySpectrumHasNoSignal() {
        PatternDetector.PatternDetectionResult result = new PatternDetector().detect(new double[0][0]);

        assertFalse(result.signal);
        assertEquals(0.0, result.score);
    }

    @Test
    void testUniformOneSpectrumReachesCornerScale() {
        PatternDetector.PatternDetectionResult result = new PatternDetector().detect(filled(16, 16, 1.0));

        double cornerDistance = Math.sqrt(8 * 8 + 8 * 8);
        assertEquals(256, result.distanceCount);
        assertTrue(result.filteredCount <= 256);
        assertTrue(result.estimatedRadius > cornerDistance / 2, "radius " + result.estimatedRadius);
        assertTrue(result.estimatedRadius <= cornerDistance, "radius " + result.estimatedRadius);

        // every cell in the disk is intense
        assertEquals(1.0, result.rawDensity);
        assertEquals(0.0, result.score);
    }

    @Test
    void testSingleCenterPeakFallsBack() {
        double[][] spectrum = new double[8][8];
        spectrum[4][4] = 1.0;

        PatternDetector.PatternDetectionResult result = new PatternDetector().detect(spectrum);

        assertEquals(1, result.distanceCount);
        assertEquals(1, result.filteredCount);
        assertEquals(0.0, result.estimatedRadius, 1e-12);
        assertFalse(result.signal);
        assertEquals(DensityScorer.NO_SIGNAL_DENSITY, result.rawDensity);
        assertEquals(0.0, result.score);
    }

    @Test
    void testSparsePeaksArePatternLike() {
        // DC plus four harmonics at distance 10, like a regular grid pattern
        double[][] spectrum = new double[64][64];
        spectrum[32][32] = 1.0;
        spectrum[22][32] = 0.9;
        spectrum[42][32] = 0.9;
        spectrum[32][22] = 0.9;
        spectrum[32][42] = 0.9;

        PatternDetector.PatternDetectionResult result = new PatternDetector().detect(spectrum);

        assertEquals(5, result.distanceCount);
        assertEquals(5, result.filteredCount);
        assertEquals(8.0, result.estimatedRadius, 1e-12);
        assertEquals(1, result.intensePoints);
        assertTrue(result.signal);
        assertEquals(1.0, result.score);
    }

    @Test
    void testScatteredNoiseIsNotPatternLike() {
        PatternDetector.PatternDetectionResult result =
                new PatternDetector().detect(randomSpectrum(64, 64, 0.6, 42));

        assertTrue(result.signal);
        assertTrue(result.rawDensity > PredictionScaler.CUTOFF_DENSITY, "density " + result.rawDensity);
        assertEquals(0.0, result.score, 1e-12);
    }

    @Test
    void testRepeatedRunsAreIdenticalAndInputIsUntouched() {
        double[][] spectrum = randomSpectrum(40, 48, 0.1, 5);
        double[][] copy = new double[spectrum.length][];
        for (int y = 0; y < spectrum.length; y++) {
            copy[y] = spectrum[y].clone();
        }

        PatternDetector detector = new PatternDetector();
        PatternDetector.PatternDetectionResult first = detector.detect(spectrum);
        PatternDetector.PatternDetectionResult second = detector.detect(spectrum);

        assertEquals(Double.doubleToLongBits(first.score), Double.doubleToLongBits(second.score));
        assertEquals(Double.doubleToLongBits(first.rawDensity), Double.doubleToLongBits(second.rawDensity));
        assertEquals(Double.doubleToLongBits(first.estimatedRadius), Double.doubleToLongBits(second.estimatedRadius));
        assertEquals(first.filteredCount, second.filteredCount);
        for (int y = 0; y < spectrum.length; y++) {
            assertArrayEquals(copy[y], spectrum[y]);
        }
    }

    @Test
    void testNeighborSearchStrategyDoesNotChangeResult() {
        double[][] spectrum = randomSpectrum(24, 24, 0.3, 9);

        PatternDetector.PatternDetectionResult sorted = new PatternDetector(new SortedNeighborSearch()).detect(spectrum);
        PatternDetector.PatternDetectionResult brute = new PatternDetector(new BruteForceNeighborSearch()).detect(spectrum);

        assertEquals(sorted.filteredCount, brute.filteredCount);
        assertEquals(Double.doubleToLongBits(sorted.estimatedRadius), Double.doubleToLongBits(brute.estimatedRadius));
        assertEquals(Double.doubleToLongBits(sorted.score), Double.doubleToLongBits(brute.score));
    }

    @Test
    void testScoreIsAlwaysInUnitRange() {
        PatternDetector detector = new PatternDetector();
        for (int seed = 0; seed < 10; seed++) {
            double score = detector.score(randomSpectrum(20, 30, seed / 10.0, seed));
            assertTrue(score >= 0.0 && score <= 1.0, "score " + score);
        }
    }

    @Test
    void testInvalidSpectrumFailsFast() {
        PatternDetector detector = new PatternDetector();

        assertThrows(InvalidSpectrumException.class, () -> detector.detect((double[][]) null));
        assertThrows(InvalidSpectrumException.class, () -> detector.detect(new double[][]{{0.1, 0.2}, {0.3}}));
        assertThrows(InvalidSpectrumException.class, () -> detector.detect(new double[][]{{0.1, 1.5}}));
        assertThrows(InvalidSpectrumException.class, () -> detector.detect(new double[][]{{Double.NaN}}));
        assertThrows(InvalidSpectrumException.class, () -> detector.detect(new double[][]{{0.1}, null}));
    }

    @Test
    void testSettersValidate() {
        PatternDetector detector = new PatternDetector();

        assertThrows(IllegalArgumentException.class, () -> detector.setContamination(0.0));
        assertThrows(IllegalArgumentException.class, () -> detector.setNeighborCount(0));
        assertThrows(IllegalArgumentException.class, () -> detector.setTopK(0));

        detector.setContamination(0.25);
        detector.setNeighborCount(10);
        detector.setTopK(5);
        assertEquals(0.25, detector.getContamination());
        assertEquals(10, detector.getNeighborCount());
        assertEquals(5, detector.getTopK());
    }

    @Test
    void testFromSystemProperties() {
        System.setProperty(PatternDetector.NEIGHBOR_SEARCH_PROPERTY, "brute");
        System.setProperty(PatternDetector.CONTAMINATION_PROPERTY, "0.3");
        System.setProperty(PatternDetector.NEIGHBORS_PROPERTY, "12");
        System.setProperty(PatternDetector.TOP_K_PROPERTY, "8");
        try {
            PatternDetector detector = PatternDetector.fromSystemProperties();

            assertTrue(detector.getNeighborSearch() instanceof BruteForceNeighborSearch);
            assertEquals(0.3, detector.getContamination());
            assertEquals(12, detector.getNeighborCount());
            assertEquals(8, detector.getTopK());
        } finally {
            System.clearProperty(PatternDetector.NEIGHBOR_SEARCH_PROPERTY);
            System.clearProperty(PatternDetector.CONTAMINATION_PROPERTY);
            System.clearProperty(PatternDetector.NEIGHBORS_PROPERTY);
            System.clearProperty(PatternDetector.TOP_K_PROPERTY);
        }
    }

    @Test
    void testDefaultsWithoutSystemProperties() {
        PatternDetector detector = PatternDetector.fromSystemProperties();

        assertTrue(detector.getNeighborSearch() instanceof SortedNeighborSearch);
        assertEquals(0.4, detector.getContamination());
        assertEquals(20, detector.getNeighborCount());
        assertEquals(20, detector.getTopK());
    }
}
