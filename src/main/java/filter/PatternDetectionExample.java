package filter;

import algorithm.PatternDetector;
import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.util.Map;

/**
 * Scores images from the command line.
 * <p>
 * Usage: {@code PatternDetectionExample image [image ...]}. Detector settings are read from
 * system properties, see {@link PatternDetector#fromSystemProperties()}.
 */
public class PatternDetectionExample {

    /**
     * Builds the reduce_colors -> pattern_detection chain.
     */
    public static FilterChain createChain(PatternDetector detector) {
        return new FilterChain()
                .add(new ReduceColorsFilter())
                .add(new PatternDetectionFilter(detector));
    }

    /**
     * Scores one image with the given chain.
     *
     * @return pattern-likeness in [0, 1]
     */
    public static double scoreImage(FilterChain chain, Mat image) {
        Map<String, Object> results = chain.run(image);
        Object reduced = results.get(ReduceColorsFilter.NAME);
        if (reduced instanceof Mat) {
            ((Mat) reduced).release();
        }
        return (Double) results.get(PatternDetectionFilter.NAME);
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: PatternDetectionExample <image> [<image> ...]");
            System.exit(1);
        }

        OpenCV.loadLocally();
        FilterChain chain = createChain(PatternDetector.fromSystemProperties());

        System.out.println("=== Pattern Detection ===\n");

        for (String imagePath : args) {
            Mat image = Imgcodecs.imread(imagePath);
            if (image.empty()) {
                System.err.println("Could not load image from: " + imagePath);
                continue;
            }

            double score = scoreImage(chain, image);
            image.release();

            System.out.println(String.format("%s: %.4f (%s)", imagePath, score,
                    score >= 0.5 ? "pattern-like" : "not pattern-like"));
        }
    }
}
