package filter;

import algorithm.PatternDetector;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Scores how pattern-like an image is, see {@link PatternDetector}.
 * <p>
 * Works on the two-color image produced by {@link ReduceColorsFilter}; the result is a
 * {@code Double} in [0, 1].
 */
public class PatternDetectionFilter implements ImageFilter {

    public static final String NAME = "pattern_detection";

    private final PatternDetector detector;

    public PatternDetectionFilter() {
        this(new PatternDetector());
    }

    public PatternDetectionFilter(PatternDetector detector) {
        this.detector = detector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> required() {
        return Collections.singleton(ReduceColorsFilter.NAME);
    }

    @Override
    public Object run(Mat image, Map<String, Object> upstream) {
        Object reduced = upstream.get(ReduceColorsFilter.NAME);
        if (!(reduced instanceof Mat)) {
            throw new IllegalStateException("Filter " + NAME + " needs a Mat result from "
                    + ReduceColorsFilter.NAME + " but got " + reduced);
        }

        Mat twoColor = (Mat) reduced;
        Mat gray = new Mat();
        if (twoColor.channels() == 3) {
            Imgproc.cvtColor(twoColor, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            gray = twoColor.clone();
        }

        try {
            return detector.detect(gray).score;
        } finally {
            gray.release();
        }
    }
}
