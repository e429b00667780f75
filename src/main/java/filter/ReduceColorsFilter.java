package filter;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.Map;

/**
 * Reduces an image to two colors (black and white) with Otsu thresholding.
 * The result is a 3 channel BGR image.
 */
public class ReduceColorsFilter implements ImageFilter {

    public static final String NAME = "reduce_colors";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Object run(Mat image, Map<String, Object> upstream) {
        Mat gray = new Mat();

        // Convert to grayscale if needed
        if (image.channels() == 3) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            gray = image.clone();
        }

        Mat binary = new Mat();
        Imgproc.threshold(gray, binary, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);
        gray.release();

        Mat twoColor = new Mat();
        Imgproc.cvtColor(binary, twoColor, Imgproc.COLOR_GRAY2BGR);
        binary.release();

        return twoColor;
    }
}
