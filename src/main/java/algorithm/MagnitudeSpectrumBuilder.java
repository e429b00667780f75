package algorithm;

import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the centered, log-scaled magnitude spectrum of a grayscale image.
 * <p>
 * The spectrum has the image's shape, low frequencies sit at the geometric center and all
 * values are min-max normalized to [0, 1].
 *
 * @see NumericUtils#normalize(double[][])
 */
public final class MagnitudeSpectrumBuilder {

    private MagnitudeSpectrumBuilder() {}

    /**
     * @param image grayscale (1 channel) or BGR (3 channel) image
     * @return magnitude spectrum as [row][column], empty for an empty image
     */
    public static double[][] build(Mat image) {
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        if (image.empty()) {
            return new double[0][0];
        }

        Mat gray;
        if (image.channels() == 3) {
            gray = new Mat();
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (image.channels() == 1) {
            gray = image.clone();
        } else {
            throw new IllegalArgumentException("Expected 1 or 3 channels but got " + image.channels());
        }

        Mat real = new Mat();
        gray.convertTo(real, CvType.CV_64F);
        gray.release();

        Mat complexI = new Mat();
        List<Mat> planes = new ArrayList<>();
        planes.add(real);
        planes.add(Mat.zeros(real.size(), CvType.CV_64F));
        Core.merge(planes, complexI);
        for (Mat p : planes) p.release();

        Core.dft(complexI, complexI);

        List<Mat> dftPlanes = new ArrayList<>();
        Core.split(complexI, dftPlanes);
        complexI.release();

        Mat magnitude = new Mat();
        Core.magnitude(dftPlanes.get(0), dftPlanes.get(1), magnitude);
        for (Mat p : dftPlanes) p.release();

        // log(1 + |F|) keeps the DC term from flattening everything else
        Core.add(magnitude, Scalar.all(1.0), magnitude);
        Core.log(magnitude, magnitude);

        int rows = magnitude.rows();
        int cols = magnitude.cols();
        double[] data = new double[rows * cols];
        magnitude.get(0, 0, data);
        magnitude.release();

        return NumericUtils.normalize(fftShift(data, rows, cols));
    }

    /**
     * Moves the zero frequency from index 0 to (rows / 2, cols / 2). Works for odd sizes,
     * unlike a quadrant swap.
     */
    static double[][] fftShift(double[] data, int rows, int cols) {
        int shiftY = rows / 2;
        int shiftX = cols / 2;

        double[][] shifted = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            int ty = (y + shiftY) % rows;
            for (int x = 0; x < cols; x++) {
                shifted[ty][(x + shiftX) % cols] = data[y * cols + x];
            }
        }
        return shifted;
    }
}
