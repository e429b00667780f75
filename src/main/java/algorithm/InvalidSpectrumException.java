package algorithm;

/**
 * Thrown when a spectrum, mask or distance field handed to the pipeline breaks its shape or
 * value contract (null, ragged, mismatched dimensions, values outside [0, 1]).
 */
public class InvalidSpectrumException extends RuntimeException {

    public InvalidSpectrumException(String message) {
        super("Invalid spectrum: " + message);
    }
}
