package xrdfit.data_structure;

/**
 * Thrown when x and y do not have the same length, when there are less than 2 points or when x is not strictly increasing
 */
public class InvalidSpectrumException extends IllegalArgumentException {
    public InvalidSpectrumException(String message) {
        super(message);
    }
}
