package xrdfit.processing.peak_fit;

/**
 * A least-squares optimization did not converge within its evaluation budget or produced invalid parameters
 */
public class OptimizerDivergenceException extends RuntimeException {
    public OptimizerDivergenceException(String message) {
        super(message);
    }
    public OptimizerDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
