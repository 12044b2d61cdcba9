package xrdfit.processing.peak_fit;

import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Projects parameters into their bounds after each optimizer step. Non finite parameters are reset to their start value
 */
public class BoundsValidator implements ParameterValidator {
    final double[] lower, upper, start;

    public BoundsValidator(double[] lower, double[] upper, double[] start) {
        if (lower.length!=upper.length || lower.length!=start.length) throw new IllegalArgumentException("bounds and start point should have same length");
        this.lower = lower;
        this.upper = upper;
        this.start = start;
    }

    public double[] project(double[] params) {
        double[] res = new double[params.length];
        for (int i = 0; i<params.length; ++i) {
            double v = Double.isFinite(params[i]) ? params[i] : start[i];
            res[i] = Math.max(lower[i], Math.min(upper[i], v));
        }
        return res;
    }

    @Override
    public RealVector validate(RealVector params) {
        return new ArrayRealVector(project(params.toArray()), false);
    }
}
