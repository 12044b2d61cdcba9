/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of XRDFIT
 *
 * XRDFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * XRDFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with XRDFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package xrdfit.processing.peak_fit;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.PeakGroup;
import xrdfit.utils.ArrayUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Joint least-squares fit of the profiles of all peaks of a group on the background-subtracted signal.
 * Strategies are attempted in order until one converges: {@link FitStrategy#TRUST_REGION} then {@link FitStrategy#DOGBOX} with a larger evaluation cap
 * @author Jean Ollion
 */
public class GroupFitter {
    public static final Logger logger = LoggerFactory.getLogger(GroupFitter.class);
    static final double SQRT_2PI = Math.sqrt(2 * Math.PI);

    /**
     * Ordered optimization attempt
     */
    public static class Attempt {
        public final FitStrategy strategy;
        public final int maxEvaluations;
        public final double tolerance;
        public Attempt(FitStrategy strategy, int maxEvaluations, double tolerance) {
            this.strategy = strategy;
            this.maxEvaluations = maxEvaluations;
            this.tolerance = tolerance;
        }
        @Override
        public String toString() {
            return strategy+"(maxEval="+maxEvaluations+", tol="+tolerance+")";
        }
    }

    /**
     * Single peak groups use the default cap and tolerance. Groups of several peaks and overlap mode use the multi-peak cap and tolerance. The fallback uses its own cap and tolerance
     */
    public static List<Attempt> getAttempts(int groupSize, PeakFitConfig config) {
        boolean multi = groupSize > 1 || config.overlapMode;
        return Arrays.asList(
                new Attempt(FitStrategy.TRUST_REGION, multi ? config.maxEvaluationsMulti : config.maxEvaluations, multi ? config.toleranceMulti : config.tolerance),
                new Attempt(FitStrategy.DOGBOX, config.maxEvaluationsFallback, config.toleranceFallback)
        );
    }

    /**
     * Window from the center of the leftmost peak minus multiplier × its FWHM to the center of the rightmost peak plus multiplier × its FWHM
     * @param x sample positions
     * @param group peaks with FWHM estimation
     * @param multiplier
     * @return fit window
     */
    public static FitWindow getWindow(double[] x, PeakGroup group, double multiplier) {
        double left = x[group.getMinSampleIndex()] - group.getFirst().getFWHM() * multiplier;
        double right = x[group.getMaxSampleIndex()] + group.getLast().getFWHM() * multiplier;
        int start = Math.max(0, ArrayUtil.searchSorted(x, left));
        int stop = Math.min(x.length, ArrayUtil.searchSorted(x, right));
        return new FitWindow(start, stop, left, right);
    }

    /**
     * Start point and bounds of packed parameters, peak after peak
     * @param x sample positions of the whole spectrum
     * @param y background-subtracted signal of the whole spectrum
     * @param window fit window
     * @param group peaks with FWHM estimation
     * @param config
     * @return array containing start point, lower bounds, upper bounds
     */
    public static double[][] getInitialParameters(double[] x, double[] y, FitWindow window, PeakGroup group, PeakFitConfig config) {
        ProfileModel profile = config.profile;
        int nParams = profile.getParameterCount();
        double[] start = new double[nParams * group.size()];
        double[] lower = new double[start.length];
        double[] upper = new double[start.length];
        double dx = ArrayUtil.meanStep(x);
        double windowMax = y[ArrayUtil.max(y, window.start, window.stop)];
        double windowRange = windowMax - y[ArrayUtil.min(y, window.start, window.stop)];
        double centerTolerance = config.getCenterTolerance();
        for (int i = 0; i<group.size(); ++i) {
            Peak peak = group.getPeak(i);
            int o = i * nParams;
            double fwhm = peak.getFWHM();
            double sigma = fwhm / ProfileModel.GAUSSIAN_FWHM_FACTOR;
            double gamma = fwhm / 2;
            double height = peak.getIndex()>=window.start && peak.getIndex()<window.stop ? y[peak.getIndex()] : windowMax;
            if (height<=0) height = windowMax * 0.5;
            start[o] = height * sigma * SQRT_2PI;
            lower[o] = 0;
            upper[o] = windowRange * sigma * SQRT_2PI * 10;
            start[o+1] = peak.getPosition();
            lower[o+1] = peak.getPosition() - fwhm * centerTolerance;
            upper[o+1] = peak.getPosition() + fwhm * centerTolerance;
            start[o+2] = sigma;
            start[o+3] = gamma;
            lower[o+2] = lower[o+3] = dx * 0.5;
            upper[o+2] = upper[o+3] = fwhm * 3;
            if (nParams>4) {
                start[o+4] = 0.5;
                lower[o+4] = 0;
                upper[o+4] = 1;
            }
        }
        return new double[][]{start, lower, upper};
    }

    /**
     * Fits all peaks of {@param group} together
     * @param x sample positions of the whole spectrum
     * @param y background-subtracted signal of the whole spectrum
     * @param group peaks sorted by position, with FWHM estimation
     * @param config
     * @return one result per peak of the group. Empty if the fit window contains less than {@link PeakFitConfig#minWindowSamples} samples
     * @throws OptimizerDivergenceException if bounds are degenerate (e.g. flat window) or if all strategies fail
     */
    public static List<FitResult> fit(double[] x, double[] y, PeakGroup group, PeakFitConfig config) throws OptimizerDivergenceException {
        FitWindow window = getWindow(x, group, config.getWindowMultiplier(group.size()));
        if (window.size() < Math.max(1, config.minWindowSamples)) {
            logger.debug("{}: window {} too small, group is skipped", group, window);
            return Collections.emptyList();
        }
        double[][] init = getInitialParameters(x, y, window, group, config);
        double[] xw = Arrays.copyOfRange(x, window.start, window.stop);
        double[] yw = Arrays.copyOfRange(y, window.start, window.stop);
        double[] params = optimize(xw, yw, init, config.profile, group.size(), getAttempts(group.size(), config));
        return ResultAssembler.unpack(group, params, config.profile, window);
    }

    /**
     *
     * @param x sample positions of the window
     * @param y values to fit
     * @param init start point, lower bounds and upper bounds
     * @param profile
     * @param peakCount
     * @param attempts strategies in order
     * @return optimized parameters, within bounds
     * @throws OptimizerDivergenceException if a lower bound is not strictly below its upper bound, or if all attempts fail
     */
    public static double[] optimize(double[] x, double[] y, double[][] init, ProfileModel profile, int peakCount, List<Attempt> attempts) throws OptimizerDivergenceException {
        for (int i = 0; i<init[1].length; ++i) {
            if (!(init[1][i] < init[2][i])) throw new OptimizerDivergenceException("invalid bounds for parameter "+i+": ["+init[1][i]+"; "+init[2][i]+"]");
        }
        BoundsValidator validator = new BoundsValidator(init[1], init[2], init[0]);
        double[] start = validator.project(init[0]);
        MultiplePeakFunction function = new MultiplePeakFunction(x, profile, peakCount, init[2]);
        List<String> errors = new ArrayList<>();
        for (Attempt attempt : attempts) {
            LeastSquaresBuilder builder = new LeastSquaresBuilder()
                    .model(function)
                    .target(y)
                    .start(start)
                    .parameterValidator(validator)
                    .lazyEvaluation(false);
            try {
                double[] res = validator.project(attempt.strategy.optimize(builder, attempt.maxEvaluations, attempt.tolerance));
                if (!errors.isEmpty()) logger.debug("fit converged with fallback strategy: {}", attempt);
                return res;
            } catch (OptimizerDivergenceException e) {
                logger.debug("fit attempt {} failed: {}", attempt, e.getMessage());
                errors.add(e.getMessage());
            }
        }
        throw new OptimizerDivergenceException(String.join("; ", errors));
    }
}
