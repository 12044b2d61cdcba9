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
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;

/**
 * Bounded least-squares algorithms. Bounds are enforced by projection of each step (see {@link BoundsValidator})
 * @author Jean Ollion
 */
public enum FitStrategy {
    /**
     * Levenberg-Marquardt trust region, converges when relative cost and parameter changes are below the tolerance
     */
    TRUST_REGION {
        @Override
        LeastSquaresOptimizer getOptimizer(double tolerance) {
            return new LevenbergMarquardtOptimizer().withCostRelativeTolerance(tolerance).withParameterRelativeTolerance(tolerance);
        }
        @Override
        LeastSquaresBuilder configure(LeastSquaresBuilder builder, double tolerance) {
            return builder;
        }
    },
    /**
     * Levenberg-Marquardt restarted with a small initial trust region ({@value #FALLBACK_STEP_BOUND} × scaled norm of the start point).
     * Steps are computed from a pivoted QR decomposition so that parameters with a null jacobian column (e.g. sigma when eta is at its upper bound) do not make the problem singular
     */
    DOGBOX {
        @Override
        LeastSquaresOptimizer getOptimizer(double tolerance) {
            return new LevenbergMarquardtOptimizer()
                    .withInitialStepBoundFactor(FALLBACK_STEP_BOUND)
                    .withCostRelativeTolerance(tolerance)
                    .withParameterRelativeTolerance(tolerance)
                    .withRankingThreshold(FALLBACK_RANKING_THRESHOLD);
        }
        @Override
        LeastSquaresBuilder configure(LeastSquaresBuilder builder, double tolerance) {
            return builder;
        }
    };
    static final double FALLBACK_STEP_BOUND = 1;
    static final double FALLBACK_RANKING_THRESHOLD = 1e-12;

    abstract LeastSquaresOptimizer getOptimizer(double tolerance);
    abstract LeastSquaresBuilder configure(LeastSquaresBuilder builder, double tolerance);

    /**
     *
     * @param builder problem with model, target, start point and validator
     * @param maxEvaluations evaluation and iteration cap
     * @param tolerance convergence tolerance
     * @return optimized parameters
     * @throws OptimizerDivergenceException if optimization does not converge or yields non finite parameters
     */
    public double[] optimize(LeastSquaresBuilder builder, int maxEvaluations, double tolerance) throws OptimizerDivergenceException {
        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = getOptimizer(tolerance).optimize(configure(builder, tolerance).maxEvaluations(maxEvaluations).maxIterations(maxEvaluations).build());
        } catch (IllegalStateException | IllegalArgumentException | ArithmeticException e) {
            throw new OptimizerDivergenceException(this + " did not converge: " + e.getMessage(), e);
        }
        double[] params = optimum.getPoint().toArray();
        for (double p : params) if (!Double.isFinite(p)) throw new OptimizerDivergenceException(this + " yielded non finite parameters");
        if (!Double.isFinite(optimum.getCost())) throw new OptimizerDivergenceException(this + " yielded non finite cost");
        return params;
    }
}
