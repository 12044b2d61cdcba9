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
package xrdfit.processing.background;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.utils.ArrayUtil;

/**
 * Natural cubic smoothing spline (Reinsch). Minimizes the roughness penalty under the constraint that the residual sum of squares at the knots does not exceed the smoothing factor.
 * The roughness weight is found by bisection. Outside the knot range the spline is extended linearly.
 * @author Jean Ollion
 */
public class SmoothingSpline implements UnivariateFunction {
    public static final Logger logger = LoggerFactory.getLogger(SmoothingSpline.class);
    final double[] x, g, gamma;
    final double rss;

    /**
     *
     * @param x knots, strictly increasing, at least 4
     * @param y values at knots
     * @param smoothingFactor target residual sum of squares. 0 gives an interpolating spline
     */
    public SmoothingSpline(double[] x, double[] y, double smoothingFactor) {
        if (x.length!=y.length) throw new IllegalArgumentException("x and y should have same length");
        if (x.length<4) throw new IllegalArgumentException("at least 4 knots are required");
        for (int i = 1; i<x.length; ++i) if (!(x[i]>x[i-1])) throw new IllegalArgumentException("knots should be strictly increasing");
        this.x = x.clone();
        int n = x.length;
        double[] h = new double[n-1];
        for (int i = 0; i<n-1; ++i) h[i] = x[i+1] - x[i];
        RealMatrix Q = new Array2DRowRealMatrix(n, n-2);
        RealMatrix R = new Array2DRowRealMatrix(n-2, n-2);
        for (int j = 1; j<n-1; ++j) {
            Q.setEntry(j-1, j-1, 1/h[j-1]);
            Q.setEntry(j, j-1, -1/h[j-1] - 1/h[j]);
            Q.setEntry(j+1, j-1, 1/h[j]);
            R.setEntry(j-1, j-1, (h[j-1] + h[j]) / 3);
            if (j<n-2) {
                R.setEntry(j-1, j, h[j] / 6);
                R.setEntry(j, j-1, h[j] / 6);
            }
        }
        RealVector yv = new ArrayRealVector(y);
        RealMatrix QtQ = Q.transpose().multiply(Q);
        RealVector Qty = Q.transpose().operate(yv);
        double alpha;
        if (smoothingFactor<=0) alpha = 0;
        else {
            // rss is increasing with alpha: bisection on log scale
            double scale = Math.pow((x[n-1] - x[0]) / (n - 1), 3);
            double logLow = Math.log(scale) - 30, logHigh = Math.log(scale) + 30;
            if (residualSumOfSquares(Math.exp(logHigh), Q, R, QtQ, Qty) <= smoothingFactor) alpha = Math.exp(logHigh);
            else if (residualSumOfSquares(Math.exp(logLow), Q, R, QtQ, Qty) >= smoothingFactor) alpha = Math.exp(logLow);
            else {
                for (int it = 0; it<100; ++it) {
                    double logMid = (logLow + logHigh) / 2;
                    if (residualSumOfSquares(Math.exp(logMid), Q, R, QtQ, Qty) > smoothingFactor) logHigh = logMid;
                    else logLow = logMid;
                }
                alpha = Math.exp(logLow);
            }
        }
        RealVector gammaInt = solve(alpha, R, QtQ, Qty);
        RealVector gv = yv.subtract(Q.operate(gammaInt).mapMultiply(alpha));
        this.g = gv.toArray();
        this.gamma = new double[n];
        for (int i = 1; i<n-1; ++i) gamma[i] = gammaInt.getEntry(i-1);
        this.rss = gv.subtract(yv).dotProduct(gv.subtract(yv));
        logger.trace("smoothing spline: {} knots, alpha={}, rss={} (target: {})", n, alpha, rss, smoothingFactor);
    }

    private static RealVector solve(double alpha, RealMatrix R, RealMatrix QtQ, RealVector Qty) {
        return new LUDecomposition(R.add(QtQ.scalarMultiply(alpha))).getSolver().solve(Qty);
    }

    private static double residualSumOfSquares(double alpha, RealMatrix Q, RealMatrix R, RealMatrix QtQ, RealVector Qty) {
        RealVector res = Q.operate(solve(alpha, R, QtQ, Qty)).mapMultiply(alpha);
        return res.dotProduct(res);
    }

    public double getResidualSumOfSquares() {
        return rss;
    }

    @Override
    public double value(double v) {
        int n = x.length;
        if (v<=x[0]) {
            double h = x[1] - x[0];
            double slope = (g[1] - g[0]) / h - h * (2 * gamma[0] + gamma[1]) / 6;
            return g[0] + slope * (v - x[0]);
        }
        if (v>=x[n-1]) {
            double h = x[n-1] - x[n-2];
            double slope = (g[n-1] - g[n-2]) / h + h * (gamma[n-2] + 2 * gamma[n-1]) / 6;
            return g[n-1] + slope * (v - x[n-1]);
        }
        int i = Math.max(0, ArrayUtil.searchSorted(x, v) - 1);
        double h = x[i+1] - x[i];
        double a = v - x[i], b = x[i+1] - v;
        return (a * g[i+1] + b * g[i]) / h - a * b / 6 * ((1 + a / h) * gamma[i+1] + (1 + b / h) * gamma[i]);
    }
}
