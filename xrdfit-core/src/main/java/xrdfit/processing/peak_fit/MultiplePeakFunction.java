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

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Sum of profiles of several peaks, evaluated on the samples of a fit window.
 * Parameters of all peaks are packed in a single vector, peak after peak, each peak using {@link ProfileModel#getParameterCount()} parameters.
 * Jacobian is computed by forward finite differences; the step is reversed when it would cross the upper bound of a parameter
 * @author Jean Ollion
 */
public class MultiplePeakFunction implements MultivariateJacobianFunction {
    static final double STEP = Math.sqrt(Math.ulp(1d));
    final double[] x;
    final ProfileModel profile;
    final int peakCount;
    final double[] upperBounds;

    /**
     *
     * @param x positions of samples
     * @param profile
     * @param peakCount number of peaks
     * @param upperBounds upper bounds of parameters, can be null
     */
    public MultiplePeakFunction(double[] x, ProfileModel profile, int peakCount, double[] upperBounds) {
        if (upperBounds!=null && upperBounds.length!=profile.getParameterCount() * peakCount) throw new IllegalArgumentException("Invalid bound number");
        this.x = x;
        this.profile = profile;
        this.peakCount = peakCount;
        this.upperBounds = upperBounds;
    }

    public int getParameterCount() {
        return profile.getParameterCount() * peakCount;
    }

    /**
     *
     * @param parameters packed parameters
     * @return sum of all peak profiles at each sample
     */
    public double[] value(double[] parameters) {
        double[] res = new double[x.length];
        int nParams = profile.getParameterCount();
        for (int peak = 0; peak<peakCount; ++peak) {
            int offset = peak * nParams;
            for (int i = 0; i<x.length; ++i) res[i] += profile.value(x[i], parameters, offset);
        }
        return res;
    }

    /**
     *
     * @param parameters packed parameters
     * @param peak index of the peak
     * @return profile of a single peak at each sample
     */
    public double[] value(double[] parameters, int peak) {
        double[] res = new double[x.length];
        int offset = peak * profile.getParameterCount();
        for (int i = 0; i<x.length; ++i) res[i] = profile.value(x[i], parameters, offset);
        return res;
    }

    @Override
    public org.apache.commons.math3.util.Pair<RealVector, RealMatrix> value(RealVector point) {
        double[] p = point.toArray();
        int nParams = profile.getParameterCount();
        double[][] peakValues = new double[peakCount][];
        double[] v = new double[x.length];
        for (int peak = 0; peak<peakCount; ++peak) {
            peakValues[peak] = value(p, peak);
            for (int i = 0; i<x.length; ++i) v[i] += peakValues[peak][i];
        }
        double[][] jacobian = new double[x.length][p.length];
        for (int j = 0; j<p.length; ++j) {
            double h = STEP * Math.max(Math.abs(p[j]), 1);
            if (upperBounds!=null && p[j] + h > upperBounds[j]) h = -h;
            double pj = p[j];
            p[j] = pj + h;
            double dh = p[j] - pj;
            // only the profile owning parameter j depends on it
            int peak = j / nParams;
            for (int i = 0; i<x.length; ++i) jacobian[i][j] = (profile.value(x[i], p, peak * nParams) - peakValues[peak][i]) / dh;
            p[j] = pj;
        }
        return new org.apache.commons.math3.util.Pair<>(new ArrayRealVector(v, false), new Array2DRowRealMatrix(jacobian, false));
    }
}
