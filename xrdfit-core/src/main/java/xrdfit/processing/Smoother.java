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
package xrdfit.processing;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * Noise reduction of 1D signals. Two strategies selected by name: gaussian kernel and Savitzky-Golay polynomial filter.
 * All methods return a new array and leave the input untouched
 * @author Jean Ollion
 */
public class Smoother {
    public static final Logger logger = LoggerFactory.getLogger(Smoother.class);
    public static final String GAUSSIAN = "gaussian";
    public static final String SAVGOL = "savgol";
    public static final String SIGMA = "sigma";
    public static final String WINDOW_LENGTH = "window_length";
    public static final String POLY_ORDER = "polyorder";

    /**
     * Smooths {@param y} with the method named {@param method}
     * <ul>
     *     <li>{@value #GAUSSIAN}: parameter {@value #SIGMA} (default 2)</li>
     *     <li>{@value #SAVGOL}: parameters {@value #WINDOW_LENGTH} (default 11) and {@value #POLY_ORDER} (default 3)</li>
     * </ul>
     * Any other method name returns an unchanged copy
     * @param y signal
     * @param method method name, case insensitive
     * @param parameters method parameters, can be null
     * @return smoothed copy of {@param y}
     */
    public static double[] apply(double[] y, String method, Map<String, ? extends Number> parameters) {
        if (parameters==null) parameters = Collections.emptyMap();
        if (GAUSSIAN.equalsIgnoreCase(method)) {
            return gaussian(y, getParameter(parameters, SIGMA, 2).doubleValue());
        } else if (SAVGOL.equalsIgnoreCase(method)) {
            return savitzkyGolay(y, getParameter(parameters, WINDOW_LENGTH, 11).intValue(), getParameter(parameters, POLY_ORDER, 3).intValue());
        } else {
            logger.debug("unknown smoothing method: {}, signal is not modified", method);
            return Arrays.copyOf(y, y.length);
        }
    }

    private static Number getParameter(Map<String, ? extends Number> parameters, String key, Number defaultValue) {
        Number n = parameters.get(key);
        return n==null ? defaultValue : n;
    }

    /**
     * Convolution with a normalized gaussian kernel truncated at 4 sigma. Borders are handled by reflection (d c b a | a b c d | d c b a)
     * @param y
     * @param sigma standard deviation of the kernel, in samples. Values &lt;= 0 return a copy of {@param y}
     * @return smoothed copy
     */
    public static double[] gaussian(double[] y, double sigma) {
        if (sigma<=0 || y.length==0) return Arrays.copyOf(y, y.length);
        int radius = (int)(4 * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double sum = 0;
        for (int i = -radius; i<=radius; ++i) {
            kernel[i+radius] = Math.exp(-0.5 * i * i / (sigma * sigma));
            sum += kernel[i+radius];
        }
        for (int i = 0; i<kernel.length; ++i) kernel[i] /= sum;
        int n = y.length;
        double[] res = new double[n];
        for (int i = 0; i<n; ++i) {
            double v = 0;
            for (int k = -radius; k<=radius; ++k) v += kernel[k+radius] * y[reflect(i+k, n)];
            res[i] = v;
        }
        return res;
    }

    private static int reflect(int idx, int n) {
        int period = 2 * n;
        idx = idx % period;
        if (idx<0) idx += period;
        return idx<n ? idx : period - 1 - idx;
    }

    /**
     * Window length coercion: capped to {@param length}, made odd and at least {@param polyOrder}+2
     * @param windowLength requested window length
     * @param polyOrder polynomial order
     * @param length length of the signal
     * @return coerced window length. Can exceed {@param length} for very short signals
     */
    public static int coerceWindowLength(int windowLength, int polyOrder, int length) {
        int w = Math.min(windowLength, length);
        if (w%2==0) --w;
        if (w<polyOrder+2) {
            w = polyOrder + 2;
            if (w%2==0) ++w;
        }
        return w;
    }

    /**
     * Savitzky-Golay filter: least-square fit of a polynomial of order {@param polyOrder} on a sliding window. The first and last half-windows are replaced by the values of the polynomial fitted on the first and last window.
     * @param y signal
     * @param windowLength window length, coerced by {@link #coerceWindowLength(int, int, int)}
     * @param polyOrder polynomial order
     * @return smoothed copy. If the signal is shorter than the coerced window a copy of {@param y} is returned
     */
    public static double[] savitzkyGolay(double[] y, int windowLength, int polyOrder) {
        if (polyOrder<0) throw new IllegalArgumentException("polynomial order must be >= 0");
        int n = y.length;
        int w = coerceWindowLength(windowLength, polyOrder, n);
        if (w>n) {
            logger.debug("signal too short for savitzky-golay filter: length={} window={}", n, w);
            return Arrays.copyOf(y, n);
        }
        int half = w / 2;
        RealMatrix pinv = getPseudoInverse(half, polyOrder);
        double[] coeffs = pinv.getRow(0);
        double[] res = new double[n];
        for (int i = half; i<n-half; ++i) {
            double v = 0;
            for (int k = 0; k<w; ++k) v += coeffs[k] * y[i - half + k];
            res[i] = v;
        }
        // borders: polynomial fitted on the first / last window
        fitEdge(y, res, pinv, 0, 0, half, half);
        fitEdge(y, res, pinv, n - w, n - half, n, half);
        return res;
    }

    private static void fitEdge(double[] y, double[] res, RealMatrix pinv, int windowStart, int start, int stop, int half) {
        int w = 2 * half + 1;
        double[] window = Arrays.copyOfRange(y, windowStart, windowStart + w);
        double[] poly = pinv.operate(window);
        for (int i = start; i<stop; ++i) {
            double t = i - windowStart - half;
            double v = 0;
            double tp = 1;
            for (double c : poly) {
                v += c * tp;
                tp *= t;
            }
            res[i] = v;
        }
    }

    private static RealMatrix getPseudoInverse(int half, int polyOrder) {
        int w = 2 * half + 1;
        double[][] vandermonde = new double[w][polyOrder+1];
        for (int i = 0; i<w; ++i) {
            double t = i - half;
            double tp = 1;
            for (int j = 0; j<=polyOrder; ++j) {
                vandermonde[i][j] = tp;
                tp *= t;
            }
        }
        return new QRDecomposition(new Array2DRowRealMatrix(vandermonde, false)).getSolver().getInverse();
    }
}
