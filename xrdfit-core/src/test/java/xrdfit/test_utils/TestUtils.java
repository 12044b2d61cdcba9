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
package xrdfit.test_utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.data_structure.Spectrum;
import xrdfit.processing.peak_fit.ProfileModel;

import static org.junit.Assert.assertEquals;

/**
 * Synthetic diffraction traces
 * @author Jean Ollion
 */
public class TestUtils {
    public static final Logger logger = LoggerFactory.getLogger(TestUtils.class);

    /**
     * @return n positions from start with constant step
     */
    public static double[] grid(double start, double step, int n) {
        double[] x = new double[n];
        for (int i = 0; i<n; ++i) x[i] = start + i * step;
        return x;
    }

    public static double[] constant(int n, double value) {
        double[] res = new double[n];
        for (int i = 0; i<n; ++i) res[i] = value;
        return res;
    }

    public static double[] linear(double[] x, double intercept, double slope) {
        double[] res = new double[x.length];
        for (int i = 0; i<x.length; ++i) res[i] = intercept + slope * x[i];
        return res;
    }

    /**
     * Adds in place an area-normalized gaussian profile
     */
    public static double[] addGaussian(double[] x, double[] y, double amplitude, double center, double sigma) {
        for (int i = 0; i<x.length; ++i) y[i] += ProfileModel.gaussian(x[i], amplitude, center, sigma);
        return y;
    }

    public static double[] addPseudoVoigt(double[] x, double[] y, double amplitude, double center, double sigma, double gamma, double eta) {
        for (int i = 0; i<x.length; ++i) y[i] += ProfileModel.pseudoVoigt(x[i], amplitude, center, sigma, gamma, eta);
        return y;
    }

    /**
     * Positions 5 to 15 with step 0.01, flat background 100 and one gaussian peak of area 500 and sigma 0.127 centered at 10
     */
    public static Spectrum singleGaussianSpectrum() {
        double[] x = grid(5, 0.01, 1001);
        return new Spectrum("single", x, addGaussian(x, constant(x.length, 100), 500, 10, 0.127));
    }

    public static String toText(Spectrum spectrum) {
        StringBuilder sb = new StringBuilder("# 2theta intensity\n");
        for (int i = 0; i<spectrum.size(); ++i) sb.append(spectrum.getX(i)).append(' ').append(spectrum.getY(i)).append('\n');
        return sb.toString();
    }

    public static void assertArray(String message, double[] expected, double[] actual, double precision) {
        assertEquals(message+": length", expected.length, actual.length);
        for (int i = 0; i<expected.length; ++i) assertEquals(message+" @"+i, expected[i], actual[i], precision);
    }
}
