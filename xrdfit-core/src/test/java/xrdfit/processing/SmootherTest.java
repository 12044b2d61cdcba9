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

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static xrdfit.test_utils.TestUtils.assertArray;

public class SmootherTest {

    @Test
    public void testWindowLengthCoercion() {
        assertEquals("capped to signal length and made odd", 7, Smoother.coerceWindowLength(11, 3, 8));
        assertEquals("at least polyorder + 2", 5, Smoother.coerceWindowLength(4, 3, 100));
        assertEquals(11, Smoother.coerceWindowLength(11, 3, 100));
        assertEquals(7, Smoother.coerceWindowLength(3, 4, 100));
    }

    @Test
    public void testSavitzkyGolayPreservesPolynomial() {
        int n = 40;
        double[] y = new double[n];
        for (int i = 0; i<n; ++i) y[i] = 2 - 0.5 * i + 0.1 * i * i - 0.003 * i * i * i;
        assertArray("cubic preserved, borders included", y, Smoother.savitzkyGolay(y, 11, 3), 1e-8);
    }

    @Test
    public void testSavitzkyGolayTooShort() {
        double[] y = new double[]{1, 5, 2};
        assertArrayEquals(y, Smoother.savitzkyGolay(y, 11, 3), 0);
    }

    @Test
    public void testGaussian() {
        double[] flat = new double[]{3, 3, 3, 3, 3};
        assertArray("constant preserved with reflected borders", flat, Smoother.gaussian(flat, 2), 1e-12);
        double[] spike = new double[21];
        spike[10] = 1;
        double[] smoothed = Smoother.gaussian(spike, 1);
        double sum = 0;
        for (double v : smoothed) sum += v;
        assertEquals("mass preserved", 1, sum, 1e-12);
        assertEquals("symmetric", smoothed[9], smoothed[11], 1e-15);
    }

    @Test
    public void testApply() {
        double[] y = new double[]{1, 2, 8, 2, 1, 0, 4};
        assertArrayEquals("unknown method: copy", y, Smoother.apply(y, "median", null), 0);
        Map<String, Double> params = new HashMap<>();
        params.put(Smoother.SIGMA, 1.);
        assertArrayEquals(Smoother.gaussian(y, 1), Smoother.apply(y, "Gaussian", params), 0);
        assertArrayEquals("default parameters", Smoother.savitzkyGolay(y, 11, 3), Smoother.apply(y, Smoother.SAVGOL, null), 0);
    }
}
