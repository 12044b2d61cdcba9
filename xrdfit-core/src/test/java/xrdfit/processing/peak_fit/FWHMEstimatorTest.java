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

import org.junit.Test;
import xrdfit.test_utils.TestUtils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FWHMEstimatorTest {

    @Test
    public void testGaussianWidth() {
        double[] x = TestUtils.grid(9.5, 0.01, 101);
        double[] y = TestUtils.addGaussian(x, new double[x.length], 500, 10, 0.127);
        double[] res = FWHMEstimator.estimate(x, y, 50, true);
        assertEquals(2.355 * 0.127, res[0], 2.355 * 0.127 * 0.02);
        assertTrue("baseline: "+res[1], res[1] >= 0 && res[1] < 15);
        double[] raw = FWHMEstimator.estimate(x, y, 50, false);
        assertEquals(res[0], raw[0], 2.355 * 0.127 * 0.02);
    }

    @Test
    public void testDegenerateWidth() {
        double[] x = TestUtils.grid(0, 1, 21);
        double[] y = new double[21];
        y[10] = 1;
        double[] res = FWHMEstimator.estimate(x, y, 10, false);
        assertEquals("floor: 8 sample spacings", 8, res[0], 1e-12);
        assertEquals(0, res[1], 0);
    }

    @Test
    public void testPeakAtBorder() {
        double[] x = TestUtils.grid(0, 1, 10);
        double[] y = new double[]{0, 0, 0, 0, 1, 2, 4, 6, 8, 10};
        double[] res = FWHMEstimator.estimate(x, y, 9, false);
        assertTrue(res[0] > 0);
        assertTrue(Double.isFinite(res[0]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidIndex() {
        double[] x = TestUtils.grid(0, 1, 10);
        FWHMEstimator.estimate(x, new double[10], 10, false);
    }
}
