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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SmoothingSplineTest {

    @Test
    public void testInterpolating() {
        double[] x = new double[]{0, 1, 2.5, 3, 5};
        double[] y = new double[]{1, -2, 4, 0, 3};
        SmoothingSpline spline = new SmoothingSpline(x, y, 0);
        for (int i = 0; i<x.length; ++i) assertEquals("knot "+i, y[i], spline.value(x[i]), 1e-9);
        assertEquals(0, spline.getResidualSumOfSquares(), 1e-12);
    }

    @Test
    public void testSmoothing() {
        int n = 30;
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i<n; ++i) {
            x[i] = i;
            y[i] = Math.sin(i * 0.3) + (i%2==0 ? 0.2 : -0.2);
        }
        double s = 0.5;
        SmoothingSpline spline = new SmoothingSpline(x, y, s);
        assertTrue("rss: "+spline.getResidualSumOfSquares(), spline.getResidualSumOfSquares() <= s + 1e-9);
        assertTrue("smoothed: "+spline.getResidualSumOfSquares(), spline.getResidualSumOfSquares() > 0.1);
    }

    @Test
    public void testLinearExtrapolation() {
        double[] x = new double[]{0, 1, 2, 4};
        double[] y = new double[]{1, 3, 5, 9};
        SmoothingSpline spline = new SmoothingSpline(x, y, 4);
        assertEquals(-1, spline.value(-1), 1e-9);
        assertEquals(13, spline.value(6), 1e-9);
        assertEquals(7, spline.value(3), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooFewKnots() {
        new SmoothingSpline(new double[]{0, 1, 2}, new double[]{0, 1, 2}, 1);
    }
}
