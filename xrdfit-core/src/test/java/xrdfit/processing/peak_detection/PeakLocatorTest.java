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
package xrdfit.processing.peak_detection;

import org.junit.Test;
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.Spectrum;
import xrdfit.test_utils.TestUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PeakLocatorTest {

    @Test
    public void testSinglePeakDetection() {
        Spectrum spectrum = TestUtils.singleGaussianSpectrum();
        int[] peaks = PeakLocator.autoFindPeaks(spectrum);
        assertArrayEquals(new int[]{500}, peaks);
        assertArrayEquals("same input same output", peaks, PeakLocator.autoFindPeaks(spectrum));
    }

    @Test
    public void testSeparatedPeaksDetection() {
        double[] x = TestUtils.grid(5, 0.01, 1001);
        double[] y = TestUtils.constant(x.length, 50);
        TestUtils.addGaussian(x, y, 300, 7, 0.1);
        TestUtils.addGaussian(x, y, 200, 12, 0.15);
        int[] peaks = PeakLocator.autoFindPeaks(new Spectrum(x, y));
        assertArrayEquals(new int[]{200, 700}, peaks);
    }

    @Test
    public void testFlatSignal() {
        double[] x = TestUtils.grid(0, 1, 50);
        assertEquals(0, PeakLocator.autoFindPeaks(new Spectrum(x, TestUtils.constant(50, 10))).length);
    }

    @Test
    public void testSnapToLocalMaximum() {
        Spectrum spectrum = TestUtils.singleGaussianSpectrum();
        assertEquals("snapped", 500, PeakLocator.snapToLocalMaximum(spectrum, 10.05));
        assertEquals("maximum too far: click position kept", 509, PeakLocator.snapToLocalMaximum(spectrum, 10.09));
    }

    @Test
    public void testAddRemovePeak() {
        Spectrum spectrum = TestUtils.singleGaussianSpectrum();
        List<Peak> peaks = PeakLocator.addPeak(spectrum, Collections.emptyList(), 10.03);
        assertEquals(1, peaks.size());
        assertEquals(500, peaks.get(0).getIndex());
        assertEquals("duplicate ignored", 1, PeakLocator.addPeak(spectrum, peaks, 9.98).size());
        peaks = PeakLocator.addPeak(spectrum, peaks, 6);
        assertEquals(2, peaks.size());
        assertEquals("sorted by position", 100, peaks.get(0).getIndex());
        List<Peak> removed = PeakLocator.removePeak(peaks, 9.5);
        assertEquals(1, removed.size());
        assertEquals(100, removed.get(0).getIndex());
        assertEquals("input not modified", 2, peaks.size());
        assertTrue(PeakLocator.removePeak(Collections.emptyList(), 3).isEmpty());
    }

    @Test
    public void testToPeaks() {
        Spectrum spectrum = TestUtils.singleGaussianSpectrum();
        List<Peak> peaks = PeakLocator.toPeaks(spectrum, new int[]{700, 100, 700});
        assertEquals(2, peaks.size());
        assertEquals(6, peaks.get(0).getPosition(), 1e-9);
        assertEquals(12, peaks.get(1).getPosition(), 1e-9);
    }

    @Test
    public void testPeakFinderCriteria() {
        double[] y = new double[]{0, 1, 0, 5, 0, 0, 3, 2.5, 3.2, 0};
        assertArrayEquals(new int[]{1, 3, 6, 8}, new PeakFinder().find(y));
        assertArrayEquals("height", new int[]{3, 6, 8}, new PeakFinder().setMinHeight(2).find(y));
        assertArrayEquals("prominence", new int[]{3, 8}, new PeakFinder().setMinProminence(2).find(y));
        assertArrayEquals("distance: higher peak kept", new int[]{3, 8}, new PeakFinder().setMinDistance(3).find(y));
        assertArrayEquals("peaks exactly at the minimal distance are kept", new int[]{1, 3, 6, 8}, new PeakFinder().setMinDistance(2).find(y));
        int[] bases = new int[2];
        assertEquals(0.5, PeakFinder.getProminence(y, 6, bases), 1e-12);
        assertEquals(Arrays.toString(new int[]{5, 7}), Arrays.toString(bases));
    }
}
