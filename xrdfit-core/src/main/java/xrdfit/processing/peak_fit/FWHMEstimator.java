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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.processing.Smoother;
import xrdfit.utils.ArrayUtil;

/**
 * Full width at half maximum of a peak from the half maximum crossings on each side of the peak
 * @author Jean Ollion
 */
public class FWHMEstimator {
    public static final Logger logger = LoggerFactory.getLogger(FWHMEstimator.class);

    /**
     * Baseline is the mean of the averages of the first and last 10% of the slice (at least 3 samples). Half maximum is the midpoint between peak value and baseline.
     * The first samples at or below half maximum on each side of the peak are searched and the crossing position is linearly interpolated. When no crossing is found, the slice border is used.
     * Estimations lower than 2 sample spacings are replaced by 8 sample spacings.
     * @param x positions of a slice of the spectrum
     * @param y intensities of the slice
     * @param peakIdx index of the peak within the slice
     * @param smooth whether intensities are smoothed (Savitzky-Golay, order 3) when the slice has more than 11 samples
     * @return array containing FWHM and baseline
     */
    public static double[] estimate(double[] x, double[] y, int peakIdx, boolean smooth) {
        int n = y.length;
        if (n<2 || x.length!=n) throw new IllegalArgumentException("at least 2 samples with positions are required");
        if (peakIdx<0 || peakIdx>=n) throw new IllegalArgumentException("peak index out of slice: "+peakIdx);
        double[] ys = smooth && n > 11 ? Smoother.savitzkyGolay(y, Math.min(11, n / 2 * 2 + 1), 3) : y;
        double peakHeight = ys[peakIdx];
        int nEdge = Math.max(3, n / 10);
        double baseline = (ArrayUtil.mean(ys, 0, Math.min(nEdge, n)) + ArrayUtil.mean(ys, Math.max(0, n - nEdge), n)) / 2;
        double halfMax = (peakHeight + baseline) / 2;

        double leftX = x[0];
        int left = ArrayUtil.getFirstOccurence(ys, peakIdx, 1, v -> v <= halfMax);
        if (left>=1) {
            if (left+1<n && ys[left+1]!=ys[left]) leftX = x[left] + (halfMax - ys[left]) / (ys[left+1] - ys[left]) * (x[left+1] - x[left]);
            else leftX = x[left];
        }
        double rightX = x[n-1];
        int right = peakIdx < n - 1 ? ArrayUtil.getFirstOccurence(ys, peakIdx, n - 1, v -> v <= halfMax) : -1;
        if (right>=0 && right<n-1) {
            if (right>0 && ys[right-1]!=ys[right]) rightX = x[right] - (halfMax - ys[right]) / (ys[right-1] - ys[right]) * (x[right] - x[right-1]);
            else rightX = x[right];
        }
        double fwhm = Math.abs(rightX - leftX);
        double dx = ArrayUtil.meanStep(x);
        if (fwhm < 2 * dx) {
            logger.trace("degenerate width: {} replaced by {}", fwhm, 8 * dx);
            fwhm = 8 * dx;
        }
        return new double[]{fwhm, baseline};
    }
}
