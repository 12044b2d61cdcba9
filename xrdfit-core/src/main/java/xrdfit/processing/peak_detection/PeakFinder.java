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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.utils.ArrayUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Local maxima of a 1D signal selected by height, separation, prominence and width. Criteria are applied in this order; NaN disables a criterion.
 * <ul>
 *     <li>height: signal value at the peak</li>
 *     <li>distance: minimal separation in samples; peaks closer than this are removed, starting from the highest peak</li>
 *     <li>prominence: peak value minus the higher of the two minima found between the peak and the nearest higher sample on each side (or the signal border)</li>
 *     <li>width: width in samples at half the prominence, with linear interpolation</li>
 * </ul>
 * @author Jean Ollion
 */
public class PeakFinder {
    public static final Logger logger = LoggerFactory.getLogger(PeakFinder.class);
    double minHeight = Double.NaN, minProminence = Double.NaN, minWidth = Double.NaN;
    double minDistance = Double.NaN;

    public PeakFinder setMinHeight(double minHeight) {
        this.minHeight = minHeight;
        return this;
    }
    public PeakFinder setMinProminence(double minProminence) {
        this.minProminence = minProminence;
        return this;
    }
    public PeakFinder setMinDistance(double minDistance) {
        if (minDistance<1 && !Double.isNaN(minDistance)) throw new IllegalArgumentException("distance must be >= 1");
        this.minDistance = minDistance;
        return this;
    }
    public PeakFinder setMinWidth(double minWidth) {
        this.minWidth = minWidth;
        return this;
    }

    /**
     *
     * @param y signal
     * @return indices of selected peaks, in increasing order
     */
    public int[] find(double[] y) {
        List<Integer> peaks = ArrayUtil.getLocalMaxima(y);
        if (!Double.isNaN(minHeight)) peaks.removeIf(p -> y[p] < minHeight);
        if (!Double.isNaN(minDistance)) peaks = selectByDistance(y, peaks, (int)Math.ceil(minDistance));
        if (!Double.isNaN(minProminence) || !Double.isNaN(minWidth)) {
            List<Integer> selected = new ArrayList<>(peaks.size());
            for (int p : peaks) {
                int[] bases = new int[2];
                double prominence = getProminence(y, p, bases);
                if (!Double.isNaN(minProminence) && prominence < minProminence) continue;
                if (!Double.isNaN(minWidth) && getWidth(y, p, prominence, 0.5, bases[0], bases[1]) < minWidth) continue;
                selected.add(p);
            }
            peaks = selected;
        }
        logger.trace("peaks: {}", peaks);
        return ArrayUtil.toIntArray(peaks);
    }

    static List<Integer> selectByDistance(double[] y, List<Integer> peaks, int distance) {
        int n = peaks.size();
        boolean[] keep = new boolean[n];
        for (int i = 0; i<n; ++i) keep[i] = true;
        // highest peaks first. for equal heights the rightmost peak has priority
        int[] priority = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> y[peaks.get(i)]).thenComparingInt(i -> i).reversed())
                .mapToInt(Integer::intValue).toArray();
        for (int j : priority) {
            if (!keep[j]) continue;
            int peak = peaks.get(j);
            for (int k = j-1; k>=0 && peak - peaks.get(k) < distance; --k) keep[k] = false;
            for (int k = j+1; k<n && peaks.get(k) - peak < distance; ++k) keep[k] = false;
        }
        List<Integer> res = new ArrayList<>();
        for (int i = 0; i<n; ++i) if (keep[i]) res.add(peaks.get(i));
        return res;
    }

    /**
     *
     * @param y signal
     * @param peak index of a local maximum
     * @param bases array of length 2 receiving the left and right base indices, can be null
     * @return prominence of the peak
     */
    public static double getProminence(double[] y, int peak, int[] bases) {
        double leftMin = y[peak];
        int leftBase = peak;
        for (int i = peak; i>=0 && y[i]<=y[peak]; --i) {
            if (y[i]<leftMin) {
                leftMin = y[i];
                leftBase = i;
            }
        }
        double rightMin = y[peak];
        int rightBase = peak;
        for (int i = peak; i<y.length && y[i]<=y[peak]; ++i) {
            if (y[i]<rightMin) {
                rightMin = y[i];
                rightBase = i;
            }
        }
        if (bases!=null) {
            bases[0] = leftBase;
            bases[1] = rightBase;
        }
        return y[peak] - Math.max(leftMin, rightMin);
    }

    /**
     *
     * @param y signal
     * @param peak peak index
     * @param prominence prominence of the peak
     * @param relHeight relative height at which width is measured, as fraction of prominence
     * @param leftBase left base of the peak
     * @param rightBase right base of the peak
     * @return width in samples, interpolated
     */
    public static double getWidth(double[] y, int peak, double prominence, double relHeight, int leftBase, int rightBase) {
        double height = y[peak] - prominence * relHeight;
        int i = peak;
        while (leftBase < i && height < y[i]) --i;
        double leftPosition = i;
        if (y[i] < height) leftPosition += (height - y[i]) / (y[i+1] - y[i]);
        i = peak;
        while (i < rightBase && height < y[i]) ++i;
        double rightPosition = i;
        if (y[i] < height) rightPosition -= (height - y[i]) / (y[i-1] - y[i]);
        return rightPosition - leftPosition;
    }
}
