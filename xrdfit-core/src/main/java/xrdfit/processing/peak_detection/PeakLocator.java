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
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.Spectrum;
import xrdfit.processing.Smoother;
import xrdfit.utils.ArrayUtil;
import xrdfit.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Automatic peak detection and manual edition of peak collections.
 * Edition methods never modify their input: they return a new list sorted by position
 * @author Jean Ollion
 */
public class PeakLocator {
    public static final Logger logger = LoggerFactory.getLogger(PeakLocator.class);
    public static final double DUPLICATE_TOLERANCE = 1e-9;
    static final int LOCAL_BASELINE_WINDOW = 40;

    /**
     * Two passes detection on the smoothed signal: a strict pass and, if nothing is found, a relaxed pass.
     * Candidates are then kept only if they exceed by 10% the baseline of their ±40 samples neighborhood.
     * @param spectrum
     * @return sample indices of detected peaks in increasing order. Same input always yields same output
     */
    public static int[] autoFindPeaks(Spectrum spectrum) {
        double[] y = spectrum.getYValues();
        int n = y.length;
        double[] ySmooth = n > 15 ? Smoother.savitzkyGolay(y, Math.min(15, n / 2 * 2 + 1), 3) : y;
        double yMin = y[ArrayUtil.min(y)];
        double range = y[ArrayUtil.max(y)] - yMin;
        double dx = spectrum.getMeanSpacing();
        int minDistance = dx > 0 ? Math.max(5, (int)(0.1 / dx)) : 5;
        int[] candidates = new PeakFinder().setMinHeight(yMin + range * 0.05).setMinProminence(range * 0.02)
                .setMinDistance(minDistance).setMinWidth(2).find(ySmooth);
        if (candidates.length==0) {
            logger.debug("no peak found with default thresholds, retrying with relaxed thresholds");
            candidates = new PeakFinder().setMinHeight(yMin + range * 0.02).setMinProminence(range * 0.01)
                    .setMinDistance(3).find(ySmooth);
        }
        List<Integer> peaks = new ArrayList<>(candidates.length);
        for (int idx : candidates) {
            int left = Math.max(0, idx - LOCAL_BASELINE_WINDOW);
            int right = Math.min(n, idx + LOCAL_BASELINE_WINDOW);
            int edge = Math.max(3, (right - left) / 10);
            double localBaseline = (ArrayUtil.mean(y, left, Math.min(n, left + edge)) + ArrayUtil.mean(y, Math.max(0, right - edge), right)) / 2;
            if (y[idx] > localBaseline * 1.1) peaks.add(idx);
            else logger.trace("candidate peak at {} removed: y={} local baseline={}", spectrum.getX(idx), y[idx], localBaseline);
        }
        logger.debug("{}: {} peak(s) detected out of {} candidate(s): {}", spectrum, peaks.size(), candidates.length, peaks);
        return ArrayUtil.toIntArray(peaks);
    }

    public static List<Peak> toPeaks(Spectrum spectrum, int[] indices) {
        List<Peak> res = new ArrayList<>(indices.length);
        for (int idx : indices) {
            Peak p = Peak.fromIndex(spectrum, idx);
            if (!containsDuplicate(res, p)) res.add(p);
        }
        Collections.sort(res);
        return res;
    }

    /**
     * Index of the local maximum near a clicked position. The search window is max(5, min(10, n/20)) samples around the sample nearest to {@param xClick}.
     * If the local maximum is further than 0.7 × window × dx from the click, the sample nearest to the click is returned.
     * @param spectrum
     * @param xClick
     * @return sample index
     */
    public static int snapToLocalMaximum(Spectrum spectrum, double xClick) {
        int n = spectrum.size();
        int idx = spectrum.getNearestIndex(xClick);
        int window = Math.max(5, Math.min(10, n / 20));
        double[] y = spectrum.getYValues();
        int peakIdx = ArrayUtil.max(y, Math.max(0, idx - window), Math.min(n, idx + window + 1));
        double maxDistance = spectrum.getMeanSpacing() * window * 0.7;
        if (Math.abs(spectrum.getX(peakIdx) - xClick) > maxDistance) {
            logger.debug("local maximum at {} too far from click {}: using click position", spectrum.getX(peakIdx), xClick);
            return idx;
        }
        return peakIdx;
    }

    /**
     *
     * @param spectrum
     * @param peaks current peaks
     * @param xClick position of the peak to add
     * @return new list containing {@param peaks} and the added peak. If the peak duplicates an existing one the list is not modified
     */
    public static List<Peak> addPeak(Spectrum spectrum, Collection<Peak> peaks, double xClick) {
        List<Peak> res = new ArrayList<>(peaks);
        Peak peak = Peak.fromIndex(spectrum, snapToLocalMaximum(spectrum, xClick));
        if (containsDuplicate(res, peak)) logger.debug("peak at {} already present", peak.getPosition());
        else res.add(peak);
        Collections.sort(res);
        return res;
    }

    /**
     *
     * @param peaks current peaks
     * @param xClick
     * @return new list without the peak closest to {@param xClick}
     */
    public static List<Peak> removePeak(Collection<Peak> peaks, double xClick) {
        List<Peak> res = new ArrayList<>(peaks);
        if (res.isEmpty()) return res;
        Peak nearest = res.stream().min((p1, p2) -> Double.compare(Math.abs(p1.getPosition() - xClick), Math.abs(p2.getPosition() - xClick))).get();
        res.remove(nearest);
        logger.debug("peak at {} removed", Utils.formatDouble(4, nearest.getPosition()));
        Collections.sort(res);
        return res;
    }

    static boolean containsDuplicate(Collection<Peak> peaks, Peak peak) {
        return peaks.stream().anyMatch(p -> p.getIndex()==peak.getIndex() || Math.abs(p.getPosition() - peak.getPosition()) < DUPLICATE_TOLERANCE);
    }
}
