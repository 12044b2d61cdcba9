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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.data_structure.BackgroundAnchor;
import xrdfit.data_structure.Spectrum;
import xrdfit.processing.Smoother;
import xrdfit.utils.ArrayUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Background anchors and background curve of a spectrum.
 * Anchor edition methods return new lists sorted by x
 * @author Jean Ollion
 */
public class BackgroundEstimator {
    public static final Logger logger = LoggerFactory.getLogger(BackgroundEstimator.class);
    public static final int DEFAULT_AUTO_POINTS = 10;
    public static final int DEFAULT_AUTO_WINDOW = 50;
    static final int PEAK_MARGIN = 5;
    static final int MAX_POLY_ORDER = 5;

    public static List<BackgroundAnchor> findAutoAnchors(Spectrum spectrum) {
        return findAutoAnchors(spectrum, DEFAULT_AUTO_POINTS, DEFAULT_AUTO_WINDOW);
    }

    /**
     * Splits the x range in {@param nPoints} segments of equal width and takes the minimum of each segment as anchor. Segments are smoothed (Savitzky-Golay, order 2) before minimum search when their half-length is at least 3 samples.
     * @param spectrum
     * @param nPoints number of segments
     * @param windowSize maximal smoothing window
     * @return at most {@param nPoints} anchors, with raw (x, y) values. Empty segments produce no anchor
     */
    public static List<BackgroundAnchor> findAutoAnchors(Spectrum spectrum, int nPoints, int windowSize) {
        List<BackgroundAnchor> res = new ArrayList<>();
        if (nPoints<=0) return res;
        double[] x = spectrum.getXValues();
        double[] y = spectrum.getYValues();
        double xMin = x[0], xMax = x[x.length-1];
        double step = (xMax - xMin) / nPoints;
        for (int i = 0; i<nPoints; ++i) {
            double segStart = xMin + i * step;
            double segEnd = i==nPoints-1 ? xMax : xMin + (i + 1) * step;
            int start = ArrayUtil.searchSorted(x, segStart);
            int stop = start;
            while (stop<x.length && x[stop]<=segEnd) ++stop;
            if (stop<=start) continue;
            double[] segY = Arrays.copyOfRange(y, start, stop);
            int localWindow = Math.min(windowSize, segY.length / 2);
            double[] segSmooth = localWindow >= 3 ? Smoother.savitzkyGolay(segY, Math.min(localWindow, segY.length / 2 * 2 + 1), 2) : segY;
            int minIdx = start + ArrayUtil.min(segSmooth);
            res.add(new BackgroundAnchor(x[minIdx], y[minIdx], false));
        }
        logger.debug("{}: {} auto background anchor(s)", spectrum, res.size());
        return res;
    }

    /**
     * Anchors in the regions free of peaks: minimum before the first peak (excluding the {@value #PEAK_MARGIN} samples before it), minimum of each interval between successive peaks and minimum after the last peak (same margin).
     * @param spectrum
     * @param peakIndices sample indices of peaks
     * @return anchors sorted by x, without duplicate x
     */
    public static List<BackgroundAnchor> getPeakFreeAnchors(Spectrum spectrum, int[] peakIndices) {
        List<BackgroundAnchor> anchors = new ArrayList<>();
        if (peakIndices.length==0) return anchors;
        double[] y = spectrum.getYValues();
        int n = y.length;
        int[] peaks = peakIndices.clone();
        Arrays.sort(peaks);
        int leftEnd = Math.max(0, peaks[0] - PEAK_MARGIN);
        anchors.add(anchorAt(spectrum, leftEnd > 0 ? ArrayUtil.min(y, 0, leftEnd + 1) : 0));
        for (int i = 0; i<peaks.length-1; ++i) {
            if (peaks[i+1] > peaks[i] + 1) anchors.add(anchorAt(spectrum, ArrayUtil.min(y, peaks[i], peaks[i+1] + 1)));
        }
        int rightStart = Math.min(n - 1, peaks[peaks.length-1] + PEAK_MARGIN);
        anchors.add(anchorAt(spectrum, rightStart < n - 1 ? ArrayUtil.min(y, rightStart, n) : n - 1));
        return sortAndRemoveDuplicates(anchors);
    }

    private static BackgroundAnchor anchorAt(Spectrum spectrum, int idx) {
        return new BackgroundAnchor(spectrum.getX(idx), spectrum.getY(idx), false);
    }

    static List<BackgroundAnchor> sortAndRemoveDuplicates(Collection<BackgroundAnchor> anchors) {
        List<BackgroundAnchor> sorted = new ArrayList<>(anchors);
        Collections.sort(sorted);
        List<BackgroundAnchor> res = new ArrayList<>(sorted.size());
        for (BackgroundAnchor a : sorted) {
            if (res.isEmpty() || a.getX() > res.get(res.size()-1).getX()) res.add(a);
        }
        return res;
    }

    /**
     * Background fitted through anchors located outside peaks (see {@link #getPeakFreeAnchors(Spectrum, int[])}).
     * Without peaks the background is flat at the median intensity. With less than 2 anchors it is flat at the anchor mean.
     * Polynomial and spline curves are clipped above by the maximal intensity. Spline requires at least 4 anchors, otherwise piecewise-linear interpolation is used.
     * If a fit fails, piecewise-linear interpolation is used.
     * @param spectrum
     * @param peakIndices sample indices of peaks
     * @param method
     * @param smoothingFactor spline smoothing factor. NaN: number of anchors
     * @param polyOrder polynomial order, limited by the number of anchors - 1 and by {@value #MAX_POLY_ORDER}
     * @return background curve and anchors
     */
    public static BackgroundEstimate fitGlobalBackground(Spectrum spectrum, int[] peakIndices, BackgroundMethod method, double smoothingFactor, int polyOrder) {
        if (peakIndices.length==0) {
            double[] flat = new double[spectrum.size()];
            Arrays.fill(flat, ArrayUtil.median(spectrum.getYValues()));
            logger.debug("{}: no peaks, flat background at median: {}", spectrum, flat[0]);
            return new BackgroundEstimate(flat, Collections.emptyList(), null);
        }
        List<BackgroundAnchor> anchors = getPeakFreeAnchors(spectrum, peakIndices);
        if (anchors.size()<2) {
            double[] flat = new double[spectrum.size()];
            Arrays.fill(flat, anchors.stream().mapToDouble(BackgroundAnchor::getY).average().orElse(ArrayUtil.median(spectrum.getYValues())));
            return new BackgroundEstimate(flat, anchors, null);
        }
        return fitAnchors(spectrum, anchors, method, smoothingFactor, polyOrder);
    }

    /**
     * Background curve through {@param anchors}. See {@link #fitGlobalBackground(Spectrum, int[], BackgroundMethod, double, int)}
     * @param anchors at least 2 anchors
     */
    public static BackgroundEstimate fitAnchors(Spectrum spectrum, Collection<BackgroundAnchor> anchors, BackgroundMethod method, double smoothingFactor, int polyOrder) {
        List<BackgroundAnchor> sorted = sortAndRemoveDuplicates(anchors);
        if (sorted.size()<2) throw new IllegalArgumentException("At least 2 anchors with distinct x are required");
        double[] ax = sorted.stream().mapToDouble(BackgroundAnchor::getX).toArray();
        double[] ay = sorted.stream().mapToDouble(BackgroundAnchor::getY).toArray();
        double[] x = spectrum.getXValues();
        double maxY = spectrum.getMaxY();
        if (method==null) method = BackgroundMethod.PIECEWISE;
        try {
            switch (method) {
                case POLYNOMIAL: {
                    int order = Math.min(Math.min(polyOrder, ax.length - 1), MAX_POLY_ORDER);
                    double[] bck = clip(polynomial(ax, ay, order, x), maxY);
                    return new BackgroundEstimate(bck, sorted, BackgroundMethod.POLYNOMIAL);
                }
                case SPLINE: {
                    if (ax.length >= 4) {
                        SmoothingSpline spline = new SmoothingSpline(ax, ay, Double.isNaN(smoothingFactor) ? ax.length : smoothingFactor);
                        double[] bck = new double[x.length];
                        for (int i = 0; i<x.length; ++i) bck[i] = spline.value(x[i]);
                        return new BackgroundEstimate(checkFinite(clip(bck, maxY)), sorted, BackgroundMethod.SPLINE);
                    } else logger.debug("{}: only {} anchors, piecewise-linear background used instead of spline", spectrum, ax.length);
                    break;
                }
                default:
                    break;
            }
        } catch (RuntimeException e) {
            logger.debug("{} background fit failed, falling back to piecewise-linear interpolation", method, e);
        }
        return new BackgroundEstimate(interpolate(x, ax, ay), sorted, BackgroundMethod.PIECEWISE);
    }

    static double[] polynomial(double[] ax, double[] ay, int order, double[] x) {
        // normalized coordinate for conditioning
        double center = (ax[0] + ax[ax.length-1]) / 2;
        double scale = (ax[ax.length-1] - ax[0]) / 2;
        WeightedObservedPoints obs = new WeightedObservedPoints();
        for (int i = 0; i<ax.length; ++i) obs.add((ax[i] - center) / scale, ay[i]);
        PolynomialFunction poly = new PolynomialFunction(PolynomialCurveFitter.create(order).withMaxIterations(1000).fit(obs.toList()));
        double[] res = new double[x.length];
        for (int i = 0; i<x.length; ++i) res[i] = poly.value((x[i] - center) / scale);
        return checkFinite(res);
    }

    private static double[] checkFinite(double[] values) {
        for (double v : values) if (!Double.isFinite(v)) throw new IllegalStateException("Non finite background value");
        return values;
    }

    private static double[] clip(double[] values, double max) {
        for (int i = 0; i<values.length; ++i) if (values[i]>max) values[i] = max;
        return values;
    }

    /**
     * Piecewise-linear interpolation through anchors, constant outside the anchor range
     * @param spectrum
     * @param anchors at least one anchor
     * @return background value at each sample of {@param spectrum}
     */
    public static double[] interpolate(Spectrum spectrum, Collection<BackgroundAnchor> anchors) {
        List<BackgroundAnchor> sorted = sortAndRemoveDuplicates(anchors);
        if (sorted.isEmpty()) throw new IllegalArgumentException("No background anchor");
        return interpolate(spectrum.getXValues(), sorted.stream().mapToDouble(BackgroundAnchor::getX).toArray(), sorted.stream().mapToDouble(BackgroundAnchor::getY).toArray());
    }

    static double[] interpolate(double[] x, double[] ax, double[] ay) {
        double[] res = new double[x.length];
        if (ax.length==1) {
            Arrays.fill(res, ay[0]);
            return res;
        }
        PolynomialSplineFunction f = new LinearInterpolator().interpolate(ax, ay);
        double min = ax[0], max = ax[ax.length-1];
        for (int i = 0; i<x.length; ++i) res[i] = f.value(Math.max(min, Math.min(max, x[i])));
        return res;
    }

    /**
     *
     * @param spectrum
     * @param anchors current anchors
     * @param xClick
     * @return new list containing {@param anchors} and a user-defined anchor at the sample nearest to {@param xClick}
     */
    public static List<BackgroundAnchor> addAnchor(Spectrum spectrum, Collection<BackgroundAnchor> anchors, double xClick) {
        int idx = spectrum.getNearestIndex(xClick);
        List<BackgroundAnchor> res = new ArrayList<>(anchors);
        res.add(new BackgroundAnchor(spectrum.getX(idx), spectrum.getY(idx), true));
        Collections.sort(res);
        return res;
    }

    /**
     *
     * @param anchors
     * @param xClick
     * @return new list without the anchor closest to {@param xClick}
     */
    public static List<BackgroundAnchor> removeAnchor(Collection<BackgroundAnchor> anchors, double xClick) {
        List<BackgroundAnchor> res = new ArrayList<>(anchors);
        if (res.isEmpty()) return res;
        BackgroundAnchor nearest = Collections.min(res, (a1, a2) -> Double.compare(Math.abs(a1.getX() - xClick), Math.abs(a2.getX() - xClick)));
        res.remove(nearest);
        Collections.sort(res);
        return res;
    }

    /**
     *
     * @param spectrum
     * @param anchors at least 2 anchors
     * @return new spectrum with the piecewise-linear background through {@param anchors} subtracted
     */
    public static Spectrum subtract(Spectrum spectrum, Collection<BackgroundAnchor> anchors) {
        if (anchors.size()<2) throw new IllegalArgumentException("At least 2 background anchors are required, found: "+anchors.size());
        return spectrum.subtract(interpolate(spectrum, anchors));
    }
}
