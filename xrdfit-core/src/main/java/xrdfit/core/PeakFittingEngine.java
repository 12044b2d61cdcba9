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
package xrdfit.core;

import xrdfit.data_structure.BackgroundAnchor;
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.PeakFitResults;
import xrdfit.data_structure.Spectrum;
import xrdfit.processing.background.BackgroundEstimate;
import xrdfit.processing.background.BackgroundEstimator;
import xrdfit.processing.background.BackgroundMethod;
import xrdfit.processing.clustering.ClusterResult;
import xrdfit.processing.clustering.PeakGrouper;
import xrdfit.processing.peak_detection.PeakLocator;
import xrdfit.processing.peak_fit.PeakFit;
import xrdfit.processing.peak_fit.PeakFitConfig;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point of the engine. All operations are stateless: independent spectra can be processed concurrently.
 * @author Jean Ollion
 */
public class PeakFittingEngine {
    public static final String SMOOTHING = "smoothing";
    public static final String POLY_ORDER = "poly_order";

    public static int[] detectPeaks(Spectrum spectrum) {
        return PeakLocator.autoFindPeaks(spectrum);
    }

    /**
     *
     * @param spectrum
     * @param peakIndices
     * @param method
     * @param parameters optional {@value #SMOOTHING} (spline smoothing factor) and {@value #POLY_ORDER} (polynomial order). Can be null
     * @return background values and anchors
     */
    public static BackgroundEstimate estimateBackground(Spectrum spectrum, int[] peakIndices, BackgroundMethod method, Map<String, ? extends Number> parameters) {
        Map<String, ? extends Number> params = parameters==null ? Collections.emptyMap() : parameters;
        double smoothing = params.containsKey(SMOOTHING) ? params.get(SMOOTHING).doubleValue() : Double.NaN;
        int polyOrder = params.containsKey(POLY_ORDER) ? params.get(POLY_ORDER).intValue() : 3;
        return BackgroundEstimator.fitGlobalBackground(spectrum, peakIndices, method, smoothing, polyOrder);
    }

    public static ClusterResult clusterPeaks(double[] positions) {
        return PeakGrouper.cluster(positions);
    }

    /**
     *
     * @param positions
     * @param eps clustering radius. NaN: default radius computed from the positions
     * @param minSamples
     * @return cluster labels and count
     */
    public static ClusterResult clusterPeaks(double[] positions, double eps, int minSamples) {
        return PeakGrouper.cluster(positions, eps, minSamples);
    }

    public static PeakFitResults fit(Spectrum spectrum, List<Peak> peaks, Collection<BackgroundAnchor> anchors, PeakFitConfig config) {
        return PeakFit.fit(spectrum, peaks, anchors, config);
    }

    /**
     *
     * @param spectrum
     * @param peakIndices sample indices of the peaks, in any order. Result peak indices refer to positions in this array
     * @param anchors user background anchors, can be null
     * @param config
     * @return fit results
     */
    public static PeakFitResults fit(Spectrum spectrum, int[] peakIndices, Collection<BackgroundAnchor> anchors, PeakFitConfig config) {
        for (int i : peakIndices) {
            if (i<0 || i>=spectrum.size()) throw new IllegalArgumentException("Peak index out of spectrum: "+i);
        }
        List<Peak> peaks = Arrays.stream(peakIndices).mapToObj(i -> Peak.fromIndex(spectrum, i)).collect(Collectors.toList());
        return PeakFit.fit(spectrum, peaks, anchors, config);
    }
}
