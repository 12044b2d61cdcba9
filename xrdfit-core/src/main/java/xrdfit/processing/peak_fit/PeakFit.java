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
import xrdfit.core.ProgressCallback;
import xrdfit.data_structure.BackgroundAnchor;
import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.GroupFailure;
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.PeakFitResults;
import xrdfit.data_structure.PeakGroup;
import xrdfit.data_structure.Spectrum;
import xrdfit.processing.background.BackgroundEstimate;
import xrdfit.processing.background.BackgroundEstimator;
import xrdfit.processing.clustering.ClusterResult;
import xrdfit.processing.clustering.PeakGrouper;
import xrdfit.utils.ArrayUtil;
import xrdfit.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fit of all peaks of a spectrum:
 * <ol>
 *     <li>background: piecewise-linear through user anchors if at least 2 are provided, otherwise fitted through anchors located between peaks</li>
 *     <li>FWHM estimation of each peak on the background-subtracted signal</li>
 *     <li>grouping of peaks closer than the average FWHM × grouping factor</li>
 *     <li>joint fit of each group. A group that fails does not prevent other groups from being fitted</li>
 * </ol>
 * No state is kept between calls
 * @author Jean Ollion
 */
public class PeakFit {
    public static final Logger logger = LoggerFactory.getLogger(PeakFit.class);

    public static PeakFitResults fit(Spectrum spectrum, List<Peak> peaks, Collection<BackgroundAnchor> anchors, PeakFitConfig config) {
        return fit(spectrum, peaks, anchors, config, null, null);
    }

    /**
     *
     * @param spectrum
     * @param peaks peaks to fit, in any order. Result peak indices refer to this list
     * @param anchors user background anchors, can be null
     * @param config
     * @param cancel checked before each group. When it returns true, remaining groups are not fitted. Can be null
     * @param progress receives one increment per fitted group. Can be null
     * @return fit results
     */
    public static PeakFitResults fit(Spectrum spectrum, List<Peak> peaks, Collection<BackgroundAnchor> anchors, PeakFitConfig config, BooleanSupplier cancel, ProgressCallback progress) {
        for (Peak p : peaks) {
            if (p.getIndex()<0 || p.getIndex()>=spectrum.size()) throw new IllegalArgumentException("Peak index out of spectrum: "+p.getIndex());
        }
        double[] x = spectrum.getXValues();
        int n = x.length;
        // fit operates on peaks sorted by position
        int[] order = IntStream.range(0, peaks.size()).boxed()
                .sorted(Comparator.comparingDouble(i -> x[peaks.get(i).getIndex()]))
                .mapToInt(Integer::intValue).toArray();
        int[] sortedIndices = IntStream.of(order).map(i -> peaks.get(i).getIndex()).toArray();

        double[] background;
        List<BackgroundAnchor> anchorsUsed;
        if (anchors!=null && anchors.size()>=2) {
            background = BackgroundEstimator.interpolate(spectrum, anchors);
            anchorsUsed = anchors.stream().sorted().collect(Collectors.toList());
            logger.debug("{}: using {} user background anchors", spectrum, anchorsUsed.size());
        } else {
            BackgroundEstimate estimate = BackgroundEstimator.fitGlobalBackground(spectrum, sortedIndices, config.backgroundMethod, config.splineSmoothing, config.polyOrder);
            background = estimate.getValues();
            anchorsUsed = estimate.getAnchors();
            logger.debug("{}: {} background fitted with {} anchors", spectrum, estimate.getMethod(), anchorsUsed.size());
        }
        double[] y = ArrayUtil.subtract(spectrum.getYValues(), background);
        if (peaks.isEmpty()) {
            logger.debug("{}: no peaks to fit", spectrum);
            return new PeakFitResults(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), anchorsUsed, background, Double.NaN, false);
        }

        List<Peak> sortedPeaks = new ArrayList<>(order.length);
        for (int idx : sortedIndices) {
            int left = Math.max(0, idx - config.fwhmWindow);
            int right = Math.min(n, idx + config.fwhmWindow);
            if (right - left < 2) {
                left = Math.max(0, Math.min(left, n - 2));
                right = Math.min(n, left + 2);
            }
            double[] fwhmBaseline = FWHMEstimator.estimate(Arrays.copyOfRange(x, left, right), Arrays.copyOfRange(y, left, right), idx - left, true);
            sortedPeaks.add(new Peak(idx, x[idx], y[idx], fwhmBaseline[0], fwhmBaseline[1]));
        }
        double meanFWHM = sortedPeaks.stream().mapToDouble(Peak::getFWHM).average().getAsDouble();
        double eps = meanFWHM * config.getGroupingFactor();
        ClusterResult clusters = PeakGrouper.cluster(sortedPeaks.stream().mapToDouble(Peak::getPosition).toArray(), eps, 1);
        List<PeakGroup> groups = new ArrayList<>(clusters.getCount());
        List<List<Integer>> members = clusters.getGroups();
        for (int g = 0; g<members.size(); ++g) {
            List<Integer> m = members.get(g);
            groups.add(new PeakGroup(g, m.stream().map(sortedPeaks::get).collect(Collectors.toList()), m.stream().mapToInt(i -> order[i]).toArray()));
        }
        logger.debug("{}: {} peak(s) in {} group(s), eps={}", spectrum, peaks.size(), groups.size(), Utils.formatDouble(5, eps));
        if (progress!=null) progress.incrementTaskNumber(groups.size());

        List<FitResult> results = new ArrayList<>();
        List<GroupFailure> failures = new ArrayList<>();
        boolean cancelled = false;
        for (PeakGroup group : groups) {
            if (cancel!=null && cancel.getAsBoolean()) {
                logger.info("{}: fit cancelled, {} group(s) fitted out of {}", spectrum, group.getId(), groups.size());
                cancelled = true;
                break;
            }
            try {
                results.addAll(GroupFitter.fit(x, y, group, config));
            } catch (OptimizerDivergenceException e) {
                logger.warn("{}: {} could not be fitted: {}", spectrum, group, e.getMessage());
                failures.add(new GroupFailure(group.getId(), group.getOriginalIndices(), e.getMessage()));
            }
            if (progress!=null) progress.incrementProgress();
        }
        return new PeakFitResults(ResultAssembler.assemble(results), failures, groups, anchorsUsed, background, eps, cancelled);
    }
}
