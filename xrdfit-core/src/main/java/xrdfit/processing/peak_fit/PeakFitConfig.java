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

import org.json.simple.JSONObject;
import xrdfit.processing.background.BackgroundMethod;
import xrdfit.utils.JSONSerializable;
import xrdfit.utils.JSONUtils;

import java.util.Map;

/**
 * Parameters of a fit. Setters return this object so that calls can be chained.
 * Stored as a json object: missing keys keep their default value and unknown keys are ignored.
 * @author Jean Ollion
 */
public class PeakFitConfig implements JSONSerializable {
    public ProfileModel profile = ProfileModel.PSEUDO_VOIGT;
    public boolean overlapMode = false;
    public double groupDistanceThreshold = 2.5;
    public double overlapThreshold = 5.0;
    public double fitWindowMultiplier = 3;
    public int fwhmWindow = 50;
    public int minWindowSamples = 5;
    public double centerTolerance = 0.5, overlapCenterTolerance = 0.8;
    public BackgroundMethod backgroundMethod = BackgroundMethod.PIECEWISE;
    public int polyOrder = 3;
    public double splineSmoothing = Double.NaN;
    public int maxEvaluations = 10000, maxEvaluationsMulti = 30000, maxEvaluationsFallback = 50000;
    public double tolerance = 1e-8, toleranceMulti = 1e-9, toleranceFallback = 1e-8;

    public PeakFitConfig duplicate() {
        return new PeakFitConfig().setProfile(profile).setOverlapMode(overlapMode)
                .setGroupDistanceThreshold(groupDistanceThreshold).setOverlapThreshold(overlapThreshold)
                .setFitWindowMultiplier(fitWindowMultiplier).setFwhmWindow(fwhmWindow).setMinWindowSamples(minWindowSamples)
                .setCenterTolerance(centerTolerance, overlapCenterTolerance)
                .setBackgroundMethod(backgroundMethod).setPolyOrder(polyOrder).setSplineSmoothing(splineSmoothing)
                .setMaxEvaluations(maxEvaluations, maxEvaluationsMulti, maxEvaluationsFallback)
                .setTolerance(tolerance, toleranceMulti, toleranceFallback);
    }

    public PeakFitConfig setProfile(ProfileModel profile) {
        this.profile = profile;
        return this;
    }

    /**
     * Overlap mode is intended for closely spaced peaks: larger clustering radius ({@link #overlapThreshold} instead of {@link #groupDistanceThreshold}), wider fit windows for groups of several peaks and larger center tolerance
     */
    public PeakFitConfig setOverlapMode(boolean overlapMode) {
        this.overlapMode = overlapMode;
        return this;
    }

    /**
     * @param groupDistanceThreshold clustering radius, as multiple of the average estimated FWHM
     */
    public PeakFitConfig setGroupDistanceThreshold(double groupDistanceThreshold) {
        this.groupDistanceThreshold = groupDistanceThreshold;
        return this;
    }

    /**
     * @param overlapThreshold clustering radius in overlap mode, as multiple of the average estimated FWHM
     */
    public PeakFitConfig setOverlapThreshold(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
        return this;
    }

    /**
     * @param fitWindowMultiplier fit window extends on each side of a group by this number of FWHM
     */
    public PeakFitConfig setFitWindowMultiplier(double fitWindowMultiplier) {
        this.fitWindowMultiplier = fitWindowMultiplier;
        return this;
    }

    /**
     * @param fwhmWindow half size, in samples, of the slice used to estimate the FWHM of each peak
     */
    public PeakFitConfig setFwhmWindow(int fwhmWindow) {
        this.fwhmWindow = fwhmWindow;
        return this;
    }

    /**
     * @param minWindowSamples groups with fewer samples in their fit window are not fitted
     */
    public PeakFitConfig setMinWindowSamples(int minWindowSamples) {
        this.minWindowSamples = minWindowSamples;
        return this;
    }

    /**
     *
     * @param centerTolerance allowed displacement of the center, as fraction of the estimated FWHM
     * @param overlapCenterTolerance same in overlap mode
     */
    public PeakFitConfig setCenterTolerance(double centerTolerance, double overlapCenterTolerance) {
        this.centerTolerance = centerTolerance;
        this.overlapCenterTolerance = overlapCenterTolerance;
        return this;
    }

    /**
     * @param backgroundMethod method used to compute the background when less than 2 user anchors are provided
     */
    public PeakFitConfig setBackgroundMethod(BackgroundMethod backgroundMethod) {
        this.backgroundMethod = backgroundMethod;
        return this;
    }

    public PeakFitConfig setPolyOrder(int polyOrder) {
        this.polyOrder = polyOrder;
        return this;
    }

    /**
     * @param splineSmoothing smoothing factor of the spline background. NaN: number of anchors
     */
    public PeakFitConfig setSplineSmoothing(double splineSmoothing) {
        this.splineSmoothing = splineSmoothing;
        return this;
    }

    /**
     *
     * @param single cap for groups of a single peak
     * @param multi cap for groups of several peaks or in overlap mode
     * @param fallback cap of the fallback strategy
     */
    public PeakFitConfig setMaxEvaluations(int single, int multi, int fallback) {
        this.maxEvaluations = single;
        this.maxEvaluationsMulti = multi;
        this.maxEvaluationsFallback = fallback;
        return this;
    }

    public PeakFitConfig setTolerance(double single, double multi, double fallback) {
        this.tolerance = single;
        this.toleranceMulti = multi;
        this.toleranceFallback = fallback;
        return this;
    }

    public double getGroupingFactor() {
        return overlapMode ? overlapThreshold : groupDistanceThreshold;
    }

    public double getWindowMultiplier(int groupSize) {
        return groupSize > 1 && overlapMode ? fitWindowMultiplier + 1 : fitWindowMultiplier;
    }

    public double getCenterTolerance() {
        return overlapMode ? overlapCenterTolerance : centerTolerance;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("profile", profile.name());
        res.put("overlapMode", overlapMode);
        res.put("groupDistanceThreshold", groupDistanceThreshold);
        res.put("overlapThreshold", overlapThreshold);
        res.put("fitWindowMultiplier", fitWindowMultiplier);
        res.put("fwhmWindow", fwhmWindow);
        res.put("minWindowSamples", minWindowSamples);
        res.put("centerTolerance", centerTolerance);
        res.put("overlapCenterTolerance", overlapCenterTolerance);
        res.put("backgroundMethod", backgroundMethod.name());
        res.put("polyOrder", polyOrder);
        res.put("splineSmoothing", JSONUtils.toJSONEntry(splineSmoothing));
        res.put("maxEvaluations", maxEvaluations);
        res.put("maxEvaluationsMulti", maxEvaluationsMulti);
        res.put("maxEvaluationsFallback", maxEvaluationsFallback);
        res.put("tolerance", tolerance);
        res.put("toleranceMulti", toleranceMulti);
        res.put("toleranceFallback", toleranceFallback);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Invalid fit configuration: "+jsonEntry);
        Map json = (Map)jsonEntry;
        profile = JSONUtils.getEnum(json, "profile", ProfileModel.class, profile);
        overlapMode = JSONUtils.getBoolean(json, "overlapMode", overlapMode);
        groupDistanceThreshold = JSONUtils.getDouble(json, "groupDistanceThreshold", groupDistanceThreshold);
        overlapThreshold = JSONUtils.getDouble(json, "overlapThreshold", overlapThreshold);
        fitWindowMultiplier = JSONUtils.getDouble(json, "fitWindowMultiplier", fitWindowMultiplier);
        fwhmWindow = JSONUtils.getInt(json, "fwhmWindow", fwhmWindow);
        minWindowSamples = JSONUtils.getInt(json, "minWindowSamples", minWindowSamples);
        centerTolerance = JSONUtils.getDouble(json, "centerTolerance", centerTolerance);
        overlapCenterTolerance = JSONUtils.getDouble(json, "overlapCenterTolerance", overlapCenterTolerance);
        backgroundMethod = JSONUtils.getEnum(json, "backgroundMethod", BackgroundMethod.class, backgroundMethod);
        polyOrder = JSONUtils.getInt(json, "polyOrder", polyOrder);
        splineSmoothing = JSONUtils.getDouble(json, "splineSmoothing", splineSmoothing);
        maxEvaluations = JSONUtils.getInt(json, "maxEvaluations", maxEvaluations);
        maxEvaluationsMulti = JSONUtils.getInt(json, "maxEvaluationsMulti", maxEvaluationsMulti);
        maxEvaluationsFallback = JSONUtils.getInt(json, "maxEvaluationsFallback", maxEvaluationsFallback);
        tolerance = JSONUtils.getDouble(json, "tolerance", tolerance);
        toleranceMulti = JSONUtils.getDouble(json, "toleranceMulti", toleranceMulti);
        toleranceFallback = JSONUtils.getDouble(json, "toleranceFallback", toleranceFallback);
    }

    @Override
    public String toString() {
        return "PeakFitConfig" + toJSONEntry().toJSONString();
    }
}
