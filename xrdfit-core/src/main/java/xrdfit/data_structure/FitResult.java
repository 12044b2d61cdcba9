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
package xrdfit.data_structure;

import xrdfit.processing.peak_fit.ProfileModel;

/**
 * Fitted parameters of one peak, with the derived physical quantities.
 * {@link #getEta()} is NaN for profiles without mixing parameter.
 * @author Jean Ollion
 */
public class FitResult {
    final int peakIndex, groupId;
    final ProfileModel profile;
    final double amplitude, center, sigma, gamma, eta;
    final double fwhm, area;
    final int windowStart, windowStop;
    final double windowXMin, windowXMax;

    /**
     *
     * @param peakIndex index of the peak in the collection supplied to the fit
     * @param groupId id of the group the peak was fitted with
     * @param profile
     * @param parameters fitted parameters of the peak, in the order of {@link ProfileModel}
     * @param windowStart first sample index of the fit window (inclusive)
     * @param windowStop last sample index of the fit window (exclusive)
     * @param windowXMin x value of the left bound of the fit window
     * @param windowXMax x value of the right bound of the fit window
     */
    public FitResult(int peakIndex, int groupId, ProfileModel profile, double[] parameters, int windowStart, int windowStop, double windowXMin, double windowXMax) {
        if (parameters.length!=profile.getParameterCount()) throw new IllegalArgumentException("Invalid parameter count for "+profile+": "+parameters.length);
        this.peakIndex = peakIndex;
        this.groupId = groupId;
        this.profile = profile;
        this.amplitude = parameters[0];
        this.center = parameters[1];
        this.sigma = parameters[2];
        this.gamma = parameters[3];
        this.eta = profile.getParameterCount()>4 ? parameters[4] : Double.NaN;
        this.fwhm = profile.fwhm(parameters);
        this.area = profile.area(parameters);
        this.windowStart = windowStart;
        this.windowStop = windowStop;
        this.windowXMin = windowXMin;
        this.windowXMax = windowXMax;
    }

    public int getPeakIndex() {
        return peakIndex;
    }
    public int getGroupId() {
        return groupId;
    }
    public ProfileModel getProfile() {
        return profile;
    }
    public double getAmplitude() {
        return amplitude;
    }
    public double getCenter() {
        return center;
    }
    public double getSigma() {
        return sigma;
    }
    public double getGamma() {
        return gamma;
    }
    public double getEta() {
        return eta;
    }
    public boolean hasEta() {
        return !Double.isNaN(eta);
    }
    public double getFWHM() {
        return fwhm;
    }
    public double getArea() {
        return area;
    }
    public int getWindowStart() {
        return windowStart;
    }
    public int getWindowStop() {
        return windowStop;
    }
    public double getWindowXMin() {
        return windowXMin;
    }
    public double getWindowXMax() {
        return windowXMax;
    }
    public double[] getParameters() {
        if (hasEta()) return new double[]{amplitude, center, sigma, gamma, eta};
        else return new double[]{amplitude, center, sigma, gamma};
    }

    @Override
    public String toString() {
        return "Peak#"+peakIndex+" (group "+groupId+") "+profile+" center="+center+" fwhm="+fwhm+" area="+area;
    }
}
