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

import org.apache.commons.math3.complex.Complex;

/**
 * Peak profiles fitted to diffraction peaks.
 * Parameters are packed in the order: amplitude, center, sigma, gamma (, eta)
 * @author Jean Ollion
 */
public enum ProfileModel {
    /**
     * η·Lorentzian + (1-η)·Gaussian, 5 parameters
     */
    PSEUDO_VOIGT("pseudo_voigt", 5) {
        @Override
        public double value(double x, double[] p, int offset) {
            return pseudoVoigt(x, p[offset], p[offset+1], p[offset+2], p[offset+3], p[offset+4]);
        }
        @Override
        public double fwhm(double[] p) {
            return pseudoVoigtFWHM(p[2], p[3], p[4]);
        }
        @Override
        public double area(double[] p) {
            return pseudoVoigtArea(p[0], p[2], p[3], p[4]);
        }
    },
    /**
     * Convolution of a Gaussian and a Lorentzian, 4 parameters.
     * Reported FWHM only includes the gaussian contribution and reported area is the amplitude parameter
     */
    VOIGT("voigt", 4) {
        @Override
        public double value(double x, double[] p, int offset) {
            return voigt(x, p[offset], p[offset+1], p[offset+2], p[offset+3]);
        }
        @Override
        public double fwhm(double[] p) {
            return GAUSSIAN_FWHM_FACTOR * p[2];
        }
        @Override
        public double area(double[] p) {
            return p[0];
        }
    };

    public static final double GAUSSIAN_FWHM_FACTOR = 2.355;
    static final double SQRT_2PI = Math.sqrt(2 * Math.PI);
    static final double SQRT_2 = Math.sqrt(2);

    public final String name;
    final int parameterCount;
    ProfileModel(String name, int parameterCount) {
        this.name = name;
        this.parameterCount = parameterCount;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    /**
     *
     * @param x position
     * @param p packed parameters
     * @param offset index of the amplitude of the peak within {@param p}
     * @return profile value at {@param x}
     */
    public abstract double value(double x, double[] p, int offset);
    public abstract double fwhm(double[] p);
    public abstract double area(double[] p);

    public static ProfileModel fromName(String name) {
        for (ProfileModel m : values()) {
            if (m.name.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name)) return m;
        }
        throw new IllegalArgumentException("Unknown profile: "+name);
    }

    public static double gaussian(double x, double amplitude, double center, double sigma) {
        double d = x - center;
        return amplitude * Math.exp(-d * d / (2 * sigma * sigma)) / (sigma * SQRT_2PI);
    }

    public static double lorentzian(double x, double amplitude, double center, double gamma) {
        double d = x - center;
        return amplitude * gamma * gamma / (d * d + gamma * gamma) / (Math.PI * gamma);
    }

    public static double pseudoVoigt(double x, double amplitude, double center, double sigma, double gamma, double eta) {
        return eta * lorentzian(x, amplitude, center, gamma) + (1 - eta) * gaussian(x, amplitude, center, sigma);
    }

    public static double voigt(double x, double amplitude, double center, double sigma, double gamma) {
        double norm = sigma * SQRT_2;
        Complex z = new Complex((x - center) / norm, gamma / norm);
        return amplitude * Faddeeva.w(z).getReal() / (sigma * SQRT_2PI);
    }

    public static double pseudoVoigtFWHM(double sigma, double gamma, double eta) {
        return eta * 2 * gamma + (1 - eta) * GAUSSIAN_FWHM_FACTOR * sigma;
    }

    public static double pseudoVoigtArea(double amplitude, double sigma, double gamma, double eta) {
        return eta * amplitude * Math.PI * gamma + (1 - eta) * amplitude * sigma * SQRT_2PI;
    }

    @Override
    public String toString() {
        return name;
    }
}
