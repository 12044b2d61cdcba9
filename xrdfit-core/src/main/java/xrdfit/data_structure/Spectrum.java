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

import xrdfit.processing.Smoother;
import xrdfit.utils.ArrayUtil;

import java.util.Arrays;
import java.util.Map;

/**
 * Intensity trace: intensity y as a function of the scattering angle x.
 * Instances are immutable: smoothing and background subtraction return new instances that share the same x values
 * @author Jean Ollion
 */
public class Spectrum {
    final String name;
    final double[] x, y;

    public Spectrum(double[] x, double[] y) {
        this("", x, y);
    }
    public Spectrum(String name, double[] x, double[] y) {
        validate(x, y);
        this.name = name==null ? "" : name;
        this.x = Arrays.copyOf(x, x.length);
        this.y = Arrays.copyOf(y, y.length);
    }
    private Spectrum(String name, double[] x, double[] y, boolean copy) {
        this.name = name;
        this.x = x;
        this.y = y;
    }

    public static void validate(double[] x, double[] y) throws InvalidSpectrumException {
        if (x==null || y==null) throw new InvalidSpectrumException("x and y values must be provided");
        if (x.length!=y.length) throw new InvalidSpectrumException("x and y should have same length: x="+x.length+" y="+y.length);
        if (x.length<2) throw new InvalidSpectrumException("at least 2 points are required, found: "+x.length);
        for (int i = 1; i<x.length; ++i) {
            if (!(x[i]>x[i-1])) throw new InvalidSpectrumException("x should be strictly increasing: x["+(i-1)+"]="+x[i-1]+" x["+i+"]="+x[i]);
        }
    }

    public String getName() {
        return name;
    }
    public int size() {
        return x.length;
    }
    public double getX(int idx) {
        return x[idx];
    }
    public double getY(int idx) {
        return y[idx];
    }
    public double[] getXValues() {
        return Arrays.copyOf(x, x.length);
    }
    public double[] getYValues() {
        return Arrays.copyOf(y, y.length);
    }
    public double getMinY() {
        return y[ArrayUtil.min(y)];
    }
    public double getMaxY() {
        return y[ArrayUtil.max(y)];
    }
    /**
     *
     * @return mean sample spacing
     */
    public double getMeanSpacing() {
        return ArrayUtil.meanStep(x);
    }
    /**
     *
     * @param xValue
     * @return index of the sample closest to {@param xValue}
     */
    public int getNearestIndex(double xValue) {
        return ArrayUtil.nearestIndex(x, xValue);
    }

    /**
     *
     * @param newY intensity values replacing the current ones
     * @return spectrum with same name and x values
     */
    public Spectrum setY(double[] newY) {
        if (newY.length!=x.length) throw new InvalidSpectrumException("x and y should have same length: x="+x.length+" y="+newY.length);
        return new Spectrum(name, x, Arrays.copyOf(newY, newY.length), false);
    }

    public Spectrum subtract(double[] background) {
        return setY(ArrayUtil.subtract(y, background));
    }

    /**
     * See {@link Smoother#apply(double[], String, Map)}
     */
    public Spectrum smooth(String method, Map<String, ? extends Number> parameters) {
        return setY(Smoother.apply(y, method, parameters));
    }

    @Override
    public String toString() {
        return (name.isEmpty() ? "spectrum" : name) + " (n="+x.length+", x=["+x[0]+"; "+x[x.length-1]+"])";
    }
}
