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
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Faddeeva function w(z) = exp(-z²) erfc(-iz), computed with the rational expansion of Weideman (SIAM J. Numer. Anal. 31, 1994) with N = 32 terms.
 * Relative accuracy is about 1e-13 in the upper half plane. Values in the lower half plane use w(z) = 2 exp(-z²) - w(-z)
 * @author Jean Ollion
 */
public class Faddeeva {
    static final int N = 32;
    static final double L = Math.sqrt(N / Math.sqrt(2));
    static final double INV_SQRT_PI = 1 / Math.sqrt(Math.PI);
    static final double[] COEFFICIENTS = computeCoefficients();

    private static double[] computeCoefficients() {
        int M = 2 * N;
        int M2 = 2 * M;
        double[] f = new double[M2];
        // f = [0, f(k=-M+1 .. M-1)]
        for (int k = -M + 1; k <= M - 1; ++k) {
            double t = L * Math.tan(k * Math.PI / M / 2);
            f[k + M] = Math.exp(-t * t) * (L * L + t * t);
        }
        double[] shifted = new double[M2];
        for (int i = 0; i < M2; ++i) shifted[i] = f[(i + M) % M2];
        Complex[] fft = new FastFourierTransformer(DftNormalization.STANDARD).transform(shifted, TransformType.FORWARD);
        double[] a = new double[N];
        for (int n = 1; n <= N; ++n) a[n - 1] = fft[n].getReal() / M2;
        return a;
    }

    public static Complex w(Complex z) {
        if (z.getImaginary() < 0) {
            Complex minusZ = z.negate();
            return minusZ.multiply(minusZ).negate().exp().multiply(2).subtract(w(minusZ));
        }
        Complex iz = Complex.I.multiply(z);
        Complex lMinusIz = new Complex(L).subtract(iz);
        Complex Z = new Complex(L).add(iz).divide(lMinusIz);
        // Horner evaluation of sum a[n] Z^n
        Complex p = Complex.ZERO;
        for (int n = N - 1; n >= 0; --n) p = p.multiply(Z).add(COEFFICIENTS[n]);
        return p.multiply(2).divide(lMinusIz.multiply(lMinusIz)).add(new Complex(INV_SQRT_PI).divide(lMinusIz));
    }

    /**
     *
     * @return real part of w(x + iy)
     */
    public static double re(double x, double y) {
        return w(new Complex(x, y)).getReal();
    }
}
