// ******************************************************************************
//
// Title:       FFTX.
// Description: FFTX - Radix-2 Fast Fourier Transforms.
// Copyright:   Copyright (c) FFTX Developers 2024.
//
// This file is part of FFTX.
//
// FFTX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// FFTX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// FFTX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package fftx.numerics.fft;

import org.apache.commons.math3.exception.DimensionMismatchException;

import static java.lang.Math.fma;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * Direct evaluation of the Discrete Fourier Transform of interleaved complex data of any length.
 * <p>
 * This is O(n^2) and is used as the reference result when testing the fast transforms:
 *
 * <PRE>
 * X[k] = sum_{t=0}^{n-1} x[t] * exp(-i * 2 * PI * k * t / n)
 * </PRE>
 */
public final class DFT {

  private DFT() {
    // Static methods only.
  }

  /**
   * Compute the DFT of interleaved data.
   *
   * @param in input array.
   * @return a new array holding the spectrum.
   */
  public static double[] dft(double[] in) {
    double[] out = new double[in.length];
    dft(in, out);
    return out;
  }

  /**
   * Compute the DFT of interleaved data. The output array must not be the input array.
   *
   * @param in  input array.
   * @param out output array.
   */
  public static void dft(double[] in, double[] out) {
    transform(in, out, -1);
  }

  /**
   * Compute the normalized inverse DFT of interleaved data.
   *
   * @param in input spectrum.
   * @return a new array holding the time domain data.
   */
  public static double[] inverse(double[] in) {
    double[] out = new double[in.length];
    transform(in, out, +1);
    // Normalize inverse DFT with 1/n.
    double norm = 2.0 / out.length;
    for (int i = 0; i < out.length; i++) {
      out[i] *= norm;
    }
    return out;
  }

  /**
   * Direct transform with the given sign on the exponent.
   *
   * @param in   input array.
   * @param out  output array.
   * @param sign the sign to apply (forward -1 and inverse 1).
   */
  private static void transform(double[] in, double[] out, int sign) {
    int n = PowerOfTwo.complexLength(in);
    if (n == 0) {
      throw new InvalidLengthException(n, " The DFT requires at least one input value.");
    }
    if (out.length != in.length) {
      throw new DimensionMismatchException(out.length, in.length);
    }

    // Roots of unity exp(sign * i * 2 * PI * j / n), indexed by (k * t) mod n.
    final double[] roots = new double[2 * n];
    final double TwoPI_N = sign * 2.0 * PI / n;
    for (int j = 0; j < n; j++) {
      final double theta = TwoPI_N * j;
      roots[2 * j] = cos(theta);
      roots[2 * j + 1] = sin(theta);
    }

    for (int k = 0; k < n; k++) {
      double sumReal = 0;
      double sumImag = 0;
      for (int t = 0; t < n; t++) {
        final int j = (int) (((long) k * t) % n);
        final double w_r = roots[2 * j];
        final double w_i = roots[2 * j + 1];
        final double x_r = in[2 * t];
        final double x_i = in[2 * t + 1];
        sumReal = fma(x_r, w_r, sumReal);
        sumReal = fma(-x_i, w_i, sumReal);
        sumImag = fma(x_r, w_i, sumImag);
        sumImag = fma(x_i, w_r, sumImag);
      }
      out[2 * k] = sumReal;
      out[2 * k + 1] = sumImag;
    }
  }
}
