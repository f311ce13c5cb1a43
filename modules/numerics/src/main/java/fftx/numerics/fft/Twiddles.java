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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * Twiddle factors for combining two transforms of length m/2 into one transform of length m.
 */
public final class Twiddles {

  private Twiddles() {
    // Static methods only.
  }

  /**
   * Compute the m/2 twiddle factors w[k] = exp(-i * 2 * PI * k / m), stored interleaved.
   * <p>
   * Each value comes directly from cos and sin of its own angle, never from a smaller table or
   * by repeated multiplication.
   * <p>
   * The remaining roots of unity follow from w[k + m/2] = -w[k].
   *
   * @param m the stage size (a power of two, 2 or greater).
   * @return interleaved twiddle factors of length m.
   * @throws InvalidLengthException if m is not a power of two or is less than 2.
   */
  public static double[] twiddles(int m) {
    PowerOfTwo.require(m);
    if (m < 2) {
      throw new InvalidLengthException(m, " Twiddle factors require a stage size of 2 or more: " + m);
    }
    final int half = m / 2;
    final double[] w = new double[m];
    final double TwoPI_M = -2.0 * PI / m;
    for (int k = 0; k < half; k++) {
      final double theta = TwoPI_M * k;
      w[2 * k] = cos(theta);
      w[2 * k + 1] = sin(theta);
    }
    return w;
  }
}
