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

import static java.lang.System.arraycopy;

/**
 * Radix-2 decimation-in-time FFT written as a direct recursion: transform the even and odd indexed
 * halves, then combine them with one butterfly matrix of the full length. The recursion depth is
 * log2(n) and a new array is allocated at every call, so this is a reference implementation rather
 * than the performance path.
 */
public class RecursiveFFT extends Radix2FFT {

  /**
   * Construct a recursive FFT with its own tables.
   */
  public RecursiveFFT() {
    this(new FFTTables());
  }

  /**
   * Construct a recursive FFT.
   *
   * @param tables the table cache to draw from.
   */
  public RecursiveFFT(FFTTables tables) {
    super(tables);
  }

  /** {@inheritDoc} */
  @Override
  public FFTMethod getMethod() {
    return FFTMethod.RECURSIVE;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] transform(double[] data, int n) {
    return recurse(data, n);
  }

  private double[] recurse(double[] x, int n) {
    if (n == 1) {
      return new double[] {x[0], x[1]};
    }
    final int half = n / 2;
    final double[] even = new double[n];
    final double[] odd = new double[n];
    for (int i = 0; i < half; i++) {
      final int i4 = 4 * i;
      even[2 * i] = x[i4];
      even[2 * i + 1] = x[i4 + 1];
      odd[2 * i] = x[i4 + 2];
      odd[2 * i + 1] = x[i4 + 3];
    }

    // Lay out E followed by O, then combine in place.
    final double[] ret = new double[2 * n];
    arraycopy(recurse(even, half), 0, ret, 0, n);
    arraycopy(recurse(odd, half), 0, ret, n, n);
    tables.butterfly(n).apply(ret, 0);
    return ret;
  }
}
