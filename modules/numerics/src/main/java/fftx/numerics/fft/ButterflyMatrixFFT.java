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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Iterative radix-2 FFT that follows the sparse factorization of the DFT matrix:
 *
 * <PRE>
 * F(n) = A(n) * A(n/2) * ... * A(2) * P(n)
 * </PRE>
 * <p>
 * where P(n) is the bit-reversal permutation and A(m) is block diagonal with n/m copies of the
 * butterfly matrix B(m). The input is permuted once into a private array, then each stage applies
 * B(m) in place to consecutive blocks of length m. Because of the permutation, the first and second
 * halves of each block already hold the two half-length transforms to combine.
 * <p>
 * No dense matrix is formed; each stage costs O(n) and there are log2(n) stages.
 */
public class ButterflyMatrixFFT extends Radix2FFT {

  private static final Logger logger = Logger.getLogger(ButterflyMatrixFFT.class.getName());

  /**
   * Construct a butterfly matrix FFT with its own tables.
   */
  public ButterflyMatrixFFT() {
    this(new FFTTables());
  }

  /**
   * Construct a butterfly matrix FFT.
   *
   * @param tables the table cache to draw from.
   */
  public ButterflyMatrixFFT(FFTTables tables) {
    super(tables);
  }

  /** {@inheritDoc} */
  @Override
  public FFTMethod getMethod() {
    return FFTMethod.MATRIX;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] transform(double[] data, int n) {
    final double[] ret = BitReversal.permute(data, tables.permutation(n));
    for (int m = 2; m <= n; m *= 2) {
      final ButterflyMatrix butterfly = tables.butterfly(m);
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(" Stage " + m + " of " + n + ": " + (n / m) + " blocks.");
      }
      for (int block = 0; block < n; block += m) {
        butterfly.apply(ret, block);
      }
    }
    return ret;
  }
}
