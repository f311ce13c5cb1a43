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

/**
 * The bit-reversal permutation reorders input so that a bottom-up butterfly pass produces output in
 * natural frequency order. For a length n = 2^b, index i maps to i with its low b bits mirrored.
 * The permutation is its own inverse.
 */
public final class BitReversal {

  private BitReversal() {
    // Static methods only.
  }

  /**
   * Compute the bit-reversal permutation by peeling bits from each index.
   *
   * @param n the length (a power of two).
   * @return perm, where perm[i] is i with its log2(n) bits reversed.
   * @throws InvalidLengthException if n is not a positive power of two.
   */
  public static int[] permutation(int n) {
    final int bits = PowerOfTwo.require(n);
    final int[] perm = new int[n];
    for (int i = 0; i < n; i++) {
      int in = i;
      int reversed = 0;
      for (int b = 0; b < bits; b++) {
        reversed = (reversed << 1) | (in & 1);
        in >>= 1;
      }
      perm[i] = reversed;
    }
    return perm;
  }

  /**
   * Compute the bit-reversal permutation in O(n) by doubling: the second half of each table of
   * length 2 * limit is the first half plus the bit that was just mirrored.
   *
   * @param n the length (a power of two).
   * @return the same permutation as {@link #permutation(int)}.
   * @throws InvalidLengthException if n is not a positive power of two.
   */
  public static int[] permutationByDoubling(int n) {
    PowerOfTwo.require(n);
    final int[] perm = new int[n];
    for (int limit = 1, bit = n / 2; limit < n; limit <<= 1, bit >>= 1) {
      for (int i = 0; i < limit; i++) {
        perm[i + limit] = perm[i] + bit;
      }
    }
    return perm;
  }

  /**
   * Reorder interleaved complex data.
   *
   * @param data interleaved complex data of length 2 * perm.length.
   * @param perm the permutation to apply.
   * @return a new array where value i is value perm[i] of data.
   */
  public static double[] permute(double[] data, int[] perm) {
    final int n = perm.length;
    if (data.length != 2 * n) {
      throw new DimensionMismatchException(data.length, 2 * n);
    }
    final double[] ret = new double[2 * n];
    for (int i = 0; i < n; i++) {
      final int j = 2 * perm[i];
      ret[2 * i] = data[j];
      ret[2 * i + 1] = data[j + 1];
    }
    return ret;
  }
}
