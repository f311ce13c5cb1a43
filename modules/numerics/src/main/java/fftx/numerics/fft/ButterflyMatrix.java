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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.OutOfRangeException;

import static java.lang.Math.fma;

/**
 * The butterfly matrix of stage size m. Factoring the DFT matrix of length n gives log2(n) stages,
 * each block diagonal in copies of
 *
 * <PRE>
 * B(m) = [ I(m/2)  D(m/2) ]
 *        [ I(m/2) -D(m/2) ]
 * </PRE>
 * <p>
 * where I is the identity and D = diag(w[0], ..., w[m/2 - 1]) holds the twiddle factors of length m.
 * Only the diagonal of D is stored. Applying B(m) to a block of length m is the butterfly
 * (a, b) to (a + w * b, a - w * b) for each of the m/2 index pairs.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class ButterflyMatrix {

  /**
   * Stage size.
   */
  private final int m;
  /**
   * Half the stage size.
   */
  private final int half;
  /**
   * Interleaved twiddle factors (the diagonal of D).
   */
  private final double[] twiddles;

  /**
   * Create the butterfly matrix for stage size m that shares the given twiddle table, which must
   * not be modified afterwards.
   *
   * @param m        the stage size (a power of two, 2 or greater).
   * @param twiddles interleaved twiddle factors for stage size m (length m).
   * @throws DimensionMismatchException if the twiddle table does not match the stage size.
   */
  ButterflyMatrix(int m, double[] twiddles) {
    PowerOfTwo.require(m);
    if (m < 2) {
      throw new InvalidLengthException(m, " A butterfly requires a stage size of 2 or more: " + m);
    }
    if (twiddles.length != m) {
      throw new DimensionMismatchException(twiddles.length / 2, m / 2);
    }
    this.m = m;
    this.half = m / 2;
    this.twiddles = twiddles;
  }

  /**
   * Create the butterfly matrix for stage size m from freshly computed twiddle factors.
   *
   * @param m the stage size (a power of two, 2 or greater).
   */
  public ButterflyMatrix(int m) {
    this(m, Twiddles.twiddles(m));
  }

  /**
   * Getter for the stage size.
   *
   * @return the stage size m.
   */
  public int getSize() {
    return m;
  }

  /**
   * Entry (row, col) of the dense m x m matrix. Intended for checking the factorization on small
   * stages; the transforms never build the dense matrix.
   *
   * @param row the row index.
   * @param col the column index.
   * @return the matrix entry.
   */
  public Complex getEntry(int row, int col) {
    if (row < 0 || row >= m) {
      throw new OutOfRangeException(row, 0, m - 1);
    }
    if (col < 0 || col >= m) {
      throw new OutOfRangeException(col, 0, m - 1);
    }
    final int k = row % half;
    if (col % half != k) {
      return Complex.ZERO;
    }
    if (col < half) {
      // Identity blocks.
      return Complex.ONE;
    }
    // Diagonal blocks: +D on top and -D below.
    final Complex w = new Complex(twiddles[2 * k], twiddles[2 * k + 1]);
    return row < half ? w : w.negate();
  }

  /**
   * Apply the matrix in place to the block of m complex values that starts at complex index
   * offset. The first half of the block holds E and the second half holds O; on return the block
   * holds E + w * O followed by E - w * O.
   *
   * @param data   interleaved complex data.
   * @param offset complex index of the first value of the block.
   * @throws DimensionMismatchException if the block extends past the end of data.
   */
  public void apply(double[] data, int offset) {
    if (offset < 0 || 2 * (offset + m) > data.length) {
      throw new DimensionMismatchException(data.length / 2 - offset, m);
    }
    final int di = 2 * half;
    for (int k = 0, i = 2 * offset; k < half; k++, i += 2) {
      final double w_r = twiddles[2 * k];
      final double w_i = twiddles[2 * k + 1];
      final double z0_r = data[i];
      final double z0_i = data[i + 1];
      final int idi = i + di;
      final double z1_r = data[idi];
      final double z1_i = data[idi + 1];
      final double t_r = fma(w_r, z1_r, -w_i * z1_i);
      final double t_i = fma(w_r, z1_i, w_i * z1_r);
      data[i] = z0_r + t_r;
      data[i + 1] = z0_i + t_i;
      data[idi] = z0_r - t_r;
      data[idi + 1] = z0_i - t_i;
    }
  }

  /**
   * String representation of the butterfly matrix.
   *
   * @return a String.
   */
  @Override
  public String toString() {
    return " Butterfly matrix: m = " + m;
  }
}
