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

import java.util.logging.Logger;

import static java.lang.Math.fma;
import static java.lang.Math.min;

/**
 * Level-synchronous radix-2 FFT. Rather than one call per sub-problem, every sub-problem of a given
 * length is combined in a single sweep.
 * <p>
 * The n input values are viewed as a row-major matrix with nMin rows and n / nMin columns, so that
 * column c holds the strided subsequence x[c], x[c + n/nMin], x[c + 2n/nMin], .... A single batched
 * pass takes the direct nMin-point DFT of every column. Each following level splits the columns
 * into a left and a right half, whose matching columns are the even and odd subsequences of a
 * subsequence with half the stride, and combines them for all columns at once:
 *
 * <PRE>
 * X'[k][c]     = X[k][c] + w[k] * X[k][c + cols/2]
 * X'[k + L][c] = X[k][c] - w[k] * X[k][c + cols/2]
 * </PRE>
 * <p>
 * with L the current number of rows and w the twiddle factors of length 2L. The row count doubles and
 * the column count halves until one column of n rows holds the spectrum. Grouping by stride takes
 * the place of an explicit bit-reversal step.
 * <p>
 * The base size is read from the fft.nMin System property unless given explicitly.
 */
public class VectorizedFFT extends Radix2FFT {

  private static final Logger logger = Logger.getLogger(VectorizedFFT.class.getName());

  /**
   * Default value of the fft.nMin property.
   */
  public static final int DEFAULT_N_MIN = 16;

  /**
   * Size of the direct transforms of the first level (clamped to n).
   */
  private final int nMin;

  /**
   * Construct a vectorized FFT with its own tables.
   */
  public VectorizedFFT() {
    this(new FFTTables());
  }

  /**
   * Construct a vectorized FFT with the base size given by the fft.nMin System property.
   *
   * @param tables the table cache to draw from.
   */
  public VectorizedFFT(FFTTables tables) {
    this(tables, nMinProperty());
  }

  /**
   * Construct a vectorized FFT.
   *
   * @param tables the table cache to draw from.
   * @param nMin   size of the direct transforms of the first level (a power of two).
   * @throws InvalidLengthException if nMin is not a positive power of two.
   */
  public VectorizedFFT(FFTTables tables, int nMin) {
    super(tables);
    PowerOfTwo.require(nMin);
    this.nMin = nMin;
  }

  /**
   * Getter for the field <code>nMin</code>.
   *
   * @return the base size.
   */
  public int getNMin() {
    return nMin;
  }

  /** {@inheritDoc} */
  @Override
  public FFTMethod getMethod() {
    return FFTMethod.VECTORIZED;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] transform(double[] data, int n) {
    int rows = min(nMin, n);
    int cols = n / rows;
    double[] current = baseLevel(data, rows, cols);
    while (rows < n) {
      current = combineLevel(current, rows, cols);
      rows *= 2;
      cols /= 2;
    }
    return current;
  }

  /**
   * Direct DFT of every column of the rows x cols view of the input.
   *
   * @param x    interleaved input data.
   * @param rows the transform length of each column.
   * @param cols the number of columns.
   * @return the row-major rows x cols matrix of column spectra.
   */
  private double[] baseLevel(double[] x, int rows, int cols) {
    if (rows == 1) {
      return x.clone();
    }

    // All rows-th roots of unity, from the twiddle factors and w[k + rows/2] = -w[k].
    final double[] w = tables.twiddles(rows);
    final double[] roots = new double[2 * rows];
    for (int k = 0; k < rows; k++) {
      roots[k] = w[k];
      roots[k + rows] = -w[k];
    }

    final double[] ret = new double[x.length];
    for (int k = 0; k < rows; k++) {
      final int out = 2 * k * cols;
      for (int r = 0; r < rows; r++) {
        final int j = 2 * (int) (((long) k * r) % rows);
        final double w_r = roots[j];
        final double w_i = roots[j + 1];
        final int in = 2 * r * cols;
        // Accumulate the (k, r) DFT term into every column at once.
        for (int c = 0; c < 2 * cols; c += 2) {
          final double x_r = x[in + c];
          final double x_i = x[in + c + 1];
          ret[out + c] = fma(x_r, w_r, fma(-x_i, w_i, ret[out + c]));
          ret[out + c + 1] = fma(x_r, w_i, fma(x_i, w_r, ret[out + c + 1]));
        }
      }
    }
    return ret;
  }

  /**
   * Combine the left and right column halves of a rows x cols matrix into a 2*rows x cols/2 matrix.
   *
   * @param x    the row-major matrix.
   * @param rows the current number of rows.
   * @param cols the current number of columns.
   * @return the combined row-major matrix.
   */
  private double[] combineLevel(double[] x, int rows, int cols) {
    final double[] w = tables.twiddles(2 * rows);
    if (w.length != 2 * rows) {
      throw new DimensionMismatchException(w.length / 2, rows);
    }
    final int half = cols / 2;
    final double[] ret = new double[x.length];
    final int lower = 2 * rows * half;
    for (int k = 0; k < rows; k++) {
      final double w_r = w[2 * k];
      final double w_i = w[2 * k + 1];
      final int in = 2 * k * cols;
      final int out = 2 * k * half;
      for (int c = 0; c < 2 * half; c += 2) {
        final int i0 = in + c;
        final int i1 = i0 + 2 * half;
        final double z0_r = x[i0];
        final double z0_i = x[i0 + 1];
        final double z1_r = x[i1];
        final double z1_i = x[i1 + 1];
        final double t_r = fma(w_r, z1_r, -w_i * z1_i);
        final double t_i = fma(w_r, z1_i, w_i * z1_r);
        final int j = out + c;
        ret[j] = z0_r + t_r;
        ret[j + 1] = z0_i + t_i;
        ret[j + lower] = z0_r - t_r;
        ret[j + lower + 1] = z0_i - t_i;
      }
    }
    return ret;
  }

  /**
   * String representation of the transform.
   *
   * @return a String.
   */
  @Override
  public String toString() {
    return super.toString() + " (nMin = " + nMin + ")";
  }

  /**
   * Read the fft.nMin System property.
   *
   * @return the configured base size, or DEFAULT_N_MIN if the value is missing or invalid.
   */
  static int nMinProperty() {
    String value = System.getProperty("fft.nMin", Integer.toString(DEFAULT_N_MIN));
    try {
      int nMin = Integer.parseInt(value.trim());
      if (PowerOfTwo.check(nMin)) {
        return nMin;
      }
      logger.info(" Invalid value for fft.nMin: " + value);
    } catch (NumberFormatException e) {
      logger.info(" Invalid value for fft.nMin: " + value);
    }
    return DEFAULT_N_MIN;
  }
}
