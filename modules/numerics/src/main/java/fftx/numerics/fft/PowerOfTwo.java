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

import static org.apache.commons.math3.util.ArithmeticUtils.isPowerOfTwo;

/**
 * Length checks shared by the radix-2 code.
 */
public final class PowerOfTwo {

  private PowerOfTwo() {
    // Static methods only.
  }

  /**
   * Check if n is a power of two (1, 2, 4, ...).
   *
   * @param n the length to check.
   * @return true if n is a positive power of two.
   */
  public static boolean check(int n) {
    return n >= 1 && isPowerOfTwo(n);
  }

  /**
   * Require n to be a power of two.
   *
   * @param n the length to check.
   * @return log2(n).
   * @throws InvalidLengthException if n is not a positive power of two.
   */
  public static int require(int n) {
    if (!check(n)) {
      throw new InvalidLengthException(n);
    }
    return Integer.numberOfTrailingZeros(n);
  }

  /**
   * Number of complex values held by interleaved data.
   *
   * @param data interleaved complex data.
   * @return data.length / 2.
   * @throws InvalidLengthException if the array length is odd.
   */
  public static int complexLength(double[] data) {
    if (data.length % 2 != 0) {
      throw new InvalidLengthException(data.length,
          " Interleaved complex data must have an even array length: " + data.length);
    }
    return data.length / 2;
  }
}
