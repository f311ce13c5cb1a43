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

/**
 * Conversions between interleaved complex data and Commons Math {@link Complex} arrays, along with
 * the element-wise helpers used by the transforms.
 */
public final class ComplexArrays {

  private ComplexArrays() {
    // Static methods only.
  }

  /**
   * Pack Complex values into interleaved data.
   *
   * @param values the values.
   * @return interleaved data of length 2 * values.length.
   */
  public static double[] interleave(Complex[] values) {
    final double[] data = new double[2 * values.length];
    for (int i = 0; i < values.length; i++) {
      data[2 * i] = values[i].getReal();
      data[2 * i + 1] = values[i].getImaginary();
    }
    return data;
  }

  /**
   * Interleaved data with zero imaginary parts.
   *
   * @param real the real parts.
   * @return interleaved data of length 2 * real.length.
   */
  public static double[] fromReal(double[] real) {
    final double[] data = new double[2 * real.length];
    for (int i = 0; i < real.length; i++) {
      data[2 * i] = real[i];
    }
    return data;
  }

  /**
   * Unpack interleaved data into Complex values.
   *
   * @param data interleaved data.
   * @return the values.
   */
  public static Complex[] toComplex(double[] data) {
    final int n = PowerOfTwo.complexLength(data);
    final Complex[] values = new Complex[n];
    for (int i = 0; i < n; i++) {
      values[i] = new Complex(data[2 * i], data[2 * i + 1]);
    }
    return values;
  }

  /**
   * Conjugate interleaved data in place.
   *
   * @param data interleaved data.
   */
  public static void conjugate(double[] data) {
    for (int i = 1; i < data.length; i += 2) {
      data[i] = -data[i];
    }
  }

  /**
   * Multiply interleaved data by a real constant in place.
   *
   * @param data  interleaved data.
   * @param scale the constant.
   */
  public static void scale(double[] data, double scale) {
    for (int i = 0; i < data.length; i++) {
      data[i] *= scale;
    }
  }
}
