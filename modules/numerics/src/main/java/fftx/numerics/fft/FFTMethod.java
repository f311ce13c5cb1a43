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

import java.util.logging.Logger;

/**
 * The available radix-2 transform orderings.
 */
public enum FFTMethod {

  /**
   * Recursive even/odd decomposition. Kept as a reference implementation.
   */
  RECURSIVE,
  /**
   * Bit-reversal followed by in-place butterfly matrix stages.
   */
  MATRIX,
  /**
   * Level-synchronous combination of all sub-problems of a given size at once.
   */
  VECTORIZED;

  private static final Logger logger = Logger.getLogger(FFTMethod.class.getName());

  /**
   * Default value of the fft.method property.
   */
  public static final FFTMethod DEFAULT = MATRIX;

  /**
   * Construct a transform of this kind.
   *
   * @param tables the table cache to draw from.
   * @return a new Radix2FFT.
   */
  public Radix2FFT create(FFTTables tables) {
    return switch (this) {
      case RECURSIVE -> new RecursiveFFT(tables);
      case MATRIX -> new ButterflyMatrixFFT(tables);
      case VECTORIZED -> new VectorizedFFT(tables);
    };
  }

  /**
   * Parse a method name, ignoring case and surrounding white space.
   *
   * @param value the name.
   * @return the FFTMethod.
   * @throws IllegalArgumentException if the name is not recognized.
   */
  public static FFTMethod parse(String value) {
    return valueOf(value.trim().toUpperCase());
  }

  /**
   * Read the fft.method System property.
   *
   * @return the configured method, or DEFAULT if the value is missing or invalid.
   */
  public static FFTMethod fromProperty() {
    String value = System.getProperty("fft.method", DEFAULT.name());
    try {
      return parse(value);
    } catch (IllegalArgumentException e) {
      logger.info(" Invalid value for fft.method: " + value);
      return DEFAULT;
    }
  }
}
