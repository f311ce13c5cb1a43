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

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.util.LocalizedFormats;

/**
 * Thrown when a transform, permutation or twiddle table is requested for a length it cannot
 * handle. Lengths are never rounded or padded.
 */
public class InvalidLengthException extends MathIllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * The offending length.
   */
  private final int length;

  /**
   * Length is not a power of two.
   *
   * @param length the offending length.
   */
  public InvalidLengthException(int length) {
    super(LocalizedFormats.NOT_POWER_OF_TWO, length);
    this.length = length;
  }

  /**
   * Length rejected for some other reason.
   *
   * @param length  the offending length.
   * @param message the reason.
   */
  public InvalidLengthException(int length, String message) {
    super(LocalizedFormats.SIMPLE_MESSAGE, message);
    this.length = length;
  }

  /**
   * Getter for the field <code>length</code>.
   *
   * @return the offending length.
   */
  public int getLength() {
    return length;
  }
}
