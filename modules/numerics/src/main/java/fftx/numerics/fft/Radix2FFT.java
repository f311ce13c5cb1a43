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

import static java.util.Objects.requireNonNull;

/**
 * Compute the FFT of complex, double precision data whose length n is a power of two using the
 * radix-2 decimation-in-time algorithm.
 * <p>
 * Data is interleaved, with the real and imaginary parts of value i stored in
 *
 * <PRE>
 * Re(d[i]) = data[2*i]
 * Im(d[i]) = data[2*i + 1]
 * </PRE>
 * <p>
 * Every method returns a new array; the caller's data is never modified. Subclasses differ only in
 * how they order the butterfly combine steps.
 *
 * @see <ul>
 * <li><a href="http://www.jstor.org/stable/2003354" target="_blank"> J. W. Cooley and J. W.
 * Tukey, Mathematics of Computation 19 (90), 297 (1965) </a>
 * <li><a href="http://en.wikipedia.org/wiki/Fast_Fourier_transform" target="_blank">FFT at Wikipedia </a>
 * </ul>
 */
public abstract class Radix2FFT {

  /**
   * Twiddle factors, permutations and butterfly matrices shared by successive transforms.
   */
  protected final FFTTables tables;

  /**
   * Construct a transform that draws its tables from the given cache.
   *
   * @param tables the table cache.
   */
  protected Radix2FFT(FFTTables tables) {
    this.tables = requireNonNull(tables);
  }

  /**
   * Construct the transform selected by the fft.method System property, with its own tables.
   *
   * @return a Radix2FFT instance.
   */
  public static Radix2FFT create() {
    return FFTMethod.fromProperty().create(new FFTTables());
  }

  /**
   * The method this transform implements.
   *
   * @return the FFTMethod.
   */
  public abstract FFTMethod getMethod();

  /**
   * Getter for the field <code>tables</code>.
   *
   * @return the table cache.
   */
  public FFTTables getTables() {
    return tables;
  }

  /**
   * Compute the Fast Fourier Transform of data.
   *
   * @param data interleaved complex data of length 2n, n a power of two.
   * @return the spectrum in natural frequency order (index 0 is the DC term).
   * @throws InvalidLengthException if n is not a positive power of two.
   */
  public double[] fft(double[] data) {
    int n = PowerOfTwo.complexLength(data);
    PowerOfTwo.require(n);
    return transform(data, n);
  }

  /**
   * Compute the (un-normalized) inverse FFT of a spectrum.
   *
   * @param data interleaved complex spectrum of length 2n, n a power of two.
   * @return the un-normalized time domain data.
   */
  public double[] ifft(double[] data) {
    // ifft(X) = conj(fft(conj(X))).
    double[] conj = data.clone();
    ComplexArrays.conjugate(conj);
    double[] ret = fft(conj);
    ComplexArrays.conjugate(ret);
    return ret;
  }

  /**
   * Compute the normalized inverse FFT of a spectrum, so that inverse(fft(x)) returns x.
   *
   * @param data interleaved complex spectrum of length 2n, n a power of two.
   * @return the time domain data.
   */
  public double[] inverse(double[] data) {
    double[] ret = ifft(data);
    // Normalize inverse FFT with 1/n.
    ComplexArrays.scale(ret, 2.0 / ret.length);
    return ret;
  }

  /**
   * Compute the Fast Fourier Transform of Complex values.
   *
   * @param values the input sequence; its length must be a power of two.
   * @return the spectrum.
   */
  public Complex[] fft(Complex[] values) {
    return ComplexArrays.toComplex(fft(ComplexArrays.interleave(values)));
  }

  /**
   * Compute the normalized inverse FFT of Complex values.
   *
   * @param values the spectrum; its length must be a power of two.
   * @return the time domain sequence.
   */
  public Complex[] inverse(Complex[] values) {
    return ComplexArrays.toComplex(inverse(ComplexArrays.interleave(values)));
  }

  /**
   * Transform validated data. Implementations must not modify the input array.
   *
   * @param data interleaved complex data.
   * @param n    number of complex values (a power of two).
   * @return a new array holding the spectrum.
   */
  protected abstract double[] transform(double[] data, int n);

  /**
   * String representation of the transform.
   *
   * @return a String.
   */
  @Override
  public String toString() {
    return " Radix-2 FFT: " + getMethod();
  }
}
