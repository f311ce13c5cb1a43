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

import fftx.utilities.FFTXTest;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

/**
 * Known spectra, linearity and length validation for each radix-2 transform.
 */
@RunWith(Parameterized.class)
public class Radix2FFTScenarioTest extends FFTXTest {

  private static final double tolerance = 1.0e-10;

  private final String info;
  private final Radix2FFT fft;

  public Radix2FFTScenarioTest(String info, Radix2FFT fft) {
    this.info = info;
    this.fft = fft;
  }

  @Parameters
  public static Collection<Object[]> data() {
    FFTTables tables = new FFTTables();
    Collection<Object[]> ret = new ArrayList<>();
    for (FFTMethod method : FFTMethod.values()) {
      ret.add(new Object[] {"Test " + method, method.create(tables)});
    }
    ret.add(new Object[] {"Test VECTORIZED (nMin = 2)", new VectorizedFFT(tables, 2)});
    ret.add(new Object[] {"Test VECTORIZED (nMin = 1)", new VectorizedFFT(tables, 1)});
    return ret;
  }

  private void assertSpectrum(String message, double[] expected, double[] actual) {
    assertEquals(message + " length", expected.length, actual.length);
    for (int i = 0; i < expected.length; i++) {
      assertEquals(message + " at position: " + i, expected[i], actual[i], tolerance);
    }
  }

  /**
   * x = [1, 2, 3, 4] gives [10, -2+2i, -2, -2-2i], the same as the DFT.
   */
  @Test
  public void testFourPoint() {
    double[] x = ComplexArrays.fromReal(new double[] {1.0, 2.0, 3.0, 4.0});
    double[] expected = {10.0, 0.0, -2.0, 2.0, -2.0, 0.0, -2.0, -2.0};
    assertSpectrum(info + " [1, 2, 3, 4]", expected, fft.fft(x));
    assertSpectrum(info + " DFT [1, 2, 3, 4]", DFT.dft(x), fft.fft(x));
  }

  /**
   * An impulse at index 0 transforms to all ones.
   */
  @Test
  public void testImpulse() {
    for (int n = 1; n <= 1024; n *= 2) {
      double[] x = new double[2 * n];
      x[0] = 1.0;
      double[] expected = new double[2 * n];
      for (int i = 0; i < n; i++) {
        expected[2 * i] = 1.0;
      }
      assertSpectrum(info + " impulse n = " + n, expected, fft.fft(x));
    }
  }

  @Test
  public void testEightPointImpulse() {
    double[] x = new double[16];
    x[0] = 1.0;
    double[] actual = fft.fft(x);
    for (int i = 0; i < 8; i++) {
      assertEquals(info + " real part at " + i, 1.0, actual[2 * i], tolerance);
      assertEquals(info + " imaginary part at " + i, 0.0, actual[2 * i + 1], tolerance);
    }
  }

  /**
   * A constant sequence of ones transforms to [n, 0, ..., 0].
   */
  @Test
  public void testConstant() {
    for (int n = 1; n <= 1024; n *= 2) {
      double[] x = new double[2 * n];
      for (int i = 0; i < n; i++) {
        x[2 * i] = 1.0;
      }
      double[] expected = new double[2 * n];
      expected[0] = n;
      assertSpectrum(info + " constant n = " + n, expected, fft.fft(x));
    }
  }

  /**
   * fft(a * x + b * y) = a * fft(x) + b * fft(y) for complex scalars a and b.
   */
  @Test
  public void testLinearity() {
    int n = 256;
    Random random = random(n);
    Complex a = new Complex(random.nextDouble(), random.nextDouble());
    Complex b = new Complex(-random.nextDouble(), random.nextDouble());
    Complex[] x = ComplexArrays.toComplex(SpectrumVerifier.randomData(random, n));
    Complex[] y = ComplexArrays.toComplex(SpectrumVerifier.randomData(random, n));
    Complex[] combined = new Complex[n];
    for (int i = 0; i < n; i++) {
      combined[i] = x[i].multiply(a).add(y[i].multiply(b));
    }
    Complex[] fx = fft.fft(x);
    Complex[] fy = fft.fft(y);
    Complex[] actual = fft.fft(combined);
    for (int i = 0; i < n; i++) {
      Complex expected = fx[i].multiply(a).add(fy[i].multiply(b));
      assertEquals(info + " real part at " + i, expected.getReal(), actual[i].getReal(), tolerance);
      assertEquals(info + " imaginary part at " + i, expected.getImaginary(),
          actual[i].getImaginary(), tolerance);
    }
  }

  /**
   * Complex values survive a forward and inverse transform.
   */
  @Test
  public void testComplexInverse() {
    Complex[] x = ComplexArrays.toComplex(SpectrumVerifier.randomData(random(), 32));
    Complex[] actual = fft.inverse(fft.fft(x));
    for (int i = 0; i < x.length; i++) {
      assertEquals(info, x[i].getReal(), actual[i].getReal(), tolerance);
      assertEquals(info, x[i].getImaginary(), actual[i].getImaginary(), tolerance);
    }
  }

  /**
   * n = 6 is rejected by the fast transforms and accepted by the DFT.
   */
  @Test
  public void testSixPoint() {
    double[] x = ComplexArrays.fromReal(new double[] {1.0, 2.0, 3.0, 4.0, 5.0, 6.0});
    try {
      fft.fft(x);
      fail(info + " accepted n = 6.");
    } catch (InvalidLengthException e) {
      assertEquals(6, e.getLength());
    }
    assertEquals(21.0, DFT.dft(x)[0], tolerance);
  }

  @Test(expected = InvalidLengthException.class)
  public void testEmpty() {
    fft.fft(new double[0]);
  }

  @Test(expected = InvalidLengthException.class)
  public void testOddArrayLength() {
    fft.fft(new double[5]);
  }

  @Test(expected = InvalidLengthException.class)
  public void testInverseSixPoint() {
    fft.inverse(new double[12]);
  }
}
