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
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

/**
 * Tests the size-keyed table cache.
 */
public class FFTTablesTest extends FFTXTest {

  @Test
  public void testSharedEntries() {
    FFTTables tables = new FFTTables(10);
    assertSame(tables.twiddles(64), tables.twiddles(64));
    assertSame(tables.permutation(64), tables.permutation(64));
    assertSame(tables.butterfly(64), tables.butterfly(64));
    assertEquals(3, tables.size());
  }

  @Test
  public void testEntriesMatchDirectComputation() {
    FFTTables tables = new FFTTables();
    assertArrayEquals(Twiddles.twiddles(256), tables.getTwiddles(256), 0.0);
    assertArrayEquals(BitReversal.permutation(256), tables.getPermutation(256));
    assertEquals(256, tables.getButterfly(256).getSize());
  }

  /**
   * Copies handed to callers do not alias the cached entries.
   */
  @Test
  public void testDefensiveCopies() {
    FFTTables tables = new FFTTables();
    double[] w = tables.getTwiddles(8);
    w[0] = 42.0;
    assertEquals(1.0, tables.getTwiddles(8)[0], 0.0);
    int[] perm = tables.getPermutation(8);
    perm[1] = 0;
    assertEquals(4, tables.getPermutation(8)[1]);
  }

  /**
   * Sizes beyond the bound are computed but not retained.
   */
  @Test
  public void testBound() {
    FFTTables tables = new FFTTables(4);
    double[] w = tables.twiddles(32);
    assertNotSame(w, tables.twiddles(32));
    assertEquals(0, tables.size());
    tables.twiddles(16);
    assertEquals(1, tables.size());
  }

  @Test(expected = InvalidLengthException.class)
  public void testInvalidSize() {
    new FFTTables().twiddles(24);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidBound() {
    new FFTTables(31);
  }

  @Test
  public void testBoundProperty() {
    System.setProperty("fft.cache.maxLog2", "12");
    assertEquals(12, new FFTTables().getMaxLog2());
    System.setProperty("fft.cache.maxLog2", "large");
    assertEquals(FFTTables.DEFAULT_MAX_LOG2, new FFTTables().getMaxLog2());
    System.setProperty("fft.cache.maxLog2", "-1");
    assertEquals(FFTTables.DEFAULT_MAX_LOG2, new FFTTables().getMaxLog2());
  }

  /**
   * Threads that request the same size at the same time all receive one instance.
   */
  @Test
  public void testConcurrentPopulation() throws Exception {
    final FFTTables tables = new FFTTables();
    final int nThreads = 8;
    final int m = 1 << 12;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(nThreads);
    try {
      List<Future<ButterflyMatrix>> butterflies = new ArrayList<>();
      List<Future<int[]>> permutations = new ArrayList<>();
      for (int i = 0; i < nThreads; i++) {
        Callable<ButterflyMatrix> butterfly = () -> {
          start.await();
          return tables.butterfly(m);
        };
        Callable<int[]> permutation = () -> {
          start.await();
          return tables.permutation(m);
        };
        butterflies.add(executor.submit(butterfly));
        permutations.add(executor.submit(permutation));
      }
      start.countDown();
      ButterflyMatrix first = butterflies.get(0).get();
      int[] perm = permutations.get(0).get();
      for (int i = 1; i < nThreads; i++) {
        assertSame(first, butterflies.get(i).get());
        assertSame(perm, permutations.get(i).get());
      }
      assertSame(first, tables.butterfly(m));
      assertEquals(3, tables.size());
    } finally {
      executor.shutdownNow();
    }
  }
}
