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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Size-keyed cache of twiddle tables, bit-reversal permutations and butterfly matrices.
 * <p>
 * Entries are created on first use through ConcurrentHashMap.computeIfAbsent, so concurrent requests
 * for the same size construct the entry once and all receive the same instance. Entries are never
 * modified or removed once present. Sizes larger than 2^maxLog2 are computed on every request and
 * not retained.
 * <p>
 * The default bound is read from the fft.cache.maxLog2 System property.
 */
public class FFTTables {

  private static final Logger logger = Logger.getLogger(FFTTables.class.getName());

  /**
   * Default value of the fft.cache.maxLog2 property.
   */
  public static final int DEFAULT_MAX_LOG2 = 20;
  /**
   * Largest meaningful bound for int indexed arrays.
   */
  private static final int LIMIT_LOG2 = 30;

  /**
   * Largest cached size is 2^maxLog2.
   */
  private final int maxLog2;
  /**
   * Twiddle tables keyed by stage size.
   */
  private final ConcurrentMap<Integer, double[]> twiddleCache = new ConcurrentHashMap<>();
  /**
   * Bit-reversal permutations keyed by length.
   */
  private final ConcurrentMap<Integer, int[]> permutationCache = new ConcurrentHashMap<>();
  /**
   * Butterfly matrices keyed by stage size.
   */
  private final ConcurrentMap<Integer, ButterflyMatrix> butterflyCache = new ConcurrentHashMap<>();

  /**
   * Construct tables bounded by the fft.cache.maxLog2 System property.
   */
  public FFTTables() {
    this(maxLog2Property());
  }

  /**
   * Construct tables that retain sizes up to 2^maxLog2.
   *
   * @param maxLog2 log2 of the largest size to cache (0 to 30).
   */
  public FFTTables(int maxLog2) {
    if (maxLog2 < 0 || maxLog2 > LIMIT_LOG2) {
      throw new IllegalArgumentException(
          format(" The cache bound must be between 0 and %d: %d", LIMIT_LOG2, maxLog2));
    }
    this.maxLog2 = maxLog2;
  }

  /**
   * Getter for the field <code>maxLog2</code>.
   *
   * @return log2 of the largest cached size.
   */
  public int getMaxLog2() {
    return maxLog2;
  }

  /**
   * A copy of the twiddle factors for stage size m.
   *
   * @param m the stage size.
   * @return interleaved twiddle factors of length m.
   */
  public double[] getTwiddles(int m) {
    return twiddles(m).clone();
  }

  /**
   * A copy of the bit-reversal permutation for length n.
   *
   * @param n the length.
   * @return the permutation.
   */
  public int[] getPermutation(int n) {
    return permutation(n).clone();
  }

  /**
   * The butterfly matrix for stage size m.
   *
   * @param m the stage size.
   * @return the shared, immutable butterfly matrix.
   */
  public ButterflyMatrix getButterfly(int m) {
    return butterfly(m);
  }

  /**
   * Number of cached entries of all kinds.
   *
   * @return the number of entries.
   */
  public int size() {
    return twiddleCache.size() + permutationCache.size() + butterflyCache.size();
  }

  /**
   * Shared twiddle table for stage size m. Callers must not modify it.
   */
  double[] twiddles(int m) {
    return lookup(twiddleCache, m, Twiddles::twiddles, "Twiddle table");
  }

  /**
   * Shared permutation for length n. Callers must not modify it.
   */
  int[] permutation(int n) {
    return lookup(permutationCache, n, BitReversal::permutation, "Bit-reversal permutation");
  }

  /**
   * Shared butterfly matrix for stage size m.
   */
  ButterflyMatrix butterfly(int m) {
    return lookup(butterflyCache, m, size -> new ButterflyMatrix(size, twiddles(size)),
        "Butterfly matrix");
  }

  private <T> T lookup(ConcurrentMap<Integer, T> cache, int size, IntFunction<T> builder,
      String description) {
    PowerOfTwo.require(size);
    if (Integer.numberOfTrailingZeros(size) > maxLog2) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" %s for size %d exceeds the cache bound 2^%d.", description, size,
            maxLog2));
      }
      return builder.apply(size);
    }
    return cache.computeIfAbsent(size, key -> {
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" %s created for size %d.", description, key));
      }
      return builder.apply(key);
    });
  }

  /**
   * String representation of the tables.
   *
   * @return a String.
   */
  @Override
  public String toString() {
    return format(" FFT tables: %d twiddle tables, %d permutations, %d butterflies (max size 2^%d)",
        twiddleCache.size(), permutationCache.size(), butterflyCache.size(), maxLog2);
  }

  /**
   * Read the fft.cache.maxLog2 System property.
   *
   * @return the configured bound, or DEFAULT_MAX_LOG2 if the value is missing or invalid.
   */
  static int maxLog2Property() {
    String value = System.getProperty("fft.cache.maxLog2", Integer.toString(DEFAULT_MAX_LOG2));
    try {
      int maxLog2 = Integer.parseInt(value.trim());
      if (maxLog2 >= 0 && maxLog2 <= LIMIT_LOG2) {
        return maxLog2;
      }
      logger.info(" Invalid value for fft.cache.maxLog2: " + value);
    } catch (NumberFormatException e) {
      logger.info(" Invalid value for fft.cache.maxLog2: " + value);
    }
    return DEFAULT_MAX_LOG2;
  }
}
