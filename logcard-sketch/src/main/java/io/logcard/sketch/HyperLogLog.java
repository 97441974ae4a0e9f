package io.logcard.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses a 128-bits hash function with a parameter p. The first 32 bits (big-endian) select the register,
 * the remaining 96 bits give the rank.
 *
 * <p>Expected relative standard error is {@code 1.04 / sqrt(m)}:
 * <pre>
 * p = 4  =&gt; 26.00%
 * p = 10 =&gt;  3.25%
 * p = 12 =&gt;  1.63%
 * p = 16 =&gt;  0.41%
 * </pre>
 *
 * <p> Differences from paper
 * <ul>
 *   <li>each register takes 8-bits instead of 5-bits
 *   <li>by default the rank is the position of the lowest set bit instead of the number of leading zeros,
 *   see {@link RankFunction}
 *   <li>no correction is applied unless {@link RangeCorrection#LINEAR_COUNTING} is requested
 *   <li>an estimator that has never seen an item reports 0
 * </ul>
 *
 * <p>Not thread-safe.
 */
public class HyperLogLog implements CardinalityEstimator
{
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 16;
  public static final int DEFAULT_PRECISION = 12;

  private static final int RANK_BITS = 96;
  private static final double SMALL_CORRECTION_FACTOR = 2.5d;

  /**
   * How the rank of the 96 non-index hash bits is computed. Both yield P(rank = k) = 2^-k on uniform bits.
   */
  public enum RankFunction
  {
    /**
     * 1-based position of the lowest set bit, 0 when no bit is set.
     */
    LOWEST_SET_BIT,
    /**
     * One plus the number of leading zeros, 97 when no bit is set.
     */
    LEADING_ZEROS
  }

  public enum RangeCorrection
  {
    /**
     * Bare harmonic mean formula.
     */
    NONE,
    /**
     * Linear counting below 2.5m while some register is still empty.
     */
    LINEAR_COUNTING
  }

  private final int p;
  private final HashFunction hashFunction;
  private final RankFunction rankFunction;
  private final RangeCorrection rangeCorrection;

  // each register actually only needs 7-bits (max rank is 97),
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  public HyperLogLog(int precision)
  {
    this(precision, Hashing.murmur3_128(), RankFunction.LOWEST_SET_BIT, RangeCorrection.NONE);
  }

  public HyperLogLog(
      int precision,
      HashFunction hashFunction,
      RankFunction rankFunction,
      RangeCorrection rangeCorrection
  )
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    Preconditions.checkArgument(
        hashFunction.bits() >= 128,
        "hash function %s produces %s bits, at least 128 are needed",
        hashFunction,
        hashFunction.bits()
    );
    this.p = precision;
    this.hashFunction = hashFunction;
    this.rankFunction = Preconditions.checkNotNull(rankFunction, "rankFunction");
    this.rangeCorrection = Preconditions.checkNotNull(rangeCorrection, "rangeCorrection");
    this.registers = new byte[1 << p];
  }

  @Override
  public void add(byte[] value)
  {
    add128BitsHash(hashFunction.hashBytes(value).asBytes());
  }

  private void add128BitsHash(byte[] hash)
  {
    final int bucket = Ints.fromBytes(hash[0], hash[1], hash[2], hash[3]) & (registers.length - 1);
    final int high = Ints.fromBytes(hash[4], hash[5], hash[6], hash[7]);
    final long low = Longs.fromBytes(hash[8], hash[9], hash[10], hash[11], hash[12], hash[13], hash[14], hash[15]);

    final byte rank = rankFunction == RankFunction.LOWEST_SET_BIT ? lowestSetBit(high, low) : leadingZeros(high, low);

    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  @VisibleForTesting
  static byte lowestSetBit(int high, long low)
  {
    if (low != 0) {
      return (byte) (Long.numberOfTrailingZeros(low) + 1);
    }
    if (high != 0) {
      return (byte) (Long.SIZE + Integer.numberOfTrailingZeros(high) + 1);
    }
    return 0; // very unlikely
  }

  @VisibleForTesting
  static byte leadingZeros(int high, long low)
  {
    if (high != 0) {
      return (byte) (Integer.numberOfLeadingZeros(high) + 1);
    }
    if (low != 0) {
      return (byte) (Integer.SIZE + Long.numberOfLeadingZeros(low) + 1);
    }
    return (byte) (RANK_BITS + 1); // very unlikely
  }

  /**
   * Estimates the number of distinct items added so far. Doesn't modify any register.
   *
   * @return 0 if no item has raised any register, otherwise the floor of the estimate
   *
   * @throws EmptyEstimatorStateException if the registers don't yield a finite estimate
   */
  @Override
  public long cardinality()
  {
    final int m = registers.length;

    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += Math.scalb(1.0d, -registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    if (zeros == m) {
      return 0;
    }

    final double alpha = 0.7213 / (1 + 1.079 / m);
    final double e = makeCorrection(alpha * m * m * (1 / registerSum), zeros, m);
    if (!Double.isFinite(e)) {
      throw new EmptyEstimatorStateException(
          String.format("registers of %s yield a non-finite estimate [%s] (sum [%s])", name(), e, registerSum)
      );
    }
    return (long) Math.floor(e);
  }

  private double makeCorrection(double e, int zeros, int m)
  {
    if (rangeCorrection == RangeCorrection.LINEAR_COUNTING && e <= SMALL_CORRECTION_FACTOR * m && zeros > 0) {
      return m * Math.log(m / (double) zeros);
    }
    // there is no large range correction: ranks come from 96 bits, so the 2^32 saturation never applies
    return e;
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `p`, `hashFunction` reference
  }

  public int precision()
  {
    return p;
  }

  public RankFunction rankFunction()
  {
    return rankFunction;
  }

  public RangeCorrection rangeCorrection()
  {
    return rangeCorrection;
  }

  @VisibleForTesting
  byte[] registers()
  {
    return registers.clone();
  }

  @Override
  public String name()
  {
    StringBuilder sb = new StringBuilder("hll").append(p);
    if (rankFunction == RankFunction.LEADING_ZEROS) {
      sb.append("-lz");
    }
    if (rangeCorrection == RangeCorrection.LINEAR_COUNTING) {
      sb.append("-lc");
    }
    return sb.toString();
  }

  @Override
  public String toString()
  {
    return name();
  }
}
