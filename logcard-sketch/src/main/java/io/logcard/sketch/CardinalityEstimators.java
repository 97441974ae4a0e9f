package io.logcard.sketch;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;

import java.util.List;

/**
 * Builds estimators from their names.
 *
 * <ul>
 *   <li>{@code exact} : {@link ExactCounter}
 *   <li>{@code hll[<p>][-lz][-lc]} : {@link HyperLogLog} with precision p (12 when omitted),
 *   {@code -lz} for {@link HyperLogLog.RankFunction#LEADING_ZEROS},
 *   {@code -lc} for {@link HyperLogLog.RangeCorrection#LINEAR_COUNTING}
 * </ul>
 *
 * <p>{@link CardinalityEstimator#name()} returns a name that this class maps back to an equivalent estimator.
 */
public final class CardinalityEstimators
{
  private static final String HLL_PREFIX = "hll";
  private static final Splitter OPTION_SPLITTER = Splitter.on('-');

  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator get(String name)
  {
    if (name.equals("exact")) {
      return new ExactCounter();
    }
    if (name.startsWith(HLL_PREFIX)) {
      List<String> parts = OPTION_SPLITTER.splitToList(name.substring(HLL_PREFIX.length()));
      String pStr = parts.get(0);
      int precision = pStr.isEmpty() ? HyperLogLog.DEFAULT_PRECISION : parsePrecision(name, pStr);

      HyperLogLog.RankFunction rankFunction = HyperLogLog.RankFunction.LOWEST_SET_BIT;
      HyperLogLog.RangeCorrection rangeCorrection = HyperLogLog.RangeCorrection.NONE;
      for (String option : parts.subList(1, parts.size())) {
        switch (option) {
          case "lz":
            rankFunction = HyperLogLog.RankFunction.LEADING_ZEROS;
            break;
          case "lc":
            rangeCorrection = HyperLogLog.RangeCorrection.LINEAR_COUNTING;
            break;
          default:
            throw new IllegalArgumentException("Unknown option \"" + option + "\" in estimator : " + name);
        }
      }
      return new HyperLogLog(precision, Hashing.murmur3_128(), rankFunction, rangeCorrection);
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  private static int parsePrecision(String name, String pStr)
  {
    Integer precision = Ints.tryParse(pStr);
    if (precision == null) {
      throw new IllegalArgumentException("illegal precision \"" + pStr + "\" in estimator : " + name);
    }
    return precision;
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    return () -> get(name);
  }
}
