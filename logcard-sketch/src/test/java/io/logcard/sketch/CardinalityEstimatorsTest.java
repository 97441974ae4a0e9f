package io.logcard.sketch;

import com.google.common.base.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CardinalityEstimatorsTest
{
  @Test
  public void testDefaults()
  {
    HyperLogLog hll = assertInstanceOf(HyperLogLog.class, CardinalityEstimators.get("hll"));
    assertEquals(HyperLogLog.DEFAULT_PRECISION, hll.precision());
    assertEquals(HyperLogLog.RankFunction.LOWEST_SET_BIT, hll.rankFunction());
    assertEquals(HyperLogLog.RangeCorrection.NONE, hll.rangeCorrection());
  }

  @Test
  public void testOptions()
  {
    HyperLogLog hll = assertInstanceOf(HyperLogLog.class, CardinalityEstimators.get("hll10-lc-lz"));
    assertEquals(10, hll.precision());
    assertEquals(HyperLogLog.RankFunction.LEADING_ZEROS, hll.rankFunction());
    assertEquals(HyperLogLog.RangeCorrection.LINEAR_COUNTING, hll.rangeCorrection());
    // canonical order
    assertEquals("hll10-lz-lc", hll.name());
  }

  @Test
  public void testExact()
  {
    assertInstanceOf(ExactCounter.class, CardinalityEstimators.get("exact"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"exact", "hll4", "hll12", "hll16-lz", "hll8-lc", "hll14-lz-lc"})
  public void testNameRoundTrip(String name)
  {
    CardinalityEstimator estimator = CardinalityEstimators.get(name);
    assertEquals(name, estimator.name());
    assertEquals(name, CardinalityEstimators.get(estimator.name()).name());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "uniq", "hllraw14", "hllx", "hll12-", "hll12-zz", "hll3", "hll17", "HLL12"})
  public void testRejectsUnknownNames(String name)
  {
    assertThrows(IllegalArgumentException.class, () -> CardinalityEstimators.get(name));
  }

  @Test
  public void testLazyGetBuildsFreshEstimators()
  {
    Supplier<CardinalityEstimator> supplier = CardinalityEstimators.lazyGet("hll8");
    CardinalityEstimator first = supplier.get();
    first.add("10.0.0.1");
    CardinalityEstimator second = supplier.get();
    assertNotSame(first, second);
    assertEquals(0, second.cardinality());
  }
}
