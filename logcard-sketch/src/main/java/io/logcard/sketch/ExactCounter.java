package io.logcard.sketch;

import java.nio.ByteBuffer;
import java.util.HashSet;
import java.util.Set;

/**
 * Ground truth for the estimators: keeps every distinct item in memory.
 */
public class ExactCounter implements CardinalityEstimator
{
  // rough per-entry cost of HashSet node + ByteBuffer wrapper, not counting the payload
  private static final int ENTRY_OVERHEAD = 16;

  private final Set<ByteBuffer> items = new HashSet<>();
  private long payloadBytes;

  @Override
  public void add(byte[] value)
  {
    // copy, the caller is free to reuse its array
    if (items.add(ByteBuffer.wrap(value.clone()))) {
      payloadBytes += value.length;
    }
  }

  @Override
  public long cardinality()
  {
    return items.size();
  }

  @Override
  public long memoryFootprint()
  {
    return payloadBytes + (long) ENTRY_OVERHEAD * items.size();
  }

  @Override
  public String name()
  {
    return "exact";
  }
}
