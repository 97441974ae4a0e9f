package io.logcard.sketch;

import java.nio.charset.StandardCharsets;

public interface CardinalityEstimator
{
  void add(byte[] value);

  default void add(String value)
  {
    add(value.getBytes(StandardCharsets.UTF_8));
  }

  long cardinality();
  long memoryFootprint();

  String name();
}
