package io.logcard.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * Generates distinct random items by hashing a counter together with a seed, which is much faster
 * than UUID#randomUUID() and doesn't need a set to rule out duplicates.
 *
 * <p>see http://antirez.com/news/99
 */
public class RandomItemGenerator
{
  private final HashFunction sha256 = Hashing.sha256();
  private final ByteBuffer buffer = ByteBuffer.allocate(16);
  private long counter = 0;

  public RandomItemGenerator()
  {
    this(new Random().nextLong());
  }

  /**
   * Generators built with the same seed produce the same sequence.
   */
  public RandomItemGenerator(long seed)
  {
    buffer.putLong(8, seed);
  }

  /**
   * @return a 32 bytes random item with a negligible collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return sha256.hashBytes(buffer.array()).asBytes();
  }

  public long generated()
  {
    return counter;
  }
}
