package io.logcard.sketch;

/**
 * Thrown when the registers of an estimator can't be turned into a finite estimate.
 */
public class EmptyEstimatorStateException extends IllegalStateException
{
  public EmptyEstimatorStateException(String message)
  {
    super(message);
  }
}
