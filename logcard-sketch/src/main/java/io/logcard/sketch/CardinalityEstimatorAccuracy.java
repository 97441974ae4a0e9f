package io.logcard.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class CardinalityEstimatorAccuracy
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimatorAccuracy.class);

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality, run j uses items generated from `seed + j`.
   *
   * @return absolute percentage errors for each experiment, errors[i][j] = error of cardinality i of the j-th run.
   */
  static double[][] testDifferentCardinalities(
      Supplier<CardinalityEstimator> estimatorSupplier,
      final int fromCard,
      final int toCard,
      final int numRuns,
      final long seed
  )
  {
    Preconditions.checkArgument(
        fromCard > 0 && toCard > fromCard && toCard % fromCard == 0,
        "illegal from [%s] and to [%s] : to should be a multiple of from",
        fromCard,
        toCard
    );
    Preconditions.checkArgument(numRuns > 0, "illegal runs [%s]", numRuns);
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // fresh estimator and items for each run
      RandomItemGenerator generator = new RandomItemGenerator(seed + run);
      CardinalityEstimator estimator = estimatorSupplier.get();
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*fromCard, 2*fromCard, 3*fromCard, .., toCard
      for (int card = 1; card <= toCard; card++) {
        estimator.add(generator.generate());

        if (card % fromCard == 0) {
          double est = estimator.cardinality();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      LOG.debug("Finish run #{} of {} in {} ms", run, estimator.name(), System.currentTimeMillis() - start);
    }

    return errors;
  }

  static List<OneResult> summarize(double[][] errors, int fromCard)
  {
    // compute min, 50%, max error for each cardinality
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }
    return results;
  }

  static void writeTsv(Path outFile, List<OneResult> results) throws IOException
  {
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            Locale.ROOT,
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>]");
      System.exit(1);
    }

    Supplier<CardinalityEstimator> estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", args[0], fromCard, toCard, numRuns));
    }

    final long seed = System.nanoTime();
    LOG.info("Evaluating {} on {} runs up to cardinality {} (seed {})", args[0], numRuns, toCard, seed);
    final double[][] errors = testDifferentCardinalities(estimatorSupplier, fromCard, toCard, numRuns, seed);

    LOG.info("Writing results to {}", outFile);
    writeTsv(outFile, summarize(errors, fromCard));
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
