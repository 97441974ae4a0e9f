package io.logcard.sketch;

import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Compares an exact distinct count of the IP addresses in a log file with an estimate.
 */
public class Main
{
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final String DEFAULT_ESTIMATOR = "hll" + HyperLogLog.DEFAULT_PRECISION;

  static int run(String[] args, PrintStream out, PrintStream err)
  {
    if (args.length < 1 || args.length > 2) {
      err.println("Arguments: <logFile> [<estimator>]");
      return 1;
    }

    Path logFile = Paths.get(args[0]);
    String estimatorName = args.length == 2 ? args[1] : DEFAULT_ESTIMATOR;
    try {
      // fail on a bad name before reading the whole file
      CardinalityEstimators.get(estimatorName);
    }
    catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 1;
    }
    Supplier<CardinalityEstimator> estimatorSupplier = CardinalityEstimators.lazyGet(estimatorName);

    List<String> addresses;
    try {
      addresses = IpAddressExtractor.extract(logFile);
    }
    catch (IOException e) {
      LOG.error("Failed to read log file {}", logFile, e);
      return 1;
    }

    CardinalityComparison.Result result = CardinalityComparison.compare(
        addresses,
        CardinalityEstimators.lazyGet("exact"),
        estimatorSupplier
    );
    out.print(result.toTable());
    return 0;
  }

  public static void main(String[] args)
  {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }
}
