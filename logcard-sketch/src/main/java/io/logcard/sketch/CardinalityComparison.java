package io.logcard.sketch;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Counts the same items with an exact baseline and with an estimator, and times both.
 */
public class CardinalityComparison
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityComparison.class);
  private static final double NANOS_PER_SECOND = 1_000_000_000.0d;

  public static Result compare(
      Iterable<String> items,
      Supplier<CardinalityEstimator> baselineSupplier,
      Supplier<CardinalityEstimator> estimatorSupplier
  )
  {
    CardinalityEstimator baseline = baselineSupplier.get();
    long start = System.nanoTime();
    long baselineCount = ingest(baseline, items);
    long baselineNanos = System.nanoTime() - start;

    CardinalityEstimator estimator = estimatorSupplier.get();
    start = System.nanoTime();
    long estimatedCount = ingest(estimator, items);
    long estimatorNanos = System.nanoTime() - start;

    Result result = new Result(
        estimator.name(),
        baselineCount,
        baselineNanos / NANOS_PER_SECOND,
        estimatedCount,
        estimatorNanos / NANOS_PER_SECOND
    );
    LOG.info(
        "{} counted {} against {} exact ({} bytes vs {} bytes)",
        estimator.name(),
        estimatedCount,
        baselineCount,
        estimator.memoryFootprint(),
        baseline.memoryFootprint()
    );
    return result;
  }

  private static long ingest(CardinalityEstimator estimator, Iterable<String> items)
  {
    for (String item : items) {
      estimator.add(item);
    }
    return estimator.cardinality();
  }

  public static final class Result
  {
    private final String estimatorName;
    private final long exactCount;
    private final double exactSeconds;
    private final long estimatedCount;
    private final double estimatorSeconds;

    Result(String estimatorName, long exactCount, double exactSeconds, long estimatedCount, double estimatorSeconds)
    {
      this.estimatorName = estimatorName;
      this.exactCount = exactCount;
      this.exactSeconds = exactSeconds;
      this.estimatedCount = estimatedCount;
      this.estimatorSeconds = estimatorSeconds;
    }

    public String estimatorName()
    {
      return estimatorName;
    }

    public long exactCount()
    {
      return exactCount;
    }

    public double exactSeconds()
    {
      return exactSeconds;
    }

    public long estimatedCount()
    {
      return estimatedCount;
    }

    public double estimatorSeconds()
    {
      return estimatorSeconds;
    }

    /**
     * @return (estimated - exact) / exact, NaN when nothing was counted
     */
    public double relativeError()
    {
      if (exactCount == 0) {
        return Double.NaN;
      }
      return (estimatedCount - exactCount) / (double) exactCount;
    }

    public String toTable()
    {
      String[][] rows = {
          {"", "Exact count", estimatorName},
          {"Unique elements", format("%,d", exactCount), format("%,d", estimatedCount)},
          {"Execution time (sec.)", format("%.5f", exactSeconds), format("%.5f", estimatorSeconds)}
      };

      int[] widths = new int[rows[0].length];
      for (String[] row : rows) {
        for (int c = 0; c < row.length; c++) {
          widths[c] = Math.max(widths[c], row[c].length());
        }
      }

      String separator = " | ";
      int totalWidth = separator.length() * (widths.length - 1);
      for (int width : widths) {
        totalWidth += width;
      }

      StringBuilder sb = new StringBuilder();
      sb.append("Comparison results").append('\n');
      sb.append(Strings.repeat("=", totalWidth)).append('\n');
      for (int r = 0; r < rows.length; r++) {
        String[] cells = new String[rows[r].length];
        for (int c = 0; c < cells.length; c++) {
          // first column is left justified, numbers are right justified
          cells[c] = c == 0 ? Strings.padEnd(rows[r][c], widths[c], ' ') : Strings.padStart(rows[r][c], widths[c], ' ');
        }
        sb.append(Joiner.on(separator).join(cells)).append('\n');
        if (r == 0) {
          sb.append(Strings.repeat("-", totalWidth)).append('\n');
        }
      }
      return sb.toString();
    }

    private static String format(String pattern, Object value)
    {
      return String.format(Locale.ROOT, pattern, value);
    }

    @Override
    public String toString()
    {
      return String.format(
          Locale.ROOT,
          "Result{estimator=%s, exact=%d, estimated=%d, relativeError=%.4f}",
          estimatorName,
          exactCount,
          estimatedCount,
          relativeError()
      );
    }
  }
}
