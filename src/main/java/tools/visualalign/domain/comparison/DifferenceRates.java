package tools.visualalign.domain.comparison;

import java.util.Locale;

/**
 * Presentation helpers for per-page difference rates.
 */
public class DifferenceRates {
  public static final String MISSING = "—";

  private DifferenceRates() {}

  /**
   * @param rate A rate in [0, 1], or {@code null} when the page was not compared yet.
   * @return The rate as a percentage with one decimal, e.g. {@code "12.3%"}, or an em dash.
   */
  public static String format(Double rate) {
    if (rate == null) {
      return MISSING;
    }
    return String.format(Locale.ROOT, "%.1f%%", rate * 100);
  }

  /**
   * @param rate A rate, or {@code null}.
   * @param threshold The alert threshold, 0.005 by default.
   * @return {@code true} when the rate is known and above the threshold.
   */
  public static boolean isAlert(Double rate, double threshold) {
    return rate != null && rate > threshold;
  }
}
