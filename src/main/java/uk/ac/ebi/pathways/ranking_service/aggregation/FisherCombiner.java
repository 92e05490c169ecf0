package uk.ac.ebi.pathways.ranking_service.aggregation;

import java.util.List;
import org.apache.commons.math3.special.Gamma;

/**
 * Fisher's method for combining independent p-values.
 *
 * <p>For {@code k} p-values the statistic {@code X = -2 Σ ln(p_i)} follows a chi-square
 * distribution with {@code 2k} degrees of freedom. Its survival function equals the regularized
 * upper incomplete gamma function {@code Q(k, X / 2)}.
 */
public final class FisherCombiner {

  private FisherCombiner() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Combines p-values.
   *
   * @param pValues usable p-values in (0, 1], at least one
   * @param minimumPValue floor applied to each value before taking its logarithm, and to the
   *     result
   * @return the combined p-value; a single value is returned unchanged
   */
  public static double combine(List<Double> pValues, double minimumPValue) {
    if (pValues == null || pValues.isEmpty()) {
      throw new IllegalArgumentException("At least one p-value is required");
    }
    if (pValues.size() == 1) {
      return pValues.get(0);
    }

    double statistic = 0.0;
    for (double p : pValues) {
      statistic += -2.0 * Math.log(Math.max(p, minimumPValue));
    }
    double combined = Gamma.regularizedGammaQ(pValues.size(), statistic / 2.0);
    return Math.min(1.0, Math.max(combined, minimumPValue));
  }

  /**
   * Returns {@code 1 - cv} of the p-values clamped to [0, 1], where {@code cv} is the population
   * standard deviation divided by the mean. A single value is fully consistent.
   */
  public static double consistency(List<Double> pValues) {
    if (pValues.size() < 2) {
      return 1.0;
    }
    double mean = pValues.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    if (mean <= 0.0) {
      return 1.0;
    }
    double variance = 0.0;
    for (double p : pValues) {
      variance += (p - mean) * (p - mean);
    }
    variance /= pValues.size();
    double cv = Math.sqrt(variance) / mean;
    return Math.max(0.0, Math.min(1.0, 1.0 - cv));
  }
}
