package uk.ac.ebi.pathways.ranking_service.util;

import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;

/** Utility methods for gene symbol sets. */
public final class GeneSymbols {

  private GeneSymbols() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Normalizes a gene symbol: trimmed and upper-cased.
   *
   * @param symbol the raw symbol
   * @return the normalized symbol, or {@code null} for a null or blank symbol
   */
  public static String normalize(String symbol) {
    String trimmed = StringUtils.trimToNull(symbol);
    return trimmed == null ? null : trimmed.toUpperCase(Locale.ROOT);
  }

  /**
   * Normalizes every symbol of a collection, dropping null and blank entries.
   *
   * @param symbols the raw symbols, may be null
   * @return an unmodifiable, sorted set
   */
  public static SortedSet<String> normalizeAll(Collection<String> symbols) {
    TreeSet<String> normalized = new TreeSet<>();
    if (symbols != null) {
      for (String symbol : symbols) {
        String value = normalize(symbol);
        if (value != null) {
          normalized.add(value);
        }
      }
    }
    return Collections.unmodifiableSortedSet(normalized);
  }

  /**
   * Returns the Jaccard similarity {@code |a ∩ b| / |a ∪ b|} of two sets, 0 when either is empty.
   */
  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    int intersection = Sets.intersection(a, b).size();
    return (double) intersection / Sets.union(a, b).size();
  }
}
