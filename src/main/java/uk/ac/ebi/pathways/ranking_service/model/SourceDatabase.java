package uk.ac.ebi.pathways.ranking_service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enumerates the kinds of annotation database a pathway hit can come from.
 *
 * <p>Each constant has a stable id, used in configuration keys and JSON, plus the native source
 * codes the enrichment service reports for it (for example {@code REAC} or {@code GO:BP}).
 */
public enum SourceDatabase {
  /** Curated signaling pathway databases, e.g. Reactome. */
  CURATED_SIGNALING("curated-signaling", List.of("REAC", "REACTOME")),

  /** Metabolic reference maps, e.g. KEGG. */
  METABOLIC_REFERENCE("metabolic-reference", List.of("KEGG")),

  /** Community curated pathway collections, e.g. WikiPathways. */
  COMMUNITY_CURATED("community-curated", List.of("WP", "WIKIPATHWAYS")),

  /** Ontology terms, e.g. Gene Ontology biological process. */
  ONTOLOGY("ontology", List.of("GO", "GO:BP", "GO:MF", "GO:CC"));

  private final String id;
  private final List<String> nativeCodes;

  SourceDatabase(String id, List<String> nativeCodes) {
    this.id = id;
    this.nativeCodes = nativeCodes;
  }

  @JsonValue
  public String getId() {
    return id;
  }

  public List<String> getNativeCodes() {
    return nativeCodes;
  }

  /**
   * Resolves a database from its id, its constant name or one of its native codes, ignoring case.
   *
   * @param value the value to resolve
   * @return the matching database
   * @throws IllegalArgumentException if nothing matches
   */
  public static SourceDatabase fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Source database must not be null");
    }
    return find(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown source database: " + value));
  }

  /**
   * Reads a database from JSON. An unknown code yields {@code null}, so the hit carrying it is
   * rejected by validation instead of failing the whole batch.
   */
  @JsonCreator
  public static SourceDatabase fromJson(String value) {
    return find(value).orElse(null);
  }

  public static Optional<SourceDatabase> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim();
    for (SourceDatabase database : values()) {
      if (database.id.equalsIgnoreCase(normalized)
          || database.name().equalsIgnoreCase(normalized)
          || database.nativeCodes.contains(normalized.toUpperCase(Locale.ROOT))) {
        return Optional.of(database);
      }
    }
    return Optional.empty();
  }

  public static boolean isKnownId(String id) {
    return id != null && Arrays.stream(values()).anyMatch(d -> d.id.equals(id));
  }

  public static Set<String> allowedIds() {
    return Arrays.stream(values()).map(SourceDatabase::getId).collect(Collectors.toSet());
  }
}
