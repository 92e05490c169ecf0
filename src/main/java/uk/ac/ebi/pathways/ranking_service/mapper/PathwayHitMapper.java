package uk.ac.ebi.pathways.ranking_service.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.model.PathwayHit;

/**
 * Reads the pathway hits written by the evidence ingestion adapter.
 *
 * <p>The input is a JSON array of hits, each tagged by {@code discovery_path}. A {@code null}
 * {@code p_value}, as well as a literal {@code NaN}, marks the statistic as unavailable. Unknown
 * properties are ignored.
 *
 * <p>Hits are read one at a time. A hit that cannot be read, for example one without a {@code
 * discovery_path}, is logged and skipped while the rest of the batch is kept. An unknown {@code
 * source_db} is read as {@code null} and left for validation to reject.
 */
@Slf4j
@Component
public class PathwayHitMapper {

  private final ObjectMapper objectMapper;

  public PathwayHitMapper() {
    objectMapper =
        JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
  }

  /**
   * Parses a JSON array of pathway hits.
   *
   * @param json the JSON array
   * @return the readable hits in input order
   * @throws IllegalArgumentException if the JSON is empty, is not valid JSON or is not an array
   */
  public List<PathwayHit> fromJson(String json) {
    String errorMessage;

    if (json == null || json.isBlank()) {
      errorMessage = "Null or empty pathway hit json provided.";
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      errorMessage = "Failed to parse pathway hits: " + e.getOriginalMessage();
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage, e);
    }
    if (root == null || root.isNull() || root.isMissingNode()) {
      return List.of();
    }
    if (!root.isArray()) {
      errorMessage = "Pathway hit json must be an array but was " + root.getNodeType();
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }

    List<PathwayHit> hits = new ArrayList<>(root.size());
    int skipped = 0;
    for (int i = 0; i < root.size(); i++) {
      JsonNode node = root.get(i);
      try {
        hits.add(objectMapper.treeToValue(node, PathwayHit.class));
      } catch (JsonProcessingException | IllegalArgumentException e) {
        skipped++;
        log.warn(
            "Skipping unreadable pathway hit #{} ({}): {}",
            i,
            node.path("source_pathway_id").asText("<no id>"),
            e.getMessage());
      }
    }
    if (skipped > 0) {
      log.info("Skipped {} of {} pathway hits that could not be read", skipped, root.size());
    }
    return hits;
  }
}
