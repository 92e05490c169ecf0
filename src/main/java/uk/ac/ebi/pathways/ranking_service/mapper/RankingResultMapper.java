package uk.ac.ebi.pathways.ranking_service.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.pipeline.RankingResult;

/**
 * Writes a {@link RankingResult} as JSON with snake_case keys, ready for persistence.
 *
 * <p>Every stage output has its own key ({@code aggregated}, {@code pruned}, {@code hypotheses}),
 * so the persisted final hypotheses are always the gated ones.
 */
@Slf4j
@Component
public class RankingResultMapper {

  private final ObjectMapper objectMapper;

  public RankingResultMapper() {
    objectMapper =
        JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
  }

  /**
   * Serializes a ranking result.
   *
   * @param result the result
   * @return the JSON document
   * @throws IllegalStateException if serialization fails
   */
  public String toJson(RankingResult result) {
    try {
      return objectMapper.writeValueAsString(result);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize ranking result {}", result.runId(), e);
      throw new IllegalStateException("Failed to serialize ranking result " + result.runId(), e);
    }
  }
}
