package uk.ac.ebi.pathways.ranking_service.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.relevance.DiseaseContext;
import uk.ac.ebi.pathways.ranking_service.relevance.TermLexicon;
import uk.ac.ebi.pathways.ranking_service.relevance.dto.TermLexiconDto;

/**
 * Maps the lexicon JSON document into a {@link TermLexicon}.
 *
 * <pre>{@code
 * TermLexicon lexicon = new LexiconMapper().fromJson(json);
 * }</pre>
 */
@Slf4j
@Component
public class LexiconMapper {

  private final ObjectMapper objectMapper;

  /** Unknown properties fail the mapping, so a misspelt category is not silently ignored. */
  public LexiconMapper() {
    objectMapper = new ObjectMapper();
    objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Parses the lexicon JSON.
   *
   * @param json the JSON document
   * @return the lexicon
   * @throws IllegalArgumentException if the JSON is empty or cannot be parsed
   */
  public TermLexicon fromJson(String json) {
    String errorMessage;

    if (json == null || json.isBlank()) {
      errorMessage = "Null or empty lexicon json provided.";
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }

    TermLexiconDto dto;
    try {
      dto = objectMapper.readValue(json, TermLexiconDto.class);
    } catch (JsonProcessingException e) {
      errorMessage = "Failed to parse term lexicon JSON: " + e.getOriginalMessage();
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage, e);
    }

    if (dto == null) {
      errorMessage = "The parsed lexicon JSON produced empty data.";
      log.error(errorMessage);
      throw new IllegalArgumentException(errorMessage);
    }
    return toLexicon(dto);
  }

  private TermLexicon toLexicon(TermLexiconDto dto) {
    List<DiseaseContext> contexts = new ArrayList<>();
    if (dto.getDiseaseContexts() != null) {
      for (Map.Entry<String, TermLexiconDto.DiseaseContextDto> entry :
          dto.getDiseaseContexts().entrySet()) {
        TermLexiconDto.DiseaseContextDto context = entry.getValue();
        contexts.add(
            new DiseaseContext(
                entry.getKey(),
                context == null ? null : context.getSynonyms(),
                context == null ? null : context.getTerms()));
      }
    }
    return new TermLexicon(
        dto.getDirectTerms(),
        dto.getProcessTerms(),
        dto.getPathologyTerms(),
        dto.getDiseaseContextTerms(),
        dto.getNegativeTerms(),
        contexts);
  }
}
