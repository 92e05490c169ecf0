package uk.ac.ebi.pathways.ranking_service.relevance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object mirroring the lexicon JSON file. Mutable, used for deserialization only.
 *
 * <pre>{@code
 * {
 *   "direct_terms": ["cardiac", "heart", "cardio*"],
 *   "process_terms": ["contraction"],
 *   "pathology_terms": ["arrhythmia"],
 *   "disease_context_terms": ["heart failure"],
 *   "negative_terms": ["neuronal"],
 *   "disease_contexts": {
 *     "heart failure": {"synonyms": ["hf"], "terms": ["ejection fraction"]}
 *   }
 * }
 * }</pre>
 */
@Data
@NoArgsConstructor
public class TermLexiconDto {

  @JsonProperty("direct_terms")
  private List<String> directTerms;

  @JsonProperty("process_terms")
  private List<String> processTerms;

  @JsonProperty("pathology_terms")
  private List<String> pathologyTerms;

  @JsonProperty("disease_context_terms")
  private List<String> diseaseContextTerms;

  @JsonProperty("negative_terms")
  private List<String> negativeTerms;

  /** Disease context label to its synonyms and terms. */
  @JsonProperty("disease_contexts")
  private Map<String, DiseaseContextDto> diseaseContexts;

  @Data
  @NoArgsConstructor
  public static class DiseaseContextDto {
    private List<String> synonyms;
    private List<String> terms;
  }
}
