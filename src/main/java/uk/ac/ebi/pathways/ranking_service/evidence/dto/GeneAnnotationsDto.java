package uk.ac.ebi.pathways.ranking_service.evidence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object mirroring the curated gene annotation file. Used for deserialization only.
 *
 * <pre>{@code
 * {
 *   "domain_scores": {"GATA4": 0.95, "MYH7": 0.95},
 *   "druggability": {"approved": ["SCN5A"], "clinical_trial": ["PCSK9"], "druggable": ["RYR2"]}
 * }
 * }</pre>
 */
@Data
@NoArgsConstructor
public class GeneAnnotationsDto {

  @JsonProperty("domain_scores")
  private Map<String, Double> domainScores;

  @JsonProperty("druggability")
  private DruggabilityDto druggability;

  @Data
  @NoArgsConstructor
  public static class DruggabilityDto {
    @JsonProperty("approved")
    private List<String> approved;

    @JsonProperty("clinical_trial")
    private List<String> clinicalTrial;

    @JsonProperty("druggable")
    private List<String> druggable;
  }
}
