package uk.ac.ebi.pathways.ranking_service.evidence;

import lombok.Builder;

/**
 * The auxiliary evidence providers available to one run. A {@code null} provider means the
 * evidence is not available and counts as neutral.
 */
@Builder
public record EvidenceProviders(
    TissueSpecificityProvider tissueSpecificity,
    LiteratureCitationProvider literatureCitations,
    DomainGeneScoreProvider domainGeneScores,
    DruggabilityProvider druggability) {

  public static EvidenceProviders none() {
    return new EvidenceProviders(null, null, null, null);
  }
}
