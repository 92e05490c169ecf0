package uk.ac.ebi.pathways.ranking_service.relevance;

import uk.ac.ebi.pathways.ranking_service.model.AggregatedPathway;
import uk.ac.ebi.pathways.ranking_service.model.RelevanceAnnotation;

/** An aggregated pathway with its relevance annotation. */
public record AnnotatedPathway(AggregatedPathway pathway, RelevanceAnnotation relevance) {}
