package uk.ac.ebi.pathways.ranking_service.relevance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.pathways.ranking_service.config.RankingProperties;

/**
 * Loads, compiles and provides the configured term lexicon.
 *
 * <p>The lexicon is loaded once from {@code ranking.relevance.lexicon-location}, either at startup
 * or on first use. After that every read is lock-free and returns the same immutable {@link
 * CompiledLexicon}.
 */
@Slf4j
@Service
public class LexiconRegistry {

  private final LexiconLoader loader;
  private final TermMatcher termMatcher;
  private final RankingProperties properties;

  private final LexiconHolder holder = new LexiconHolder();

  public LexiconRegistry(
      LexiconLoader loader, TermMatcher termMatcher, RankingProperties properties) {
    this.loader = loader;
    this.termMatcher = termMatcher;
    this.properties = properties;
  }

  /**
   * Loads and compiles the lexicon from the configured location, replacing any loaded one.
   *
   * @return the compiled lexicon
   * @throws IllegalStateException if the resource cannot be read, or defines no direct term
   */
  public synchronized CompiledLexicon loadLexicon() {
    String location = properties.getRelevance().getLexiconLocation();
    TermLexicon lexicon = loader.loadFromResource(location);
    CompiledLexicon compiled = termMatcher.compileLexicon(lexicon);
    holder.initialize(compiled);
    log.info("Loaded term lexicon from {}: {}", location, lexicon.sizes());
    return compiled;
  }

  /** Returns the compiled lexicon, loading it first if needed. */
  public CompiledLexicon getCurrentLexicon() {
    CompiledLexicon lexicon = holder.get();
    if (lexicon != null) {
      return lexicon;
    }
    synchronized (this) {
      lexicon = holder.get();
      return lexicon != null ? lexicon : loadLexicon();
    }
  }

  /** Safe publication of the compiled lexicon. */
  private static class LexiconHolder {
    private volatile CompiledLexicon lexicon;

    void initialize(CompiledLexicon lexicon) {
      this.lexicon = lexicon;
    }

    CompiledLexicon get() {
      return lexicon;
    }
  }
}
