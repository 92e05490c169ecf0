package uk.ac.ebi.pathways.ranking_service.relevance;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.ac.ebi.pathways.ranking_service.mapper.LexiconMapper;

/**
 * Loads a {@link TermLexicon} from a JSON resource, e.g. {@code
 * classpath:lexicon/cardiac-lexicon.json}. Resource access is kept apart from JSON parsing, which
 * is delegated to {@link LexiconMapper}.
 */
@Slf4j
@Component
public class LexiconLoader {
  private final LexiconMapper lexiconMapper;
  private final ResourceLoader resourceLoader;

  public LexiconLoader(LexiconMapper lexiconMapper, ResourceLoader resourceLoader) {
    this.lexiconMapper = lexiconMapper;
    this.resourceLoader = resourceLoader;
  }

  /**
   * Loads the lexicon from a resource.
   *
   * @param resourceLocation Spring resource location of the JSON file
   * @return the lexicon
   * @throws IllegalStateException if the resource is missing or unreadable
   * @throws IllegalArgumentException if its content is not a valid lexicon
   */
  public TermLexicon loadFromResource(String resourceLocation) {
    log.debug("Loading term lexicon from {}", resourceLocation);
    Resource resource = resourceLoader.getResource(resourceLocation);
    if (!resource.exists()) {
      log.error("Term lexicon resource not found: {}", resourceLocation);
      throw new IllegalStateException("Resource not found: " + resourceLocation);
    }
    String json;
    try {
      json = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read term lexicon {}", resourceLocation, e);
      throw new IllegalStateException("Failed to read resource: " + resourceLocation, e);
    }
    return lexiconMapper.fromJson(json);
  }
}
