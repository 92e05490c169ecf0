package uk.ac.ebi.pathways.ranking_service.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PathwayTextAnalyzerTest {

  private PathwayTextAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    analyzer = new PathwayTextAnalyzer();
  }

  @AfterEach
  void tearDown() {
    analyzer.close();
  }

  @Test
  void shouldSplitOnPunctuationAndHyphens() {
    assertEquals(
        List.of("beta", "adrenergic", "signaling", "in", "cardiomyocytes"),
        analyzer.tokenize("Beta-adrenergic signaling (in cardiomyocytes)"));
  }

  @Test
  void shouldKeepDigitsInsideTokens() {
    assertEquals(List.of("nkx2", "5", "targets"), analyzer.tokenize("NKX2-5 targets"));
  }

  @Test
  void shouldFoldAccentedCharacters() {
    assertEquals(List.of("sjogren", "syndrome"), analyzer.tokenize("Sjögren syndrome"));
  }

  @Test
  void shouldKeepStopWords() {
    assertEquals(List.of("bundle", "of", "his"), analyzer.tokenize("Bundle of His"));
  }

  @Test
  void shouldReturnNoTokensForBlankText() {
    assertTrue(analyzer.tokenize(null).isEmpty());
    assertTrue(analyzer.tokenize("  ").isEmpty());
    assertTrue(analyzer.tokenize("-- / --").isEmpty());
  }
}
