package uk.ac.ebi.pathways.ranking_service.analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.CharTokenizer;
import org.springframework.stereotype.Component;

/**
 * Analyzer for pathway names, descriptions and lexicon terms.
 *
 * <p>Text is split into runs of letters and digits, so hyphens, slashes and punctuation act as
 * word boundaries ("Beta-adrenergic signaling" gives {@code beta}, {@code adrenergic}, {@code
 * signaling}). Accents are folded and tokens lowercased. No stop words are removed: lexicon terms
 * such as "bundle of his" must keep every word.
 *
 * <p>Both pathway text and lexicon terms go through this analyzer, so a term matches when its
 * tokens appear as a contiguous run of the text tokens.
 */
@Component
public final class PathwayTextAnalyzer extends Analyzer {

  private static final String FIELD_NAME = "pathway_text";

  /**
   * Pipeline order:
   *
   * <ol>
   *   <li>{@link PathwayTextTokenizer}: tokens made of letters or digits.
   *   <li>{@link ASCIIFoldingFilter}: removes accents.
   *   <li>{@link LowerCaseFilter}: case-insensitive matching.
   * </ol>
   */
  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source = new PathwayTextTokenizer();
    TokenStream filter = new ASCIIFoldingFilter(source);
    filter = new LowerCaseFilter(filter);
    return new TokenStreamComponents(source, filter);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new LowerCaseFilter(new ASCIIFoldingFilter(in));
  }

  /**
   * Splits text into normalized tokens.
   *
   * @param text the text, may be null
   * @return the tokens in order, empty for null or blank text
   */
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    try (TokenStream stream = tokenStream(FIELD_NAME, text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      // reading from a String never fails
      throw new UncheckedIOException("Failed to tokenize text: " + text, e);
    }
    return tokens;
  }

  /** Accepts letters and digits only. */
  private static class PathwayTextTokenizer extends CharTokenizer {
    @Override
    protected boolean isTokenChar(int c) {
      return Character.isLetter(c) || Character.isDigit(c);
    }
  }
}
