package uk.ac.ebi.pathways.ranking_service.relevance;

import java.util.List;

/**
 * A lexicon term split into analyzer tokens.
 *
 * @param text the term as written in the lexicon
 * @param tokens normalized tokens of the term
 * @param prefix whether the last token matches any word starting with it
 */
public record LexiconTerm(String text, List<String> tokens, boolean prefix) {

  public LexiconTerm {
    tokens = List.copyOf(tokens);
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Lexicon term has no tokens: '" + text + "'");
    }
  }

  /**
   * Returns whether the term occurs in the text as a contiguous run of whole tokens.
   *
   * @param textTokens analyzer tokens of the text
   */
  public boolean occursIn(List<String> textTokens) {
    int last = textTokens.size() - tokens.size();
    for (int start = 0; start <= last; start++) {
      if (matchesAt(textTokens, start)) {
        return true;
      }
    }
    return false;
  }

  private boolean matchesAt(List<String> textTokens, int start) {
    for (int i = 0; i < tokens.size(); i++) {
      String expected = tokens.get(i);
      String actual = textTokens.get(start + i);
      boolean lastToken = i == tokens.size() - 1;
      boolean matches =
          lastToken && prefix ? actual.startsWith(expected) : actual.equals(expected);
      if (!matches) {
        return false;
      }
    }
    return true;
  }
}
