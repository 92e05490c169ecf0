package uk.ac.ebi.pathways.ranking_service.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GeneSymbolsTest {

  @Test
  void testNormalize() {
    assertEquals("NKX2-5", GeneSymbols.normalize(" nkx2-5 "));
    assertNull(GeneSymbols.normalize("  "));
    assertNull(GeneSymbols.normalize(null));
  }

  @Test
  void testNormalizeAll_sortsAndDropsBlanks() {
    Set<String> genes =
        GeneSymbols.normalizeAll(Arrays.asList("tbx5", "GATA4", null, " ", "Tbx5"));

    assertEquals(List.of("GATA4", "TBX5"), List.copyOf(genes));
    assertThrows(UnsupportedOperationException.class, () -> genes.add("MYH6"));
  }

  @Test
  void testJaccard() {
    assertEquals(
        0.5, GeneSymbols.jaccard(Set.of("A", "B", "C"), Set.of("A", "B", "C", "D", "E", "F")));
    assertEquals(1.0, GeneSymbols.jaccard(Set.of("A"), Set.of("A")));
    assertEquals(0.0, GeneSymbols.jaccard(Set.of(), Set.of("A")));
    assertEquals(0.0, GeneSymbols.jaccard(Set.of("A", "B"), Set.of("C")));
  }
}
