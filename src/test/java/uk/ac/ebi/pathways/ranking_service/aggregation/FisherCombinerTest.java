package uk.ac.ebi.pathways.ranking_service.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FisherCombinerTest {

  private static final double FLOOR = 1e-300;

  @Test
  void singlePValueIsReturnedUnchanged() {
    assertThat(FisherCombiner.combine(List.of(0.03), FLOOR)).isEqualTo(0.03);
  }

  @ParameterizedTest
  @ValueSource(doubles = {0.01, 0.05})
  void twoEqualSignificantPValuesCombineBelowEither(double p) {
    double combined = FisherCombiner.combine(List.of(p, p), FLOOR);

    assertThat(combined).isLessThan(p);
  }

  @Test
  void knownValueForTwoPValues() {
    // X = -2 ln(0.05^2) = 11.98, chi-square with 4 degrees of freedom
    double combined = FisherCombiner.combine(List.of(0.05, 0.05), FLOOR);

    assertThat(combined).isCloseTo(0.0175, within(1e-4));
  }

  @Test
  void pValuesOfOneGiveOne() {
    assertThat(FisherCombiner.combine(List.of(1.0, 1.0, 1.0), FLOOR)).isEqualTo(1.0);
  }

  @Test
  void extremePValuesStayAboveTheFloor() {
    double combined = FisherCombiner.combine(List.of(1e-300, 1e-300), 1e-300);

    assertThat(combined).isGreaterThanOrEqualTo(1e-300).isFinite();
  }

  @Test
  void emptyListIsRejected() {
    assertThatThrownBy(() -> FisherCombiner.combine(List.of(), FLOOR))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void singleValueIsFullyConsistent() {
    assertThat(FisherCombiner.consistency(List.of(0.2))).isEqualTo(1.0);
  }

  @Test
  void equalValuesAreFullyConsistent() {
    assertThat(FisherCombiner.consistency(List.of(0.01, 0.01, 0.01))).isEqualTo(1.0);
  }

  @Test
  void divergentValuesAreLessConsistent() {
    double close = FisherCombiner.consistency(List.of(0.010, 0.012));
    double far = FisherCombiner.consistency(List.of(1e-10, 0.5));

    assertThat(close).isGreaterThan(far);
    assertThat(far).isBetween(0.0, 1.0);
  }
}
