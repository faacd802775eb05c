package io.b2mash.b2b.nexusengine.interest;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class PenaltyRuleTest {

  private static final BigDecimal BASE = new BigDecimal("1000.00");

  @Test
  void perPeriod_chargesAtLeastOnePeriod() {
    var rule = new PenaltyRule.PerPeriod(new BigDecimal("0.05"), 30, null, null);

    assertThat(rule.assess(BASE, 10)).isEqualByComparingTo("50.00");
    assertThat(rule.assess(BASE, 65)).isEqualByComparingTo("100.00");
  }

  @Test
  void perPeriod_raisedToMinimum() {
    var rule = new PenaltyRule.PerPeriod(new BigDecimal("0.01"), 30, null, new BigDecimal("25"));

    // 1 period * 1% of 1000 = 10 -> minimum 25
    assertThat(rule.assess(BASE, 20)).isEqualByComparingTo("25");
  }

  @Test
  void tiered_daysBeforeFirstTier_chargesNothing() {
    var rule =
        new PenaltyRule.Tiered(List.of(new PenaltyRule.Tier(90, null, new BigDecimal("0.10"))));

    assertThat(rule.assess(BASE, 45)).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(rule.assess(BASE, 90)).isEqualByComparingTo("100.00");
  }

  @Test
  void flat_minimumThenMaximum() {
    var rule = new PenaltyRule.Flat(new BigDecimal("0.10"), new BigDecimal("50"), null);

    // 10% of 100 = 10 -> floor 50
    assertThat(rule.assess(new BigDecimal("100.00"), 30)).isEqualByComparingTo("50");
  }
}
