package io.b2mash.b2b.nexusengine.jurisdiction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.nexusengine.config.NexusEngineProperties;
import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.PenaltyBase;
import io.b2mash.b2b.nexusengine.interest.PenaltyComponent;
import io.b2mash.b2b.nexusengine.interest.PenaltyKind;
import io.b2mash.b2b.nexusengine.interest.PenaltyRule;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.MonthDay;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import tools.jackson.databind.json.JsonMapper;

class JurisdictionPackLoaderTest {

  private final JurisdictionPackLoader loader =
      new JurisdictionPackLoader(
          new PathMatchingResourcePatternResolver(),
          JsonMapper.builder().build(),
          new NexusEngineProperties(2, "classpath:test-jurisdiction-packs/*.json"));

  @Test
  void load_readsEveryPackAtLocation() {
    var lookup = loader.load();

    assertThat(lookup.jurisdictionCodes()).containsExactlyInAnyOrder("TA", "TB", "TC", "TD");
  }

  @Test
  void load_mapsNexusRules() {
    var config = loader.load().jurisdictionConfig("TA").orElseThrow();

    assertThat(config.thresholdAmount()).isEqualByComparingTo("100000");
    assertThat(config.thresholdCount()).isEqualTo(200L);
    assertThat(config.thresholdOperator()).isEqualTo(ThresholdOperator.AND);
    assertThat(config.lookbackPolicy())
        .isEqualTo(new LookbackPolicy.FixedAnnualWindow(MonthDay.of(9, 30)));
    assertThat(config.taxRate()).isEqualByComparingTo("0.0635");
    assertThat(config.marketplaceLawEffectiveDate()).isEqualTo(LocalDate.of(2018, 12, 1));
  }

  @Test
  void load_convertsMonthlyRatesToAnnualRates() {
    var charges = loader.load().interestPenaltyConfig("TA").orElseThrow();

    assertThat(charges.annualInterestRate().value()).isEqualByComparingTo("0.12");
    assertThat(charges.interestMethod()).isEqualTo(InterestMethod.COMPOUND_MONTHLY);
    assertThat(charges.ratePeriods()).hasSize(1);
    assertThat(charges.ratePeriods().get(0).annualRate().value()).isEqualByComparingTo("0.06");
    assertThat(charges.ratePeriods().get(0).endDate()).isEqualTo(LocalDate.of(2023, 12, 31));
    assertThat(charges.penaltyMin()).isEqualByComparingTo("50");
    assertThat(charges.penaltyMax()).isEqualByComparingTo("5000");
    assertThat(charges.penaltyBase()).isEqualTo(PenaltyBase.TAX_PLUS_INTEREST);
    assertThat(charges.vdaInterestWaived()).isTrue();
    assertThat(charges.vdaPenaltiesWaived()).isTrue();
    assertThat(charges.vdaLookbackMonths()).isEqualTo(36);
  }

  @Test
  void load_appliesDefaultsForOmittedFields() {
    var lookup = loader.load();

    var rolling = lookup.jurisdictionConfig("TB").orElseThrow();
    assertThat(rolling.thresholdOperator()).isEqualTo(ThresholdOperator.OR);
    assertThat(rolling.lookbackPolicy()).isEqualTo(new LookbackPolicy.RollingWindow(365));
    assertThat(rolling.thresholdCount()).isNull();
    assertThat(lookup.interestPenaltyConfig("TB")).isEmpty();

    var quarters = lookup.jurisdictionConfig("TC").orElseThrow();
    assertThat(quarters.thresholdOperator()).isEqualTo(ThresholdOperator.OR);
    assertThat(quarters.lookbackPolicy()).isEqualTo(new LookbackPolicy.QuarterWindow(4));
    var charges = lookup.interestPenaltyConfig("TC").orElseThrow();
    assertThat(charges.penaltyRate()).isEqualByComparingTo("0.10");
    assertThat(charges.penaltyBase()).isEqualTo(PenaltyBase.TAX_ONLY);
    assertThat(charges.vdaLookbackMonths()).isEqualTo(48);
  }

  @Test
  void load_malformedJson_namesThePack() {
    assertThatThrownBy(() -> loader.load("classpath:malformed-jurisdiction-packs/*.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("broken.json");
  }

  @Test
  void load_unusableEntries_recordedAsInvalidWhileSiblingsLoad() {
    var lookup = loader.load("classpath:unknown-lookback-packs/*.json");

    assertThat(lookup.jurisdictionCodes()).containsExactly("GA");
    assertThat(lookup.invalidJurisdictionCodes()).containsExactlyInAnyOrder("XY", "XW");
    assertThat(lookup.invalidConfiguration("XY").orElseThrow())
        .contains("unknown.json")
        .contains("FISCAL_FORTNIGHT");
    assertThat(lookup.invalidConfiguration("XW").orElseThrow()).contains("days is required");
    assertThat(lookup.invalidConfiguration("GA")).isEmpty();
  }

  @Test
  void load_mapsPenaltyComponentsAndInterestMinimum() {
    var charges = loader.load().interestPenaltyConfig("TD").orElseThrow();

    assertThat(charges.interestMinimum()).isEqualByComparingTo("1.00");
    assertThat(charges.penaltyComponents())
        .extracting(PenaltyComponent::kind)
        .containsExactly(
            PenaltyKind.LATE_FILING,
            PenaltyKind.LATE_PAYMENT,
            PenaltyKind.NEGLIGENCE,
            PenaltyKind.LATE_REGISTRATION,
            PenaltyKind.EXTENDED_DELINQUENCY);
    assertThat(charges.penaltyComponents().get(0).rule())
        .isEqualTo(
            new PenaltyRule.PerPeriod(
                new BigDecimal("0.05"), null, new BigDecimal("0.25"), null));
    assertThat(charges.penaltyComponents().get(4).rule())
        .isInstanceOfSatisfying(
            PenaltyRule.Tiered.class,
            tiered -> {
              assertThat(tiered.tiers()).hasSize(2);
              assertThat(tiered.tiers().get(1).endDay()).isNull();
            });
    assertThat(charges.combinedPenaltyCap().appliesTo())
        .containsExactlyInAnyOrder(PenaltyKind.LATE_FILING, PenaltyKind.LATE_PAYMENT);
  }

  @Test
  void load_noPacksAtLocation_returnsEmptyLookup() {
    var lookup = loader.load("classpath:no-such-packs/*.json");

    assertThat(lookup.jurisdictionCodes()).isEmpty();
  }
}
