package io.b2mash.b2b.nexusengine.vda;

import static io.b2mash.b2b.nexusengine.testutil.TestTransactions.direct;
import static io.b2mash.b2b.nexusengine.testutil.TestTransactions.revenueOnly;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.nexusengine.interest.AnnualRate;
import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyCalculator;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.interest.PenaltyBase;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.liability.LiabilityCalculator;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class VdaCalculatorTest {

  private static final LocalDate FILING_DATE = LocalDate.of(2024, 1, 1);

  private final VdaCalculator calculator =
      new VdaCalculator(new LiabilityCalculator(), new InterestPenaltyCalculator());

  private final JurisdictionConfig config =
      revenueOnly("WA", new LookbackPolicy.CurrentOrPreviousCalendarYear());

  @Test
  void calculate_yearBeforeLookback_owesNothing() {
    // lookback starts 2020-01-01, after every 2018 sale
    var result =
        calculator.calculate(
            2018,
            List.of(direct("t1", "2018-09-01", "WA", "10000.00")),
            LocalDate.of(2018, 7, 1),
            new BigDecimal("1000.00"),
            FILING_DATE,
            config,
            interestPenalty(false, true));

    assertThat(result.effectiveObligationStart()).isEqualTo(LocalDate.of(2020, 1, 1));
    assertThat(result.taxableSales()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(result.totalLiability()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(result.savings()).isEqualByComparingTo("1000.00");
  }

  @Test
  void calculate_penaltiesWaived_savesThePenalty() {
    // tax 600.00; interest 600 * 0.03 * 1095 / 365.25 = 53.96; penalty 60.00 waived
    var result =
        calculator.calculate(
            2021,
            List.of(direct("t1", "2021-03-01", "WA", "10000.00")),
            LocalDate.of(2021, 1, 1),
            new BigDecimal("713.96"),
            FILING_DATE,
            config,
            interestPenalty(false, true));

    assertThat(result.effectiveObligationStart()).isEqualTo(LocalDate.of(2021, 1, 1));
    assertThat(result.baseTax()).isEqualByComparingTo("600.00");
    assertThat(result.interest()).isEqualByComparingTo("53.96");
    assertThat(result.penalties()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(result.totalLiability()).isEqualByComparingTo("653.96");
    assertThat(result.savings()).isEqualByComparingTo("60.00");
    assertThat(result.penaltiesWaived()).isTrue();
    assertThat(result.interestWaived()).isFalse();
  }

  @Test
  void calculate_interestAndPenaltiesWaived_owesTaxOnly() {
    var result =
        calculator.calculate(
            2021,
            List.of(direct("t1", "2021-03-01", "WA", "10000.00")),
            LocalDate.of(2021, 1, 1),
            new BigDecimal("713.96"),
            FILING_DATE,
            config,
            interestPenalty(true, true));

    assertThat(result.totalLiability()).isEqualByComparingTo("600.00");
    assertThat(result.savings()).isEqualByComparingTo("113.96");
  }

  @Test
  void calculate_withoutNexus_owesNothing() {
    var result =
        calculator.calculate(
            2021,
            List.of(direct("t1", "2021-03-01", "WA", "10000.00")),
            null,
            BigDecimal.ZERO,
            FILING_DATE,
            config,
            interestPenalty(false, false));

    assertThat(result.effectiveObligationStart()).isNull();
    assertThat(result.totalLiability()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(result.savings()).isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void effectiveObligationStart_isLaterOfObligationAndLookbackStart() {
    assertThat(
            VdaCalculator.effectiveObligationStart(LocalDate.of(2018, 7, 1), FILING_DATE, 48))
        .isEqualTo(LocalDate.of(2020, 1, 1));
    assertThat(
            VdaCalculator.effectiveObligationStart(LocalDate.of(2022, 7, 1), FILING_DATE, 48))
        .isEqualTo(LocalDate.of(2022, 7, 1));
  }

  @Test
  void summary_sumsYearsAndSavings() {
    var years =
        List.of(
            new VdaYearResult(
                2020,
                LocalDate.of(2020, 1, 1),
                new BigDecimal("1000.00"),
                new BigDecimal("60.00"),
                new BigDecimal("5.00"),
                BigDecimal.ZERO,
                new BigDecimal("65.00"),
                false,
                true,
                new BigDecimal("71.00"),
                new BigDecimal("6.00")),
            new VdaYearResult(
                2021,
                LocalDate.of(2021, 1, 1),
                new BigDecimal("2000.00"),
                new BigDecimal("120.00"),
                new BigDecimal("4.00"),
                BigDecimal.ZERO,
                new BigDecimal("124.00"),
                false,
                true,
                new BigDecimal("136.00"),
                new BigDecimal("12.00")));

    var summary = VdaSummary.of(FILING_DATE, 48, years);

    assertThat(summary.totalLiability()).isEqualByComparingTo("189.00");
    assertThat(summary.standardTotalLiability()).isEqualByComparingTo("207.00");
    assertThat(summary.savings()).isEqualByComparingTo("18.00");
  }

  private static InterestPenaltyConfig interestPenalty(
      boolean interestWaived, boolean penaltiesWaived) {
    return new InterestPenaltyConfig(
        AnnualRate.of("0.03"),
        InterestMethod.SIMPLE,
        List.of(),
        new BigDecimal("0.10"),
        null,
        null,
        PenaltyBase.TAX_ONLY,
        interestWaived,
        penaltiesWaived,
        48);
  }
}
