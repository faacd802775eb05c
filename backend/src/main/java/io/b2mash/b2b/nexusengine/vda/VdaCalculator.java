package io.b2mash.b2b.nexusengine.vda;

import io.b2mash.b2b.nexusengine.interest.InterestPenaltyAmounts;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyCalculator;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.liability.LiabilityAmounts;
import io.b2mash.b2b.nexusengine.liability.LiabilityCalculator;
import io.b2mash.b2b.nexusengine.money.Money;
import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recomputes a year's liability as a voluntary disclosure would assess it: only sales within
 * the disclosure lookback count, interest runs to the filing date, and the jurisdiction's
 * waivers apply.
 */
@Service
public class VdaCalculator {

  private static final Logger log = LoggerFactory.getLogger(VdaCalculator.class);

  private final LiabilityCalculator liabilityCalculator;
  private final InterestPenaltyCalculator interestPenaltyCalculator;

  public VdaCalculator(
      LiabilityCalculator liabilityCalculator,
      InterestPenaltyCalculator interestPenaltyCalculator) {
    this.liabilityCalculator = liabilityCalculator;
    this.interestPenaltyCalculator = interestPenaltyCalculator;
  }

  /**
   * @param year the calendar year
   * @param yearTransactions the jurisdiction's transactions dated in the year
   * @param obligationStart the year's standard obligation start, null without nexus
   * @param standardTotalLiability the year's liability without a disclosure
   * @param filingDate date the disclosure is filed
   * @param config the jurisdiction's rate and marketplace rules
   * @param interestPenaltyConfig the jurisdiction's interest, penalty and disclosure rules
   */
  public VdaYearResult calculate(
      int year,
      List<TransactionRecord> yearTransactions,
      LocalDate obligationStart,
      BigDecimal standardTotalLiability,
      LocalDate filingDate,
      JurisdictionConfig config,
      InterestPenaltyConfig interestPenaltyConfig) {
    LocalDate effectiveStart =
        effectiveObligationStart(
            obligationStart, filingDate, interestPenaltyConfig.vdaLookbackMonths());

    LiabilityAmounts liability =
        liabilityCalculator.calculate(yearTransactions, effectiveStart, config);
    InterestPenaltyAmounts charges =
        interestPenaltyCalculator
            .calculate(liability.baseTax(), effectiveStart, filingDate, interestPenaltyConfig)
            .waive(
                interestPenaltyConfig.vdaInterestWaived(),
                interestPenaltyConfig.vdaPenaltiesWaived());

    BigDecimal total = liability.baseTax().add(charges.interest()).add(charges.penalties());
    BigDecimal savings = standardTotalLiability.subtract(total);
    log.debug(
        "VDA: jurisdiction={}, year={}, effectiveStart={}, total={}, savings={}",
        config.jurisdictionCode(),
        year,
        effectiveStart,
        total,
        savings);

    return new VdaYearResult(
        year,
        effectiveStart,
        liability.taxableSales(),
        liability.baseTax(),
        charges.interest(),
        charges.penalties(),
        Money.round(total),
        interestPenaltyConfig.vdaInterestWaived(),
        interestPenaltyConfig.vdaPenaltiesWaived(),
        standardTotalLiability,
        Money.round(savings));
  }

  /** The later of the standard obligation start and the start of the disclosure lookback. */
  static LocalDate effectiveObligationStart(
      LocalDate obligationStart, LocalDate filingDate, int lookbackMonths) {
    if (obligationStart == null) {
      return null;
    }
    LocalDate lookbackStart = filingDate.minusMonths(lookbackMonths);
    return lookbackStart.isAfter(obligationStart) ? lookbackStart : obligationStart;
  }
}
