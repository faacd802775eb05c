package io.b2mash.b2b.nexusengine.interest;

import io.b2mash.b2b.nexusengine.money.Money;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interest and penalties on a base tax amount, both rounded to cents and never negative.
 *
 * @param interest accrued interest
 * @param penalties sum of {@code penaltyBreakdown}
 * @param daysOutstanding days between obligation start and calculation date, 0 if none
 * @param interestMethod the accrual method applied, null when nothing accrued
 * @param annualInterestRate the annual rate in force at the calculation date, null when nothing
 *     accrued
 * @param penaltyBreakdown each assessed penalty, in the order the jurisdiction lists them
 */
public record InterestPenaltyAmounts(
    BigDecimal interest,
    BigDecimal penalties,
    long daysOutstanding,
    InterestMethod interestMethod,
    AnnualRate annualInterestRate,
    Map<PenaltyKind, BigDecimal> penaltyBreakdown) {

  public InterestPenaltyAmounts {
    penaltyBreakdown =
        penaltyBreakdown == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(penaltyBreakdown));
  }

  public static InterestPenaltyAmounts none() {
    return new InterestPenaltyAmounts(Money.ZERO, Money.ZERO, 0, null, null, Map.of());
  }

  /** Same amounts with interest and/or penalties waived. */
  public InterestPenaltyAmounts waive(boolean interestWaived, boolean penaltiesWaived) {
    Map<PenaltyKind, BigDecimal> breakdown = penaltyBreakdown;
    if (penaltiesWaived) {
      var waived = new LinkedHashMap<PenaltyKind, BigDecimal>();
      penaltyBreakdown.keySet().forEach(kind -> waived.put(kind, Money.ZERO));
      breakdown = waived;
    }
    return new InterestPenaltyAmounts(
        interestWaived ? Money.ZERO : interest,
        penaltiesWaived ? Money.ZERO : penalties,
        daysOutstanding,
        interestMethod,
        annualInterestRate,
        breakdown);
  }
}
