package io.b2mash.b2b.nexusengine.engine;

import io.b2mash.b2b.nexusengine.interest.AnnualRate;
import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyAmounts;
import io.b2mash.b2b.nexusengine.interest.PenaltyKind;
import io.b2mash.b2b.nexusengine.liability.LiabilityAmounts;
import io.b2mash.b2b.nexusengine.money.Money;
import io.b2mash.b2b.nexusengine.nexus.NexusType;
import io.b2mash.b2b.nexusengine.nexus.NexusYearDetermination;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/** Nexus status and liability of one jurisdiction for one calendar year. */
public record NexusYearResult(
    int year,
    NexusType nexusType,
    LocalDate nexusDate,
    LocalDate obligationStartDate,
    Integer firstNexusYear,
    String crossingTransactionId,
    BigDecimal totalSales,
    BigDecimal directSales,
    BigDecimal marketplaceSales,
    long transactionCount,
    BigDecimal taxableSales,
    BigDecimal baseTax,
    BigDecimal interest,
    BigDecimal penalties,
    Map<PenaltyKind, BigDecimal> penaltyBreakdown,
    BigDecimal totalLiability,
    InterestMethod interestMethod,
    AnnualRate annualInterestRate,
    long daysOutstanding) {

  static NexusYearResult of(
      NexusYearDetermination determination,
      LiabilityAmounts liability,
      InterestPenaltyAmounts charges) {
    return new NexusYearResult(
        determination.year(),
        determination.nexusType(),
        determination.nexusDate(),
        determination.obligationStartDate(),
        determination.firstNexusYear(),
        determination.crossing() == null ? null : determination.crossing().crossingTransactionId(),
        liability.totalSales(),
        liability.directSales(),
        liability.marketplaceSales(),
        liability.transactionCount(),
        liability.taxableSales(),
        liability.baseTax(),
        charges.interest(),
        charges.penalties(),
        charges.penaltyBreakdown(),
        Money.round(liability.baseTax().add(charges.interest()).add(charges.penalties())),
        charges.interestMethod(),
        charges.annualInterestRate(),
        charges.daysOutstanding());
  }

  public boolean hasNexus() {
    return nexusType.hasNexus();
  }
}
