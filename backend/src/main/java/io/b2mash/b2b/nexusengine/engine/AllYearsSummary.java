package io.b2mash.b2b.nexusengine.engine;

import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.money.Money;
import java.math.BigDecimal;
import java.util.List;

/**
 * Totals of one jurisdiction across all years. {@code interestMethod} is the method of the most
 * recent year with interest, for display only.
 */
public record AllYearsSummary(
    BigDecimal totalSales,
    BigDecimal taxableSales,
    BigDecimal baseTax,
    BigDecimal interest,
    BigDecimal penalties,
    BigDecimal totalLiability,
    InterestMethod interestMethod) {

  public static final AllYearsSummary EMPTY =
      new AllYearsSummary(
          Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO, null);

  public static AllYearsSummary of(List<NexusYearResult> years) {
    BigDecimal totalSales = Money.ZERO;
    BigDecimal taxableSales = Money.ZERO;
    BigDecimal baseTax = Money.ZERO;
    BigDecimal interest = Money.ZERO;
    BigDecimal penalties = Money.ZERO;
    BigDecimal totalLiability = Money.ZERO;
    InterestMethod interestMethod = null;
    for (NexusYearResult year : years) {
      totalSales = totalSales.add(year.totalSales());
      taxableSales = taxableSales.add(year.taxableSales());
      baseTax = baseTax.add(year.baseTax());
      interest = interest.add(year.interest());
      penalties = penalties.add(year.penalties());
      totalLiability = totalLiability.add(year.totalLiability());
      if (year.interestMethod() != null) {
        interestMethod = year.interestMethod();
      }
    }
    return new AllYearsSummary(
        totalSales, taxableSales, baseTax, interest, penalties, totalLiability, interestMethod);
  }
}
