package io.b2mash.b2b.nexusengine.vda;

import io.b2mash.b2b.nexusengine.money.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Voluntary disclosure totals of one jurisdiction across all years. */
public record VdaSummary(
    LocalDate filingDate,
    int lookbackMonths,
    BigDecimal baseTax,
    BigDecimal interest,
    BigDecimal penalties,
    BigDecimal totalLiability,
    BigDecimal standardTotalLiability,
    BigDecimal savings) {

  public static VdaSummary of(LocalDate filingDate, int lookbackMonths, List<VdaYearResult> years) {
    BigDecimal baseTax = Money.ZERO;
    BigDecimal interest = Money.ZERO;
    BigDecimal penalties = Money.ZERO;
    BigDecimal total = Money.ZERO;
    BigDecimal standard = Money.ZERO;
    for (VdaYearResult year : years) {
      baseTax = baseTax.add(year.baseTax());
      interest = interest.add(year.interest());
      penalties = penalties.add(year.penalties());
      total = total.add(year.totalLiability());
      standard = standard.add(year.standardTotalLiability());
    }
    return new VdaSummary(
        filingDate,
        lookbackMonths,
        baseTax,
        interest,
        penalties,
        total,
        standard,
        standard.subtract(total));
  }
}
