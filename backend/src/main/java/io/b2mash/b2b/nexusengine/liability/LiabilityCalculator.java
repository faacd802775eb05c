package io.b2mash.b2b.nexusengine.liability;

import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.money.Money;
import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Stateless service computing the taxable base and base tax of a jurisdiction-year. */
@Service
public class LiabilityCalculator {

  private static final Logger log = LoggerFactory.getLogger(LiabilityCalculator.class);

  /**
   * Computes sales totals and base tax for one year.
   *
   * @param yearTransactions the jurisdiction's transactions dated in the year
   * @param obligationStart first date whose sales are taxable, or null when there is no nexus
   * @param config the jurisdiction's rate and marketplace facilitator law date
   * @return the year's amounts; taxable sales and base tax are zero without an obligation
   */
  public LiabilityAmounts calculate(
      List<TransactionRecord> yearTransactions,
      LocalDate obligationStart,
      JurisdictionConfig config) {
    BigDecimal directSales = BigDecimal.ZERO;
    BigDecimal marketplaceSales = BigDecimal.ZERO;
    BigDecimal taxableSales = BigDecimal.ZERO;

    for (TransactionRecord transaction : yearTransactions) {
      if (transaction.isMarketplace()) {
        marketplaceSales = marketplaceSales.add(transaction.amount());
      } else {
        directSales = directSales.add(transaction.amount());
      }
      if (isTaxable(transaction, obligationStart, config.marketplaceLawEffectiveDate())) {
        taxableSales = taxableSales.add(transaction.amount());
      }
    }

    BigDecimal baseTax = calculateBaseTax(taxableSales, config.taxRate());
    log.debug(
        "Liability: jurisdiction={}, obligationStart={}, direct={}, marketplace={}, taxable={},"
            + " baseTax={}",
        config.jurisdictionCode(),
        obligationStart,
        directSales,
        marketplaceSales,
        taxableSales,
        baseTax);

    return new LiabilityAmounts(
        Money.round(directSales.add(marketplaceSales)),
        Money.round(directSales),
        Money.round(marketplaceSales),
        yearTransactions.size(),
        Money.round(taxableSales),
        baseTax);
  }

  /**
   * Calculates the tax on a taxable amount.
   *
   * @param taxableSales the taxable sales
   * @param taxRate the rate as a fraction (e.g. 0.0625)
   * @return the tax, scale 2, HALF_UP rounding
   */
  public BigDecimal calculateBaseTax(BigDecimal taxableSales, BigDecimal taxRate) {
    return Money.round(taxableSales.multiply(taxRate));
  }

  /**
   * A sale counts toward liability from the obligation start on. Marketplace sales only count
   * before the marketplace facilitator law took effect; from then on the platform collects.
   */
  static boolean isTaxable(
      TransactionRecord transaction, LocalDate obligationStart, LocalDate marketplaceLawDate) {
    if (obligationStart == null || transaction.date().isBefore(obligationStart)) {
      return false;
    }
    if (!transaction.isMarketplace()) {
      return true;
    }
    return marketplaceLawDate == null || transaction.date().isBefore(marketplaceLawDate);
  }
}
