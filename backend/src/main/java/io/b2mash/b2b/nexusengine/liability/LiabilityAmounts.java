package io.b2mash.b2b.nexusengine.liability;

import java.math.BigDecimal;

/**
 * Sales and base tax of one jurisdiction-year.
 *
 * @param totalSales all sales of the year, both channels, regardless of obligation
 * @param directSales direct-channel share of {@code totalSales}
 * @param marketplaceSales marketplace-channel share of {@code totalSales}
 * @param transactionCount number of sales in the year
 * @param taxableSales sales the seller is liable for, from the obligation start on
 * @param baseTax {@code taxableSales * taxRate}, rounded to cents
 */
public record LiabilityAmounts(
    BigDecimal totalSales,
    BigDecimal directSales,
    BigDecimal marketplaceSales,
    long transactionCount,
    BigDecimal taxableSales,
    BigDecimal baseTax) {}
