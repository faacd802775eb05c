package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Economic nexus rules and tax rate of one jurisdiction.
 *
 * @param jurisdictionCode the jurisdiction code, e.g. "CT"
 * @param thresholdAmount revenue threshold, or null when the jurisdiction has none
 * @param thresholdCount transaction-count threshold, or null when the jurisdiction has none
 * @param thresholdOperator how the two thresholds combine
 * @param lookbackPolicy the window examined when testing the thresholds
 * @param taxRate combined tax rate as a fraction (0.0635 for 6.35%)
 * @param marketplaceLawEffectiveDate date marketplace facilitators took over collection, or null
 */
public record JurisdictionConfig(
    String jurisdictionCode,
    BigDecimal thresholdAmount,
    Long thresholdCount,
    ThresholdOperator thresholdOperator,
    LookbackPolicy lookbackPolicy,
    BigDecimal taxRate,
    LocalDate marketplaceLawEffectiveDate) {

  public JurisdictionConfig {
    Objects.requireNonNull(jurisdictionCode, "jurisdictionCode must not be null");
    Objects.requireNonNull(thresholdOperator, "thresholdOperator must not be null");
    Objects.requireNonNull(lookbackPolicy, "lookbackPolicy must not be null");
    Objects.requireNonNull(taxRate, "taxRate must not be null");
  }

  /** Returns a copy of this config bound to another jurisdiction. */
  public JurisdictionConfig forJurisdiction(String code) {
    return new JurisdictionConfig(
        code,
        thresholdAmount,
        thresholdCount,
        thresholdOperator,
        lookbackPolicy,
        taxRate,
        marketplaceLawEffectiveDate);
  }
}
