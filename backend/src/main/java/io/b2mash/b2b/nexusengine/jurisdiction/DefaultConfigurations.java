package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.interest.AnnualRate;
import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.interest.PenaltyBase;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Conservative rules substituted when a jurisdiction has no reference data on file. Results
 * computed with them are reported with degraded confidence.
 */
public final class DefaultConfigurations {

  public static final BigDecimal STANDARD_THRESHOLD_AMOUNT = new BigDecimal("100000");
  public static final long STANDARD_THRESHOLD_COUNT = 200;
  public static final BigDecimal STANDARD_TAX_RATE = new BigDecimal("0.06");
  public static final AnnualRate STANDARD_INTEREST_RATE = AnnualRate.of("0.03");
  public static final BigDecimal STANDARD_PENALTY_RATE = new BigDecimal("0.10");
  public static final int STANDARD_VDA_LOOKBACK_MONTHS = 48;

  private final JurisdictionConfig jurisdictionTemplate;
  private final InterestPenaltyConfig interestPenaltyConfig;

  public DefaultConfigurations(
      JurisdictionConfig jurisdictionTemplate, InterestPenaltyConfig interestPenaltyConfig) {
    this.jurisdictionTemplate =
        Objects.requireNonNull(jurisdictionTemplate, "jurisdictionTemplate must not be null");
    this.interestPenaltyConfig =
        Objects.requireNonNull(interestPenaltyConfig, "interestPenaltyConfig must not be null");
  }

  /**
   * $100,000 or 200 transactions in the current or previous calendar year, 6% tax; 3% simple
   * interest, 10% penalty on tax only without bounds, no disclosure waivers, 48-month
   * disclosure lookback.
   */
  public static DefaultConfigurations standard() {
    return new DefaultConfigurations(standardJurisdiction(), standardInterestPenalty());
  }

  public static JurisdictionConfig standardJurisdiction() {
    return new JurisdictionConfig(
        "DEFAULT",
        STANDARD_THRESHOLD_AMOUNT,
        STANDARD_THRESHOLD_COUNT,
        ThresholdOperator.OR,
        new LookbackPolicy.CurrentOrPreviousCalendarYear(),
        STANDARD_TAX_RATE,
        null);
  }

  public static InterestPenaltyConfig standardInterestPenalty() {
    return new InterestPenaltyConfig(
        STANDARD_INTEREST_RATE,
        InterestMethod.SIMPLE,
        List.of(),
        STANDARD_PENALTY_RATE,
        null,
        null,
        PenaltyBase.TAX_ONLY,
        false,
        false,
        STANDARD_VDA_LOOKBACK_MONTHS);
  }

  public JurisdictionConfig jurisdictionConfig(String jurisdictionCode) {
    return jurisdictionTemplate.forJurisdiction(jurisdictionCode);
  }

  public InterestPenaltyConfig interestPenaltyConfig() {
    return interestPenaltyConfig;
  }
}
