package io.b2mash.b2b.nexusengine.jurisdiction;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO record for deserializing jurisdiction pack JSON files from the classpath. Dates are ISO
 * strings ({@code 2019-10-01}); a fixed window period end is a month-day ({@code --09-30}).
 */
public record JurisdictionPackDefinition(
    String packId, String version, List<JurisdictionEntry> jurisdictions) {

  public record JurisdictionEntry(
      String code,
      BigDecimal thresholdAmount,
      Long thresholdCount,
      String thresholdOperator,
      LookbackEntry lookback,
      BigDecimal taxRate,
      String marketplaceLawEffectiveDate,
      InterestEntry interest) {}

  /**
   * @param type one of PREVIOUS_CALENDAR_YEAR, CURRENT_OR_PREVIOUS_CALENDAR_YEAR, ROLLING_WINDOW,
   *     QUARTER_WINDOW, FIXED_ANNUAL_WINDOW
   */
  public record LookbackEntry(String type, Integer days, Integer quarters, String periodEnd) {}

  /** Exactly one of {@code annualRate} and {@code monthlyRate} is expected. */
  public record InterestEntry(
      BigDecimal annualRate,
      BigDecimal monthlyRate,
      String method,
      List<RatePeriodEntry> ratePeriods,
      BigDecimal penaltyRate,
      BigDecimal penaltyMin,
      BigDecimal penaltyMax,
      String penaltyBase,
      Boolean vdaInterestWaived,
      Boolean vdaPenaltiesWaived,
      Integer vdaLookbackMonths,
      BigDecimal interestMinimum,
      List<PenaltyEntry> penalties,
      CombinedCapEntry combinedPenaltyCap) {}

  public record RatePeriodEntry(
      String startDate, String endDate, BigDecimal annualRate, BigDecimal monthlyRate) {}

  /**
   * @param kind one of LATE_FILING, LATE_PAYMENT, NEGLIGENCE, LATE_REGISTRATION,
   *     EXTENDED_DELINQUENCY
   * @param type one of FLAT, FLAT_FEE, PER_PERIOD, PER_DAY, TIERED; the other fields are read
   *     according to it
   */
  public record PenaltyEntry(
      String kind,
      String type,
      BigDecimal rate,
      BigDecimal minimum,
      BigDecimal maximum,
      BigDecimal amount,
      BigDecimal ratePerPeriod,
      Integer periodDays,
      BigDecimal maxRate,
      BigDecimal amountPerDay,
      List<TierEntry> tiers) {}

  public record TierEntry(Long startDay, Long endDay, BigDecimal rate) {}

  public record CombinedCapEntry(BigDecimal maxRate, List<String> appliesTo) {}
}
