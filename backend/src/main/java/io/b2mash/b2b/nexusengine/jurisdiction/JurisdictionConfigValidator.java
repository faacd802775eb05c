package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.interest.InterestRatePeriod;
import io.b2mash.b2b.nexusengine.interest.PenaltyComponent;
import io.b2mash.b2b.nexusengine.interest.PenaltyKind;
import io.b2mash.b2b.nexusengine.interest.PenaltyRule;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Rejects reference data the calculators cannot use. */
@Component
public class JurisdictionConfigValidator {

  public void validate(JurisdictionConfig config) {
    String code = config.jurisdictionCode();
    if (code.isBlank()) {
      throw new InvalidConfigurationException(code, "jurisdiction code is blank");
    }
    if (config.thresholdAmount() != null && config.thresholdAmount().signum() <= 0) {
      throw new InvalidConfigurationException(code, "threshold amount must be positive");
    }
    if (config.thresholdCount() != null && config.thresholdCount() <= 0) {
      throw new InvalidConfigurationException(code, "threshold count must be positive");
    }
    if (config.taxRate().signum() < 0 || config.taxRate().compareTo(BigDecimal.ONE) > 0) {
      throw new InvalidConfigurationException(code, "tax rate must be between 0 and 1");
    }
    validateLookback(code, config.lookbackPolicy());
  }

  public void validate(String code, InterestPenaltyConfig config) {
    if (config.annualInterestRate().value().signum() < 0) {
      throw new InvalidConfigurationException(code, "interest rate must not be negative");
    }
    requireNonNegative(code, config.interestMinimum(), "interest minimum");
    if (config.vdaLookbackMonths() < 0) {
      throw new InvalidConfigurationException(code, "VDA lookback months must not be negative");
    }
    validateRatePeriods(code, config.ratePeriods());
    for (PenaltyComponent component : config.effectivePenaltyComponents()) {
      validatePenaltyRule(code, component.kind(), component.rule());
    }
    if (config.combinedPenaltyCap() != null) {
      requireNonNegative(code, config.combinedPenaltyCap().maxRate(), "combined penalty cap");
    }
  }

  private static void validatePenaltyRule(String code, PenaltyKind kind, PenaltyRule rule) {
    String name = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ') + " penalty";
    if (rule instanceof PenaltyRule.Flat flat) {
      requireNonNegative(code, flat.rate(), name + " rate");
      requireBounds(code, name, flat.minimum(), flat.maximum());
    } else if (rule instanceof PenaltyRule.FlatFee fee) {
      requireNonNegative(code, fee.amount(), name + " amount");
    } else if (rule instanceof PenaltyRule.PerPeriod perPeriod) {
      requireNonNegative(code, perPeriod.ratePerPeriod(), name + " rate per period");
      requireNonNegative(code, perPeriod.maxRate(), name + " maximum rate");
      requireNonNegative(code, perPeriod.minimum(), name + " minimum");
      if (perPeriod.periodDays() != null && perPeriod.periodDays() <= 0) {
        throw new InvalidConfigurationException(code, name + " period days must be positive");
      }
    } else if (rule instanceof PenaltyRule.PerDay perDay) {
      requireNonNegative(code, perDay.amountPerDay(), name + " amount per day");
      requireNonNegative(code, perDay.maximum(), name + " maximum");
    } else if (rule instanceof PenaltyRule.Tiered tiered) {
      for (PenaltyRule.Tier tier : tiered.tiers()) {
        requireNonNegative(code, tier.rate(), name + " tier rate");
        if (tier.endDay() != null && tier.endDay() < tier.startDay()) {
          throw new InvalidConfigurationException(
              code, name + " tier starting on day " + tier.startDay() + " ends before it starts");
        }
      }
    }
  }

  private static void requireBounds(
      String code, String name, BigDecimal minimum, BigDecimal maximum) {
    requireNonNegative(code, minimum, name + " minimum");
    requireNonNegative(code, maximum, name + " maximum");
    if (minimum != null && maximum != null && minimum.compareTo(maximum) > 0) {
      throw new InvalidConfigurationException(
          code, name + " minimum " + minimum + " exceeds maximum " + maximum);
    }
  }

  private static void requireNonNegative(String code, BigDecimal value, String name) {
    if (value != null && value.signum() < 0) {
      throw new InvalidConfigurationException(code, name + " must not be negative");
    }
  }

  private static void validateLookback(String code, LookbackPolicy policy) {
    if (policy instanceof LookbackPolicy.RollingWindow rolling && rolling.days() <= 0) {
      throw new InvalidConfigurationException(code, "rolling window days must be positive");
    }
    if (policy instanceof LookbackPolicy.QuarterWindow quarters && quarters.quarters() <= 0) {
      throw new InvalidConfigurationException(code, "quarter window quarters must be positive");
    }
  }

  private static void validateRatePeriods(String code, List<InterestRatePeriod> periods) {
    List<InterestRatePeriod> sorted =
        periods.stream().sorted(Comparator.comparing(InterestRatePeriod::startDate)).toList();
    InterestRatePeriod previous = null;
    for (InterestRatePeriod period : sorted) {
      if (period.endDate().isBefore(period.startDate())) {
        throw new InvalidConfigurationException(
            code, "rate period " + period.startDate() + " ends before it starts");
      }
      if (period.annualRate().value().signum() < 0) {
        throw new InvalidConfigurationException(code, "rate period rate must not be negative");
      }
      if (previous != null && !period.startDate().isAfter(previous.endDate())) {
        throw new InvalidConfigurationException(
            code, "rate periods overlap at " + period.startDate());
      }
      previous = period;
    }
  }
}
