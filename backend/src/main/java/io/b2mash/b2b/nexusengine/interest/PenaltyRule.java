package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * How a single penalty is priced. Amounts returned by {@link #assess} are unrounded; the caller
 * rounds each penalty to cents.
 */
public sealed interface PenaltyRule {

  /**
   * @param penaltyBase the tax, or tax plus interest, the penalty is charged on
   * @param daysLate days between obligation start and calculation date, positive
   */
  BigDecimal assess(BigDecimal penaltyBase, long daysLate);

  /** A percentage of the base, raised to {@code minimum} and capped at {@code maximum}. */
  record Flat(BigDecimal rate, BigDecimal minimum, BigDecimal maximum) implements PenaltyRule {

    public Flat {
      Objects.requireNonNull(rate, "rate must not be null");
    }

    @Override
    public BigDecimal assess(BigDecimal penaltyBase, long daysLate) {
      return clamp(penaltyBase.multiply(rate), minimum, maximum);
    }
  }

  /** A fixed amount regardless of the base. */
  record FlatFee(BigDecimal amount) implements PenaltyRule {

    public FlatFee {
      Objects.requireNonNull(amount, "amount must not be null");
    }

    @Override
    public BigDecimal assess(BigDecimal penaltyBase, long daysLate) {
      return amount;
    }
  }

  /**
   * A rate charged per elapsed period, at least one period, with the accumulated rate capped at
   * {@code maxRate}.
   *
   * @param periodDays length of a period in days, or null for average calendar months
   * @param minimum smallest penalty charged, or null
   */
  record PerPeriod(
      BigDecimal ratePerPeriod, Integer periodDays, BigDecimal maxRate, BigDecimal minimum)
      implements PenaltyRule {

    public PerPeriod {
      Objects.requireNonNull(ratePerPeriod, "ratePerPeriod must not be null");
    }

    @Override
    public BigDecimal assess(BigDecimal penaltyBase, long daysLate) {
      BigDecimal totalRate = ratePerPeriod.multiply(BigDecimal.valueOf(periods(daysLate)));
      if (maxRate != null && totalRate.compareTo(maxRate) > 0) {
        totalRate = maxRate;
      }
      return clamp(penaltyBase.multiply(totalRate), minimum, null);
    }

    long periods(long daysLate) {
      long periods =
          periodDays == null
              ? BigDecimal.valueOf(daysLate)
                  .divide(InterestMethod.DAYS_PER_MONTH, 0, RoundingMode.DOWN)
                  .longValue()
              : daysLate / periodDays;
      return Math.max(1, periods);
    }
  }

  /** A fixed amount per day late, capped at {@code maximum}. */
  record PerDay(BigDecimal amountPerDay, BigDecimal maximum) implements PenaltyRule {

    public PerDay {
      Objects.requireNonNull(amountPerDay, "amountPerDay must not be null");
    }

    @Override
    public BigDecimal assess(BigDecimal penaltyBase, long daysLate) {
      return clamp(amountPerDay.multiply(BigDecimal.valueOf(daysLate)), null, maximum);
    }
  }

  /** The rate of the first tier whose day range contains the days late; zero when none does. */
  record Tiered(List<Tier> tiers) implements PenaltyRule {

    public Tiered {
      tiers = tiers == null ? List.of() : List.copyOf(tiers);
    }

    @Override
    public BigDecimal assess(BigDecimal penaltyBase, long daysLate) {
      for (Tier tier : tiers) {
        if (tier.contains(daysLate)) {
          return penaltyBase.multiply(tier.rate());
        }
      }
      return BigDecimal.ZERO;
    }
  }

  /**
   * @param startDay first day late the tier covers
   * @param endDay last day late the tier covers, inclusive, or null for open-ended
   */
  record Tier(long startDay, Long endDay, BigDecimal rate) {

    public Tier {
      Objects.requireNonNull(rate, "rate must not be null");
    }

    boolean contains(long daysLate) {
      return startDay <= daysLate && (endDay == null || daysLate <= endDay);
    }
  }

  private static BigDecimal clamp(BigDecimal amount, BigDecimal minimum, BigDecimal maximum) {
    BigDecimal clamped = amount;
    if (minimum != null && clamped.compareTo(minimum) < 0) {
      clamped = minimum;
    }
    if (maximum != null && clamped.compareTo(maximum) > 0) {
      clamped = maximum;
    }
    return clamped;
  }
}
