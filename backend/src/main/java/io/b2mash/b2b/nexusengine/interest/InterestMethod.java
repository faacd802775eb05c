package io.b2mash.b2b.nexusengine.interest;

import ch.obermuhlner.math.big.BigDecimalMath;
import java.math.BigDecimal;
import java.math.MathContext;

/** How interest accrues on unpaid tax. Results are unrounded. */
public enum InterestMethod {

  /** {@code principal * annualRate * days / 365.25}. */
  SIMPLE {
    @Override
    public BigDecimal accrue(BigDecimal principal, AnnualRate rate, long days) {
      BigDecimal years = BigDecimal.valueOf(days).divide(DAYS_PER_YEAR, MC);
      return principal.multiply(rate.value(), MC).multiply(years, MC);
    }
  },

  /** {@code principal * ((1 + annualRate / 12) ^ (days / 30.44) - 1)}. */
  COMPOUND_MONTHLY {
    @Override
    public BigDecimal accrue(BigDecimal principal, AnnualRate rate, long days) {
      MonthlyRate monthlyRate = rate.monthly();
      BigDecimal months = BigDecimal.valueOf(days).divide(DAYS_PER_MONTH, MC);
      BigDecimal factor = growthFactor(BigDecimal.ONE.add(monthlyRate.value()), months);
      return principal.multiply(factor.subtract(BigDecimal.ONE), MC);
    }
  },

  /** {@code principal * ((1 + annualRate / 365) ^ days - 1)}. */
  COMPOUND_DAILY {
    @Override
    public BigDecimal accrue(BigDecimal principal, AnnualRate rate, long days) {
      DailyRate dailyRate = rate.daily();
      BigDecimal factor = BigDecimal.ONE.add(dailyRate.value()).pow(Math.toIntExact(days), MC);
      return principal.multiply(factor.subtract(BigDecimal.ONE), MC);
    }
  };

  static final MathContext MC = MathContext.DECIMAL64;
  static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365.25");
  static final BigDecimal DAYS_PER_MONTH = new BigDecimal("30.44");

  /**
   * Interest accrued on {@code principal} over {@code days} days at {@code rate}.
   *
   * @param principal the unpaid tax
   * @param rate the annual rate
   * @param days elapsed days, positive
   */
  public abstract BigDecimal accrue(BigDecimal principal, AnnualRate rate, long days);

  /** {@code base ^ exponent} for a non-negative fractional exponent, in decimal arithmetic. */
  static BigDecimal growthFactor(BigDecimal base, BigDecimal exponent) {
    return BigDecimalMath.pow(base, exponent, MC);
  }
}
