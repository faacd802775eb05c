package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * An annual interest rate expressed as a fraction (0.03 for 3% a year). Kept distinct from
 * {@link MonthlyRate} and {@link DailyRate} so a rate cannot be applied in the wrong unit.
 */
public record AnnualRate(BigDecimal value) {

  private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
  private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

  public AnnualRate {
    Objects.requireNonNull(value, "value must not be null");
  }

  public static AnnualRate of(String value) {
    return new AnnualRate(new BigDecimal(value));
  }

  public MonthlyRate monthly() {
    return new MonthlyRate(value.divide(MONTHS_PER_YEAR, MathContext.DECIMAL64));
  }

  public DailyRate daily() {
    return new DailyRate(value.divide(DAYS_PER_YEAR, MathContext.DECIMAL64));
  }

  public boolean isZero() {
    return value.signum() == 0;
  }
}
