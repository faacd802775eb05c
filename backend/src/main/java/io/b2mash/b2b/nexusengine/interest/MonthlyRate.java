package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.util.Objects;

/** A monthly interest rate as a fraction (0.015 for 1.5% a month). */
public record MonthlyRate(BigDecimal value) {

  private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

  public MonthlyRate {
    Objects.requireNonNull(value, "value must not be null");
  }

  public static MonthlyRate of(String value) {
    return new MonthlyRate(new BigDecimal(value));
  }

  /** Some jurisdictions publish their rate per month; this is the equivalent annual rate. */
  public AnnualRate annualized() {
    return new AnnualRate(value.multiply(MONTHS_PER_YEAR));
  }
}
