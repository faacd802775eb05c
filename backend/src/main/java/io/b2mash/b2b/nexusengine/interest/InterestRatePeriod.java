package io.b2mash.b2b.nexusengine.interest;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A statutory interest rate in force between two dates, both inclusive. Used by jurisdictions
 * that change their rate during the year.
 */
public record InterestRatePeriod(LocalDate startDate, LocalDate endDate, AnnualRate annualRate) {

  public InterestRatePeriod {
    Objects.requireNonNull(startDate, "startDate must not be null");
    Objects.requireNonNull(endDate, "endDate must not be null");
    Objects.requireNonNull(annualRate, "annualRate must not be null");
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(startDate) && !date.isAfter(endDate);
  }
}
