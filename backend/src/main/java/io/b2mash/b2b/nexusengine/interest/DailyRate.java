package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.util.Objects;

/** A daily interest rate as a fraction. */
public record DailyRate(BigDecimal value) {

  public DailyRate {
    Objects.requireNonNull(value, "value must not be null");
  }
}
