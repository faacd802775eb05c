package io.b2mash.b2b.nexusengine.money;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Currency rounding shared by the calculators: 2 decimals, HALF_UP. */
public final class Money {

  public static final int SCALE = 2;
  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

  private Money() {}

  public static BigDecimal round(BigDecimal amount) {
    return amount.setScale(SCALE, RoundingMode.HALF_UP);
  }
}
