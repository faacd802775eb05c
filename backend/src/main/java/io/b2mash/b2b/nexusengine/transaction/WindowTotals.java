package io.b2mash.b2b.nexusengine.transaction;

import java.math.BigDecimal;

/** Qualifying revenue and transaction count of a lookback window. */
public record WindowTotals(BigDecimal revenue, long count) {

  public static final WindowTotals EMPTY = new WindowTotals(BigDecimal.ZERO, 0);
}
