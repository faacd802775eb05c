package io.b2mash.b2b.nexusengine.lookback;

import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import io.b2mash.b2b.nexusengine.transaction.WindowTotals;

/** Window totals observed right after {@code transaction} was included. */
public record WindowStep(TransactionRecord transaction, WindowTotals totals) {}
