package io.b2mash.b2b.nexusengine.threshold;

import io.b2mash.b2b.nexusengine.lookback.ScanBasis;
import io.b2mash.b2b.nexusengine.transaction.WindowTotals;
import java.time.LocalDate;

/**
 * The transaction at which a jurisdiction's threshold condition first became true.
 *
 * @param nexusDate date of the crossing transaction
 * @param crossingTransactionId id of the crossing transaction
 * @param windowTotals qualifying totals of the window right after the crossing transaction
 * @param basis whether the crossing falls in the year under test or an earlier period
 */
public record ThresholdCrossing(
    LocalDate nexusDate,
    String crossingTransactionId,
    WindowTotals windowTotals,
    ScanBasis basis) {}
