package io.b2mash.b2b.nexusengine.threshold;

import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.lookback.LookbackScan;
import io.b2mash.b2b.nexusengine.lookback.WindowStep;
import io.b2mash.b2b.nexusengine.transaction.WindowTotals;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds the first transaction at which a jurisdiction's threshold condition holds. Stateless;
 * finding no crossing is a normal outcome.
 */
@Service
public class ThresholdCrossingDetector {

  private static final Logger log = LoggerFactory.getLogger(ThresholdCrossingDetector.class);

  /**
   * Walks the scans in precedence order and returns the first step that satisfies the threshold.
   * Later scans are only consulted when an earlier scan has no crossing.
   */
  public Optional<ThresholdCrossing> detect(List<LookbackScan> scans, JurisdictionConfig config) {
    for (LookbackScan scan : scans) {
      for (WindowStep step : scan) {
        if (isThresholdMet(step.totals(), config)) {
          var transaction = step.transaction();
          log.debug(
              "Threshold crossed: jurisdiction={}, transaction={}, date={}, revenue={}, count={},"
                  + " basis={}",
              config.jurisdictionCode(),
              transaction.transactionId(),
              transaction.date(),
              step.totals().revenue(),
              step.totals().count(),
              scan.basis());
          return Optional.of(
              new ThresholdCrossing(
                  transaction.date(), transaction.transactionId(), step.totals(), scan.basis()));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Tests window totals against the configured thresholds. An absent threshold never counts as
   * met under OR and is not required under AND; a config with no threshold at all is never met.
   */
  public boolean isThresholdMet(WindowTotals totals, JurisdictionConfig config) {
    boolean hasRevenueThreshold = config.thresholdAmount() != null;
    boolean hasCountThreshold = config.thresholdCount() != null;
    if (!hasRevenueThreshold && !hasCountThreshold) {
      return false;
    }
    boolean revenueMet =
        hasRevenueThreshold && totals.revenue().compareTo(config.thresholdAmount()) >= 0;
    boolean countMet = hasCountThreshold && totals.count() >= config.thresholdCount();

    return switch (config.thresholdOperator()) {
      case OR -> revenueMet || countMet;
      case AND -> (revenueMet || !hasRevenueThreshold) && (countMet || !hasCountThreshold);
    };
  }
}
