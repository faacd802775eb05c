package io.b2mash.b2b.nexusengine.jurisdiction;

/** How the revenue and transaction-count thresholds of a jurisdiction combine. */
public enum ThresholdOperator {
  /** Every configured threshold must be met on the same transaction. */
  AND,
  /** Any configured threshold suffices. */
  OR
}
