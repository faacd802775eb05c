package io.b2mash.b2b.nexusengine.lookback;

/** How a crossing found by a scan relates to the year under test. */
public enum ScanBasis {
  /** The crossing happens in the year under test; nexus starts at the crossing. */
  CURRENT_PERIOD,
  /** The crossing happened in an earlier period; nexus covers the whole year under test. */
  PRIOR_PERIOD
}
