package io.b2mash.b2b.nexusengine.engine;

/** How far a jurisdiction's result can be relied on. */
public enum Confidence {
  /** Computed from the jurisdiction's own reference data. */
  FULL,
  /** Computed, but with default rules substituted for missing reference data. */
  DEGRADED,
  /** Not computed; see the result's notes. */
  FAILED
}
