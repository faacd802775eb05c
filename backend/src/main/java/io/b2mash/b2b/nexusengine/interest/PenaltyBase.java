package io.b2mash.b2b.nexusengine.interest;

/** The amount a penalty rate is applied to. */
public enum PenaltyBase {
  TAX_ONLY,
  TAX_PLUS_INTEREST
}
