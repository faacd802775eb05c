package io.b2mash.b2b.nexusengine.interest;

/** The separately assessed penalties a jurisdiction may charge on unpaid tax. */
public enum PenaltyKind {
  LATE_FILING,
  LATE_PAYMENT,
  NEGLIGENCE,
  LATE_REGISTRATION,
  EXTENDED_DELINQUENCY
}
