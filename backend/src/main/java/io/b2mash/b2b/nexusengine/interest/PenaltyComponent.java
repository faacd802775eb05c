package io.b2mash.b2b.nexusengine.interest;

import java.util.Objects;

/** One penalty a jurisdiction assesses, with the rule that prices it. */
public record PenaltyComponent(PenaltyKind kind, PenaltyRule rule) {

  public PenaltyComponent {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(rule, "rule must not be null");
  }
}
