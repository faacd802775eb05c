package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * Caps the sum of several penalties at a fraction of the penalty base. When the cap binds, each
 * capped penalty is reduced in proportion to its share of the sum.
 *
 * @param maxRate the combined maximum as a fraction of the penalty base
 * @param appliesTo the penalties the cap covers
 */
public record CombinedPenaltyCap(BigDecimal maxRate, Set<PenaltyKind> appliesTo) {

  public CombinedPenaltyCap {
    Objects.requireNonNull(maxRate, "maxRate must not be null");
    appliesTo = appliesTo == null ? Set.of() : Set.copyOf(appliesTo);
  }
}
