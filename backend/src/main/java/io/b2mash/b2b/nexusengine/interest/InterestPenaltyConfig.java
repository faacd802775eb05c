package io.b2mash.b2b.nexusengine.interest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Interest, penalty and voluntary disclosure rules of one jurisdiction.
 *
 * <p>A jurisdiction either lists its penalties as {@code penaltyComponents}, or charges the single
 * percentage penalty described by {@code penaltyRate}, {@code penaltyMin} and {@code penaltyMax},
 * which is reported as {@link PenaltyKind#LATE_PAYMENT}.
 *
 * @param annualInterestRate the annual interest rate, used when no rate periods are configured
 * @param interestMethod how interest accrues
 * @param ratePeriods dated rates replacing {@code annualInterestRate}; empty when the rate is
 *     constant
 * @param penaltyRate penalty as a fraction of the penalty base
 * @param penaltyMin minimum penalty, or null
 * @param penaltyMax maximum penalty, or null
 * @param penaltyBase what the penalty rate applies to
 * @param vdaInterestWaived whether a voluntary disclosure waives interest
 * @param vdaPenaltiesWaived whether a voluntary disclosure waives penalties
 * @param vdaLookbackMonths how far back a voluntary disclosure assesses liability
 * @param interestMinimum smallest interest charged once any interest accrues, or null
 * @param penaltyComponents separately assessed penalties; empty for the single percentage penalty
 * @param combinedPenaltyCap limit on the sum of several components, or null
 */
public record InterestPenaltyConfig(
    AnnualRate annualInterestRate,
    InterestMethod interestMethod,
    List<InterestRatePeriod> ratePeriods,
    BigDecimal penaltyRate,
    BigDecimal penaltyMin,
    BigDecimal penaltyMax,
    PenaltyBase penaltyBase,
    boolean vdaInterestWaived,
    boolean vdaPenaltiesWaived,
    int vdaLookbackMonths,
    BigDecimal interestMinimum,
    List<PenaltyComponent> penaltyComponents,
    CombinedPenaltyCap combinedPenaltyCap) {

  public InterestPenaltyConfig {
    Objects.requireNonNull(annualInterestRate, "annualInterestRate must not be null");
    Objects.requireNonNull(interestMethod, "interestMethod must not be null");
    Objects.requireNonNull(penaltyRate, "penaltyRate must not be null");
    Objects.requireNonNull(penaltyBase, "penaltyBase must not be null");
    ratePeriods = ratePeriods == null ? List.of() : List.copyOf(ratePeriods);
    penaltyComponents = penaltyComponents == null ? List.of() : List.copyOf(penaltyComponents);
  }

  /** Rules with the single percentage penalty and no interest minimum. */
  public InterestPenaltyConfig(
      AnnualRate annualInterestRate,
      InterestMethod interestMethod,
      List<InterestRatePeriod> ratePeriods,
      BigDecimal penaltyRate,
      BigDecimal penaltyMin,
      BigDecimal penaltyMax,
      PenaltyBase penaltyBase,
      boolean vdaInterestWaived,
      boolean vdaPenaltiesWaived,
      int vdaLookbackMonths) {
    this(
        annualInterestRate,
        interestMethod,
        ratePeriods,
        penaltyRate,
        penaltyMin,
        penaltyMax,
        penaltyBase,
        vdaInterestWaived,
        vdaPenaltiesWaived,
        vdaLookbackMonths,
        null,
        List.of(),
        null);
  }

  public boolean hasRatePeriods() {
    return !ratePeriods.isEmpty();
  }

  /** The penalties to assess, in reporting order. */
  public List<PenaltyComponent> effectivePenaltyComponents() {
    if (!penaltyComponents.isEmpty()) {
      return penaltyComponents;
    }
    return List.of(
        new PenaltyComponent(
            PenaltyKind.LATE_PAYMENT, new PenaltyRule.Flat(penaltyRate, penaltyMin, penaltyMax)));
  }
}
