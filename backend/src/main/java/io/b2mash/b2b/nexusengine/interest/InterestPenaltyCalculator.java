package io.b2mash.b2b.nexusengine.interest;

import io.b2mash.b2b.nexusengine.money.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateless service computing interest and penalties on unpaid base tax.
 *
 * <p>Interest is rounded to cents before it feeds a {@link PenaltyBase#TAX_PLUS_INTEREST}
 * penalty base. Each penalty is assessed by its own rule, the combined cap is applied, and each is
 * then rounded; the penalty total is the sum of the rounded penalties.
 */
@Service
public class InterestPenaltyCalculator {

  private static final Logger log = LoggerFactory.getLogger(InterestPenaltyCalculator.class);

  /**
   * Computes interest and penalties on {@code baseTax} owed since {@code obligationStart}.
   *
   * @param baseTax the unpaid tax
   * @param obligationStart date the tax started accruing, null without obligation
   * @param calculationDate date interest is computed to
   * @param config the jurisdiction's interest and penalty rules
   * @return zero amounts when there is no tax or no elapsed time
   */
  public InterestPenaltyAmounts calculate(
      BigDecimal baseTax,
      LocalDate obligationStart,
      LocalDate calculationDate,
      InterestPenaltyConfig config) {
    if (obligationStart == null || baseTax.signum() <= 0) {
      return InterestPenaltyAmounts.none();
    }
    long days = ChronoUnit.DAYS.between(obligationStart, calculationDate);
    if (days <= 0) {
      return InterestPenaltyAmounts.none();
    }

    BigDecimal interest =
        Money.round(accrueInterest(baseTax, obligationStart, calculationDate, config));
    Map<PenaltyKind, BigDecimal> penaltyBreakdown =
        calculatePenalties(baseTax, interest, days, config);
    BigDecimal penalties =
        penaltyBreakdown.values().stream().reduce(Money.ZERO, BigDecimal::add);

    log.debug(
        "Interest: baseTax={}, from={}, to={}, days={}, method={}, interest={}, penalties={}",
        baseTax,
        obligationStart,
        calculationDate,
        days,
        config.interestMethod(),
        interest,
        penaltyBreakdown);

    return new InterestPenaltyAmounts(
        interest,
        penalties,
        days,
        config.interestMethod(),
        rateInForce(calculationDate, config),
        penaltyBreakdown);
  }

  /**
   * Assesses each configured penalty on the configured base, applies the combined cap and rounds
   * each penalty to cents.
   *
   * @param baseTax the unpaid tax
   * @param interest interest already rounded to cents
   * @param daysLate days the tax has been outstanding
   * @param config the jurisdiction's penalty rules
   * @return penalties by kind, in the order the jurisdiction lists them; empty without tax
   */
  public Map<PenaltyKind, BigDecimal> calculatePenalties(
      BigDecimal baseTax, BigDecimal interest, long daysLate, InterestPenaltyConfig config) {
    if (baseTax.signum() <= 0 || daysLate <= 0) {
      return Map.of();
    }
    BigDecimal base =
        config.penaltyBase() == PenaltyBase.TAX_PLUS_INTEREST ? baseTax.add(interest) : baseTax;
    var assessed = new LinkedHashMap<PenaltyKind, BigDecimal>();
    for (PenaltyComponent component : config.effectivePenaltyComponents()) {
      assessed.merge(component.kind(), component.rule().assess(base, daysLate), BigDecimal::add);
    }
    if (config.combinedPenaltyCap() != null) {
      applyCombinedCap(assessed, base, config.combinedPenaltyCap());
    }
    assessed.replaceAll((kind, amount) -> Money.round(amount));
    return assessed;
  }

  private BigDecimal accrueInterest(
      BigDecimal baseTax, LocalDate from, LocalDate to, InterestPenaltyConfig config) {
    BigDecimal interest =
        config.hasRatePeriods()
            ? accrueOverPeriods(baseTax, from, to, config)
            : config
                .interestMethod()
                .accrue(baseTax, config.annualInterestRate(), ChronoUnit.DAYS.between(from, to));
    BigDecimal minimum = config.interestMinimum();
    if (minimum != null && interest.signum() > 0 && interest.compareTo(minimum) < 0) {
      return minimum;
    }
    return interest;
  }

  /** Scales the capped penalties down in proportion so their sum equals the cap. */
  private static void applyCombinedCap(
      Map<PenaltyKind, BigDecimal> assessed, BigDecimal base, CombinedPenaltyCap cap) {
    BigDecimal combined = BigDecimal.ZERO;
    for (PenaltyKind kind : cap.appliesTo()) {
      combined = combined.add(assessed.getOrDefault(kind, BigDecimal.ZERO));
    }
    BigDecimal limit = base.multiply(cap.maxRate());
    if (combined.compareTo(limit) <= 0) {
      return;
    }
    BigDecimal scale = limit.divide(combined, InterestMethod.MC);
    for (PenaltyKind kind : cap.appliesTo()) {
      assessed.computeIfPresent(kind, (k, amount) -> amount.multiply(scale, InterestMethod.MC));
    }
    log.debug("Combined penalty cap applied: combined={}, limit={}", combined, limit);
  }

  /**
   * Sums interest over each rate period's overlap with {@code [from, to)}. Days no period covers
   * accrue at the config's base annual rate.
   */
  private BigDecimal accrueOverPeriods(
      BigDecimal baseTax, LocalDate from, LocalDate to, InterestPenaltyConfig config) {
    InterestMethod method = config.interestMethod();
    BigDecimal total = BigDecimal.ZERO;
    long coveredDays = 0;
    for (InterestRatePeriod period : config.ratePeriods()) {
      LocalDate overlapStart = period.startDate().isAfter(from) ? period.startDate() : from;
      LocalDate periodEndExclusive = period.endDate().plusDays(1);
      LocalDate overlapEnd = periodEndExclusive.isBefore(to) ? periodEndExclusive : to;
      long days = ChronoUnit.DAYS.between(overlapStart, overlapEnd);
      if (days > 0) {
        total = total.add(method.accrue(baseTax, period.annualRate(), days));
        coveredDays += days;
      }
    }
    long uncoveredDays = ChronoUnit.DAYS.between(from, to) - coveredDays;
    if (uncoveredDays > 0) {
      total = total.add(method.accrue(baseTax, config.annualInterestRate(), uncoveredDays));
    }
    return total;
  }

  private static AnnualRate rateInForce(LocalDate date, InterestPenaltyConfig config) {
    for (InterestRatePeriod period : config.ratePeriods()) {
      if (period.contains(date)) {
        return period.annualRate();
      }
    }
    return config.annualInterestRate();
  }
}
