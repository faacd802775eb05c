package io.b2mash.b2b.nexusengine.lookback;

import java.time.MonthDay;

/**
 * The span of sales examined when testing a jurisdiction's economic nexus threshold. The set of
 * policies is closed; every consumer dispatches through {@link Visitor}, so a new policy does not
 * compile until each consumer handles it.
 */
public sealed interface LookbackPolicy {

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive dispatch over the lookback policies. */
  interface Visitor<R> {

    R previousCalendarYear(PreviousCalendarYear policy);

    R currentOrPreviousCalendarYear(CurrentOrPreviousCalendarYear policy);

    R rollingWindow(RollingWindow policy);

    R quarterWindow(QuarterWindow policy);

    R fixedAnnualWindow(FixedAnnualWindow policy);
  }

  /** All sales of the calendar year before the year under test. */
  record PreviousCalendarYear() implements LookbackPolicy {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.previousCalendarYear(this);
    }
  }

  /** Sales of the current calendar year, falling back to the previous calendar year. */
  record CurrentOrPreviousCalendarYear() implements LookbackPolicy {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.currentOrPreviousCalendarYear(this);
    }
  }

  /** Sales dated within the {@code days} days up to and including the evaluation date. */
  record RollingWindow(int days) implements LookbackPolicy {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.rollingWindow(this);
    }
  }

  /** Sales of the {@code quarters} calendar quarters preceding the evaluation date's quarter. */
  record QuarterWindow(int quarters) implements LookbackPolicy {

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.quarterWindow(this);
    }
  }

  /**
   * Sales of the 12-month measurement period ending on {@code periodEnd} that contains the
   * evaluation date. A null {@code periodEnd} measures against the client's fiscal year end.
   */
  record FixedAnnualWindow(MonthDay periodEnd) implements LookbackPolicy {

    public static FixedAnnualWindow clientFiscalYear() {
      return new FixedAnnualWindow(null);
    }

    public boolean usesClientFiscalYearEnd() {
      return periodEnd == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.fixedAnnualWindow(this);
    }
  }
}
