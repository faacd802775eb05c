package io.b2mash.b2b.nexusengine.lookback;

import static io.b2mash.b2b.nexusengine.testutil.TestTransactions.direct;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.nexusengine.transaction.TransactionHistory;
import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LookbackWindowEvaluatorTest {

  private final LookbackWindowEvaluator evaluator = new LookbackWindowEvaluator();

  // --- Calendar year policies ---

  @Test
  void previousCalendarYear_scansOnlyThePriorYear() {
    var history =
        history(
            direct("a", "2022-02-01", "TX", "100.00"),
            direct("b", "2022-05-01", "TX", "200.00"),
            direct("c", "2023-01-15", "TX", "400.00"));

    var scans =
        evaluator.scansFor(new LookbackPolicy.PreviousCalendarYear(), history, 2023, null);

    assertThat(scans).hasSize(1);
    assertThat(scans.get(0).basis()).isEqualTo(ScanBasis.PRIOR_PERIOD);
    var steps = steps(scans.get(0));
    assertThat(steps)
        .extracting(step -> step.transaction().transactionId())
        .containsExactly("a", "b");
    assertThat(steps.get(1).totals().revenue()).isEqualByComparingTo("300.00");
    assertThat(steps.get(1).totals().count()).isEqualTo(2);
  }

  @Test
  void currentOrPreviousCalendarYear_scansCurrentYearBeforePriorYear() {
    var history =
        history(
            direct("a", "2022-02-01", "CA", "100.00"), direct("b", "2023-03-01", "CA", "50.00"));

    var scans =
        evaluator.scansFor(new LookbackPolicy.CurrentOrPreviousCalendarYear(), history, 2023, null);

    assertThat(scans)
        .extracting(LookbackScan::basis)
        .containsExactly(ScanBasis.CURRENT_PERIOD, ScanBasis.PRIOR_PERIOD);
    assertThat(steps(scans.get(0)))
        .extracting(step -> step.transaction().transactionId())
        .containsExactly("b");
    assertThat(steps(scans.get(1)))
        .extracting(step -> step.transaction().transactionId())
        .containsExactly("a");
  }

  // --- Rolling window ---

  @Test
  void rollingWindow_dropsSalesOlderThanTheWindow() {
    // window at 2023-02-01 is (2022-02-01, 2023-02-01]
    var history =
        history(
            direct("old", "2022-01-10", "WA", "60000.00"),
            direct("mid", "2022-12-01", "WA", "30000.00"),
            direct("now", "2023-02-01", "WA", "50000.00"));

    var scans = evaluator.scansFor(new LookbackPolicy.RollingWindow(365), history, 2023, null);

    var steps = steps(scans.get(0));
    assertThat(steps).hasSize(1);
    assertThat(steps.get(0).totals().revenue()).isEqualByComparingTo("80000.00");
    assertThat(steps.get(0).totals().count()).isEqualTo(2);
  }

  @Test
  void rollingWindow_slidesForwardAcrossEvaluationPoints() {
    var history =
        history(
            direct("a", "2023-01-01", "WA", "10.00"),
            direct("b", "2023-01-20", "WA", "20.00"),
            direct("c", "2023-02-15", "WA", "40.00"));

    var steps =
        steps(evaluator.scansFor(new LookbackPolicy.RollingWindow(30), history, 2023, null).get(0));

    assertThat(steps)
        .extracting(step -> step.totals().revenue().toPlainString())
        .containsExactly("10.00", "30.00", "60.00");
  }

  @Test
  void rollingWindow_canBeIteratedTwice() {
    var history =
        history(direct("a", "2023-01-01", "WA", "10.00"), direct("b", "2023-06-01", "WA", "5.00"));
    var scan =
        evaluator.scansFor(new LookbackPolicy.RollingWindow(30), history, 2023, null).get(0);

    assertThat(steps(scan)).isEqualTo(steps(scan));
  }

  // --- Quarter window ---

  @Test
  void quarterWindow_skipsPointsWithoutEnoughHistory() {
    var history =
        history(
            direct("a", "2023-02-15", "NY", "600000.00"),
            direct("b", "2023-11-01", "NY", "1.00"));

    var scans = evaluator.scansFor(new LookbackPolicy.QuarterWindow(4), history, 2023, null);

    assertThat(steps(scans.get(0))).isEmpty();
  }

  @Test
  void quarterWindow_sumsCompletedQuartersBeforeTheEvaluationQuarter() {
    // evaluated in Q1 2024: window is Q1..Q4 2023; the Q1 2024 sale itself is excluded
    var history =
        history(
            direct("a", "2023-02-15", "NY", "100.00"),
            direct("b", "2023-11-01", "NY", "200.00"),
            direct("c", "2024-01-10", "NY", "5000.00"),
            direct("d", "2024-04-02", "NY", "7.00"));

    var steps =
        steps(evaluator.scansFor(new LookbackPolicy.QuarterWindow(4), history, 2024, null).get(0));

    assertThat(steps)
        .extracting(step -> step.transaction().transactionId())
        .containsExactly("c", "d");
    assertThat(steps.get(0).totals().revenue()).isEqualByComparingTo("300.00");
    // at Q2 2024 the window is Q2 2023..Q1 2024
    assertThat(steps.get(1).totals().revenue()).isEqualByComparingTo("5200.00");
  }

  @Test
  void quarterIndex_roundTripsThroughQuarterStart() {
    int index = LookbackWindowEvaluator.quarterIndex(LocalDate.of(2023, 8, 17));

    assertThat(LookbackWindowEvaluator.quarterStart(index)).isEqualTo(LocalDate.of(2023, 7, 1));
    assertThat(LookbackWindowEvaluator.quarterStart(index - 3))
        .isEqualTo(LocalDate.of(2022, 10, 1));
  }

  // --- Fixed annual window ---

  @Test
  void fixedAnnualWindow_resetsAfterPeriodEnd() {
    var history =
        history(
            direct("a", "2023-09-15", "CT", "80000.00"),
            direct("b", "2023-10-05", "CT", "30000.00"),
            direct("c", "2023-11-01", "CT", "50000.00"));

    var policy = new LookbackPolicy.FixedAnnualWindow(MonthDay.of(9, 30));
    var steps = steps(evaluator.scansFor(policy, history, 2023, null).get(0));

    assertThat(steps)
        .extracting(step -> step.totals().revenue().toPlainString())
        .containsExactly("80000.00", "30000.00", "80000.00");
  }

  @Test
  void fixedAnnualWindow_withoutPeriodEnd_usesClientFiscalYearEnd() {
    var history =
        history(
            direct("a", "2023-06-01", "CT", "60000.00"),
            direct("b", "2023-07-01", "CT", "60000.00"));

    var steps =
        steps(
            evaluator
                .scansFor(
                    LookbackPolicy.FixedAnnualWindow.clientFiscalYear(),
                    history,
                    2023,
                    MonthDay.of(6, 30))
                .get(0));

    assertThat(steps.get(1).totals().revenue()).isEqualByComparingTo("60000.00");
  }

  @Test
  void fixedAnnualWindow_withoutAnyFiscalYearEnd_measuresCalendarYear() {
    var history =
        history(
            direct("a", "2022-12-20", "CT", "60000.00"),
            direct("b", "2023-01-05", "CT", "60000.00"));

    var steps =
        steps(
            evaluator
                .scansFor(LookbackPolicy.FixedAnnualWindow.clientFiscalYear(), history, 2023, null)
                .get(0));

    assertThat(steps).hasSize(1);
    assertThat(steps.get(0).totals().revenue()).isEqualByComparingTo("60000.00");
  }

  private static TransactionHistory history(TransactionRecord... records) {
    return TransactionHistory.of(records[0].jurisdictionCode(), List.of(records));
  }

  private static List<WindowStep> steps(LookbackScan scan) {
    var steps = new ArrayList<WindowStep>();
    scan.forEach(steps::add);
    return steps;
  }
}
