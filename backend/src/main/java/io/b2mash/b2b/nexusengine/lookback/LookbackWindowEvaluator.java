package io.b2mash.b2b.nexusengine.lookback;

import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy.CurrentOrPreviousCalendarYear;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy.FixedAnnualWindow;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy.PreviousCalendarYear;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy.QuarterWindow;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy.RollingWindow;
import io.b2mash.b2b.nexusengine.lookback.LookbackScan.WindowFunction;
import io.b2mash.b2b.nexusengine.transaction.TransactionHistory;
import io.b2mash.b2b.nexusengine.transaction.TransactionHistory.IndexRange;
import io.b2mash.b2b.nexusengine.transaction.WindowTotals;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Turns a lookback policy into the scans that test one calendar year. Scans are returned in
 * precedence order: a crossing in an earlier scan wins over any crossing in a later one.
 */
@Service
public class LookbackWindowEvaluator {

  static final MonthDay CALENDAR_YEAR_END = MonthDay.of(12, 31);

  /**
   * Builds the scans that decide whether nexus is established in {@code year}.
   *
   * @param policy the jurisdiction's lookback policy
   * @param history the jurisdiction's full transaction history
   * @param year the calendar year under test
   * @param clientFiscalYearEnd the analysis' fiscal year end, used by {@link FixedAnnualWindow}
   *     policies without their own period end; null means December 31
   * @return scans in precedence order, possibly empty steps but never null
   */
  public List<LookbackScan> scansFor(
      LookbackPolicy policy,
      TransactionHistory history,
      int year,
      MonthDay clientFiscalYearEnd) {
    return policy.accept(new ScanBuilder(history, year, clientFiscalYearEnd));
  }

  private static final class ScanBuilder implements LookbackPolicy.Visitor<List<LookbackScan>> {

    private final TransactionHistory history;
    private final int year;
    private final MonthDay clientFiscalYearEnd;

    private ScanBuilder(TransactionHistory history, int year, MonthDay clientFiscalYearEnd) {
      this.history = history;
      this.year = year;
      this.clientFiscalYearEnd = clientFiscalYearEnd;
    }

    @Override
    public List<LookbackScan> previousCalendarYear(PreviousCalendarYear policy) {
      return List.of(runningTotal(ScanBasis.PRIOR_PERIOD, history.yearRange(year - 1)));
    }

    @Override
    public List<LookbackScan> currentOrPreviousCalendarYear(CurrentOrPreviousCalendarYear policy) {
      return List.of(
          runningTotal(ScanBasis.CURRENT_PERIOD, history.yearRange(year)),
          runningTotal(ScanBasis.PRIOR_PERIOD, history.yearRange(year - 1)));
    }

    @Override
    public List<LookbackScan> rollingWindow(RollingWindow policy) {
      int days = policy.days();
      return List.of(
          new LookbackScan(
              ScanBasis.CURRENT_PERIOD,
              history,
              history.yearRange(year),
              () -> slidingWindow(days)));
    }

    @Override
    public List<LookbackScan> quarterWindow(QuarterWindow policy) {
      int quarters = policy.quarters();
      WindowFunction window =
          index -> {
            int evalQuarter = quarterIndex(history.get(index).date());
            int firstWindowQuarter = evalQuarter - quarters;
            if (firstWindowQuarter < quarterIndex(history.get(0).date())) {
              // fewer than the required quarters of history precede this point
              return null;
            }
            return history.totalsBetween(
                history.firstIndexOnOrAfter(quarterStart(firstWindowQuarter)),
                history.firstIndexOnOrAfter(quarterStart(evalQuarter)));
          };
      return List.of(currentYearScan(window));
    }

    @Override
    public List<LookbackScan> fixedAnnualWindow(FixedAnnualWindow policy) {
      MonthDay periodEnd = resolvePeriodEnd(policy);
      WindowFunction window =
          index -> {
            LocalDate evalDate = history.get(index).date();
            int endYear = evalDate.getYear();
            if (evalDate.isAfter(periodEnd.atYear(endYear))) {
              endYear++;
            }
            int periodStart = history.firstIndexAfter(periodEnd.atYear(endYear - 1));
            return history.totalsBetween(periodStart, index + 1);
          };
      return List.of(currentYearScan(window));
    }

    private MonthDay resolvePeriodEnd(FixedAnnualWindow policy) {
      if (!policy.usesClientFiscalYearEnd()) {
        return policy.periodEnd();
      }
      return clientFiscalYearEnd != null ? clientFiscalYearEnd : CALENDAR_YEAR_END;
    }

    private LookbackScan currentYearScan(WindowFunction window) {
      return new LookbackScan(
          ScanBasis.CURRENT_PERIOD, history, history.yearRange(year), () -> window);
    }

    private LookbackScan runningTotal(ScanBasis basis, IndexRange range) {
      WindowFunction window = index -> history.totalsBetween(range.start(), index + 1);
      return new LookbackScan(basis, history, range, () -> window);
    }

    /** Two-pointer window over {@code (evalDate - days, evalDate]}. */
    private WindowFunction slidingWindow(int days) {
      return new WindowFunction() {
        private int left = -1;

        @Override
        public WindowTotals totalsAt(int index) {
          LocalDate windowStart = history.get(index).date().minusDays(days);
          if (left < 0) {
            left = history.firstIndexAfter(windowStart);
          } else {
            while (left < index && !history.get(left).date().isAfter(windowStart)) {
              left++;
            }
          }
          return history.totalsBetween(left, index + 1);
        }
      };
    }
  }

  static int quarterIndex(LocalDate date) {
    return date.getYear() * 4 + (date.getMonthValue() - 1) / 3;
  }

  static LocalDate quarterStart(int quarterIndex) {
    return LocalDate.of(
        Math.floorDiv(quarterIndex, 4), Math.floorMod(quarterIndex, 4) * 3 + 1, 1);
  }
}
