package io.b2mash.b2b.nexusengine.lookback;

import io.b2mash.b2b.nexusengine.transaction.TransactionHistory;
import io.b2mash.b2b.nexusengine.transaction.TransactionHistory.IndexRange;
import io.b2mash.b2b.nexusengine.transaction.WindowTotals;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * A lazy, chronological sequence of {@link WindowStep}s over a range of evaluation points. Each
 * iteration gets a fresh {@link WindowFunction}, so stateful (sliding) windows can be iterated
 * more than once.
 */
public final class LookbackScan implements Iterable<WindowStep> {

  /**
   * Computes the window totals at an evaluation point. Called with strictly ascending indexes
   * within one iteration. Returns null when the point cannot be tested yet.
   */
  @FunctionalInterface
  interface WindowFunction {
    WindowTotals totalsAt(int index);
  }

  private final ScanBasis basis;
  private final TransactionHistory history;
  private final IndexRange evaluationPoints;
  private final Supplier<WindowFunction> windowFunctions;

  LookbackScan(
      ScanBasis basis,
      TransactionHistory history,
      IndexRange evaluationPoints,
      Supplier<WindowFunction> windowFunctions) {
    this.basis = basis;
    this.history = history;
    this.evaluationPoints = evaluationPoints;
    this.windowFunctions = windowFunctions;
  }

  public ScanBasis basis() {
    return basis;
  }

  public IndexRange evaluationPoints() {
    return evaluationPoints;
  }

  @Override
  public Iterator<WindowStep> iterator() {
    var window = windowFunctions.get();
    return new Iterator<>() {
      private int index = evaluationPoints.start();
      private WindowStep next = advance();

      private WindowStep advance() {
        while (index < evaluationPoints.end()) {
          int current = index++;
          var totals = window.totalsAt(current);
          if (totals != null) {
            return new WindowStep(history.get(current), totals);
          }
        }
        return null;
      }

      @Override
      public boolean hasNext() {
        return next != null;
      }

      @Override
      public WindowStep next() {
        if (next == null) {
          throw new NoSuchElementException();
        }
        var result = next;
        next = advance();
        return result;
      }
    };
  }
}
