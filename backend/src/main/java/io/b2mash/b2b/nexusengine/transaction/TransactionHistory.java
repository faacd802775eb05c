package io.b2mash.b2b.nexusengine.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Chronologically ordered transactions of a single jurisdiction with prefix sums of revenue and
 * count, so the totals of any contiguous index range are available in constant time.
 *
 * <p>The sort is stable: transactions sharing a date keep their input order, which keeps the
 * crossing transaction deterministic for identical inputs.
 */
public final class TransactionHistory {

  private final String jurisdictionCode;
  private final List<TransactionRecord> transactions;
  private final BigDecimal[] revenuePrefix;

  private TransactionHistory(String jurisdictionCode, List<TransactionRecord> sorted) {
    this.jurisdictionCode = jurisdictionCode;
    this.transactions = List.copyOf(sorted);
    this.revenuePrefix = new BigDecimal[sorted.size() + 1];
    revenuePrefix[0] = BigDecimal.ZERO;
    for (int i = 0; i < sorted.size(); i++) {
      revenuePrefix[i + 1] = revenuePrefix[i].add(sorted.get(i).amount());
    }
  }

  /** Builds a history from the given transactions, all of which must share one jurisdiction. */
  public static TransactionHistory of(String jurisdictionCode, List<TransactionRecord> records) {
    Objects.requireNonNull(jurisdictionCode, "jurisdictionCode must not be null");
    var sorted = new ArrayList<>(records);
    for (TransactionRecord record : sorted) {
      if (!jurisdictionCode.equals(record.jurisdictionCode())) {
        throw new IllegalArgumentException(
            "Transaction "
                + record.transactionId()
                + " belongs to "
                + record.jurisdictionCode()
                + ", not "
                + jurisdictionCode);
      }
    }
    sorted.sort(Comparator.comparing(TransactionRecord::date));
    return new TransactionHistory(jurisdictionCode, sorted);
  }

  public String jurisdictionCode() {
    return jurisdictionCode;
  }

  public int size() {
    return transactions.size();
  }

  public boolean isEmpty() {
    return transactions.isEmpty();
  }

  public TransactionRecord get(int index) {
    return transactions.get(index);
  }

  public List<TransactionRecord> transactions() {
    return transactions;
  }

  /** Totals of the transactions at indexes {@code [fromInclusive, toExclusive)}. */
  public WindowTotals totalsBetween(int fromInclusive, int toExclusive) {
    if (toExclusive <= fromInclusive) {
      return WindowTotals.EMPTY;
    }
    return new WindowTotals(
        revenuePrefix[toExclusive].subtract(revenuePrefix[fromInclusive]),
        (long) toExclusive - fromInclusive);
  }

  /** Index of the first transaction dated on or after {@code date}, or {@link #size()}. */
  public int firstIndexOnOrAfter(LocalDate date) {
    int low = 0;
    int high = transactions.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (transactions.get(mid).date().isBefore(date)) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /** Index of the first transaction dated strictly after {@code date}, or {@link #size()}. */
  public int firstIndexAfter(LocalDate date) {
    return firstIndexOnOrAfter(date.plusDays(1));
  }

  /** Index range {@code [start, end)} of the transactions dated in the given calendar year. */
  public IndexRange yearRange(int year) {
    return new IndexRange(
        firstIndexOnOrAfter(LocalDate.of(year, 1, 1)),
        firstIndexOnOrAfter(LocalDate.of(year + 1, 1, 1)));
  }

  /** Transactions dated in the given calendar year, in chronological order. */
  public List<TransactionRecord> transactionsIn(int year) {
    var range = yearRange(year);
    return transactions.subList(range.start(), range.end());
  }

  /** Distinct calendar years present in the history, ascending. */
  public List<Integer> years() {
    var years = new TreeSet<Integer>();
    for (TransactionRecord record : transactions) {
      years.add(record.date().getYear());
    }
    return List.copyOf(years);
  }

  /** A half-open range of indexes into the history. */
  public record IndexRange(int start, int end) {

    public boolean isEmpty() {
      return end <= start;
    }
  }
}
