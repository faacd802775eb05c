package io.b2mash.b2b.nexusengine.transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single normalized sale. Records arrive already validated by the upstream normalizer; only
 * null checks are applied here.
 *
 * @param transactionId identifier of the sale, reported back as the crossing transaction
 * @param date the sale date
 * @param jurisdictionCode the taxing jurisdiction the sale was shipped to (e.g. "CA")
 * @param amount the sale amount, non-negative
 * @param channel whether the sale was direct or through a marketplace facilitator
 */
public record TransactionRecord(
    String transactionId,
    LocalDate date,
    String jurisdictionCode,
    BigDecimal amount,
    SalesChannel channel) {

  public TransactionRecord {
    Objects.requireNonNull(transactionId, "transactionId must not be null");
    Objects.requireNonNull(date, "date must not be null");
    Objects.requireNonNull(jurisdictionCode, "jurisdictionCode must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(channel, "channel must not be null");
  }

  public boolean isMarketplace() {
    return channel == SalesChannel.MARKETPLACE;
  }
}
