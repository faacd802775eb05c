package io.b2mash.b2b.nexusengine.engine;

import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfigLookup;
import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Input of one nexus analysis.
 *
 * @param transactions validated sales of all jurisdictions, in any order
 * @param configLookup jurisdiction reference data
 * @param calculationDate date interest is computed to
 * @param vdaFilingDate planned voluntary disclosure filing date; null uses {@code
 *     calculationDate}
 * @param vdaJurisdictions jurisdictions to compute a voluntary disclosure scenario for
 * @param physicalNexusDates date physical presence began, per jurisdiction code
 * @param clientFiscalYearEnd the client's fiscal year end, for fixed windows measured against
 *     it; null means December 31
 */
public record NexusAnalysisRequest(
    List<TransactionRecord> transactions,
    JurisdictionConfigLookup configLookup,
    LocalDate calculationDate,
    LocalDate vdaFilingDate,
    Set<String> vdaJurisdictions,
    Map<String, LocalDate> physicalNexusDates,
    MonthDay clientFiscalYearEnd) {

  public NexusAnalysisRequest {
    Objects.requireNonNull(configLookup, "configLookup must not be null");
    Objects.requireNonNull(calculationDate, "calculationDate must not be null");
    transactions = transactions == null ? List.of() : List.copyOf(transactions);
    vdaJurisdictions = vdaJurisdictions == null ? Set.of() : Set.copyOf(vdaJurisdictions);
    physicalNexusDates = physicalNexusDates == null ? Map.of() : Map.copyOf(physicalNexusDates);
  }

  /** A request without voluntary disclosure scenarios or physical presence. */
  public static NexusAnalysisRequest of(
      List<TransactionRecord> transactions,
      JurisdictionConfigLookup configLookup,
      LocalDate calculationDate) {
    return new NexusAnalysisRequest(
        transactions, configLookup, calculationDate, null, Set.of(), Map.of(), null);
  }

  public LocalDate effectiveVdaFilingDate() {
    return vdaFilingDate != null ? vdaFilingDate : calculationDate;
  }
}
