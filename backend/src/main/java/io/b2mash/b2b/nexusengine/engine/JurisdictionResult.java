package io.b2mash.b2b.nexusengine.engine;

import io.b2mash.b2b.nexusengine.vda.VdaSummary;
import io.b2mash.b2b.nexusengine.vda.VdaYearResult;
import java.util.List;

/**
 * Outcome of one jurisdiction.
 *
 * @param jurisdictionCode the jurisdiction
 * @param confidence whether defaults were substituted or the calculation failed
 * @param notes what was defaulted, or why the calculation failed
 * @param years one result per calendar year with sales, ascending
 * @param allYears totals across {@code years}
 * @param vdaYears voluntary disclosure scenario per year, empty when not requested
 * @param vdaSummary voluntary disclosure totals, null when not requested
 */
public record JurisdictionResult(
    String jurisdictionCode,
    Confidence confidence,
    List<String> notes,
    List<NexusYearResult> years,
    AllYearsSummary allYears,
    List<VdaYearResult> vdaYears,
    VdaSummary vdaSummary) {

  public JurisdictionResult {
    notes = List.copyOf(notes);
    years = List.copyOf(years);
    vdaYears = List.copyOf(vdaYears);
  }

  static JurisdictionResult failed(String jurisdictionCode, String note) {
    return new JurisdictionResult(
        jurisdictionCode,
        Confidence.FAILED,
        List.of(note),
        List.of(),
        AllYearsSummary.EMPTY,
        List.of(),
        null);
  }

  public boolean hasNexus() {
    return years.stream().anyMatch(NexusYearResult::hasNexus);
  }

  public boolean isFailed() {
    return confidence == Confidence.FAILED;
  }
}
