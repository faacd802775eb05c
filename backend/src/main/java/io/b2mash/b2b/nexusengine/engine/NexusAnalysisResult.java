package io.b2mash.b2b.nexusengine.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one analysis.
 *
 * @param calculationDate date interest was computed to
 * @param jurisdictions per-jurisdiction results, sorted by code
 * @param jurisdictionsWithNexus codes of jurisdictions with nexus in any year, sorted
 * @param totalLiability liability summed over all jurisdictions that did not fail
 * @param totalVdaSavings voluntary disclosure savings summed over the requested jurisdictions
 */
public record NexusAnalysisResult(
    LocalDate calculationDate,
    List<JurisdictionResult> jurisdictions,
    List<String> jurisdictionsWithNexus,
    BigDecimal totalLiability,
    BigDecimal totalVdaSavings) {

  public NexusAnalysisResult {
    jurisdictions = List.copyOf(jurisdictions);
    jurisdictionsWithNexus = List.copyOf(jurisdictionsWithNexus);
  }

  public Optional<JurisdictionResult> jurisdiction(String jurisdictionCode) {
    return jurisdictions.stream()
        .filter(result -> result.jurisdictionCode().equals(jurisdictionCode))
        .findFirst();
  }
}
