package io.b2mash.b2b.nexusengine.nexus;

import io.b2mash.b2b.nexusengine.threshold.ThresholdCrossing;
import java.time.LocalDate;

/**
 * Nexus status of one jurisdiction for one calendar year.
 *
 * @param year the calendar year
 * @param nexusType why the jurisdiction has nexus, {@link NexusType#NONE} if it does not
 * @param nexusDate date nexus was first established, null without nexus
 * @param obligationStartDate first date whose sales count toward liability this year, null
 *     without nexus
 * @param firstNexusYear year nexus was first established, null without nexus
 * @param crossing the threshold crossing detected this year; null in sticky years and years
 *     without an economic crossing
 */
public record NexusYearDetermination(
    int year,
    NexusType nexusType,
    LocalDate nexusDate,
    LocalDate obligationStartDate,
    Integer firstNexusYear,
    ThresholdCrossing crossing) {

  static NexusYearDetermination noNexus(int year) {
    return new NexusYearDetermination(year, NexusType.NONE, null, null, null, null);
  }

  public boolean hasNexus() {
    return nexusType.hasNexus();
  }
}
