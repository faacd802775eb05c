package io.b2mash.b2b.nexusengine.nexus;

import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.lookback.LookbackWindowEvaluator;
import io.b2mash.b2b.nexusengine.lookback.ScanBasis;
import io.b2mash.b2b.nexusengine.nexus.NexusState.Established;
import io.b2mash.b2b.nexusengine.threshold.ThresholdCrossing;
import io.b2mash.b2b.nexusengine.threshold.ThresholdCrossingDetector;
import io.b2mash.b2b.nexusengine.transaction.TransactionHistory;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Determines nexus for every calendar year of a jurisdiction's history, in ascending order.
 *
 * <p>Until nexus is established, each year is tested with the jurisdiction's lookback policy.
 * Once established, nexus is sticky: later years are not re-tested and their obligation starts
 * on January 1, whatever that year's sales.
 */
@Service
public class MultiYearNexusTracker {

  private static final Logger log = LoggerFactory.getLogger(MultiYearNexusTracker.class);

  private final LookbackWindowEvaluator lookbackWindowEvaluator;
  private final ThresholdCrossingDetector thresholdCrossingDetector;

  public MultiYearNexusTracker(
      LookbackWindowEvaluator lookbackWindowEvaluator,
      ThresholdCrossingDetector thresholdCrossingDetector) {
    this.lookbackWindowEvaluator = lookbackWindowEvaluator;
    this.thresholdCrossingDetector = thresholdCrossingDetector;
  }

  /**
   * Produces one determination per calendar year present in {@code history}.
   *
   * @param history the jurisdiction's transactions
   * @param config the jurisdiction's nexus rules
   * @param physicalNexusDate date physical presence began, or null
   * @param clientFiscalYearEnd fiscal year end for client-measured fixed windows, or null
   */
  public List<NexusYearDetermination> track(
      TransactionHistory history,
      JurisdictionConfig config,
      LocalDate physicalNexusDate,
      MonthDay clientFiscalYearEnd) {
    var determinations = new ArrayList<NexusYearDetermination>();
    NexusState state = NexusState.NO_NEXUS;

    for (int year : history.years()) {
      NexusYearDetermination determination;
      if (state instanceof Established established) {
        if (hasPhysicalPresence(physicalNexusDate, year)
            && established.nexusType() != established.nexusType().withPhysical()) {
          established = established.withType(established.nexusType().withPhysical());
          state = established;
        }
        determination =
            new NexusYearDetermination(
                year,
                established.nexusType(),
                established.nexusDate(),
                LocalDate.of(year, 1, 1),
                established.firstNexusYear(),
                null);
      } else {
        determination = testYear(history, config, physicalNexusDate, clientFiscalYearEnd, year);
        if (determination.hasNexus()) {
          state =
              new Established(year, determination.nexusDate(), determination.nexusType());
          log.info(
              "Nexus established: jurisdiction={}, year={}, type={}, nexusDate={},"
                  + " obligationStart={}",
              config.jurisdictionCode(),
              year,
              determination.nexusType(),
              determination.nexusDate(),
              determination.obligationStartDate());
        }
      }
      determinations.add(determination);
    }
    return determinations;
  }

  private NexusYearDetermination testYear(
      TransactionHistory history,
      JurisdictionConfig config,
      LocalDate physicalNexusDate,
      MonthDay clientFiscalYearEnd,
      int year) {
    var scans =
        lookbackWindowEvaluator.scansFor(
            config.lookbackPolicy(), history, year, clientFiscalYearEnd);
    Optional<ThresholdCrossing> crossing = thresholdCrossingDetector.detect(scans, config);
    boolean physical = hasPhysicalPresence(physicalNexusDate, year);

    if (crossing.isEmpty() && !physical) {
      return NexusYearDetermination.noNexus(year);
    }

    LocalDate yearStart = LocalDate.of(year, 1, 1);
    LocalDate nexusDate = null;
    LocalDate obligationStart = null;
    NexusType type = NexusType.NONE;

    if (crossing.isPresent()) {
      var found = crossing.get();
      nexusDate = found.nexusDate();
      obligationStart =
          found.basis() == ScanBasis.PRIOR_PERIOD
              ? yearStart
              : obligationStartAfter(found.nexusDate());
      type = NexusType.ECONOMIC;
    }
    if (physical) {
      LocalDate physicalStart = latest(physicalNexusDate, yearStart);
      nexusDate = earliest(nexusDate, physicalNexusDate);
      obligationStart = earliest(obligationStart, physicalStart);
      type = type.withPhysical();
    }

    return new NexusYearDetermination(
        year, type, nexusDate, obligationStart, year, crossing.orElse(null));
  }

  /** Collection obligation begins on the first day of the month following the crossing. */
  static LocalDate obligationStartAfter(LocalDate nexusDate) {
    return nexusDate.withDayOfMonth(1).plusMonths(1);
  }

  private static boolean hasPhysicalPresence(LocalDate physicalNexusDate, int year) {
    return physicalNexusDate != null && physicalNexusDate.getYear() <= year;
  }

  private static LocalDate earliest(LocalDate current, LocalDate candidate) {
    if (current == null) {
      return candidate;
    }
    return candidate.isBefore(current) ? candidate : current;
  }

  private static LocalDate latest(LocalDate a, LocalDate b) {
    return a.isAfter(b) ? a : b;
  }
}
