package io.b2mash.b2b.nexusengine.engine;

import io.b2mash.b2b.nexusengine.exception.InvalidConfigurationException;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyAmounts;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyCalculator;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.jurisdiction.DefaultConfigurations;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfigValidator;
import io.b2mash.b2b.nexusengine.liability.LiabilityAmounts;
import io.b2mash.b2b.nexusengine.liability.LiabilityCalculator;
import io.b2mash.b2b.nexusengine.money.Money;
import io.b2mash.b2b.nexusengine.nexus.MultiYearNexusTracker;
import io.b2mash.b2b.nexusengine.nexus.NexusYearDetermination;
import io.b2mash.b2b.nexusengine.transaction.TransactionHistory;
import io.b2mash.b2b.nexusengine.transaction.TransactionRecord;
import io.b2mash.b2b.nexusengine.vda.VdaCalculator;
import io.b2mash.b2b.nexusengine.vda.VdaSummary;
import io.b2mash.b2b.nexusengine.vda.VdaYearResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a nexus analysis: determination, liability, interest and penalties, and the voluntary
 * disclosure scenario, per jurisdiction.
 *
 * <p>Jurisdictions are independent and evaluated concurrently on the engine executor. A failure
 * in one jurisdiction is reported on that jurisdiction only. Results are returned in
 * jurisdiction-code order, so identical requests produce equal results.
 */
@Service
public class NexusEngine {

  private static final Logger log = LoggerFactory.getLogger(NexusEngine.class);

  static final String MDC_ANALYSIS_ID = "analysisId";
  static final String MDC_JURISDICTION = "jurisdiction";

  private final MultiYearNexusTracker nexusTracker;
  private final LiabilityCalculator liabilityCalculator;
  private final InterestPenaltyCalculator interestPenaltyCalculator;
  private final VdaCalculator vdaCalculator;
  private final JurisdictionConfigValidator configValidator;
  private final DefaultConfigurations defaultConfigurations;
  private final Executor executor;

  public NexusEngine(
      MultiYearNexusTracker nexusTracker,
      LiabilityCalculator liabilityCalculator,
      InterestPenaltyCalculator interestPenaltyCalculator,
      VdaCalculator vdaCalculator,
      JurisdictionConfigValidator configValidator,
      DefaultConfigurations defaultConfigurations,
      @Qualifier("nexusEngineExecutor") Executor executor) {
    this.nexusTracker = nexusTracker;
    this.liabilityCalculator = liabilityCalculator;
    this.interestPenaltyCalculator = interestPenaltyCalculator;
    this.vdaCalculator = vdaCalculator;
    this.configValidator = configValidator;
    this.defaultConfigurations = defaultConfigurations;
    this.executor = executor;
  }

  public NexusAnalysisResult analyze(NexusAnalysisRequest request) {
    String analysisId = UUID.randomUUID().toString();
    MDC.put(MDC_ANALYSIS_ID, analysisId);
    try {
      Map<String, List<TransactionRecord>> byJurisdiction = partition(request.transactions());
      log.info(
          "Starting nexus analysis: jurisdictions={}, transactions={}, calculationDate={}",
          byJurisdiction.size(),
          request.transactions().size(),
          request.calculationDate());

      var futures = new ArrayList<CompletableFuture<JurisdictionResult>>();
      for (var entry : byJurisdiction.entrySet()) {
        futures.add(
            CompletableFuture.supplyAsync(
                () -> analyzeJurisdiction(entry.getKey(), entry.getValue(), request), executor));
      }
      List<JurisdictionResult> results = futures.stream().map(CompletableFuture::join).toList();

      NexusAnalysisResult result = summarize(request, results);
      log.info(
          "Nexus analysis complete: jurisdictionsWithNexus={}, totalLiability={},"
              + " totalVdaSavings={}",
          result.jurisdictionsWithNexus(),
          result.totalLiability(),
          result.totalVdaSavings());
      return result;
    } finally {
      MDC.remove(MDC_ANALYSIS_ID);
    }
  }

  JurisdictionResult analyzeJurisdiction(
      String code, List<TransactionRecord> transactions, NexusAnalysisRequest request) {
    MDC.put(MDC_JURISDICTION, code);
    try {
      return calculate(code, transactions, request);
    } catch (InvalidConfigurationException e) {
      log.error("Invalid configuration for jurisdiction {}: {}", code, e.getBody().getDetail());
      return JurisdictionResult.failed(code, e.getBody().getDetail());
    } catch (RuntimeException e) {
      log.error("Nexus calculation failed for jurisdiction {}", code, e);
      return JurisdictionResult.failed(code, "Calculation failed: " + e.getMessage());
    } finally {
      MDC.remove(MDC_JURISDICTION);
    }
  }

  private JurisdictionResult calculate(
      String code, List<TransactionRecord> transactions, NexusAnalysisRequest request) {
    var notes = new ArrayList<String>();

    Optional<String> invalid = request.configLookup().invalidConfiguration(code);
    if (invalid.isPresent()) {
      throw new InvalidConfigurationException(code, invalid.get());
    }

    Optional<JurisdictionConfig> configured = request.configLookup().jurisdictionConfig(code);
    JurisdictionConfig config;
    if (configured.isPresent()) {
      config = configured.get();
    } else {
      log.warn("No nexus configuration for jurisdiction {}, using defaults", code);
      notes.add("Nexus rules not on file; default thresholds and tax rate applied");
      config = defaultConfigurations.jurisdictionConfig(code);
    }
    configValidator.validate(config);

    Optional<InterestPenaltyConfig> configuredCharges =
        request.configLookup().interestPenaltyConfig(code);
    InterestPenaltyConfig chargesConfig;
    if (configuredCharges.isPresent()) {
      chargesConfig = configuredCharges.get();
    } else {
      log.warn("No interest and penalty configuration for jurisdiction {}, using defaults", code);
      notes.add("Interest and penalty rules not on file; default rates applied");
      chargesConfig = defaultConfigurations.interestPenaltyConfig();
    }
    configValidator.validate(code, chargesConfig);

    TransactionHistory history = TransactionHistory.of(code, transactions);
    List<NexusYearDetermination> determinations =
        nexusTracker.track(
            history,
            config,
            request.physicalNexusDates().get(code),
            request.clientFiscalYearEnd());

    var years = new ArrayList<NexusYearResult>();
    for (NexusYearDetermination determination : determinations) {
      LiabilityAmounts liability =
          liabilityCalculator.calculate(
              history.transactionsIn(determination.year()),
              determination.obligationStartDate(),
              config);
      InterestPenaltyAmounts charges =
          interestPenaltyCalculator.calculate(
              liability.baseTax(),
              determination.obligationStartDate(),
              request.calculationDate(),
              chargesConfig);
      years.add(NexusYearResult.of(determination, liability, charges));
    }

    List<VdaYearResult> vdaYears = List.of();
    VdaSummary vdaSummary = null;
    if (request.vdaJurisdictions().contains(code)) {
      vdaYears = calculateVda(history, years, request, config, chargesConfig);
      vdaSummary =
          VdaSummary.of(
              request.effectiveVdaFilingDate(), chargesConfig.vdaLookbackMonths(), vdaYears);
    }

    return new JurisdictionResult(
        code,
        notes.isEmpty() ? Confidence.FULL : Confidence.DEGRADED,
        notes,
        years,
        AllYearsSummary.of(years),
        vdaYears,
        vdaSummary);
  }

  private List<VdaYearResult> calculateVda(
      TransactionHistory history,
      List<NexusYearResult> years,
      NexusAnalysisRequest request,
      JurisdictionConfig config,
      InterestPenaltyConfig chargesConfig) {
    var vdaYears = new ArrayList<VdaYearResult>();
    for (NexusYearResult year : years) {
      vdaYears.add(
          vdaCalculator.calculate(
              year.year(),
              history.transactionsIn(year.year()),
              year.obligationStartDate(),
              year.totalLiability(),
              request.effectiveVdaFilingDate(),
              config,
              chargesConfig));
    }
    return vdaYears;
  }

  private static Map<String, List<TransactionRecord>> partition(
      List<TransactionRecord> transactions) {
    var byJurisdiction = new TreeMap<String, List<TransactionRecord>>();
    for (TransactionRecord transaction : transactions) {
      byJurisdiction
          .computeIfAbsent(transaction.jurisdictionCode(), code -> new ArrayList<>())
          .add(transaction);
    }
    return byJurisdiction;
  }

  private static NexusAnalysisResult summarize(
      NexusAnalysisRequest request, List<JurisdictionResult> results) {
    BigDecimal totalLiability = Money.ZERO;
    BigDecimal totalVdaSavings = Money.ZERO;
    var withNexus = new ArrayList<String>();
    for (JurisdictionResult result : results) {
      totalLiability = totalLiability.add(result.allYears().totalLiability());
      if (result.vdaSummary() != null) {
        totalVdaSavings = totalVdaSavings.add(result.vdaSummary().savings());
      }
      if (result.hasNexus()) {
        withNexus.add(result.jurisdictionCode());
      }
    }
    return new NexusAnalysisResult(
        request.calculationDate(), results, withNexus, totalLiability, totalVdaSavings);
  }
}
