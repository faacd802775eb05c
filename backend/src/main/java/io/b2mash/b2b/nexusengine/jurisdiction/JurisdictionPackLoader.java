package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.config.NexusEngineProperties;
import io.b2mash.b2b.nexusengine.interest.AnnualRate;
import io.b2mash.b2b.nexusengine.interest.CombinedPenaltyCap;
import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.interest.InterestRatePeriod;
import io.b2mash.b2b.nexusengine.interest.MonthlyRate;
import io.b2mash.b2b.nexusengine.interest.PenaltyBase;
import io.b2mash.b2b.nexusengine.interest.PenaltyComponent;
import io.b2mash.b2b.nexusengine.interest.PenaltyKind;
import io.b2mash.b2b.nexusengine.interest.PenaltyRule;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.CombinedCapEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.InterestEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.JurisdictionEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.LookbackEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.PenaltyEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.RatePeriodEntry;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackDefinition.TierEntry;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads jurisdiction reference data from JSON packs on the classpath (by default
 * classpath:jurisdiction-packs/&#42;.json). Packs are read in file name order; a jurisdiction
 * defined by several packs keeps the definition of the last one.
 */
@Service
public class JurisdictionPackLoader {

  private static final Logger log = LoggerFactory.getLogger(JurisdictionPackLoader.class);
  static final String DEFAULT_PACK_LOCATION = "classpath:jurisdiction-packs/*.json";

  private final ResourcePatternResolver resourceResolver;
  private final ObjectMapper objectMapper;
  private final String packLocation;

  public JurisdictionPackLoader(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      NexusEngineProperties properties) {
    this.resourceResolver = resourceResolver;
    this.objectMapper = objectMapper;
    this.packLocation =
        properties.packLocation() == null || properties.packLocation().isBlank()
            ? DEFAULT_PACK_LOCATION
            : properties.packLocation();
  }

  public InMemoryJurisdictionConfigLookup load() {
    return load(packLocation);
  }

  /**
   * Reads every pack at {@code location}. An entry that cannot be mapped is logged and recorded
   * as invalid for its jurisdiction; the other entries still load.
   *
   * @throws IllegalStateException when a pack cannot be parsed, naming the pack file
   */
  public InMemoryJurisdictionConfigLookup load(String location) {
    var builder = InMemoryJurisdictionConfigLookup.builder();
    for (Resource resource : findPacks(location)) {
      JurisdictionPackDefinition pack = readPack(resource);
      List<JurisdictionEntry> entries =
          pack.jurisdictions() == null ? List.of() : pack.jurisdictions();
      int rejected = 0;
      for (JurisdictionEntry entry : entries) {
        if (!addEntry(builder, entry, fileName(resource))) {
          rejected++;
        }
      }
      log.info(
          "Loaded jurisdiction pack {} v{} with {} jurisdictions, {} rejected",
          pack.packId(),
          pack.version(),
          entries.size() - rejected,
          rejected);
    }
    InMemoryJurisdictionConfigLookup lookup = builder.build();
    if (!lookup.invalidJurisdictionCodes().isEmpty()) {
      log.warn(
          "Jurisdictions {} will be reported as failed until their pack entries are fixed",
          lookup.invalidJurisdictionCodes());
    }
    return lookup;
  }

  private static boolean addEntry(
      InMemoryJurisdictionConfigLookup.Builder builder, JurisdictionEntry entry, String pack) {
    if (entry.code() == null || entry.code().isBlank()) {
      log.error("Skipping jurisdiction without a code in jurisdiction pack {}", pack);
      return false;
    }
    try {
      JurisdictionConfig config = toJurisdictionConfig(entry);
      InterestPenaltyConfig charges =
          entry.interest() == null ? null : toInterestPenaltyConfig(entry.interest());
      builder.jurisdiction(config);
      if (charges != null) {
        builder.interestPenalty(entry.code(), charges);
      }
      return true;
    } catch (RuntimeException e) {
      log.error("Invalid jurisdiction {} in jurisdiction pack {}", entry.code(), pack, e);
      builder.invalid(
          entry.code(), "invalid entry in jurisdiction pack " + pack + ": " + e.getMessage());
      return false;
    }
  }

  private List<Resource> findPacks(String location) {
    try {
      Resource[] resources = resourceResolver.getResources(location);
      return Arrays.stream(resources)
          .sorted(Comparator.comparing(JurisdictionPackLoader::fileName))
          .toList();
    } catch (IOException e) {
      log.warn("Failed to scan for jurisdiction packs at {}", location, e);
      return List.of();
    }
  }

  private static String fileName(Resource resource) {
    return resource.getFilename() == null ? "" : resource.getFilename();
  }

  private JurisdictionPackDefinition readPack(Resource resource) {
    try {
      return objectMapper.readValue(resource.getInputStream(), JurisdictionPackDefinition.class);
    } catch (Exception e) {
      throw new IllegalStateException(
          "Failed to parse jurisdiction pack: " + resource.getFilename(), e);
    }
  }

  static JurisdictionConfig toJurisdictionConfig(JurisdictionEntry entry) {
    return new JurisdictionConfig(
        entry.code(),
        entry.thresholdAmount(),
        entry.thresholdCount(),
        entry.thresholdOperator() == null
            ? ThresholdOperator.OR
            : ThresholdOperator.valueOf(entry.thresholdOperator().toUpperCase(Locale.ROOT)),
        toLookbackPolicy(entry.lookback()),
        entry.taxRate(),
        parseDate(entry.marketplaceLawEffectiveDate()));
  }

  static LookbackPolicy toLookbackPolicy(LookbackEntry entry) {
    if (entry == null || entry.type() == null) {
      throw new IllegalArgumentException("lookback type is required");
    }
    return switch (entry.type().toUpperCase(Locale.ROOT)) {
      case "PREVIOUS_CALENDAR_YEAR" -> new LookbackPolicy.PreviousCalendarYear();
      case "CURRENT_OR_PREVIOUS_CALENDAR_YEAR" ->
          new LookbackPolicy.CurrentOrPreviousCalendarYear();
      case "ROLLING_WINDOW" -> new LookbackPolicy.RollingWindow(required(entry.days(), "days"));
      case "QUARTER_WINDOW" ->
          new LookbackPolicy.QuarterWindow(required(entry.quarters(), "quarters"));
      case "FIXED_ANNUAL_WINDOW" ->
          new LookbackPolicy.FixedAnnualWindow(
              entry.periodEnd() == null ? null : MonthDay.parse(entry.periodEnd()));
      default -> throw new IllegalArgumentException("unknown lookback type " + entry.type());
    };
  }

  static InterestPenaltyConfig toInterestPenaltyConfig(InterestEntry entry) {
    return new InterestPenaltyConfig(
        toAnnualRate(entry.annualRate(), entry.monthlyRate()),
        entry.method() == null
            ? InterestMethod.SIMPLE
            : InterestMethod.valueOf(entry.method().toUpperCase(Locale.ROOT)),
        entry.ratePeriods() == null
            ? List.of()
            : entry.ratePeriods().stream().map(JurisdictionPackLoader::toRatePeriod).toList(),
        entry.penaltyRate() == null
            ? DefaultConfigurations.STANDARD_PENALTY_RATE
            : entry.penaltyRate(),
        entry.penaltyMin(),
        entry.penaltyMax(),
        entry.penaltyBase() == null
            ? PenaltyBase.TAX_ONLY
            : PenaltyBase.valueOf(entry.penaltyBase().toUpperCase(Locale.ROOT)),
        Boolean.TRUE.equals(entry.vdaInterestWaived()),
        Boolean.TRUE.equals(entry.vdaPenaltiesWaived()),
        entry.vdaLookbackMonths() == null
            ? DefaultConfigurations.STANDARD_VDA_LOOKBACK_MONTHS
            : entry.vdaLookbackMonths(),
        entry.interestMinimum(),
        entry.penalties() == null
            ? List.of()
            : entry.penalties().stream().map(JurisdictionPackLoader::toPenaltyComponent).toList(),
        toCombinedCap(entry.combinedPenaltyCap()));
  }

  static PenaltyComponent toPenaltyComponent(PenaltyEntry entry) {
    if (entry.kind() == null || entry.type() == null) {
      throw new IllegalArgumentException("penalty kind and type are required");
    }
    PenaltyKind kind = PenaltyKind.valueOf(entry.kind().toUpperCase(Locale.ROOT));
    PenaltyRule rule =
        switch (entry.type().toUpperCase(Locale.ROOT)) {
          case "FLAT" -> new PenaltyRule.Flat(
              required(entry.rate(), "rate"), entry.minimum(), entry.maximum());
          case "FLAT_FEE" -> new PenaltyRule.FlatFee(required(entry.amount(), "amount"));
          case "PER_PERIOD" -> new PenaltyRule.PerPeriod(
              required(entry.ratePerPeriod(), "ratePerPeriod"),
              entry.periodDays(),
              entry.maxRate(),
              entry.minimum());
          case "PER_DAY" -> new PenaltyRule.PerDay(
              required(entry.amountPerDay(), "amountPerDay"), entry.maximum());
          case "TIERED" -> new PenaltyRule.Tiered(
              required(entry.tiers(), "tiers").stream()
                  .map(JurisdictionPackLoader::toTier)
                  .toList());
          default -> throw new IllegalArgumentException("unknown penalty type " + entry.type());
        };
    return new PenaltyComponent(kind, rule);
  }

  private static PenaltyRule.Tier toTier(TierEntry entry) {
    return new PenaltyRule.Tier(
        entry.startDay() == null ? 0 : entry.startDay(),
        entry.endDay(),
        required(entry.rate(), "tier rate"));
  }

  private static CombinedPenaltyCap toCombinedCap(CombinedCapEntry entry) {
    if (entry == null) {
      return null;
    }
    Set<PenaltyKind> appliesTo =
        entry.appliesTo() == null
            ? Set.of()
            : entry.appliesTo().stream()
                .map(kind -> PenaltyKind.valueOf(kind.toUpperCase(Locale.ROOT)))
                .collect(Collectors.toSet());
    return new CombinedPenaltyCap(required(entry.maxRate(), "combined cap maxRate"), appliesTo);
  }

  private static InterestRatePeriod toRatePeriod(RatePeriodEntry entry) {
    return new InterestRatePeriod(
        parseDate(entry.startDate()),
        parseDate(entry.endDate()),
        toAnnualRate(entry.annualRate(), entry.monthlyRate()));
  }

  private static AnnualRate toAnnualRate(BigDecimal annualRate, BigDecimal monthlyRate) {
    if (annualRate != null && monthlyRate != null) {
      throw new IllegalArgumentException("both annualRate and monthlyRate given");
    }
    if (monthlyRate != null) {
      return new MonthlyRate(monthlyRate).annualized();
    }
    if (annualRate == null) {
      throw new IllegalArgumentException("annualRate or monthlyRate is required");
    }
    return new AnnualRate(annualRate);
  }

  private static LocalDate parseDate(String value) {
    return value == null || value.isBlank() ? null : LocalDate.parse(value);
  }

  private static <T> T required(T value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
    return value;
  }
}
