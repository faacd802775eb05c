package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** Immutable map-backed lookup, built from JSON packs or directly in tests. */
public final class InMemoryJurisdictionConfigLookup implements JurisdictionConfigLookup {

  private final Map<String, JurisdictionConfig> jurisdictionConfigs;
  private final Map<String, InterestPenaltyConfig> interestPenaltyConfigs;
  private final Map<String, String> invalidConfigurations;

  public InMemoryJurisdictionConfigLookup(
      Map<String, JurisdictionConfig> jurisdictionConfigs,
      Map<String, InterestPenaltyConfig> interestPenaltyConfigs) {
    this(jurisdictionConfigs, interestPenaltyConfigs, Map.of());
  }

  private InMemoryJurisdictionConfigLookup(
      Map<String, JurisdictionConfig> jurisdictionConfigs,
      Map<String, InterestPenaltyConfig> interestPenaltyConfigs,
      Map<String, String> invalidConfigurations) {
    this.jurisdictionConfigs = Map.copyOf(jurisdictionConfigs);
    this.interestPenaltyConfigs = Map.copyOf(interestPenaltyConfigs);
    this.invalidConfigurations = Map.copyOf(invalidConfigurations);
  }

  public static InMemoryJurisdictionConfigLookup empty() {
    return new InMemoryJurisdictionConfigLookup(Map.of(), Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<JurisdictionConfig> jurisdictionConfig(String jurisdictionCode) {
    return Optional.ofNullable(jurisdictionConfigs.get(jurisdictionCode));
  }

  @Override
  public Optional<InterestPenaltyConfig> interestPenaltyConfig(String jurisdictionCode) {
    return Optional.ofNullable(interestPenaltyConfigs.get(jurisdictionCode));
  }

  @Override
  public Optional<String> invalidConfiguration(String jurisdictionCode) {
    return Optional.ofNullable(invalidConfigurations.get(jurisdictionCode));
  }

  public Set<String> jurisdictionCodes() {
    return Set.copyOf(jurisdictionConfigs.keySet());
  }

  public Set<String> invalidJurisdictionCodes() {
    return Set.copyOf(invalidConfigurations.keySet());
  }

  public static final class Builder {

    private final Map<String, JurisdictionConfig> jurisdictionConfigs = new TreeMap<>();
    private final Map<String, InterestPenaltyConfig> interestPenaltyConfigs = new TreeMap<>();
    private final Map<String, String> invalidConfigurations = new TreeMap<>();

    private Builder() {}

    public Builder jurisdiction(JurisdictionConfig config) {
      jurisdictionConfigs.put(config.jurisdictionCode(), config);
      invalidConfigurations.remove(config.jurisdictionCode());
      return this;
    }

    /** Marks a jurisdiction's data as unusable, replacing anything loaded for it before. */
    public Builder invalid(String jurisdictionCode, String reason) {
      jurisdictionConfigs.remove(jurisdictionCode);
      interestPenaltyConfigs.remove(jurisdictionCode);
      invalidConfigurations.put(jurisdictionCode, reason);
      return this;
    }

    public Builder interestPenalty(String jurisdictionCode, InterestPenaltyConfig config) {
      interestPenaltyConfigs.put(jurisdictionCode, config);
      return this;
    }

    public InMemoryJurisdictionConfigLookup build() {
      return new InMemoryJurisdictionConfigLookup(
          jurisdictionConfigs, interestPenaltyConfigs, invalidConfigurations);
    }
  }
}
