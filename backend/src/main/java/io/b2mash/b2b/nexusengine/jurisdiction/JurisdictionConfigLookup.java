package io.b2mash.b2b.nexusengine.jurisdiction;

import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import java.util.Optional;

/** Source of jurisdiction reference data. An empty result means the data is not on file. */
public interface JurisdictionConfigLookup {

  Optional<JurisdictionConfig> jurisdictionConfig(String jurisdictionCode);

  Optional<InterestPenaltyConfig> interestPenaltyConfig(String jurisdictionCode);

  /** Why the data on file for a jurisdiction could not be used, if it could not. */
  default Optional<String> invalidConfiguration(String jurisdictionCode) {
    return Optional.empty();
  }
}
