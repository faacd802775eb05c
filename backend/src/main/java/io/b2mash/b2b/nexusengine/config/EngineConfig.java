package io.b2mash.b2b.nexusengine.config;

import io.b2mash.b2b.nexusengine.interest.AnnualRate;
import io.b2mash.b2b.nexusengine.interest.InterestPenaltyConfig;
import io.b2mash.b2b.nexusengine.jurisdiction.DefaultConfigurations;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfig;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfigLookup;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionPackLoader;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({NexusEngineProperties.class, NexusDefaultsProperties.class})
public class EngineConfig {

  @Bean(destroyMethod = "close")
  MdcPropagatingExecutor nexusEngineExecutor(NexusEngineProperties properties) {
    int parallelism =
        properties.parallelism() > 0
            ? properties.parallelism()
            : Runtime.getRuntime().availableProcessors();
    return new MdcPropagatingExecutor(parallelism);
  }

  /** Reference data of the jurisdiction packs on the classpath, loaded once at startup. */
  @Bean
  JurisdictionConfigLookup jurisdictionConfigLookup(JurisdictionPackLoader packLoader) {
    return packLoader.load();
  }

  @Bean
  DefaultConfigurations defaultConfigurations(NexusDefaultsProperties props) {
    JurisdictionConfig standard = DefaultConfigurations.standardJurisdiction();
    InterestPenaltyConfig standardInterest = DefaultConfigurations.standardInterestPenalty();

    var jurisdiction =
        new JurisdictionConfig(
            standard.jurisdictionCode(),
            props.thresholdAmount() != null ? props.thresholdAmount() : standard.thresholdAmount(),
            props.thresholdCount() != null ? props.thresholdCount() : standard.thresholdCount(),
            props.thresholdOperator() != null
                ? props.thresholdOperator()
                : standard.thresholdOperator(),
            new LookbackPolicy.CurrentOrPreviousCalendarYear(),
            props.taxRate() != null ? props.taxRate() : standard.taxRate(),
            null);
    var interestPenalty =
        new InterestPenaltyConfig(
            props.annualInterestRate() != null
                ? new AnnualRate(props.annualInterestRate())
                : standardInterest.annualInterestRate(),
            props.interestMethod() != null
                ? props.interestMethod()
                : standardInterest.interestMethod(),
            standardInterest.ratePeriods(),
            props.penaltyRate() != null ? props.penaltyRate() : standardInterest.penaltyRate(),
            null,
            null,
            props.penaltyBase() != null ? props.penaltyBase() : standardInterest.penaltyBase(),
            false,
            false,
            props.vdaLookbackMonths() != null
                ? props.vdaLookbackMonths()
                : standardInterest.vdaLookbackMonths());
    return new DefaultConfigurations(jurisdiction, interestPenalty);
  }
}
