package io.b2mash.b2b.nexusengine.config;

import io.b2mash.b2b.nexusengine.interest.InterestMethod;
import io.b2mash.b2b.nexusengine.interest.PenaltyBase;
import io.b2mash.b2b.nexusengine.jurisdiction.ThresholdOperator;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rules substituted for jurisdictions without reference data. Unset values keep the standard
 * defaults.
 */
@ConfigurationProperties(prefix = "nexus.defaults")
public record NexusDefaultsProperties(
    BigDecimal thresholdAmount,
    Long thresholdCount,
    ThresholdOperator thresholdOperator,
    BigDecimal taxRate,
    BigDecimal annualInterestRate,
    InterestMethod interestMethod,
    BigDecimal penaltyRate,
    PenaltyBase penaltyBase,
    Integer vdaLookbackMonths) {}
