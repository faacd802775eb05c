package io.b2mash.b2b.nexusengine;

import static io.b2mash.b2b.nexusengine.testutil.TestTransactions.direct;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.nexusengine.engine.Confidence;
import io.b2mash.b2b.nexusengine.engine.NexusAnalysisRequest;
import io.b2mash.b2b.nexusengine.engine.NexusEngine;
import io.b2mash.b2b.nexusengine.jurisdiction.DefaultConfigurations;
import io.b2mash.b2b.nexusengine.jurisdiction.JurisdictionConfigLookup;
import io.b2mash.b2b.nexusengine.lookback.LookbackPolicy;
import io.b2mash.b2b.nexusengine.nexus.NexusType;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class NexusEngineApplicationTest {

  @Autowired private NexusEngine nexusEngine;
  @Autowired private JurisdictionConfigLookup jurisdictionConfigLookup;
  @Autowired private DefaultConfigurations defaultConfigurations;

  @Test
  void contextLoads_withBundledJurisdictionPacks() {
    var connecticut = jurisdictionConfigLookup.jurisdictionConfig("CT").orElseThrow();

    assertThat(connecticut.lookbackPolicy())
        .isEqualTo(new LookbackPolicy.FixedAnnualWindow(MonthDay.of(9, 30)));
    assertThat(jurisdictionConfigLookup.interestPenaltyConfig("TX").orElseThrow().ratePeriods())
        .hasSize(3);
    assertThat(
            jurisdictionConfigLookup.interestPenaltyConfig("TX").orElseThrow().penaltyComponents())
        .hasSize(2);
    assertThat(jurisdictionConfigLookup.invalidConfiguration("TX")).isEmpty();
  }

  @Test
  void contextLoads_defaultsBoundFromProperties() {
    var defaults = defaultConfigurations.jurisdictionConfig("ZZ");

    assertThat(defaults.jurisdictionCode()).isEqualTo("ZZ");
    assertThat(defaults.thresholdAmount()).isEqualByComparingTo("100000");
    assertThat(defaults.thresholdCount()).isEqualTo(200L);
    assertThat(defaultConfigurations.interestPenaltyConfig().vdaLookbackMonths()).isEqualTo(48);
  }

  @Test
  void analyze_withBundledPacks() {
    var sales =
        List.of(
            direct("wa-1", "2023-02-01", "WA", "60000.00"),
            direct("wa-2", "2023-05-01", "WA", "60000.00"),
            direct("zz-1", "2023-05-01", "ZZ", "10.00"));

    var result =
        nexusEngine.analyze(
            NexusAnalysisRequest.of(sales, jurisdictionConfigLookup, LocalDate.of(2024, 1, 1)));

    var washington = result.jurisdiction("WA").orElseThrow();
    assertThat(washington.confidence()).isEqualTo(Confidence.FULL);
    assertThat(washington.years().get(0).nexusType()).isEqualTo(NexusType.ECONOMIC);
    assertThat(washington.years().get(0).obligationStartDate())
        .isEqualTo(LocalDate.of(2023, 6, 1));
    assertThat(result.jurisdiction("ZZ").orElseThrow().confidence())
        .isEqualTo(Confidence.DEGRADED);
  }
}
