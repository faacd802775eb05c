package io.b2mash.b2b.nexusengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcPropagatingExecutorTest {

  private final MdcPropagatingExecutor executor = new MdcPropagatingExecutor(1);

  @AfterEach
  void tearDown() {
    MDC.clear();
    executor.close();
  }

  @Test
  void execute_runsTaskWithSubmittersMdc() {
    MDC.put("analysisId", "analysis-1");

    var seen = CompletableFuture.supplyAsync(() -> MDC.get("analysisId"), executor).join();

    assertThat(seen).isEqualTo("analysis-1");
  }

  @Test
  void execute_clearsMdcAfterTask() {
    MDC.put("analysisId", "analysis-1");
    CompletableFuture.runAsync(() -> {}, executor).join();
    MDC.clear();

    var seen = CompletableFuture.supplyAsync(() -> MDC.get("analysisId"), executor).join();

    assertThat(seen).isNull();
  }

  @Test
  void constructor_rejectsNonPositiveParallelism() {
    assertThatThrownBy(() -> new MdcPropagatingExecutor(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
