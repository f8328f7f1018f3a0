package ca.gc.cra.vigil.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.vigil.application.assertion.AssertionEvaluator;
import ca.gc.cra.vigil.domain.assertion.AssertionFailure;
import ca.gc.cra.vigil.domain.assertion.SeverityLevel;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void failedAssertionsAreCountedPerLevel() {
    AssertionEvaluator evaluator = AssertionEvaluator.builder()
        .threshold(SeverityLevel.WARNING)
        .metrics(adapter)
        .build();

    evaluator.check(SeverityLevel.WARNING, "a", () -> false);
    evaluator.check(SeverityLevel.WARNING, "b", () -> false);
    evaluator.check(SeverityLevel.WARNING, "c", () -> true);
    assertThrows(AssertionFailure.class, () -> evaluator.check(SeverityLevel.ERROR, "d", () -> false));
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertEquals(2L, counterValue(metrics, "assert.warning.failed"));
    assertEquals(1L, counterValue(metrics, "assert.error.failed"));
    assertFalse(find(metrics, "assert.termination.requested").isPresent());
  }

  @Test
  void counterCarriesKeyAttributeAndServiceResource() {
    adapter.increment("assert.error.failed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "assert.error.failed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("assert.error.failed", point.getAttributes().get(AttributeKey.stringKey("vigil.metric.key")));
    assertEquals("vigil", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  private static long counterValue(Collection<MetricData> metrics, String name) {
    MetricData data = find(metrics, name).orElseThrow(() -> new AssertionError("missing metric " + name));
    return data.getLongSumData().getPoints().iterator().next().getValue();
  }
}
