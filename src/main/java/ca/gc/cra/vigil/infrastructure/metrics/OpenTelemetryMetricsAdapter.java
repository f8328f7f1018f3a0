package ca.gc.cra.vigil.infrastructure.metrics;

import ca.gc.cra.vigil.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards assertion failure counters to OpenTelemetry.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("vigil.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the named exporter.
   *
   * @param exporter {@code otlp} or {@code none}
   * @throws IllegalArgumentException if the exporter name is unknown
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(OpenTelemetryBootstrap.ExporterMode.from(exporter)));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Indicates whether metrics are discarded.
   *
   * @return {@code true} when no exporter is active
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributes(key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return bootstrap.meter()
        .counterBuilder(key)
        .setUnit("1")
        .setDescription("Assertion counter for " + key)
        .build();
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }
}
