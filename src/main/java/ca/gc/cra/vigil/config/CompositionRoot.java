package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.application.assertion.AssertionEvaluator;
import ca.gc.cra.vigil.application.port.ConsoleSinkPort;
import ca.gc.cra.vigil.application.port.HostTerminationPort;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.infrastructure.host.RuntimeExitTerminationAdapter;
import ca.gc.cra.vigil.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vigil.infrastructure.sink.Slf4jConsoleSinkAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires {@link AssertionEvaluator} instances from {@link AssertionSettings}.
 * <p><strong>Why:</strong> Keeps adapter selection out of the evaluator and the facade.</p>
 * <p><strong>Role:</strong> Composition root for the process-wide facade and for hosts injecting their own ports.</p>
 * <p><strong>Thread-safety:</strong> Stateless; evaluators it returns are immutable.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private CompositionRoot() {}

  /**
   * Builds the evaluator used by the process-wide facade: SLF4J sink, JVM-exit termination, and metrics chosen
   * by {@link AssertionSettings#metrics()}.
   *
   * @param settings effective settings
   * @return evaluator
   */
  public static AssertionEvaluator processEvaluator(AssertionSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return evaluator(
        settings,
        new Slf4jConsoleSinkAdapter(),
        new RuntimeExitTerminationAdapter(),
        metrics(settings));
  }

  /**
   * Builds an evaluator with host-supplied collaborators.
   *
   * @param settings effective settings
   * @param sink warning sink; {@code null} selects {@link ConsoleSinkPort#NO_OP}
   * @param termination termination hook; {@code null} selects {@link HostTerminationPort#NO_OP}
   * @param metrics metrics port; {@code null} selects {@link MetricsPort#NO_OP}
   * @return evaluator
   */
  public static AssertionEvaluator evaluator(
      AssertionSettings settings,
      ConsoleSinkPort sink,
      HostTerminationPort termination,
      MetricsPort metrics) {
    Objects.requireNonNull(settings, "settings");
    log.debug("Assertion evaluator configured with {}", settings);
    return AssertionEvaluator.builder()
        .threshold(settings.threshold())
        .quitOnAssertion(settings.quitOnAssertion())
        .includeLocation(settings.includeLocation())
        .sink(sink)
        .termination(termination)
        .metrics(metrics)
        .build();
  }

  static MetricsPort metrics(AssertionSettings settings) {
    if ("none".equals(settings.metrics())) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(settings.metrics());
  }
}
