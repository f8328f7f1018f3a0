package ca.gc.cra.vigil.infrastructure.sink;

import ca.gc.cra.vigil.application.port.ConsoleSinkPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes warning diagnostics to SLF4J at WARN level.
 *
 * <p>The diagnostic text is logged verbatim as the formatted message so log consumers see the exact
 * {@code Failed assertion:} layout.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jConsoleSinkAdapter implements ConsoleSinkPort {
  private final Logger logger;

  /** Creates a sink that logs through this class's logger. */
  public Slf4jConsoleSinkAdapter() {
    this(LoggerFactory.getLogger(Slf4jConsoleSinkAdapter.class));
  }

  Slf4jConsoleSinkAdapter(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void emit(String text) {
    logger.warn("{}", Objects.requireNonNull(text, "text"));
  }
}
