package ca.gc.cra.vigil.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class Slf4jConsoleSinkAdapterTest {
  private static final String LOGGER_NAME = "vigil.assertions.test";

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LOGGER_NAME);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void emitsDiagnosticVerbatimAtWarn() {
    Slf4jConsoleSinkAdapter sink = new Slf4jConsoleSinkAdapter(logger);

    sink.emit("Failed assertion:\n\tMessage: {} braces kept\n\tExpression: (a != b)");

    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertEquals("Failed assertion:\n\tMessage: {} braces kept\n\tExpression: (a != b)",
        event.getFormattedMessage());
  }

  @Test
  void rejectsNullText() {
    Slf4jConsoleSinkAdapter sink = new Slf4jConsoleSinkAdapter(logger);

    assertThrows(NullPointerException.class, () -> sink.emit(null));
  }
}
