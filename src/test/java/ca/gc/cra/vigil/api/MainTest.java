package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MainTest {
  private StringWriter buffer;
  private Logger root;
  private Level originalRootLevel;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalRootLevel = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    root.setLevel(originalRootLevel);
  }

  @Test
  void helpPrintsCommands() {
    ExitCode code = Main.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("levels"));
    assertTrue(buffer.toString().contains("check"));
    assertTrue(buffer.toString().contains("quitOnAssertion=BOOL"));
  }

  @Test
  void missingCommandPrintsUsage() {
    ExitCode code = Main.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: vigil <levels|check>"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    ExitCode code = Main.run(new String[] {"assemble"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: vigil <levels|check>"));
  }

  @Test
  void dispatchesCheckCaseInsensitively() {
    ExitCode code = Main.run(new String[] {"CHECK", "level=Warning", "metrics=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("level=Warning"));
  }

  @Test
  void verboseFlagRaisesRootLevel() {
    ExitCode code = Main.run(new String[] {"--verbose", "levels", "level=Error"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(Level.DEBUG, root.getLevel());
  }
}
