package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LevelsCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void errorThresholdElidesWarnings() {
    ExitCode code = LevelsCli.run(new String[] {"level=Error"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of(
        "threshold: Error",
        "Warning       0 elided",
        "Error         1 active",
        "NoAssertions  2 threshold-only"), lines());
  }

  @Test
  void emptyLevelDisablesEverySite() {
    ExitCode code = LevelsCli.run(new String[] {"level="});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = lines();
    assertEquals("threshold: NoAssertions", lines.get(0));
    assertTrue(lines.get(1).endsWith("elided"));
    assertTrue(lines.get(2).endsWith("elided"));
  }

  @Test
  void invalidLevelReturnsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, LevelsCli.run(new String[] {"level=warning"}));
  }

  @Test
  void badArgumentNameReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, LevelsCli.run(new String[] {"le vel=Error"}));
    assertTrue(buffer.toString().contains("usage: vigil levels"));
  }

  private List<String> lines() {
    return buffer.toString().lines().toList();
  }
}
