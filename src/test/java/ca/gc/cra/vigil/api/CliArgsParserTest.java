package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"level=Error", "config=a=b.yaml", "metrics="});

    assertEquals(List.of("level", "config", "metrics"), List.copyOf(map.keySet()));
    assertEquals("a=b.yaml", map.get("config"));
    assertEquals("", map.get("metrics"));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"level"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=Error"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"le vel=Error"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"level=Err\u0007or"}));
  }
}
