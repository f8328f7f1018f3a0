package ca.gc.cra.vigil.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Map;
import org.junit.jupiter.api.Test;

class BuildThresholdTest {

  @Test
  void buildPropertiesWereSubstituted() {
    for (Map.Entry<String, String> entry : AssertionSettings.buildDefaults().entrySet()) {
      assertFalse(entry.getValue().contains("${"), "unfiltered build property for " + entry.getKey());
    }
  }

  @Test
  void buildDefaultsParse() {
    AssertionSettings settings = assertDoesNotThrow(AssertionSettings::fromBuild);

    assertEquals(AssertionSettings.buildDefaults().keySet(), AssertionSettings.KNOWN_KEYS);
    assertEquals(settings, AssertionSettings.fromMap(settings.toMap()));
  }
}
