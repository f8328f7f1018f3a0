package ca.gc.cra.vigil.domain.assertion;

import static ca.gc.cra.vigil.domain.assertion.SeverityLevel.ERROR;
import static ca.gc.cra.vigil.domain.assertion.SeverityLevel.NO_ASSERTIONS;
import static ca.gc.cra.vigil.domain.assertion.SeverityLevel.WARNING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class LevelPolicyTest {

  @Test
  void compareFollowsWarningErrorNoAssertionsOrder() {
    assertTrue(LevelPolicy.compare(WARNING, ERROR) < 0);
    assertTrue(LevelPolicy.compare(ERROR, NO_ASSERTIONS) < 0);
    assertTrue(LevelPolicy.compare(WARNING, NO_ASSERTIONS) < 0);
    assertTrue(LevelPolicy.compare(NO_ASSERTIONS, WARNING) > 0);
    for (SeverityLevel level : SeverityLevel.values()) {
      assertEquals(0, LevelPolicy.compare(level, level));
    }
  }

  @Test
  void parseMapsExactNamesAndAbsentValue() {
    assertEquals(NO_ASSERTIONS, LevelPolicy.parse(Optional.empty()));
    assertEquals(WARNING, LevelPolicy.parse(Optional.of("Warning")));
    assertEquals(ERROR, LevelPolicy.parse(Optional.of("Error")));
    assertEquals(NO_ASSERTIONS, LevelPolicy.parse(Optional.of("NoAssertions")));
    assertEquals(NO_ASSERTIONS, LevelPolicy.parse((String) null));
    assertEquals(NO_ASSERTIONS, LevelPolicy.parse(""));
    assertEquals(NO_ASSERTIONS, LevelPolicy.parse(Optional.of("")));
  }

  @Test
  void parseRejectsUnknownNames() {
    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> LevelPolicy.parse(Optional.of("bogus")));
    assertTrue(ex.getMessage().contains("bogus"));
    assertTrue(ex.getMessage().contains("Warning, Error, NoAssertions"));
  }

  @Test
  void parseIsCaseExact() {
    assertThrows(ConfigurationException.class, () -> LevelPolicy.parse("warning"));
    assertThrows(ConfigurationException.class, () -> LevelPolicy.parse("ERROR"));
  }

  @Test
  void parseDoesNotTrimOrTreatWhitespaceAsAbsent() {
    assertThrows(ConfigurationException.class, () -> LevelPolicy.parse(Optional.of(" Warning ")));
    assertThrows(ConfigurationException.class, () -> LevelPolicy.parse(Optional.of("   ")));
    assertThrows(ConfigurationException.class, () -> LevelPolicy.parse("Error\t"));
  }

  @Test
  void isActiveMeansSiteAtOrAboveThreshold() {
    assertTrue(LevelPolicy.isActive(WARNING, WARNING));
    assertTrue(LevelPolicy.isActive(ERROR, WARNING));
    assertFalse(LevelPolicy.isActive(WARNING, ERROR));
    assertTrue(LevelPolicy.isActive(ERROR, ERROR));
    assertFalse(LevelPolicy.isActive(WARNING, NO_ASSERTIONS));
    assertFalse(LevelPolicy.isActive(ERROR, NO_ASSERTIONS));
  }

  @Test
  void noAssertionsIsNotASiteLevel() {
    assertThrows(IllegalArgumentException.class, () -> LevelPolicy.isActive(NO_ASSERTIONS, WARNING));
    assertThrows(IllegalArgumentException.class, () -> LevelPolicy.forThreshold(WARNING).isActive(NO_ASSERTIONS));
    assertThrows(IllegalArgumentException.class, () -> AssertionSite.of(NO_ASSERTIONS, "x", () -> true));
  }

  @Test
  void boundPolicyMatchesStaticDecision() {
    for (SeverityLevel threshold : SeverityLevel.values()) {
      LevelPolicy policy = LevelPolicy.forThreshold(threshold);
      assertEquals(threshold, policy.threshold());
      assertEquals(LevelPolicy.isActive(WARNING, threshold), policy.isActive(WARNING));
      assertEquals(LevelPolicy.isActive(ERROR, threshold), policy.isActive(ERROR));
    }
  }
}
