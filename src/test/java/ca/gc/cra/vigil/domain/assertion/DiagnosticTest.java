package ca.gc.cra.vigil.domain.assertion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Test;

class DiagnosticTest {
  private static final SourceLocation LOCATION =
      new SourceLocation("Inventory.java", 42, "demo.Inventory", "restock");

  @Test
  void renderWithoutMessageOmitsMessageLine() {
    Diagnostic diagnostic = new Diagnostic("x > 0", null, LOCATION);

    assertEquals("Failed assertion:\n\tExpression: (x > 0)", diagnostic.render());
  }

  @Test
  void emptyMessageIsTreatedAsAbsent() {
    Diagnostic diagnostic = new Diagnostic("x > 0", "", LOCATION);

    assertEquals("Failed assertion:\n\tExpression: (x > 0)", diagnostic.render());
  }

  @Test
  void renderWithMessage() {
    Diagnostic diagnostic = new Diagnostic("len < cap", "bound check", LOCATION);

    assertEquals("Failed assertion:\n\tMessage: bound check\n\tExpression: (len < cap)", diagnostic.render());
  }

  @Test
  void locationPrefixUsesFileAndLine() {
    Diagnostic diagnostic = new Diagnostic("len < cap", "bound check", LOCATION);

    assertEquals(
        "Inventory.java:42: Failed assertion:\n\tMessage: bound check\n\tExpression: (len < cap)",
        diagnostic.render(true));
  }

  @Test
  void missingLocationFallsBackToUnknown() {
    Diagnostic diagnostic = new Diagnostic("ok", null, null);

    assertSame(SourceLocation.UNKNOWN, diagnostic.location());
    assertEquals("<unknown>: Failed assertion:\n\tExpression: (ok)", diagnostic.renderWithLocation());
  }

  @Test
  void failureCarriesDiagnosticText() {
    Diagnostic diagnostic = new Diagnostic("len < cap", "bound check", LOCATION);
    AssertionFailure failure = new AssertionFailure(diagnostic);

    assertEquals(diagnostic.render(), failure.getMessage());
    assertSame(diagnostic, failure.diagnostic());
    assertEquals(LOCATION, failure.location());
  }

  @Test
  void failureKeepsLocationAcrossSerialization() throws IOException, ClassNotFoundException {
    AssertionFailure failure = new AssertionFailure(new Diagnostic("len < cap", "bound check", LOCATION));

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(failure);
    }
    AssertionFailure restored;
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      restored = (AssertionFailure) in.readObject();
    }

    assertEquals(LOCATION, restored.location());
    assertEquals(failure.getMessage(), restored.getMessage());
    assertEquals("bound check", restored.diagnostic().message());
  }
}
