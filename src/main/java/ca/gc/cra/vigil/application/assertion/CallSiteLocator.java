package ca.gc.cra.vigil.application.assertion;

import ca.gc.cra.vigil.domain.assertion.SourceLocation;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the caller of an assertion by walking the stack past the assertion library's own frames.
 *
 * <p>Only used on the failure path; a passing assertion never walks the stack.</p>
 *
 * @since 0.1.0
 */
public final class CallSiteLocator {
  static final Set<String> LIBRARY_FRAMES = Set.of(
      "ca.gc.cra.vigil.Assertions",
      "ca.gc.cra.vigil.application.assertion.AssertionEvaluator",
      "ca.gc.cra.vigil.application.assertion.CallSiteLocator");

  private final StackWalker walker = StackWalker.getInstance();
  private final Set<String> skipped;

  /** Creates a locator that skips the assertion library frames. */
  public CallSiteLocator() {
    this(LIBRARY_FRAMES);
  }

  /**
   * Creates a locator that skips exactly the given classes.
   *
   * @param skipped fully qualified class names whose frames are ignored
   */
  public CallSiteLocator(Set<String> skipped) {
    this.skipped = Set.copyOf(Objects.requireNonNull(skipped, "skipped"));
  }

  /**
   * Returns the first frame outside the skipped classes.
   *
   * @return caller location, or {@link SourceLocation#UNKNOWN} when the stack holds no such frame
   */
  public SourceLocation locate() {
    return walker.walk(frames -> frames
        .filter(frame -> !skipped.contains(frame.getClassName()))
        .findFirst()
        .map(frame -> new SourceLocation(
            frame.getFileName(), frame.getLineNumber(), frame.getClassName(), frame.getMethodName()))
        .orElse(SourceLocation.UNKNOWN));
  }
}
