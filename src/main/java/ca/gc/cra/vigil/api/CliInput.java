package ca.gc.cra.vigil.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed CLI arguments split into global flags and positional/key-value arguments.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] arguments;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] arguments, boolean help, boolean verbose) {
    this.arguments = arguments;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false);
    }

    List<String> remaining = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else {
        remaining.add(arg);
      }
    }
    return new CliInput(remaining.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns a copy of the non-flag arguments; the first is the command name.
   *
   * @return remaining arguments
   */
  public String[] arguments() {
    return Arrays.copyOf(arguments, arguments.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when {@code --verbose} (or equivalent) was present
   */
  public boolean verbose() {
    return verbose;
  }
}
