package ca.gc.cra.aoaisim.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command-line tokens split into {@code key=value} overrides and bare flags.
 *
 * @param keyValueArgs tokens that are not flags, in their original order
 * @param flags lower-cased flags such as {@code --dry-run}
 */
record CliInput(List<String> keyValueArgs, Set<String> flags) {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String DRY_RUN = "--dry-run";

  CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments. {@code -h} and {@code help} normalize to {@code --help}; {@code -v} and
   * {@code --debug} normalize to {@code --verbose}.
   *
   * @param args raw arguments; {@code null} and blank entries are ignored
   * @return parsed input
   */
  static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new TreeSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(normalizeFlag(arg.toLowerCase(Locale.ROOT)));
        } else if ("help".equalsIgnoreCase(arg)) {
          flags.add(HELP);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  boolean help() {
    return flags.contains(HELP);
  }

  boolean verbose() {
    return flags.contains(VERBOSE);
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** @return non-flag tokens as an array */
  String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }

  private static String normalizeFlag(String flag) {
    return switch (flag) {
      case "-h" -> HELP;
      case "-v", "--debug" -> VERBOSE;
      default -> flag;
    };
  }
}
