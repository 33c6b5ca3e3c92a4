package ca.gc.cra.rpx.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and normalized flags.
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags lower-case flags; help and verbose aliases are normalized to {@code --help} and {@code --verbose}
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments; {@code null} and blank entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(kv, flags);
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was supplied (case-insensitive).
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
