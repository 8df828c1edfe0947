package ca.gc.cra.meshgate.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into flags ({@code --dry-run}, {@code --verbose}) and {@code key=value} pairs.
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags normalized (lowercase) flags
 * @since 0.1.0
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  /**
   * Copies the collections.
   */
  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_ALIASES.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_ALIASES.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  /**
   * Returns the non-flag arguments as an array for {@link CliArgsParser#toMap(String[])}.
   *
   * @return copy of the arguments
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Indicates whether help was requested.
   *
   * @return {@code true} for {@code --help}, {@code -h}, or {@code help}
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether DEBUG logging was requested.
   *
   * @return {@code true} for {@code --verbose}, {@code -v}, or {@code --debug}
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag, ignoring case.
   *
   * @param flag flag such as {@code --dry-run}
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the arguments after the first one, used when the first names a command.
   *
   * @return remaining arguments, or an empty array
   */
  String[] afterCommand() {
    String[] all = keyValueArray();
    return all.length <= 1 ? new String[0] : Arrays.copyOfRange(all, 1, all.length);
  }
}
