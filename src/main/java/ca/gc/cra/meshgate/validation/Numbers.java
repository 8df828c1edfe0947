package ca.gc.cra.meshgate.validation;

/**
 * Numeric range checks for ports, pool sizes, capacities, and timeouts.
 *
 * @since 0.1.0
 */
public final class Numbers {

  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} for fluent call sites
   * @throws IllegalArgumentException if {@code value} is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks its range.
   *
   * @param name parameter name used in diagnostics
   * @param raw text to parse
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or is out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    int value;
    try {
      value = Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + trimmed + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
