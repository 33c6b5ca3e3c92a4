package ca.gc.cra.rpx.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for configuration and client-visible tokens.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blank or control-character content.
   *
   * @param name configuration key used in the error message
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a permission or capability token such as {@code logs}.
   *
   * @return trimmed token
   * @throws IllegalArgumentException if the token contains characters other than letters, digits, dot,
   *     underscore or hyphen
   */
  public static String requireToken(String name, String value) {
    String token = requireNonBlank(name, value);
    if (!TOKEN_PATTERN.matcher(token).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return token;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
