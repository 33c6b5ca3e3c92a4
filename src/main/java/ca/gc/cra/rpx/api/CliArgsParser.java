package ca.gc.cra.rpx.api;

import ca.gc.cra.rpx.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a mutable, insertion-ordered map.
 * <p>Values may themselves contain {@code '='} (for example {@code otelResourceAttributes=a=b}); only the first one
 * separates key from value. A later duplicate key replaces an earlier one.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map of keys to trimmed values
   * @throws IllegalArgumentException for arguments without {@code '='}, invalid keys or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = arg.substring(idx + 1).trim();
      if (!value.isEmpty()) {
        value = Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
