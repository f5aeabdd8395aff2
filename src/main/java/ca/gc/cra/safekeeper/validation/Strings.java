package ca.gc.cra.safekeeper.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation utilities for configuration and CLI input.
 * <p><strong>Why:</strong> Rejects blank or control-character values before they name Kafka topics, files, or
 * addresses.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is present, not blank, and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name parameter name for diagnostics
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic is blank, too long, or uses unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + MAX_TOPIC_LENGTH);
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
