package ca.gc.cra.safekeeper.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network endpoint validation for the Kafka bootstrap list and the OTLP collector endpoint.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated Kafka bootstrap list.
   *
   * @param value entries of the form {@code host:port} or {@code [ipv6]:port}
   * @return normalized list joined with commas
   * @throws IllegalArgumentException if the list is empty or any entry is malformed
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> entries = new ArrayList<>();
    for (String part : sanitized.split(",")) {
      if (part.isBlank()) {
        continue;
      }
      entries.add(validateHostPort(part));
    }
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return String.join(",", entries);
  }

  /**
   * Validates a single {@code host:port} pair supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param value candidate pair
   * @return normalized pair
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String port;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      String literal = sanitized.substring(1, close);
      requireIpv6(literal);
      host = '[' + literal + ']';
      port = sanitized.substring(close + 2);
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      port = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        for (String octet : host.split("\\.")) {
          Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
        }
      } else {
        requireHostname(host);
      }
    }
    long portNumber = Numbers.requireRange("port", Numbers.parseLong("port", port), 1, 65_535);
    return host + ':' + portNumber;
  }

  /**
   * Validates an OTLP endpoint URL.
   *
   * @param value candidate endpoint, e.g. {@code http://collector:4317}
   * @return trimmed endpoint
   * @throws IllegalArgumentException if the value is not an absolute http(s) URI with a host
   */
  public static String validateHttpEndpoint(String value) {
    String sanitized = Strings.requireNonBlank("otelEndpoint", value);
    try {
      URI uri = new URI(sanitized);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        throw new IllegalArgumentException("otelEndpoint must use http or https (was " + sanitized + ")");
      }
      if (uri.getHost() == null) {
        throw new IllegalArgumentException("otelEndpoint must include a host (was " + sanitized + ")");
      }
      return sanitized;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint is not a valid URI: " + sanitized, ex);
    }
  }

  private static void requireHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
    }
  }

  private static void requireIpv6(String literal) {
    try {
      if (!(InetAddress.getByName(literal) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + literal);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + literal, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
