package ca.gc.cra.safekeeper.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads the optional SafeKeeper YAML configuration file passed as {@code config=PATH}.
 * <p><strong>Why:</strong> Operators keep the state file, event sink, telemetry settings, and recurring command
 * arguments in one file instead of repeating them on every invocation.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Top-level sections are {@code common} or a command name such as {@code deploy} or
 *       {@code withdraw-fees}; section names are case-insensitive.</li>
 *   <li>{@code common} holds only settings every command shares; a command section may also hold that command's
 *       arguments (see {@link CommandDefaults#acceptedKeys(String)}).</li>
 *   <li>Values are scalars. Addresses must be quoted because YAML reads an unquoted {@code 0x...} as a
 *       hexadecimal integer.</li>
 * </ul>
 * Every section is checked, not only the one for the running command. Command keys win over common keys.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the section for {@code command}.
   *
   * @param path location of the YAML configuration
   * @param command CLI command whose section applies
   * @return merged settings as strings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown, the YAML is malformed, or a section or key is
   *     not one SafeKeeper accepts
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    String normalized = normalize(command);
    if (!CommandDefaults.COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Map<String, String>> sections = readSections(asMap(document, "configuration"));
    Map<String, String> merged = new LinkedHashMap<>(sections.getOrDefault(COMMON_SECTION, Map.of()));
    merged.putAll(sections.getOrDefault(normalized, Map.of()));
    return Optional.of(Map.copyOf(merged));
  }

  private static Map<String, Map<String, String>> readSections(Map<String, Object> root) {
    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String name = normalize(entry.getKey());
      Set<String> accepted;
      if (name.equals(COMMON_SECTION)) {
        accepted = CommandDefaults.commonKeys();
      } else if (CommandDefaults.COMMANDS.contains(name)) {
        accepted = CommandDefaults.acceptedKeys(name);
      } else {
        throw new IllegalArgumentException("Unknown configuration section '" + entry.getKey()
            + "'; expected common or one of " + String.join(", ", new TreeSet<>(CommandDefaults.COMMANDS)));
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Configuration section " + name + " appears more than once");
      }
      Object body = entry.getValue();
      sections.put(name, body == null ? Map.of() : readSection(name, asMap(body, name), accepted));
    }
    return sections;
  }

  private static Map<String, String> readSection(String section, Map<String, Object> body, Set<String> accepted) {
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : body.entrySet()) {
      String key = entry.getKey().trim();
      if (!accepted.contains(key)) {
        String hint = section.equals(COMMON_SECTION) ? "; command arguments belong in a command section" : "";
        throw new IllegalArgumentException("Section " + section + " does not accept '" + key + "'" + hint);
      }
      values.put(key, scalar(section, key, entry.getValue()));
    }
    return values;
  }

  private static String scalar(String section, String key, Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(section + "." + key + " must be a single value");
    }
    if (CommandDefaults.ADDRESS_KEYS.contains(key) && !(value instanceof String)) {
      throw new IllegalArgumentException(section + "." + key + " must be a quoted address");
    }
    return value.toString();
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
