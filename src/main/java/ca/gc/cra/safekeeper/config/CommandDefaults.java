package ca.gc.cra.safekeeper.config;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each SafeKeeper CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class CommandDefaults {
  /** Commands that accept configuration; each may own a YAML section of the same name. */
  public static final Set<String> COMMANDS = Set.of(
      "deploy",
      "store",
      "claim",
      "set-fee",
      "withdraw-fees",
      "transfer-ownership",
      "renounce-ownership",
      "show");

  /** Arguments whose values are account addresses. */
  public static final Set<String> ADDRESS_KEYS =
      Set.of("owner", "caller", "beneficiary", "recipient", "newOwner", "noble", "payouts");

  private static final Set<String> COMMON_KEYS = Set.of(
      "state",
      "eventSink",
      "kafkaBootstrap",
      "kafkaTopic",
      "metricsExporter",
      "otelEndpoint",
      "otelResourceAttributes",
      "verbose",
      "now");

  private static final Map<String, Set<String>> COMMAND_KEYS = Map.of(
      "deploy", Set.of("owner", "feeBasisPoints", "feePolicy", "allowOverwrite", "dryRun"),
      "store", Set.of("caller", "beneficiary", "value", "unlockTime", "lockFor", "dryRun"),
      "claim", Set.of("caller", "id", "dryRun"),
      "set-fee", Set.of("caller", "rate", "dryRun"),
      "withdraw-fees", Set.of("caller", "recipient", "dryRun"),
      "transfer-ownership", Set.of("caller", "newOwner", "dryRun"),
      "renounce-ownership", Set.of("caller", "dryRun"),
      "show", Set.of("treasure", "noble", "beneficiary", "payouts", "offset", "limit"));

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private CommandDefaults() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command CLI command such as {@code store} or {@code show}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (normalized.equals("deploy")) {
      LedgerConfig config = LedgerConfig.defaults();
      defaults.put("feeBasisPoints", Integer.toString(config.feeBasisPoints()));
      defaults.put("feePolicy", config.feePolicy().name());
      defaults.put("allowOverwrite", "false");
    }
    if (!normalized.equals("show")) {
      defaults.put("dryRun", "false");
    }
    return Map.copyOf(defaults);
  }

  /**
   * Returns the settings every command shares, which are the only keys a {@code common} YAML section may hold.
   *
   * @return unmodifiable key set
   */
  public static Set<String> commonKeys() {
    return COMMON_KEYS;
  }

  /**
   * Returns every key {@code command} understands: the shared settings plus the command's own arguments.
   *
   * @param command CLI command such as {@code claim}
   * @return unmodifiable key set
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Set<String> acceptedKeys(String command) {
    Objects.requireNonNull(command, "command");
    Set<String> own = COMMAND_KEYS.get(command.trim().toLowerCase(Locale.ROOT));
    if (own == null) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Set<String> keys = new HashSet<>(COMMON_KEYS);
    keys.addAll(own);
    return Set.copyOf(keys);
  }

  private static Map<String, String> buildCommonDefaults() {
    LedgerConfig config = LedgerConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("state", config.statePath().toString());
    map.put("eventSink", config.eventSink().name().toLowerCase(Locale.ROOT));
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", config.kafkaTopic());
    map.put("metricsExporter", config.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
