package ca.gc.cra.safekeeper.config;

import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.domain.escrow.FeeCalculator;
import ca.gc.cra.safekeeper.domain.escrow.FeePolicy;
import ca.gc.cra.safekeeper.validation.Net;
import ca.gc.cra.safekeeper.validation.Numbers;
import ca.gc.cra.safekeeper.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Runtime configuration shared by the ledger CLI commands.
 * <p><strong>Why:</strong> Consolidates CLI arguments, YAML sections, and defaults into one validated value.</p>
 * <p><strong>Role:</strong> Input to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param statePath ledger state file
 * @param feeBasisPoints fee rate a new deployment starts with
 * @param feePolicy fee policy a new deployment starts with
 * @param eventSink destination for ledger events
 * @param kafkaBootstrap bootstrap servers; required when {@code eventSink} is {@link EventSink#KAFKA}
 * @param kafkaTopic topic receiving ledger events
 * @param metricsExporter {@code otlp} or {@code none}
 * @param now fixed clock reading in epoch seconds; empty uses the system clock
 * @since 0.1.0
 * @implNote Deployment-only keys ({@code feeBasisPoints}, {@code feePolicy}) are ignored by the other commands,
 *     which read the values persisted in the state file.
 */
public record LedgerConfig(
    Path statePath,
    int feeBasisPoints,
    FeePolicy feePolicy,
    EventSink eventSink,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    String metricsExporter,
    OptionalLong now) {

  /** Topic used when {@code kafkaTopic} is not configured. */
  public static final String DEFAULT_KAFKA_TOPIC = "safekeeper.ledger.events";

  private static final Path DEFAULT_STATE =
      Path.of(System.getProperty("user.home", "."), ".safekeeper", "ledger.yaml");

  /**
   * Normalizes and validates the configuration.
   *
   * @throws IllegalArgumentException if a value is out of range or Kafka is selected without bootstrap servers
   */
  public LedgerConfig {
    statePath = Objects.requireNonNull(statePath, "statePath").toAbsolutePath().normalize();
    Numbers.requireRange("feeBasisPoints", feeBasisPoints, 0, FeeCalculator.BASIS_POINTS_DENOMINATOR);
    feePolicy = Objects.requireNonNullElse(feePolicy, FeePolicy.STORE_AND_CLAIM);
    eventSink = Objects.requireNonNullElse(eventSink, EventSink.LOG);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty())
        .map(Net::validateBootstrapServers);
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic == null ? DEFAULT_KAFKA_TOPIC : kafkaTopic);
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "otlp"
        : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("otlp") && !metricsExporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    now = Objects.requireNonNullElse(now, OptionalLong.empty());
    if (eventSink == EventSink.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when eventSink=kafka");
    }
  }

  /**
   * Returns the configuration used when nothing is supplied.
   *
   * @return defaults: state under {@code ~/.safekeeper}, 42 bp, store-and-claim, log sink, OTLP metrics
   */
  public static LedgerConfig defaults() {
    return new LedgerConfig(
        DEFAULT_STATE,
        SafeKeeperLedger.DEFAULT_FEE_BASIS_POINTS,
        FeePolicy.STORE_AND_CLAIM,
        EventSink.LOG,
        Optional.empty(),
        DEFAULT_KAFKA_TOPIC,
        "otlp",
        OptionalLong.empty());
  }

  /**
   * Creates a configuration from flattened key/value options.
   *
   * @param options keys such as {@code state}, {@code eventSink}, {@code kafkaBootstrap}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static LedgerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    LedgerConfig defaults = defaults();

    Path state = optionalString(options.get("state"))
        .map(LedgerConfig::parsePath)
        .orElse(defaults.statePath());
    int feeBasisPoints = optionalString(options.get("feeBasisPoints"))
        .map(raw -> Numbers.parseInt("feeBasisPoints", raw))
        .orElse(defaults.feeBasisPoints());
    FeePolicy feePolicy = FeePolicy.fromString(options.get("feePolicy"));
    EventSink sink = EventSink.fromString(options.get("eventSink"));
    Optional<String> bootstrap = optionalString(options.get("kafkaBootstrap"));
    String topic = optionalString(options.get("kafkaTopic")).orElse(defaults.kafkaTopic());
    String exporter = optionalString(options.get("metricsExporter")).orElse(defaults.metricsExporter());
    OptionalLong now = optionalString(options.get("now"))
        .map(raw -> OptionalLong.of(Numbers.parseLong("now", raw)))
        .orElse(OptionalLong.empty());

    return new LedgerConfig(state, feeBasisPoints, feePolicy, sink, bootstrap, topic, exporter, now);
  }

  private static Path parsePath(String raw) {
    String value = raw.startsWith("~") ? System.getProperty("user.home", ".") + raw.substring(1) : raw;
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("state is not a valid path: " + raw, ex);
    }
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }
}
