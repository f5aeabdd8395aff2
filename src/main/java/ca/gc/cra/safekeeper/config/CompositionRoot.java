package ca.gc.cra.safekeeper.config;

import ca.gc.cra.safekeeper.adapter.kafka.KafkaLedgerEventEmitter;
import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.application.port.ClockPort;
import ca.gc.cra.safekeeper.application.port.LedgerEventEmitter;
import ca.gc.cra.safekeeper.application.port.LedgerStatePort;
import ca.gc.cra.safekeeper.application.port.MetricsPort;
import ca.gc.cra.safekeeper.application.port.ValueTransferPort;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerSnapshot;
import ca.gc.cra.safekeeper.infrastructure.events.LoggingLedgerEventEmitter;
import ca.gc.cra.safekeeper.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.safekeeper.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.safekeeper.infrastructure.persistence.YamlLedgerStateStore;
import ca.gc.cra.safekeeper.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the ledger core to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link LedgerConfig} into a runnable ledger.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning clock, metrics, events, and persistence.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the clock: a fixed instant when {@code now} is configured, otherwise the system clock.</li>
 *   <li>Pick the metrics adapter from {@code metricsExporter} and the event emitter from {@code eventSink}.</li>
 *   <li>Build deployed or resumed {@link SafeKeeperLedger} instances over a caller-supplied transfer port.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Adapters are created lazily without synchronization; use from the CLI thread.</p>
 * <p><strong>Observability:</strong> Logs the selected adapters at DEBUG. Closing flushes the event emitter and
 * the metrics exporter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final LedgerConfig config;
  private final boolean publish;
  private MetricsPort metrics;
  private LedgerEventEmitter events;

  /**
   * Creates a composition root whose metrics adapter follows {@code metricsExporter}.
   *
   * @param config validated configuration; must not be {@code null}
   */
  public CompositionRoot(LedgerConfig config) {
    this(config, null);
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config validated configuration; must not be {@code null}
   * @param metrics metrics adapter; {@code null} selects one from {@code metricsExporter}
   */
  public CompositionRoot(LedgerConfig config, MetricsPort metrics) {
    this(config, metrics, true);
  }

  private CompositionRoot(LedgerConfig config, MetricsPort metrics, boolean publish) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics;
    this.publish = publish;
  }

  /**
   * Creates a composition root for {@code --dry-run}: events are discarded and metrics are not exported.
   *
   * @param config validated configuration; must not be {@code null}
   * @return root that publishes nothing
   */
  public static CompositionRoot dryRun(LedgerConfig config) {
    return new CompositionRoot(config, new NoOpMetricsAdapter(), false);
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public LedgerConfig config() {
    return config;
  }

  /**
   * Returns the clock, frozen at {@code now} when that key is configured.
   *
   * @return clock port
   */
  public ClockPort clock() {
    if (config.now().isPresent()) {
      return ClockPort.fixed(config.now().getAsLong());
    }
    return new SystemClockAdapter();
  }

  /**
   * Returns the metrics adapter, creating it on first use.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    if (metrics == null) {
      metrics = config.metricsExporter().equals("none")
          ? new NoOpMetricsAdapter()
          : new OpenTelemetryMetricsAdapter();
      log.debug("Metrics adapter: {}", metrics.getClass().getSimpleName());
    }
    return metrics;
  }

  /**
   * Returns the event emitter selected by {@code eventSink}, creating it on first use. A dry-run root always
   * returns {@link LedgerEventEmitter#NO_OP}.
   *
   * @return event emitter
   */
  public LedgerEventEmitter events() {
    if (events == null && !publish) {
      events = LedgerEventEmitter.NO_OP;
    }
    if (events == null) {
      events = switch (config.eventSink()) {
        case LOG -> new LoggingLedgerEventEmitter(metrics());
        case KAFKA -> new KafkaLedgerEventEmitter(
            config.kafkaBootstrap().orElseThrow(), config.kafkaTopic(), metrics());
        case NONE -> LedgerEventEmitter.NO_OP;
      };
      log.debug("Event sink: {}", config.eventSink());
    }
    return events;
  }

  /**
   * Returns the state store bound to {@code state}.
   *
   * @return state port
   */
  public LedgerStatePort stateStore() {
    return new YamlLedgerStateStore(config.statePath());
  }

  /**
   * Deploys a new ledger with the configured fee rate and policy.
   *
   * @param owner deployer identity
   * @param transfers payout mechanism
   * @return empty ledger
   */
  public SafeKeeperLedger deployLedger(Identity owner, ValueTransferPort transfers) {
    return SafeKeeperLedger.deploy(
        owner, config.feeBasisPoints(), config.feePolicy(), clock(), transfers, events(), metrics());
  }

  /**
   * Resumes a ledger from a saved snapshot.
   *
   * @param snapshot saved state
   * @param transfers payout mechanism
   * @return ledger over the snapshot
   */
  public SafeKeeperLedger openLedger(LedgerSnapshot snapshot, ValueTransferPort transfers) {
    return new SafeKeeperLedger(snapshot, clock(), transfers, events(), metrics());
  }

  /**
   * Closes the event emitter and the metrics adapter when they were created.
   */
  @Override
  public void close() {
    if (events != null) {
      try {
        events.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close event emitter", ex);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
