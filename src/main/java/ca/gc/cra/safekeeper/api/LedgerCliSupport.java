package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.config.CommandDefaults;
import ca.gc.cra.safekeeper.config.CompositionRoot;
import ca.gc.cra.safekeeper.config.ConfigMerger;
import ca.gc.cra.safekeeper.config.LedgerConfig;
import ca.gc.cra.safekeeper.config.YamlConfigLoader;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerException;
import ca.gc.cra.safekeeper.logging.LoggingConfigurator;
import ca.gc.cra.safekeeper.logging.Logs;
import ca.gc.cra.safekeeper.validation.Numbers;
import ca.gc.cra.safekeeper.validation.Paths;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared driver for every ledger subcommand.
 * <p><strong>Why:</strong> All commands parse arguments, merge YAML and defaults, open the state file, and map
 * failures to {@link ExitCode} the same way.</p>
 * <p><strong>Role:</strong> Driving adapter between the CLI and the ledger core.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the effective configuration with precedence CLI &gt; YAML &gt; defaults.</li>
 *   <li>Run the command's action and save state only when a mutating command commits outside a dry run.</li>
 *   <li>Translate ledger rejections to {@link ExitCode#LEDGER_REJECTED}.</li>
 * </ul>
 * <p><strong>Observability:</strong> Logs failures at ERROR with the ledger error kind.</p>
 *
 * @since 0.1.0
 */
final class LedgerCliSupport {
  private static final Logger log = LoggerFactory.getLogger(LedgerCliSupport.class);
  private static final int MAX_LOGGED_MESSAGE_BYTES = 512;

  private LedgerCliSupport() {}

  /**
   * Executes {@code command} with raw arguments.
   *
   * @param command subcommand to run
   * @param args arguments following the subcommand name
   * @return exit code capturing the outcome
   */
  static ExitCode run(LedgerCommand command, String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(command.helpText().stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command.name());
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", input.unknownFlags()));
      CliPrinter.println(command.usage());
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_MESSAGE_BYTES));
      CliPrinter.println(command.usage());
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, command.name());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    LedgerConfig config;
    LedgerCommand.Action action;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          command.name(), yaml, kv, CommandDefaults.asFlatMap(command.name()), log::warn);
      TelemetryConfigurator.configureMetrics(effective);
      config = LedgerConfig.fromMap(effective);
      action = command.prepare(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}",
          command.name(), Logs.truncate(ex.getMessage(), MAX_LOGGED_MESSAGE_BYTES));
      CliPrinter.println(command.usage());
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = command.mutating()
        && (input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun"));
    boolean allowOverwrite = input.hasFlag("--allow-overwrite")
        || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    if (command.mutating()) {
      try {
        Paths.validateStateFile(config.statePath(), !dryRun, allowOverwrite || !"deploy".equals(command.name()));
      } catch (IllegalArgumentException ex) {
        log.error("Invalid state path: {}", ex.getMessage());
        return ExitCode.INVALID_ARGS;
      }
    }

    try (CompositionRoot root = dryRun ? CompositionRoot.dryRun(config) : new CompositionRoot(config)) {
      LedgerSession session = new LedgerSession(root);
      List<String> output = new ArrayList<>();
      if (dryRun) {
        output.add(command.name() + " dry-run: state file will not be changed.");
        output.addAll(action.plan());
      }
      output.addAll(action.apply(session));
      if (command.mutating() && !dryRun && session.opened()) {
        session.save();
        log.debug("Saved ledger state to {}", config.statePath());
      }
      if (dryRun) {
        output.add(" Re-run without --dry-run to apply.");
      }
      CliPrinter.printLines(output);
      return ExitCode.SUCCESS;
    } catch (LedgerException ex) {
      log.error("{} rejected: {} ({})", command.name(), ex.getMessage(), ex.kind());
      return ExitCode.LEDGER_REJECTED;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", command.name(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} failed to access ledger state at {}", command.name(), config.statePath(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command.name(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static Identity requireIdentity(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    try {
      return Identity.of(raw.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + " is not a valid address: " + raw, ex);
    }
  }

  static long requireLong(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Numbers.parseLong(key, raw);
  }

  static OptionalLong optionalLong(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(Numbers.parseLong(key, raw));
  }

  static BigInteger requireAmount(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Numbers.parseAmount(key, raw);
  }
}
