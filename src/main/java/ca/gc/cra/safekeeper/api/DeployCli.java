package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.config.LedgerConfig;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.util.List;
import java.util.Map;

/**
 * Creates a fresh ledger state file owned by the deployer.
 *
 * @since 0.1.0
 */
final class DeployCli implements LedgerCommand {
  private static final String SUMMARY_USAGE =
      "usage: deploy owner=ADDRESS [feeBasisPoints=N] [feePolicy=STORE_AND_CLAIM|STORE_ONLY] [state=PATH] "
          + "[--allow-overwrite] [--dry-run]";
  private static final String HELP_TEXT = """
      SafeKeeper deploy

      Usage:
        deploy owner=0x... [options]

      Required:
        owner=ADDRESS              Administrator of the new ledger

      Optional:
        feeBasisPoints=N           Initial fee rate in basis points, 0..10000 (default 42)
        feePolicy=POLICY           STORE_AND_CLAIM charges on deposit and claim; STORE_ONLY on deposit only
        state=PATH                 Ledger state file (default ~/.safekeeper/ledger.yaml)
        config=PATH                YAML file with common/deploy sections
        --allow-overwrite          Replace an existing state file
        --dry-run                  Validate and print the plan without writing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private DeployCli() {}

  static ExitCode run(String[] args) {
    return LedgerCliSupport.run(new DeployCli(), args);
  }

  @Override
  public String name() {
    return "deploy";
  }

  @Override
  public String usage() {
    return SUMMARY_USAGE;
  }

  @Override
  public String helpText() {
    return HELP_TEXT;
  }

  @Override
  public Action prepare(Map<String, String> options) {
    Identity owner = LedgerCliSupport.requireIdentity(options, "owner");
    if (Identity.isNone(owner)) {
      throw new IllegalArgumentException("owner must not be the zero address");
    }
    LedgerConfig config = LedgerConfig.fromMap(options);
    return new Action() {
      @Override
      public List<String> plan() {
        return List.of(
            " Owner             : " + owner.address(),
            " Fee               : " + config.feeBasisPoints() + " bp",
            " Fee policy        : " + config.feePolicy(),
            " State file        : " + config.statePath());
      }

      @Override
      public List<String> apply(LedgerSession session) {
        SafeKeeperLedger ledger = session.deploy(owner);
        return List.of(String.format(
            "Deployed ledger owned by %s at %d bp (%s) -> %s",
            ledger.owner().address(), ledger.feeBasisPoints(), ledger.feePolicy(), config.statePath()));
      }
    };
  }
}
