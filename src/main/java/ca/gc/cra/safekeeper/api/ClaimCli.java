package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.logging.Logs;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Releases an unlocked treasure to its beneficiary.
 *
 * @since 0.1.0
 */
final class ClaimCli implements LedgerCommand {
  private static final String SUMMARY_USAGE =
      "usage: claim caller=ADDRESS id=TREASURE_ID [state=PATH] [now=EPOCH_SECONDS] [--dry-run]";
  private static final String HELP_TEXT = """
      SafeKeeper claim

      Usage:
        claim caller=0x... id=0 [options]

      Required:
        caller=ADDRESS             Beneficiary of the treasure
        id=TREASURE_ID             Treasure to claim

      Optional:
        state=PATH                 Ledger state file
        now=EPOCH_SECONDS          Override the clock
        eventSink=log|kafka|none   Where ledger events go (default log)
        --dry-run                  Run against the loaded state without saving
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        The net payout is credited to the caller's payout balance (see: show payouts=ADDRESS).
      """;

  private ClaimCli() {}

  static ExitCode run(String[] args) {
    return LedgerCliSupport.run(new ClaimCli(), args);
  }

  @Override
  public String name() {
    return "claim";
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
    Identity caller = LedgerCliSupport.requireIdentity(options, "caller");
    long id = LedgerCliSupport.requireLong(options, "id");
    return new Action() {
      @Override
      public List<String> plan() {
        return List.of(
            " Beneficiary       : " + caller.address(),
            " Treasure          : " + id);
      }

      @Override
      public List<String> apply(LedgerSession session) throws IOException {
        BigInteger payout = session.ledger().claim(caller, id);
        return List.of(String.format(
            "Claimed treasure %d: paid %s to %s", id, payout, Logs.abbreviate(caller.address())));
      }
    };
  }
}
