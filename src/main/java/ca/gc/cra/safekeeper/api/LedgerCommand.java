package ca.gc.cra.safekeeper.api;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * One SafeKeeper subcommand as seen by {@link LedgerCliSupport}.
 *
 * @since 0.1.0
 */
interface LedgerCommand {
  /** Command name, also the YAML section holding its settings. */
  String name();

  /** One-line usage printed after argument errors. */
  String usage();

  /** Full text printed for {@code --help}. */
  String helpText();

  /**
   * Whether a successful run changes the state file. Read-only commands ignore {@code --dry-run}.
   *
   * @return {@code true} for commands that save state
   */
  default boolean mutating() {
    return true;
  }

  /**
   * Parses the command's own arguments.
   *
   * @param options effective configuration including command arguments
   * @return action ready to run
   * @throws IllegalArgumentException when an argument is missing or malformed
   */
  Action prepare(Map<String, String> options);

  /** A parsed invocation. */
  interface Action {
    /**
     * Describes what the action will do; printed for {@code --dry-run}.
     *
     * @return plan lines
     */
    List<String> plan();

    /**
     * Runs the action against the session's ledger.
     *
     * @param session ledger, clock, and payout balances for this invocation
     * @return result lines to print
     * @throws IOException if the saved state cannot be read
     */
    List<String> apply(LedgerSession session) throws IOException;
  }
}
