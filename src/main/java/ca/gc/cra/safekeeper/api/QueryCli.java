package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import ca.gc.cra.safekeeper.validation.Numbers;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only {@code show} command: ledger status, one treasure, per-identity treasure lists, or payout balances.
 *
 * @since 0.1.0
 */
final class QueryCli implements LedgerCommand {
  private static final List<String> SELECTORS = List.of("treasure", "noble", "beneficiary", "payouts");
  private static final String SUMMARY_USAGE =
      "usage: show [treasure=ID | noble=ADDRESS | beneficiary=ADDRESS | payouts=ADDRESS] "
          + "[offset=N limit=N] [state=PATH]";
  private static final String HELP_TEXT = """
      SafeKeeper show

      Usage:
        show                       Ledger status
        show treasure=ID           Details of one treasure
        show noble=ADDRESS         Treasures deposited by ADDRESS
        show beneficiary=ADDRESS   Treasures claimable by ADDRESS
        show payouts=ADDRESS       Value ADDRESS has received

      Optional:
        offset=N limit=N           Page through noble/beneficiary lists (limit at most 1000)
        state=PATH                 Ledger state file
        now=EPOCH_SECONDS          Override the clock used for the 'unlocked' column
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private QueryCli() {}

  static ExitCode run(String[] args) {
    return LedgerCliSupport.run(new QueryCli(), args);
  }

  @Override
  public String name() {
    return "show";
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
  public boolean mutating() {
    return false;
  }

  @Override
  public Action prepare(Map<String, String> options) {
    String selector = null;
    for (String key : SELECTORS) {
      if (options.containsKey(key)) {
        if (selector != null) {
          throw new IllegalArgumentException("show accepts only one of " + String.join(", ", SELECTORS));
        }
        selector = key;
      }
    }
    if (selector == null) {
      return new Query(this::status);
    }
    return switch (selector) {
      case "treasure" -> {
        long id = LedgerCliSupport.requireLong(options, "treasure");
        yield new Query(session -> treasure(session, id));
      }
      case "payouts" -> {
        Identity identity = LedgerCliSupport.requireIdentity(options, "payouts");
        yield new Query(session -> List.of(
            identity.address() + " received " + session.payoutsOf(identity)));
      }
      default -> listing(options, selector);
    };
  }

  private Action listing(Map<String, String> options, String selector) {
    Identity identity = LedgerCliSupport.requireIdentity(options, selector);
    boolean paged = options.containsKey("offset") || options.containsKey("limit");
    int offset = paged ? parseOrDefault(options, "offset", 0) : 0;
    int limit = paged ? parseOrDefault(options, "limit", SafeKeeperLedger.MAX_PAGE_SIZE) : 0;
    if (paged) {
      Numbers.requireRange("offset", offset, 0, Integer.MAX_VALUE);
      Numbers.requireRange("limit", limit, 1, SafeKeeperLedger.MAX_PAGE_SIZE);
    }
    boolean byNoble = selector.equals("noble");
    return new Query(session -> {
      SafeKeeperLedger ledger = session.ledger();
      List<Long> ids;
      if (byNoble) {
        ids = paged ? ledger.treasuresByNoble(identity, offset, limit) : ledger.treasuresByNoble(identity);
      } else {
        ids = paged
            ? ledger.treasuresByBeneficiary(identity, offset, limit)
            : ledger.treasuresByBeneficiary(identity);
      }
      long now = session.now();
      List<String> lines = new ArrayList<>();
      lines.add(selector + " " + identity.address() + ": " + ids.size() + " treasure(s)");
      for (long id : ids) {
        Treasure treasure = ledger.treasureDetails(id);
        lines.add(String.format(
            "  #%d amount=%s unlockTime=%d claimed=%s unlocked=%s",
            id, treasure.amount(), treasure.unlockTime(), treasure.claimed(), treasure.isUnlockedAt(now)));
      }
      return lines;
    });
  }

  private List<String> status(LedgerSession session) throws IOException {
    SafeKeeperLedger ledger = session.ledger();
    return List.of(
        "SafeKeeper ledger",
        " Owner             : " + (Identity.isNone(ledger.owner()) ? "<renounced>" : ledger.owner().address()),
        " Fee               : " + ledger.feeBasisPoints() + " bp (" + ledger.feePolicy() + ")",
        " Treasures         : " + ledger.nextTreasureId(),
        " Collected fees    : " + ledger.collectedFees(),
        " Held value        : " + ledger.heldValue());
  }

  private static List<String> treasure(LedgerSession session, long id) throws IOException {
    Treasure treasure = session.ledger().treasureDetails(id);
    long now = session.now();
    return List.of(
        "Treasure " + id,
        " Amount            : " + treasure.amount(),
        " Unlock time       : " + treasure.unlockTime() + " (" + Instant.ofEpochSecond(treasure.unlockTime()) + ")",
        " Unlocked          : " + treasure.isUnlockedAt(now),
        " Claimed           : " + treasure.claimed(),
        " Noble             : " + treasure.noble().address(),
        " Beneficiary       : " + treasure.beneficiary().address());
  }

  private static int parseOrDefault(Map<String, String> options, String key, int defaultValue) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? defaultValue : Numbers.parseInt(key, raw);
  }

  @FunctionalInterface
  private interface Lookup {
    List<String> run(LedgerSession session) throws IOException;
  }

  private static final class Query implements Action {
    private final Lookup lookup;

    Query(Lookup lookup) {
      this.lookup = lookup;
    }

    @Override
    public List<String> plan() {
      return List.of();
    }

    @Override
    public List<String> apply(LedgerSession session) throws IOException {
      return lookup.run(session);
    }
  }
}
