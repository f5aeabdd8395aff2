package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import ca.gc.cra.safekeeper.logging.Logs;
import ca.gc.cra.safekeeper.validation.Numbers;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Locks value for a beneficiary until an unlock time.
 *
 * @since 0.1.0
 */
final class StoreCli implements LedgerCommand {
  // Half the long range, so any realistic clock reading plus the lock still fits.
  static final long MAX_LOCK_SECONDS = Long.MAX_VALUE / 2;
  private static final String SUMMARY_USAGE =
      "usage: store caller=ADDRESS beneficiary=ADDRESS value=AMOUNT (unlockTime=EPOCH_SECONDS|lockFor=SECONDS) "
          + "[state=PATH] [now=EPOCH_SECONDS] [--dry-run]";
  private static final String HELP_TEXT = """
      SafeKeeper store

      Usage:
        store caller=0x... beneficiary=0x... value=1000 lockFor=86400 [options]

      Required:
        caller=ADDRESS             Noble making the deposit
        beneficiary=ADDRESS        Only identity allowed to claim
        value=AMOUNT               Deposited value; '_' separators allowed
        unlockTime=EPOCH_SECONDS   Absolute unlock instant, or
        lockFor=SECONDS            Unlock relative to the current instant

      Optional:
        state=PATH                 Ledger state file
        now=EPOCH_SECONDS          Override the clock
        eventSink=log|kafka|none   Where ledger events go (default log)
        --dry-run                  Run against the loaded state without saving
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private StoreCli() {}

  private static long unlockAfter(long now, long lockFor) {
    try {
      return Math.addExact(now, lockFor);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("lockFor overflows unlockTime", ex);
    }
  }

  static ExitCode run(String[] args) {
    return LedgerCliSupport.run(new StoreCli(), args);
  }

  @Override
  public String name() {
    return "store";
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
    if (Identity.isNone(caller)) {
      throw new IllegalArgumentException("caller must not be the zero address");
    }
    Identity beneficiary = LedgerCliSupport.requireIdentity(options, "beneficiary");
    BigInteger value = LedgerCliSupport.requireAmount(options, "value");
    OptionalLong unlockTime = LedgerCliSupport.optionalLong(options, "unlockTime");
    OptionalLong lockFor = LedgerCliSupport.optionalLong(options, "lockFor");
    if (unlockTime.isPresent() == lockFor.isPresent()) {
      throw new IllegalArgumentException("exactly one of unlockTime or lockFor is required");
    }
    if (lockFor.isPresent()) {
      Numbers.requireRange("lockFor", lockFor.getAsLong(), 0, MAX_LOCK_SECONDS);
    }
    return new Action() {
      @Override
      public List<String> plan() {
        return List.of(
            " Noble             : " + caller.address(),
            " Beneficiary       : " + beneficiary.address(),
            " Value             : " + value,
            " Unlock            : " + (unlockTime.isPresent()
                ? "at " + unlockTime.getAsLong()
                : "in " + lockFor.getAsLong() + "s"));
      }

      @Override
      public List<String> apply(LedgerSession session) throws IOException {
        long unlock = unlockTime.isPresent()
            ? unlockTime.getAsLong()
            : unlockAfter(session.now(), lockFor.getAsLong());
        SafeKeeperLedger ledger = session.ledger();
        long id = ledger.store(caller, beneficiary, unlock, value);
        Treasure treasure = ledger.treasureDetails(id);
        return List.of(String.format(
            "Stored treasure %d for %s: amount=%s fee=%s unlockTime=%d",
            id,
            Logs.abbreviate(beneficiary.address()),
            treasure.amount(),
            value.subtract(treasure.amount()),
            unlock));
      }
    };
  }
}
