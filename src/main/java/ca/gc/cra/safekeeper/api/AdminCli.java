package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.validation.Numbers;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Owner-only commands: {@code set-fee}, {@code withdraw-fees}, {@code transfer-ownership}, and
 * {@code renounce-ownership}.
 *
 * @since 0.1.0
 */
final class AdminCli {
  private static final String COMMON_OPTIONS = """

      Optional:
        state=PATH                 Ledger state file
        eventSink=log|kafka|none   Where ledger events go (default log)
        --dry-run                  Run against the loaded state without saving
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private AdminCli() {}

  static ExitCode setFee(String[] args) {
    return LedgerCliSupport.run(new SetFee(), args);
  }

  static ExitCode withdrawFees(String[] args) {
    return LedgerCliSupport.run(new WithdrawFees(), args);
  }

  static ExitCode transferOwnership(String[] args) {
    return LedgerCliSupport.run(new TransferOwnership(), args);
  }

  static ExitCode renounceOwnership(String[] args) {
    return LedgerCliSupport.run(new RenounceOwnership(), args);
  }

  private abstract static class OwnerCommand implements LedgerCommand {
    private final String name;
    private final String arguments;
    private final String description;

    OwnerCommand(String name, String arguments, String description) {
      this.name = name;
      this.arguments = arguments;
      this.description = description;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String usage() {
      return "usage: " + name + " caller=ADDRESS" + arguments + " [state=PATH] [--dry-run]";
    }

    @Override
    public String helpText() {
      return "SafeKeeper " + name + "\n\n" + description + "\n\nUsage:\n  " + name + " caller=0x..." + arguments
          + "\n" + COMMON_OPTIONS;
    }
  }

  private static final class SetFee extends OwnerCommand {
    SetFee() {
      super("set-fee", " rate=BASIS_POINTS", "Changes the fee rate for future deposits and claims (0..10000 bp).");
    }

    @Override
    public Action prepare(Map<String, String> options) {
      Identity caller = LedgerCliSupport.requireIdentity(options, "caller");
      String raw = options.get("rate");
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("rate is required");
      }
      int rate = Numbers.parseInt("rate", raw);
      return new Action() {
        @Override
        public List<String> plan() {
          return List.of(" Owner             : " + caller.address(), " New rate          : " + rate + " bp");
        }

        @Override
        public List<String> apply(LedgerSession session) throws IOException {
          session.ledger().setFeeRate(caller, rate);
          return List.of("Fee rate set to " + rate + " bp");
        }
      };
    }
  }

  private static final class WithdrawFees extends OwnerCommand {
    WithdrawFees() {
      super("withdraw-fees", " recipient=ADDRESS", "Pays the whole collected fee pool to the recipient.");
    }

    @Override
    public Action prepare(Map<String, String> options) {
      Identity caller = LedgerCliSupport.requireIdentity(options, "caller");
      Identity recipient = LedgerCliSupport.requireIdentity(options, "recipient");
      return new Action() {
        @Override
        public List<String> plan() {
          return List.of(" Owner             : " + caller.address(), " Recipient         : " + recipient.address());
        }

        @Override
        public List<String> apply(LedgerSession session) throws IOException {
          BigInteger amount = session.ledger().withdrawFees(caller, recipient);
          return List.of("Withdrew " + amount + " in fees to " + recipient.address());
        }
      };
    }
  }

  private static final class TransferOwnership extends OwnerCommand {
    TransferOwnership() {
      super("transfer-ownership", " newOwner=ADDRESS", "Hands administration of the ledger to a new owner.");
    }

    @Override
    public Action prepare(Map<String, String> options) {
      Identity caller = LedgerCliSupport.requireIdentity(options, "caller");
      Identity newOwner = LedgerCliSupport.requireIdentity(options, "newOwner");
      return new Action() {
        @Override
        public List<String> plan() {
          return List.of(" Owner             : " + caller.address(), " New owner         : " + newOwner.address());
        }

        @Override
        public List<String> apply(LedgerSession session) throws IOException {
          session.ledger().transferOwnership(caller, newOwner);
          return List.of("Ownership transferred to " + newOwner.address());
        }
      };
    }
  }

  private static final class RenounceOwnership extends OwnerCommand {
    RenounceOwnership() {
      super("renounce-ownership", "", "Leaves the ledger without an owner. Fees can no longer be withdrawn.");
    }

    @Override
    public Action prepare(Map<String, String> options) {
      Identity caller = LedgerCliSupport.requireIdentity(options, "caller");
      return new Action() {
        @Override
        public List<String> plan() {
          return List.of(" Owner             : " + caller.address());
        }

        @Override
        public List<String> apply(LedgerSession session) throws IOException {
          session.ledger().renounceOwnership(caller);
          return List.of("Ownership renounced");
        }
      };
    }
  }
}
