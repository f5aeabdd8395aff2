package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SafeKeeper CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: safekeeper <deploy|store|claim|set-fee|withdraw-fees|transfer-ownership|renounce-ownership|show> "
          + "[options]";
  private static final String HELP_TEXT = """
      SafeKeeper time-locked escrow ledger

      Usage:
        safekeeper <command> [key=value ...] [flags]

      Commands:
        deploy              Create a new ledger state file
        store               Lock value for a beneficiary until an unlock time
        claim               Release an unlocked treasure to its beneficiary
        set-fee             Change the fee rate (owner only)
        withdraw-fees       Pay out the collected fee pool (owner only)
        transfer-ownership  Hand the ledger to a new owner (owner only)
        renounce-ownership  Leave the ledger without an owner (owner only)
        show                Inspect status, treasures, and payouts

      Global flags:
        --help      Show this message (or '<command> --help' for details)
        --verbose   Enable DEBUG logging before dispatching to the command

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 configuration error,
        5 runtime failure, 6 rejected by the ledger
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    int commandIndex = 0;
    while (commandIndex < args.length && args[commandIndex] != null && args[commandIndex].startsWith("-")) {
      commandIndex++;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(args, 0, commandIndex));
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex >= args.length || args[commandIndex] == null) {
      if (globals.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = args[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, commandIndex + 1, args.length);
    if (globals.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }

    return switch (command) {
      case "deploy" -> DeployCli.run(delegateArgs);
      case "store" -> StoreCli.run(delegateArgs);
      case "claim" -> ClaimCli.run(delegateArgs);
      case "set-fee" -> AdminCli.setFee(delegateArgs);
      case "withdraw-fees" -> AdminCli.withdrawFees(delegateArgs);
      case "transfer-ownership" -> AdminCli.transferOwnership(delegateArgs);
      case "renounce-ownership" -> AdminCli.renounceOwnership(delegateArgs);
      case "show" -> QueryCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
