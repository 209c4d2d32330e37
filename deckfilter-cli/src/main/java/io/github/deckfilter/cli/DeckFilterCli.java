package io.github.deckfilter.cli;

import io.github.deckfilter.cli.command.GenerateCommand;
import io.github.deckfilter.cli.command.ResolveCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for deckfilter.
 */
@Command(
    name = "deckfilter-cli",
    description = "Materialize and resolve include/exclude deck subsets",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {GenerateCommand.class, ResolveCommand.class})
public class DeckFilterCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new DeckFilterCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
