package io.github.themoah.kfc;

import picocli.CommandLine;

/**
 * Command-line entry point of kfc.
 */
public class KfcLauncher {

  public static void main(String[] args) {
    int exitCode = new CommandLine(new ConsumeCommand()).execute(args);
    System.exit(exitCode);
  }
}
