package com.websweep.cli;

import com.websweep.cli.commands.ScanCommand;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** System.exit 없이 종료 코드만 돌려준다 */
    public static int run(String... args) {
        return new CommandLine(new Root()).addSubcommand("scan", new ScanCommand()).execute(args);
    }

    @CommandLine.Command(name = "websweep", mixinStandardHelpOptions = true, version = "0.5.0",
            description = "Crawling web application vulnerability scanner")
    static class Root implements Runnable {
        @Override public void run() { System.out.println("Use subcommand: scan"); }
    }
}
