package me.bechberger.jlongtasks;

import me.bechberger.jlongtasks.cli.AnalyzeCommand;
import me.bechberger.jlongtasks.cli.ParseCommand;
import me.bechberger.jlongtasks.cli.TasksCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main entry point for jlongtasks CLI
 */
@Command(
        name = "jlongtasks",
        description = "Long main-thread task analyzer for page load traces",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        subcommands = {
                AnalyzeCommand.class,
                TasksCommand.class,
                ParseCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Show help if no subcommand is provided
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
