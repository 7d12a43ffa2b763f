package me.bechberger.jlongtasks.cli;

import me.bechberger.jlongtasks.analysis.Analyzer;
import me.bechberger.jlongtasks.analysis.analyzers.MainThreadTasksAnalyzer;
import picocli.CommandLine.Command;

/**
 * Tasks command - lists the qualifying top-level tasks with start and end times.
 */
@Command(
        name = "tasks",
        description = "List the toplevel main-thread tasks with their start and end times",
        mixinStandardHelpOptions = true
)
public class TasksCommand extends ReportCommand {

    @Override
    protected Analyzer<?> createAnalyzer() {
        return new MainThreadTasksAnalyzer();
    }
}
