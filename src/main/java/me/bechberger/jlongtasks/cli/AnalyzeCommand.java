package me.bechberger.jlongtasks.cli;

import me.bechberger.jlongtasks.analysis.Analyzer;
import me.bechberger.jlongtasks.analysis.analyzers.LongTasksAnalyzer;
import picocli.CommandLine.Command;

/**
 * Analyze command - reports the longest top-level main-thread tasks and what caused them.
 *
 * Usage: jlongtasks analyze trace.json --threshold 50
 */
@Command(
        name = "analyze",
        description = "Report the longest main-thread tasks and the script or browser work that caused them",
        mixinStandardHelpOptions = true
)
public class AnalyzeCommand extends ReportCommand {

    @Override
    protected Analyzer<?> createAnalyzer() {
        return new LongTasksAnalyzer();
    }
}
