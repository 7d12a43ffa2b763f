package me.bechberger.jlongtasks.cli;

import me.bechberger.jlongtasks.analysis.*;
import me.bechberger.jlongtasks.model.TraceInput;
import me.bechberger.jlongtasks.parser.TaskForestParser;
import me.bechberger.jlongtasks.view.*;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base of the commands that read a trace input, run one analyzer and render its result.
 */
abstract class ReportCommand implements Callable<Integer> {

    /** Exit codes */
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    @Mixin
    protected SharedOptions sharedOptions;

    @Parameters(index = "0", description = "Trace input file (JSON task forest and network records)")
    protected Path inputFile;

    @Option(names = {"--save"}, description = "Save analysis result to file (json/yaml)")
    private Path saveFile;

    @Option(names = {"--html"}, description = "Export HTML report to file")
    private Path htmlFile;

    /**
     * The analyzer whose result this command reports
     */
    protected abstract Analyzer<?> createAnalyzer();

    @Override
    public Integer call() {
        if (!Files.exists(inputFile)) {
            sharedOptions.errorLog("File not found: " + inputFile);
            return EXIT_ERROR;
        }
        if (!Files.isRegularFile(inputFile)) {
            sharedOptions.errorLog("Not a regular file: " + inputFile);
            return EXIT_ERROR;
        }

        AnalysisOptions analysisOptions;
        OutputOptions outputOptions;
        try {
            analysisOptions = sharedOptions.buildAnalysisOptions();
            outputOptions = sharedOptions.buildOutputOptions();
        } catch (IllegalArgumentException e) {
            sharedOptions.errorLog(e.getMessage());
            return EXIT_ERROR;
        }

        try {
            TraceInput input = new TaskForestParser().parse(inputFile);
            sharedOptions.verboseLog("Parsed " + inputFile + ": " + input.forest().getTaskCount() + " tasks, "
                    + input.networkRecords().size() + " network records");

            Analyzer<?> analyzer = createAnalyzer();
            AnalysisContext context = AnalysisContext.of(input, analysisOptions);
            if (analyzer.requiresNetworkRecords() && analysisOptions.isUseNetworkRecords()
                    && !context.hasNetworkRecords()) {
                sharedOptions.warnLog("No network records in " + inputFile
                        + ", tasks are attributed to their first URL");
            }

            AnalysisResult result = AnalysisEngine.createEmpty().analyze(context, analyzer);
            outputResult(result, outputOptions);

            if (saveFile != null) {
                saveResult(result, saveFile);
            }
            if (htmlFile != null) {
                exportHtml(result, htmlFile);
            }
            return EXIT_OK;
        } catch (IOException e) {
            sharedOptions.errorLog(e.getMessage());
            if (sharedOptions.isVerbose()) {
                e.printStackTrace();
            }
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            sharedOptions.errorLog(e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void outputResult(AnalysisResult result, OutputOptions options) {
        if (sharedOptions.isQuiet()) {
            System.out.println(result.getSummary());
            return;
        }
        ViewRendererFactory.initialize();
        System.out.println(ViewRendererFactory.render(forFormat(result, options.getFormat()), options));
    }

    private void saveResult(AnalysisResult result, Path file) throws IOException {
        OutputFormat format = OutputFormat.fromFileName(file.toString());
        if (format == OutputFormat.TEXT || format == OutputFormat.HTML) {
            format = OutputFormat.JSON; // Default to JSON for save
        }

        OutputOptions saveOptions = OutputOptions.builder().format(format).noColor().build();
        Files.writeString(file, ViewRendererFactory.render(result, saveOptions));

        sharedOptions.verboseLog("Saved to: " + file);
    }

    private void exportHtml(AnalysisResult result, Path file) throws IOException {
        OutputOptions htmlOptions = OutputOptions.builder()
                .format(OutputFormat.HTML)
                .noColor()
                .build();
        Files.writeString(file, ViewRendererFactory.render(forFormat(result, OutputFormat.HTML), htmlOptions));

        sharedOptions.verboseLog("HTML report exported to: " + file);
    }

    /**
     * HTML reports are whole documents, which only the composite view writes
     */
    private static AnalysisResult forFormat(AnalysisResult result, OutputFormat format) {
        if (format == OutputFormat.HTML && !(result instanceof AnalysisResult.CompositeResult)) {
            return new AnalysisResult.CompositeResult(List.of(result));
        }
        return result;
    }
}
