package me.bechberger.jlongtasks.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import me.bechberger.jlongtasks.model.NetworkRecord;
import me.bechberger.jlongtasks.model.TaskNode;
import me.bechberger.jlongtasks.model.TraceInput;
import me.bechberger.jlongtasks.parser.TaskForestParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Parse command - validates a trace input file and prints the task forest in various formats
 */
@Command(
        name = "parse",
        description = "Validate a trace input file and print its task forest"
)
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the trace input file")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Output format: text, json, yaml (default: text)")
    private OutputFormat outputFormat = OutputFormat.TEXT;

    @Option(names = {"-p", "--pretty"}, description = "Pretty print JSON output (default: true)")
    private boolean prettyPrint = true;

    public enum OutputFormat {
        TEXT, JSON, YAML
    }

    @Override
    public Integer call() throws Exception {
        if (!Files.exists(inputFile)) {
            System.err.println("Error: File not found: " + inputFile);
            return 1;
        }

        if (!Files.isRegularFile(inputFile)) {
            System.err.println("Error: Not a regular file: " + inputFile);
            return 1;
        }

        try {
            TraceInput input = new TaskForestParser().parse(inputFile);

            switch (outputFormat) {
                case JSON -> outputJson(input);
                case YAML -> outputYaml(input);
                case TEXT -> outputText(input);
            }

            return 0;

        } catch (IOException e) {
            System.err.println("Error reading or parsing file: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Same shape as the input document, with derived end and self times filled in
     */
    private static Map<String, Object> toDocument(TraceInput input) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("tasks", input.forest().roots());
        document.put("networkRecords", input.networkRecords());
        return document;
    }

    private void outputJson(TraceInput input) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        System.out.println(mapper.writeValueAsString(toDocument(input)));
    }

    private void outputYaml(TraceInput input) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
        System.out.println(mapper.writeValueAsString(toDocument(input)));
    }

    private void outputText(TraceInput input) {
        System.out.println("=== Trace Input ===");
        System.out.println();
        System.out.println("Identity: " + input.identity());
        System.out.println("Top-level tasks: " + input.forest().roots().size());
        System.out.println("Total tasks: " + input.forest().getTaskCount());
        System.out.println("Network records: " + input.networkRecords().size());
        System.out.println();

        System.out.println("Tasks:");
        System.out.println("------");
        for (TaskNode task : input.forest().allTasks()) {
            printTask(task);
        }

        if (!input.networkRecords().isEmpty()) {
            System.out.println();
            System.out.println("Network records:");
            System.out.println("----------------");
            for (NetworkRecord record : input.networkRecords()) {
                System.out.printf("  %-10s %s%n", record.resourceType().getProtocolName(), record.url());
            }
        }
    }

    private void printTask(TaskNode task) {
        String indent = "  ".repeat(task.getDepth() + 1);
        System.out.printf(Locale.US, "%s%s start=%.1fms duration=%.1fms self=%.1fms group=%s%s%n",
                indent,
                task.getEventName(),
                task.getStartTime(),
                task.getDuration(),
                task.getSelfTime(),
                task.getGroup().getId(),
                task.isUnbounded() ? " unbounded" : "");
        if (!task.getAttributableUrls().isEmpty()) {
            System.out.println(indent + "  urls: " + String.join(", ", task.getAttributableUrls()));
        }
    }
}
