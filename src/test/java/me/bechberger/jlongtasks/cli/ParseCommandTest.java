package me.bechberger.jlongtasks.cli;

import com.fasterxml.jackson.databind.JsonNode;
import me.bechberger.jlongtasks.cli.ParseCommand.OutputFormat;
import me.bechberger.jlongtasks.model.TraceInput;
import me.bechberger.jlongtasks.parser.TaskForestParser;
import me.bechberger.jlongtasks.test.TraceFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;

import static me.bechberger.jlongtasks.test.JsonAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParseCommand
 */
public class ParseCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorStream = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    @BeforeEach
    void setUp() {
        outputStream.reset();
        errorStream.reset();
        System.setOut(new PrintStream(outputStream));
        System.setErr(new PrintStream(errorStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private void setField(Object obj, String fieldName, Object value) throws Exception {
        var field = obj.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(obj, value);
    }

    @Test
    void testParseNonExistentFile() throws Exception {
        ParseCommand cmd = new ParseCommand();
        setField(cmd, "inputFile", tempDir.resolve("does-not-exist.json"));

        int exitCode = cmd.call();
        assertEquals(1, exitCode);
        assertTrue(errorStream.toString().contains("not found"));
    }

    @ParameterizedTest
    @EnumSource(OutputFormat.class)
    void testParseWithDifferentFormats(OutputFormat format) throws Exception {
        ParseCommand cmd = new ParseCommand();
        setField(cmd, "inputFile", TraceFixtures.copyTo(TraceFixtures.LONG_TASKS, tempDir));
        setField(cmd, "outputFormat", format);

        int exitCode = cmd.call();
        assertEquals(0, exitCode);

        String output = outputStream.toString();
        switch (format) {
            case JSON -> {
                JsonNode json = parseJson(output);
                assertJsonArraySize(json, "tasks", 6);
                assertJsonField(json, "tasks.1.group", "scriptEvaluation");
                assertJsonField(json, "tasks.1.children.0.event", "FunctionCall");
                assertJsonField(json, "networkRecords.1.resourceType", "Script");
            }
            case YAML -> {
                assertTrue(output.contains("MajorGC"), output);
                assertTrue(output.contains("networkRecords:"));
                assertFalse(output.startsWith("---"));
            }
            case TEXT -> {
                assertTrue(output.contains("=== Trace Input ==="));
                assertTrue(output.contains("Total tasks: 7"));
                assertTrue(output.contains("FunctionCall"));
                assertTrue(output.contains("unbounded"));
            }
        }
    }

    @Test
    void testJsonOutputIsValidInput() throws Exception {
        ParseCommand cmd = new ParseCommand();
        setField(cmd, "inputFile", TraceFixtures.copyTo(TraceFixtures.LONG_TASKS, tempDir));
        setField(cmd, "outputFormat", OutputFormat.JSON);

        assertEquals(0, cmd.call());

        TraceInput reparsed = new TaskForestParser().parse(outputStream.toString());
        assertEquals(7, reparsed.forest().getTaskCount());
        assertEquals(3, reparsed.networkRecords().size());
        assertTrue(reparsed.forest().roots().get(3).isUnbounded());
    }

    @Test
    void testParseInvalidFile() throws Exception {
        ParseCommand cmd = new ParseCommand();
        setField(cmd, "inputFile", TraceFixtures.copyTo(TraceFixtures.INVALID_SELF_TIME, tempDir));

        int exitCode = cmd.call();
        assertEquals(1, exitCode);
        assertTrue(errorStream.toString().contains("selfTime"));
    }
}
