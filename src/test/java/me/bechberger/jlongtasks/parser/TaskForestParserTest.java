package me.bechberger.jlongtasks.parser;

import me.bechberger.jlongtasks.model.*;
import me.bechberger.jlongtasks.test.TraceFixtures;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskForestParser
 */
class TaskForestParserTest {

    private final TaskForestParser parser = new TaskForestParser();

    @Nested
    class ValidInput {

        @Test
        void shouldParseFixture() throws Exception {
            TraceInput input = parser.parse(TraceFixtures.read(TraceFixtures.LONG_TASKS));

            TaskForest forest = input.forest();
            assertEquals(6, forest.roots().size());
            assertEquals(7, forest.getTaskCount());
            assertEquals(3, input.networkRecords().size());

            TaskNode script = forest.roots().get(1);
            assertEquals("RunTask", script.getEventName());
            assertEquals(TaskGroup.SCRIPT_EVALUATION, script.getGroup());
            assertEquals(List.of(TraceFixtures.VENDOR_JS, TraceFixtures.APP_JS), script.getAttributableUrls());
            assertEquals(50, script.getSelfTime(), 1e-9);
            assertEquals(1, script.getChildren().size());
            assertSame(script, script.getChildren().get(0).getParent());

            assertTrue(forest.roots().get(3).isUnbounded());
            assertEquals(ResourceType.SCRIPT, input.networkRecords().get(1).resourceType());
        }

        @Test
        void shouldDeriveOptionalTimes() throws Exception {
            TraceInput input = parser.parse("""
                    {"tasks": [{"event": "RunTask", "startTime": 10, "duration": 100,
                                "children": [{"event": "FunctionCall", "startTime": 20, "duration": 60}]}]}
                    """);

            TaskNode task = input.forest().roots().get(0);
            assertEquals(110, task.getEndTime(), 1e-9);
            assertEquals(40, task.getSelfTime(), 1e-9);
            assertTrue(input.networkRecords().isEmpty());
        }

        @Test
        void shouldAcceptEmptyTaskList() throws Exception {
            TraceInput input = parser.parse("{\"tasks\": []}");

            assertTrue(input.forest().isEmpty());
        }

        @Test
        void shouldMapUnknownGroupAndResourceTypeToOther() throws Exception {
            TraceInput input = parser.parse("""
                    {"tasks": [{"event": "RunTask", "startTime": 0, "duration": 60, "group": "wasmCompile"}],
                     "networkRecords": [{"url": "https://example.com/x", "resourceType": "Prefetch"}]}
                    """);

            assertEquals(TaskGroup.OTHER, input.forest().roots().get(0).getGroup());
            assertEquals(ResourceType.OTHER, input.networkRecords().get(0).resourceType());
        }

        @Test
        void shouldToleratePrecisionNoise() throws Exception {
            TraceInput input = parser.parse("""
                    {"tasks": [{"event": "RunTask", "startTime": 0.1, "duration": 0.2,
                                "endTime": 0.30000000000000004, "selfTime": 0.2000000001}]}
                    """);

            assertEquals(1, input.forest().getTaskCount());
        }
    }

    @Nested
    class Identity {

        @Test
        void shouldDeriveIdentityFromContent() throws Exception {
            String content = TraceFixtures.read(TraceFixtures.LONG_TASKS);

            TraceInput first = parser.parse(content);
            TraceInput second = parser.parse(content);

            assertEquals(first.identity(), second.identity());
            assertEquals(64, first.identity().length());
            assertEquals(TaskForestParser.identityOf(content.getBytes(StandardCharsets.UTF_8)), first.identity());
        }

        @Test
        void shouldDifferForDifferentContent() throws Exception {
            TraceInput a = parser.parse("{\"tasks\": []}");
            TraceInput b = parser.parse("{\"tasks\": [], \"networkRecords\": []}");

            assertNotEquals(a.identity(), b.identity());
        }

        @Test
        void shouldUseCallerIdentity() throws Exception {
            TraceInput input = parser.parse("{\"tasks\": []}".getBytes(StandardCharsets.UTF_8), "run-42");

            assertEquals("run-42", input.identity());
        }

        @Test
        void shouldParseFileWithContentIdentity(@TempDir Path tempDir) throws Exception {
            Path file = TraceFixtures.copyTo(TraceFixtures.LONG_TASKS, tempDir);

            TraceInput fromFile = parser.parse(file);
            TraceInput fromString = parser.parse(TraceFixtures.read(TraceFixtures.LONG_TASKS));

            assertEquals(fromString.identity(), fromFile.identity());
        }
    }

    @Nested
    class InvalidInput {

        @Test
        void shouldRejectMalformedJson() {
            TraceFormatException e = assertThrows(TraceFormatException.class,
                    () -> parser.parse("{\"tasks\": ["));

            assertTrue(e.getMessage().startsWith("Invalid JSON"));
        }

        @Test
        void shouldRejectNonObjectDocument() {
            TraceFormatException e = assertThrows(TraceFormatException.class, () -> parser.parse("[]"));

            assertEquals("", e.getPath());
        }

        @Test
        void shouldRejectMissingTasks() {
            TraceFormatException e = assertThrows(TraceFormatException.class,
                    () -> parser.parse("{\"networkRecords\": []}"));

            assertEquals("tasks", e.getPath());
            assertEquals("tasks: missing", e.getMessage());
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "{\"startTime\": 0, \"duration\": 10}                   | tasks[0].event",
                "{\"event\": \"RunTask\", \"duration\": 10}             | tasks[0].startTime",
                "{\"event\": \"RunTask\", \"startTime\": 0}             | tasks[0].duration",
                "{\"event\": \"RunTask\", \"startTime\": \"0\", \"duration\": 10} | tasks[0].startTime",
                "{\"event\": 1, \"startTime\": 0, \"duration\": 10}     | tasks[0].event"
        })
        void shouldReportPathOfBadField(String task, String expectedPath) {
            TraceFormatException e = assertThrows(TraceFormatException.class,
                    () -> parser.parse("{\"tasks\": [" + task + "]}"));

            assertEquals(expectedPath, e.getPath());
        }

        @Test
        void shouldReportNestedPath() {
            TraceFormatException e = assertThrows(TraceFormatException.class, () -> parser.parse("""
                    {"tasks": [{"event": "RunTask", "startTime": 0, "duration": 100,
                                "children": [{"event": "A", "startTime": 0, "duration": 10},
                                             {"event": "B", "startTime": 10}]}]}
                    """));

            assertEquals("tasks[0].children[1].duration", e.getPath());
        }

        @Test
        void shouldRejectNegativeDuration() {
            TraceFormatException e = assertThrows(TraceFormatException.class,
                    () -> parser.parse("{\"tasks\": [{\"event\": \"RunTask\", \"startTime\": 0, \"duration\": -5}]}"));

            assertEquals("tasks[0].duration", e.getPath());
        }

        @Test
        void shouldRejectSelfTimeAboveDuration() {
            TraceFormatException e = assertThrows(TraceFormatException.class,
                    () -> parser.parse(TraceFixtures.read(TraceFixtures.INVALID_SELF_TIME)));

            assertEquals("tasks[0]", e.getPath());
            assertTrue(e.getMessage().contains("selfTime 40.000 exceeds duration 30.000"), e.getMessage());
        }

        @Test
        void shouldRejectInconsistentEndTime() {
            TraceFormatException e = assertThrows(TraceFormatException.class, () -> parser.parse(
                    "{\"tasks\": [{\"event\": \"RunTask\", \"startTime\": 10, \"duration\": 50, \"endTime\": 70}]}"));

            assertTrue(e.getMessage().contains("does not match"), e.getMessage());
        }

        @Test
        void shouldRejectNetworkRecordWithoutUrl() {
            TraceFormatException e = assertThrows(TraceFormatException.class, () -> parser.parse(
                    "{\"tasks\": [], \"networkRecords\": [{\"resourceType\": \"Script\"}]}"));

            assertEquals("networkRecords[0].url", e.getPath());
        }

        @Test
        void shouldBeAnIOException() {
            assertInstanceOf(java.io.IOException.class, new TraceFormatException("tasks", "missing"));
        }
    }
}
