package me.bechberger.jlongtasks.analysis.analyzers;

import me.bechberger.jlongtasks.analysis.AnalysisContext;
import me.bechberger.jlongtasks.analysis.AnalysisOptions;
import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.analysis.UrlAttributor;
import me.bechberger.jlongtasks.model.*;
import me.bechberger.jlongtasks.parser.TaskForestParser;
import me.bechberger.jlongtasks.test.TraceFixtures;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LongTasksAnalyzer
 */
class LongTasksAnalyzerTest {

    private static final String APP_JS = "https://example.com/app.js";

    private final LongTasksAnalyzer analyzer = new LongTasksAnalyzer();

    private LongTasksAnalyzer.LongTasksResult analyze(List<NetworkRecord> records, TaskNode... roots) {
        TraceInput input = new TraceInput("long-tasks-test", TaskForest.of(roots), records);
        return analyzer.analyze(AnalysisContext.of(input));
    }

    private static TaskNode task(double start, double duration) {
        return TaskNode.builder("RunTask", start, duration).build();
    }

    @Nested
    class Scenarios {

        @Test
        void noLongTasks() {
            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(), task(0, 30), task(100, 49));

            assertEquals(0, result.getTaskCount());
            assertEquals(Optional.empty(), result.displayValue());
            assertNull(result.getDisplayValue());
            assertEquals(AnalysisResult.Severity.OK, result.getSeverity());
            assertFalse(result.hasFindings());
        }

        @Test
        void fourTasksWithoutUrls() {
            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(),
                    task(0, 200), task(300, 200), task(600, 200), task(900, 200));

            assertEquals(4, result.getTaskCount());
            assertTrue(result.getTasks().stream().allMatch(t -> t.url().equals(UrlAttributor.UNATTRIBUTABLE)));
            assertEquals(Optional.of("4 long tasks found"), result.displayValue());
            assertEquals(List.of(0.0, 300.0, 600.0, 900.0),
                    result.getTasks().stream().map(AttributedTask::start).toList());
        }

        @Test
        void mixedDurations() {
            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(),
                    task(0, 30), task(100, 100), task(300, 25), task(400, 50));

            assertEquals(List.of(100.0, 50.0), result.getTasks().stream().map(AttributedTask::duration).toList());
            assertEquals("2 long tasks found", result.getSummary());
        }

        @Test
        void singleScriptTask() {
            TaskNode script = TaskNode.builder("RunTask", 0, 200)
                    .group(TaskGroup.SCRIPT_EVALUATION)
                    .attributableUrl(APP_JS)
                    .build();

            LongTasksAnalyzer.LongTasksResult result = analyze(
                    List.of(new NetworkRecord(APP_JS, ResourceType.SCRIPT)), script);

            assertEquals(1, result.getTaskCount());
            assertEquals(APP_JS, result.getTasks().get(0).url());
            assertEquals("Script Evaluation", result.getTasks().get(0).group());
            assertEquals("1 long task found", result.getDisplayValue());
        }
    }

    @Nested
    class Report {

        @Test
        void shouldCapAndSortRows() {
            List<TaskNode> roots = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                roots.add(task(i * 1000, 50 + (i * 7) % 30));
            }

            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(), roots.toArray(new TaskNode[0]));

            assertEquals(20, result.getTaskCount());
            List<AttributedTask> rows = result.getTasks();
            for (int i = 1; i < rows.size(); i++) {
                assertTrue(rows.get(i - 1).duration() >= rows.get(i).duration());
            }
            assertEquals("20 long tasks found", result.getSummary());
        }

        @Test
        void shouldAddOneFindingPerRow() {
            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(), task(0, 120), task(200, 60));

            assertEquals(AnalysisResult.Severity.INFO, result.getSeverity());
            assertEquals(2, result.getFindings().size());
            AnalysisResult.Finding finding = result.getFindings().get(0);
            assertEquals("long-task", finding.category());
            assertEquals("120ms Other task caused by Unattributable", finding.message());
            assertEquals(120.0, finding.details().get("duration"));
        }

        @Test
        void shouldSumTotalDuration() {
            LongTasksAnalyzer.LongTasksResult result = analyze(List.of(), task(0, 120), task(200, 60));

            assertEquals(180, result.getTotalDuration(), 1e-9);
            assertEquals(50, result.getThresholdMs(), 1e-9);
        }

        @Test
        void shouldBeDeterministic() {
            TaskNode[] roots = {task(0, 70), task(100, 70), task(200, 90)};

            assertEquals(analyze(List.of(), roots).getTasks(), analyze(List.of(), roots).getTasks());
        }

        @Test
        void shouldAttributeFixture() throws Exception {
            TraceInput input = new TaskForestParser().parse(TraceFixtures.read(TraceFixtures.LONG_TASKS));

            LongTasksAnalyzer.LongTasksResult result = analyzer.analyze(AnalysisContext.of(input));

            assertEquals(List.of(
                    new AttributedTask(APP_JS, "Script Evaluation", 100, 50, 250),
                    new AttributedTask(UrlAttributor.BROWSER_GC, "Garbage Collection", 400, 80, 80),
                    new AttributedTask(UrlAttributor.UNATTRIBUTABLE, "Parse HTML & CSS", 700, 60, 60),
                    new AttributedTask(UrlAttributor.BROWSER, "Other", 800, 55, 55)), result.getTasks());
        }

        @Test
        void shouldFallBackToFirstUrlWithoutNetworkRecords() throws Exception {
            TraceInput input = new TaskForestParser().parse(TraceFixtures.read(TraceFixtures.LONG_TASKS));
            AnalysisOptions options = AnalysisOptions.builder().useNetworkRecords(false).build();

            LongTasksAnalyzer.LongTasksResult result = analyzer.analyze(AnalysisContext.of(input, options));

            assertEquals(TraceFixtures.VENDOR_JS, result.getTasks().get(0).url());
        }

        @Test
        void shouldHonorThresholdOption() throws Exception {
            TraceInput input = new TaskForestParser().parse(TraceFixtures.read(TraceFixtures.LONG_TASKS));
            AnalysisOptions options = AnalysisOptions.builder().longTaskThresholdMs(100).build();

            LongTasksAnalyzer.LongTasksResult result = analyzer.analyze(AnalysisContext.of(input, options));

            assertEquals(1, result.getTaskCount());
            assertEquals(100, result.getThresholdMs(), 1e-9);
        }
    }

    @Test
    void shouldFormatDisplayValue() {
        assertEquals(Optional.empty(), LongTasksAnalyzer.formatDisplayValue(0));
        assertEquals(Optional.of("1 long task found"), LongTasksAnalyzer.formatDisplayValue(1));
        assertEquals(Optional.of("7 long tasks found"), LongTasksAnalyzer.formatDisplayValue(7));
    }
}
