package me.bechberger.jlongtasks.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.bechberger.jlongtasks.model.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Strict parser for trace input documents holding an already-built task forest
 * and the network records of the same page load.
 * <p>
 * All task invariants are checked here, so the analysis code can rely on them.
 */
public class TaskForestParser {

    // Tolerance for rounding noise in selfTime/endTime
    private static final double EPSILON_MS = 1e-6;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parse a trace input file, its identity is the SHA-256 of the file content
     */
    public TraceInput parse(@NotNull Path file) throws IOException {
        byte[] content = Files.readAllBytes(file);
        return parse(content, identityOf(content));
    }

    /**
     * Parse a trace input document, its identity is the SHA-256 of the content
     */
    public TraceInput parse(@NotNull String content) throws TraceFormatException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return parse(bytes, identityOf(bytes));
    }

    /**
     * Parse a trace input document with a caller-chosen identity
     */
    public TraceInput parse(byte @NotNull [] content, @NotNull String identity) throws TraceFormatException {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new TraceFormatException("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TraceFormatException("Unreadable input: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TraceFormatException("", "Expected a JSON object at the top level");
        }

        TaskForest forest = parseForest(root.get("tasks"));
        List<NetworkRecord> records = parseNetworkRecords(root.get("networkRecords"));
        return new TraceInput(identity, forest, records);
    }

    private TaskForest parseForest(@Nullable JsonNode tasks) throws TraceFormatException {
        if (tasks == null || tasks.isNull()) {
            throw new TraceFormatException("tasks", "missing");
        }
        if (!tasks.isArray()) {
            throw new TraceFormatException("tasks", "expected an array");
        }
        List<TaskNode> roots = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            String path = "tasks[" + i + "]";
            TaskNode root = parseTask(tasks.get(i), path).build();
            validate(root, path);
            roots.add(root);
        }
        return new TaskForest(roots);
    }

    private TaskNode.Builder parseTask(JsonNode node, String path) throws TraceFormatException {
        if (!node.isObject()) {
            throw new TraceFormatException(path, "expected an object");
        }
        String event = requireText(node, "event", path);
        double startTime = requireNumber(node, "startTime", path);
        double duration = requireNumber(node, "duration", path);

        TaskNode.Builder builder = TaskNode.builder(event, startTime, duration)
                .endTime(optionalNumber(node, "endTime", path))
                .selfTime(optionalNumber(node, "selfTime", path))
                .unbounded(node.path("unbounded").asBoolean(false));

        JsonNode group = node.get("group");
        if (group != null && !group.isNull()) {
            builder.group(TaskGroup.fromString(textOf(group, path + ".group")));
        }

        JsonNode urls = node.get("attributableURLs");
        if (urls != null && !urls.isNull()) {
            if (!urls.isArray()) {
                throw new TraceFormatException(path + ".attributableURLs", "expected an array");
            }
            for (int i = 0; i < urls.size(); i++) {
                builder.attributableUrl(textOf(urls.get(i), path + ".attributableURLs[" + i + "]"));
            }
        }

        JsonNode children = node.get("children");
        if (children != null && !children.isNull()) {
            if (!children.isArray()) {
                throw new TraceFormatException(path + ".children", "expected an array");
            }
            for (int i = 0; i < children.size(); i++) {
                builder.child(parseTask(children.get(i), path + ".children[" + i + "]"));
            }
        }
        return builder;
    }

    private void validate(TaskNode task, String path) throws TraceFormatException {
        checkTiming(task.getStartTime(), "startTime", path);
        checkTiming(task.getDuration(), "duration", path);
        checkTiming(task.getSelfTime(), "selfTime", path);
        checkTiming(task.getEndTime(), "endTime", path);

        if (task.getSelfTime() > task.getDuration() + EPSILON_MS) {
            throw new TraceFormatException(path, String.format(Locale.US,
                    "selfTime %.3f exceeds duration %.3f", task.getSelfTime(), task.getDuration()));
        }
        if (Math.abs(task.getEndTime() - (task.getStartTime() + task.getDuration())) > EPSILON_MS) {
            throw new TraceFormatException(path, String.format(Locale.US,
                    "endTime %.3f does not match startTime + duration %.3f",
                    task.getEndTime(), task.getStartTime() + task.getDuration()));
        }

        List<TaskNode> children = task.getChildren();
        for (int i = 0; i < children.size(); i++) {
            validate(children.get(i), path + ".children[" + i + "]");
        }
    }

    private static void checkTiming(double value, String field, String path) throws TraceFormatException {
        if (!Double.isFinite(value) || value < 0) {
            throw new TraceFormatException(path + "." + field, "must be a non-negative finite number, was " + value);
        }
    }

    private List<NetworkRecord> parseNetworkRecords(@Nullable JsonNode records) throws TraceFormatException {
        if (records == null || records.isNull()) {
            return List.of();
        }
        if (!records.isArray()) {
            throw new TraceFormatException("networkRecords", "expected an array");
        }
        List<NetworkRecord> result = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            String path = "networkRecords[" + i + "]";
            JsonNode record = records.get(i);
            if (!record.isObject()) {
                throw new TraceFormatException(path, "expected an object");
            }
            String url = requireText(record, "url", path);
            JsonNode type = record.get("resourceType");
            ResourceType resourceType = type == null || type.isNull()
                    ? ResourceType.OTHER
                    : ResourceType.fromString(textOf(type, path + ".resourceType"));
            result.add(new NetworkRecord(url, resourceType));
        }
        return result;
    }

    private static String requireText(JsonNode node, String field, String path) throws TraceFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new TraceFormatException(path + "." + field, "missing");
        }
        return textOf(value, path + "." + field);
    }

    private static String textOf(JsonNode value, String path) throws TraceFormatException {
        if (!value.isTextual()) {
            throw new TraceFormatException(path, "expected a string");
        }
        return value.asText();
    }

    private static double requireNumber(JsonNode node, String field, String path) throws TraceFormatException {
        Double value = optionalNumber(node, field, path);
        if (value == null) {
            throw new TraceFormatException(path + "." + field, "missing");
        }
        return value;
    }

    private static @Nullable Double optionalNumber(JsonNode node, String field, String path) throws TraceFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new TraceFormatException(path + "." + field, "expected a number");
        }
        return value.asDouble();
    }

    /**
     * Stable identity of an input document
     */
    public static String identityOf(byte @NotNull [] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
