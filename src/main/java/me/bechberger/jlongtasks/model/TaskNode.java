package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single main-thread task of a trace, together with its nested tasks.
 * <p>
 * Timings are in milliseconds. {@code duration} already includes the time of all
 * descendants, {@code selfTime} is the part not covered by any child.
 * Instances are immutable and compared by identity.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"event", "startTime", "endTime", "duration", "selfTime", "unbounded",
        "group", "attributableURLs", "children"})
public final class TaskNode {

    private final String eventName;
    private final double startTime;
    private final double endTime;
    private final double duration;
    private final double selfTime;
    private final boolean unbounded;
    private final TaskGroup group;
    private final List<String> attributableUrls;
    private final @Nullable TaskNode parent;
    private final List<TaskNode> children;

    private TaskNode(Builder builder, @Nullable TaskNode parent) {
        this.eventName = builder.eventName;
        this.startTime = builder.startTime;
        this.duration = builder.duration;
        this.endTime = builder.endTime != null ? builder.endTime : builder.startTime + builder.duration;
        this.unbounded = builder.unbounded;
        this.group = builder.group;
        this.attributableUrls = List.copyOf(builder.attributableUrls);
        this.parent = parent;

        List<TaskNode> kids = new ArrayList<>(builder.children.size());
        for (Builder child : builder.children) {
            kids.add(new TaskNode(child, this));
        }
        this.children = Collections.unmodifiableList(kids);
        this.selfTime = builder.selfTime != null ? builder.selfTime : deriveSelfTime(duration, kids);
    }

    private static double deriveSelfTime(double duration, List<TaskNode> children) {
        double childTime = 0;
        for (TaskNode child : children) {
            childTime += child.duration;
        }
        return Math.max(0, duration - childTime);
    }

    public static Builder builder(@NotNull String eventName, double startTime, double duration) {
        return new Builder(eventName, startTime, duration);
    }

    @JsonProperty("event")
    public String getEventName() {
        return eventName;
    }

    public double getStartTime() {
        return startTime;
    }

    public double getEndTime() {
        return endTime;
    }

    public double getDuration() {
        return duration;
    }

    public double getSelfTime() {
        return selfTime;
    }

    public boolean isUnbounded() {
        return unbounded;
    }

    public TaskGroup getGroup() {
        return group;
    }

    @JsonProperty("attributableURLs")
    public List<String> getAttributableUrls() {
        return attributableUrls;
    }

    @JsonIgnore
    public @Nullable TaskNode getParent() {
        return parent;
    }

    public List<TaskNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isTopLevel() {
        return parent == null;
    }

    /**
     * Nesting depth, 0 for top-level tasks
     */
    @JsonIgnore
    public int getDepth() {
        int depth = 0;
        for (TaskNode p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return String.format("%s@%.1fms (%.1fms%s)", eventName, startTime, duration,
                unbounded ? ", unbounded" : "");
    }

    public static class Builder {
        private final String eventName;
        private final double startTime;
        private final double duration;
        private @Nullable Double endTime;
        private @Nullable Double selfTime;
        private boolean unbounded = false;
        private TaskGroup group = TaskGroup.OTHER;
        private final List<String> attributableUrls = new ArrayList<>();
        private final List<Builder> children = new ArrayList<>();

        private Builder(String eventName, double startTime, double duration) {
            this.eventName = Objects.requireNonNull(eventName, "eventName");
            this.startTime = startTime;
            this.duration = duration;
        }

        public Builder endTime(@Nullable Double endTime) { this.endTime = endTime; return this; }
        public Builder selfTime(@Nullable Double selfTime) { this.selfTime = selfTime; return this; }
        public Builder unbounded(boolean unbounded) { this.unbounded = unbounded; return this; }

        public Builder group(@NotNull TaskGroup group) {
            this.group = Objects.requireNonNull(group, "group");
            return this;
        }

        public Builder attributableUrl(@NotNull String url) {
            this.attributableUrls.add(Objects.requireNonNull(url, "url"));
            return this;
        }

        public Builder attributableUrls(@NotNull List<String> urls) {
            urls.forEach(this::attributableUrl);
            return this;
        }

        public Builder child(@NotNull Builder child) {
            this.children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        /**
         * Build this task as a top-level task, wiring the parent links of all children
         */
        public TaskNode build() {
            return new TaskNode(this, null);
        }
    }
}
