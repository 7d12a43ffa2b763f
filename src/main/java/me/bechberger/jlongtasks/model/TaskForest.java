package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The main-thread tasks of a trace as a forest of top-level tasks
 */
public record TaskForest(
        @JsonProperty("tasks") List<TaskNode> roots
) {
    public TaskForest {
        roots = roots != null ? List.copyOf(roots) : List.of();
        for (TaskNode root : roots) {
            if (!root.isTopLevel()) {
                throw new IllegalArgumentException("Not a top-level task: " + root);
            }
        }
    }

    public static TaskForest of(TaskNode... roots) {
        return new TaskForest(List.of(roots));
    }

    /**
     * All tasks of the forest in depth-first pre-order, roots in their original order
     */
    @JsonIgnore
    public List<TaskNode> allTasks() {
        List<TaskNode> result = new ArrayList<>();
        Deque<TaskNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            TaskNode task = stack.pop();
            result.add(task);
            List<TaskNode> children = task.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    @JsonIgnore
    public int getTaskCount() {
        return allTasks().size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return roots.isEmpty();
    }
}
