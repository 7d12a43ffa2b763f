package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of the kind of work a task performs
 */
public enum TaskGroup {
    PARSE_HTML("parseHTML", "Parse HTML & CSS"),
    STYLE_LAYOUT("styleLayout", "Style & Layout"),
    PAINT_COMPOSITE_RENDER("paintCompositeRender", "Rendering"),
    SCRIPT_PARSE_COMPILE("scriptParseCompile", "Script Parsing & Compilation"),
    SCRIPT_EVALUATION("scriptEvaluation", "Script Evaluation"),
    GARBAGE_COLLECTION("garbageCollection", "Garbage Collection"),
    OTHER("other", "Other");

    private final String id;
    private final String label;

    TaskGroup(String id, String label) {
        this.id = id;
        this.label = label;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Look up a group by id or label (case-insensitive), unknown values map to {@link #OTHER}
     */
    @JsonCreator
    public static TaskGroup fromString(String value) {
        if (value == null) {
            return OTHER;
        }
        for (TaskGroup group : values()) {
            if (group.id.equalsIgnoreCase(value) || group.label.equalsIgnoreCase(value)) {
                return group;
            }
        }
        return OTHER;
    }
}
