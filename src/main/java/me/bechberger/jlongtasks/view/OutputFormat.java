package me.bechberger.jlongtasks.view;

import java.util.Locale;

/**
 * Output format for rendering analysis results.
 */
public enum OutputFormat {
    /** Plain text table for the terminal (with optional ANSI colors) */
    TEXT,
    /** Single-file HTML report */
    HTML,
    /** JSON for machine processing */
    JSON,
    /** YAML for human-readable machine format */
    YAML;

    /**
     * Parse a format from string (case-insensitive), {@code null} means TEXT
     *
     * @throws IllegalArgumentException for unknown formats
     */
    public static OutputFormat fromString(String format) {
        if (format == null) {
            return TEXT;
        }
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "text", "txt", "cli" -> TEXT;
            case "html", "htm" -> HTML;
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException(
                    "Unknown output format: " + format + " (expected text, html, json or yaml)");
        };
    }

    /**
     * Guess the format from a file name, TEXT if the extension is unknown
     */
    public static OutputFormat fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return TEXT;
        }
        try {
            return fromString(fileName.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            return TEXT;
        }
    }

    /**
     * Get file extension for this format
     */
    public String getExtension() {
        return switch (this) {
            case TEXT -> "txt";
            case HTML -> "html";
            case JSON -> "json";
            case YAML -> "yaml";
        };
    }
}
