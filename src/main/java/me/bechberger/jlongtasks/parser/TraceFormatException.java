package me.bechberger.jlongtasks.parser;

import java.io.IOException;

/**
 * Thrown when a trace input document is malformed or violates the task invariants
 */
public class TraceFormatException extends IOException {

    private final String path;

    public TraceFormatException(String path, String message) {
        super(path.isEmpty() ? message : path + ": " + message);
        this.path = path;
    }

    public TraceFormatException(String message, Throwable cause) {
        super(message, cause);
        this.path = "";
    }

    /**
     * JSON path of the offending element, empty if the whole document is affected
     */
    public String getPath() {
        return path;
    }
}
