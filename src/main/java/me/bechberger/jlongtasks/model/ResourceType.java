package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resource type of a network request, as reported by the DevTools protocol
 */
public enum ResourceType {
    DOCUMENT("Document"),
    STYLESHEET("Stylesheet"),
    IMAGE("Image"),
    MEDIA("Media"),
    FONT("Font"),
    SCRIPT("Script"),
    TEXT_TRACK("TextTrack"),
    XHR("XHR"),
    FETCH("Fetch"),
    EVENT_SOURCE("EventSource"),
    WEB_SOCKET("WebSocket"),
    MANIFEST("Manifest"),
    SIGNED_EXCHANGE("SignedExchange"),
    PING("Ping"),
    CSP_VIOLATION_REPORT("CSPViolationReport"),
    PREFLIGHT("Preflight"),
    OTHER("Other");

    private final String protocolName;

    ResourceType(String protocolName) {
        this.protocolName = protocolName;
    }

    @JsonValue
    public String getProtocolName() {
        return protocolName;
    }

    @JsonCreator
    public static ResourceType fromString(String value) {
        if (value == null) {
            return OTHER;
        }
        for (ResourceType type : values()) {
            if (type.protocolName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return OTHER;
    }
}
