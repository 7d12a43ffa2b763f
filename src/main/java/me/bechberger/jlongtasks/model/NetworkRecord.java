package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A network request made during the page load
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkRecord(
        String url,
        ResourceType resourceType
) {
    public NetworkRecord {
        Objects.requireNonNull(url, "url");
        resourceType = resourceType != null ? resourceType : ResourceType.OTHER;
    }

    @JsonIgnore
    public boolean isScript() {
        return resourceType == ResourceType.SCRIPT;
    }
}
