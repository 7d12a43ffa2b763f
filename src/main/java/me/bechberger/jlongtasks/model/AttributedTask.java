package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A reported task: the resolved causing URL (or browser bucket) and its timings in milliseconds
 */
@JsonPropertyOrder({"url", "group", "start", "self", "duration", "end"})
public record AttributedTask(
        String url,
        String group,
        double start,
        double self,
        double duration
) {
    @JsonProperty("end")
    public double end() {
        return start + duration;
    }
}
