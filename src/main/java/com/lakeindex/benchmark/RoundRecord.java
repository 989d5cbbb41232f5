package com.lakeindex.benchmark;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 基准日志中的一轮记录。
 */
public record RoundRecord(
        @JsonProperty("round") int round,
        @JsonProperty("cumulative_deleted") int cumulativeDeleted,
        @JsonProperty("compactions") int compactions,
        @JsonProperty("latency_ms") List<Double> latencyMs
) {
    public RoundRecord {
        latencyMs = latencyMs == null ? List.of() : List.copyOf(latencyMs);
    }

    @JsonIgnore
    public double averageLatencyMs() {
        return latencyMs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
