package github.sarthakdev143.hdr_studio.model;

import java.time.Instant;
import java.util.Map;

public record GradingJobStatus(
        String jobId,
        String shotId,
        GradingJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String preset,
        Map<String, String> artifacts) {

    public GradingJobStatus {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
    }
}
