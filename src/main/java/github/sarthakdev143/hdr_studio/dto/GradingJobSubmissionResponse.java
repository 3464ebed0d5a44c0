package github.sarthakdev143.hdr_studio.dto;

import github.sarthakdev143.hdr_studio.model.GradingJobState;

public record GradingJobSubmissionResponse(
        String jobId,
        GradingJobState state,
        String message) {
}
