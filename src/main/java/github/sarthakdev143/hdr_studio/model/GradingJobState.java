package github.sarthakdev143.hdr_studio.model;

public enum GradingJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED
}
