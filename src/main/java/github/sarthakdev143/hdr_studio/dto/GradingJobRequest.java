package github.sarthakdev143.hdr_studio.dto;

public record GradingJobRequest(
        String imageUrl,
        String shotId,
        String preset,
        Double exposure,
        Double contrast,
        Double saturation,
        Double temperature) {
}
