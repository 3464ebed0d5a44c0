package github.sarthakdev143.hdr_studio.model;

import java.net.URI;

public record ShotGradingPlan(
        URI sourceLocation,
        String shotId,
        GradeParams gradeParams) {

    public ShotGradingPlan {
        gradeParams = gradeParams == null ? GradeParams.defaults() : gradeParams;
    }
}
