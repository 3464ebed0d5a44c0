package github.sarthakdev143.hdr_studio.service;

import github.sarthakdev143.hdr_studio.dto.GradingJobRequest;
import github.sarthakdev143.hdr_studio.model.GradingJobStatus;

import java.util.Optional;

public interface GradingJobService {

    String submitJob(GradingJobRequest request);

    Optional<GradingJobStatus> getJobStatus(String jobId);
}
