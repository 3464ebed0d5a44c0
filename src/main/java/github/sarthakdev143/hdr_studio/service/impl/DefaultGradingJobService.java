package github.sarthakdev143.hdr_studio.service.impl;

import github.sarthakdev143.hdr_studio.dto.GradingJobRequest;
import github.sarthakdev143.hdr_studio.exception.AcquisitionException;
import github.sarthakdev143.hdr_studio.exception.ExportException;
import github.sarthakdev143.hdr_studio.exception.InvalidGradeParameterException;
import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.GradingJobState;
import github.sarthakdev143.hdr_studio.model.GradingJobStatus;
import github.sarthakdev143.hdr_studio.model.ShotGradingPlan;
import github.sarthakdev143.hdr_studio.service.GradingJobService;
import github.sarthakdev143.hdr_studio.service.HdrPipelineService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultGradingJobService implements GradingJobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultGradingJobService.class);
    private static final int RUN_SUFFIX_LENGTH = 8;

    private final HdrPipelineService hdrPipelineService;
    private final GradingRequestValidator requestValidator;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final Map<String, GradingJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter jobsSubmittedCounter;
    private final Counter jobsCompletedCounter;

    public DefaultGradingJobService(
            HdrPipelineService hdrPipelineService,
            GradingRequestValidator requestValidator,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.hdrPipelineService = hdrPipelineService;
        this.requestValidator = requestValidator;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.jobsSubmittedCounter = meterRegistry.counter("hdr_studio.jobs.submitted");
        this.jobsCompletedCounter = meterRegistry.counter("hdr_studio.jobs.completed");
    }

    @Override
    public String submitJob(GradingJobRequest request) {
        ShotGradingPlan plan = requestValidator.normalizeAndValidate(request);
        String jobId = UUID.randomUUID().toString();
        String runIdentifier = plan.shotId() + "-" + jobId.substring(0, RUN_SUFFIX_LENGTH);

        Instant now = Instant.now();
        jobs.put(jobId, new GradingJobStatus(
                jobId,
                plan.shotId(),
                GradingJobState.QUEUED,
                "Job queued.",
                now,
                now,
                plan.gradeParams().preset().apiName(),
                null));
        jobsSubmittedCounter.increment();

        logger.info(
                "Accepted grading job {} shotId={} preset={} source={}",
                jobId,
                plan.shotId(),
                plan.gradeParams().preset().apiName(),
                plan.sourceLocation());

        taskExecutor.execute(() -> processJob(jobId, runIdentifier, plan));
        return jobId;
    }

    @Override
    public Optional<GradingJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void processJob(String jobId, String runIdentifier, ShotGradingPlan plan) {
        updateJobState(jobId, GradingJobState.PROCESSING, "Downloading, grading and exporting.", null);

        try {
            ArtifactManifest manifest = hdrPipelineService.process(
                    plan.sourceLocation(),
                    runIdentifier,
                    plan.gradeParams());
            jobsCompletedCounter.increment();
            updateJobState(jobId, GradingJobState.COMPLETED, "Grading completed.", manifest.toApiView());
            logger.info("Completed grading job {} shotId={} artifacts={}", jobId, plan.shotId(), manifest.artifacts().keySet());
        } catch (Exception e) {
            String reason = failureReason(e);
            meterRegistry.counter("hdr_studio.jobs.failed", "reason", reason).increment();
            logger.error("Grading job {} failed ({})", jobId, reason, e);
            updateJobState(jobId, GradingJobState.FAILED, failureMessage(reason), null);
        }
    }

    private String failureReason(Exception e) {
        if (e instanceof AcquisitionException) {
            return "acquisition";
        }
        if (e instanceof InvalidGradeParameterException) {
            return "invalid_parameters";
        }
        if (e instanceof ExportException) {
            return "export";
        }
        return "unexpected";
    }

    private String failureMessage(String reason) {
        return switch (reason) {
            case "acquisition" -> "Source image could not be downloaded or decoded.";
            case "invalid_parameters" -> "Grading parameters were rejected.";
            case "export" -> "Writing output artifacts failed. Check server logs.";
            default -> "Grading failed. Check server logs.";
        };
    }

    private void updateJobState(String jobId, GradingJobState state, String message, Map<String, String> artifacts) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new GradingJobStatus(
                current.jobId(),
                current.shotId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.preset(),
                artifacts == null ? current.artifacts() : artifacts));
    }
}
