package github.sarthakdev143.hdr_studio.controller;

import github.sarthakdev143.hdr_studio.config.HdrStudioProperties;
import github.sarthakdev143.hdr_studio.dto.GradingJobRequest;
import github.sarthakdev143.hdr_studio.dto.GradingJobSubmissionResponse;
import github.sarthakdev143.hdr_studio.dto.PresetDescription;
import github.sarthakdev143.hdr_studio.model.GradePreset;
import github.sarthakdev143.hdr_studio.model.GradingJobState;
import github.sarthakdev143.hdr_studio.service.GradingJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/hdr")
public class GradingController {

    private static final Logger logger = LoggerFactory.getLogger(GradingController.class);

    private final GradingJobService gradingJobService;
    private final Path outputDirectory;

    public GradingController(GradingJobService gradingJobService, HdrStudioProperties properties) {
        this.gradingJobService = gradingJobService;
        this.outputDirectory = properties.outputDir().toAbsolutePath().normalize();
    }

    @PostMapping(value = "/jobs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submitJob(@RequestBody GradingJobRequest request) {
        try {
            String jobId = gradingJobService.submitJob(request);
            return ResponseEntity.accepted()
                    .body(new GradingJobSubmissionResponse(
                            jobId,
                            GradingJobState.QUEUED,
                            "Grading job accepted. Poll /api/hdr/jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Grading job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit grading job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return gradingJobService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @GetMapping("/presets")
    public List<PresetDescription> listPresets() {
        return Arrays.stream(GradePreset.values())
                .map(preset -> new PresetDescription(preset.apiName(), preset.description()))
                .toList();
    }

    @GetMapping("/artifacts/{filename}")
    public ResponseEntity<?> downloadArtifact(@PathVariable String filename) {
        if (filename.contains("/") || filename.contains("\\") || filename.contains("..")) {
            return ResponseEntity.badRequest().body("Invalid request: filename must not contain path segments.");
        }

        Path artifact = outputDirectory.resolve(filename).normalize();
        if (!artifact.startsWith(outputDirectory) || !Files.isRegularFile(artifact)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Artifact not found: " + filename);
        }

        MediaType mediaType = MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(mediaType)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(new FileSystemResource(artifact));
    }
}
