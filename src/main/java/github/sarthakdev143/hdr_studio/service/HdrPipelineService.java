package github.sarthakdev143.hdr_studio.service;

import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.GradeParams;

import java.net.URI;

public interface HdrPipelineService {

    /**
     * Runs acquisition, bit-depth expansion, grading and export for one shot.
     * The identifier must be unique per run: output file names only carry a second-granularity
     * timestamp, and writers do not check for existing files.
     */
    ArtifactManifest process(URI sourceLocation, String identifier, GradeParams gradeParams);
}
