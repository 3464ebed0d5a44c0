package github.sarthakdev143.hdr_studio.service.impl;

import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.GradeParams;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import github.sarthakdev143.hdr_studio.processing.BitDepthExpander;
import github.sarthakdev143.hdr_studio.processing.GradingEngine;
import github.sarthakdev143.hdr_studio.service.ArtifactExporter;
import github.sarthakdev143.hdr_studio.service.HdrPipelineService;
import github.sarthakdev143.hdr_studio.service.RasterAcquirer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;

@Service
public class DefaultHdrPipelineService implements HdrPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultHdrPipelineService.class);

    private final RasterAcquirer rasterAcquirer;
    private final BitDepthExpander bitDepthExpander;
    private final GradingEngine gradingEngine;
    private final ArtifactExporter artifactExporter;

    public DefaultHdrPipelineService(
            RasterAcquirer rasterAcquirer,
            BitDepthExpander bitDepthExpander,
            GradingEngine gradingEngine,
            ArtifactExporter artifactExporter) {
        this.rasterAcquirer = rasterAcquirer;
        this.bitDepthExpander = bitDepthExpander;
        this.gradingEngine = gradingEngine;
        this.artifactExporter = artifactExporter;
    }

    @Override
    public ArtifactManifest process(URI sourceLocation, String identifier, GradeParams gradeParams) {
        GradeParams params = gradeParams == null ? GradeParams.defaults() : gradeParams;
        logger.info("Starting HDR pipeline for {} preset={}", identifier, params.preset().apiName());

        RasterBuffer8 original = rasterAcquirer.acquire(sourceLocation);
        RasterBuffer16 expanded = bitDepthExpander.expand(original);
        logger.debug("Expanded {} to 16-bit working buffer", identifier);

        RasterBuffer16 graded = gradingEngine.grade(expanded, params);
        logger.info(
                "Graded {} exposure={} contrast={} saturation={} temperature={}",
                identifier,
                params.exposure(),
                params.contrast(),
                params.saturation(),
                params.temperature());

        ArtifactManifest manifest = artifactExporter.export(original, graded, identifier);
        logger.info("Completed HDR pipeline for {} with {} artifacts", identifier, manifest.artifacts().size());
        return manifest;
    }
}
