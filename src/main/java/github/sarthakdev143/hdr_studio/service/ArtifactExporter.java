package github.sarthakdev143.hdr_studio.service;

import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;

public interface ArtifactExporter {

    ArtifactManifest export(RasterBuffer8 original, RasterBuffer16 graded, String baseIdentifier);
}
