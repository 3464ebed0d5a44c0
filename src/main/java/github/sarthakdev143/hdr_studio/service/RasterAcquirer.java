package github.sarthakdev143.hdr_studio.service;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;

import java.net.URI;

public interface RasterAcquirer {

    RasterBuffer8 acquire(URI sourceLocation);
}
