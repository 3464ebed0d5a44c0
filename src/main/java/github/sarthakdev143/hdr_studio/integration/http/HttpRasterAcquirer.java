package github.sarthakdev143.hdr_studio.integration.http;

import github.sarthakdev143.hdr_studio.exception.AcquisitionException;
import github.sarthakdev143.hdr_studio.integration.imageio.RasterImages;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import github.sarthakdev143.hdr_studio.service.RasterAcquirer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Set;

@Component
public class HttpRasterAcquirer implements RasterAcquirer {

    private static final Logger logger = LoggerFactory.getLogger(HttpRasterAcquirer.class);
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    private final RestClient restClient;

    public HttpRasterAcquirer(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public RasterBuffer8 acquire(URI sourceLocation) {
        if (sourceLocation == null) {
            throw new AcquisitionException("Source location is required.");
        }
        String scheme = sourceLocation.getScheme();
        if (scheme == null || !SUPPORTED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            throw new AcquisitionException("Source location must be an http or https URL: " + sourceLocation);
        }
        if (sourceLocation.isOpaque() || sourceLocation.getHost() == null) {
            throw new AcquisitionException("Source location has no host: " + sourceLocation);
        }

        logger.info("Downloading source image from {}", sourceLocation);
        byte[] payload;
        try {
            payload = restClient.get()
                    .uri(sourceLocation)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            throw new AcquisitionException("Failed to download source image from " + sourceLocation + ".", e);
        }

        if (payload == null || payload.length == 0) {
            throw new AcquisitionException("Source image at " + sourceLocation + " returned an empty body.");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(payload));
        } catch (IOException e) {
            throw new AcquisitionException("Source image at " + sourceLocation + " could not be decoded.", e);
        }
        if (image == null) {
            throw new AcquisitionException("Source image at " + sourceLocation + " is not a supported image format.");
        }

        if (image.getColorModel().hasAlpha()) {
            logger.debug("Dropping alpha channel from source image {}", sourceLocation);
        }
        RasterBuffer8 raster = RasterImages.fromBufferedImage(image);
        logger.info("Downloaded source image {}x{} ({} bytes)", raster.width(), raster.height(), payload.length);
        return raster;
    }
}
