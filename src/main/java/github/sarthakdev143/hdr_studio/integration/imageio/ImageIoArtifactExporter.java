package github.sarthakdev143.hdr_studio.integration.imageio;

import github.sarthakdev143.hdr_studio.config.HdrStudioProperties;
import github.sarthakdev143.hdr_studio.exception.ExportException;
import github.sarthakdev143.hdr_studio.model.ArtifactKind;
import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import github.sarthakdev143.hdr_studio.processing.ReinhardToneMapper;
import github.sarthakdev143.hdr_studio.service.ArtifactExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

@Component
public class ImageIoArtifactExporter implements ArtifactExporter {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoArtifactExporter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String TIFF_COMPRESSION_TYPE = "LZW";
    private static final int PNG_COMPRESSION_LEVEL = 6;
    private static final float JPEG_QUALITY = 0.95f;

    private final Path outputDirectory;
    private final ReinhardToneMapper toneMapper;
    private final ComparisonRenderer comparisonRenderer;
    private final Clock clock;

    public ImageIoArtifactExporter(
            HdrStudioProperties properties,
            ReinhardToneMapper toneMapper,
            ComparisonRenderer comparisonRenderer,
            Clock clock) {
        this.outputDirectory = properties.outputDir();
        this.toneMapper = toneMapper;
        this.comparisonRenderer = comparisonRenderer;
        this.clock = clock;
    }

    @Override
    public ArtifactManifest export(RasterBuffer8 original, RasterBuffer16 graded, String baseIdentifier) {
        if (baseIdentifier == null || baseIdentifier.isBlank()) {
            throw new IllegalArgumentException("baseIdentifier is required.");
        }
        createOutputDirectory();

        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        Map<ArtifactKind, Path> paths = new EnumMap<>(ArtifactKind.class);

        BufferedImage masterImage = RasterImages.toBufferedImage(graded);
        paths.put(ArtifactKind.TIFF_16BIT, write(
                ArtifactKind.TIFF_16BIT, masterImage, "tiff", baseIdentifier, timestamp, this::configureTiff));
        paths.put(ArtifactKind.PNG_16BIT, write(
                ArtifactKind.PNG_16BIT, masterImage, "png", baseIdentifier, timestamp, this::configurePng));

        RasterBuffer8 display = toneMapper.toneMap(graded);
        paths.put(ArtifactKind.WEB_PREVIEW, write(
                ArtifactKind.WEB_PREVIEW,
                RasterImages.toBufferedImage(display),
                "jpeg",
                baseIdentifier,
                timestamp,
                this::configureJpeg));

        BufferedImage comparison = comparisonRenderer.render(original, display);
        paths.put(ArtifactKind.COMPARISON, write(
                ArtifactKind.COMPARISON, comparison, "jpeg", baseIdentifier, timestamp, this::configureJpeg));

        return new ArtifactManifest(paths);
    }

    String fileNameFor(String baseIdentifier, String timestamp, ArtifactKind kind) {
        return baseIdentifier + "_" + timestamp + "_" + kind.fileSuffix();
    }

    private Path write(
            ArtifactKind kind,
            BufferedImage image,
            String formatName,
            String baseIdentifier,
            String timestamp,
            Consumer<ImageWriteParam> configure) {
        Path target = outputDirectory.resolve(fileNameFor(baseIdentifier, timestamp, kind));
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new ExportException("No ImageIO writer available for format " + formatName + ".");
        }

        ImageWriter writer = writers.next();
        try (OutputStream output = Files.newOutputStream(target);
             ImageOutputStream imageOutput = ImageIO.createImageOutputStream(output)) {
            writer.setOutput(imageOutput);
            ImageWriteParam param = writer.getDefaultWriteParam();
            configure.accept(param);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new ExportException("Failed to write " + kind.apiName() + " to " + target + ".", e);
        } finally {
            writer.dispose();
        }

        logger.info("Exported {} to {} ({} bytes)", kind.apiName(), target, sizeOf(target));
        return target;
    }

    private void configureTiff(ImageWriteParam param) {
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionType(TIFF_COMPRESSION_TYPE);
        }
    }

    private void configurePng(ImageWriteParam param) {
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionType(param.getCompressionTypes()[0]);
            // The PNG writer derives the deflate level as (int) (9 * (1 - quality)).
            param.setCompressionQuality(1.0f - (PNG_COMPRESSION_LEVEL + 0.5f) / 9.0f);
        }
    }

    private void configureJpeg(ImageWriteParam param) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);
    }

    private void createOutputDirectory() {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new ExportException("Unable to create output directory " + outputDirectory + ".", e);
        }
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new ExportException("Unable to read size of written artifact " + path + ".", e);
        }
    }
}
