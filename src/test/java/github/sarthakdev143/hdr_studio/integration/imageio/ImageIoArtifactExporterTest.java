package github.sarthakdev143.hdr_studio.integration.imageio;

import github.sarthakdev143.hdr_studio.config.HdrStudioProperties;
import github.sarthakdev143.hdr_studio.exception.ExportException;
import github.sarthakdev143.hdr_studio.model.ArtifactKind;
import github.sarthakdev143.hdr_studio.model.ArtifactManifest;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import github.sarthakdev143.hdr_studio.processing.BitDepthExpander;
import github.sarthakdev143.hdr_studio.processing.ReinhardToneMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageIoArtifactExporterTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:34:56Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void exportWritesAllFourArtifactsWithTimestampedNames() throws IOException {
        Path outputDir = tempDir.resolve("hdr");
        ImageIoArtifactExporter exporter = exporterFor(outputDir);
        RasterBuffer8 original = gradient(48, 64);

        ArtifactManifest manifest = exporter.export(original, new BitDepthExpander().expand(original), "shot-1");

        assertThat(manifest.artifacts()).containsOnlyKeys(ArtifactKind.values());
        assertThat(manifest.pathFor(ArtifactKind.TIFF_16BIT)).isEqualTo(outputDir.resolve("shot-1_20260301_123456_16bit.tiff"));
        assertThat(manifest.pathFor(ArtifactKind.PNG_16BIT)).isEqualTo(outputDir.resolve("shot-1_20260301_123456_16bit.png"));
        assertThat(manifest.pathFor(ArtifactKind.WEB_PREVIEW)).isEqualTo(outputDir.resolve("shot-1_20260301_123456_preview.jpg"));
        assertThat(manifest.pathFor(ArtifactKind.COMPARISON)).isEqualTo(outputDir.resolve("shot-1_20260301_123456_comparison.jpg"));
        for (Path path : manifest.artifacts().values()) {
            assertThat(path).isRegularFile();
            assertThat(Files.size(path)).isPositive();
        }
    }

    @Test
    void sixteenBitMastersKeepEverySample() throws IOException {
        ImageIoArtifactExporter exporter = exporterFor(tempDir);
        RasterBuffer8 original = gradient(1, 3);
        RasterBuffer16 graded = RasterBuffer16.of(1, 3, new int[]{
                0, 1, 65535,
                257, 32896, 40001,
                65534, 12345, 2});

        ArtifactManifest manifest = exporter.export(original, graded, "masters");

        assertThat(readSixteenBitSamples(manifest.pathFor(ArtifactKind.PNG_16BIT))).containsExactly(graded.toSamples());
        assertThat(readSixteenBitSamples(manifest.pathFor(ArtifactKind.TIFF_16BIT))).containsExactly(graded.toSamples());
    }

    @Test
    void previewIsEightBitAndComparisonIsSideBySide() throws IOException {
        ImageIoArtifactExporter exporter = exporterFor(tempDir);
        RasterBuffer8 original = gradient(40, 60);

        ArtifactManifest manifest = exporter.export(original, new BitDepthExpander().expand(original), "layout");

        BufferedImage preview = ImageIO.read(manifest.pathFor(ArtifactKind.WEB_PREVIEW).toFile());
        assertThat(preview.getWidth()).isEqualTo(60);
        assertThat(preview.getHeight()).isEqualTo(40);
        assertThat(preview.getSampleModel().getSampleSize(0)).isEqualTo(8);

        BufferedImage comparison = ImageIO.read(manifest.pathFor(ArtifactKind.COMPARISON).toFile());
        assertThat(comparison.getWidth()).isEqualTo(60 * 2 + ComparisonRenderer.SEPARATOR_WIDTH);
        assertThat(comparison.getHeight()).isEqualTo(40);
    }

    @Test
    void exportCreatesMissingOutputDirectory() {
        Path nested = tempDir.resolve("a").resolve("b");
        RasterBuffer8 original = gradient(4, 4);

        exporterFor(nested).export(original, new BitDepthExpander().expand(original), "nested");

        assertThat(nested).isDirectory();
    }

    @Test
    void exportFailsWithExportExceptionWhenDirectoryCannotBeCreated() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        RasterBuffer8 original = gradient(4, 4);
        ImageIoArtifactExporter exporter = exporterFor(blocker.resolve("hdr"));

        assertThatThrownBy(() -> exporter.export(original, new BitDepthExpander().expand(original), "blocked"))
                .isInstanceOf(ExportException.class)
                .hasMessageContaining("output directory");
    }

    @Test
    void exportFailsWhenOneArtifactCannotBeWrittenAndKeepsEarlierArtifacts() throws IOException {
        Files.createDirectories(tempDir.resolve("partial_20260301_123456_16bit.png"));
        RasterBuffer8 original = gradient(4, 4);
        ImageIoArtifactExporter exporter = exporterFor(tempDir);

        assertThatThrownBy(() -> exporter.export(original, new BitDepthExpander().expand(original), "partial"))
                .isInstanceOf(ExportException.class)
                .hasMessageContaining("png_16bit");

        Path tiff = tempDir.resolve("partial_20260301_123456_16bit.tiff");
        assertThat(tiff).isRegularFile();
        assertThat(Files.size(tiff)).isPositive();
        assertThat(tempDir.resolve("partial_20260301_123456_preview.jpg")).doesNotExist();
    }

    @Test
    void exportRequiresBaseIdentifier() {
        RasterBuffer8 original = gradient(2, 2);
        ImageIoArtifactExporter exporter = exporterFor(tempDir);

        assertThatThrownBy(() -> exporter.export(original, new BitDepthExpander().expand(original), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ImageIoArtifactExporter exporterFor(Path outputDir) {
        HdrStudioProperties properties = new HdrStudioProperties(
                outputDir,
                new HdrStudioProperties.Fetch(Duration.ofSeconds(1), Duration.ofSeconds(1)));
        return new ImageIoArtifactExporter(properties, new ReinhardToneMapper(), new ComparisonRenderer(), FIXED_CLOCK);
    }

    private int[] readSixteenBitSamples(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        Raster raster = image.getRaster();
        assertThat(raster.getNumBands()).isEqualTo(3);
        assertThat(raster.getSampleModel().getDataType()).isEqualTo(DataBuffer.TYPE_USHORT);
        return raster.getPixels(0, 0, image.getWidth(), image.getHeight(), (int[]) null);
    }

    private RasterBuffer8 gradient(int height, int width) {
        int[] samples = new int[height * width * 3];
        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                int offset = (row * width + column) * 3;
                samples[offset] = column * 255 / Math.max(1, width - 1);
                samples[offset + 1] = row * 255 / Math.max(1, height - 1);
                samples[offset + 2] = 128;
            }
        }
        return RasterBuffer8.of(height, width, samples);
    }
}
