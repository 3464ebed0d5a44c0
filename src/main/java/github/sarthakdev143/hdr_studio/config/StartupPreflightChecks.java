package github.sarthakdev143.hdr_studio.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
@ConditionalOnProperty(name = "hdr-studio.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final List<String> REQUIRED_WRITER_FORMATS = List.of("tiff", "png", "jpeg");

    private final HdrStudioProperties properties;

    public StartupPreflightChecks(HdrStudioProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkOutputDirectory();
        checkImageWriters();
    }

    void checkOutputDirectory() {
        Path outputDir = properties.outputDir();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Output directory could not be created at " + outputDir.toAbsolutePath()
                            + ". Set hdr-studio.output-dir to a writable location.",
                    e);
        }

        if (!Files.isWritable(outputDir)) {
            throw new IllegalStateException(
                    "Output directory is not writable at " + outputDir.toAbsolutePath() + ".");
        }
    }

    void checkImageWriters() {
        for (String format : REQUIRED_WRITER_FORMATS) {
            if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
                throw new IllegalStateException(
                        "No ImageIO writer is available for " + format + ". A JDK with the standard ImageIO plugins is required.");
            }
        }
    }
}
