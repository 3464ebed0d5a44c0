package github.sarthakdev143.hdr_studio.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "hdr-studio")
public record HdrStudioProperties(
        @DefaultValue("outputs/hdr") Path outputDir,
        @DefaultValue Fetch fetch) {

    public record Fetch(
            @DefaultValue("10s") Duration connectTimeout,
            @DefaultValue("30s") Duration readTimeout) {
    }
}
