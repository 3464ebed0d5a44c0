package github.sarthakdev143.hdr_studio.service.impl;

import github.sarthakdev143.hdr_studio.dto.GradingJobRequest;
import github.sarthakdev143.hdr_studio.model.GradeParams;
import github.sarthakdev143.hdr_studio.model.GradePreset;
import github.sarthakdev143.hdr_studio.model.ShotGradingPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class GradingRequestValidator {

    private static final Logger logger = LoggerFactory.getLogger(GradingRequestValidator.class);
    private static final Pattern SHOT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final double MIN_EXPOSURE = -10.0;
    private static final double MAX_EXPOSURE = 10.0;
    private static final double MIN_CONTRAST = 0.0;
    private static final double MAX_CONTRAST = 10.0;
    private static final double MIN_SATURATION = 0.0;
    private static final double MAX_SATURATION = 10.0;
    private static final double MIN_TEMPERATURE = -10.0;
    private static final double MAX_TEMPERATURE = 10.0;

    public ShotGradingPlan normalizeAndValidate(GradingJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }

        URI sourceLocation = requireImageUrl(request.imageUrl());
        String shotId = requireShotId(request.shotId());
        GradePreset preset = resolvePreset(request.preset());

        GradeParams gradeParams = new GradeParams(
                preset,
                valueInRangeOrDefault(request.exposure(), GradeParams.DEFAULT_EXPOSURE, MIN_EXPOSURE, MAX_EXPOSURE, "exposure"),
                valueInRangeOrDefault(request.contrast(), GradeParams.DEFAULT_CONTRAST, MIN_CONTRAST, MAX_CONTRAST, "contrast"),
                valueInRangeOrDefault(request.saturation(), GradeParams.DEFAULT_SATURATION, MIN_SATURATION, MAX_SATURATION, "saturation"),
                valueInRangeOrDefault(request.temperature(), GradeParams.DEFAULT_TEMPERATURE, MIN_TEMPERATURE, MAX_TEMPERATURE, "temperature"));

        return new ShotGradingPlan(sourceLocation, shotId, gradeParams);
    }

    private URI requireImageUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("imageUrl is required.");
        }

        URI uri;
        try {
            uri = new URI(imageUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("imageUrl must be a valid URL.", e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("imageUrl must be an absolute http or https URL.");
        }
        return uri;
    }

    private String requireShotId(String shotId) {
        if (shotId == null || shotId.isBlank()) {
            throw new IllegalArgumentException("shotId is required.");
        }
        String normalized = shotId.trim();
        if (!SHOT_ID_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("shotId must match ^[A-Za-z0-9_-]{1,64}$.");
        }
        return normalized;
    }

    private GradePreset resolvePreset(String presetInput) {
        if (!GradePreset.isRecognized(presetInput)) {
            // Unknown names grade without preset deltas rather than failing the request.
            logger.warn("Unrecognized grade preset '{}', grading without preset adjustments", presetInput);
        }
        return GradePreset.fromName(presetInput);
    }

    private double requireFinite(Double value, String fieldName) {
        if (value == null || !Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be a finite number.");
        }
        return value;
    }

    private double valueInRangeOrDefault(
            Double value,
            double defaultValue,
            double minValue,
            double maxValue,
            String fieldName) {
        if (value == null) {
            return defaultValue;
        }

        double normalized = requireFinite(value, fieldName);
        if (normalized < minValue || normalized > maxValue) {
            throw new IllegalArgumentException(
                    fieldName
                            + " must be between "
                            + minValue
                            + " and "
                            + maxValue
                            + ".");
        }
        return normalized;
    }
}
