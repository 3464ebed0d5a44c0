package github.sarthakdev143.hdr_studio.processing;

import github.sarthakdev143.hdr_studio.exception.InvalidGradeParameterException;
import github.sarthakdev143.hdr_studio.model.GradeParams;
import github.sarthakdev143.hdr_studio.model.ResolvedGrade;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class GradingEngine {

    private static final Logger logger = LoggerFactory.getLogger(GradingEngine.class);

    static final double LUMA_RED = 0.299;
    static final double LUMA_GREEN = 0.587;
    static final double LUMA_BLUE = 0.114;
    static final double TEMPERATURE_SCALE = 0.1;
    private static final double PIVOT = 0.5;
    private static final double FULL_SCALE = RasterBuffer16.MAX_VALUE;

    public RasterBuffer16 grade(RasterBuffer16 source, GradeParams params) {
        Objects.requireNonNull(source, "source raster is required");
        Objects.requireNonNull(params, "grade params are required");
        validate(params);

        ResolvedGrade grade = params.preset().resolve(params);
        validate(grade);
        logger.debug(
                "Resolved grade preset={} exposure={} contrast={} saturation={} temperature={}",
                params.preset(),
                grade.exposure(),
                grade.contrast(),
                grade.saturation(),
                grade.temperature());

        double exposureGain = Math.pow(2.0, grade.exposure());
        double temperatureShift = grade.temperature() * TEMPERATURE_SCALE;
        int[] samples = source.toSamples();

        for (int offset = 0; offset < samples.length; offset += RasterBuffer16.CHANNELS) {
            double red = samples[offset] / FULL_SCALE;
            double green = samples[offset + 1] / FULL_SCALE;
            double blue = samples[offset + 2] / FULL_SCALE;

            red *= exposureGain;
            green *= exposureGain;
            blue *= exposureGain;

            red = (red - PIVOT) * grade.contrast() + PIVOT;
            green = (green - PIVOT) * grade.contrast() + PIVOT;
            blue = (blue - PIVOT) * grade.contrast() + PIVOT;

            double luma = LUMA_RED * red + LUMA_GREEN * green + LUMA_BLUE * blue;
            red = luma + grade.saturation() * (red - luma);
            green = luma + grade.saturation() * (green - luma);
            blue = luma + grade.saturation() * (blue - luma);

            red += temperatureShift;
            blue -= temperatureShift;

            samples[offset] = toSixteenBit(red);
            samples[offset + 1] = toSixteenBit(green);
            samples[offset + 2] = toSixteenBit(blue);
        }

        return RasterBuffer16.of(source.height(), source.width(), samples);
    }

    private int toSixteenBit(double normalized) {
        double clipped = Math.min(1.0, Math.max(0.0, normalized));
        return (int) Math.round(clipped * FULL_SCALE);
    }

    private void validate(GradeParams params) {
        requireFinite(params.exposure(), "exposure");
        requireFinite(params.contrast(), "contrast");
        requireFinite(params.saturation(), "saturation");
        requireFinite(params.temperature(), "temperature");
        requireNonNegative(params.contrast(), "contrast");
        requireNonNegative(params.saturation(), "saturation");
    }

    private void validate(ResolvedGrade grade) {
        requireFinite(grade.exposure(), "resolved exposure");
        requireFinite(Math.pow(2.0, grade.exposure()), "exposure gain");
        requireFinite(grade.contrast(), "resolved contrast");
        requireFinite(grade.saturation(), "resolved saturation");
        requireFinite(grade.temperature(), "resolved temperature");
    }

    private void requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new InvalidGradeParameterException(fieldName + " must be a finite number, was " + value + ".");
        }
    }

    private void requireNonNegative(double value, String fieldName) {
        if (value < 0.0) {
            throw new InvalidGradeParameterException(fieldName + " must be greater than or equal to 0, was " + value + ".");
        }
    }
}
