package github.sarthakdev143.hdr_studio.model;

public record GradeParams(
        GradePreset preset,
        double exposure,
        double contrast,
        double saturation,
        double temperature) {

    public static final double DEFAULT_EXPOSURE = 0.0;
    public static final double DEFAULT_CONTRAST = 1.0;
    public static final double DEFAULT_SATURATION = 1.0;
    public static final double DEFAULT_TEMPERATURE = 0.0;

    public GradeParams {
        preset = preset == null ? GradePreset.NONE : preset;
    }

    public static GradeParams defaults() {
        return new GradeParams(GradePreset.NONE, DEFAULT_EXPOSURE, DEFAULT_CONTRAST, DEFAULT_SATURATION, DEFAULT_TEMPERATURE);
    }

    public static GradeParams ofPreset(GradePreset preset) {
        return defaults().withPreset(preset);
    }

    public GradeParams withPreset(GradePreset newPreset) {
        return new GradeParams(newPreset, exposure, contrast, saturation, temperature);
    }

    public GradeParams withExposure(double newExposure) {
        return new GradeParams(preset, newExposure, contrast, saturation, temperature);
    }

    public GradeParams withContrast(double newContrast) {
        return new GradeParams(preset, exposure, newContrast, saturation, temperature);
    }

    public GradeParams withSaturation(double newSaturation) {
        return new GradeParams(preset, exposure, contrast, newSaturation, temperature);
    }

    public GradeParams withTemperature(double newTemperature) {
        return new GradeParams(preset, exposure, contrast, saturation, newTemperature);
    }
}
