package github.sarthakdev143.hdr_studio.model;

public record ResolvedGrade(
        double exposure,
        double contrast,
        double saturation,
        double temperature) {

    static ResolvedGrade from(GradeParams params) {
        return new ResolvedGrade(params.exposure(), params.contrast(), params.saturation(), params.temperature());
    }

    ResolvedGrade addExposure(double delta) {
        return new ResolvedGrade(exposure + delta, contrast, saturation, temperature);
    }

    ResolvedGrade scaleContrast(double factor) {
        return new ResolvedGrade(exposure, contrast * factor, saturation, temperature);
    }

    ResolvedGrade scaleSaturation(double factor) {
        return new ResolvedGrade(exposure, contrast, saturation * factor, temperature);
    }

    ResolvedGrade addTemperature(double delta) {
        return new ResolvedGrade(exposure, contrast, saturation, temperature + delta);
    }
}
