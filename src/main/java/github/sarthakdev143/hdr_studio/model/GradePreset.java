package github.sarthakdev143.hdr_studio.model;

import java.util.Locale;
import java.util.function.UnaryOperator;

public enum GradePreset {
    NONE("No adjustment", grade -> grade),
    WARM("Golden hour: exposure +0.1, temperature +0.15, saturation x0.95",
            grade -> grade.addExposure(0.1).addTemperature(0.15).scaleSaturation(0.95)),
    COOL("Clinical: temperature -0.15, saturation x0.9",
            grade -> grade.addTemperature(-0.15).scaleSaturation(0.9)),
    DRAMATIC("High contrast: contrast x1.3, saturation x0.85, exposure -0.1",
            grade -> grade.scaleContrast(1.3).scaleSaturation(0.85).addExposure(-0.1)),
    VINTAGE("Faded warm: saturation x0.7, temperature +0.1, contrast x0.9",
            grade -> grade.scaleSaturation(0.7).addTemperature(0.1).scaleContrast(0.9)),
    NOIR("Near monochrome: saturation x0.3, contrast x1.4",
            grade -> grade.scaleSaturation(0.3).scaleContrast(1.4));

    private final String description;
    private final UnaryOperator<ResolvedGrade> deltas;

    GradePreset(String description, UnaryOperator<ResolvedGrade> deltas) {
        this.description = description;
        this.deltas = deltas;
    }

    public String description() {
        return description;
    }

    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public ResolvedGrade resolve(GradeParams params) {
        return deltas.apply(ResolvedGrade.from(params));
    }

    public static GradePreset fromName(String input) {
        GradePreset preset = lookup(input);
        return preset == null ? NONE : preset;
    }

    public static boolean isRecognized(String input) {
        return lookup(input) != null;
    }

    private static GradePreset lookup(String input) {
        if (input == null || input.isBlank()) {
            return NONE;
        }
        String normalized = input.trim().toUpperCase(Locale.ROOT);
        if ("NEUTRAL".equals(normalized)) {
            return NONE;
        }
        for (GradePreset preset : values()) {
            if (preset.name().equals(normalized)) {
                return preset;
            }
        }
        return null;
    }
}
