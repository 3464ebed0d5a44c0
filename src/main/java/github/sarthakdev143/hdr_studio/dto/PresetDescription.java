package github.sarthakdev143.hdr_studio.dto;

public record PresetDescription(
        String name,
        String description) {
}
