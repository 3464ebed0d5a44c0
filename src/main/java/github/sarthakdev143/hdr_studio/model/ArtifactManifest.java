package github.sarthakdev143.hdr_studio.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record ArtifactManifest(Map<ArtifactKind, Path> artifacts) {

    public ArtifactManifest {
        if (artifacts == null || artifacts.isEmpty()) {
            throw new IllegalArgumentException("Artifact manifest must contain at least one artifact.");
        }
        artifacts = Collections.unmodifiableMap(new EnumMap<>(artifacts));
    }

    public Path pathFor(ArtifactKind kind) {
        return artifacts.get(kind);
    }

    public Map<String, String> toApiView() {
        Map<String, String> view = new LinkedHashMap<>();
        artifacts.forEach((kind, path) -> view.put(kind.apiName(), path.toString()));
        return view;
    }
}
