package github.sarthakdev143.hdr_studio.model;

public enum ArtifactKind {
    TIFF_16BIT("tiff_16bit", "16bit.tiff"),
    PNG_16BIT("png_16bit", "16bit.png"),
    WEB_PREVIEW("web_preview", "preview.jpg"),
    COMPARISON("comparison", "comparison.jpg");

    private final String apiName;
    private final String fileSuffix;

    ArtifactKind(String apiName, String fileSuffix) {
        this.apiName = apiName;
        this.fileSuffix = fileSuffix;
    }

    public String apiName() {
        return apiName;
    }

    public String fileSuffix() {
        return fileSuffix;
    }
}
