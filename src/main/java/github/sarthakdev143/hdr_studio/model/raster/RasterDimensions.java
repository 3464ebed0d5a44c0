package github.sarthakdev143.hdr_studio.model.raster;

final class RasterDimensions {

    private RasterDimensions() {
    }

    static void check(int height, int width, int sampleCount) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(
                    "Raster dimensions must be positive, got " + height + "x" + width + ".");
        }
        if (sampleCount < 0) {
            throw new IllegalArgumentException("Raster samples are required.");
        }
        long expected = (long) height * width * 3;
        if (expected != sampleCount) {
            throw new IllegalArgumentException(
                    "Raster of " + height + "x" + width + "x3 needs " + expected + " samples, got " + sampleCount + ".");
        }
    }

    static int offset(int width, int row, int column, int channel) {
        return (row * width + column) * 3 + channel;
    }
}
