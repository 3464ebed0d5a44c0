package github.sarthakdev143.hdr_studio.model.raster;

import java.util.Arrays;

/**
 * Immutable 16-bit-per-channel RGB raster, interleaved R,G,B in row-major order.
 * Samples are unsigned and lie in [0, 65535].
 */
public final class RasterBuffer16 {

    public static final int CHANNELS = 3;
    public static final int MAX_VALUE = 65535;

    private final int height;
    private final int width;
    private final short[] samples;

    private RasterBuffer16(int height, int width, short[] samples) {
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    public static RasterBuffer16 of(int height, int width, int[] samples) {
        RasterDimensions.check(height, width, samples == null ? -1 : samples.length);
        short[] copy = new short[samples.length];
        for (int index = 0; index < samples.length; index++) {
            int value = samples[index];
            if (value < 0 || value > MAX_VALUE) {
                throw new IllegalArgumentException(
                        "16-bit sample at index " + index + " must be between 0 and " + MAX_VALUE + ", was " + value + ".");
            }
            copy[index] = (short) value;
        }
        return new RasterBuffer16(height, width, copy);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int pixelCount() {
        return height * width;
    }

    public int sample(int row, int column, int channel) {
        return sampleAt(RasterDimensions.offset(width, row, column, channel));
    }

    public int sampleAt(int offset) {
        return samples[offset] & 0xFFFF;
    }

    public int[] toSamples() {
        int[] copy = new int[samples.length];
        for (int index = 0; index < samples.length; index++) {
            copy[index] = samples[index] & 0xFFFF;
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RasterBuffer16 that)) {
            return false;
        }
        return height == that.height && width == that.width && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "RasterBuffer16[" + height + "x" + width + "x" + CHANNELS + "]";
    }
}
