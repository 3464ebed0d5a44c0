package github.sarthakdev143.hdr_studio.model.raster;

import java.util.Arrays;

/**
 * Immutable 8-bit-per-channel RGB raster, interleaved R,G,B in row-major order. No alpha.
 * Samples are unsigned and lie in [0, 255].
 */
public final class RasterBuffer8 {

    public static final int CHANNELS = 3;
    public static final int MAX_VALUE = 255;

    private final int height;
    private final int width;
    private final byte[] samples;

    private RasterBuffer8(int height, int width, byte[] samples) {
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    public static RasterBuffer8 of(int height, int width, int[] samples) {
        RasterDimensions.check(height, width, samples == null ? -1 : samples.length);
        byte[] copy = new byte[samples.length];
        for (int index = 0; index < samples.length; index++) {
            int value = samples[index];
            if (value < 0 || value > MAX_VALUE) {
                throw new IllegalArgumentException(
                        "8-bit sample at index " + index + " must be between 0 and " + MAX_VALUE + ", was " + value + ".");
            }
            copy[index] = (byte) value;
        }
        return new RasterBuffer8(height, width, copy);
    }

    public static RasterBuffer8 filled(int height, int width, int red, int green, int blue) {
        int[] samples = new int[height * width * CHANNELS];
        for (int index = 0; index < samples.length; index += CHANNELS) {
            samples[index] = red;
            samples[index + 1] = green;
            samples[index + 2] = blue;
        }
        return of(height, width, samples);
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
        return samples[offset] & 0xFF;
    }

    public int[] toSamples() {
        int[] copy = new int[samples.length];
        for (int index = 0; index < samples.length; index++) {
            copy[index] = samples[index] & 0xFF;
        }
        return copy;
    }

    public boolean sameDimensions(RasterBuffer16 other) {
        return other != null && height == other.height() && width == other.width();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RasterBuffer8 that)) {
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
        return "RasterBuffer8[" + height + "x" + width + "x" + CHANNELS + "]";
    }
}
