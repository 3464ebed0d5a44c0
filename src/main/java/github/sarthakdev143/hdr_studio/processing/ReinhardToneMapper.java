package github.sarthakdev143.hdr_studio.processing;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Global Reinhard tone mapping from the 16-bit working range to an 8-bit display raster.
 *
 * <p>The operator normalizes the input to [0, 1], derives a map key from the log-luminance
 * distribution, compresses every channel with {@code c / (adapt + c)} where {@code adapt} blends
 * per-pixel and mean luminance, renormalizes and applies the display gamma. There is no spatial
 * (local) adaptation, so the result only depends on pixel values and global statistics.
 */
@Component
public class ReinhardToneMapper {

    static final double GAMMA = 2.2;
    static final double INTENSITY = 0.0;
    static final double LIGHT_ADAPTATION = 0.8;
    static final double COLOR_ADAPTATION = 0.0;

    private static final double LOG_FLOOR = 1e-4;
    private static final double EPSILON = 1e-12;
    // Key used when the log-luminance range is empty (flat images).
    private static final double FLAT_IMAGE_KEY = 0.5;
    private static final int CHANNELS = RasterBuffer16.CHANNELS;

    public RasterBuffer8 toneMap(RasterBuffer16 source) {
        Objects.requireNonNull(source, "source raster is required");
        int pixelCount = source.pixelCount();
        double[] image = new double[pixelCount * CHANNELS];
        for (int offset = 0; offset < image.length; offset++) {
            image[offset] = source.sampleAt(offset) / (double) RasterBuffer16.MAX_VALUE;
        }

        normalize(image, 1.0);

        double[] gray = new double[pixelCount];
        double logSum = 0.0;
        double logMin = Double.POSITIVE_INFINITY;
        double logMax = Double.NEGATIVE_INFINITY;
        double graySum = 0.0;
        double[] channelSums = new double[CHANNELS];
        for (int pixel = 0; pixel < pixelCount; pixel++) {
            int offset = pixel * CHANNELS;
            double luminance = GradingEngine.LUMA_RED * image[offset]
                    + GradingEngine.LUMA_GREEN * image[offset + 1]
                    + GradingEngine.LUMA_BLUE * image[offset + 2];
            gray[pixel] = luminance;
            graySum += luminance;
            for (int channel = 0; channel < CHANNELS; channel++) {
                channelSums[channel] += image[offset + channel];
            }

            double logLuminance = Math.log(Math.max(luminance, LOG_FLOOR));
            logSum += logLuminance;
            logMin = Math.min(logMin, logLuminance);
            logMax = Math.max(logMax, logLuminance);
        }

        double logMean = logSum / pixelCount;
        double logRange = logMax - logMin;
        double key = logRange > EPSILON ? (logMax - logMean) / logRange : FLAT_IMAGE_KEY;
        double mapKey = 0.3 + 0.7 * Math.pow(key, 1.4);
        double intensityScale = Math.exp(-INTENSITY);
        double grayMean = graySum / pixelCount;

        for (int channel = 0; channel < CHANNELS; channel++) {
            double channelMean = channelSums[channel] / pixelCount;
            double global = COLOR_ADAPTATION * channelMean + (1.0 - COLOR_ADAPTATION) * grayMean;
            for (int pixel = 0; pixel < pixelCount; pixel++) {
                int offset = pixel * CHANNELS + channel;
                double value = image[offset];
                double adapt = COLOR_ADAPTATION * value + (1.0 - COLOR_ADAPTATION) * gray[pixel];
                adapt = LIGHT_ADAPTATION * adapt + (1.0 - LIGHT_ADAPTATION) * global;
                adapt = Math.pow(intensityScale * adapt, mapKey);
                double denominator = adapt + value;
                image[offset] = denominator > EPSILON ? value / denominator : 0.0;
            }
        }

        normalize(image, GAMMA);

        int[] samples = new int[image.length];
        for (int offset = 0; offset < image.length; offset++) {
            double clipped = Math.min(1.0, Math.max(0.0, image[offset]));
            samples[offset] = (int) Math.round(clipped * RasterBuffer8.MAX_VALUE);
        }
        return RasterBuffer8.of(source.height(), source.width(), samples);
    }

    private void normalize(double[] image, double gamma) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : image) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        double range = max - min;
        boolean stretch = range > EPSILON;
        double exponent = 1.0 / gamma;
        for (int offset = 0; offset < image.length; offset++) {
            double value = stretch ? (image[offset] - min) / range : image[offset];
            image[offset] = Math.pow(value, exponent);
        }
    }
}
