package github.sarthakdev143.hdr_studio.integration.imageio;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

public final class RasterImages {

    private RasterImages() {
    }

    public static RasterBuffer8 fromBufferedImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] samples = new int[width * height * RasterBuffer8.CHANNELS];

        if (image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            // Band 0 is the gray level; getRGB would push it through a linear-to-sRGB conversion.
            Raster raster = image.getRaster();
            int bits = image.getColorModel().getComponentSize(0);
            int[] gray = raster.getSamples(0, 0, width, height, 0, (int[]) null);
            for (int pixel = 0; pixel < gray.length; pixel++) {
                int value = toEightBit(gray[pixel], bits);
                int offset = pixel * RasterBuffer8.CHANNELS;
                samples[offset] = value;
                samples[offset + 1] = value;
                samples[offset + 2] = value;
            }
            return RasterBuffer8.of(height, width, samples);
        }

        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        for (int pixel = 0; pixel < argb.length; pixel++) {
            int offset = pixel * RasterBuffer8.CHANNELS;
            samples[offset] = (argb[pixel] >> 16) & 0xFF;
            samples[offset + 1] = (argb[pixel] >> 8) & 0xFF;
            samples[offset + 2] = argb[pixel] & 0xFF;
        }
        return RasterBuffer8.of(height, width, samples);
    }

    private static int toEightBit(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        if (bits == 16) {
            return (sample + 128) / 257;
        }
        int max = (1 << bits) - 1;
        return (int) Math.round(sample * (double) RasterBuffer8.MAX_VALUE / max);
    }

    public static BufferedImage toBufferedImage(RasterBuffer8 buffer) {
        BufferedImage image = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_INT_RGB);
        int[] rgb = new int[buffer.pixelCount()];
        for (int pixel = 0; pixel < rgb.length; pixel++) {
            int offset = pixel * RasterBuffer8.CHANNELS;
            rgb[pixel] = (buffer.sampleAt(offset) << 16)
                    | (buffer.sampleAt(offset + 1) << 8)
                    | buffer.sampleAt(offset + 2);
        }
        image.setRGB(0, 0, buffer.width(), buffer.height(), rgb, 0, buffer.width());
        return image;
    }

    public static BufferedImage toBufferedImage(RasterBuffer16 buffer) {
        ComponentColorModel colorModel = new ComponentColorModel(
                ColorSpace.getInstance(ColorSpace.CS_sRGB),
                new int[]{16, 16, 16},
                false,
                false,
                Transparency.OPAQUE,
                DataBuffer.TYPE_USHORT);
        WritableRaster raster = colorModel.createCompatibleWritableRaster(buffer.width(), buffer.height());
        raster.setPixels(0, 0, buffer.width(), buffer.height(), buffer.toSamples());
        return new BufferedImage(colorModel, raster, false, null);
    }
}
