package github.sarthakdev143.hdr_studio.processing;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class BitDepthExpander {

    static final int SCALE = RasterBuffer16.MAX_VALUE / RasterBuffer8.MAX_VALUE;

    public RasterBuffer16 expand(RasterBuffer8 source) {
        Objects.requireNonNull(source, "source raster is required");
        int[] samples = source.toSamples();
        for (int index = 0; index < samples.length; index++) {
            samples[index] = samples[index] * SCALE;
        }
        return RasterBuffer16.of(source.height(), source.width(), samples);
    }
}
