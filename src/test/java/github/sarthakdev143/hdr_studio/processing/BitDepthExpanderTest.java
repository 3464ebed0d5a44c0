package github.sarthakdev143.hdr_studio.processing;

import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer16;
import github.sarthakdev143.hdr_studio.model.raster.RasterBuffer8;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitDepthExpanderTest {

    private final BitDepthExpander expander = new BitDepthExpander();

    @Test
    void expandMultipliesEveryValueBy257() {
        int[] samples = new int[256 * 3];
        for (int value = 0; value < 256; value++) {
            samples[value * 3] = value;
            samples[value * 3 + 1] = value;
            samples[value * 3 + 2] = value;
        }

        RasterBuffer16 expanded = expander.expand(RasterBuffer8.of(1, 256, samples));

        for (int value = 0; value < 256; value++) {
            assertThat(expanded.sample(0, value, 0)).isEqualTo(value * 257);
            assertThat(expanded.sample(0, value, 1)).isEqualTo(value * 257);
            assertThat(expanded.sample(0, value, 2)).isEqualTo(value * 257);
        }
        assertThat(expanded.sample(0, 0, 0)).isZero();
        assertThat(expanded.sample(0, 255, 0)).isEqualTo(65535);
    }

    @Test
    void expandMidGrayTo32896() {
        RasterBuffer16 expanded = expander.expand(RasterBuffer8.filled(2, 2, 128, 128, 128));

        assertThat(expanded.height()).isEqualTo(2);
        assertThat(expanded.width()).isEqualTo(2);
        assertThat(expanded.toSamples()).containsOnly(32896);
    }

    @Test
    void expandLeavesSourceUntouched() {
        RasterBuffer8 source = RasterBuffer8.filled(1, 2, 10, 20, 30);

        expander.expand(source);

        assertThat(source).isEqualTo(RasterBuffer8.filled(1, 2, 10, 20, 30));
    }

    @Test
    void expandRejectsMissingSource() {
        assertThatThrownBy(() -> expander.expand(null))
                .isInstanceOf(NullPointerException.class);
    }
}
