package github.sarthakdev143.hdr_studio.model.raster;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterBufferTest {

    @Test
    void eightBitBufferCopiesSamplesAndIndexesInterleaved() {
        int[] samples = {1, 2, 3, 4, 5, 6, 7, 8, 9, 250, 251, 255};

        RasterBuffer8 buffer = RasterBuffer8.of(2, 2, samples);
        samples[0] = 99;

        assertThat(buffer.sample(0, 0, 0)).isEqualTo(1);
        assertThat(buffer.sample(0, 1, 2)).isEqualTo(6);
        assertThat(buffer.sample(1, 1, 2)).isEqualTo(255);
        assertThat(buffer.pixelCount()).isEqualTo(4);
        buffer.toSamples()[1] = 42;
        assertThat(buffer.sample(0, 0, 1)).isEqualTo(2);
    }

    @Test
    void eightBitBufferRejectsOutOfRangeSamples() {
        assertThatThrownBy(() -> RasterBuffer8.of(1, 1, new int[]{0, 256, 0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");
        assertThatThrownBy(() -> RasterBuffer8.of(1, 1, new int[]{-1, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sixteenBitBufferHoldsFullUnsignedRange() {
        RasterBuffer16 buffer = RasterBuffer16.of(1, 1, new int[]{0, 32768, 65535});

        assertThat(buffer.toSamples()).containsExactly(0, 32768, 65535);
        assertThatThrownBy(() -> RasterBuffer16.of(1, 1, new int[]{0, 65536, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buffersRejectMismatchedDimensions() {
        assertThatThrownBy(() -> RasterBuffer8.of(2, 2, new int[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs 12 samples");
        assertThatThrownBy(() -> RasterBuffer16.of(0, 4, new int[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> RasterBuffer8.of(1, 1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityIsByDimensionsAndContent() {
        assertThat(RasterBuffer8.filled(2, 3, 10, 20, 30)).isEqualTo(RasterBuffer8.filled(2, 3, 10, 20, 30));
        assertThat(RasterBuffer8.filled(2, 3, 10, 20, 30)).isNotEqualTo(RasterBuffer8.filled(3, 2, 10, 20, 30));
        assertThat(RasterBuffer8.filled(2, 3, 0, 0, 0).sameDimensions(RasterBuffer16.of(2, 3, new int[18]))).isTrue();
    }
}
