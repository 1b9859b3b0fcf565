package buaa.search.audio;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.support.TestMedia;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AudioDecoderTest {

    private final AudioDecoder decoder = new AudioDecoder();

    @Test
    void stereoWavIsMixedToMonoAndResampled() {
        byte[] wav = TestMedia.wav(TestMedia.tone(2, 8000, 0, 0), 8000, 2);

        float[] waveform = decoder.decode(wav, 4000);

        assertThat(waveform).hasSize(8000);
        assertThat(waveform[100]).isCloseTo(0.5f, within(0.001f));
    }

    @Test
    void upsamplingUsesCeilingLength() {
        float[] resampled = AudioDecoder.resample(new float[]{0f, 1f, 0f}, 2, 3);

        assertThat(resampled).hasSize(5);
        assertThat(resampled[0]).isZero();
        assertThat(resampled[1]).isCloseTo(0.6667f, within(0.001f));
    }

    @Test
    void sameRateIsUnchanged() {
        float[] input = {0.1f, 0.2f};

        assertThat(AudioDecoder.resample(input, 100, 100)).isSameAs(input);
    }

    @Test
    void nonAudioBytesAreRejected() {
        assertThatThrownBy(() -> decoder.decode("<html></html>".getBytes(), 48000))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode")
            .isEqualTo(SearchErrorCode.AUDIO_DECODE_FAILED.code());
        assertThatThrownBy(() -> decoder.decode(new byte[0], 48000))
            .isInstanceOf(ClientException.class);
    }
}
