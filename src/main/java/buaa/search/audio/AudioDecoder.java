package buaa.search.audio;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * 音频解码
 *
 * <p>通过 javax.sound 已安装的解码器读取（WAV/AIFF/AU 内置，MP3 由 mp3spi 提供），
 * 统一转换为 16 位有符号 PCM，多声道取平均混为单声道，归一化到 [-1, 1] 后线性重采样到目标采样率。</p>
 */
@Component
public class AudioDecoder {

    private static final Logger log = LoggerFactory.getLogger(AudioDecoder.class);
    private static final int BYTES_PER_SAMPLE = 2;

    private final Tika tika = new Tika();

    /**
     * 解码为目标采样率的单声道波形
     *
     * @param data 音频文件内容
     * @param targetSampleRate 目标采样率
     * @return 单声道波形
     */
    public float[] decode(byte[] data, int targetSampleRate) {
        if (data == null || data.length == 0) {
            throw new ClientException("音频内容为空", SearchErrorCode.AUDIO_DECODE_FAILED);
        }
        String mediaType = tika.detect(data);
        if (!mediaType.startsWith("audio/")) {
            throw new ClientException("不是音频文件: " + mediaType, SearchErrorCode.AUDIO_DECODE_FAILED);
        }

        try (AudioInputStream source = AudioSystem.getAudioInputStream(
                new BufferedInputStream(new ByteArrayInputStream(data)))) {
            AudioFormat sourceFormat = source.getFormat();
            float sourceRate = sourceFormat.getSampleRate();
            int channels = Math.max(1, sourceFormat.getChannels());
            if (sourceRate <= 0) {
                throw new ClientException("无法确定音频采样率", SearchErrorCode.AUDIO_DECODE_FAILED);
            }

            AudioFormat pcmFormat = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED,
                sourceRate, 16, channels, channels * BYTES_PER_SAMPLE, sourceRate, false);
            try (AudioInputStream pcm = AudioSystem.getAudioInputStream(pcmFormat, source)) {
                float[] mono = toMono(pcm.readAllBytes(), channels);
                float[] waveform = resample(mono, Math.round(sourceRate), targetSampleRate);
                log.debug("音频解码完成: {} -> {} 采样 @ {}Hz", mediaType, waveform.length, targetSampleRate);
                return waveform;
            }
        } catch (UnsupportedAudioFileException | IllegalArgumentException e) {
            throw new ClientException("不支持的音频格式: " + mediaType, e, SearchErrorCode.AUDIO_DECODE_FAILED);
        } catch (IOException e) {
            throw new ClientException("音频读取失败", e, SearchErrorCode.AUDIO_DECODE_FAILED);
        }
    }

    private float[] toMono(byte[] pcmBytes, int channels) {
        int frameSize = channels * BYTES_PER_SAMPLE;
        int frames = pcmBytes.length / frameSize;
        float[] mono = new float[frames];
        for (int frame = 0; frame < frames; frame++) {
            float sum = 0f;
            int base = frame * frameSize;
            for (int channel = 0; channel < channels; channel++) {
                int index = base + channel * BYTES_PER_SAMPLE;
                short sample = (short) ((pcmBytes[index + 1] << 8) | (pcmBytes[index] & 0xff));
                sum += sample / 32768f;
            }
            mono[frame] = sum / channels;
        }
        return mono;
    }

    /**
     * 线性插值重采样
     */
    static float[] resample(float[] input, int sourceRate, int targetRate) {
        if (sourceRate == targetRate || input.length == 0) {
            return input;
        }
        int outputLength = (int) Math.ceil((double) input.length * targetRate / sourceRate);
        float[] output = new float[outputLength];
        double step = (double) sourceRate / targetRate;
        for (int i = 0; i < outputLength; i++) {
            double position = i * step;
            int left = (int) position;
            if (left >= input.length - 1) {
                output[i] = input[input.length - 1];
                continue;
            }
            double fraction = position - left;
            output[i] = (float) (input[left] * (1 - fraction) + input[left + 1] * fraction);
        }
        return output;
    }
}
