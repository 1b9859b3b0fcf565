package buaa.search.audio;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 音频定长分块
 *
 * <p>将波形按 {@code durationSeconds * sampleRate} 个采样切分，末块不足时右侧补零。
 * 第 i 块覆盖 [i*d, (i+1)*d) 秒，块数为 ceil(len / L)。</p>
 */
public class AudioChunker {

    private final int durationSeconds;
    private final int sampleRate;
    private final int samplesPerChunk;

    public AudioChunker(int durationSeconds, int sampleRate) {
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException("分块时长必须为正数: " + durationSeconds);
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("采样率必须为正数: " + sampleRate);
        }
        this.durationSeconds = durationSeconds;
        this.sampleRate = sampleRate;
        this.samplesPerChunk = Math.multiplyExact(durationSeconds, sampleRate);
    }

    /**
     * 惰性切分，每次调用 iterator() 都从头开始
     *
     * @param waveform 单声道波形，采样率须与构造参数一致
     * @return 分块序列
     */
    public Iterable<AudioChunk> chunk(float[] waveform) {
        float[] source = waveform == null ? new float[0] : waveform;
        return () -> new ChunkIterator(source);
    }

    /**
     * 给定采样数时的分块数量
     */
    public int chunkCount(int sampleCount) {
        return (int) ((sampleCount + (long) samplesPerChunk - 1) / samplesPerChunk);
    }

    private final class ChunkIterator implements Iterator<AudioChunk> {

        private final float[] waveform;
        private int offset;

        private ChunkIterator(float[] waveform) {
            this.waveform = waveform;
        }

        @Override
        public boolean hasNext() {
            return offset < waveform.length;
        }

        @Override
        public AudioChunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int end = Math.min(offset + samplesPerChunk, waveform.length);
            // copyOfRange 越界部分补 0
            float[] samples = Arrays.copyOfRange(waveform, offset, offset + samplesPerChunk);
            if (end - offset < samplesPerChunk) {
                Arrays.fill(samples, end - offset, samplesPerChunk, 0f);
            }
            int startSeconds = offset / sampleRate;
            AudioChunk chunk = new AudioChunk(samples, startSeconds, startSeconds + durationSeconds);
            offset += samplesPerChunk;
            return chunk;
        }
    }
}
