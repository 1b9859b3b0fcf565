package buaa.search.embedding;

import java.util.List;

/**
 * 音频与文本联合空间向量化
 */
public interface AudioEmbedder {

    /**
     * 编码单声道波形，采样率须为 {@link #samplingRate()}
     */
    List<float[]> embedAudio(List<float[]> waveforms);

    /**
     * 将文本编码到音频向量空间，用于以文搜音
     */
    List<float[]> embedTextsInAudioSpace(List<String> texts);

    /**
     * 模型要求的输入采样率
     */
    int samplingRate();
}
