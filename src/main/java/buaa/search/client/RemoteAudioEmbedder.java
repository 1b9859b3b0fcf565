package buaa.search.client;

import buaa.search.config.SearchEngineProperties;
import buaa.search.embedding.AudioEmbedder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 远程音频与文本联合空间向量化（CLAP 类模型）
 * 波形以浮点数组传输，并附带采样率
 */
@Component
public class RemoteAudioEmbedder implements AudioEmbedder {

    private final EmbeddingApiClient apiClient;
    private final SearchEngineProperties.AudioModel model;

    public RemoteAudioEmbedder(EmbeddingApiClient apiClient, SearchEngineProperties properties) {
        this.apiClient = apiClient;
        this.model = properties.getModels().getAudio();
    }

    @Override
    public List<float[]> embedAudio(List<float[]> waveforms) {
        return apiClient.encode(model.getName(), "audio", waveforms, model.getBatchSize(),
            Map.of("sampling_rate", model.getSamplingRate()));
    }

    @Override
    public List<float[]> embedTextsInAudioSpace(List<String> texts) {
        return apiClient.encode(model.getName(), "text-audio", texts, model.getBatchSize(), null);
    }

    @Override
    public int samplingRate() {
        return model.getSamplingRate();
    }
}
