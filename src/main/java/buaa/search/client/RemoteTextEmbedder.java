package buaa.search.client;

import buaa.search.config.SearchEngineProperties;
import buaa.search.embedding.TextEmbedder;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 远程文本向量化（句向量模型）
 */
@Component
public class RemoteTextEmbedder implements TextEmbedder {

    private final EmbeddingApiClient apiClient;
    private final SearchEngineProperties.Model model;

    public RemoteTextEmbedder(EmbeddingApiClient apiClient, SearchEngineProperties properties) {
        this.apiClient = apiClient;
        this.model = properties.getModels().getText();
    }

    @Override
    public List<float[]> embedTexts(List<String> texts) {
        return apiClient.encode(model.getName(), "text", texts, model.getBatchSize(), null);
    }
}
