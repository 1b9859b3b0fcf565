package buaa.search.client;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.config.SearchEngineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 向量化模型服务客户端
 *
 * <p>请求 POST {url}/embeddings，body 为 {model, input, input_type, encoding_format}，
 * 响应 {data: [{embedding: [...]}, ...]}，顺序与输入一致。</p>
 */
@Component
public class EmbeddingApiClient {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingApiClient.class);

    private final WebClient httpClient;
    private final ObjectMapper jsonParser;
    private final SearchEngineProperties.Embedding settings;

    public EmbeddingApiClient(@Qualifier("embeddingWebClient") WebClient embeddingWebClient,
                              ObjectMapper objectMapper,
                              SearchEngineProperties properties) {
        this.httpClient = embeddingWebClient;
        this.jsonParser = objectMapper;
        this.settings = properties.getEmbedding();
    }

    /**
     * 分批编码
     *
     * @param model 模型名称
     * @param inputType 输入类型（text/image/audio/text-image/text-audio）
     * @param inputs 已序列化的输入
     * @param batchSize 批大小
     * @param extraParams 附加请求参数
     * @return 与输入一一对应的向量
     */
    public List<float[]> encode(String model,
                                String inputType,
                                List<?> inputs,
                                int batchSize,
                                Map<String, Object> extraParams) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        log.debug("启动向量编码任务，类型: {}, 输入总数: {}", inputType, inputs.size());

        List<float[]> allVectors = new ArrayList<>(inputs.size());
        List<List<?>> batches = partitionIntoBatches(inputs, Math.max(1, batchSize));
        for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
            List<?> currentBatch = batches.get(batchIndex);
            log.debug("处理第 {}/{} 批，大小: {}", batchIndex + 1, batches.size(), currentBatch.size());

            String apiResponse = invokeEncodingApi(buildRequestBody(model, inputType, currentBatch, extraParams));
            List<float[]> batchVectors = extractVectorsFromResponse(apiResponse);
            if (batchVectors.size() != currentBatch.size()) {
                throw new ServiceException(
                    String.format("向量数量与输入不一致，期望 %d，实际 %d", currentBatch.size(), batchVectors.size()),
                    SearchErrorCode.EMBEDDING_SERVICE_ERROR);
            }
            allVectors.addAll(batchVectors);
        }
        return allVectors;
    }

    private List<List<?>> partitionIntoBatches(List<?> inputs, int batchSize) {
        List<List<?>> batches = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i += batchSize) {
            int endIndex = Math.min(i + batchSize, inputs.size());
            batches.add(inputs.subList(i, endIndex));
        }
        return batches;
    }

    private Map<String, Object> buildRequestBody(String model,
                                                 String inputType,
                                                 List<?> batch,
                                                 Map<String, Object> extraParams) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", batch);
        body.put("input_type", inputType);
        body.put("encoding_format", "float");
        if (extraParams != null) {
            body.putAll(extraParams);
        }
        return body;
    }

    /**
     * 调用编码API，网络错误与 HTTP 错误按固定间隔重试
     */
    private String invokeEncodingApi(Map<String, Object> requestBody) {
        try {
            return httpClient.post()
                .uri("/embeddings")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetryPolicy())
                .block(settings.getTimeout());
        } catch (RuntimeException e) {
            throw new ServiceException("向量化接口调用失败: " + e.getMessage(), e, SearchErrorCode.EMBEDDING_API_ERROR);
        }
    }

    private Retry createRetryPolicy() {
        return Retry.fixedDelay(settings.getMaxRetries(), settings.getRetryBackoff())
            .filter(error -> error instanceof WebClientResponseException
                || error instanceof WebClientRequestException);
    }

    private List<float[]> extractVectorsFromResponse(String response) {
        JsonNode dataArray;
        try {
            JsonNode responseJson = jsonParser.readTree(response == null ? "" : response);
            dataArray = responseJson == null ? null : responseJson.get("data");
        } catch (Exception e) {
            throw new ServiceException("API响应无法解析", e, SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        if (dataArray == null || !dataArray.isArray()) {
            throw new ServiceException("API响应格式异常: 缺少data数组", SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }

        List<float[]> vectors = new ArrayList<>();
        for (JsonNode item : dataArray) {
            JsonNode embeddingNode = item.get("embedding");
            if (embeddingNode != null && embeddingNode.isArray()) {
                vectors.add(parseVector(embeddingNode));
            }
        }
        return vectors;
    }

    private float[] parseVector(JsonNode embeddingNode) {
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < embeddingNode.size(); i++) {
            vector[i] = (float) embeddingNode.get(i).asDouble();
        }
        return vector;
    }
}
