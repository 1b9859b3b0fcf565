package buaa.search.service;

import buaa.search.audio.AudioDecoder;
import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.dto.AudioResult;
import buaa.search.dto.ImageResult;
import buaa.search.dto.SearchResultItem;
import buaa.search.dto.TextResult;
import buaa.search.embedding.AudioEmbedder;
import buaa.search.embedding.ImageEmbedder;
import buaa.search.embedding.TextEmbedder;
import buaa.search.media.ImageDecoder;
import buaa.search.model.Modality;
import buaa.search.repository.FeatureStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 跨模态检索服务
 *
 * <p>将查询（文本或文件）编码到目标模态的向量空间，在对应存储中做 kNN 检索，
 * 结果按 L2 距离升序返回。只读，不修改任何存储。</p>
 */
@Service
public class CrossModalRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(CrossModalRetrievalService.class);

    private final TextEmbedder textEmbedder;
    private final ImageEmbedder imageEmbedder;
    private final AudioEmbedder audioEmbedder;
    private final FeatureStores stores;
    private final ImageDecoder imageDecoder;
    private final AudioDecoder audioDecoder;
    private final SearchEngineProperties.Retrieval retrieval;

    public CrossModalRetrievalService(TextEmbedder textEmbedder,
                                      ImageEmbedder imageEmbedder,
                                      AudioEmbedder audioEmbedder,
                                      FeatureStores stores,
                                      ImageDecoder imageDecoder,
                                      AudioDecoder audioDecoder,
                                      SearchEngineProperties properties) {
        this.textEmbedder = textEmbedder;
        this.imageEmbedder = imageEmbedder;
        this.audioEmbedder = audioEmbedder;
        this.stores = stores;
        this.imageDecoder = imageDecoder;
        this.audioDecoder = audioDecoder;
        this.retrieval = properties.getRetrieval();
    }

    /**
     * 以文本检索任意模态
     *
     * @param query 查询文本
     * @param modality 目标模态
     * @param limit 返回数量
     * @return 按距离升序的结果
     */
    public List<SearchResultItem> searchByText(String query, Modality modality, int limit) {
        if (query == null || query.isBlank()) {
            throw new ClientException(SearchErrorCode.QUERY_EMPTY);
        }
        if (query.length() > retrieval.getMaxQueryLength()) {
            throw new ClientException("查询内容不能超过" + retrieval.getMaxQueryLength() + "个字符",
                SearchErrorCode.PARAM_INVALID);
        }
        validateLimit(limit);

        List<String> queries = List.of(query);
        float[] vector;
        switch (modality) {
            case TEXT:
                vector = single(textEmbedder.embedTexts(queries));
                break;
            case IMAGE:
                vector = single(imageEmbedder.embedTextsInImageSpace(queries));
                break;
            case AUDIO:
                vector = single(audioEmbedder.embedTextsInAudioSpace(queries));
                break;
            default:
                throw new ClientException(SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED);
        }

        List<SearchResultItem> results = nearest(modality, vector, limit);
        log.info("文本检索完成: type={}, limit={}, 命中 {}", modality, limit, results.size());
        return results;
    }

    /**
     * 以图搜图或以音搜音
     *
     * @param data 上传的文件内容
     * @param modality IMAGE 或 AUDIO
     * @param limit 返回数量
     */
    public List<SearchResultItem> searchByFile(byte[] data, Modality modality, int limit) {
        if (modality != Modality.IMAGE && modality != Modality.AUDIO) {
            throw new ClientException("文件检索仅支持 image 与 audio", SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED);
        }
        validateLimit(limit);

        float[] vector;
        if (modality == Modality.IMAGE) {
            BufferedImage image = imageDecoder.decode(data);
            vector = single(imageEmbedder.embedImages(List.of(image)));
        } else {
            float[] waveform = audioDecoder.decode(data, audioEmbedder.samplingRate());
            vector = single(audioEmbedder.embedAudio(List.of(waveform)));
        }

        List<SearchResultItem> results = nearest(modality, vector, limit);
        log.info("文件检索完成: type={}, limit={}, 命中 {}", modality, limit, results.size());
        return results;
    }

    private List<SearchResultItem> nearest(Modality modality, float[] vector, int limit) {
        switch (modality) {
            case TEXT:
                return stores.text().nearest(vector, limit).stream()
                    .map(TextResult::from)
                    .collect(Collectors.toList());
            case IMAGE:
                return stores.image().nearest(vector, limit).stream()
                    .map(ImageResult::from)
                    .collect(Collectors.toList());
            case AUDIO:
                return stores.audio().nearest(vector, limit).stream()
                    .map(AudioResult::from)
                    .collect(Collectors.toList());
            default:
                throw new ClientException(SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED);
        }
    }

    private void validateLimit(int limit) {
        if (limit < 1 || limit > retrieval.getMaxLimit()) {
            throw new ClientException("返回数量须在 1 到 " + retrieval.getMaxLimit() + " 之间",
                SearchErrorCode.LIMIT_OUT_OF_RANGE);
        }
    }

    private float[] single(List<float[]> vectors) {
        if (vectors == null || vectors.size() != 1 || vectors.get(0) == null) {
            throw new ServiceException("查询向量化失败", SearchErrorCode.SEARCH_SERVICE_ERROR);
        }
        return vectors.get(0);
    }
}
