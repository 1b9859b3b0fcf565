package buaa.search.repository;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.model.FeatureRecord;
import buaa.search.model.Modality;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 基于 Elasticsearch dense_vector 的特征存储
 *
 * <p>每个模态一个索引，向量字段使用 l2_norm 相似度，kNN 得分越高距离越小。
 * upsert 使用确定性文档ID的单条 update 请求（doc + upsert），在 ES 中对单文档是原子的。</p>
 */
public class ElasticsearchFeatureStore<R extends FeatureRecord> extends AbstractFeatureStore<R> {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchFeatureStore.class);
    static final String VECTOR_FIELD = "embedding";
    private static final String CREATED_AT_FIELD = "createdAt";
    private static final String INDEX_NOT_FOUND = "index_not_found_exception";

    private final ElasticsearchClient esClient;
    private final ObjectMapper objectMapper;
    private final String indexName;
    private final Class<R> recordType;
    private final int minCandidates;

    public ElasticsearchFeatureStore(ElasticsearchClient esClient,
                                     ObjectMapper objectMapper,
                                     Modality modality,
                                     int dimension,
                                     String indexName,
                                     Class<R> recordType,
                                     int minCandidates) {
        super(modality, dimension);
        this.esClient = esClient;
        this.objectMapper = objectMapper;
        this.indexName = indexName;
        this.recordType = recordType;
        this.minCandidates = minCandidates;
    }

    /**
     * 索引不存在时按配置维度创建
     */
    public void ensureIndex() {
        try {
            boolean exists = esClient.indices().exists(ExistsRequest.of(e -> e.index(indexName))).value();
            if (exists) {
                log.info("索引已存在: {}", indexName);
                return;
            }
            esClient.indices().create(CreateIndexRequest.of(c -> c
                .index(indexName)
                .mappings(m -> m
                    .properties(VECTOR_FIELD, p -> p.denseVector(d -> d
                        .dims(dimension())
                        .index(true)
                        .similarity("l2_norm")))
                    .properties("assetUrl", p -> p.keyword(k -> k))
                    .properties("sourcePageUrl", p -> p.keyword(k -> k))
                    .properties(CREATED_AT_FIELD, p -> p.date(d -> d))
                    .properties("updatedAt", p -> p.date(d -> d))
                )
            ));
            log.info("索引创建完成: {}, 维度: {}", indexName, dimension());
        } catch (IOException e) {
            throw new ServiceException("创建索引失败: " + indexName, e, SearchErrorCode.ELASTICSEARCH_ERROR);
        }
    }

    @Override
    protected void doInsert(R record) {
        try {
            esClient.index(IndexRequest.of(i -> i
                .index(indexName)
                .id(record.getId())
                .document(record)
            ));
            log.debug("写入 {} 记录: {}", modality(), record.getId());
        } catch (IOException e) {
            throw new ServiceException("写入索引失败: " + indexName, e, SearchErrorCode.ELASTICSEARCH_ERROR);
        }
    }

    @Override
    protected void doUpsert(R record, LocalDateTime createdAt) {
        // doc 不带 createdAt，已有文档保留原创建时间；upsert 文档仅在首次写入时生效
        Map<String, Object> partial = objectMapper.convertValue(record, new TypeReference<Map<String, Object>>() { });
        partial.remove(CREATED_AT_FIELD);
        record.setCreatedAt(createdAt);

        UpdateRequest<R, Map<String, Object>> request = UpdateRequest.of(u -> u
            .index(indexName)
            .id(record.getId())
            .doc(partial)
            .upsert(record)
            .retryOnConflict(3)
        );
        try {
            esClient.update(request, recordType);
            log.debug("更新 {} 记录: {} ({})", modality(), record.getId(), record.getUniqueKey());
        } catch (IOException e) {
            throw new ServiceException("更新索引失败: " + indexName, e, SearchErrorCode.ELASTICSEARCH_ERROR);
        }
    }

    @Override
    protected List<R> doNearest(float[] queryVector, int k) {
        List<Float> vector = toFloatList(queryVector);
        int candidates = Math.max(k, minCandidates);
        try {
            SearchRequest request = SearchRequest.of(s -> s
                .index(indexName)
                .knn(knn -> knn
                    .field(VECTOR_FIELD)
                    .queryVector(vector)
                    .k(k)
                    .numCandidates(candidates)
                )
                .size(k));
            SearchResponse<R> response = esClient.search(request, recordType);

            return response.hits().hits().stream()
                .map(Hit::source)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        } catch (Exception e) {
            if (isIndexMissing(e)) {
                log.warn("索引 {} 不存在，返回空结果", indexName);
                return Collections.emptyList();
            }
            throw new ServiceException("向量检索失败: " + indexName, e, SearchErrorCode.SEARCH_SERVICE_ERROR);
        }
    }

    private List<Float> toFloatList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float v : vector) {
            values.add(v);
        }
        return values;
    }

    private boolean isIndexMissing(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof ElasticsearchException
            && INDEX_NOT_FOUND.equals(((ElasticsearchException) error).error().type())) {
            return true;
        }
        String message = error.getMessage();
        if (message != null) {
            String lowered = message.toLowerCase(Locale.ROOT);
            if (lowered.contains("index_not_found")) {
                return true;
            }
        }
        return isIndexMissing(error.getCause());
    }
}
