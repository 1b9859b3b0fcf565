package buaa.search.repository;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.model.FeatureRecord;
import buaa.search.model.Modality;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 特征存储模板
 * 所有写入路径在访问存储之前统一校验向量维度、补齐标识与时间戳
 *
 * @param <R> 记录类型
 */
public abstract class AbstractFeatureStore<R extends FeatureRecord> implements FeatureStore<R> {

    private final Modality modality;
    private final int dimension;

    protected AbstractFeatureStore(Modality modality, int dimension) {
        this.modality = modality;
        this.dimension = dimension;
    }

    @Override
    public Modality modality() {
        return modality;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void insert(R record) {
        validate(record);
        LocalDateTime now = LocalDateTime.now();
        record.setId(UUID.randomUUID().toString());
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        doInsert(record);
    }

    @Override
    public void upsert(R record) {
        validate(record);
        String uniqueKey = record.getUniqueKey();
        if (uniqueKey == null || record.getAssetUrl() == null || record.getAssetUrl().isBlank()) {
            throw new ClientException("upsert 需要资源地址", SearchErrorCode.PARAM_EMPTY);
        }
        LocalDateTime now = LocalDateTime.now();
        record.setId(documentIdOf(uniqueKey));
        record.setUpdatedAt(now);
        doUpsert(record, now);
    }

    @Override
    public List<R> nearest(float[] queryVector, int k) {
        checkDimension(queryVector);
        if (k <= 0) {
            return List.of();
        }
        return doNearest(queryVector, k);
    }

    /**
     * 去重键对应的确定性文档ID
     */
    public static String documentIdOf(String uniqueKey) {
        return DigestUtils.sha256Hex(uniqueKey);
    }

    protected abstract void doInsert(R record);

    /**
     * 原子地插入或覆盖；插入时以 createdAt 作为创建时间，覆盖时保留原创建时间
     */
    protected abstract void doUpsert(R record, LocalDateTime createdAt);

    protected abstract List<R> doNearest(float[] queryVector, int k);

    private void validate(R record) {
        if (record == null) {
            throw new ClientException("记录不能为空", SearchErrorCode.PARAM_EMPTY);
        }
        if (record.getModality() != modality) {
            throw new ClientException(
                String.format("记录模态 %s 与存储模态 %s 不一致", record.getModality(), modality),
                SearchErrorCode.PARAM_INVALID);
        }
        if (record.getSourcePageUrl() == null || record.getSourcePageUrl().isBlank()) {
            throw new ClientException("来源页面地址不能为空", SearchErrorCode.PARAM_EMPTY);
        }
        checkDimension(record.getEmbedding());
    }

    private void checkDimension(float[] vector) {
        int actual = vector == null ? 0 : vector.length;
        if (actual != dimension) {
            throw new ClientException(
                String.format("%s 向量维度错误，期望 %d，实际 %d", modality, dimension, actual),
                SearchErrorCode.EMBEDDING_DIMENSION_MISMATCH);
        }
    }
}
