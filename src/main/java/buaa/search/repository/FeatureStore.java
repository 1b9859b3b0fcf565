package buaa.search.repository;

import buaa.search.model.FeatureRecord;
import buaa.search.model.Modality;

import java.util.List;

/**
 * 单一模态的特征存储
 *
 * <p>实现必须保证 {@link #upsert} 以记录的去重键原子地插入或覆盖，
 * 并发写入同一资源时不会产生重复记录。</p>
 *
 * @param <R> 记录类型
 */
public interface FeatureStore<R extends FeatureRecord> {

    Modality modality();

    /**
     * 该模态配置的向量维度
     */
    int dimension();

    /**
     * 直接插入新记录，不做去重
     */
    void insert(R record);

    /**
     * 按 {@link FeatureRecord#getUniqueKey()} 插入或覆盖记录，已存在时保留 createdAt
     */
    void upsert(R record);

    /**
     * 按 L2 距离升序返回最近的 k 条记录
     *
     * @param queryVector 查询向量
     * @param k 返回数量
     */
    List<R> nearest(float[] queryVector, int k);
}
