package buaa.search.repository;

import buaa.search.model.FeatureRecord;
import buaa.search.model.Modality;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存版特征存储，按文档ID保存，线性扫描求 L2 最近邻
 */
public class InMemoryFeatureStore<R extends FeatureRecord> extends AbstractFeatureStore<R> {

    private final Map<String, R> documents = new LinkedHashMap<>();

    public InMemoryFeatureStore(Modality modality, int dimension) {
        super(modality, dimension);
    }

    @Override
    protected synchronized void doInsert(R record) {
        documents.put(record.getId(), record);
    }

    @Override
    protected synchronized void doUpsert(R record, LocalDateTime createdAt) {
        R existing = documents.get(record.getId());
        record.setCreatedAt(existing != null ? existing.getCreatedAt() : createdAt);
        documents.put(record.getId(), record);
    }

    @Override
    protected synchronized List<R> doNearest(float[] queryVector, int k) {
        return documents.values().stream()
            .sorted(Comparator.comparingDouble(record -> distance(queryVector, record.getEmbedding())))
            .limit(k)
            .collect(Collectors.toList());
    }

    public synchronized List<R> all() {
        return new ArrayList<>(documents.values());
    }

    public synchronized int size() {
        return documents.size();
    }

    static double distance(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
