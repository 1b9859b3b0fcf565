package buaa.search.config;

import buaa.search.model.AudioFeature;
import buaa.search.model.ImageFeature;
import buaa.search.model.Modality;
import buaa.search.model.TextFeature;
import buaa.search.repository.ElasticsearchFeatureStore;
import buaa.search.repository.FeatureStore;
import buaa.search.repository.FeatureStores;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;

/**
 * 三种模态的特征存储，各自对应一个 ES 索引
 */
@Configuration
public class FeatureStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(FeatureStoreConfig.class);

    @Bean
    public ElasticsearchFeatureStore<TextFeature> textFeatureStore(ElasticsearchClient esClient,
                                                                   ObjectMapper objectMapper,
                                                                   SearchEngineProperties properties) {
        return new ElasticsearchFeatureStore<>(esClient, objectMapper, Modality.TEXT,
            properties.getModels().dimensionOf(Modality.TEXT),
            properties.getStore().getTextIndex(), TextFeature.class,
            properties.getStore().getNumCandidates());
    }

    @Bean
    public ElasticsearchFeatureStore<ImageFeature> imageFeatureStore(ElasticsearchClient esClient,
                                                                     ObjectMapper objectMapper,
                                                                     SearchEngineProperties properties) {
        return new ElasticsearchFeatureStore<>(esClient, objectMapper, Modality.IMAGE,
            properties.getModels().dimensionOf(Modality.IMAGE),
            properties.getStore().getImageIndex(), ImageFeature.class,
            properties.getStore().getNumCandidates());
    }

    @Bean
    public ElasticsearchFeatureStore<AudioFeature> audioFeatureStore(ElasticsearchClient esClient,
                                                                     ObjectMapper objectMapper,
                                                                     SearchEngineProperties properties) {
        return new ElasticsearchFeatureStore<>(esClient, objectMapper, Modality.AUDIO,
            properties.getModels().dimensionOf(Modality.AUDIO),
            properties.getStore().getAudioIndex(), AudioFeature.class,
            properties.getStore().getNumCandidates());
    }

    /**
     * 启动时创建缺失的索引，先于命令行任务执行
     */
    @Bean
    @Order(0)
    public ApplicationRunner featureIndexInitializer(List<ElasticsearchFeatureStore<?>> stores,
                                                     SearchEngineProperties properties) {
        return args -> {
            if (!properties.getStore().isCreateIndices()) {
                log.info("已关闭索引自动创建");
                return;
            }
            for (ElasticsearchFeatureStore<?> store : stores) {
                store.ensureIndex();
            }
        };
    }

    /**
     * 按接口类型暴露，供业务层注入
     */
    @Bean
    public FeatureStores featureStores(ElasticsearchFeatureStore<TextFeature> textFeatureStore,
                                       ElasticsearchFeatureStore<ImageFeature> imageFeatureStore,
                                       ElasticsearchFeatureStore<AudioFeature> audioFeatureStore) {
        FeatureStore<TextFeature> text = textFeatureStore;
        FeatureStore<ImageFeature> image = imageFeatureStore;
        FeatureStore<AudioFeature> audio = audioFeatureStore;
        return new FeatureStores(text, image, audio);
    }
}
