package buaa.search.config;

import buaa.search.model.Modality;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 搜索引擎配置
 */
@Component
@ConfigurationProperties(prefix = "search")
@Data
public class SearchEngineProperties {

    private Crawler crawler = new Crawler();
    private Ingestion ingestion = new Ingestion();
    private Models models = new Models();
    private Retrieval retrieval = new Retrieval();
    private Store store = new Store();
    private Embedding embedding = new Embedding();

    @Data
    public static class Crawler {
        private Duration fetchTimeout = Duration.ofSeconds(5);
        private String userAgent = "Mozilla/5.0 (compatible; MultimodalSearchBot/1.0)";
        private int defaultLimit = 10;
        private double defaultDelaySeconds = 1.0;
        private List<String> imageExtensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png"));
        private List<String> audioExtensions = new ArrayList<>(List.of(".wav", ".mp3"));
        private List<String> ignoredTextTags = new ArrayList<>(List.of("script", "style", "head", "title", "meta"));
    }

    @Data
    public static class Ingestion {
        private int maxAttempts = 4;
        private Duration retryDelay = Duration.ofSeconds(60);
        private Duration downloadTimeout = Duration.ofSeconds(30);
        private int maxAssetBytes = 64 * 1024 * 1024;
        private boolean skipSilentChunks = true;
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 1000;
    }

    @Data
    public static class Models {
        private Model text = new Model("all-MiniLM-L6-v2", 384, 32);
        private Model image = new Model("openai/clip-vit-base-patch32", 512, 16);
        private AudioModel audio = new AudioModel();

        /**
         * 按模态获取向量维度
         */
        public int dimensionOf(Modality modality) {
            switch (modality) {
                case TEXT:
                    return text.getDimension();
                case IMAGE:
                    return image.getDimension();
                case AUDIO:
                    return audio.getDimension();
                default:
                    throw new IllegalArgumentException("未知模态: " + modality);
            }
        }
    }

    @Data
    public static class Model {
        private String name;
        private int dimension;
        private int batchSize;

        public Model() {
        }

        public Model(String name, int dimension, int batchSize) {
            this.name = name;
            this.dimension = dimension;
            this.batchSize = batchSize;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class AudioModel extends Model {
        /** 模型要求的采样率 */
        private int samplingRate = 48000;
        /** 单个分块的时长（秒） */
        private int inputLenSeconds = 10;

        public AudioModel() {
            super("laion/clap-htsat-unfused", 512, 8);
        }
    }

    @Data
    public static class Retrieval {
        private int defaultLimit = 10;
        private int maxLimit = 50;
        private int maxQueryLength = 200;
    }

    @Data
    public static class Store {
        private String textIndex = "text_features";
        private String imageIndex = "image_features";
        private String audioIndex = "audio_features";
        /** kNN 候选集下限 */
        private int numCandidates = 100;
        private boolean createIndices = true;
    }

    @Data
    public static class Embedding {
        private String url = "http://localhost:8001/v1";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
        private Duration retryBackoff = Duration.ofSeconds(1);
    }
}
