package buaa.search.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * HTTP客户端配置
 * embeddingWebClient 调用向量化模型服务，assetWebClient 下载页面中的图片与音频
 */
@Configuration
public class HttpClientConfiguration {

    /**
     * 创建用于向量编码的WebClient
     * 配置了大内存缓冲区以支持批量图片与波形请求
     */
    @Bean
    public WebClient embeddingWebClient(SearchEngineProperties properties) {
        SearchEngineProperties.Embedding embedding = properties.getEmbedding();
        WebClient.Builder builder = WebClient.builder()
            .baseUrl(embedding.getUrl())
            .clientConnector(connectorOf(embedding.getTimeout()))
            .exchangeStrategies(bufferOf(64 * 1024 * 1024))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (embedding.getApiKey() != null && !embedding.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embedding.getApiKey());
        }
        return builder.build();
    }

    /**
     * 创建用于资源下载的WebClient
     * 缓冲区上限即单个资源的大小上限，跟随 3xx 跳转
     */
    @Bean
    public WebClient assetWebClient(SearchEngineProperties properties) {
        return WebClient.builder()
            .clientConnector(connectorOf(properties.getIngestion().getDownloadTimeout()))
            .exchangeStrategies(bufferOf(properties.getIngestion().getMaxAssetBytes()))
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getCrawler().getUserAgent())
            .build();
    }

    private ReactorClientHttpConnector connectorOf(Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .responseTimeout(responseTimeout);
        return new ReactorClientHttpConnector(httpClient);
    }

    private ExchangeStrategies bufferOf(int maxBytes) {
        return ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(maxBytes))
            .build();
    }
}
