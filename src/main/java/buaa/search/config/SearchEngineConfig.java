package buaa.search.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch 向量存储配置
 */
@Configuration
public class SearchEngineConfig {

    @Value("${elasticsearch.host:localhost}")
    private String esHost;

    @Value("${elasticsearch.port:9200}")
    private int esPort;

    @Value("${elasticsearch.scheme:http}")
    private String protocol;

    @Value("${elasticsearch.username:}")
    private String userName;

    @Value("${elasticsearch.password:}")
    private String userPassword;

    /**
     * 构建Elasticsearch客户端实例
     * 复用 Spring 的 ObjectMapper，保证时间字段按 ISO 格式读写
     *
     * @return ES客户端
     */
    @Bean
    public ElasticsearchClient elasticsearchClient(ObjectMapper objectMapper) {
        RestClientBuilder clientBuilder = RestClient.builder(
            new HttpHost(esHost, esPort, protocol)
        );

        if (isAuthenticationRequired()) {
            configureAuthentication(clientBuilder);
        }

        RestClientTransport transport = new RestClientTransport(
            clientBuilder.build(),
            new JacksonJsonpMapper(objectMapper)
        );
        return new ElasticsearchClient(transport);
    }

    private boolean isAuthenticationRequired() {
        return userName != null && !userName.trim().isEmpty();
    }

    /**
     * 配置身份认证
     */
    private void configureAuthentication(RestClientBuilder builder) {
        BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        credentialsProvider.setCredentials(
            AuthScope.ANY,
            new UsernamePasswordCredentials(userName, userPassword)
        );

        builder.setHttpClientConfigCallback(httpClientBuilder ->
            httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
    }
}
