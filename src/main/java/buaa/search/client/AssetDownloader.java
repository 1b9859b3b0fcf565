package buaa.search.client;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.config.SearchEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * 页面资源下载
 * 超时与大小上限由配置决定，失败一律抛出 {@link ServiceException}，由摄取队列重试
 */
@Component
public class AssetDownloader {

    private static final Logger log = LoggerFactory.getLogger(AssetDownloader.class);

    private final WebClient httpClient;
    private final Duration timeout;

    public AssetDownloader(@Qualifier("assetWebClient") WebClient assetWebClient,
                           SearchEngineProperties properties) {
        this.httpClient = assetWebClient;
        this.timeout = properties.getIngestion().getDownloadTimeout();
    }

    /**
     * 下载资源内容
     *
     * @param assetUrl 资源地址
     * @return 资源字节
     */
    public byte[] download(String assetUrl) {
        log.debug("下载资源: {}", assetUrl);
        byte[] body;
        try {
            body = httpClient.get()
                .uri(URI.create(assetUrl))
                .retrieve()
                .bodyToMono(byte[].class)
                .block(timeout);
        } catch (RuntimeException e) {
            throw new ServiceException("资源下载失败: " + assetUrl, e, SearchErrorCode.ASSET_DOWNLOAD_FAILED);
        }
        if (body == null || body.length == 0) {
            throw new ServiceException("资源内容为空: " + assetUrl, SearchErrorCode.ASSET_DOWNLOAD_FAILED);
        }
        return body;
    }
}
