package buaa.search.crawler;

import buaa.search.config.SearchEngineProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 基于 jsoup 连接的页面抓取，非 2xx 状态抛出 HttpStatusException
 */
@Component
public class JsoupPageFetcher implements PageFetcher {

    private final SearchEngineProperties.Crawler settings;

    public JsoupPageFetcher(SearchEngineProperties properties) {
        this.settings = properties.getCrawler();
    }

    @Override
    public Document fetch(String url) throws IOException {
        return Jsoup.connect(url)
            .userAgent(settings.getUserAgent())
            .timeout((int) settings.getFetchTimeout().toMillis())
            .followRedirects(true)
            .get();
    }
}
