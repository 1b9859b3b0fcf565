package buaa.search.crawler;

import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * 页面抓取
 */
public interface PageFetcher {

    /**
     * 抓取并解析页面
     *
     * @param url 页面地址
     * @return 已解析的页面
     * @throws IOException 网络错误、HTTP 错误状态或超时
     */
    Document fetch(String url) throws IOException;
}
