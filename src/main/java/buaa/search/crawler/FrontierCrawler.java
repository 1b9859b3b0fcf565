package buaa.search.crawler;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.service.IngestionDispatcher;
import buaa.search.service.IngestionTask;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * 广度优先站内爬虫
 *
 * <p>单线程顺序抓取，仅访问与起始页同源的页面。visited 集合保证同一地址在一次爬取中最多抓取一次，
 * 页面预算按 visited 数量计算。抽取到的内容逐条投递给摄取队列后立即返回，不等待索引完成。</p>
 */
@Component
public class FrontierCrawler {

    private static final Logger log = LoggerFactory.getLogger(FrontierCrawler.class);

    private final PageFetcher pageFetcher;
    private final FragmentExtractor fragmentExtractor;
    private final IngestionDispatcher dispatcher;

    public FrontierCrawler(PageFetcher pageFetcher,
                           FragmentExtractor fragmentExtractor,
                           IngestionDispatcher dispatcher) {
        this.pageFetcher = pageFetcher;
        this.fragmentExtractor = fragmentExtractor;
        this.dispatcher = dispatcher;
    }

    /**
     * 执行一次爬取
     *
     * @param seedUrl 起始地址
     * @param limit 最多访问的页面数
     * @param delay 两次抓取之间的间隔
     * @return 爬取统计
     */
    public CrawlReport crawl(String seedUrl, int limit, Duration delay) {
        String seed = validateSeed(seedUrl);
        if (limit < 1) {
            throw new ClientException("页面数量上限必须为正数", SearchErrorCode.PARAM_INVALID);
        }
        if (delay == null || delay.isNegative()) {
            throw new ClientException("抓取间隔不能为负数", SearchErrorCode.PARAM_INVALID);
        }

        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(seed);
        Set<String> visited = new HashSet<>();
        CrawlReport report = new CrawlReport(seed);

        log.info("开始爬取: {}, 页面上限: {}, 间隔: {}ms", seed, limit, delay.toMillis());

        while (!frontier.isEmpty() && visited.size() < limit) {
            String currentUrl = frontier.poll();
            if (!visited.add(currentUrl)) {
                continue;
            }
            report.getVisitedUrls().add(currentUrl);
            log.info("抓取页面: {} ({}/{})", currentUrl, visited.size(), limit);

            Document document;
            try {
                document = pageFetcher.fetch(currentUrl);
            } catch (IOException e) {
                log.warn("页面抓取失败，跳过: {} - {}", currentUrl, e.getMessage());
                report.getFailedUrls().add(currentUrl);
                continue;
            }

            PageFragments fragments = fragmentExtractor.extract(document, currentUrl);
            dispatch(currentUrl, fragments, report);

            for (String link : fragments.getLinks()) {
                if (!visited.contains(link)) {
                    frontier.add(link);
                }
            }

            if (!pause(delay)) {
                log.warn("爬取被中断: {}", seed);
                break;
            }
        }

        log.info("爬取结束: {}, 访问 {} 个页面, 失败 {} 个, 投递 {} 个任务",
            seed, report.getVisitedCount(), report.getFailedUrls().size(), report.getDispatchedTasks());
        return report;
    }

    private void dispatch(String pageUrl, PageFragments fragments, CrawlReport report) {
        if (fragments.isEmpty()) {
            log.debug("页面没有可索引的内容: {}", pageUrl);
            return;
        }
        for (String text : fragments.getTexts()) {
            dispatcher.submit(IngestionTask.text(text, pageUrl));
            report.setDispatchedTextTasks(report.getDispatchedTextTasks() + 1);
        }
        for (ImageAsset image : fragments.getImages()) {
            dispatcher.submit(IngestionTask.image(image, pageUrl));
            report.setDispatchedImageTasks(report.getDispatchedImageTasks() + 1);
        }
        for (AudioAsset audio : fragments.getAudios()) {
            dispatcher.submit(IngestionTask.audio(audio, pageUrl));
            report.setDispatchedAudioTasks(report.getDispatchedAudioTasks() + 1);
        }
        log.info("已投递 {} 个文本任务, {} 个媒体任务: {}",
            fragments.getTexts().size(), fragments.getImages().size() + fragments.getAudios().size(), pageUrl);
    }

    /**
     * @return false 表示线程被中断
     */
    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String validateSeed(String seedUrl) {
        if (seedUrl == null || seedUrl.isBlank()) {
            throw new ClientException(SearchErrorCode.SEED_URL_INVALID);
        }
        return UrlResolver.resolve(seedUrl.trim(), seedUrl.trim())
            .filter(UrlResolver::isHttp)
            .orElseThrow(() -> new ClientException(SearchErrorCode.SEED_URL_INVALID));
    }
}
