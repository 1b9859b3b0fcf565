package buaa.search.service;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.crawler.CrawlReport;
import buaa.search.crawler.FrontierCrawler;
import buaa.search.crawler.UrlResolver;
import buaa.search.dto.CrawlResponse;
import buaa.search.dto.IngestionTaskView;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.repository.IngestionTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 爬取触发与任务台账查询
 */
@Service
public class CrawlService {

    private static final Logger log = LoggerFactory.getLogger(CrawlService.class);
    private static final int MAX_TASK_PAGE = 100;

    private final FrontierCrawler crawler;
    private final Executor crawlExecutor;
    private final IngestionTaskRepository taskRepository;
    private final SearchEngineProperties.Crawler crawlerProperties;

    public CrawlService(FrontierCrawler crawler,
                        @Qualifier("crawlExecutor") Executor crawlExecutor,
                        IngestionTaskRepository taskRepository,
                        SearchEngineProperties properties) {
        this.crawler = crawler;
        this.crawlExecutor = crawlExecutor;
        this.taskRepository = taskRepository;
        this.crawlerProperties = properties.getCrawler();
    }

    /**
     * 同步爬取，在调用线程中执行
     */
    public CrawlReport crawl(String seedUrl, Integer limit, Double delaySeconds) {
        int pages = limit != null ? limit : crawlerProperties.getDefaultLimit();
        return crawler.crawl(seedUrl, pages, toDuration(delaySeconds));
    }

    /**
     * 后台爬取，参数校验通过后立即返回
     *
     * @return 实际采用的参数
     */
    public CrawlResponse startCrawl(String seedUrl, Integer limit, Double delaySeconds) {
        int pages = limit != null ? limit : crawlerProperties.getDefaultLimit();
        double seconds = delaySeconds != null ? delaySeconds : crawlerProperties.getDefaultDelaySeconds();
        if (pages < 1) {
            throw new ClientException("页面数量上限必须为正数", SearchErrorCode.PARAM_INVALID);
        }
        Duration delay = toDuration(seconds);
        String seed = UrlResolver.resolve(seedUrl, seedUrl)
            .filter(UrlResolver::isHttp)
            .orElseThrow(() -> new ClientException(SearchErrorCode.SEED_URL_INVALID));

        try {
            crawlExecutor.execute(() -> {
                try {
                    CrawlReport report = crawler.crawl(seed, pages, delay);
                    log.info("后台爬取完成: {}, 访问 {} 个页面, 投递 {} 个任务",
                        seed, report.getVisitedCount(), report.getDispatchedTasks());
                } catch (RuntimeException e) {
                    log.error("后台爬取失败: {}", seed, e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new ClientException("爬取任务过多，请稍后重试", SearchErrorCode.CLIENT_ERROR);
        }
        return new CrawlResponse(seed, pages, seconds);
    }

    /**
     * 按状态列出摄取任务，最近更新的在前
     */
    public List<IngestionTaskView> listTasks(IngestionTaskStatus status) {
        return taskRepository.findByStatusOrderByUpdatedAtDesc(status, PageRequest.of(0, MAX_TASK_PAGE))
            .stream()
            .map(IngestionTaskView::from)
            .collect(Collectors.toList());
    }

    private Duration toDuration(Double delaySeconds) {
        double seconds = delaySeconds != null ? delaySeconds : crawlerProperties.getDefaultDelaySeconds();
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new ClientException("抓取间隔不能为负数", SearchErrorCode.PARAM_INVALID);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
