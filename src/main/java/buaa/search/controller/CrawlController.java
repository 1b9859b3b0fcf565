package buaa.search.controller;

import buaa.search.common.convention.result.Result;
import buaa.search.common.convention.result.Results;
import buaa.search.dto.CrawlRequest;
import buaa.search.dto.CrawlResponse;
import buaa.search.dto.IngestionTaskView;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.service.CrawlService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 爬取与摄取任务接口
 */
@RestController
@RequestMapping("/api")
public class CrawlController {

    private final CrawlService crawlService;

    public CrawlController(CrawlService crawlService) {
        this.crawlService = crawlService;
    }

    /**
     * 后台启动一次爬取
     * POST /api/crawl {"seedUrl": "...", "limit": 10, "delay": 1.0}
     */
    @PostMapping("/crawl")
    public Result<CrawlResponse> startCrawl(@Valid @RequestBody CrawlRequest request) {
        return Results.success(crawlService.startCrawl(
            request.getSeedUrl(), request.getLimit(), request.getDelay()));
    }

    /**
     * 按状态查询摄取任务
     * GET /api/ingestion/tasks?status=FAILED
     */
    @GetMapping("/ingestion/tasks")
    public Result<List<IngestionTaskView>> listTasks(
            @RequestParam(defaultValue = "FAILED") IngestionTaskStatus status) {
        return Results.success(crawlService.listTasks(status));
    }
}
