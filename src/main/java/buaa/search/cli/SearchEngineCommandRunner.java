package buaa.search.cli;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.crawler.CrawlReport;
import buaa.search.model.Modality;
import buaa.search.service.CrawlService;
import buaa.search.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 命令行入口
 *
 * <p>第一个非选项参数为命令时执行：</p>
 * <pre>
 * crawl &lt;seedUrl&gt; [--limit=10] [--delay=1.0]
 * index --type=text|image|audio --source-url=&lt;url&gt; [--content=..] [--path=..] [--asset-url=..] [--alt-text=..]
 * </pre>
 * 没有命令时不做任何事，应用照常提供 HTTP 服务。
 */
@Component
@Order(1)
public class SearchEngineCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SearchEngineCommandRunner.class);

    private final CrawlService crawlService;
    private final IngestionService ingestionService;

    public SearchEngineCommandRunner(CrawlService crawlService, IngestionService ingestionService) {
        this.crawlService = crawlService;
        this.ingestionService = ingestionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            return;
        }
        switch (commands.get(0)) {
            case "crawl":
                runCrawl(args, commands);
                break;
            case "index":
                runIndex(args);
                break;
            default:
                log.debug("忽略未知命令: {}", commands.get(0));
        }
    }

    private void runCrawl(ApplicationArguments args, List<String> commands) {
        if (commands.size() < 2) {
            throw new ClientException("用法: crawl <seedUrl> [--limit=10] [--delay=1.0]", SearchErrorCode.PARAM_EMPTY);
        }
        Integer limit = intOption(args, "limit");
        Double delay = doubleOption(args, "delay");

        CrawlReport report = crawlService.crawl(commands.get(1), limit, delay);
        log.info("爬取完成: {}, 访问 {} 个页面 (失败 {}), 投递文本 {} / 图片 {} / 音频 {} 个任务",
            report.getSeedUrl(), report.getVisitedCount(), report.getFailedUrls().size(),
            report.getDispatchedTextTasks(), report.getDispatchedImageTasks(), report.getDispatchedAudioTasks());
    }

    private void runIndex(ApplicationArguments args) {
        Modality type = Modality.fromValue(requiredOption(args, "type"));
        String sourceUrl = requiredOption(args, "source-url");

        switch (type) {
            case TEXT:
                ingestionService.ingestText(requiredOption(args, "content"), sourceUrl);
                log.info("文本已索引: {}", sourceUrl);
                break;
            case IMAGE:
                ingestionService.indexImage(readFile(requiredOption(args, "path")),
                    requiredOption(args, "asset-url"), sourceUrl, option(args, "alt-text"));
                break;
            case AUDIO:
                int chunks = ingestionService.indexAudio(readFile(requiredOption(args, "path")),
                    requiredOption(args, "asset-url"), sourceUrl);
                log.info("音频已索引: {} 个分块", chunks);
                break;
            default:
                throw new ClientException(SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED);
        }
    }

    private byte[] readFile(String path) {
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException e) {
            throw new ClientException("无法读取文件: " + path, SearchErrorCode.PARAM_INVALID);
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String requiredOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null || value.isBlank()) {
            throw new ClientException("缺少参数 --" + name, SearchErrorCode.PARAM_EMPTY);
        }
        return value;
    }

    private static Integer intOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ClientException("参数 --" + name + " 必须为整数", SearchErrorCode.PARAM_INVALID);
        }
    }

    private static Double doubleOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ClientException("参数 --" + name + " 必须为数字", SearchErrorCode.PARAM_INVALID);
        }
    }
}
