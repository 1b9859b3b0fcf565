package buaa.search.crawler;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单次爬取的统计结果
 */
@Data
public class CrawlReport {

    private final String seedUrl;

    /** 按访问顺序记录的页面 */
    private final List<String> visitedUrls = new ArrayList<>();

    private final List<String> failedUrls = new ArrayList<>();

    private int dispatchedTextTasks;

    private int dispatchedImageTasks;

    private int dispatchedAudioTasks;

    public int getVisitedCount() {
        return visitedUrls.size();
    }

    public int getDispatchedTasks() {
        return dispatchedTextTasks + dispatchedImageTasks + dispatchedAudioTasks;
    }
}
