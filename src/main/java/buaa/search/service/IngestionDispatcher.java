package buaa.search.service;

/**
 * 摄取任务投递入口
 * 提交即返回，不等待任务执行
 */
public interface IngestionDispatcher {

    /**
     * 投递任务
     *
     * @param task 摄取任务
     */
    void submit(IngestionTask task);
}
