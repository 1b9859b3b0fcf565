package buaa.search.service;

/**
 * 摄取任务的执行逻辑，由队列运行时调用
 * 抛出任何异常都视为本次尝试失败
 */
public interface IngestionTaskHandler {

    void execute(IngestionTask task);
}
