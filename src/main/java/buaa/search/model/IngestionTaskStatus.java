package buaa.search.model;

/**
 * 摄取任务状态
 */
public enum IngestionTaskStatus {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED
}
