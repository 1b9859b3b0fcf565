package buaa.search.service;

import buaa.search.config.SearchEngineProperties;
import buaa.search.model.IngestionTaskRecord;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.repository.IngestionTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * 摄取任务队列
 *
 * <p>任务提交后写入台账并交给工作线程池执行；失败时按 {@link RetryPolicy} 经调度器延迟重新入队，
 * 重试耗尽后在台账中标记为 FAILED。重试逻辑与具体业务无关，统一作用于所有任务。</p>
 */
@Service
public class IngestionTaskQueue implements IngestionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(IngestionTaskQueue.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final Executor workers;
    private final TaskScheduler retryScheduler;
    private final IngestionTaskRepository taskRepository;
    private final IngestionTaskHandler handler;
    private final RetryPolicy retryPolicy;

    @Autowired
    public IngestionTaskQueue(@Qualifier("ingestionExecutor") Executor workers,
                              @Qualifier("ingestionRetryScheduler") TaskScheduler retryScheduler,
                              IngestionTaskRepository taskRepository,
                              IngestionTaskHandler handler,
                              SearchEngineProperties properties) {
        this(workers, retryScheduler, taskRepository, handler, new RetryPolicy(
            properties.getIngestion().getMaxAttempts(),
            properties.getIngestion().getRetryDelay()));
    }

    public IngestionTaskQueue(Executor workers,
                              TaskScheduler retryScheduler,
                              IngestionTaskRepository taskRepository,
                              IngestionTaskHandler handler,
                              RetryPolicy retryPolicy) {
        this.workers = workers;
        this.retryScheduler = retryScheduler;
        this.taskRepository = taskRepository;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void submit(IngestionTask task) {
        recordSubmitted(task);
        enqueue(task, 1);
    }

    private void enqueue(IngestionTask task, int attempt) {
        try {
            workers.execute(() -> runAttempt(task, attempt));
        } catch (RejectedExecutionException e) {
            log.error("摄取队列已满，任务被拒绝: {} ({})", task.getTaskId(), describe(task));
            updateLedger(task, record -> {
                record.setStatus(IngestionTaskStatus.FAILED);
                record.setLastError(truncate("队列已满: " + e.getMessage()));
            });
        }
    }

    /**
     * 执行一次尝试
     */
    void runAttempt(IngestionTask task, int attempt) {
        updateLedger(task, record -> {
            record.setStatus(IngestionTaskStatus.RUNNING);
            record.setAttempts(attempt);
        });

        try {
            handler.execute(task);
        } catch (Exception e) {
            handleFailure(task, attempt, e);
            return;
        }

        updateLedger(task, record -> {
            record.setStatus(IngestionTaskStatus.SUCCEEDED);
            record.setLastError(null);
        });
        log.info("摄取任务完成: {} ({}), 第 {} 次尝试", task.getTaskId(), describe(task), attempt);
    }

    private void handleFailure(IngestionTask task, int attempt, Exception error) {
        String message = truncate(error.getClass().getSimpleName() + ": " + error.getMessage());

        if (!retryPolicy.canRetry(attempt)) {
            log.error("摄取任务重试耗尽: {} ({}), 共 {} 次尝试",
                task.getTaskId(), describe(task), attempt, error);
            updateLedger(task, record -> {
                record.setStatus(IngestionTaskStatus.FAILED);
                record.setLastError(message);
            });
            return;
        }

        log.warn("摄取任务失败，{}ms 后重试: {} ({}), 第 {}/{} 次尝试 - {}",
            retryPolicy.getDelay().toMillis(), task.getTaskId(), describe(task),
            attempt, retryPolicy.getMaxAttempts(), message);
        updateLedger(task, record -> {
            record.setStatus(IngestionTaskStatus.RETRYING);
            record.setLastError(message);
        });
        try {
            retryScheduler.schedule(() -> enqueue(task, attempt + 1),
                Instant.now().plus(retryPolicy.getDelay()));
        } catch (RejectedExecutionException e) {
            log.error("重试调度被拒绝，任务终止: {} ({})", task.getTaskId(), describe(task));
            updateLedger(task, record -> {
                record.setStatus(IngestionTaskStatus.FAILED);
                record.setLastError(truncate("重试调度被拒绝: " + e.getMessage() + "; " + message));
            });
        }
    }

    private void recordSubmitted(IngestionTask task) {
        try {
            IngestionTaskRecord record = new IngestionTaskRecord();
            record.setTaskId(task.getTaskId());
            record.setTaskType(task.getType());
            record.setIdempotencyKey(task.getIdempotencyKey());
            record.setSourcePageUrl(truncate(task.getSourcePageUrl()));
            record.setAssetUrl(truncate(task.getAssetUrl()));
            record.setStatus(IngestionTaskStatus.PENDING);
            record.setAttempts(0);
            taskRepository.save(record);
        } catch (RuntimeException e) {
            log.warn("任务台账写入失败: {} - {}", task.getTaskId(), e.getMessage());
        }
    }

    /**
     * 台账更新失败只记录日志，不影响任务本身
     */
    private void updateLedger(IngestionTask task, Consumer<IngestionTaskRecord> change) {
        try {
            taskRepository.findById(task.getTaskId()).ifPresent(record -> {
                change.accept(record);
                taskRepository.save(record);
            });
        } catch (RuntimeException e) {
            log.warn("任务台账更新失败: {} - {}", task.getTaskId(), e.getMessage());
        }
    }

    private String describe(IngestionTask task) {
        return task.getAssetUrl() != null
            ? task.getType() + " " + task.getAssetUrl()
            : task.getType() + " @ " + task.getSourcePageUrl();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
