package buaa.search.service;

import buaa.search.crawler.ImageAsset;
import buaa.search.model.IngestionTaskRecord;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.model.Modality;
import buaa.search.repository.IngestionTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IngestionTaskQueueTest {

    @Mock private TaskScheduler retryScheduler;
    @Mock private IngestionTaskRepository taskRepository;
    @Mock private IngestionTaskHandler handler;

    private final Map<String, IngestionTaskRecord> ledger = new HashMap<>();
    private final Executor directExecutor = Runnable::run;

    @BeforeEach
    void setUp() {
        lenient().when(taskRepository.save(any(IngestionTaskRecord.class))).thenAnswer(invocation -> {
            IngestionTaskRecord record = invocation.getArgument(0);
            ledger.put(record.getTaskId(), record);
            return record;
        });
        lenient().when(taskRepository.findById(anyString()))
            .thenAnswer(invocation -> Optional.ofNullable(ledger.get(invocation.<String>getArgument(0))));
    }

    private IngestionTaskQueue queue(int maxAttempts) {
        return new IngestionTaskQueue(directExecutor, retryScheduler, taskRepository, handler,
            new RetryPolicy(maxAttempts, Duration.ofSeconds(60)));
    }

    private Runnable capturedRetry(int expectedSchedules) {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(retryScheduler, times(expectedSchedules)).schedule(captor.capture(), any(Instant.class));
        return captor.getValue();
    }

    @Test
    void successfulTaskIsMarkedSucceeded() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");

        queue(4).submit(task);

        IngestionTaskRecord record = ledger.get(task.getTaskId());
        assertThat(record.getStatus()).isEqualTo(IngestionTaskStatus.SUCCEEDED);
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.getTaskType()).isEqualTo(Modality.TEXT);
        assertThat(record.getIdempotencyKey()).isEqualTo(task.getIdempotencyKey());
        verify(retryScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void failedAttemptIsRetriedUntilSuccess() {
        IngestionTask task = IngestionTask.image(new ImageAsset("http://site.example.com/a.png", "a"),
            "http://site.example.com/");
        doThrow(new IllegalStateException("timeout")).doNothing().when(handler).execute(task);

        IngestionTaskQueue queue = queue(4);
        queue.submit(task);

        IngestionTaskRecord record = ledger.get(task.getTaskId());
        assertThat(record.getStatus()).isEqualTo(IngestionTaskStatus.RETRYING);
        assertThat(record.getLastError()).contains("timeout");

        capturedRetry(1).run();

        assertThat(record.getStatus()).isEqualTo(IngestionTaskStatus.SUCCEEDED);
        assertThat(record.getAttempts()).isEqualTo(2);
        assertThat(record.getLastError()).isNull();
        verify(handler, times(2)).execute(task);
    }

    @Test
    void exhaustedRetriesMarkTaskFailed() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");
        doThrow(new IllegalStateException("embedding down")).when(handler).execute(task);

        queue(2).submit(task);
        capturedRetry(1).run();

        IngestionTaskRecord record = ledger.get(task.getTaskId());
        assertThat(record.getStatus()).isEqualTo(IngestionTaskStatus.FAILED);
        assertThat(record.getAttempts()).isEqualTo(2);
        assertThat(record.getLastError()).contains("embedding down");
        verify(handler, times(2)).execute(task);
        verify(retryScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void singleAttemptPolicyNeverSchedules() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");
        doThrow(new IllegalStateException("boom")).when(handler).execute(task);

        queue(1).submit(task);

        assertThat(ledger.get(task.getTaskId()).getStatus()).isEqualTo(IngestionTaskStatus.FAILED);
        verify(retryScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void ledgerOutageDoesNotStopTheTask() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");
        doThrow(new IllegalStateException("db down")).when(taskRepository).save(any(IngestionTaskRecord.class));
        doNothing().when(handler).execute(task);

        queue(4).submit(task);

        verify(handler).execute(task);
    }

    @Test
    void rejectedSubmissionIsRecordedAsFailed() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");
        Executor saturated = command -> {
            throw new RejectedExecutionException("queue full");
        };

        new IngestionTaskQueue(saturated, retryScheduler, taskRepository, handler,
            new RetryPolicy(4, Duration.ZERO)).submit(task);

        assertThat(ledger.get(task.getTaskId()).getStatus()).isEqualTo(IngestionTaskStatus.FAILED);
        verify(handler, never()).execute(any());
    }

    @Test
    void rejectedRetryScheduleMarksTaskFailed() {
        IngestionTask task = IngestionTask.text("hello", "http://site.example.com/");
        doThrow(new IllegalStateException("embedding down")).when(handler).execute(task);
        doThrow(new TaskRejectedException("scheduler shut down"))
            .when(retryScheduler).schedule(any(Runnable.class), any(Instant.class));

        queue(4).submit(task);

        IngestionTaskRecord record = ledger.get(task.getTaskId());
        assertThat(record.getStatus()).isEqualTo(IngestionTaskStatus.FAILED);
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(record.getLastError()).contains("scheduler shut down").contains("embedding down");
    }
}
