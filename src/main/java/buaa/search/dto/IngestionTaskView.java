package buaa.search.dto;

import buaa.search.model.IngestionTaskRecord;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 摄取任务台账视图
 */
@Data
public class IngestionTaskView {
    private String taskId;
    private String taskType;
    private String sourcePageUrl;
    private String assetUrl;
    private String status;
    private int attempts;
    private String lastError;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static IngestionTaskView from(IngestionTaskRecord record) {
        IngestionTaskView view = new IngestionTaskView();
        view.setTaskId(record.getTaskId());
        view.setTaskType(record.getTaskType() != null ? record.getTaskType().value() : null);
        view.setSourcePageUrl(record.getSourcePageUrl());
        view.setAssetUrl(record.getAssetUrl());
        view.setStatus(record.getStatus() != null ? record.getStatus().name() : null);
        view.setAttempts(record.getAttempts());
        view.setLastError(record.getLastError());
        view.setCreatedAt(record.getCreatedAt());
        view.setUpdatedAt(record.getUpdatedAt());
        return view;
    }
}
