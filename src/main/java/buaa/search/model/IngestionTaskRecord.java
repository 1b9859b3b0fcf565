package buaa.search.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 摄取任务台账
 * 记录每个后台摄取任务的状态与重试次数，重试耗尽的任务留在 FAILED 状态供运维排查
 */
@Data
@Entity
@Table(name = "ingestion_tasks", indexes = {
    @Index(name = "idx_ingestion_task_status", columnList = "status"),
    @Index(name = "idx_ingestion_task_key", columnList = "idempotency_key")
})
public class IngestionTaskRecord {

    @Id
    @Column(name = "task_id", length = 36)
    private String taskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", length = 16, nullable = false)
    private Modality taskType;

    @Column(name = "idempotency_key", length = 32, nullable = false)
    private String idempotencyKey;

    @Column(name = "source_page_url", length = 1024)
    private String sourcePageUrl;

    @Column(name = "asset_url", length = 1024)
    private String assetUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private IngestionTaskStatus status;

    @Column(name = "attempts")
    private int attempts;

    @Column(name = "last_error", length = 1024)
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
