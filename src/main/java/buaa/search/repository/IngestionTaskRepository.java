package buaa.search.repository;

import buaa.search.model.IngestionTaskRecord;
import buaa.search.model.IngestionTaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 摄取任务台账数据访问接口
 */
@Repository
public interface IngestionTaskRepository extends JpaRepository<IngestionTaskRecord, String> {

    /**
     * 按状态查询任务，最近更新的在前
     */
    List<IngestionTaskRecord> findByStatusOrderByUpdatedAtDesc(IngestionTaskStatus status, Pageable pageable);
}
