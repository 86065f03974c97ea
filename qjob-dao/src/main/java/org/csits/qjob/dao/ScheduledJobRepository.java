package org.csits.qjob.dao;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 定时任务仓储，读写 scheduled_jobs。
 */
public interface ScheduledJobRepository {

    /**
     * 新增或更新（id 为空时新增）
     */
    ScheduledJobEntity save(ScheduledJobEntity entity);

    Optional<ScheduledJobEntity> findById(Long id);

    List<ScheduledJobEntity> findAll(int skip, int limit);

    /**
     * 所有 is_active=TRUE 的任务，按 id 升序
     */
    List<ScheduledJobEntity> findActive();

    List<ScheduledJobEntity> findByTemplateId(Long templateId);

    /**
     * 仅更新参考用的下次运行时间，不修改 updated_at。
     */
    void updateNextRunTime(Long id, LocalDateTime nextRunTime);

    /**
     * 删除任务，其执行记录由外键级联删除。
     *
     * @return 是否删除了记录
     */
    boolean deleteById(Long id);
}
