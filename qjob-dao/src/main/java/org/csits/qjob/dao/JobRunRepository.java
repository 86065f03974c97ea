package org.csits.qjob.dao;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 执行记录仓储，读写 job_runs。
 */
public interface JobRunRepository {

    /**
     * 创建一条 running 状态的执行记录
     */
    JobRunEntity createRun(Long jobId, LocalDateTime startedAt);

    /**
     * 终结执行记录。只更新非终态记录，已处于终态的记录保持不变。
     *
     * @return 终结后的记录；记录不存在（例如任务已被删除）时为空
     */
    Optional<JobRunEntity> finishRun(Long runId, JobRunOutcome outcome);

    Optional<JobRunEntity> findById(Long id);

    /**
     * 按任务分页查询执行记录，最新的在前
     */
    List<JobRunEntity> findByJobId(Long jobId, int skip, int limit);

    /**
     * 统计任务处于非终态（pending/running）的执行记录数
     */
    long countUnfinishedByJobId(Long jobId);
}
