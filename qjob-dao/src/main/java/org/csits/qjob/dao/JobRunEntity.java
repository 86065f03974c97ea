package org.csits.qjob.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 任务执行记录实体，对应 job_runs。
 */
@Data
public class JobRunEntity {

    private Long id;

    private Long jobId;

    private JobRunStatus status = JobRunStatus.PENDING;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private Long durationMs;

    private Integer rowsAffected = 0;

    /**
     * 结果预览 JSON：{"preview": [...], "total": N}
     */
    private String result;

    private String error;

    private LocalDateTime createdAt;
}
