package org.csits.qjob.dao;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次执行的最终结果，用于终结 job_runs 记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRunOutcome {

    private JobRunStatus status;
    private LocalDateTime finishedAt;
    private long durationMs;
    private int rowsAffected;
    private String result;
    private String error;
}
