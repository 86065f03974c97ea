package org.csits.qjob.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的执行记录仓储实现，读写 job_runs。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseJobRunRepository implements JobRunRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO job_runs (job_id, status, started_at, rows_affected) VALUES (?, ?, ?, 0)";

    /**
     * 只终结非终态记录，保证 success/failed 一旦写入不再被覆盖
     */
    private static final String FINISH_SQL =
        "UPDATE job_runs SET status = ?, finished_at = ?, duration_ms = ?, rows_affected = ?, result = ?, error = ? " +
        "WHERE id = ? AND status IN ('pending', 'running')";

    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM job_runs WHERE id = ?";

    private static final String SELECT_BY_JOB_SQL =
        "SELECT * FROM job_runs WHERE job_id = ? ORDER BY id DESC LIMIT ? OFFSET ?";

    private static final String COUNT_UNFINISHED_SQL =
        "SELECT COUNT(*) FROM job_runs WHERE job_id = ? AND status IN ('pending', 'running')";

    @Override
    public JobRunEntity createRun(Long jobId, LocalDateTime startedAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            java.sql.PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
            ps.setLong(1, jobId);
            ps.setString(2, JobRunStatus.RUNNING.getCode());
            ps.setTimestamp(3, toTimestamp(startedAt));
            return ps;
        }, keyHolder);

        Long id = keyHolder.getKey().longValue();
        log.debug("插入执行记录: id={}, jobId={}", id, jobId);
        return findById(id).orElseThrow(() -> new IllegalStateException("执行记录写入后无法读取: id=" + id));
    }

    @Override
    public Optional<JobRunEntity> finishRun(Long runId, JobRunOutcome outcome) {
        if (outcome.getStatus() == null || !outcome.getStatus().isTerminal()) {
            throw new IllegalArgumentException("终结执行记录必须使用终态: " + outcome.getStatus());
        }
        int rows = jdbcTemplate.update(FINISH_SQL,
            outcome.getStatus().getCode(),
            toTimestamp(outcome.getFinishedAt()),
            outcome.getDurationMs(),
            outcome.getRowsAffected(),
            outcome.getResult(),
            outcome.getError(),
            runId
        );

        Optional<JobRunEntity> current = findById(runId);
        if (rows == 0) {
            if (current.isPresent()) {
                log.warn("执行记录已处于终态，忽略本次终结: id={}, status={}", runId, current.get().getStatus());
            } else {
                log.warn("终结执行记录失败，记录不存在: id={}", runId);
            }
        } else {
            log.debug("终结执行记录: id={}, status={}, durationMs={}",
                runId, outcome.getStatus(), outcome.getDurationMs());
        }
        return current;
    }

    @Override
    public Optional<JobRunEntity> findById(Long id) {
        List<JobRunEntity> results = jdbcTemplate.query(SELECT_BY_ID_SQL, new JobRunRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<JobRunEntity> findByJobId(Long jobId, int skip, int limit) {
        return jdbcTemplate.query(SELECT_BY_JOB_SQL, new JobRunRowMapper(), jobId, limit, skip);
    }

    @Override
    public long countUnfinishedByJobId(Long jobId) {
        Long count = jdbcTemplate.queryForObject(COUNT_UNFINISHED_SQL, Long.class, jobId);
        return count != null ? count : 0;
    }

    private static class JobRunRowMapper implements RowMapper<JobRunEntity> {
        @Override
        public JobRunEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            JobRunEntity entity = new JobRunEntity();
            entity.setId(rs.getLong("id"));
            entity.setJobId(rs.getLong("job_id"));
            entity.setStatus(JobRunStatus.fromCode(rs.getString("status")));
            entity.setStartedAt(toLocalDateTime(rs.getTimestamp("started_at")));
            entity.setFinishedAt(toLocalDateTime(rs.getTimestamp("finished_at")));
            long duration = rs.getLong("duration_ms");
            entity.setDurationMs(rs.wasNull() ? null : duration);
            entity.setRowsAffected(rs.getInt("rows_affected"));
            entity.setResult(rs.getString("result"));
            entity.setError(rs.getString("error"));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            return entity;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
