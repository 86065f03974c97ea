package org.csits.qjob.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
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
 * 基于数据库的定时任务仓储实现，读写 scheduled_jobs。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseScheduledJobRepository implements ScheduledJobRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonColumnMapper;

    private static final String INSERT_SQL =
        "INSERT INTO scheduled_jobs (name, template_id, schedule_type, cron_expression, interval_seconds, " +
        "is_active, next_run_time, override_config) VALUES (?, ?, ?, ?, ?, ?, NULL, ?)";

    private static final String UPDATE_SQL =
        "UPDATE scheduled_jobs SET name = ?, schedule_type = ?, cron_expression = ?, interval_seconds = ?, " +
        "is_active = ?, override_config = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?";

    private static final String UPDATE_NEXT_RUN_TIME_SQL =
        "UPDATE scheduled_jobs SET next_run_time = ? WHERE id = ?";

    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM scheduled_jobs WHERE id = ?";

    private static final String SELECT_PAGE_SQL =
        "SELECT * FROM scheduled_jobs ORDER BY id LIMIT ? OFFSET ?";

    private static final String SELECT_ACTIVE_SQL =
        "SELECT * FROM scheduled_jobs WHERE is_active = TRUE ORDER BY id";

    private static final String SELECT_BY_TEMPLATE_SQL =
        "SELECT * FROM scheduled_jobs WHERE template_id = ? ORDER BY id";

    private static final String DELETE_SQL =
        "DELETE FROM scheduled_jobs WHERE id = ?";

    @Override
    public ScheduledJobEntity save(ScheduledJobEntity entity) {
        if (entity.getId() == null) {
            return insert(entity);
        } else {
            return update(entity);
        }
    }

    private ScheduledJobEntity insert(ScheduledJobEntity entity) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        String overrideConfig = jsonColumnMapper.write(entity.getOverrideConfig());

        jdbcTemplate.update(connection -> {
            java.sql.PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
            ps.setString(1, entity.getName());
            ps.setLong(2, entity.getTemplateId());
            ps.setString(3, scheduleTypeCode(entity));
            ps.setString(4, entity.getCronExpression());
            setNullableInt(ps, 5, entity.getIntervalSeconds());
            ps.setBoolean(6, entity.isActive());
            ps.setString(7, overrideConfig);
            return ps;
        }, keyHolder);

        Long id = keyHolder.getKey().longValue();
        entity.setId(id);
        log.debug("插入定时任务: id={}, name={}, templateId={}", id, entity.getName(), entity.getTemplateId());
        return findById(id).orElse(entity);
    }

    private ScheduledJobEntity update(ScheduledJobEntity entity) {
        int rows = jdbcTemplate.update(UPDATE_SQL,
            entity.getName(),
            scheduleTypeCode(entity),
            entity.getCronExpression(),
            entity.getIntervalSeconds(),
            entity.isActive(),
            jsonColumnMapper.write(entity.getOverrideConfig()),
            entity.getId()
        );

        if (rows == 0) {
            log.warn("更新定时任务失败，记录不存在: id={}", entity.getId());
            return entity;
        }
        log.debug("更新定时任务: id={}, active={}", entity.getId(), entity.isActive());
        return findById(entity.getId()).orElse(entity);
    }

    @Override
    public Optional<ScheduledJobEntity> findById(Long id) {
        List<ScheduledJobEntity> results = jdbcTemplate.query(SELECT_BY_ID_SQL, new ScheduledJobRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ScheduledJobEntity> findAll(int skip, int limit) {
        return jdbcTemplate.query(SELECT_PAGE_SQL, new ScheduledJobRowMapper(), limit, skip);
    }

    @Override
    public List<ScheduledJobEntity> findActive() {
        return jdbcTemplate.query(SELECT_ACTIVE_SQL, new ScheduledJobRowMapper());
    }

    @Override
    public List<ScheduledJobEntity> findByTemplateId(Long templateId) {
        return jdbcTemplate.query(SELECT_BY_TEMPLATE_SQL, new ScheduledJobRowMapper(), templateId);
    }

    @Override
    public void updateNextRunTime(Long id, LocalDateTime nextRunTime) {
        jdbcTemplate.update(UPDATE_NEXT_RUN_TIME_SQL, toTimestamp(nextRunTime), id);
    }

    @Override
    public boolean deleteById(Long id) {
        int rows = jdbcTemplate.update(DELETE_SQL, id);
        if (rows > 0) {
            log.debug("删除定时任务: id={}", id);
        }
        return rows > 0;
    }

    private static String scheduleTypeCode(ScheduledJobEntity entity) {
        return entity.getScheduleType() != null ? entity.getScheduleType().getCode() : ScheduleType.CRON.getCode();
    }

    private static void setNullableInt(java.sql.PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    /**
     * RowMapper实现
     */
    private class ScheduledJobRowMapper implements RowMapper<ScheduledJobEntity> {
        @Override
        public ScheduledJobEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            ScheduledJobEntity entity = new ScheduledJobEntity();
            entity.setId(rs.getLong("id"));
            entity.setName(rs.getString("name"));
            entity.setTemplateId(rs.getLong("template_id"));
            entity.setScheduleType(ScheduleType.fromCode(rs.getString("schedule_type")));
            entity.setCronExpression(rs.getString("cron_expression"));
            int interval = rs.getInt("interval_seconds");
            entity.setIntervalSeconds(rs.wasNull() ? null : interval);
            entity.setActive(rs.getBoolean("is_active"));
            entity.setNextRunTime(toLocalDateTime(rs.getTimestamp("next_run_time")));
            entity.setOverrideConfig(jsonColumnMapper.read(rs.getString("override_config")));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            entity.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
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
