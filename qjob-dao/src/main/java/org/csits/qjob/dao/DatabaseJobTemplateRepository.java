package org.csits.qjob.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * 基于数据库的作业模板仓储实现，读写 job_templates。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseJobTemplateRepository implements JobTemplateRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonColumnMapper;

    private static final String INSERT_SQL =
        "INSERT INTO job_templates (name, description, template_type, default_config) VALUES (?, ?, ?, ?)";
    private static final String UPDATE_SQL =
        "UPDATE job_templates SET name = ?, description = ?, template_type = ?, default_config = ?, " +
        "updated_at = CURRENT_TIMESTAMP WHERE id = ?";
    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM job_templates WHERE id = ?";
    private static final String SELECT_BY_NAME_SQL =
        "SELECT * FROM job_templates WHERE name = ?";
    private static final String SELECT_PAGE_SQL =
        "SELECT * FROM job_templates ORDER BY id LIMIT ? OFFSET ?";
    private static final String EXISTS_SQL =
        "SELECT 1 FROM job_templates WHERE name = ? LIMIT 1";
    private static final String DELETE_SQL =
        "DELETE FROM job_templates WHERE id = ?";

    @Override
    public JobTemplateEntity save(JobTemplateEntity entity) {
        String defaultConfig = jsonColumnMapper.write(entity.getDefaultConfig());
        String templateType = entity.getTemplateType() != null
            ? entity.getTemplateType() : JobTemplateEntity.TYPE_DB_QUERY;
        if (entity.getId() == null) {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                java.sql.PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
                ps.setString(1, entity.getName());
                ps.setString(2, entity.getDescription());
                ps.setString(3, templateType);
                ps.setString(4, defaultConfig);
                return ps;
            }, keyHolder);
            if (keyHolder.getKey() != null) {
                entity.setId(keyHolder.getKey().longValue());
            }
            log.debug("插入作业模板: id={}, name={}", entity.getId(), entity.getName());
        } else {
            int rows = jdbcTemplate.update(UPDATE_SQL,
                entity.getName(), entity.getDescription(), templateType, defaultConfig, entity.getId());
            if (rows == 0) {
                log.warn("更新作业模板失败，记录不存在: id={}", entity.getId());
            }
        }
        return findById(entity.getId()).orElse(entity);
    }

    @Override
    public Optional<JobTemplateEntity> findById(Long id) {
        List<JobTemplateEntity> list = jdbcTemplate.query(SELECT_BY_ID_SQL, new JobTemplateRowMapper(), id);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public Optional<JobTemplateEntity> findByName(String name) {
        List<JobTemplateEntity> list = jdbcTemplate.query(SELECT_BY_NAME_SQL, new JobTemplateRowMapper(), name);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<JobTemplateEntity> findAll(int skip, int limit) {
        return jdbcTemplate.query(SELECT_PAGE_SQL, new JobTemplateRowMapper(), limit, skip);
    }

    @Override
    public boolean existsByName(String name) {
        List<Object> list = jdbcTemplate.query(EXISTS_SQL, (rs, rowNum) -> 1, name);
        return !list.isEmpty();
    }

    @Override
    public boolean deleteById(Long id) {
        int rows = jdbcTemplate.update(DELETE_SQL, id);
        if (rows > 0) {
            log.debug("删除作业模板: id={}", id);
        }
        return rows > 0;
    }

    private class JobTemplateRowMapper implements RowMapper<JobTemplateEntity> {
        @Override
        public JobTemplateEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            JobTemplateEntity e = new JobTemplateEntity();
            e.setId(rs.getLong("id"));
            e.setName(rs.getString("name"));
            e.setDescription(rs.getString("description"));
            e.setTemplateType(rs.getString("template_type"));
            Map<String, Object> defaultConfig = jsonColumnMapper.read(rs.getString("default_config"));
            e.setDefaultConfig(defaultConfig != null ? defaultConfig : new LinkedHashMap<>());
            e.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
            e.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
            return e;
        }
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
