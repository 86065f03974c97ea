package org.csits.qjob.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
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
 * 基于数据库的连接器仓储实现，读写 connectors。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatabaseConnectorRepository implements ConnectorRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL =
        "INSERT INTO connectors (name, db_type, host, port, username, password, database_name, description, is_active) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String UPDATE_SQL =
        "UPDATE connectors SET name = ?, db_type = ?, host = ?, port = ?, username = ?, password = ?, " +
        "database_name = ?, description = ?, is_active = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?";
    private static final String SELECT_BY_ID_SQL =
        "SELECT * FROM connectors WHERE id = ?";
    private static final String SELECT_BY_NAME_SQL =
        "SELECT * FROM connectors WHERE name = ?";
    private static final String SELECT_ALL_SQL =
        "SELECT * FROM connectors ORDER BY id";

    @Override
    public ConnectorEntity save(ConnectorEntity entity) {
        if (entity.getId() == null) {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(connection -> {
                java.sql.PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[]{"id"});
                ps.setString(1, entity.getName());
                ps.setString(2, entity.getDbType());
                ps.setString(3, entity.getHost());
                ps.setInt(4, entity.getPort() != null ? entity.getPort() : 0);
                ps.setString(5, entity.getUsername());
                ps.setString(6, entity.getPassword());
                ps.setString(7, entity.getDatabaseName());
                ps.setString(8, entity.getDescription());
                ps.setBoolean(9, entity.isActive());
                return ps;
            }, keyHolder);
            if (keyHolder.getKey() != null) {
                entity.setId(keyHolder.getKey().longValue());
            }
            log.info("新增连接器: id={}, name={}, dbType={}", entity.getId(), entity.getName(), entity.getDbType());
        } else {
            jdbcTemplate.update(UPDATE_SQL, entity.getName(), entity.getDbType(), entity.getHost(),
                entity.getPort(), entity.getUsername(), entity.getPassword(), entity.getDatabaseName(),
                entity.getDescription(), entity.isActive(), entity.getId());
        }
        return entity;
    }

    @Override
    public Optional<ConnectorEntity> findById(Long id) {
        List<ConnectorEntity> list = jdbcTemplate.query(SELECT_BY_ID_SQL, new ConnectorRowMapper(), id);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public Optional<ConnectorEntity> findByName(String name) {
        List<ConnectorEntity> list = jdbcTemplate.query(SELECT_BY_NAME_SQL, new ConnectorRowMapper(), name);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public List<ConnectorEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new ConnectorRowMapper());
    }

    private static class ConnectorRowMapper implements RowMapper<ConnectorEntity> {
        @Override
        public ConnectorEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            ConnectorEntity e = new ConnectorEntity();
            e.setId(rs.getLong("id"));
            e.setName(rs.getString("name"));
            e.setDbType(rs.getString("db_type"));
            e.setHost(rs.getString("host"));
            e.setPort(rs.getInt("port"));
            e.setUsername(rs.getString("username"));
            e.setPassword(rs.getString("password"));
            e.setDatabaseName(rs.getString("database_name"));
            e.setDescription(rs.getString("description"));
            e.setActive(rs.getBoolean("is_active"));
            Timestamp created = rs.getTimestamp("created_at");
            e.setCreatedAt(created != null ? created.toLocalDateTime() : null);
            Timestamp updated = rs.getTimestamp("updated_at");
            e.setUpdatedAt(updated != null ? updated.toLocalDateTime() : null);
            return e;
        }
    }
}
