package org.csits.qjob.manager.connector;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * 基于 {@link NamedParameterJdbcTemplate} 的通用执行器，各方言只需提供列表表名的 SQL。
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {

    private static final String PING_SQL = "SELECT 1";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String listTablesSql;

    public JdbcQueryExecutor(DataSource dataSource, String listTablesSql) {
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.listTablesSql = listTablesSql;
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params) {
        log.debug("执行查询: sql={}, params={}", sql, params);
        return jdbcTemplate.queryForList(sql, safe(params));
    }

    @Override
    public int executeUpdate(String sql, Map<String, Object> params) {
        log.debug("执行更新: sql={}, params={}", sql, params);
        return jdbcTemplate.update(sql, safe(params));
    }

    @Override
    public boolean testConnection() {
        try {
            jdbcTemplate.getJdbcTemplate().queryForObject(PING_SQL, Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("数据源连接测试失败: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> getTables() {
        return jdbcTemplate.getJdbcTemplate().queryForList(listTablesSql, String.class);
    }

    private static Map<String, Object> safe(Map<String, Object> params) {
        return params != null ? params : Collections.emptyMap();
    }
}
