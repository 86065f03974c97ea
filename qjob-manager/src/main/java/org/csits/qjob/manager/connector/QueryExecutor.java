package org.csits.qjob.manager.connector;

import java.util.List;
import java.util.Map;

/**
 * 数据源查询能力接口，不同数据库方言通过 {@link QueryExecutorFactory} 提供实现。
 *
 * SQL 中的命名参数使用 {@code :name} 形式，由 params 绑定。
 * 执行失败抛出 Spring 的 {@link org.springframework.dao.DataAccessException}。
 */
public interface QueryExecutor {

    /**
     * 执行查询，每行以列名为键返回。
     */
    List<Map<String, Object>> executeQuery(String sql, Map<String, Object> params);

    /**
     * 执行 DML，返回影响行数。
     */
    int executeUpdate(String sql, Map<String, Object> params);

    boolean testConnection();

    List<String> getTables();
}
