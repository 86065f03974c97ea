package org.csits.qjob.server.worker.core;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.manager.connector.QueryExecutorFactory;
import org.springframework.stereotype.Component;

/**
 * 数据库方言插件注册与选择器。
 */
@Component
@RequiredArgsConstructor
public class QueryExecutorRegistry {

    private final List<QueryExecutorFactory> factories;

    public QueryExecutorFactory select(DbType dbType) {
        return factories.stream()
            .filter(f -> f.supports(dbType))
            .findFirst()
            .orElse(null);
    }
}
