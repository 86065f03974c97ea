package org.csits.qjob.server.connector;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.ConnectorEntity;
import org.csits.qjob.dao.ConnectorRepository;
import org.csits.qjob.manager.connector.ConnectionParams;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.manager.connector.QueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutorFactory;
import org.csits.qjob.server.exception.NotFoundException;
import org.csits.qjob.server.exception.ValidationException;
import org.csits.qjob.server.worker.core.QueryExecutorRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 基于 connectors 表的连接器注册表。每个连接器持有一个 HikariCP 连接池，连接参数变更后旧池关闭并重建，
 * 应用关闭时统一释放。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseConnectorRegistry implements ConnectorRegistry {

    private final ConnectorRepository connectorRepository;
    private final QueryExecutorRegistry queryExecutorRegistry;
    private final Map<Long, PooledDataSource> dataSources = new ConcurrentHashMap<>();

    @Value("${qjob.connector.max-pool-size:5}")
    private int maxPoolSize = 5;

    @Override
    public ConnectorEntity getConnector(Long connectorId) {
        return connectorRepository.findById(connectorId)
            .orElseThrow(() -> new NotFoundException("连接器不存在: id=" + connectorId));
    }

    @Override
    public QueryExecutor getExecutor(ConnectorEntity connector) {
        DbType dbType;
        try {
            dbType = DbType.fromCode(connector.getDbType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        QueryExecutorFactory factory = queryExecutorRegistry.select(dbType);
        if (factory == null) {
            throw new ValidationException("未找到数据源类型对应的插件: " + dbType.getCode());
        }
        ConnectionParams params = new ConnectionParams(dbType, connector.getHost(), connector.getPort(),
            connector.getUsername(), connector.getPassword(), connector.getDatabaseName());
        Long connectorId = connector.getId();
        PooledDataSource pooled = dataSources.compute(connectorId, (id, existing) -> {
            if (existing != null) {
                if (existing.params.equals(params)) {
                    return existing;
                }
                log.info("[connectorId={}] 连接参数已变更，关闭旧连接池: {}", id, existing.params);
                existing.dataSource.close();
            }
            return new PooledDataSource(params, createDataSource(factory, id, params));
        });
        return factory.create(pooled.dataSource);
    }

    private HikariDataSource createDataSource(QueryExecutorFactory factory, Long connectorId,
        ConnectionParams params) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(factory.jdbcUrl(params));
        config.setDriverClassName(factory.driverClassName());
        config.setUsername(params.getUsername());
        config.setPassword(params.getPassword());
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(0);
        config.setPoolName("qjob-" + params.getDbType().getCode() + "-" + connectorId);
        log.info("[connectorId={}] 创建连接池: {}, maxPoolSize={}", connectorId, params, maxPoolSize);
        return new HikariDataSource(config);
    }

    int pooledDataSourceCount() {
        return dataSources.size();
    }

    @PreDestroy
    public void close() {
        dataSources.forEach((connectorId, pooled) -> {
            log.info("[connectorId={}] 关闭连接池: {}", connectorId, pooled.params);
            pooled.dataSource.close();
        });
        dataSources.clear();
    }

    private static final class PooledDataSource {

        private final ConnectionParams params;
        private final HikariDataSource dataSource;

        private PooledDataSource(ConnectionParams params, HikariDataSource dataSource) {
            this.params = params;
            this.dataSource = dataSource;
        }
    }
}
