package org.csits.qjob.manager.connector;

import javax.sql.DataSource;

/**
 * 数据库方言插件：声明支持的类型、JDBC 连接方式，并基于连接池创建执行器。
 *
 * 实现类位于 qjob-server 的 plugin 包中，由 Spring 统一注册。
 */
public interface QueryExecutorFactory {

    boolean supports(DbType dbType);

    String driverClassName();

    String jdbcUrl(ConnectionParams params);

    QueryExecutor create(DataSource dataSource);
}
