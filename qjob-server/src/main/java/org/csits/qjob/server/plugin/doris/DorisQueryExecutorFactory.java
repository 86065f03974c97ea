package org.csits.qjob.server.plugin.doris;

import javax.sql.DataSource;
import org.csits.qjob.manager.connector.ConnectionParams;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.manager.connector.JdbcQueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutorFactory;
import org.csits.qjob.server.plugin.mysql.MysqlQueryExecutorFactory;
import org.springframework.stereotype.Component;

/**
 * Doris 方言插件。Doris FE 兼容 MySQL 协议（默认查询端口 9030），复用 MySQL 驱动。
 */
@Component
public class DorisQueryExecutorFactory implements QueryExecutorFactory {

    @Override
    public boolean supports(DbType dbType) {
        return dbType == DbType.DORIS;
    }

    @Override
    public String driverClassName() {
        return "com.mysql.cj.jdbc.Driver";
    }

    @Override
    public String jdbcUrl(ConnectionParams params) {
        return MysqlQueryExecutorFactory.mysqlProtocolUrl(params);
    }

    @Override
    public QueryExecutor create(DataSource dataSource) {
        return new JdbcQueryExecutor(dataSource, "SHOW TABLES");
    }
}
