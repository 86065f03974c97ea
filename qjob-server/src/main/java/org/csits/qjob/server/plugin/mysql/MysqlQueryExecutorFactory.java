package org.csits.qjob.server.plugin.mysql;

import javax.sql.DataSource;
import org.csits.qjob.manager.connector.ConnectionParams;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.manager.connector.JdbcQueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutorFactory;
import org.springframework.stereotype.Component;

/**
 * MySQL 方言插件，基于 MySQL Connector/J。
 */
@Component
public class MysqlQueryExecutorFactory implements QueryExecutorFactory {

    static final String DRIVER_CLASS = "com.mysql.cj.jdbc.Driver";
    static final String LIST_TABLES_SQL = "SHOW TABLES";

    @Override
    public boolean supports(DbType dbType) {
        return dbType == DbType.MYSQL;
    }

    @Override
    public String driverClassName() {
        return DRIVER_CLASS;
    }

    @Override
    public String jdbcUrl(ConnectionParams params) {
        return mysqlProtocolUrl(params);
    }

    @Override
    public QueryExecutor create(DataSource dataSource) {
        return new JdbcQueryExecutor(dataSource, LIST_TABLES_SQL);
    }

    /**
     * MySQL 协议的连接串，Doris 共用。
     */
    public static String mysqlProtocolUrl(ConnectionParams params) {
        return String.format("jdbc:mysql://%s:%d/%s?useUnicode=true&characterEncoding=utf8&connectTimeout=5000",
            params.getHost(), params.getPort(), params.getDatabase() != null ? params.getDatabase() : "");
    }
}
