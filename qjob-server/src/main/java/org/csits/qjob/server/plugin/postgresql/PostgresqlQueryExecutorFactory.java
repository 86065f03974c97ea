package org.csits.qjob.server.plugin.postgresql;

import javax.sql.DataSource;
import org.csits.qjob.manager.connector.ConnectionParams;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.manager.connector.JdbcQueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutor;
import org.csits.qjob.manager.connector.QueryExecutorFactory;
import org.springframework.stereotype.Component;

/**
 * PostgreSQL 方言插件，列出 current_schema 下的普通表。
 */
@Component
public class PostgresqlQueryExecutorFactory implements QueryExecutorFactory {

    private static final String LIST_TABLES_SQL =
        "SELECT table_name FROM information_schema.tables " +
        "WHERE table_schema = current_schema() AND table_type = 'BASE TABLE' ORDER BY table_name";

    @Override
    public boolean supports(DbType dbType) {
        return dbType == DbType.POSTGRESQL;
    }

    @Override
    public String driverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    public String jdbcUrl(ConnectionParams params) {
        return String.format("jdbc:postgresql://%s:%d/%s",
            params.getHost(), params.getPort(), params.getDatabase() != null ? params.getDatabase() : "");
    }

    @Override
    public QueryExecutor create(DataSource dataSource) {
        return new JdbcQueryExecutor(dataSource, LIST_TABLES_SQL);
    }
}
