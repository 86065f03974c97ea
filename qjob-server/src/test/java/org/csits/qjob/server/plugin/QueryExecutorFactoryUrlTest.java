package org.csits.qjob.server.plugin;

import static org.assertj.core.api.Assertions.assertThat;

import org.csits.qjob.manager.connector.ConnectionParams;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.server.plugin.doris.DorisQueryExecutorFactory;
import org.csits.qjob.server.plugin.mysql.MysqlQueryExecutorFactory;
import org.csits.qjob.server.plugin.postgresql.PostgresqlQueryExecutorFactory;
import org.junit.jupiter.api.Test;

class QueryExecutorFactoryUrlTest {

    @Test
    void mysqlAndDorisShareMysqlProtocol() {
        ConnectionParams params = new ConnectionParams(DbType.DORIS, "fe.local", 9030, "root", "", "test_db");

        assertThat(new DorisQueryExecutorFactory().jdbcUrl(params))
            .startsWith("jdbc:mysql://fe.local:9030/test_db");
        assertThat(new DorisQueryExecutorFactory().driverClassName())
            .isEqualTo(new MysqlQueryExecutorFactory().driverClassName());
    }

    @Test
    void postgresqlUrl() {
        ConnectionParams params = new ConnectionParams(DbType.POSTGRESQL, "pg.local", 5432, "app", "pw", "reports");

        assertThat(new PostgresqlQueryExecutorFactory().jdbcUrl(params))
            .isEqualTo("jdbc:postgresql://pg.local:5432/reports");
    }

    @Test
    void connectionParamsToStringHidesPassword() {
        ConnectionParams params = new ConnectionParams(DbType.MYSQL, "db", 3306, "root", "secret", "test");

        assertThat(params.toString()).doesNotContain("secret");
    }
}
