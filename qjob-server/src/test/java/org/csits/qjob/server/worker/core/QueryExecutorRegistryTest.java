package org.csits.qjob.server.worker.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import org.csits.qjob.manager.connector.DbType;
import org.csits.qjob.server.plugin.doris.DorisQueryExecutorFactory;
import org.csits.qjob.server.plugin.mysql.MysqlQueryExecutorFactory;
import org.csits.qjob.server.plugin.postgresql.PostgresqlQueryExecutorFactory;
import org.junit.jupiter.api.Test;

class QueryExecutorRegistryTest {

    private final MysqlQueryExecutorFactory mysql = new MysqlQueryExecutorFactory();
    private final DorisQueryExecutorFactory doris = new DorisQueryExecutorFactory();
    private final PostgresqlQueryExecutorFactory postgresql = new PostgresqlQueryExecutorFactory();

    @Test
    void select_returnsFactoryForEachDbType() {
        QueryExecutorRegistry registry = new QueryExecutorRegistry(Arrays.asList(mysql, doris, postgresql));

        assertThat(registry.select(DbType.MYSQL)).isSameAs(mysql);
        assertThat(registry.select(DbType.DORIS)).isSameAs(doris);
        assertThat(registry.select(DbType.POSTGRESQL)).isSameAs(postgresql);
    }

    @Test
    void select_returnsNullWhenNoneSupport() {
        QueryExecutorRegistry registry = new QueryExecutorRegistry(Collections.singletonList(mysql));

        assertThat(registry.select(DbType.POSTGRESQL)).isNull();
    }

    @Test
    void select_returnsNullWhenFactoriesEmpty() {
        QueryExecutorRegistry registry = new QueryExecutorRegistry(Collections.emptyList());

        assertThat(registry.select(DbType.MYSQL)).isNull();
    }
}
