package org.csits.qjob.server.connector;

import org.csits.qjob.dao.ConnectorEntity;
import org.csits.qjob.manager.connector.QueryExecutor;

/**
 * 连接器注册表：按 id 查找已登记的数据源，并提供对应方言的查询执行器。
 */
public interface ConnectorRegistry {

    /**
     * @throws org.csits.qjob.server.exception.NotFoundException 连接器不存在
     */
    ConnectorEntity getConnector(Long connectorId);

    /**
     * @throws org.csits.qjob.server.exception.ValidationException db_type 不受支持
     */
    QueryExecutor getExecutor(ConnectorEntity connector);
}
