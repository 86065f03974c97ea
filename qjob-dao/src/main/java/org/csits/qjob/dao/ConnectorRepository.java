package org.csits.qjob.dao;

import java.util.List;
import java.util.Optional;

/**
 * 连接器仓储，读写 connectors。
 */
public interface ConnectorRepository {

    ConnectorEntity save(ConnectorEntity entity);

    Optional<ConnectorEntity> findById(Long id);

    Optional<ConnectorEntity> findByName(String name);

    List<ConnectorEntity> findAll();
}
