package org.csits.qjob.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 数据源连接器实体，对应 connectors。
 */
@Data
public class ConnectorEntity {

    private Long id;
    private String name;
    /** mysql / doris / postgresql */
    private String dbType;
    private String host;
    private Integer port;
    private String username;
    private String password;
    private String databaseName;
    private String description;
    private boolean active = true;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
