package org.csits.qjob.manager.connector;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 建立数据源连接所需的参数，同一组参数共享一个连接池。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionParams {

    private DbType dbType;
    private String host;
    private Integer port;
    private String username;
    private String password;
    private String database;

    @Override
    public String toString() {
        return dbType + "://" + username + "@" + host + ":" + port + "/" + database;
    }
}
