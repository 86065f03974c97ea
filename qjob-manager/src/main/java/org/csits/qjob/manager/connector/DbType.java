package org.csits.qjob.manager.connector;

/**
 * 支持的数据源类型。
 */
public enum DbType {

    MYSQL("mysql"),
    /**
     * Doris 兼容 MySQL 协议，使用 MySQL 驱动连接。
     */
    DORIS("doris"),
    POSTGRESQL("postgresql");

    private final String code;

    DbType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 按编码解析，大小写不敏感。
     *
     * @throws IllegalArgumentException 编码为空或不支持
     */
    public static DbType fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new IllegalArgumentException("数据源类型不能为空");
        }
        String normalized = code.trim().toLowerCase();
        for (DbType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的数据源类型: " + code);
    }
}
