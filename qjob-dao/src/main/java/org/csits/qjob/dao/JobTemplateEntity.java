package org.csits.qjob.dao;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * 作业模板实体，对应 job_templates。
 */
@Data
public class JobTemplateEntity {

    public static final String TYPE_DB_QUERY = "db_query";

    private Long id;
    private String name;
    private String description;
    private String templateType = TYPE_DB_QUERY;
    /** 默认配置，至少包含 connector_id 与 sql，可选 params；更新时整体替换。 */
    private Map<String, Object> defaultConfig = new LinkedHashMap<>();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
