package org.csits.qjob.server.dto;

import java.util.Map;
import lombok.Data;

/**
 * 创建作业模板的请求。
 */
@Data
public class TemplateCreateRequest {

    private String name;
    private String description;
    private String templateType;
    /**
     * 至少包含 connector_id 与 sql，可选 params。
     */
    private Map<String, Object> defaultConfig;
}
