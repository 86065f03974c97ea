package org.csits.qjob.server.dto;

import java.util.Map;
import lombok.Data;

/**
 * 部分更新作业模板，字段为 null 表示不修改。defaultConfig 整体替换，不做合并。
 */
@Data
public class TemplateUpdateRequest {

    private String name;
    private String description;
    private Map<String, Object> defaultConfig;
}
