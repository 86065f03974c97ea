package org.csits.qjob.dao;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON 配置列与 Map 之间的转换。配置结构不由表结构约束，仅在触发执行时校验。
 */
@Component
@RequiredArgsConstructor
public class JsonColumnMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public String write(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("配置无法序列化为 JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("配置列不是合法的 JSON 对象: " + e.getOriginalMessage(), e);
        }
    }
}
