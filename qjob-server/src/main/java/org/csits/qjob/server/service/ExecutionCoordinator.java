package org.csits.qjob.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.ConnectorEntity;
import org.csits.qjob.dao.JobRunEntity;
import org.csits.qjob.dao.JobRunOutcome;
import org.csits.qjob.dao.JobRunRepository;
import org.csits.qjob.dao.JobRunStatus;
import org.csits.qjob.dao.JobTemplateEntity;
import org.csits.qjob.dao.JobTemplateRepository;
import org.csits.qjob.dao.ScheduledJobEntity;
import org.csits.qjob.dao.ScheduledJobRepository;
import org.csits.qjob.manager.connector.QueryExecutor;
import org.csits.qjob.server.connector.ConnectorRegistry;
import org.csits.qjob.server.exception.JobExecutionException;
import org.csits.qjob.server.exception.NotFoundException;
import org.csits.qjob.server.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 单次作业执行：创建执行记录、合并配置、调用数据源并落库结果。
 *
 * 执行记录在所有退出路径上恰好终结一次；任何异常都记录到执行记录中，不向调用方抛出。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionCoordinator {

    static final String JOB_MISSING = "job missing";
    static final String KEY_CONNECTOR_ID = "connector_id";
    static final String KEY_SQL = "sql";
    static final String KEY_PARAMS = "params";

    private final JobRunRepository jobRunRepository;
    private final ScheduledJobRepository scheduledJobRepository;
    private final JobTemplateRepository jobTemplateRepository;
    private final ConnectorRegistry connectorRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${qjob.execution.preview-rows:10}")
    private int previewRows = 10;

    /**
     * @return 终结后的执行记录；执行记录无法创建或已被级联删除时返回 null
     */
    public JobRunEntity execute(Long jobId) {
        long startMillis = clock.millis();
        JobRunEntity run;
        try {
            run = jobRunRepository.createRun(jobId, LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.error("[jobId={}] 创建执行记录失败，放弃本次执行", jobId, e);
            return null;
        }
        log.info("[jobId={}] 开始执行, runId={}", jobId, run.getId());

        JobRunStatus status = JobRunStatus.FAILED;
        int rowsAffected = 0;
        String result = null;
        String error = null;
        try {
            Map<String, Object> config = resolveConfig(jobId);
            Long connectorId = requireConnectorId(config);
            String sql = requireSql(config);
            Map<String, Object> params = readParams(config);

            ConnectorEntity connector = connectorRegistry.getConnector(connectorId);
            QueryExecutor executor = connectorRegistry.getExecutor(connector);
            List<Map<String, Object>> rows;
            try {
                rows = executor.executeQuery(sql, params);
            } catch (DataAccessException e) {
                throw new JobExecutionException(e.getMessage(), e);
            }

            result = toResultJson(rows);
            rowsAffected = rows.size();
            status = JobRunStatus.SUCCESS;
        } catch (Exception e) {
            status = JobRunStatus.FAILED;
            rowsAffected = 0;
            result = null;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            log.error("[jobId={}] 执行失败, runId={}: {}", jobId, run.getId(), error, e);
        } finally {
            LocalDateTime finishedAt = LocalDateTime.now(clock);
            long durationMs = clock.millis() - startMillis;
            run = finish(jobId, run.getId(),
                new JobRunOutcome(status, finishedAt, durationMs, rowsAffected, result, error));
        }
        return run;
    }

    private JobRunEntity finish(Long jobId, Long runId, JobRunOutcome outcome) {
        try {
            Optional<JobRunEntity> finished = jobRunRepository.finishRun(runId, outcome);
            if (!finished.isPresent()) {
                log.warn("[jobId={}] 执行记录已不存在（任务可能已被删除）, runId={}", jobId, runId);
                return null;
            }
            log.info("[jobId={}] 执行结束, runId={}, status={}, rows={}, durationMs={}",
                jobId, runId, outcome.getStatus().getCode(), outcome.getRowsAffected(), outcome.getDurationMs());
            return finished.get();
        } catch (RuntimeException e) {
            log.error("[jobId={}] 写入执行结果失败, runId={}", jobId, runId, e);
            return null;
        }
    }

    /**
     * 模板默认配置浅拷贝后按键覆盖任务配置，只合并一层。
     */
    Map<String, Object> resolveConfig(Long jobId) {
        ScheduledJobEntity job = scheduledJobRepository.findById(jobId)
            .orElseThrow(() -> new NotFoundException(JOB_MISSING));
        JobTemplateEntity template = jobTemplateRepository.findById(job.getTemplateId())
            .orElseThrow(() -> new NotFoundException(JOB_MISSING));
        return mergeConfig(template.getDefaultConfig(), job.getOverrideConfig());
    }

    static Map<String, Object> mergeConfig(Map<String, Object> defaults, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (defaults != null) {
            merged.putAll(defaults);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }

    private static Long requireConnectorId(Map<String, Object> config) {
        Object value = config.get(KEY_CONNECTOR_ID);
        if (isBlank(value) || isBlank(config.get(KEY_SQL))) {
            throw new ValidationException("配置不完整: 需要 connector_id 和 sql");
        }
        // 带小数部分的值不截断
        try {
            return new BigDecimal(value.toString().trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException("connector_id 必须为整数: " + value, e);
        }
    }

    private static String requireSql(Map<String, Object> config) {
        Object value = config.get(KEY_SQL);
        if (!(value instanceof String)) {
            throw new ValidationException("sql 必须为字符串");
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readParams(Map<String, Object> config) {
        Object value = config.get(KEY_PARAMS);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new ValidationException("params 必须为键值对象");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> params.put(String.valueOf(k), v));
        return params;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).trim().isEmpty());
    }

    private String toResultJson(List<Map<String, Object>> rows) throws JsonProcessingException {
        int size = Math.min(previewRows, rows.size());
        List<Map<String, Object>> preview = new ArrayList<>(size);
        for (Map<String, Object> row : rows.subList(0, size)) {
            Map<String, Object> converted = new LinkedHashMap<>();
            row.forEach((column, value) -> converted.put(column, previewValue(value)));
            preview.add(converted);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("preview", preview);
        result.put("total", rows.size());
        return objectMapper.writeValueAsString(result);
    }

    // 时间等驱动类型按字符串输出，二进制转 Base64
    private static Object previewValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) value);
        }
        return value.toString();
    }
}
