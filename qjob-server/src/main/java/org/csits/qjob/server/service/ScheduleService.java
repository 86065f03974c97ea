package org.csits.qjob.server.service;

import java.util.LinkedHashMap;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.JobRunEntity;
import org.csits.qjob.dao.JobRunRepository;
import org.csits.qjob.dao.JobTemplateEntity;
import org.csits.qjob.dao.JobTemplateRepository;
import org.csits.qjob.dao.ScheduleType;
import org.csits.qjob.dao.ScheduledJobEntity;
import org.csits.qjob.dao.ScheduledJobRepository;
import org.csits.qjob.server.dto.JobCreateRequest;
import org.csits.qjob.server.dto.JobUpdateRequest;
import org.csits.qjob.server.dto.TemplateCreateRequest;
import org.csits.qjob.server.dto.TemplateUpdateRequest;
import org.csits.qjob.server.exception.ConflictException;
import org.csits.qjob.server.exception.NotFoundException;
import org.csits.qjob.server.exception.ValidationException;
import org.csits.qjob.server.scheduler.JobScheduler;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * 模板、定时任务与执行记录的管理入口。任务的每次增删改都会同步到调度运行时。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final JobTemplateRepository jobTemplateRepository;
    private final ScheduledJobRepository scheduledJobRepository;
    private final JobRunRepository jobRunRepository;
    private final JobScheduler jobScheduler;

    // ---------------------------------------------------------------- 模板

    public JobTemplateEntity createTemplate(TemplateCreateRequest request) {
        String name = requireName(request.getName());
        String type = request.getTemplateType() != null ? request.getTemplateType() : JobTemplateEntity.TYPE_DB_QUERY;
        if (!JobTemplateEntity.TYPE_DB_QUERY.equals(type)) {
            throw new ValidationException("不支持的模板类型: " + type);
        }
        if (jobTemplateRepository.existsByName(name)) {
            throw new ConflictException("模板名称已存在: " + name);
        }
        JobTemplateEntity entity = new JobTemplateEntity();
        entity.setName(name);
        entity.setDescription(request.getDescription());
        entity.setTemplateType(type);
        entity.setDefaultConfig(request.getDefaultConfig() != null
            ? new LinkedHashMap<>(request.getDefaultConfig()) : new LinkedHashMap<>());
        JobTemplateEntity saved = saveTemplate(entity);
        log.info("创建模板: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    public JobTemplateEntity getTemplate(Long templateId) {
        return jobTemplateRepository.findById(templateId)
            .orElseThrow(() -> new NotFoundException("模板不存在: id=" + templateId));
    }

    public List<JobTemplateEntity> listTemplates(int skip, int limit) {
        checkPage(skip, limit);
        return jobTemplateRepository.findAll(skip, limit);
    }

    /**
     * 模板配置在执行时读取，更新模板不需要重新同步调度。
     */
    public JobTemplateEntity updateTemplate(Long templateId, TemplateUpdateRequest request) {
        JobTemplateEntity entity = getTemplate(templateId);
        if (request.getName() != null) {
            String name = requireName(request.getName());
            if (!name.equals(entity.getName()) && jobTemplateRepository.existsByName(name)) {
                throw new ConflictException("模板名称已存在: " + name);
            }
            entity.setName(name);
        }
        if (request.getDescription() != null) {
            entity.setDescription(request.getDescription());
        }
        if (request.getDefaultConfig() != null) {
            entity.setDefaultConfig(new LinkedHashMap<>(request.getDefaultConfig()));
        }
        JobTemplateEntity saved = saveTemplate(entity);
        log.info("更新模板: id={}", templateId);
        return saved;
    }

    /**
     * 删除模板，其下任务与执行记录由外键级联删除，相应调度一并移除。
     */
    public void deleteTemplate(Long templateId) {
        getTemplate(templateId);
        List<ScheduledJobEntity> jobs = scheduledJobRepository.findByTemplateId(templateId);
        jobs.forEach(job -> jobScheduler.remove(job.getId()));
        jobTemplateRepository.deleteById(templateId);
        log.info("删除模板: id={}, 级联删除任务 {} 个", templateId, jobs.size());
    }

    // ---------------------------------------------------------------- 定时任务

    public ScheduledJobEntity createJob(JobCreateRequest request) {
        String name = requireName(request.getName());
        if (request.getTemplateId() == null || !jobTemplateRepository.findById(request.getTemplateId()).isPresent()) {
            throw new ValidationException("模板不存在: id=" + request.getTemplateId());
        }
        ScheduledJobEntity entity = new ScheduledJobEntity();
        entity.setName(name);
        entity.setTemplateId(request.getTemplateId());
        entity.setScheduleType(request.getScheduleType() != null ? request.getScheduleType() : ScheduleType.CRON);
        entity.setCronExpression(request.getCronExpression());
        entity.setIntervalSeconds(request.getIntervalSeconds());
        entity.setActive(request.getActive() == null || request.getActive());
        entity.setOverrideConfig(request.getOverrideConfig());

        ScheduledJobEntity saved = scheduledJobRepository.save(entity);
        log.info("创建定时任务: id={}, name={}, type={}", saved.getId(), saved.getName(),
            saved.getScheduleType().getCode());
        jobScheduler.sync(saved);
        return saved;
    }

    public ScheduledJobEntity getJob(Long jobId) {
        return scheduledJobRepository.findById(jobId)
            .orElseThrow(() -> new NotFoundException("定时任务不存在: id=" + jobId));
    }

    public List<ScheduledJobEntity> listJobs(int skip, int limit) {
        checkPage(skip, limit);
        return scheduledJobRepository.findAll(skip, limit);
    }

    public ScheduledJobEntity updateJob(Long jobId, JobUpdateRequest request) {
        ScheduledJobEntity entity = getJob(jobId);
        if (request.getName() != null) {
            entity.setName(requireName(request.getName()));
        }
        if (request.getScheduleType() != null) {
            entity.setScheduleType(request.getScheduleType());
        }
        if (request.getCronExpression() != null) {
            entity.setCronExpression(request.getCronExpression());
        }
        if (request.getIntervalSeconds() != null) {
            entity.setIntervalSeconds(request.getIntervalSeconds());
        }
        if (request.getActive() != null) {
            entity.setActive(request.getActive());
        }
        if (request.getOverrideConfig() != null) {
            entity.setOverrideConfig(request.getOverrideConfig());
        }
        ScheduledJobEntity saved = scheduledJobRepository.save(entity);
        log.info("更新定时任务: id={}, active={}", jobId, saved.isActive());
        jobScheduler.sync(saved);
        return saved;
    }

    public void deleteJob(Long jobId) {
        getJob(jobId);
        jobScheduler.remove(jobId);
        scheduledJobRepository.deleteById(jobId);
        log.info("删除定时任务: id={}", jobId);
    }

    public void triggerNow(Long jobId) {
        if (!jobScheduler.triggerNow(jobId)) {
            throw new NotFoundException("定时任务不存在: id=" + jobId);
        }
    }

    // ---------------------------------------------------------------- 执行记录

    /**
     * 按 id 倒序（最新在前）分页。
     */
    public List<JobRunEntity> listRuns(Long jobId, int skip, int limit) {
        checkPage(skip, limit);
        return jobRunRepository.findByJobId(jobId, skip, limit);
    }

    public JobRunEntity getRun(Long runId) {
        return jobRunRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("执行记录不存在: id=" + runId));
    }

    private JobTemplateEntity saveTemplate(JobTemplateEntity entity) {
        try {
            return jobTemplateRepository.save(entity);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("模板名称已存在: " + entity.getName(), e);
        }
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException("名称不能为空");
        }
        return name.trim();
    }

    private static void checkPage(int skip, int limit) {
        if (skip < 0 || limit <= 0) {
            throw new ValidationException("分页参数非法: skip=" + skip + ", limit=" + limit);
        }
    }
}
