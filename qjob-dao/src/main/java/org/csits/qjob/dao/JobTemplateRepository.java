package org.csits.qjob.dao;

import java.util.List;
import java.util.Optional;

/**
 * 作业模板仓储，读写 job_templates。
 */
public interface JobTemplateRepository {

    /**
     * 新增或更新（id 为空时新增）
     */
    JobTemplateEntity save(JobTemplateEntity entity);

    Optional<JobTemplateEntity> findById(Long id);

    Optional<JobTemplateEntity> findByName(String name);

    List<JobTemplateEntity> findAll(int skip, int limit);

    boolean existsByName(String name);

    /**
     * 删除模板，引用它的定时任务及其执行记录由外键级联删除。
     *
     * @return 是否删除了记录
     */
    boolean deleteById(Long id);
}
