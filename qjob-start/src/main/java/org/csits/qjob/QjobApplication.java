package org.csits.qjob;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.JobRunEntity;
import org.csits.qjob.server.scheduler.JobScheduler;
import org.csits.qjob.server.service.ExecutionCoordinator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类。默认以常驻模式启动调度器；指定 jobId 时只执行一次该任务后退出。
 *
 * 示例：
 *  java -jar qjob-start.jar
 *  java -jar qjob-start.jar --jobId=12
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.qjob")
@RequiredArgsConstructor
public class QjobApplication implements CommandLineRunner {

    private final JobScheduler jobScheduler;
    private final ExecutionCoordinator executionCoordinator;

    @Value("${qjob.scheduler.auto-start:true}")
    private boolean autoStart = true;

    public static void main(String[] args) {
        SpringApplication.run(QjobApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        String jobId = null;
        for (String arg : args) {
            if (arg.startsWith("--jobId=")) {
                jobId = arg.substring("--jobId=".length());
            }
        }
        if (jobId == null || jobId.isEmpty()) {
            if (autoStart) {
                log.info("未指定 jobId，以常驻模式启动调度器");
                jobScheduler.start();
            } else {
                log.info("qjob.scheduler.auto-start=false，调度器未启动");
            }
            return;
        }

        Long id;
        try {
            id = Long.valueOf(jobId.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("jobId 必须为整数: " + jobId, e);
        }
        JobRunEntity run = executionCoordinator.execute(id);
        if (run == null) {
            log.warn("任务 {} 未生成执行记录", id);
        } else {
            log.info("任务 {} 执行完成: runId={}, status={}, rows={}, error={}",
                id, run.getId(), run.getStatus().getCode(), run.getRowsAffected(), run.getError());
        }
    }
}
