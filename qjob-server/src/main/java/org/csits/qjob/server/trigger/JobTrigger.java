package org.csits.qjob.server.trigger;

import java.time.Instant;

/**
 * 触发规则：给定一个时刻，计算严格晚于它的下一次触发时刻。
 */
public interface JobTrigger {

    /**
     * @return 下一次触发时刻，没有后续触发时返回 null
     */
    Instant nextFireTime(Instant after);

    String describe();
}
