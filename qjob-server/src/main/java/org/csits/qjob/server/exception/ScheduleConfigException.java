package org.csits.qjob.server.exception;

/**
 * 调度配置非法（cron 表达式错误、间隔秒数不合法等）。
 */
public class ScheduleConfigException extends QjobException {

    public ScheduleConfigException(String message) {
        super(message);
    }

    public ScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
