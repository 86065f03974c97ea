package org.csits.qjob.dao;

/**
 * 调度类型，对应 scheduled_jobs.schedule_type。
 */
public enum ScheduleType {

    CRON("cron"),

    INTERVAL("interval");

    private final String code;

    ScheduleType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ScheduleType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ScheduleType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的调度类型: " + code);
    }
}
