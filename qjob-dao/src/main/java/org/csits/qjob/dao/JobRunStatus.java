package org.csits.qjob.dao;

/**
 * 执行记录状态。PENDING/RUNNING 为非终态，SUCCESS/FAILED 为终态且一旦写入不再变化。
 */
public enum JobRunStatus {

    PENDING("pending"),

    RUNNING("running"),

    SUCCESS("success"),

    FAILED("failed");

    private final String code;

    JobRunStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public static JobRunStatus fromCode(String code) {
        for (JobRunStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的执行状态: " + code);
    }
}
