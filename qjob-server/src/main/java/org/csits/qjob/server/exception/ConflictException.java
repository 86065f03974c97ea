package org.csits.qjob.server.exception;

/**
 * 与已有数据冲突，例如模板名称重复。
 */
public class ConflictException extends QjobException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
