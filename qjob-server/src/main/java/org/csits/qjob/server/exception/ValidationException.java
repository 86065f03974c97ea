package org.csits.qjob.server.exception;

/**
 * 参数或配置校验失败。
 */
public class ValidationException extends QjobException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
