package org.csits.qjob.server.exception;

/**
 * 按 id 查找的对象不存在。
 */
public class NotFoundException extends QjobException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
