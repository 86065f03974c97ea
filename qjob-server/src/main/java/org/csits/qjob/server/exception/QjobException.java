package org.csits.qjob.server.exception;

/**
 * 业务异常基类，均为非受检异常。
 */
public class QjobException extends RuntimeException {

    public QjobException(String message) {
        super(message);
    }

    public QjobException(String message, Throwable cause) {
        super(message, cause);
    }
}
