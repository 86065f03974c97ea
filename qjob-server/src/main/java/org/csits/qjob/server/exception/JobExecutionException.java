package org.csits.qjob.server.exception;

/**
 * 作业执行期间连接器或查询失败，保留原始异常。
 */
public class JobExecutionException extends QjobException {

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
