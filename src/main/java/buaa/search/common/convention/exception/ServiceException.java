package buaa.search.common.convention.exception;

import buaa.search.common.convention.errorcode.IErrorCode;
import buaa.search.common.convention.errorcode.SearchErrorCode;

import java.util.Optional;

/**
 * 服务端异常
 * 用于表示由服务端内部或外部依赖引起的问题（网络下载失败、向量化服务异常、ES 异常等）
 * HTTP状态码为 5xx，摄取任务遇到此类异常会按重试策略重新调度
 */
public class ServiceException extends AbstractException {

    public ServiceException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ServiceException(String message) {
        this(message, null, SearchErrorCode.SERVICE_ERROR);
    }

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ServiceException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
