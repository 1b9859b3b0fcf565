package buaa.search.common.convention.exception;

import buaa.search.common.convention.errorcode.IErrorCode;
import buaa.search.common.convention.errorcode.SearchErrorCode;

import java.util.Optional;

/**
 * 客户端异常
 * 用于表示由调用方输入引起的错误（参数校验失败、内容无法解码、向量维度不符等）
 * HTTP状态码为 4xx
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, SearchErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
