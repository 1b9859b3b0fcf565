package buaa.search.common.web;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.AbstractException;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.convention.result.Result;
import buaa.search.common.convention.result.Results;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * 全局异常处理器
 * 业务层只抛出带错误码的异常，HTTP 状态码仅在此处决定：
 * 客户端异常映射为 400，其余映射为 500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理参数绑定与校验异常（Bean Validation）
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Result<Void>> handleBindException(BindException ex, HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null
                ? firstError.getField() + ": " + firstError.getDefaultMessage()
                : "参数校验失败";

        log.warn("[{}] {} - 参数校验失败: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                errorMessage);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Results.failure(SearchErrorCode.PARAM_INVALID.code(), errorMessage));
    }

    /**
     * 处理缺失的请求参数或文件
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Result<Void>> handleMissingParameter(Exception ex, HttpServletRequest request) {
        log.warn("[{}] {} - 缺少参数: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Results.failure(SearchErrorCode.PARAM_EMPTY.code(), ex.getMessage()));
    }

    /**
     * 处理参数类型不匹配，例如未知的任务状态
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                           HttpServletRequest request) {
        String errorMessage = ex.getName() + ": 参数格式不正确";
        log.warn("[{}] {} - {}", request.getMethod(), getFullRequestUrl(request), errorMessage);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Results.failure(SearchErrorCode.PARAM_INVALID.code(), errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                             HttpServletRequest request) {
        log.warn("[{}] {} - 请求体无法解析: {}", request.getMethod(), getFullRequestUrl(request), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Results.failure(SearchErrorCode.PARAM_INVALID.code(), "请求体格式不正确"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Result<Void>> handleUploadTooLarge(MaxUploadSizeExceededException ex,
                                                             HttpServletRequest request) {
        log.warn("[{}] {} - 上传文件过大", request.getMethod(), getFullRequestUrl(request));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Results.failure(SearchErrorCode.FILE_SIZE_EXCEEDED));
    }

    /**
     * 处理客户端异常（参数错误、内容无法解码等）
     */
    @ExceptionHandler(ClientException.class)
    public ResponseEntity<Result<Void>> handleClientException(ClientException ex, HttpServletRequest request) {
        log.warn("[{}] {} - 客户端错误: {} ({})",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getErrorMessage(),
                ex.getErrorCode());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Results.failure(ex));
    }

    /**
     * 处理服务端业务异常
     */
    @ExceptionHandler(AbstractException.class)
    public ResponseEntity<Result<Void>> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        // 如果有原始异常，打印完整堆栈；否则只打印错误信息
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Results.failure(ex));
    }

    /**
     * 处理未捕获的异常（兜底处理）
     */
    @ExceptionHandler(Throwable.class)
    public ResponseEntity<Result<Void>> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        // 返回通用服务端错误，避免暴露内部异常细节
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Results.failure(SearchErrorCode.SERVICE_ERROR));
    }

    /**
     * 获取完整请求URL（包含查询参数）
     */
    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
