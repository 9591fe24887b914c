package com.community.moderation.exception;

import com.community.moderation.dto.CommonResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * 将异常统一转换为 CommonResponse 信封
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<CommonResponse<Void>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("存储不可用: {}", e.getMessage(), e.getCause());
        return ResponseEntity.status(e.getStatus())
                .body(CommonResponse.unavailable(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(ModerationException.class)
    public ResponseEntity<CommonResponse<Void>> handleModeration(ModerationException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("审核请求失败 [{}]: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("请求被拒绝 [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus())
                .body(CommonResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommonResponse<Void>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(CommonResponse.error("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommonResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        // 枚举解析失败时，ValidationException 被 Jackson 包装在 cause 链中
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ValidationException) {
                return ResponseEntity.badRequest()
                        .body(CommonResponse.error("VALIDATION_ERROR", cause.getMessage()));
            }
            cause = cause.getCause();
        }
        return ResponseEntity.badRequest().body(CommonResponse.error("VALIDATION_ERROR", "Malformed request body"));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadParameter(Exception e) {
        return ResponseEntity.badRequest().body(CommonResponse.error("VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<CommonResponse<Void>> handleDataAccess(Exception e) {
        log.error("数据库访问失败", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(CommonResponse.unavailable("STORE_UNAVAILABLE", "Moderation store is temporarily unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleUnexpected(Exception e) {
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error("INTERNAL_ERROR", "Internal server error"));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
