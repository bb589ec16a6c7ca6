package com.bit.wallet.web;

import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * 统一异常转换为 Result
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WalletException.class)
    public Result<Void> handleWalletException(WalletException e) {
        ErrorType type = e.getErrorType();
        if (type == ErrorType.STORAGE_FAILURE || type == ErrorType.ENCRYPTION_FAILED || type == ErrorType.SIGNING_FAILED) {
            log.error("钱包操作失败: {}", e.getMessage(), e);
        } else {
            log.warn("钱包操作被拒绝: {}", e.getMessage());
        }
        return Result.error(type.getCode(), e.getMessage());
    }

    @ExceptionHandler(CompletionException.class)
    public Result<Void> handleCompletionException(CompletionException e) {
        if (e.getCause() instanceof WalletException) {
            return handleWalletException((WalletException) e.getCause());
        }
        log.error("异步任务失败", e);
        return Result.error("异步任务失败");
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public Result<Void> handleRejected(RejectedExecutionException e) {
        log.warn("KDF线程池已满");
        return Result.error("服务繁忙，请稍后重试");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadable(HttpMessageNotReadableException e) {
        return Result.error(ErrorType.INVALID_ARGUMENT.getCode(), "请求体格式错误");
    }
}
