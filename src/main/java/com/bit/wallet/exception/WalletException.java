package com.bit.wallet.exception;

/**
 * 钱包核心统一异常：按 {@link ErrorType} 分类，调用方据此区分处理
 */
public class WalletException extends RuntimeException {

    private final ErrorType errorType;

    public WalletException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    // 带cause（链式追踪）
    public WalletException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static WalletException locked() {
        return new WalletException(ErrorType.WALLET_LOCKED, "请先解锁钱包");
    }

    public static WalletException notFound(String walletId) {
        return new WalletException(ErrorType.WALLET_NOT_FOUND, walletId);
    }

    public static WalletException invalidArgument(String message) {
        return new WalletException(ErrorType.INVALID_ARGUMENT, message);
    }
}
