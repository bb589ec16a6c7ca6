package com.bit.wallet.exception;

public enum ErrorType {
    INVALID_MNEMONIC(4001, "助记词无效（单词不在词表/校验和错误/长度非法）"),
    ENCRYPTION_FAILED(5001, "加密失败"),
    DECRYPTION_FAILED(4011, "解密失败"),
    WALLET_LOCKED(4012, "钱包已锁定"),
    WALLET_NOT_FOUND(4041, "钱包不存在"),
    UNSUPPORTED_CHAIN(4002, "不支持的链"),
    STORAGE_FAILURE(5002, "存储读写失败"),
    INVALID_ARGUMENT(4003, "参数非法"),
    SESSION_CONFLICT(4091, "已有其他钱包处于解锁状态"),
    SIGNING_FAILED(5003, "交易签名失败");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
