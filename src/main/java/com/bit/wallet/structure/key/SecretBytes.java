package com.bit.wallet.structure.key;

import com.bit.wallet.util.ByteUtils;

/**
 * 敏感字节缓冲（种子、私钥）。close() 后内容被覆写为0，再访问直接报错
 */
public final class SecretBytes implements AutoCloseable {

    private final byte[] value;
    private volatile boolean closed;

    private SecretBytes(byte[] value) {
        this.value = value;
    }

    /**
     * 接管数组所有权，调用方不应再持有原引用
     */
    public static SecretBytes wrap(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("secret is null");
        }
        return new SecretBytes(value);
    }

    /**
     * 返回内部数组（不复制），只能在本对象 close 之前使用
     */
    public byte[] bytes() {
        if (closed) {
            throw new IllegalStateException("secret already wiped");
        }
        return value;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        ByteUtils.wipe(value);
        closed = true;
    }

    @Override
    public String toString() {
        return "SecretBytes[" + value.length + " bytes]";
    }
}
