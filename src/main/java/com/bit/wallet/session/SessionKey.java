package com.bit.wallet.session;

import com.bit.wallet.structure.wallet.WalletType;
import com.bit.wallet.util.ByteUtils;
import lombok.Getter;

import java.time.Instant;

/**
 * 解锁会话：只存在于内存，不序列化。close() 立即覆写主密钥。
 * 助记词钱包的主密钥是64字节 BIP-39 种子，私钥导入的钱包直接保存32字节私钥
 */
public final class SessionKey implements AutoCloseable {

    @Getter
    private final String walletId;
    @Getter
    private final WalletType walletType;
    private final byte[] masterKey;
    @Getter
    private final Instant unlockedAt;
    @Getter
    private Instant expiresAt;
    private boolean cleared;

    SessionKey(String walletId, WalletType walletType, byte[] masterKey, Instant unlockedAt, Instant expiresAt) {
        this.walletId = walletId;
        this.walletType = walletType;
        this.masterKey = masterKey;
        this.unlockedAt = unlockedAt;
        this.expiresAt = expiresAt;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void extendTo(Instant newExpiry) {
        this.expiresAt = newExpiry;
    }

    byte[] masterKey() {
        if (cleared) {
            throw new IllegalStateException("session key already cleared");
        }
        return masterKey;
    }

    @Override
    public void close() {
        ByteUtils.wipe(masterKey);
        cleared = true;
    }

    @Override
    public String toString() {
        return "SessionKey{walletId=" + walletId + ", expiresAt=" + expiresAt + "}";
    }
}
