package com.bit.wallet.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.Security;

@Slf4j
public class Sha {
    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    // ThreadLocal存储每个线程独立的SHA-256实例
    private static final ThreadLocal<MessageDigest> SHA256_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME);
        } catch (Exception e) {
            throw new RuntimeException("创建线程本地SHA-256实例失败", e);
        }
    });

    // 以太坊使用原始 Keccak-256（非 NIST SHA3-256）
    private static final ThreadLocal<MessageDigest> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Keccak.Digest256::new);

    public static byte[] applySHA256(byte[] input) {
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(input);
    }

    public static byte[] applyKeccak256(byte[] input) {
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(input);
    }
}
