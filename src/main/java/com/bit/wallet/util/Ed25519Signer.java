package com.bit.wallet.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

@Slf4j
public class Ed25519Signer {
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    // Ed25519核心密钥长度（公钥/私钥均为32字节）
    public static final int CORE_KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    // X.509公钥固定头部（用于补全32字节核心公钥）
    private static final byte[] X509_PUBLIC_HEADER = new byte[]{
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };
    // PKCS#8私钥固定头部（用于补全32字节核心私钥）
    private static final byte[] PKCS8_PRIVATE_HEADER = new byte[]{
            0x30, 0x2e, 0x02, 0x01, 0x00, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x04, 0x22, 0x04, 0x20
    };

    /**
     * 由32字节私钥种子计算32字节公钥
     */
    public static byte[] derivePublicKey(byte[] privateKey) {
        checkLength(privateKey, "私钥");
        return new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    }

    /**
     * Ed25519 签名：内部自动做 SHA-512，调用方直接传原始消息
     * @return 64字节签名
     */
    public static byte[] sign(byte[] privateKey, byte[] data) {
        checkLength(privateKey, "私钥");
        byte[] pkcs8 = ByteUtils.concat(PKCS8_PRIVATE_HEADER, privateKey);
        try {
            PrivateKey key = keyFactory().generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
            Signature signer = signature();
            signer.initSign(key);
            signer.update(data);
            return signer.sign();
        } catch (Exception e) {
            throw new IllegalStateException("Ed25519 签名失败", e);
        } finally {
            ByteUtils.wipe(pkcs8);
        }
    }

    /**
     * Ed25519 验签
     * @param publicKey 32字节原始公钥
     */
    public static boolean verify(byte[] publicKey, byte[] data, byte[] sig) {
        try {
            checkLength(publicKey, "公钥");
            PublicKey key = keyFactory().generatePublic(new X509EncodedKeySpec(ByteUtils.concat(X509_PUBLIC_HEADER, publicKey)));
            Signature verifier = signature();
            verifier.initVerify(key);
            verifier.update(data);
            return verifier.verify(sig);
        } catch (Exception e) {
            log.error("Ed25519 验签异常", e);
            return false;
        }
    }

    // 优先 JDK 原生，降级 BouncyCastle
    private static Signature signature() throws Exception {
        try {
            return Signature.getInstance("Ed25519");
        } catch (NoSuchAlgorithmException e) {
            return Signature.getInstance("Ed25519", BouncyCastleProvider.PROVIDER_NAME);
        }
    }

    private static KeyFactory keyFactory() throws Exception {
        try {
            return KeyFactory.getInstance("Ed25519");
        } catch (NoSuchAlgorithmException e) {
            return KeyFactory.getInstance("Ed25519", BouncyCastleProvider.PROVIDER_NAME);
        }
    }

    private static void checkLength(byte[] key, String name) {
        if (key == null || key.length != CORE_KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519" + name + "必须为32字节");
        }
    }
}
