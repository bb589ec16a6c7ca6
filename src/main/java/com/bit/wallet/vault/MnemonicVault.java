package com.bit.wallet.vault;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.wallet.EncryptedSecret;
import com.bit.wallet.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;

/**
 * 助记词/私钥加密保管：PBKDF2-HMAC-SHA256 派生密钥 + AES-256-GCM
 * 每次加密使用新的随机盐和随机 nonce，迭代次数随密文保存
 */
@Slf4j
@Component
public class MnemonicVault {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int MIN_ITERATIONS = 600_000;
    public static final int MAX_ITERATIONS = 10_000_000;
    private static final int SALT_LENGTH = 32;
    private static final int KEY_LENGTH = 32; // AES-256
    private static final int GCM_IV_LENGTH = 12; // GCM推荐IV长度12字节
    private static final int GCM_TAG_LENGTH = 128; // 认证标签长度128位
    // 解密失败一律返回同一信息，不区分密码错误和数据损坏
    private static final String DECRYPTION_FAILED_MESSAGE = "密码错误或数据已损坏";

    private static final ThreadLocal<SecureRandom> SECURE_RANDOM = ThreadLocal.withInitial(SecureRandom::new);

    private final int iterations;

    @Autowired
    public MnemonicVault(WalletProperties properties) {
        this(properties.getKdf().getIterations());
    }

    public MnemonicVault(int configuredIterations) {
        if (configuredIterations < MIN_ITERATIONS) {
            log.warn("配置的PBKDF2迭代次数 {} 低于下限，按 {} 处理", configuredIterations, MIN_ITERATIONS);
            this.iterations = MIN_ITERATIONS;
        } else if (configuredIterations > MAX_ITERATIONS) {
            log.warn("配置的PBKDF2迭代次数 {} 超过上限，按 {} 处理", configuredIterations, MAX_ITERATIONS);
            this.iterations = MAX_ITERATIONS;
        } else {
            this.iterations = configuredIterations;
        }
    }

    public int getIterations() {
        return iterations;
    }

    public EncryptedSecret encrypt(String mnemonic, String password) {
        if (mnemonic == null) {
            throw new WalletException(ErrorType.ENCRYPTION_FAILED, "助记词或密码为空");
        }
        byte[] plaintext = mnemonic.getBytes(StandardCharsets.UTF_8);
        try {
            return seal(plaintext, password);
        } finally {
            ByteUtils.wipe(plaintext);
        }
    }

    /**
     * 加密原始私钥字节，调用方仍负责清零自己的副本
     */
    public EncryptedSecret encryptKey(byte[] privateKey, String password) {
        if (privateKey == null || privateKey.length == 0) {
            throw new WalletException(ErrorType.ENCRYPTION_FAILED, "私钥或密码为空");
        }
        return seal(privateKey, password);
    }

    /**
     * 使用记录中保存的盐、nonce 和迭代次数解密。任何失败都抛出同一个 DECRYPTION_FAILED，不附带原因
     */
    public String decrypt(EncryptedSecret encrypted, String password) {
        byte[] plaintext = open(encrypted, password);
        try {
            return strictUtf8(plaintext);
        } catch (CharacterCodingException e) {
            log.warn("助记词解密失败");
            throw decryptionFailed();
        } finally {
            ByteUtils.wipe(plaintext);
        }
    }

    /**
     * 返回的私钥由调用方清零
     */
    public byte[] decryptKey(EncryptedSecret encrypted, String password) {
        return open(encrypted, password);
    }

    private EncryptedSecret seal(byte[] plaintext, String password) {
        if (password == null) {
            throw new WalletException(ErrorType.ENCRYPTION_FAILED, "密码为空");
        }
        SecureRandom random = SECURE_RANDOM.get();
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        byte[] nonce = new byte[GCM_IV_LENGTH];
        random.nextBytes(nonce);

        byte[] key = deriveKey(password, salt, iterations);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding", BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            // 输出为 密文 + 16字节认证标签
            byte[] ciphertext = cipher.doFinal(plaintext);
            Base64.Encoder encoder = Base64.getEncoder();
            return new EncryptedSecret(
                    encoder.encodeToString(ciphertext),
                    encoder.encodeToString(salt),
                    encoder.encodeToString(nonce),
                    EncryptedSecret.ALGORITHM,
                    iterations);
        } catch (Exception e) {
            throw new WalletException(ErrorType.ENCRYPTION_FAILED, "AES-GCM 加密失败", e);
        } finally {
            ByteUtils.wipe(key);
        }
    }

    private byte[] open(EncryptedSecret encrypted, String password) {
        byte[] key = null;
        try {
            // 迭代次数来自存储，超出上限视为篡改，避免 KDF 线程被长时间占用
            if (encrypted == null || password == null
                    || !EncryptedSecret.ALGORITHM.equals(encrypted.getAlgorithm())
                    || encrypted.getIterations() <= 0
                    || encrypted.getIterations() > MAX_ITERATIONS) {
                throw decryptionFailed();
            }
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] ciphertext = decoder.decode(encrypted.getCiphertext());
            byte[] salt = decoder.decode(encrypted.getSalt());
            byte[] nonce = decoder.decode(encrypted.getNonce());
            if (nonce.length != GCM_IV_LENGTH || salt.length == 0) {
                throw decryptionFailed();
            }
            key = deriveKey(password, salt, encrypted.getIterations());
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding", BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
            return cipher.doFinal(ciphertext);
        } catch (WalletException e) {
            throw e;
        } catch (Exception e) {
            // 不记录异常细节，避免泄露是哪一步失败
            log.warn("秘密解密失败");
            throw decryptionFailed();
        } finally {
            ByteUtils.wipe(key);
        }
    }

    private static byte[] deriveKey(String password, byte[] salt, int iterations) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password.toCharArray());
        try {
            generator.init(passwordBytes, salt, iterations);
            KeyParameter parameter = (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH * 8);
            return parameter.getKey();
        } finally {
            ByteUtils.wipe(passwordBytes);
        }
    }

    private static String strictUtf8(byte[] bytes) throws CharacterCodingException {
        CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes));
        return chars.toString();
    }

    private static WalletException decryptionFailed() {
        return new WalletException(ErrorType.DECRYPTION_FAILED, DECRYPTION_FAILED_MESSAGE);
    }
}
