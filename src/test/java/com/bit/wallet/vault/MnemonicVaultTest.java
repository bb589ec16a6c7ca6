package com.bit.wallet.vault;

import com.bit.wallet.WalletTestFixtures;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.wallet.EncryptedSecret;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class MnemonicVaultTest {

    private static final String MNEMONIC = WalletTestFixtures.ABANDON_MNEMONIC;
    private static final String PASSWORD = WalletTestFixtures.PASSWORD;

    private final MnemonicVault vault = new MnemonicVault(MnemonicVault.MIN_ITERATIONS);

    @Test
    void roundTrip() {
        long start = System.currentTimeMillis();
        EncryptedSecret encrypted = vault.encrypt(MNEMONIC, PASSWORD);
        log.info("PBKDF2 加密耗时 {}ms", System.currentTimeMillis() - start);
        assertEquals("AES-256-GCM", encrypted.getAlgorithm());
        assertEquals(MnemonicVault.MIN_ITERATIONS, encrypted.getIterations());
        assertEquals(32, Base64.getDecoder().decode(encrypted.getSalt()).length);
        assertEquals(12, Base64.getDecoder().decode(encrypted.getNonce()).length);
        // 明文长度 + 16字节标签，不截断不填充
        assertEquals(MNEMONIC.length() + 16, Base64.getDecoder().decode(encrypted.getCiphertext()).length);
        assertEquals(MNEMONIC, vault.decrypt(encrypted, PASSWORD));
    }

    @Test
    void wrongPasswordFails() {
        EncryptedSecret encrypted = vault.encrypt(MNEMONIC, PASSWORD);
        assertDecryptionFailed(encrypted, "CorrectHorseBatteryStaple?");
    }

    @Test
    void tamperingIsDetected() {
        EncryptedSecret encrypted = vault.encrypt(MNEMONIC, PASSWORD);
        assertDecryptionFailed(withCiphertext(encrypted, flipFirstBit(encrypted.getCiphertext())), PASSWORD);
        assertDecryptionFailed(withSalt(encrypted, flipFirstBit(encrypted.getSalt())), PASSWORD);
        assertDecryptionFailed(withNonce(encrypted, flipFirstBit(encrypted.getNonce())), PASSWORD);
    }

    @Test
    void malformedRecordsFailWithTheSameError() {
        EncryptedSecret base = new EncryptedSecret("AAAA", "AAAA", "AAAAAAAAAAAAAAAA", "AES-256-GCM", 0);
        assertDecryptionFailed(base, PASSWORD);
        EncryptedSecret badAlgorithm = new EncryptedSecret("AAAA", "AAAA", "AAAAAAAAAAAAAAAA", "AES-128-CBC", 600000);
        assertDecryptionFailed(badAlgorithm, PASSWORD);
        EncryptedSecret badBase64 = new EncryptedSecret("***", "AAAA", "AAAAAAAAAAAAAAAA", "AES-256-GCM", 600000);
        assertDecryptionFailed(badBase64, PASSWORD);
        assertDecryptionFailed(null, PASSWORD);
    }

    @Test
    void freshSaltAndNonceEveryTime() {
        EncryptedSecret first = vault.encrypt(MNEMONIC, PASSWORD);
        EncryptedSecret second = vault.encrypt(MNEMONIC, PASSWORD);
        assertNotEquals(first.getSalt(), second.getSalt());
        assertNotEquals(first.getNonce(), second.getNonce());
        assertNotEquals(first.getCiphertext(), second.getCiphertext());
    }

    @Test
    void storedIterationCountIsHonored() {
        MnemonicVault stronger = new MnemonicVault(650_000);
        EncryptedSecret encrypted = stronger.encrypt(MNEMONIC, PASSWORD);
        assertEquals(650_000, encrypted.getIterations());
        // 默认配置的实例按记录中的迭代次数解密
        assertEquals(MNEMONIC, vault.decrypt(encrypted, PASSWORD));
    }

    @Test
    void configuredIterationsBelowFloorAreRaised() {
        assertEquals(MnemonicVault.MIN_ITERATIONS, new MnemonicVault(1000).getIterations());
        assertEquals(MnemonicVault.MAX_ITERATIONS, new MnemonicVault(Integer.MAX_VALUE).getIterations());
    }

    @Test
    void oversizedStoredIterationCountFailsWithoutRunningKdf() {
        EncryptedSecret encrypted = vault.encrypt(MNEMONIC, PASSWORD);
        EncryptedSecret tampered = new EncryptedSecret(encrypted.getCiphertext(), encrypted.getSalt(),
                encrypted.getNonce(), encrypted.getAlgorithm(), Integer.MAX_VALUE);
        long start = System.currentTimeMillis();
        assertDecryptionFailed(tampered, PASSWORD);
        // 正常 PBKDF2 需要数百毫秒，这里应立即失败
        assertTrue(System.currentTimeMillis() - start < 5_000);
    }

    @Test
    void privateKeyBytesRoundTrip() {
        byte[] privateKey = new byte[32];
        privateKey[31] = 7;
        EncryptedSecret encrypted = vault.encryptKey(privateKey, PASSWORD);
        assertEquals(32 + 16, Base64.getDecoder().decode(encrypted.getCiphertext()).length);
        assertArrayEquals(privateKey, vault.decryptKey(encrypted, PASSWORD));
        assertEquals(ErrorType.DECRYPTION_FAILED, assertThrows(WalletException.class,
                () -> vault.decryptKey(encrypted, "wrong-password")).getErrorType());
    }

    private void assertDecryptionFailed(EncryptedSecret encrypted, String password) {
        WalletException e = assertThrows(WalletException.class, () -> vault.decrypt(encrypted, password));
        assertEquals(ErrorType.DECRYPTION_FAILED, e.getErrorType());
        assertNull(e.getCause());
        assertTrue(e.getMessage().contains("密码错误或数据已损坏"));
    }

    private static String flipFirstBit(String base64) {
        byte[] bytes = Base64.getDecoder().decode(base64);
        bytes[0] ^= 0x01;
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static EncryptedSecret withCiphertext(EncryptedSecret e, String ciphertext) {
        return new EncryptedSecret(ciphertext, e.getSalt(), e.getNonce(), e.getAlgorithm(), e.getIterations());
    }

    private static EncryptedSecret withSalt(EncryptedSecret e, String salt) {
        return new EncryptedSecret(e.getCiphertext(), salt, e.getNonce(), e.getAlgorithm(), e.getIterations());
    }

    private static EncryptedSecret withNonce(EncryptedSecret e, String nonce) {
        return new EncryptedSecret(e.getCiphertext(), e.getSalt(), nonce, e.getAlgorithm(), e.getIterations());
    }
}
