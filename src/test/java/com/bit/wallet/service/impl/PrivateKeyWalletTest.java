package com.bit.wallet.service.impl;

import com.bit.wallet.WalletTestFixtures;
import com.bit.wallet.chain.Chain;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.structure.wallet.WalletRecord;
import com.bit.wallet.structure.wallet.WalletType;
import com.bit.wallet.util.ByteUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.Wallet;
import org.web3j.crypto.WalletFile;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static com.bit.wallet.WalletTestFixtures.ABANDON_MNEMONIC;
import static com.bit.wallet.WalletTestFixtures.PASSWORD;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class PrivateKeyWalletTest {

    private static final String PRIVATE_KEY = "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01f3f362318";
    private static final String ADDRESS = "0x2c7536e3605d9c16a7a3d7b1898e529396a65c23";
    private static final String KEYSTORE_PASSWORD = "keystore-password";

    private final WalletTestFixtures fixtures = new WalletTestFixtures();
    private final WalletServiceImpl service = fixtures.service;

    @AfterEach
    void tearDown() {
        fixtures.shutdown();
    }

    @Test
    void importedKeyHasEvmAddressesOnly() {
        WalletRecord record = service.importPrivateKey("hot", PRIVATE_KEY, PASSWORD);
        log.info("导入私钥钱包 {}，地址 {}", record.getId(), record.getAddresses());

        assertEquals(WalletType.PRIVATE_KEY, record.getWalletType());
        for (Chain chain : List.of(Chain.ETH, Chain.BSC, Chain.POLYGON)) {
            assertEquals(ADDRESS, record.address(chain));
        }
        assertEquals(3, record.getAddresses().size());
        assertNull(record.address(Chain.BTC));
        assertTrue(record.getDerivationPaths().isEmpty());
        assertNull(record.getEncryptedMnemonic());
        assertNotNull(record.getEncryptedPrivateKey());
        assertEquals(WalletRecord.CURRENT_VERSION, record.getVersion());

        assertTrue(service.isUnlocked());
        assertEquals(WalletType.PRIVATE_KEY, fixtures.sessionManager.withSessionKey((type, key) -> type));
    }

    @Test
    void prefixCaseAndWhitespaceGiveSameWallet() {
        String id = service.importPrivateKey("a", PRIVATE_KEY, PASSWORD).getId();
        WalletRecord again = service.importPrivateKey("b", "  0x" + PRIVATE_KEY.toUpperCase() + "\n", PASSWORD);
        assertEquals(id, again.getId());
        assertEquals(1, service.listWallets().size());
    }

    @Test
    void malformedOrOutOfRangeKeysAreRejected() {
        String order = "fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141";
        for (String bad : Arrays.asList(null, "", "abcd", PRIVATE_KEY + "00", "zz" + PRIVATE_KEY.substring(2),
                "0".repeat(64), order, "f".repeat(64))) {
            WalletException e = assertThrows(WalletException.class, () -> service.importPrivateKey("bad", bad, PASSWORD));
            assertEquals(ErrorType.INVALID_ARGUMENT, e.getErrorType(), String.valueOf(bad));
        }
        assertTrue(service.listWallets().isEmpty());
        assertFalse(service.isUnlocked());
    }

    @Test
    void signingIsLimitedToEvmChains() {
        service.importPrivateKey("hot", PRIVATE_KEY, PASSWORD);
        TransactionParams params = TransactionParams.builder()
                .nonce(BigInteger.ONE)
                .gasPrice(BigInteger.TEN)
                .to("0x3535353535353535353535353535353535353535")
                .build();
        assertTrue(service.signTransaction("POLYGON", params).length > 0);

        byte[] signature = service.signMessage("ETH", "hello wallet");
        Sign.SignatureData data = new Sign.SignatureData(signature[64],
                Arrays.copyOfRange(signature, 0, 32), Arrays.copyOfRange(signature, 32, 64));
        assertDoesNotThrow(() -> assertEquals(ADDRESS, "0x" + Keys.getAddress(
                Sign.signedPrefixedMessageToKey("hello wallet".getBytes(StandardCharsets.UTF_8), data))));

        assertEquals(ErrorType.UNSUPPORTED_CHAIN, assertThrows(WalletException.class,
                () -> service.signMessage("SOL", "hello wallet")).getErrorType());
    }

    @Test
    void lockUnlockChangePasswordAndNoMnemonic() {
        String id = service.importPrivateKey("hot", PRIVATE_KEY, PASSWORD).getId();
        service.lock();
        assertEquals(ErrorType.DECRYPTION_FAILED, assertThrows(WalletException.class,
                () -> service.unlock(id, "not-the-password")).getErrorType());
        assertTrue(service.unlock(id, PASSWORD).isUnlocked());
        assertEquals(WalletType.PRIVATE_KEY, fixtures.sessionManager.withSessionKey((type, key) -> type));
        assertEquals(PRIVATE_KEY, fixtures.sessionManager.withSessionKey((type, key) -> ByteUtils.bytesToHex(key)));

        String newPassword = "another-strong-password";
        service.changePassword(id, PASSWORD, newPassword);
        service.lock();
        assertEquals(ErrorType.DECRYPTION_FAILED, assertThrows(WalletException.class,
                () -> service.unlock(id, PASSWORD)).getErrorType());
        assertTrue(service.unlock(id, newPassword).isUnlocked());

        assertEquals(ErrorType.INVALID_ARGUMENT, assertThrows(WalletException.class,
                () -> service.revealMnemonic(id, newPassword)).getErrorType());
    }

    @Test
    void importWhileAnotherWalletUnlockedConflicts() {
        service.recoverWallet(ABANDON_MNEMONIC, "first", PASSWORD);
        assertEquals(ErrorType.SESSION_CONFLICT, assertThrows(WalletException.class,
                () -> service.importPrivateKey("hot", PRIVATE_KEY, PASSWORD)).getErrorType());
        assertEquals(1, service.listWallets().size());
    }

    @Test
    void keystoreImportMatchesRawKeyImport() throws Exception {
        String keystore = keystore(KEYSTORE_PASSWORD);
        WalletRecord fromKeystore = service.importKeystore("ks", keystore, KEYSTORE_PASSWORD, PASSWORD);
        assertEquals(ADDRESS, fromKeystore.address(Chain.ETH));
        assertEquals(WalletType.PRIVATE_KEY, fromKeystore.getWalletType());

        service.lock();
        WalletRecord fromKey = service.importPrivateKey("raw", PRIVATE_KEY, PASSWORD);
        assertEquals(fromKeystore.getId(), fromKey.getId());
        assertEquals(fromKeystore.getCreatedAt(), fromKey.getCreatedAt());
    }

    @Test
    void keystoreFailuresLeaveNothingBehind() throws Exception {
        String keystore = keystore(KEYSTORE_PASSWORD);
        assertEquals(ErrorType.DECRYPTION_FAILED, assertThrows(WalletException.class,
                () -> service.importKeystore("ks", keystore, "wrong-password", PASSWORD)).getErrorType());
        assertEquals(ErrorType.INVALID_ARGUMENT, assertThrows(WalletException.class,
                () -> service.importKeystore("ks", "{not json", KEYSTORE_PASSWORD, PASSWORD)).getErrorType());
        assertEquals(ErrorType.INVALID_ARGUMENT, assertThrows(WalletException.class,
                () -> service.importKeystore("ks", keystore.replace("\"version\":3", "\"version\":1"),
                        KEYSTORE_PASSWORD, PASSWORD)).getErrorType());
        // 本地密码不合格时不解密 Keystore
        assertEquals(ErrorType.INVALID_ARGUMENT, assertThrows(WalletException.class,
                () -> service.importKeystore("ks", keystore, KEYSTORE_PASSWORD, "short")).getErrorType());
        assertTrue(service.listWallets().isEmpty());
        assertFalse(service.isUnlocked());
    }

    @Test
    void asyncImportRunsOnKdfPool() throws Exception {
        WalletRecord record = service.importPrivateKeyAsync("async", PRIVATE_KEY, PASSWORD).get();
        assertEquals(ADDRESS, record.address(Chain.BSC));
        service.lock();
        WalletRecord again = service.importKeystoreAsync("async", keystore(KEYSTORE_PASSWORD), KEYSTORE_PASSWORD, PASSWORD).get();
        assertEquals(record.getId(), again.getId());
    }

    static String keystore(String password) throws Exception {
        WalletFile walletFile = Wallet.createLight(password, ECKeyPair.create(Numeric.toBigInt(PRIVATE_KEY)));
        return new ObjectMapper().writeValueAsString(walletFile);
    }
}
