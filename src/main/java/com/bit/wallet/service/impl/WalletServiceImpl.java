package com.bit.wallet.service.impl;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.config.WalletConfig;
import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.derive.MultiChainDeriver;
import com.bit.wallet.derive.Secp256k1KeyDeriver;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.mnemonic.MnemonicGenerator;
import com.bit.wallet.service.WalletService;
import com.bit.wallet.session.SessionManager;
import com.bit.wallet.signer.SigningDispatcher;
import com.bit.wallet.store.WalletStore;
import com.bit.wallet.structure.dto.CreateWalletResult;
import com.bit.wallet.structure.dto.SessionStatus;
import com.bit.wallet.structure.key.SecretBytes;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.structure.wallet.EncryptedSecret;
import com.bit.wallet.structure.wallet.WalletRecord;
import com.bit.wallet.structure.wallet.WalletType;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.WalletIdGenerator;
import com.bit.wallet.vault.KeystoreDecoder;
import com.bit.wallet.vault.MnemonicVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * 钱包核心流程：创建/恢复/导入私钥 → 派生 → 加密 → 持久化 → 开启会话；解锁；签名；元数据维护
 */
@Slf4j
@Service
public class WalletServiceImpl implements WalletService {

    public static final int MAX_NAME_LENGTH = 64;

    private final MnemonicGenerator mnemonicGenerator;
    private final MultiChainDeriver deriver;
    private final MnemonicVault vault;
    private final KeystoreDecoder keystoreDecoder;
    private final WalletStore store;
    private final SessionManager sessionManager;
    private final SigningDispatcher signingDispatcher;
    private final ExecutorService kdfExecutor;
    private final Clock clock;
    private final int passwordMinLength;

    @Autowired
    public WalletServiceImpl(MnemonicGenerator mnemonicGenerator,
                             MultiChainDeriver deriver,
                             MnemonicVault vault,
                             KeystoreDecoder keystoreDecoder,
                             WalletStore store,
                             SessionManager sessionManager,
                             SigningDispatcher signingDispatcher,
                             @Qualifier(WalletConfig.KDF_EXECUTOR) ExecutorService kdfExecutor,
                             Clock clock,
                             WalletProperties properties) {
        this.mnemonicGenerator = mnemonicGenerator;
        this.deriver = deriver;
        this.vault = vault;
        this.keystoreDecoder = keystoreDecoder;
        this.store = store;
        this.sessionManager = sessionManager;
        this.signingDispatcher = signingDispatcher;
        this.kdfExecutor = kdfExecutor;
        this.clock = clock;
        this.passwordMinLength = properties.getPassword().getMinLength();
    }

    @Override
    public CreateWalletResult createWallet(String name, String password) {
        String walletName = checkName(name);
        checkPassword(password);
        List<String> words = mnemonicGenerator.generate();
        WalletRecord record = persist(words, walletName, password);
        log.info("新钱包已创建: {} ({})", record.getId(), walletName);
        return new CreateWalletResult(MnemonicGenerator.join(words), record);
    }

    @Override
    public CreateWalletResult recoverWallet(String mnemonic, String name, String password) {
        String walletName = checkName(name);
        checkPassword(password);
        // 非法助记词在任何派生之前失败
        List<String> words = mnemonicGenerator.parse(mnemonic);
        WalletRecord record = persist(words, walletName, password);
        log.info("钱包已恢复: {} ({})", record.getId(), walletName);
        return new CreateWalletResult(MnemonicGenerator.join(words), record);
    }

    @Override
    public WalletRecord importPrivateKey(String name, String privateKeyHex, String password) {
        String walletName = checkName(name);
        checkPassword(password);
        try (SecretBytes privateKey = parsePrivateKey(privateKeyHex)) {
            WalletRecord record = persistPrivateKey(privateKey.bytes(), walletName, password);
            log.info("私钥钱包已导入: {} ({})", record.getId(), walletName);
            return record;
        }
    }

    @Override
    public WalletRecord importKeystore(String name, String keystoreJson, String keystorePassword, String password) {
        String walletName = checkName(name);
        checkPassword(password);
        try (SecretBytes privateKey = keystoreDecoder.decrypt(keystoreJson, keystorePassword)) {
            if (!Secp256k1KeyDeriver.isValidPrivateKey(privateKey.bytes())) {
                throw WalletException.invalidArgument("Keystore 中的私钥超出 secp256k1 取值范围");
            }
            WalletRecord record = persistPrivateKey(privateKey.bytes(), walletName, password);
            log.info("Keystore 钱包已导入: {} ({})", record.getId(), walletName);
            return record;
        }
    }

    /**
     * 派生地址 → 计算ID → 冲突检查 → 加密 → 保存 → 开启会话
     */
    private WalletRecord persist(List<String> words, String walletName, String password) {
        try (SecretBytes seed = mnemonicGenerator.toSeed(words)) {
            MultiChainDeriver.DerivedAddresses derived = deriver.deriveAll(seed.bytes());
            String walletId = WalletIdGenerator.generate(derived.getAddresses());
            sessionManager.checkStartAllowed(walletId);

            EncryptedSecret encrypted = vault.encrypt(MnemonicGenerator.join(words), password);

            WalletRecord record = new WalletRecord();
            record.setId(walletId);
            record.setName(walletName);
            record.setWalletType(WalletType.MNEMONIC);
            record.setEncryptedMnemonic(encrypted);
            record.setAddresses(byName(derived.getAddresses()));
            record.setPublicKeys(byName(derived.getPublicKeys()));
            record.setDerivationPaths(byName(derived.getPaths()));
            record.setVersion(WalletRecord.CURRENT_VERSION);
            keepCreatedAt(record);
            store.save(record);
            sessionManager.start(walletId, WalletType.MNEMONIC, seed.bytes());
            return record;
        }
    }

    /**
     * 私钥钱包只有 EVM 地址，没有派生路径；会话中保存的是原始私钥
     */
    private WalletRecord persistPrivateKey(byte[] privateKey, String walletName, String password) {
        MultiChainDeriver.DerivedAddresses derived = deriver.fromPrivateKey(privateKey);
        String walletId = WalletIdGenerator.generate(derived.getAddresses());
        sessionManager.checkStartAllowed(walletId);

        EncryptedSecret encrypted = vault.encryptKey(privateKey, password);

        WalletRecord record = new WalletRecord();
        record.setId(walletId);
        record.setName(walletName);
        record.setWalletType(WalletType.PRIVATE_KEY);
        record.setEncryptedPrivateKey(encrypted);
        record.setAddresses(byName(derived.getAddresses()));
        record.setPublicKeys(byName(derived.getPublicKeys()));
        record.setDerivationPaths(new TreeMap<>());
        record.setVersion(WalletRecord.CURRENT_VERSION);
        keepCreatedAt(record);
        store.save(record);
        sessionManager.start(walletId, WalletType.PRIVATE_KEY, privateKey);
        return record;
    }

    // 同一秘密重复导入：保留原创建时间
    private void keepCreatedAt(WalletRecord record) {
        Optional<WalletRecord> existing = store.find(record.getId());
        if (existing.isPresent()) {
            record.setCreatedAt(existing.get().getCreatedAt());
            log.info("钱包 {} 已存在，覆盖保存并保留创建时间", record.getId());
        } else {
            record.setCreatedAt(clock.millis());
        }
    }

    @Override
    public SessionStatus unlock(String walletId, String password) {
        if (password == null) {
            throw WalletException.invalidArgument("密码为空");
        }
        sessionManager.checkStartAllowed(walletId);
        WalletRecord record = store.load(walletId);
        if (record.getWalletType() == WalletType.PRIVATE_KEY) {
            try (SecretBytes privateKey = SecretBytes.wrap(vault.decryptKey(record.secret(), password))) {
                sessionManager.start(walletId, WalletType.PRIVATE_KEY, privateKey.bytes());
            }
            return sessionStatus();
        }
        String phrase = vault.decrypt(record.secret(), password);
        List<String> words = mnemonicGenerator.parse(phrase);
        try (SecretBytes seed = mnemonicGenerator.toSeed(words)) {
            sessionManager.start(walletId, WalletType.MNEMONIC, seed.bytes());
        }
        return sessionStatus();
    }

    @Override
    public CompletableFuture<CreateWalletResult> createWalletAsync(String name, String password) {
        return CompletableFuture.supplyAsync(() -> createWallet(name, password), kdfExecutor);
    }

    @Override
    public CompletableFuture<CreateWalletResult> recoverWalletAsync(String mnemonic, String name, String password) {
        return CompletableFuture.supplyAsync(() -> recoverWallet(mnemonic, name, password), kdfExecutor);
    }

    @Override
    public CompletableFuture<WalletRecord> importPrivateKeyAsync(String name, String privateKeyHex, String password) {
        return CompletableFuture.supplyAsync(() -> importPrivateKey(name, privateKeyHex, password), kdfExecutor);
    }

    @Override
    public CompletableFuture<WalletRecord> importKeystoreAsync(String name, String keystoreJson, String keystorePassword, String password) {
        return CompletableFuture.supplyAsync(() -> importKeystore(name, keystoreJson, keystorePassword, password), kdfExecutor);
    }

    @Override
    public CompletableFuture<SessionStatus> unlockAsync(String walletId, String password) {
        return CompletableFuture.supplyAsync(() -> unlock(walletId, password), kdfExecutor);
    }

    @Override
    public CompletableFuture<Void> changePasswordAsync(String walletId, String oldPassword, String newPassword) {
        return CompletableFuture.runAsync(() -> changePassword(walletId, oldPassword, newPassword), kdfExecutor);
    }

    @Override
    public CompletableFuture<String> revealMnemonicAsync(String walletId, String password) {
        return CompletableFuture.supplyAsync(() -> revealMnemonic(walletId, password), kdfExecutor);
    }

    @Override
    public void lock() {
        sessionManager.lock();
    }

    @Override
    public boolean isUnlocked() {
        return sessionManager.isUnlocked();
    }

    @Override
    public SessionStatus sessionStatus() {
        Optional<String> walletId = sessionManager.activeWalletId();
        if (walletId.isEmpty()) {
            return SessionStatus.locked();
        }
        long expiresAt = sessionManager.expiresAt().map(i -> i.toEpochMilli()).orElse(0L);
        return new SessionStatus(true, walletId.get(), expiresAt, sessionManager.remainingMillis());
    }

    @Override
    public SessionStatus refreshSession() {
        sessionManager.refresh();
        return sessionStatus();
    }

    @Override
    public byte[] signTransaction(String chain, TransactionParams params) {
        return signingDispatcher.sign(chain, params);
    }

    @Override
    public byte[] signMessage(String chain, String message) {
        return signingDispatcher.signMessage(chain, message);
    }

    @Override
    public List<WalletRecord> listWallets() {
        return store.list();
    }

    @Override
    public WalletRecord getWallet(String walletId) {
        return store.load(walletId);
    }

    @Override
    public void deleteWallet(String walletId) {
        if (!store.exists(walletId)) {
            throw WalletException.notFound(walletId);
        }
        sessionManager.lockIfActive(walletId);
        store.delete(walletId);
        log.info("钱包已删除: {}", walletId);
    }

    @Override
    public WalletRecord renameWallet(String walletId, String name) {
        String walletName = checkName(name);
        WalletRecord record = store.load(walletId);
        record.setName(walletName);
        store.save(record);
        log.info("钱包 {} 已重命名", walletId);
        return record;
    }

    /**
     * 旧密码解密后用新密码重新加密（新盐、新 nonce），ID、地址和会话不变
     */
    @Override
    public void changePassword(String walletId, String oldPassword, String newPassword) {
        checkPassword(newPassword);
        if (oldPassword == null) {
            throw WalletException.invalidArgument("旧密码为空");
        }
        WalletRecord record = store.load(walletId);
        if (record.getWalletType() == WalletType.PRIVATE_KEY) {
            try (SecretBytes privateKey = SecretBytes.wrap(vault.decryptKey(record.secret(), oldPassword))) {
                record.setEncryptedPrivateKey(vault.encryptKey(privateKey.bytes(), newPassword));
            }
        } else {
            String phrase = vault.decrypt(record.secret(), oldPassword);
            record.setEncryptedMnemonic(vault.encrypt(phrase, newPassword));
        }
        store.save(record);
        log.info("钱包 {} 已修改密码", walletId);
    }

    @Override
    public String revealMnemonic(String walletId, String password) {
        if (password == null) {
            throw WalletException.invalidArgument("密码为空");
        }
        WalletRecord record = store.load(walletId);
        if (record.getWalletType() == WalletType.PRIVATE_KEY) {
            throw WalletException.invalidArgument("私钥导入的钱包没有助记词");
        }
        String phrase = vault.decrypt(record.secret(), password);
        log.info("钱包 {} 的助记词已导出", walletId);
        return phrase;
    }

    private static String checkName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw WalletException.invalidArgument("钱包名称不能为空");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw WalletException.invalidArgument("钱包名称不能超过" + MAX_NAME_LENGTH + "个字符");
        }
        return trimmed;
    }

    private void checkPassword(String password) {
        if (password == null || password.length() < passwordMinLength) {
            throw WalletException.invalidArgument("密码长度不能少于" + passwordMinLength + "位");
        }
    }

    /**
     * 64位十六进制（可带 0x），且落在 secp256k1 的 [1, n-1] 内
     */
    private static SecretBytes parsePrivateKey(String privateKeyHex) {
        if (privateKeyHex == null) {
            throw WalletException.invalidArgument("私钥为空");
        }
        String hex = privateKeyHex.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() != 64) {
            throw WalletException.invalidArgument("私钥必须是64位十六进制字符串");
        }
        byte[] bytes;
        try {
            bytes = ByteUtils.hexToBytes(hex);
        } catch (IllegalArgumentException e) {
            throw WalletException.invalidArgument("私钥必须是64位十六进制字符串");
        }
        SecretBytes privateKey = SecretBytes.wrap(bytes);
        if (!Secp256k1KeyDeriver.isValidPrivateKey(bytes)) {
            privateKey.close();
            throw WalletException.invalidArgument("私钥超出 secp256k1 取值范围");
        }
        return privateKey;
    }

    private static Map<String, String> byName(Map<Chain, String> values) {
        Map<String, String> result = new TreeMap<>();
        values.forEach((chain, value) -> result.put(chain.name(), value));
        return result;
    }
}
