package com.bit.wallet.vault;

import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.key.SecretBytes;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.CipherException;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Wallet;
import org.web3j.crypto.WalletFile;
import org.web3j.utils.Numeric;

import java.io.IOException;

/**
 * 以太坊 V3 Keystore 解密（scrypt / pbkdf2 + aes-128-ctr，MAC 校验由 web3j 完成）
 */
@Slf4j
@Component
public class KeystoreDecoder {

    public static final int SUPPORTED_VERSION = 3;
    private static final String CIPHER = "aes-128-ctr";
    // KDF 参数来自外部文件，设上限避免导入时长时间占用 KDF 线程
    static final int MAX_SCRYPT_N = 1 << 20;
    static final int MAX_SCRYPT_P = 16;
    static final int MAX_SCRYPT_R = 16;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * 返回32字节私钥，调用方负责 close
     */
    public SecretBytes decrypt(String keystoreJson, String password) {
        if (keystoreJson == null || keystoreJson.isBlank()) {
            throw WalletException.invalidArgument("Keystore 内容为空");
        }
        if (password == null || password.isEmpty()) {
            throw WalletException.invalidArgument("Keystore 密码为空");
        }
        WalletFile walletFile = parse(keystoreJson);
        ECKeyPair keyPair;
        try {
            keyPair = Wallet.decrypt(password, walletFile);
        } catch (CipherException e) {
            // 密码错误与 MAC 不符不作区分
            log.warn("Keystore 解密失败");
            throw new WalletException(ErrorType.DECRYPTION_FAILED, "Keystore 密码错误或数据已损坏");
        }
        String expected = walletFile.getAddress();
        if (expected != null && !expected.isEmpty()
                && !Numeric.cleanHexPrefix(expected).equalsIgnoreCase(Keys.getAddress(keyPair))) {
            throw WalletException.invalidArgument("Keystore 地址与私钥不匹配");
        }
        return SecretBytes.wrap(Numeric.toBytesPadded(keyPair.getPrivateKey(), 32));
    }

    private WalletFile parse(String keystoreJson) {
        WalletFile walletFile;
        try {
            walletFile = objectMapper.readValue(keystoreJson, WalletFile.class);
        } catch (IOException e) {
            throw WalletException.invalidArgument("Keystore JSON 格式错误");
        }
        if (walletFile.getVersion() != SUPPORTED_VERSION) {
            throw WalletException.invalidArgument("仅支持 V3 Keystore，实际版本: " + walletFile.getVersion());
        }
        WalletFile.Crypto crypto = walletFile.getCrypto();
        if (crypto == null || crypto.getKdfparams() == null) {
            throw WalletException.invalidArgument("Keystore 缺少 crypto 字段");
        }
        if (!CIPHER.equals(crypto.getCipher())) {
            throw WalletException.invalidArgument("不支持的 Keystore 加密算法: " + crypto.getCipher());
        }
        Object params = crypto.getKdfparams();
        if (params instanceof WalletFile.ScryptKdfParams) {
            WalletFile.ScryptKdfParams scrypt = (WalletFile.ScryptKdfParams) params;
            if (scrypt.getN() <= 1 || scrypt.getN() > MAX_SCRYPT_N
                    || scrypt.getP() <= 0 || scrypt.getP() > MAX_SCRYPT_P
                    || scrypt.getR() <= 0 || scrypt.getR() > MAX_SCRYPT_R) {
                throw WalletException.invalidArgument("Keystore scrypt 参数超出范围");
            }
        } else if (params instanceof WalletFile.Aes128CtrKdfParams) {
            int c = ((WalletFile.Aes128CtrKdfParams) params).getC();
            if (c <= 0 || c > MnemonicVault.MAX_ITERATIONS) {
                throw WalletException.invalidArgument("Keystore pbkdf2 迭代次数超出范围");
            }
        } else {
            throw WalletException.invalidArgument("不支持的 Keystore KDF: " + crypto.getKdf());
        }
        return walletFile;
    }
}
