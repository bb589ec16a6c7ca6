package com.bit.wallet.structure.wallet;

import com.bit.wallet.chain.Chain;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * 持久化的钱包记录，JSON 字段名为蛇形命名，保持跨实现兼容。
 * v3 起区分钱包来源：助记词钱包保存 encrypted_mnemonic，私钥导入的钱包保存 encrypted_private_key
 */
@Data
@NoArgsConstructor
public class WalletRecord {

    public static final int CURRENT_VERSION = 3;

    @JsonProperty("id")
    private String id;
    @JsonProperty("name")
    private String name;
    @JsonProperty("wallet_type")
    private WalletType walletType = WalletType.MNEMONIC;
    @JsonProperty("encrypted_mnemonic")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private EncryptedSecret encryptedMnemonic;
    @JsonProperty("encrypted_private_key")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private EncryptedSecret encryptedPrivateKey;
    @JsonProperty("addresses")
    private Map<String, String> addresses = new TreeMap<>();
    @JsonProperty("public_keys")
    private Map<String, String> publicKeys = new TreeMap<>();
    @JsonProperty("derivation_paths")
    private Map<String, String> derivationPaths = new TreeMap<>();
    @JsonProperty("created_at")
    private long createdAt;//毫秒时间戳
    @JsonProperty("version")
    private int version = CURRENT_VERSION;

    public String address(Chain chain) {
        return addresses.get(chain.name());
    }

    /**
     * 当前记录对应的加密秘密
     */
    public EncryptedSecret secret() {
        return walletType == WalletType.PRIVATE_KEY ? encryptedPrivateKey : encryptedMnemonic;
    }

    /**
     * 旧版本记录在内存中升级，返回是否发生了升级。
     * v1 没有公钥与路径，v1/v2 没有钱包类型（一律为助记词钱包）
     */
    public boolean upgrade() {
        if (version >= CURRENT_VERSION && walletType != null && publicKeys != null && derivationPaths != null) {
            return false;
        }
        if (walletType == null) {
            walletType = WalletType.MNEMONIC;
        }
        if (addresses == null) {
            addresses = new TreeMap<>();
        }
        if (publicKeys == null) {
            publicKeys = new TreeMap<>();
        }
        if (walletType == WalletType.MNEMONIC && (derivationPaths == null || derivationPaths.isEmpty())) {
            Map<String, String> paths = new TreeMap<>();
            for (Chain chain : Chain.values()) {
                if (addresses.containsKey(chain.name())) {
                    paths.put(chain.name(), chain.defaultPath().toString());
                }
            }
            derivationPaths = paths;
        } else if (derivationPaths == null) {
            derivationPaths = new TreeMap<>();
        }
        version = CURRENT_VERSION;
        return true;
    }
}
