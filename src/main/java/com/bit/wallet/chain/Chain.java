package com.bit.wallet.chain;

import com.bit.wallet.derive.DerivationPath;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 支持的链（封闭集合）。派生路径固定，修改会导致钱包无法在其他实现中恢复
 */
public enum Chain {
    // EVM 系共用 m/44'/60'/0'/0/index
    ETH(ChainFamily.EVM, "m/44'/60'/0'/0/0", 1L, List.of("ETHEREUM")),
    BSC(ChainFamily.EVM, "m/44'/60'/0'/0/0", 56L, List.of("BNB")),
    POLYGON(ChainFamily.EVM, "m/44'/60'/0'/0/0", 137L, List.of("MATIC")),
    // 原生隔离见证 BIP-84
    BTC(ChainFamily.BITCOIN, "m/84'/0'/0'/0/0", 0L, List.of("BITCOIN")),
    // SLIP-10，全部强化派生
    SOL(ChainFamily.SOLANA, "m/44'/501'/0'/0'", 0L, List.of("SOLANA")),
    TON(ChainFamily.TON, "m/44'/607'/0'/0'/0'/0'", 0L, List.of());

    @Getter
    private final ChainFamily family;
    private final DerivationPath basePath;
    @Getter
    private final long evmChainId;//仅 EVM 链有效（EIP-155）
    private final List<String> aliases;

    private static final Map<String, Chain> LOOKUP = new HashMap<>();

    static {
        for (Chain chain : values()) {
            LOOKUP.put(chain.name(), chain);
            for (String alias : chain.aliases) {
                LOOKUP.put(alias, chain);
            }
        }
    }

    Chain(ChainFamily family, String path, long evmChainId, List<String> aliases) {
        this.family = family;
        this.basePath = DerivationPath.parse(path);
        this.evmChainId = evmChainId;
        this.aliases = aliases;
    }

    public CurveType getCurve() {
        return family.getCurve();
    }

    /**
     * 账户索引替换路径最后一级（保持该级是否强化不变）
     */
    public DerivationPath path(int accountIndex) {
        return basePath.withLastIndex(accountIndex);
    }

    public DerivationPath defaultPath() {
        return basePath;
    }

    /**
     * 根据链标识解析（大小写不敏感），未知标识直接失败，不回退到任何默认链
     */
    public static Chain fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, "链标识为空");
        }
        Chain chain = LOOKUP.get(id.trim().toUpperCase(Locale.ROOT));
        if (chain == null) {
            throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, id);
        }
        return chain;
    }
}
