package com.bit.wallet.derive;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.chain.CurveType;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.key.KeyInfo;
import com.bit.wallet.util.ByteUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 多链派生编排：按曲线选派生器，同一曲线下相同路径只派生一次（EVM 系共用一个地址）
 */
@Slf4j
@Component
public class MultiChainDeriver {

    public static final int DEFAULT_ACCOUNT_INDEX = 0;

    private final Map<CurveType, KeyDeriver> derivers = new EnumMap<>(CurveType.class);

    @Autowired
    public MultiChainDeriver(List<KeyDeriver> deriverList) {
        for (KeyDeriver deriver : deriverList) {
            KeyDeriver previous = derivers.put(deriver.curve(), deriver);
            if (previous != null) {
                throw new IllegalStateException("曲线 " + deriver.curve() + " 存在多个派生器");
            }
        }
        for (CurveType curve : CurveType.values()) {
            if (!derivers.containsKey(curve)) {
                throw new IllegalStateException("缺少曲线 " + curve + " 的派生器");
            }
        }
    }

    public KeyDeriver deriverFor(Chain chain) {
        KeyDeriver deriver = derivers.get(chain.getCurve());
        if (deriver == null) {
            throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, chain.name());
        }
        return deriver;
    }

    /**
     * 派生单条链的密钥，调用方负责 close
     */
    public KeyInfo derive(byte[] seed, Chain chain, int accountIndex) {
        return deriverFor(chain).derive(seed, chain, accountIndex);
    }

    /**
     * 派生全部链的地址和公钥，私钥用完即清零
     */
    public DerivedAddresses deriveAll(byte[] seed) {
        Map<Chain, String> addresses = new EnumMap<>(Chain.class);
        Map<Chain, String> publicKeys = new EnumMap<>(Chain.class);
        Map<Chain, String> paths = new EnumMap<>(Chain.class);
        // 曲线+路径+公钥格式 相同的链复用派生结果
        Map<String, KeyInfo> derived = new HashMap<>();
        try {
            for (Chain chain : Chain.values()) {
                String cacheKey = chain.getFamily() + "|" + chain.defaultPath();
                KeyInfo info = derived.get(cacheKey);
                if (info == null) {
                    info = derive(seed, chain, DEFAULT_ACCOUNT_INDEX);
                    derived.put(cacheKey, info);
                }
                addresses.put(chain, info.getAddress());
                publicKeys.put(chain, info.getPublicKeyHex());
                paths.put(chain, info.getPath());
            }
        } finally {
            derived.values().forEach(KeyInfo::close);
        }
        log.debug("多链派生完成，链数量: {}, 实际派生次数: {}", addresses.size(), derived.size());
        return new DerivedAddresses(addresses, publicKeys, paths);
    }

    /**
     * 导入的单个 secp256k1 私钥只对应 EVM 地址，没有派生路径
     */
    public DerivedAddresses fromPrivateKey(byte[] privateKey) {
        if (!Secp256k1KeyDeriver.isValidPrivateKey(privateKey)) {
            throw WalletException.invalidArgument("私钥超出 secp256k1 取值范围");
        }
        Map<Chain, String> addresses = new EnumMap<>(Chain.class);
        Map<Chain, String> publicKeys = new EnumMap<>(Chain.class);
        for (Chain chain : Chain.values()) {
            if (chain.getFamily() != ChainFamily.EVM) {
                continue;
            }
            KeyDeriver deriver = deriverFor(chain);
            byte[] publicKey = deriver.derivePublicKey(privateKey, chain);
            addresses.put(chain, deriver.deriveAddress(publicKey, chain));
            publicKeys.put(chain, ByteUtils.bytesToHex(publicKey));
        }
        return new DerivedAddresses(addresses, publicKeys, new EnumMap<>(Chain.class));
    }

    @Getter
    public static class DerivedAddresses {
        private final Map<Chain, String> addresses;
        private final Map<Chain, String> publicKeys;
        private final Map<Chain, String> paths;

        public DerivedAddresses(Map<Chain, String> addresses, Map<Chain, String> publicKeys, Map<Chain, String> paths) {
            this.addresses = Collections.unmodifiableMap(addresses);
            this.publicKeys = Collections.unmodifiableMap(publicKeys);
            this.paths = Collections.unmodifiableMap(paths);
        }
    }
}
