package com.bit.wallet.derive;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.CurveType;
import com.bit.wallet.structure.key.KeyInfo;
import com.bit.wallet.util.ByteUtils;

/**
 * 按曲线划分的密钥派生能力，每条曲线一个实现
 */
public interface KeyDeriver {

    CurveType curve();

    /**
     * 沿链的固定路径（最后一级替换为账户索引）派生32字节私钥，调用方负责清零
     */
    byte[] derivePrivateKey(byte[] seed, Chain chain, int accountIndex);

    byte[] derivePublicKey(byte[] privateKey, Chain chain);

    String deriveAddress(byte[] publicKey, Chain chain);

    default KeyInfo derive(byte[] seed, Chain chain, int accountIndex) {
        byte[] privateKey = derivePrivateKey(seed, chain, accountIndex);
        try {
            byte[] publicKey = derivePublicKey(privateKey, chain);
            String address = deriveAddress(publicKey, chain);
            return new KeyInfo(privateKey, publicKey, address, chain.path(accountIndex).toString());
        } catch (RuntimeException e) {
            ByteUtils.wipe(privateKey);
            throw e;
        }
    }
}
