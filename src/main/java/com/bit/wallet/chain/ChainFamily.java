package com.bit.wallet.chain;

import lombok.Getter;

/**
 * 链族：同一族共用一种签名器（交易编码格式）
 */
public enum ChainFamily {
    EVM(CurveType.SECP256K1),
    BITCOIN(CurveType.SECP256K1),
    SOLANA(CurveType.ED25519),
    TON(CurveType.ED25519);

    @Getter
    private final CurveType curve;

    ChainFamily(CurveType curve) {
        this.curve = curve;
    }
}
