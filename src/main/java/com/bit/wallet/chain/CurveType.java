package com.bit.wallet.chain;

public enum CurveType {
    SECP256K1,
    ED25519
}
