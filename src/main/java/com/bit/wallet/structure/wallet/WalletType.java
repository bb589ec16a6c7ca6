package com.bit.wallet.structure.wallet;

/**
 * 钱包来源：助记词钱包覆盖全部链，私钥导入的钱包只有 EVM 地址
 */
public enum WalletType {
    MNEMONIC,
    PRIVATE_KEY
}
