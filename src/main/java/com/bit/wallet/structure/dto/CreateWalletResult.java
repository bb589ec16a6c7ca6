package com.bit.wallet.structure.dto;

import com.bit.wallet.structure.wallet.WalletRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 创建/恢复钱包结果。助记词明文只返回这一次，由调用方展示后丢弃
 */
@Data
@AllArgsConstructor
public class CreateWalletResult {
    private String mnemonic;
    private WalletRecord wallet;
}
