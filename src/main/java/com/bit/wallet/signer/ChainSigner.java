package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.structure.tx.TransactionParams;

/**
 * 链族签名器，每种交易编码一个实现。私钥由调用方持有并清零，实现不得保存
 */
public interface ChainSigner {

    ChainFamily family();

    byte[] sign(Chain chain, byte[] privateKey, TransactionParams params);

    /**
     * 链下消息签名（按各链的消息签名约定），消息按 UTF-8 编码
     */
    byte[] signMessage(Chain chain, byte[] privateKey, String message);
}
