package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.Ed25519Signer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 对调用方给出的 cell hash / 消息做 Ed25519 签名，返回64字节签名
 */
@Component
public class TonTxSigner implements ChainSigner {

    @Override
    public ChainFamily family() {
        return ChainFamily.TON;
    }

    @Override
    public byte[] sign(Chain chain, byte[] privateKey, TransactionParams params) {
        byte[] payload;
        try {
            payload = params.getPayload() == null ? new byte[0] : ByteUtils.hexToBytes(params.getPayload());
        } catch (IllegalArgumentException e) {
            throw WalletException.invalidArgument("payload 不是合法的十六进制");
        }
        if (payload.length == 0) {
            throw WalletException.invalidArgument("缺少参数 payload");
        }
        return Ed25519Signer.sign(privateKey, payload);
    }

    @Override
    public byte[] signMessage(Chain chain, byte[] privateKey, String message) {
        return Ed25519Signer.sign(privateKey, message.getBytes(StandardCharsets.UTF_8));
    }
}
