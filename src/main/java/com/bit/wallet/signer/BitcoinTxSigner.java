package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.util.ByteUtils;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * 对调用方给出的32字节 sighash 签名，输出 DER ‖ 0x01（SIGHASH_ALL），UTXO 交易组装不在此处
 */
@Component
public class BitcoinTxSigner implements ChainSigner {

    private static final byte SIGHASH_ALL = 0x01;

    @Override
    public ChainFamily family() {
        return ChainFamily.BITCOIN;
    }

    @Override
    public byte[] sign(Chain chain, byte[] privateKey, TransactionParams params) {
        if (params.getPayload() == null) {
            throw WalletException.invalidArgument("缺少参数 payload(sighash)");
        }
        byte[] sighash;
        try {
            sighash = ByteUtils.hexToBytes(params.getPayload());
        } catch (IllegalArgumentException e) {
            throw WalletException.invalidArgument("payload 不是合法的十六进制");
        }
        if (sighash.length != 32) {
            throw WalletException.invalidArgument("sighash 必须为32字节");
        }
        ECKey key = ECKey.fromPrivate(privateKey, true);
        byte[] der = key.sign(Sha256Hash.wrap(sighash)).encodeToDER();
        return ByteUtils.concat(der, new byte[]{SIGHASH_ALL});
    }

    /**
     * 比特币签名消息格式（"Bitcoin Signed Message:\n" 前缀），65字节：头字节 ‖ r ‖ s
     */
    @Override
    public byte[] signMessage(Chain chain, byte[] privateKey, String message) {
        String signature = ECKey.fromPrivate(privateKey, true).signMessage(message);
        return Base64.getDecoder().decode(signature);
    }
}
