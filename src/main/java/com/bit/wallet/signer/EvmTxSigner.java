package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.Rlp;
import com.bit.wallet.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * EVM 传统交易（EIP-155）签名：
 * rlp([nonce, gasPrice, gasLimit, to, value, data, v, r, s])，s 取低半区
 */
@Slf4j
@Component
public class EvmTxSigner implements ChainSigner {

    public static final BigInteger DEFAULT_GAS_LIMIT = BigInteger.valueOf(21_000);

    @Override
    public ChainFamily family() {
        return ChainFamily.EVM;
    }

    @Override
    public byte[] sign(Chain chain, byte[] privateKey, TransactionParams params) {
        BigInteger nonce = required(params.getNonce(), "nonce");
        BigInteger gasPrice = required(params.getGasPrice(), "gasPrice");
        BigInteger gasLimit = params.getGasLimit() == null ? DEFAULT_GAS_LIMIT : params.getGasLimit();
        BigInteger value = params.getValue() == null ? BigInteger.ZERO : params.getValue();
        byte[] to = parseTo(params.getTo());
        byte[] data = params.getData() == null ? new byte[0] : hex(params.getData(), "data");
        long chainId = params.getChainId() == null ? chain.getEvmChainId() : params.getChainId();
        if (chainId < 0) {
            throw WalletException.invalidArgument("chainId 不能为负");
        }
        for (BigInteger n : List.of(nonce, gasPrice, gasLimit, value)) {
            if (n.signum() < 0) {
                throw WalletException.invalidArgument("交易数值不能为负");
            }
        }

        // EIP-155 签名原文：末尾追加 chainId, 0, 0
        List<byte[]> fields = List.of(
                Rlp.encodeBigInteger(nonce),
                Rlp.encodeBigInteger(gasPrice),
                Rlp.encodeBigInteger(gasLimit),
                Rlp.encodeBytes(to),
                Rlp.encodeBigInteger(value),
                Rlp.encodeBytes(data));
        byte[] unsigned = chainId > 0
                ? Rlp.encodeList(concat(fields, Rlp.encodeLong(chainId), Rlp.encodeLong(0), Rlp.encodeLong(0)))
                : Rlp.encodeList(fields);
        Sha256Hash hash = Sha256Hash.wrap(Sha.applyKeccak256(unsigned));

        ECKey key = ECKey.fromPrivate(privateKey, false);
        // bitcoinj 签名结果已规范化为低 s
        ECKey.ECDSASignature signature = key.sign(hash);
        int recId = recoveryId(key, signature, hash);
        long v = chainId > 0 ? recId + 35 + 2 * chainId : 27 + recId;

        byte[] signed = Rlp.encodeList(concat(fields,
                Rlp.encodeLong(v),
                Rlp.encodeBigInteger(signature.r),
                Rlp.encodeBigInteger(signature.s)));
        log.debug("{} 交易签名完成，chainId={}, 长度={}", chain, chainId, signed.length);
        return signed;
    }

    /**
     * EIP-191 personal_sign："\x19Ethereum Signed Message:\n" + 长度 + 消息，输出 r ‖ s ‖ v（v 为 27/28）
     */
    @Override
    public byte[] signMessage(Chain chain, byte[] privateKey, String message) {
        Sign.SignatureData signature = Sign.signPrefixedMessage(
                message.getBytes(StandardCharsets.UTF_8), ECKeyPair.create(privateKey));
        return ByteUtils.concat(signature.getR(), signature.getS(), signature.getV());
    }

    static int recoveryId(ECKey key, ECKey.ECDSASignature signature, Sha256Hash hash) {
        byte[] expected = key.getPubKey();
        for (int i = 0; i < 4; i++) {
            ECKey recovered = ECKey.recoverFromSignature(i, signature, hash, false);
            if (recovered != null && Arrays.equals(recovered.getPubKey(), expected)) {
                return i;
            }
        }
        throw new WalletException(ErrorType.SIGNING_FAILED, "无法计算签名恢复ID");
    }

    private static byte[] parseTo(String to) {
        // 空 to 表示合约创建
        if (to == null || to.isEmpty()) {
            return new byte[0];
        }
        byte[] bytes = hex(to, "to");
        if (bytes.length != 20) {
            throw WalletException.invalidArgument("to 地址必须为20字节");
        }
        return bytes;
    }

    private static byte[] hex(String value, String field) {
        try {
            return ByteUtils.hexToBytes(value);
        } catch (IllegalArgumentException e) {
            throw WalletException.invalidArgument(field + " 不是合法的十六进制");
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw WalletException.invalidArgument("缺少参数 " + field);
        }
        return value;
    }

    private static List<byte[]> concat(List<byte[]> head, byte[]... tail) {
        List<byte[]> all = new ArrayList<>(head);
        all.addAll(Arrays.asList(tail));
        return all;
    }
}
