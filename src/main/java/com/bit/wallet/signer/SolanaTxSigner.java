package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.Ed25519Signer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Solana 传统消息格式的系统程序转账签名。
 * 输出为线上交易格式：compact-u16(1) ‖ 64字节签名 ‖ message
 */
@Slf4j
@Component
public class SolanaTxSigner implements ChainSigner {

    // 系统程序 11111111111111111111111111111111，即32个0字节
    static final byte[] SYSTEM_PROGRAM_ID = new byte[32];
    // 系统程序 Transfer 指令序号
    private static final int TRANSFER_INSTRUCTION = 2;
    private static final BigInteger U64_MAX = new BigInteger("18446744073709551615");

    @Override
    public ChainFamily family() {
        return ChainFamily.SOLANA;
    }

    @Override
    public byte[] sign(Chain chain, byte[] privateKey, TransactionParams params) {
        byte[] message;
        if (params.getPayload() != null && !params.getPayload().isEmpty()) {
            // 调用方已编码好的 message
            try {
                message = ByteUtils.hexToBytes(params.getPayload());
            } catch (IllegalArgumentException e) {
                throw WalletException.invalidArgument("payload 不是合法的十六进制");
            }
            if (message.length == 0) {
                throw WalletException.invalidArgument("payload 为空");
            }
        } else {
            byte[] from = Ed25519Signer.derivePublicKey(privateKey);
            message = transferMessage(from, params);
        }
        byte[] signature = Ed25519Signer.sign(privateKey, message);
        return ByteUtils.concat(ByteUtils.compactU16(1), signature, message);
    }

    // 链下消息：对原始 UTF-8 字节做 Ed25519 签名
    @Override
    public byte[] signMessage(Chain chain, byte[] privateKey, String message) {
        return Ed25519Signer.sign(privateKey, message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * header[1,0,1] | 账户[from, to, system] | recentBlockhash | 1条指令(program=2, accounts=[0,1], data=u32(2)+u64(lamports))
     */
    static byte[] transferMessage(byte[] from, TransactionParams params) {
        byte[] to = base58(params.getTo(), "to");
        byte[] blockhash = base58(params.getRecentBlockhash(), "recentBlockhash");
        if (Arrays.equals(from, to)) {
            throw WalletException.invalidArgument("不能转账给自己");
        }
        BigInteger lamports = params.getValue();
        if (lamports == null || lamports.signum() < 0 || lamports.compareTo(U64_MAX) > 0) {
            throw WalletException.invalidArgument("转账金额必须在 u64 范围内");
        }
        byte[] data = ByteUtils.concat(ByteUtils.intToBytesLE(TRANSFER_INSTRUCTION), ByteUtils.longToBytes(lamports.longValue()));
        return ByteUtils.concat(
                new byte[]{1, 0, 1},
                ByteUtils.compactU16(3), from, to, SYSTEM_PROGRAM_ID,
                blockhash,
                ByteUtils.compactU16(1),
                new byte[]{2},
                ByteUtils.compactU16(2), new byte[]{0, 1},
                ByteUtils.compactU16(data.length), data);
    }

    private static byte[] base58(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw WalletException.invalidArgument("缺少参数 " + field);
        }
        byte[] bytes;
        try {
            bytes = Base58.decode(value);
        } catch (AddressFormatException e) {
            throw WalletException.invalidArgument(field + " 不是合法的 Base58");
        }
        if (bytes.length != 32) {
            throw WalletException.invalidArgument(field + " 必须为32字节");
        }
        return bytes;
    }
}
