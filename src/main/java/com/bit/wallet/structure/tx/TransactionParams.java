package com.bit.wallet.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 签名参数，各链签名器按需读取:
 * EVM: to/value/data/nonce/gasPrice/gasLimit/chainId
 * SOL: to/value(lamports)/recentBlockhash，或直接给 payload(已编码 message)
 * BTC: payload = 32字节 sighash
 * TON: payload = cell hash 或待签消息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionParams {
    private String to;
    private BigInteger value;
    private String data;//十六进制
    private BigInteger nonce;
    private BigInteger gasPrice;
    private BigInteger gasLimit;
    private Long chainId;//为空时取链默认值
    private String recentBlockhash;//Base58
    private String payload;//十六进制
}
