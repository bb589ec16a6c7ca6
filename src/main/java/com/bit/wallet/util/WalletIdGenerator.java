package com.bit.wallet.util;

import com.bit.wallet.chain.Chain;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 钱包ID：按链名排序后以换行拼接 "CHAIN:address"，SHA-256 取前16个十六进制字符。
 * 同一助记词恢复得到同一ID，与 Map 迭代顺序无关
 */
public final class WalletIdGenerator {

    public static final int ID_LENGTH = 16;

    private WalletIdGenerator() {
    }

    public static String generate(Map<Chain, String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new IllegalArgumentException("地址表为空");
        }
        // 每对之间以换行分隔，地址中不会出现换行，边界无歧义
        String joined = addresses.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getKey().name()))
                .map(e -> e.getKey().name() + ':' + e.getValue())
                .collect(Collectors.joining("\n"));
        byte[] hash = Sha.applySHA256(joined.getBytes(StandardCharsets.UTF_8));
        return ByteUtils.bytesToHex(hash).substring(0, ID_LENGTH);
    }
}
