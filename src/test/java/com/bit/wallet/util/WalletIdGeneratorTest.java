package com.bit.wallet.util;

import com.bit.wallet.chain.Chain;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class WalletIdGeneratorTest {

    @Test
    void idIsIndependentOfInsertionOrder() {
        Map<Chain, String> forward = new LinkedHashMap<>();
        forward.put(Chain.ETH, "0xabc");
        forward.put(Chain.BTC, "bc1qxyz");
        forward.put(Chain.SOL, "So1");
        Map<Chain, String> reverse = new LinkedHashMap<>();
        reverse.put(Chain.SOL, "So1");
        reverse.put(Chain.BTC, "bc1qxyz");
        reverse.put(Chain.ETH, "0xabc");

        String id = WalletIdGenerator.generate(forward);
        log.info("钱包ID: {}", id);
        assertEquals(id, WalletIdGenerator.generate(reverse));
        assertEquals(WalletIdGenerator.ID_LENGTH, id.length());
        assertTrue(id.matches("[0-9a-f]{16}"));
    }

    @Test
    void idMatchesSortedConcatenationHash() {
        Map<Chain, String> addresses = new EnumMap<>(Chain.class);
        addresses.put(Chain.TON, "0:11");
        addresses.put(Chain.BTC, "bc1q");
        // 按链名排序：BTC 在 TON 之前
        byte[] hash = Sha.applySHA256("BTC:bc1q\nTON:0:11".getBytes(StandardCharsets.UTF_8));
        assertEquals(ByteUtils.bytesToHex(hash).substring(0, 16), WalletIdGenerator.generate(addresses));
    }

    @Test
    void pairBoundariesAreUnambiguous() {
        // 无分隔符时两者拼接结果都是 "BTC:abETH:c"
        Map<Chain, String> a = new EnumMap<>(Chain.class);
        a.put(Chain.BTC, "abETH:c");
        a.put(Chain.TON, "x");
        Map<Chain, String> b = new EnumMap<>(Chain.class);
        b.put(Chain.BTC, "ab");
        b.put(Chain.ETH, "c");
        b.put(Chain.TON, "x");
        assertNotEquals(WalletIdGenerator.generate(a), WalletIdGenerator.generate(b));
    }

    @Test
    void differentAddressesGiveDifferentIds() {
        Map<Chain, String> a = Map.of(Chain.ETH, "0x01");
        Map<Chain, String> b = Map.of(Chain.ETH, "0x02");
        assertNotEquals(WalletIdGenerator.generate(a), WalletIdGenerator.generate(b));
        assertThrows(IllegalArgumentException.class, () -> WalletIdGenerator.generate(Map.of()));
    }
}
