package com.bit.wallet.util;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RlpTest {

    @Test
    void encodesScalarsAndStrings() {
        assertEquals("80", ByteUtils.bytesToHex(Rlp.encodeLong(0)));
        assertEquals("0f", ByteUtils.bytesToHex(Rlp.encodeLong(15)));
        assertEquals("820400", ByteUtils.bytesToHex(Rlp.encodeLong(1024)));
        assertEquals("83646f67", ByteUtils.bytesToHex(Rlp.encodeBytes("dog".getBytes(StandardCharsets.US_ASCII))));
        assertEquals("80", ByteUtils.bytesToHex(Rlp.encodeBytes(new byte[0])));
        assertThrows(IllegalArgumentException.class, () -> Rlp.encodeBigInteger(BigInteger.valueOf(-1)));
    }

    @Test
    void encodesLists() {
        byte[] list = Rlp.encodeList(List.of(
                Rlp.encodeBytes("cat".getBytes(StandardCharsets.US_ASCII)),
                Rlp.encodeBytes("dog".getBytes(StandardCharsets.US_ASCII))));
        assertEquals("c88363617483646f67", ByteUtils.bytesToHex(list));
        assertEquals("c0", ByteUtils.bytesToHex(Rlp.encodeList(List.of())));
    }

    @Test
    void longStringUsesLengthOfLength() {
        byte[] value = new byte[56];
        byte[] encoded = Rlp.encodeBytes(value);
        assertEquals((byte) 0xb8, encoded[0]);
        assertEquals(56, encoded[1]);
        assertEquals(58, encoded.length);
    }
}
