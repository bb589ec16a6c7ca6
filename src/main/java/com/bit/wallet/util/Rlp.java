package com.bit.wallet.util;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;

/**
 * 以太坊 RLP 编码（仅编码，交易签名用）
 */
public final class Rlp {

    private Rlp() {
    }

    public static byte[] encodeBytes(byte[] value) {
        if (value.length == 1 && (value[0] & 0xFF) < 0x80) {
            return value;
        }
        return ByteUtils.concat(header(0x80, value.length), value);
    }

    /**
     * 整数按最短大端编码，0 编码为空串
     */
    public static byte[] encodeBigInteger(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP 不支持负数");
        }
        return encodeBytes(toMinimalBytes(value));
    }

    public static byte[] encodeLong(long value) {
        return encodeBigInteger(BigInteger.valueOf(value));
    }

    public static byte[] encodeList(List<byte[]> encodedItems) {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        for (byte[] item : encodedItems) {
            payload.writeBytes(item);
        }
        byte[] body = payload.toByteArray();
        return ByteUtils.concat(header(0xc0, body.length), body);
    }

    public static byte[] toMinimalBytes(BigInteger value) {
        if (value.signum() == 0) {
            return new byte[0];
        }
        byte[] raw = value.toByteArray();
        if (raw[0] == 0) {
            byte[] trimmed = new byte[raw.length - 1];
            System.arraycopy(raw, 1, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return raw;
    }

    private static byte[] header(int offset, int length) {
        if (length < 56) {
            return new byte[]{(byte) (offset + length)};
        }
        byte[] len = toMinimalBytes(BigInteger.valueOf(length));
        return ByteUtils.concat(new byte[]{(byte) (offset + 55 + len.length)}, len);
    }
}
