package com.bit.wallet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用 RLP 解码：只支持一层列表，元素均为字节串
 */
public final class RlpTestDecoder {

    private RlpTestDecoder() {
    }

    public static List<byte[]> decodeList(byte[] encoded) {
        int prefix = encoded[0] & 0xFF;
        if (prefix < 0xc0) {
            throw new IllegalArgumentException("not a list");
        }
        int offset;
        int length;
        if (prefix <= 0xf7) {
            offset = 1;
            length = prefix - 0xc0;
        } else {
            int lenOfLen = prefix - 0xf7;
            offset = 1 + lenOfLen;
            length = toInt(encoded, 1, lenOfLen);
        }
        if (offset + length != encoded.length) {
            throw new IllegalArgumentException("trailing bytes");
        }
        List<byte[]> items = new ArrayList<>();
        int pos = offset;
        while (pos < encoded.length) {
            int b = encoded[pos] & 0xFF;
            if (b < 0x80) {
                items.add(new byte[]{(byte) b});
                pos += 1;
            } else if (b <= 0xb7) {
                int len = b - 0x80;
                items.add(Arrays.copyOfRange(encoded, pos + 1, pos + 1 + len));
                pos += 1 + len;
            } else if (b < 0xc0) {
                int lenOfLen = b - 0xb7;
                int len = toInt(encoded, pos + 1, lenOfLen);
                int start = pos + 1 + lenOfLen;
                items.add(Arrays.copyOfRange(encoded, start, start + len));
                pos = start + len;
            } else {
                throw new IllegalArgumentException("nested list not supported");
            }
        }
        return items;
    }

    private static int toInt(byte[] data, int offset, int len) {
        int value = 0;
        for (int i = 0; i < len; i++) {
            value = (value << 8) | (data[offset + i] & 0xFF);
        }
        return value;
    }
}
