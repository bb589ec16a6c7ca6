package com.bit.wallet.structure.key;

import com.bit.wallet.util.ByteUtils;
import lombok.Getter;

/**
 * 单条链派生结果。私钥只在签名期间存在，用完 close
 */
@Getter
public class KeyInfo implements AutoCloseable {
    private final byte[] privateKey;
    private final byte[] publicKey;
    private final String address;
    private final String path;

    public KeyInfo(byte[] privateKey, byte[] publicKey, String address, String path) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.address = address;
        this.path = path;
    }

    public String getPublicKeyHex() {
        return ByteUtils.bytesToHex(publicKey);
    }

    @Override
    public void close() {
        ByteUtils.wipe(privateKey);
    }

    // 不输出私钥
    @Override
    public String toString() {
        return "KeyInfo{address=" + address + ", path=" + path + "}";
    }
}
