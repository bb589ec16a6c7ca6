package com.bit.wallet.derive;

import java.util.Arrays;

/**
 * BIP-32 派生路径，如 m/44'/60'/0'/0/0。索引以原始 int 保存，强化派生带 0x80000000 标记
 */
public final class DerivationPath {

    public static final int HARDENED_BIT = 0x80000000;

    private final int[] indexes;

    private DerivationPath(int[] indexes) {
        this.indexes = indexes;
    }

    public static DerivationPath parse(String path) {
        if (path == null) {
            throw new IllegalArgumentException("派生路径为空");
        }
        String[] parts = path.trim().split("/");
        if (parts.length == 0 || !"m".equalsIgnoreCase(parts[0])) {
            throw new IllegalArgumentException("派生路径必须以 m 开头: " + path);
        }
        int[] indexes = new int[parts.length - 1];
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            boolean hardened = part.endsWith("'") || part.endsWith("H") || part.endsWith("h");
            String number = hardened ? part.substring(0, part.length() - 1) : part;
            int value;
            try {
                value = Integer.parseInt(number);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("派生路径索引非法: " + path, e);
            }
            if (value < 0) {
                throw new IllegalArgumentException("派生路径索引不能为负: " + path);
            }
            indexes[i - 1] = hardened ? (value | HARDENED_BIT) : value;
        }
        return new DerivationPath(indexes);
    }

    public DerivationPath withLastIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("账户索引不能为负: " + index);
        }
        if (indexes.length == 0) {
            throw new IllegalStateException("根路径没有可替换的索引");
        }
        int[] copy = indexes.clone();
        int last = copy.length - 1;
        copy[last] = isHardened(copy[last]) ? (index | HARDENED_BIT) : index;
        return new DerivationPath(copy);
    }

    public int[] indexes() {
        return indexes.clone();
    }

    public int depth() {
        return indexes.length;
    }

    public static boolean isHardened(int index) {
        return (index & HARDENED_BIT) != 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("m");
        for (int index : indexes) {
            sb.append('/').append(index & ~HARDENED_BIT);
            if (isHardened(index)) {
                sb.append('\'');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DerivationPath)) return false;
        return Arrays.equals(indexes, ((DerivationPath) o).indexes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indexes);
    }
}
