package com.bit.wallet.database;

import lombok.Getter;

/**
 * 表枚举（集中管理所有表的元信息），RocksDB 中每张表对应一个列族
 */
@Getter
public enum TableEnum {
    // 钱包记录表：key = wallet_{id}，value = JSON
    WALLET((short) 1, "wallet");

    private final short code;
    private final String columnFamilyName;

    TableEnum(short code, String columnFamilyName) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
    }
}
