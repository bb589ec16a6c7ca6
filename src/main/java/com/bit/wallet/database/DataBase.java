package com.bit.wallet.database;

import com.bit.wallet.config.WalletProperties;

//KV数据库操作，按表隔离
public interface DataBase {

    /**
     * 创建/打开数据库
     * @param config 存储配置
     * @return 是否成功
     */
    boolean createDatabase(WalletProperties.Storage config);

    /**
     * 关闭数据库
     */
    boolean closeDatabase();

    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据（已存在则覆盖）
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    void delete(TableEnum table, byte[] key);

    /**
     * 获取一条数据，不存在返回 null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 按键的字节序遍历（避免一次性加载所有数据到内存）
     * @param table 表名
     * @param handler 处理器，返回 false 停止遍历
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    void close();
}
