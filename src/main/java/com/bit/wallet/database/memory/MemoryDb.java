package com.bit.wallet.database.memory;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.database.DataBase;
import com.bit.wallet.database.KeyValueHandler;
import com.bit.wallet.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存存储，进程退出即丢失，用于测试和临时运行
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "wallet.storage", name = "type", havingValue = "memory")
public class MemoryDb implements DataBase {

    private final Map<TableEnum, ConcurrentNavigableMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            // 与 RocksDB 默认比较器一致：无符号字节序
            tables.put(table, new ConcurrentSkipListMap<>(Arrays::compareUnsigned));
        }
    }

    @Override
    public boolean createDatabase(WalletProperties.Storage config) {
        log.info("使用内存存储，数据不会持久化");
        return true;
    }

    @Override
    public boolean closeDatabase() {
        close();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return tables.get(table).containsKey(key);
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        tables.get(table).put(key.clone(), value.clone());
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        tables.get(table).remove(key);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        byte[] value = tables.get(table).get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public int count(TableEnum table) {
        return tables.get(table).size();
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        for (Map.Entry<byte[], byte[]> entry : tables.get(table).entrySet()) {
            if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                break;
            }
        }
    }

    @Override
    public void close() {
        tables.values().forEach(Map::clear);
    }
}
