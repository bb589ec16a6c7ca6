package com.bit.wallet.database.rocksDb;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.database.DataBase;
import com.bit.wallet.database.KeyValueHandler;
import com.bit.wallet.database.TableEnum;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * RocksDB 持久化存储，每张表一个列族
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "wallet.storage", name = "type", havingValue = "rocksdb", matchIfMissing = true)
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    private RocksDB db;
    private DBOptions dbOptions;
    // 列族选项需在数据库关闭后释放
    private final List<ColumnFamilyOptions> cfOptions = new ArrayList<>();
    private final RTable rTable = new RTable();
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(WalletProperties.Storage config) {
        String path = config.getPath();
        if (path == null || path.isBlank()) {
            return false;
        }
        dbPath = path;
        rwLock.writeLock().lock();
        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 1. 默认列族（索引0）
            ColumnFamilyOptions defaultOptions = new ColumnFamilyOptions();
            cfOptions.add(defaultOptions);
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, defaultOptions));

            // 2. 自定义列族
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                ColumnFamilyDescriptor descriptor = customDescriptors.get(table);
                cfOptions.add(descriptor.getOptions());
                cfDescriptors.add(descriptor);
            }

            dbOptions = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
            db = RocksDB.open(dbOptions, dbPath, cfDescriptors, cfHandles);

            // 3. 绑定列族句柄（顺序与描述符一致，自定义列族从索引1开始）
            if (cfHandles.size() != cfDescriptors.size()) {
                throw new IllegalStateException("列族句柄数量与描述符不匹配，初始化失败");
            }
            for (int i = 0; i < tableEnums.size(); i++) {
                rTable.setColumnFamilyHandle(tableEnums.get(i), cfHandles.get(i + 1));
            }
            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            closeOptions();
            return false;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean closeDatabase() {
        try {
            close();
            log.info("数据库已关闭");
            return true;
        } catch (Exception e) {
            log.error("关闭数据库失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(handle(table), key, value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new WalletException(ErrorType.STORAGE_FAILURE, "插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            db.delete(handle(table), key);
        } catch (RocksDBException e) {
            log.error("删除数据失败, table={}", table, e);
            throw new WalletException(ErrorType.STORAGE_FAILURE, "删除数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            return db.get(handle(table), key);
        } catch (RocksDBException e) {
            log.error("查询数据失败, table={}", table, e);
            throw new WalletException(ErrorType.STORAGE_FAILURE, "查询数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(table))) {
            iterator.seekToFirst();
            scan(iterator, handler);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 迭代器因 IO 错误或数据损坏提前结束时 isValid() 也返回 false，必须检查 status()
     */
    static void scan(RocksIterator iterator, KeyValueHandler handler) {
        while (iterator.isValid()) {
            if (!handler.handle(iterator.key(), iterator.value())) {
                return;
            }
            iterator.next();
        }
        try {
            iterator.status();
        } catch (RocksDBException e) {
            log.error("遍历数据失败", e);
            throw new WalletException(ErrorType.STORAGE_FAILURE, "遍历数据失败", e);
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeAll();
                db.close();
                db = null;
                log.info("RocksDB连接已关闭: {}", dbPath);
            }
            closeOptions();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    boolean isOptionsReleased() {
        return dbOptions == null && cfOptions.isEmpty();
    }

    private void closeOptions() {
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
        cfOptions.forEach(ColumnFamilyOptions::close);
        cfOptions.clear();
    }

    private ColumnFamilyHandle handle(TableEnum table) {
        if (db == null) {
            throw new WalletException(ErrorType.STORAGE_FAILURE, "数据库未打开");
        }
        ColumnFamilyHandle cfHandle = rTable.getColumnFamilyHandle(table);
        if (cfHandle == null) {
            throw new WalletException(ErrorType.STORAGE_FAILURE, "表不存在: " + table);
        }
        return cfHandle;
    }
}
