package com.bit.wallet.database.rocksDb;

import com.bit.wallet.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表枚举 -> 列族句柄映射，每个数据库实例一份
 */
@Slf4j
public class RTable {

    private final Map<TableEnum, ColumnFamilyHandle> handles = new EnumMap<>(TableEnum.class);

    public ColumnFamilyHandle getColumnFamilyHandle(TableEnum tableEnum) {
        if (tableEnum == null) {
            log.warn("表枚举为空，无法获取列族句柄");
            return null;
        }
        return handles.get(tableEnum);
    }

    /**
     * 绑定列族句柄（数据库初始化时调用）
     */
    public void setColumnFamilyHandle(TableEnum tableEnum, ColumnFamilyHandle handle) {
        if (tableEnum == null || handle == null) {
            log.warn("绑定列族句柄失败：表枚举或句柄为空");
            return;
        }
        handles.put(tableEnum, handle);
    }

    public void closeAll() {
        for (Map.Entry<TableEnum, ColumnFamilyHandle> entry : handles.entrySet()) {
            entry.getValue().close();
            log.debug("已关闭表[{}]的列族句柄", entry.getKey());
        }
        handles.clear();
    }

    /**
     * 获取所有列族描述符（从TableEnum动态生成，保持定义顺序）
     */
    public static Map<TableEnum, ColumnFamilyDescriptor> getColumnFamilyDescriptors() {
        Map<TableEnum, ColumnFamilyDescriptor> descriptors = new LinkedHashMap<>();
        for (TableEnum table : TableEnum.values()) {
            descriptors.put(
                    table,
                    new ColumnFamilyDescriptor(
                            table.getColumnFamilyName().getBytes(StandardCharsets.UTF_8),
                            new ColumnFamilyOptions()
                    )
            );
        }
        return descriptors;
    }
}
