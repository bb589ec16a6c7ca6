package com.bit.wallet.store;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.database.DataBase;
import com.bit.wallet.database.TableEnum;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.wallet.WalletRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 钱包记录持久化：表 WALLET，key = "wallet_{id}"，value = UTF-8 JSON
 * 缓存的是 JSON 文本，每次读取都反序列化出新对象，调用方修改不会影响缓存
 */
@Slf4j
@Component
public class WalletStore {

    public static final String KEY_PREFIX = "wallet_";

    private final DataBase dataBase;
    private final ObjectMapper objectMapper;
    private final Cache<String, String> cache;

    @Autowired
    public WalletStore(DataBase dataBase, WalletProperties properties) {
        this(dataBase, properties.getStorage().getCacheSize());
    }

    public WalletStore(DataBase dataBase, int cacheSize) {
        this.dataBase = dataBase;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, cacheSize))
                .build();
    }

    public static String storageKey(String walletId) {
        return KEY_PREFIX + walletId;
    }

    public void save(WalletRecord record) {
        if (record == null || record.getId() == null || record.getId().isBlank()) {
            throw WalletException.invalidArgument("钱包记录缺少ID");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new WalletException(ErrorType.STORAGE_FAILURE, "钱包记录序列化失败", e);
        }
        String key = storageKey(record.getId());
        dataBase.insert(TableEnum.WALLET, key.getBytes(StandardCharsets.UTF_8), json.getBytes(StandardCharsets.UTF_8));
        cache.put(key, json);
        log.debug("钱包记录已保存: {}", record.getId());
    }

    public Optional<WalletRecord> find(String walletId) {
        if (walletId == null || walletId.isBlank()) {
            return Optional.empty();
        }
        String key = storageKey(walletId);
        String json = cache.getIfPresent(key);
        if (json == null) {
            byte[] value = dataBase.get(TableEnum.WALLET, key.getBytes(StandardCharsets.UTF_8));
            if (value == null) {
                return Optional.empty();
            }
            json = new String(value, StandardCharsets.UTF_8);
            cache.put(key, json);
        }
        return Optional.of(parse(json, walletId));
    }

    public WalletRecord load(String walletId) {
        return find(walletId).orElseThrow(() -> WalletException.notFound(walletId));
    }

    public boolean exists(String walletId) {
        if (walletId == null || walletId.isBlank()) {
            return false;
        }
        String key = storageKey(walletId);
        return cache.getIfPresent(key) != null
                || dataBase.isExist(TableEnum.WALLET, key.getBytes(StandardCharsets.UTF_8));
    }

    public void delete(String walletId) {
        if (!exists(walletId)) {
            throw WalletException.notFound(walletId);
        }
        String key = storageKey(walletId);
        dataBase.delete(TableEnum.WALLET, key.getBytes(StandardCharsets.UTF_8));
        cache.invalidate(key);
        log.debug("钱包记录已删除: {}", walletId);
    }

    /**
     * 全部钱包，按创建时间升序
     */
    public List<WalletRecord> list() {
        List<WalletRecord> records = new ArrayList<>();
        dataBase.iterate(TableEnum.WALLET, (key, value) -> {
            String k = new String(key, StandardCharsets.UTF_8);
            if (k.startsWith(KEY_PREFIX)) {
                records.add(parse(new String(value, StandardCharsets.UTF_8), k.substring(KEY_PREFIX.length())));
            }
            return true;
        });
        records.sort(Comparator.comparingLong(WalletRecord::getCreatedAt).thenComparing(WalletRecord::getId));
        return records;
    }

    private WalletRecord parse(String json, String walletId) {
        try {
            WalletRecord record = objectMapper.readValue(json, WalletRecord.class);
            if (record.upgrade()) {
                log.info("钱包记录 {} 已从旧版本升级到 v{}", walletId, WalletRecord.CURRENT_VERSION);
            }
            return record;
        } catch (JsonProcessingException e) {
            throw new WalletException(ErrorType.STORAGE_FAILURE, "钱包记录解析失败: " + walletId, e);
        }
    }
}
