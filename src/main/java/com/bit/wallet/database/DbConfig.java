package com.bit.wallet.database;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 按配置打开存储，容器关闭时释放
 */
@Slf4j
@Component
@Order(0)
public class DbConfig {

    private final WalletProperties properties;
    private final DataBase dataBase;

    @Autowired
    public DbConfig(WalletProperties properties, DataBase dataBase) {
        this.properties = properties;
        this.dataBase = dataBase;
    }

    @PostConstruct
    public void init() {
        WalletProperties.Storage storage = properties.getStorage();
        log.info("钱包存储类型:{} 路径:{}", storage.getType(), storage.getPath());
        boolean created = dataBase.createDatabase(storage);
        if (!created) {
            throw new WalletException(ErrorType.STORAGE_FAILURE, "数据库创建失败: " + storage.getPath());
        }
    }

    @PreDestroy
    public void destroy() {
        dataBase.closeDatabase();
    }
}
