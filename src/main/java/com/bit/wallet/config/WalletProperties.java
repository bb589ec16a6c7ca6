package com.bit.wallet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "wallet")
public class WalletProperties {

    private Storage storage = new Storage();
    private Kdf kdf = new Kdf();
    private Session session = new Session();
    private Password password = new Password();

    @Data
    public static class Storage {
        private String type = "rocksdb";//rocksdb | memory
        private String path = "./data/wallet";//保存路径
        private int cacheSize = 256;//钱包记录缓存条数
    }

    @Data
    public static class Kdf {
        private int iterations = 600_000;//PBKDF2 迭代次数，低于 600000 时按 600000 处理
        private int poolSize = 2;//KDF 工作线程数
    }

    @Data
    public static class Session {
        private long timeoutMinutes = 15;//滑动过期时间
        private boolean requireExplicitLock = true;//其他钱包解锁中时是否必须先 lock
    }

    @Data
    public static class Password {
        private int minLength = 8;
    }
}
