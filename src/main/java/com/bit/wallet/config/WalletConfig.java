package com.bit.wallet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class WalletConfig {

    public static final String KDF_EXECUTOR = "kdfExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * PBKDF2（60万次迭代）是CPU密集型操作，放到独立线程池执行，调用方通过 CompletableFuture 等待结果
     */
    @Bean(name = KDF_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService kdfExecutor(WalletProperties properties) {
        int poolSize = Math.max(1, properties.getKdf().getPoolSize());
        log.info("KDF线程池初始化，线程数: {}", poolSize);
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(64),
                new ThreadFactory() {
                    private final AtomicInteger seq = new AtomicInteger(0);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "wallet-kdf-" + seq.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy() // 队列满直接拒绝，不在调用线程上执行KDF
        );
    }
}
