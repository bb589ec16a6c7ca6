package com.bit.wallet.session;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.wallet.WalletType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * 解锁会话管理：Locked ⇄ Unlocked 状态机。
 * 同一时刻最多一个会话，过期为惰性检查（没有后台定时器），每次成功签名或显式刷新都会滑动延长
 */
@Slf4j
@Component
public class SessionManager {

    private final Clock clock;
    private final Duration timeout;
    private final boolean requireExplicitLock;

    // 由实例监视器保护
    private SessionKey current;

    @Autowired
    public SessionManager(Clock clock, WalletProperties properties) {
        this(clock,
                Duration.ofMinutes(properties.getSession().getTimeoutMinutes()),
                properties.getSession().isRequireExplicitLock());
    }

    public SessionManager(Clock clock, Duration timeout, boolean requireExplicitLock) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("会话超时必须为正数");
        }
        this.clock = clock;
        this.timeout = timeout;
        this.requireExplicitLock = requireExplicitLock;
    }

    /**
     * 解锁前置检查：其他钱包的会话仍有效且要求显式锁定时直接失败，放在 KDF 之前调用
     */
    public synchronized void checkStartAllowed(String walletId) {
        if (!requireExplicitLock || !isUnlocked()) {
            return;
        }
        if (!current.getWalletId().equals(walletId)) {
            throw new WalletException(ErrorType.SESSION_CONFLICT,
                    "钱包 " + current.getWalletId() + " 仍处于解锁状态，请先锁定");
        }
    }

    /**
     * 开启会话，复制主密钥（调用方仍负责清零自己的副本）。旧会话被清零替换，不叠加
     */
    public synchronized void start(String walletId, WalletType walletType, byte[] masterKey) {
        if (walletId == null || walletType == null || masterKey == null || masterKey.length == 0) {
            throw WalletException.invalidArgument("会话参数为空");
        }
        checkStartAllowed(walletId);
        clear();
        Instant now = clock.instant();
        current = new SessionKey(walletId, walletType, masterKey.clone(), now, now.plus(timeout));
        log.info("钱包 {} 已解锁，过期时间 {}", walletId, current.getExpiresAt());
    }

    /**
     * 到期即清零并丢弃会话
     */
    public synchronized boolean isUnlocked() {
        if (current == null) {
            return false;
        }
        if (current.isExpired(clock.instant())) {
            log.info("钱包 {} 会话已过期，自动锁定", current.getWalletId());
            clear();
            return false;
        }
        return true;
    }

    public synchronized boolean isUnlocked(String walletId) {
        return isUnlocked() && current.getWalletId().equals(walletId);
    }

    public synchronized void lock() {
        if (current != null) {
            String walletId = current.getWalletId();
            clear();
            log.info("钱包 {} 已锁定", walletId);
        }
    }

    /**
     * 仅当活动会话属于该钱包时锁定
     */
    public synchronized void lockIfActive(String walletId) {
        if (current != null && current.getWalletId().equals(walletId)) {
            lock();
        }
    }

    /**
     * 滑动续期：expires_at = now + timeout
     */
    public synchronized Instant refresh() {
        if (!isUnlocked()) {
            throw WalletException.locked();
        }
        current.extendTo(clock.instant().plus(timeout));
        return current.getExpiresAt();
    }

    /**
     * 在会话有效期内使用主密钥（连同钱包类型），成功后续期。主密钥不会离开本方法
     */
    public synchronized <T> T withSessionKey(BiFunction<WalletType, byte[], T> action) {
        if (!isUnlocked()) {
            throw WalletException.locked();
        }
        T result = action.apply(current.getWalletType(), current.masterKey());
        // 操作可能耗时，成功后再按当前时间续期
        if (current != null) {
            current.extendTo(clock.instant().plus(timeout));
        }
        return result;
    }

    public synchronized Optional<String> activeWalletId() {
        return isUnlocked() ? Optional.of(current.getWalletId()) : Optional.empty();
    }

    public synchronized Optional<Instant> expiresAt() {
        return isUnlocked() ? Optional.of(current.getExpiresAt()) : Optional.empty();
    }

    public synchronized long remainingMillis() {
        if (!isUnlocked()) {
            return 0L;
        }
        return Math.max(0L, Duration.between(clock.instant(), current.getExpiresAt()).toMillis());
    }

    /**
     * 供外部定时器调用，返回本次是否发生了过期锁定
     */
    public synchronized boolean expireIfDue() {
        return current != null && !isUnlocked();
    }

    @PreDestroy
    public synchronized void shutdown() {
        lock();
    }

    private void clear() {
        if (current != null) {
            current.close();
            current = null;
        }
    }
}
