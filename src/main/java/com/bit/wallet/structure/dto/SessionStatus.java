package com.bit.wallet.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatus {
    private boolean unlocked;
    private String walletId;
    private long expiresAt;//毫秒时间戳，锁定时为0
    private long remainingMillis;

    public static SessionStatus locked() {
        return new SessionStatus(false, null, 0L, 0L);
    }
}
