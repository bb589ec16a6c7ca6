package com.bit.wallet.structure.dto;

import lombok.Data;

/**
 * 解锁、查看助记词共用
 */
@Data
public class PasswordRequest {
    private String password;
}
