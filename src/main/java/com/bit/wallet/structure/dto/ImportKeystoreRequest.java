package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class ImportKeystoreRequest {
    private String keystore;//V3 Keystore JSON 原文
    private String keystorePassword;
    private String name;
    private String password;//本地加密用的新密码
}
