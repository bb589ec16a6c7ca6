package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class ImportPrivateKeyRequest {
    private String privateKey;//64位十六进制，可带 0x
    private String name;
    private String password;
}
