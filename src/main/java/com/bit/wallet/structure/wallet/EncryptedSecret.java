package com.bit.wallet.structure.wallet;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 加密后的秘密（助记词或私钥），二进制字段均为标准 Base64
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedSecret {

    public static final String ALGORITHM = "AES-256-GCM";

    @JsonProperty("ciphertext")
    private String ciphertext;//密文+16字节认证标签
    @JsonProperty("salt")
    private String salt;
    @JsonProperty("nonce")
    private String nonce;
    @JsonProperty("algorithm")
    private String algorithm = ALGORITHM;
    @JsonProperty("iterations")
    private int iterations;
}
