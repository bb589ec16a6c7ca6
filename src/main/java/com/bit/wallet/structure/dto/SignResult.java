package com.bit.wallet.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SignResult {
    private String chain;
    private String encoding;//hex 或 base64
    private String signed;
}
