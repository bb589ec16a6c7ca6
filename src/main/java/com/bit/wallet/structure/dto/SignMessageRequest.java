package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class SignMessageRequest {
    private String chain;
    private String message;
}
