package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class CreateWalletRequest {
    private String name;
    private String password;
}
