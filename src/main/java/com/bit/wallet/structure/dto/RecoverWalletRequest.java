package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class RecoverWalletRequest {
    private String mnemonic;
    private String name;
    private String password;
}
