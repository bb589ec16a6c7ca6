package com.bit.wallet.structure.dto;

import lombok.Data;

@Data
public class RenameWalletRequest {
    private String name;
}
