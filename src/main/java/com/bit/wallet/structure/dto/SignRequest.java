package com.bit.wallet.structure.dto;

import com.bit.wallet.structure.tx.TransactionParams;
import lombok.Data;

@Data
public class SignRequest {
    private String chain;
    private TransactionParams params;
}
