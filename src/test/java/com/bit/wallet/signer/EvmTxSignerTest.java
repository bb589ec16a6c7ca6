package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.util.ByteUtils;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class EvmTxSignerTest {

    private final EvmTxSigner signer = new EvmTxSigner();

    // EIP-155 示例交易
    @Test
    void eip155ReferenceTransaction() {
        byte[] privateKey = ByteUtils.hexToBytes("4646464646464646464646464646464646464646464646464646464646464646");
        TransactionParams params = TransactionParams.builder()
                .nonce(BigInteger.valueOf(9))
                .gasPrice(new BigInteger("20000000000"))
                .gasLimit(BigInteger.valueOf(21000))
                .to("0x3535353535353535353535353535353535353535")
                .value(new BigInteger("1000000000000000000"))
                .chainId(1L)
                .build();
        byte[] signed = signer.sign(Chain.ETH, privateKey, params);
        assertEquals("f86c098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a7640000"
                        + "8025a028ef61340bd939bc2195fe537567866003e1a15d3c71ff63e1590620aa636276"
                        + "a067cbe9d8997f761aecb703304b3800ccf555c9f3dc64214b297fb1966a3b6d83",
                ByteUtils.bytesToHex(signed));
    }

    @Test
    void missingFieldsAreRejected() {
        byte[] privateKey = ByteUtils.hexToBytes("4646464646464646464646464646464646464646464646464646464646464646");
        TransactionParams noGasPrice = TransactionParams.builder().nonce(BigInteger.ONE).build();
        assertEquals(ErrorType.INVALID_ARGUMENT,
                assertThrows(WalletException.class, () -> signer.sign(Chain.ETH, privateKey, noGasPrice)).getErrorType());
        TransactionParams shortTo = TransactionParams.builder()
                .nonce(BigInteger.ONE).gasPrice(BigInteger.ONE).to("0x1234").build();
        assertEquals(ErrorType.INVALID_ARGUMENT,
                assertThrows(WalletException.class, () -> signer.sign(Chain.ETH, privateKey, shortTo)).getErrorType());
    }
}
