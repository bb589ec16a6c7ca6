package com.bit.wallet.chain;

import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChainTest {

    @Test
    void resolvesNamesAndAliasesCaseInsensitively() {
        assertEquals(Chain.ETH, Chain.fromId("eth"));
        assertEquals(Chain.ETH, Chain.fromId(" Ethereum "));
        assertEquals(Chain.POLYGON, Chain.fromId("matic"));
        assertEquals(Chain.BTC, Chain.fromId("bitcoin"));
        assertEquals(Chain.TON, Chain.fromId("TON"));
    }

    @Test
    void unknownChainNeverFallsBack() {
        WalletException e = assertThrows(WalletException.class, () -> Chain.fromId("DOGE"));
        assertEquals(ErrorType.UNSUPPORTED_CHAIN, e.getErrorType());
        assertEquals(ErrorType.UNSUPPORTED_CHAIN,
                assertThrows(WalletException.class, () -> Chain.fromId("")).getErrorType());
        assertEquals(ErrorType.UNSUPPORTED_CHAIN,
                assertThrows(WalletException.class, () -> Chain.fromId(null)).getErrorType());
    }

    @Test
    void fixedDerivationPaths() {
        assertEquals("m/44'/60'/0'/0/0", Chain.ETH.defaultPath().toString());
        assertEquals("m/44'/60'/0'/0/0", Chain.BSC.defaultPath().toString());
        assertEquals("m/84'/0'/0'/0/0", Chain.BTC.defaultPath().toString());
        assertEquals("m/44'/501'/0'/0'", Chain.SOL.defaultPath().toString());
        assertEquals("m/44'/607'/0'/0'/0'/0'", Chain.TON.defaultPath().toString());
    }

    @Test
    void accountIndexKeepsHardenedFlagOfLastLevel() {
        assertEquals("m/44'/60'/0'/0/3", Chain.ETH.path(3).toString());
        assertEquals("m/44'/501'/0'/3'", Chain.SOL.path(3).toString());
    }

    @Test
    void curvesFollowFamily() {
        assertEquals(CurveType.SECP256K1, Chain.BTC.getCurve());
        assertEquals(CurveType.ED25519, Chain.TON.getCurve());
        assertEquals(56L, Chain.BSC.getEvmChainId());
    }
}
