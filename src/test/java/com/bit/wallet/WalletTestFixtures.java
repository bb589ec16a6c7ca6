package com.bit.wallet;

import com.bit.wallet.config.WalletProperties;
import com.bit.wallet.database.memory.MemoryDb;
import com.bit.wallet.derive.Ed25519KeyDeriver;
import com.bit.wallet.derive.MultiChainDeriver;
import com.bit.wallet.derive.Secp256k1KeyDeriver;
import com.bit.wallet.mnemonic.MnemonicGenerator;
import com.bit.wallet.service.impl.WalletServiceImpl;
import com.bit.wallet.session.SessionManager;
import com.bit.wallet.signer.BitcoinTxSigner;
import com.bit.wallet.signer.EvmTxSigner;
import com.bit.wallet.signer.SigningDispatcher;
import com.bit.wallet.signer.SolanaTxSigner;
import com.bit.wallet.signer.TonTxSigner;
import com.bit.wallet.store.WalletStore;
import com.bit.wallet.vault.KeystoreDecoder;
import com.bit.wallet.vault.MnemonicVault;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 不启动 Spring 容器，手工装配钱包组件
 */
public class WalletTestFixtures {

    public static final String ABANDON_MNEMONIC =
            "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about";
    public static final String PASSWORD = "CorrectHorseBatteryStaple!";

    public final MutableClock clock = MutableClock.startingAtEpoch();
    public final MnemonicGenerator mnemonicGenerator = new MnemonicGenerator();
    public final MultiChainDeriver deriver = newDeriver();
    public final MnemonicVault vault = new MnemonicVault(MnemonicVault.MIN_ITERATIONS);
    public final KeystoreDecoder keystoreDecoder = new KeystoreDecoder();
    public final MemoryDb dataBase = new MemoryDb();
    public final WalletStore store = new WalletStore(dataBase, 16);
    public final SessionManager sessionManager;
    public final SigningDispatcher dispatcher;
    public final ExecutorService kdfExecutor = Executors.newFixedThreadPool(2);
    public final WalletServiceImpl service;

    public WalletTestFixtures() {
        this(true);
    }

    public WalletTestFixtures(boolean requireExplicitLock) {
        sessionManager = new SessionManager(clock, Duration.ofMinutes(15), requireExplicitLock);
        dispatcher = newDispatcher(deriver, sessionManager);
        service = new WalletServiceImpl(mnemonicGenerator, deriver, vault, keystoreDecoder, store, sessionManager,
                dispatcher, kdfExecutor, clock, new WalletProperties());
    }

    public static MultiChainDeriver newDeriver() {
        return new MultiChainDeriver(List.of(new Secp256k1KeyDeriver(), new Ed25519KeyDeriver()));
    }

    public static SigningDispatcher newDispatcher(MultiChainDeriver deriver, SessionManager sessionManager) {
        return new SigningDispatcher(
                List.of(new EvmTxSigner(), new BitcoinTxSigner(), new SolanaTxSigner(), new TonTxSigner()),
                deriver, sessionManager);
    }

    public void shutdown() {
        kdfExecutor.shutdownNow();
    }
}
