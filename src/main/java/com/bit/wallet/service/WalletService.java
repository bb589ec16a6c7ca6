package com.bit.wallet.service;

import com.bit.wallet.structure.dto.CreateWalletResult;
import com.bit.wallet.structure.dto.SessionStatus;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.structure.wallet.WalletRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface WalletService {

    CreateWalletResult createWallet(String name, String password);

    CreateWalletResult recoverWallet(String mnemonic, String name, String password);

    WalletRecord importPrivateKey(String name, String privateKeyHex, String password);

    WalletRecord importKeystore(String name, String keystoreJson, String keystorePassword, String password);

    SessionStatus unlock(String walletId, String password);

    //KDF 在独立线程池执行
    CompletableFuture<CreateWalletResult> createWalletAsync(String name, String password);

    CompletableFuture<CreateWalletResult> recoverWalletAsync(String mnemonic, String name, String password);

    CompletableFuture<WalletRecord> importPrivateKeyAsync(String name, String privateKeyHex, String password);

    CompletableFuture<WalletRecord> importKeystoreAsync(String name, String keystoreJson, String keystorePassword, String password);

    CompletableFuture<SessionStatus> unlockAsync(String walletId, String password);

    CompletableFuture<Void> changePasswordAsync(String walletId, String oldPassword, String newPassword);

    CompletableFuture<String> revealMnemonicAsync(String walletId, String password);

    void lock();

    boolean isUnlocked();

    SessionStatus sessionStatus();

    SessionStatus refreshSession();

    byte[] signTransaction(String chain, TransactionParams params);

    byte[] signMessage(String chain, String message);

    List<WalletRecord> listWallets();

    WalletRecord getWallet(String walletId);

    void deleteWallet(String walletId);

    WalletRecord renameWallet(String walletId, String name);

    void changePassword(String walletId, String oldPassword, String newPassword);

    String revealMnemonic(String walletId, String password);
}
