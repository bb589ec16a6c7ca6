package com.bit.wallet.api;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.result.Result;
import com.bit.wallet.service.WalletService;
import com.bit.wallet.structure.dto.ChangePasswordRequest;
import com.bit.wallet.structure.dto.CreateWalletRequest;
import com.bit.wallet.structure.dto.CreateWalletResult;
import com.bit.wallet.structure.dto.ImportKeystoreRequest;
import com.bit.wallet.structure.dto.ImportPrivateKeyRequest;
import com.bit.wallet.structure.dto.PasswordRequest;
import com.bit.wallet.structure.dto.RecoverWalletRequest;
import com.bit.wallet.structure.dto.RenameWalletRequest;
import com.bit.wallet.structure.dto.SessionStatus;
import com.bit.wallet.structure.dto.SignMessageRequest;
import com.bit.wallet.structure.dto.SignRequest;
import com.bit.wallet.structure.dto.SignResult;
import com.bit.wallet.structure.wallet.WalletRecord;
import com.bit.wallet.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 本地钱包接口，KDF 相关操作异步返回
 */
@Slf4j
@RestController
@RequestMapping("/wallet")
public class WalletApi {

    @Autowired
    private WalletService walletService;

    //创建钱包，助记词只返回这一次
    @PostMapping("/create")
    public CompletableFuture<Result<CreateWalletResult>> create(@RequestBody CreateWalletRequest req) {
        return walletService.createWalletAsync(req.getName(), req.getPassword()).thenApply(Result::OK);
    }

    //通过助记词恢复
    @PostMapping("/recover")
    public CompletableFuture<Result<CreateWalletResult>> recover(@RequestBody RecoverWalletRequest req) {
        return walletService.recoverWalletAsync(req.getMnemonic(), req.getName(), req.getPassword()).thenApply(Result::OK);
    }

    //导入私钥，只生成 EVM 地址
    @PostMapping("/import/private-key")
    public CompletableFuture<Result<WalletRecord>> importPrivateKey(@RequestBody ImportPrivateKeyRequest req) {
        return walletService.importPrivateKeyAsync(req.getName(), req.getPrivateKey(), req.getPassword()).thenApply(Result::OK);
    }

    @PostMapping("/import/keystore")
    public CompletableFuture<Result<WalletRecord>> importKeystore(@RequestBody ImportKeystoreRequest req) {
        return walletService.importKeystoreAsync(req.getName(), req.getKeystore(), req.getKeystorePassword(), req.getPassword())
                .thenApply(Result::OK);
    }

    @PostMapping("/{id}/unlock")
    public CompletableFuture<Result<SessionStatus>> unlock(@PathVariable("id") String id, @RequestBody PasswordRequest req) {
        return walletService.unlockAsync(id, req.getPassword()).thenApply(Result::OK);
    }

    @PostMapping("/lock")
    public Result<SessionStatus> lock() {
        walletService.lock();
        return Result.OK(walletService.sessionStatus());
    }

    @GetMapping("/session")
    public Result<SessionStatus> session() {
        return Result.OK(walletService.sessionStatus());
    }

    @PostMapping("/session/refresh")
    public Result<SessionStatus> refresh() {
        return Result.OK(walletService.refreshSession());
    }

    // EVM 返回 0x 十六进制原始交易，其他链返回 Base64
    @PostMapping("/sign")
    public Result<SignResult> sign(@RequestBody SignRequest req) {
        byte[] signed = walletService.signTransaction(req.getChain(), req.getParams());
        return Result.OK(encode(req.getChain(), signed));
    }

    //消息签名，EVM 为 EIP-191 格式 r||s||v
    @PostMapping("/sign-message")
    public Result<SignResult> signMessage(@RequestBody SignMessageRequest req) {
        byte[] signature = walletService.signMessage(req.getChain(), req.getMessage());
        return Result.OK(encode(req.getChain(), signature));
    }

    private static SignResult encode(String chainId, byte[] signed) {
        Chain chain = Chain.fromId(chainId);
        if (chain.getFamily() == ChainFamily.EVM) {
            return new SignResult(chain.name(), "hex", "0x" + ByteUtils.bytesToHex(signed));
        }
        return new SignResult(chain.name(), "base64", Base64.getEncoder().encodeToString(signed));
    }

    @GetMapping("/list")
    public Result<List<WalletRecord>> list() {
        return Result.OK(walletService.listWallets());
    }

    @GetMapping("/{id}")
    public Result<WalletRecord> detail(@PathVariable("id") String id) {
        return Result.OK(walletService.getWallet(id));
    }

    @PutMapping("/{id}/name")
    public Result<WalletRecord> rename(@PathVariable("id") String id, @RequestBody RenameWalletRequest req) {
        return Result.OK(walletService.renameWallet(id, req.getName()));
    }

    @PutMapping("/{id}/password")
    public CompletableFuture<Result<Void>> changePassword(@PathVariable("id") String id, @RequestBody ChangePasswordRequest req) {
        return walletService.changePasswordAsync(id, req.getOldPassword(), req.getNewPassword()).thenApply(v -> Result.OK());
    }

    //备份用，每次都要求密码
    @PostMapping("/{id}/mnemonic")
    public CompletableFuture<Result<String>> mnemonic(@PathVariable("id") String id, @RequestBody PasswordRequest req) {
        return walletService.revealMnemonicAsync(id, req.getPassword()).thenApply(Result::OK);
    }

    @DeleteMapping("/{id}")
    public Result<Void> delete(@PathVariable("id") String id) {
        walletService.deleteWallet(id);
        return Result.OK();
    }
}
