package com.bit.wallet.signer;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.derive.MultiChainDeriver;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.session.SessionManager;
import com.bit.wallet.structure.key.KeyInfo;
import com.bit.wallet.structure.key.SecretBytes;
import com.bit.wallet.structure.tx.TransactionParams;
import com.bit.wallet.structure.wallet.WalletType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 签名分发：先检查会话，再解析链、从会话主密钥重新派生私钥、交给对应链族签名器，私钥用完清零
 */
@Slf4j
@Component
public class SigningDispatcher {

    private final Map<ChainFamily, ChainSigner> signers = new EnumMap<>(ChainFamily.class);
    private final MultiChainDeriver deriver;
    private final SessionManager sessionManager;

    @Autowired
    public SigningDispatcher(List<ChainSigner> signerList, MultiChainDeriver deriver, SessionManager sessionManager) {
        for (ChainSigner signer : signerList) {
            if (signers.put(signer.family(), signer) != null) {
                throw new IllegalStateException("链族 " + signer.family() + " 存在多个签名器");
            }
        }
        // 能力表必须完整，缺失在启动时暴露
        for (ChainFamily family : ChainFamily.values()) {
            if (!signers.containsKey(family)) {
                throw new IllegalStateException("缺少链族 " + family + " 的签名器");
            }
        }
        this.deriver = deriver;
        this.sessionManager = sessionManager;
    }

    public byte[] sign(String chainId, TransactionParams params) {
        Chain chain = resolve(chainId);
        if (params == null) {
            throw WalletException.invalidArgument("缺少交易参数");
        }
        ChainSigner signer = signers.get(chain.getFamily());
        byte[] signed = withChainKey(chain, privateKey -> signer.sign(chain, privateKey, params));
        log.info("钱包 {} 完成 {} 签名", sessionManager.activeWalletId().orElse("-"), chain);
        return signed;
    }

    public byte[] signMessage(String chainId, String message) {
        Chain chain = resolve(chainId);
        if (message == null || message.isEmpty()) {
            throw WalletException.invalidArgument("消息为空");
        }
        ChainSigner signer = signers.get(chain.getFamily());
        byte[] signature = withChainKey(chain, privateKey -> signer.signMessage(chain, privateKey, message));
        log.info("钱包 {} 完成 {} 消息签名", sessionManager.activeWalletId().orElse("-"), chain);
        return signature;
    }

    // 锁定状态下不做任何派生，也不解析链
    private Chain resolve(String chainId) {
        if (!sessionManager.isUnlocked()) {
            throw WalletException.locked();
        }
        return Chain.fromId(chainId);
    }

    private byte[] withChainKey(Chain chain, Function<byte[], byte[]> action) {
        return sessionManager.withSessionKey((walletType, masterKey) -> {
            try (SecretBytes privateKey = privateKeyFor(walletType, masterKey, chain)) {
                return action.apply(privateKey.bytes());
            } catch (WalletException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("{} 签名失败", chain, e);
                throw new WalletException(ErrorType.SIGNING_FAILED, chain + " 签名失败", e);
            }
        });
    }

    private SecretBytes privateKeyFor(WalletType walletType, byte[] masterKey, Chain chain) {
        if (walletType == WalletType.PRIVATE_KEY) {
            // 导入的私钥只对应 EVM 地址
            if (chain.getFamily() != ChainFamily.EVM) {
                throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, "私钥导入的钱包不支持 " + chain);
            }
            return SecretBytes.wrap(masterKey.clone());
        }
        KeyInfo key = deriver.derive(masterKey, chain, MultiChainDeriver.DEFAULT_ACCOUNT_INDEX);
        // 接管私钥数组，close 时清零
        return SecretBytes.wrap(key.getPrivateKey());
    }
}
