package com.bit.wallet.derive;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.chain.CurveType;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.Ed25519Signer;
import com.bit.wallet.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Ed25519 分层派生（SLIP-10），只支持强化派生，覆盖 Solana 与 TON
 */
@Slf4j
@Component
public class Ed25519KeyDeriver implements KeyDeriver {

    // SLIP-10 根密钥 HMAC 的 key
    private static final byte[] ED25519_SEED = "ed25519 seed".getBytes(StandardCharsets.UTF_8);

    @Override
    public CurveType curve() {
        return CurveType.ED25519;
    }

    @Override
    public byte[] derivePrivateKey(byte[] seed, Chain chain, int accountIndex) {
        checkCurve(chain);
        return derivePrivateKey(seed, chain.path(accountIndex));
    }

    public byte[] derivePrivateKey(byte[] seed, DerivationPath path) {
        if (seed == null || seed.length < 16 || seed.length > 64) {
            throw WalletException.invalidArgument("种子长度必须在16到64字节之间");
        }
        byte[] i = hmacSha512(ED25519_SEED, seed);
        byte[] key = Arrays.copyOfRange(i, 0, 32);
        byte[] chainCode = Arrays.copyOfRange(i, 32, 64);
        ByteUtils.wipe(i);
        try {
            for (int index : path.indexes()) {
                if (!DerivationPath.isHardened(index)) {
                    throw WalletException.invalidArgument("Ed25519 只支持强化派生: " + path);
                }
                byte[] data = ByteUtils.concat(new byte[]{0}, key, ByteUtils.intToBytes(index));
                byte[] child = hmacSha512(chainCode, data);
                ByteUtils.wipe(data);
                ByteUtils.wipe(key);
                ByteUtils.wipe(chainCode);
                key = Arrays.copyOfRange(child, 0, 32);
                chainCode = Arrays.copyOfRange(child, 32, 64);
                ByteUtils.wipe(child);
            }
            return key;
        } catch (RuntimeException e) {
            ByteUtils.wipe(key);
            throw e;
        } finally {
            ByteUtils.wipe(chainCode);
        }
    }

    @Override
    public byte[] derivePublicKey(byte[] privateKey, Chain chain) {
        checkCurve(chain);
        return Ed25519Signer.derivePublicKey(privateKey);
    }

    /**
     * SOL: Base58(公钥)；TON: 原始格式 0:hex(SHA256(公钥))
     */
    @Override
    public String deriveAddress(byte[] publicKey, Chain chain) {
        checkCurve(chain);
        if (publicKey == null || publicKey.length != Ed25519Signer.CORE_KEY_LENGTH) {
            throw WalletException.invalidArgument("Ed25519 公钥必须为32字节");
        }
        if (chain.getFamily() == ChainFamily.SOLANA) {
            return Base58.encode(publicKey);
        }
        return "0:" + ByteUtils.bytesToHex(Sha.applySHA256(publicKey));
    }

    private static byte[] hmacSha512(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }

    private static void checkCurve(Chain chain) {
        if (chain.getCurve() != CurveType.ED25519) {
            throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, chain + " 不是 ed25519 链");
        }
    }
}
