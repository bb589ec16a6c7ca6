package com.bit.wallet.derive;

import com.bit.wallet.chain.Chain;
import com.bit.wallet.chain.ChainFamily;
import com.bit.wallet.chain.CurveType;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.util.ByteUtils;
import com.bit.wallet.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.params.MainNetParams;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 分层确定性派生（BIP-32），覆盖 EVM 系与比特币
 * 注：基于 bitcoinj 的 HDKeyDerivation 实现
 */
@Slf4j
@Component
public class Secp256k1KeyDeriver implements KeyDeriver {

    // 私钥32字节
    private static final int PRIVATE_KEY_LENGTH = 32;
    // 以太坊地址取 Keccak 哈希后20字节
    private static final int EVM_ADDRESS_LENGTH = 20;

    @Override
    public CurveType curve() {
        return CurveType.SECP256K1;
    }

    @Override
    public byte[] derivePrivateKey(byte[] seed, Chain chain, int accountIndex) {
        checkCurve(chain);
        return derivePrivateKey(seed, chain.path(accountIndex));
    }

    /**
     * 按任意路径派生，中间节点不保留
     */
    public byte[] derivePrivateKey(byte[] seed, DerivationPath path) {
        if (seed == null || seed.length < 16 || seed.length > 64) {
            throw WalletException.invalidArgument("种子长度必须在16到64字节之间");
        }
        DeterministicKey key = HDKeyDerivation.createMasterPrivateKey(seed);
        for (int index : path.indexes()) {
            key = HDKeyDerivation.deriveChildKey(key, new ChildNumber(index));
        }
        byte[] privateKey = key.getPrivKeyBytes();
        if (privateKey.length != PRIVATE_KEY_LENGTH) {
            ByteUtils.wipe(privateKey);
            throw new IllegalStateException("派生私钥长度异常");
        }
        return privateKey;
    }

    /**
     * EVM 保存非压缩公钥（65字节），比特币保存压缩公钥（33字节）
     */
    @Override
    public byte[] derivePublicKey(byte[] privateKey, Chain chain) {
        checkCurve(chain);
        boolean compressed = chain.getFamily() == ChainFamily.BITCOIN;
        return ECKey.fromPrivate(privateKey, compressed).getPubKey();
    }

    @Override
    public String deriveAddress(byte[] publicKey, Chain chain) {
        checkCurve(chain);
        if (chain.getFamily() == ChainFamily.EVM) {
            return evmAddress(publicKey);
        }
        ECKey key = ECKey.fromPublicOnly(publicKey);
        if (!key.isCompressed()) {
            key = ECKey.fromPublicOnly(key.getPubKeyPoint(), true);
        }
        // 原生隔离见证 P2WPKH（bc1q...）
        return SegwitAddress.fromKey(MainNetParams.get(), key).toBech32();
    }

    /**
     * 0x + Keccak256(去掉0x04前缀的非压缩公钥) 的后20字节
     */
    public static String evmAddress(byte[] publicKey) {
        byte[] uncompressed = publicKey;
        if (publicKey.length == 33) {
            uncompressed = ECKey.fromPublicOnly(publicKey).decompress().getPubKey();
        }
        if (uncompressed.length != 65) {
            throw WalletException.invalidArgument("公钥长度非法: " + publicKey.length);
        }
        byte[] hash = Sha.applyKeccak256(Arrays.copyOfRange(uncompressed, 1, 65));
        return "0x" + ByteUtils.bytesToHex(Arrays.copyOfRange(hash, hash.length - EVM_ADDRESS_LENGTH, hash.length));
    }

    /**
     * 32字节且落在 [1, n-1] 区间
     */
    public static boolean isValidPrivateKey(byte[] privateKey) {
        if (privateKey == null || privateKey.length != PRIVATE_KEY_LENGTH) {
            return false;
        }
        BigInteger d = new BigInteger(1, privateKey);
        return d.signum() > 0 && d.compareTo(ECKey.CURVE.getN()) < 0;
    }

    private static void checkCurve(Chain chain) {
        if (chain.getCurve() != CurveType.SECP256K1) {
            throw new WalletException(ErrorType.UNSUPPORTED_CHAIN, chain + " 不是 secp256k1 链");
        }
    }
}
