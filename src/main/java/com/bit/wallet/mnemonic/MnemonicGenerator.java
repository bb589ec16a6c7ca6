package com.bit.wallet.mnemonic;

import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.exception.WalletException;
import com.bit.wallet.structure.key.SecretBytes;
import com.bit.wallet.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * BIP-39 助记词：生成、规范化、校验（英文词表 + 校验和）、转种子
 */
@Slf4j
@Component
public class MnemonicGenerator {

    // 24个单词对应256位熵
    private static final int ENTROPY_LENGTH = 32;
    private static final int SEED_LENGTH = 64;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * 生成 24 个单词的助记词
     */
    public List<String> generate() {
        byte[] entropy = new byte[ENTROPY_LENGTH];
        try {
            secureRandom.nextBytes(entropy);
            return mnemonicCode().toMnemonic(entropy);
        } catch (Exception e) {
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "生成助记词失败", e);
        } finally {
            ByteUtils.wipe(entropy);
        }
    }

    /**
     * 去首尾空白、转小写、按任意空白切分，然后校验单词数、词表和校验和
     */
    public List<String> parse(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "助记词为空");
        }
        List<String> words = Arrays.asList(phrase.trim().toLowerCase(Locale.ROOT).split("\\s+"));
        validate(words);
        return words;
    }

    public void validate(List<String> words) {
        if (words == null || (words.size() != 12 && words.size() != 24)) {
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "单词数必须为12或24");
        }
        try {
            mnemonicCode().check(words);
        } catch (MnemonicException.MnemonicWordException e) {
            // 不回显用户输入的单词
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "存在不在词表中的单词");
        } catch (MnemonicException.MnemonicChecksumException e) {
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "校验和错误");
        } catch (MnemonicException e) {
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "助记词格式错误");
        }
    }

    public boolean isValid(String phrase) {
        try {
            parse(phrase);
            return true;
        } catch (WalletException e) {
            return false;
        }
    }

    /**
     * BIP-39 种子（PBKDF2-HMAC-SHA512，空口令），64字节
     */
    public SecretBytes toSeed(List<String> words) {
        validate(words);
        byte[] seed = MnemonicCode.toSeed(words, "");
        if (seed.length != SEED_LENGTH) {
            ByteUtils.wipe(seed);
            throw new WalletException(ErrorType.INVALID_MNEMONIC, "种子长度异常");
        }
        return SecretBytes.wrap(seed);
    }

    public static String join(List<String> words) {
        return String.join(" ", words);
    }

    private static MnemonicCode mnemonicCode() {
        MnemonicCode code = MnemonicCode.INSTANCE;
        if (code == null) {
            throw new IllegalStateException("BIP-39 英文词表加载失败");
        }
        return code;
    }
}
