package com.fleet.admin.common.utils;

import cn.hutool.core.util.HexUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.digest.DigestUtil;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * X25519 密钥生成与派生
 * Reality 密钥使用 base64url 无填充编码，WireGuard / AmneziaWG 使用标准 base64
 */
public class KeyUtil {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final String AWG_KEY_SALT = "amneziawg-key-salt";
    private static final String RELAY_SEPARATOR = ":relay:";
    private static final int KEY_LENGTH = 32;
    private static final int SHORT_ID_BYTES = 8;

    private KeyUtil() {
    }

    public static RealityKeys generateRealityKeypair() {
        X25519PrivateKeyParameters privateKey = new X25519PrivateKeyParameters(RANDOM);
        byte[] shortId = new byte[SHORT_ID_BYTES];
        RANDOM.nextBytes(shortId);

        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return new RealityKeys(
                encoder.encodeToString(privateKey.getEncoded()),
                encoder.encodeToString(privateKey.generatePublicKey().getEncoded()),
                HexUtil.encodeHexStr(shortId));
    }

    public static X25519KeyPair generateWireguardKeypair() {
        return toStandardPair(new X25519PrivateKeyParameters(RANDOM));
    }

    /**
     * 由种子确定性派生 AmneziaWG 客户端密钥，相同种子总是得到相同的密钥对
     */
    public static X25519KeyPair deriveDeterministicKey(String seed) {
        byte[] k = DigestUtil.sha256(StrUtil.nullToEmpty(seed) + AWG_KEY_SALT);
        k[0] &= (byte) 248;
        k[31] &= (byte) 127;
        k[31] |= (byte) 64;
        return toStandardPair(new X25519PrivateKeyParameters(k, 0));
    }

    /**
     * 私钥合法：去除空白后为 base64url 无填充编码的 32 字节
     */
    public static boolean isValidPrivateKey(String key) {
        if (StringUtils.isBlank(key)) {
            return false;
        }
        String trimmed = key.trim();
        if (trimmed.contains("=") || StringUtils.containsWhitespace(trimmed)) {
            return false;
        }
        try {
            return Base64.getUrlDecoder().decode(trimmed).length == KEY_LENGTH;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * 把标准 base64 的 Reality 私钥转换为 url-safe 无填充形式
     */
    public static String normalizeRealityKey(String key) {
        if (key == null) {
            return null;
        }
        return key.trim().replace('+', '-').replace('/', '_').replace("=", "");
    }

    /**
     * 中转认证密码：hex(sha256(token ":relay:" targetId))，绑定到具体的目标节点
     */
    public static String deriveRelayPassword(String joinToken, Long targetNodeId) {
        String material = StringUtils.trimToEmpty(joinToken) + RELAY_SEPARATOR + targetNodeId;
        return DigestUtil.sha256Hex(material.getBytes(StandardCharsets.UTF_8));
    }

    private static X25519KeyPair toStandardPair(X25519PrivateKeyParameters privateKey) {
        Base64.Encoder encoder = Base64.getEncoder();
        return new X25519KeyPair(
                encoder.encodeToString(privateKey.getEncoded()),
                encoder.encodeToString(privateKey.generatePublicKey().getEncoded()));
    }

    @Data
    public static class RealityKeys {
        private final String privateKey;
        private final String publicKey;
        private final String shortId;
    }

    @Data
    public static class X25519KeyPair {
        private final String privateKey;
        private final String publicKey;
    }
}
