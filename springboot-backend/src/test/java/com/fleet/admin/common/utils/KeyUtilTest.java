package com.fleet.admin.common.utils;

import cn.hutool.crypto.digest.DigestUtil;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Base64;

class KeyUtilTest {

    @Test
    void realityKeypairIsUrlSafeWithoutPadding() {
        KeyUtil.RealityKeys keys = KeyUtil.generateRealityKeypair();

        Assertions.assertEquals(43, keys.getPrivateKey().length());
        Assertions.assertEquals(43, keys.getPublicKey().length());
        Assertions.assertFalse(keys.getPrivateKey().contains("="));
        Assertions.assertTrue(KeyUtil.isValidPrivateKey(keys.getPrivateKey()));
        Assertions.assertTrue(keys.getShortId().matches("[0-9a-f]{16}"));
    }

    @Test
    void wireguardKeypairUsesStandardBase64() {
        KeyUtil.X25519KeyPair keys = KeyUtil.generateWireguardKeypair();

        Assertions.assertEquals(32, Base64.getDecoder().decode(keys.getPrivateKey()).length);
        Assertions.assertEquals(32, Base64.getDecoder().decode(keys.getPublicKey()).length);
        Assertions.assertTrue(keys.getPrivateKey().endsWith("="));
    }

    @Test
    void deterministicKeyIsStableAndClamped() {
        KeyUtil.X25519KeyPair first = KeyUtil.deriveDeterministicKey("5b3c1f0e-1111-2222-3333-444455556666");
        KeyUtil.X25519KeyPair second = KeyUtil.deriveDeterministicKey("5b3c1f0e-1111-2222-3333-444455556666");
        KeyUtil.X25519KeyPair other = KeyUtil.deriveDeterministicKey("another-subscription");

        Assertions.assertEquals(first, second);
        Assertions.assertNotEquals(first.getPrivateKey(), other.getPrivateKey());

        byte[] scalar = Base64.getDecoder().decode(first.getPrivateKey());
        Assertions.assertEquals(0, scalar[0] & 7);
        Assertions.assertEquals(0, scalar[31] & 0x80);
        Assertions.assertEquals(0x40, scalar[31] & 0x40);
    }

    @Test
    void deterministicKeyIsSaltedSha256() {
        byte[] expected = DigestUtil.sha256("seed" + "amneziawg-key-salt");
        expected[0] &= (byte) 248;
        expected[31] &= (byte) 127;
        expected[31] |= (byte) 64;

        Assertions.assertEquals(Base64.getEncoder().encodeToString(expected),
                KeyUtil.deriveDeterministicKey("seed").getPrivateKey());
    }

    @Test
    void privateKeyValidity() {
        String valid = KeyUtil.generateRealityKeypair().getPrivateKey();

        Assertions.assertTrue(KeyUtil.isValidPrivateKey(valid));
        Assertions.assertTrue(KeyUtil.isValidPrivateKey("  " + valid + "\n"));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey(null));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey(""));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey("short"));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey(valid + "="));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey(valid.substring(0, 20) + " " + valid.substring(21)));
        Assertions.assertFalse(KeyUtil.isValidPrivateKey(valid + valid));
        // 标准 base64 字符不属于 url-safe 字母表
        Assertions.assertFalse(KeyUtil.isValidPrivateKey("+" + valid.substring(1)));
    }

    @Test
    void normalizeRealityKeyConvertsStandardAlphabet() {
        byte[] raw = new byte[32];
        raw[0] = (byte) 0xfb;
        raw[1] = (byte) 0xff;
        String standard = Base64.getEncoder().encodeToString(raw);

        String normalized = KeyUtil.normalizeRealityKey(" " + standard + " ");

        Assertions.assertEquals(Base64.getUrlEncoder().withoutPadding().encodeToString(raw), normalized);
        Assertions.assertTrue(KeyUtil.isValidPrivateKey(normalized));
    }

    @Test
    void relayPasswordIsBoundToTokenAndTarget() {
        String derived = KeyUtil.deriveRelayPassword("relay-token", 2L);

        Assertions.assertEquals(DigestUtil.sha256Hex("relay-token:relay:2"), derived);
        Assertions.assertTrue(derived.matches("[0-9a-f]{64}"));
        Assertions.assertEquals(derived, KeyUtil.deriveRelayPassword("  relay-token  ", 2L));
        Assertions.assertNotEquals(derived, KeyUtil.deriveRelayPassword("relay-token", 3L));
        Assertions.assertNotEquals(derived, KeyUtil.deriveRelayPassword("other-token", 2L));
    }
}
