package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.infrastructure.crypto.exception.CryptoException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * String-in, hex-out digest primitives.
 *
 * <p>Inputs are the UTF-8 bytes of the given strings, outputs lowercase hex.
 * Instances of {@link MessageDigest} and {@link Mac} are created per call.
 */
final class HexDigests {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private HexDigests() {
    }

    static String sha256(String text) {
        return digest("SHA-256", text);
    }

    static String sha512(String text) {
        return digest("SHA-512", text);
    }

    /**
     * HMAC-SHA256 of {@code text} keyed with the UTF-8 bytes of {@code key}.
     */
    static String hmacSha256(String text, String key) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexCodec.encode(mac.doFinal(text.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to compute " + HMAC_SHA256, e);
        }
    }

    private static String digest(String algorithm, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexCodec.encode(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to hash data with " + algorithm, e);
        }
    }
}
