package com.fieldcrypto.infrastructure.crypto;

import static com.fieldcrypto.infrastructure.crypto.HexDigests.hmacSha256;
import static com.fieldcrypto.infrastructure.crypto.HexDigests.sha256;
import static com.fieldcrypto.infrastructure.crypto.HexDigests.sha512;

/**
 * The four layered hash compositions.
 *
 * <p>Every stage works on lowercase hex strings and concatenation happens on
 * those strings, not on raw digest bytes. The HMAC key is the hex rendering
 * of the 32-byte data-type key. Frontend hashes are computed the same way, so
 * none of this may be reordered.
 */
public enum HashComposition {

    /**
     * {@code SHA256(SHA512(hmac) + hmac)}, 64 hex chars.
     */
    HMAC_THEN_SHA512_SHA256 {
        @Override
        public String apply(String text, String hexKey) {
            String hmac = hmacSha256(text, hexKey);
            return sha256(sha512(hmac) + hmac);
        }
    },

    /**
     * {@code SHA512(SHA256(hmac) + hmac)}, 128 hex chars.
     */
    HMAC_THEN_SHA256_SHA512 {
        @Override
        public String apply(String text, String hexKey) {
            String hmac = hmacSha256(text, hexKey);
            return sha512(sha256(hmac) + hmac);
        }
    },

    /**
     * {@code HMAC(SHA512(text) + SHA256(text))}, 64 hex chars.
     */
    DIGESTS_THEN_HMAC {
        @Override
        public String apply(String text, String hexKey) {
            return hmacSha256(sha512(text) + sha256(text), hexKey);
        }
    },

    /**
     * {@code HMAC(SHA512(SHA256(text) + SHA512(text) + SHA256(text)))}, 64 hex chars.
     * Reserved for the most sensitive fields.
     */
    LAYERED_DIGESTS_THEN_HMAC {
        @Override
        public String apply(String text, String hexKey) {
            String textSha256 = sha256(text);
            return hmacSha256(sha512(textSha256 + sha512(text) + textSha256), hexKey);
        }
    };

    /**
     * @param text   value to hash
     * @param hexKey lowercase hex rendering of the data-type key
     * @return lowercase hex digest
     */
    public abstract String apply(String text, String hexKey);
}
