package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.domain.model.EncryptedValue;

import java.util.Map;

/**
 * Keyed cryptographic service interface.
 *
 * <p>Every operation selects its key by data-type label. Binary values cross
 * this interface as lowercase hex. Failures are reported as subclasses of
 * {@link com.fieldcrypto.infrastructure.crypto.exception.CryptoException}.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Deterministic keyed hash for lookups.
     *
     * @param text Value to hash
     * @param dataType Hashed data type label (e.g., "USER_EMAIL", "API_KEY")
     * @return 64 or 128 lowercase hex characters depending on the composition
     */
    String hash(String text, String dataType);

    /**
     * Encrypt text with AES-256-GCM.
     *
     * @param plaintext Text to encrypt
     * @param dataType Key label
     * @return Hex-encoded envelope
     */
    EncryptedValue encrypt(String plaintext, String dataType);

    /**
     * Decrypt an envelope produced by {@link #encrypt}.
     */
    String decrypt(EncryptedValue encryptedValue, String dataType);

    /**
     * Decrypt from the three hex fields as received on the wire.
     */
    default String decrypt(String ciphertextHex, String nonceHex, String authTagHex, String dataType) {
        return decrypt(new EncryptedValue(ciphertextHex, nonceHex, authTagHex), dataType);
    }

    /**
     * Decrypt an AES-256-CBC payload from the frontend client and parse it as JSON.
     *
     * @param ciphertextHex Ciphertext as hex
     * @param ivHex 16-byte IV as hex
     * @param dataType Key label
     * @return Parsed JSON object
     */
    Map<String, Object> decryptLegacyCbc(String ciphertextHex, String ivHex, String dataType);

    /**
     * Verify integrity (GCM tag) without returning the plaintext.
     */
    boolean verifyIntegrity(EncryptedValue encryptedValue, String dataType);
}
