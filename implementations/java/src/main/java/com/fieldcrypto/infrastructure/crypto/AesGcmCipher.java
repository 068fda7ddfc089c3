package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.domain.model.EncryptedValue;
import com.fieldcrypto.infrastructure.crypto.exception.CryptoException;
import com.fieldcrypto.infrastructure.crypto.exception.DecryptionFailedException;
import com.fieldcrypto.infrastructure.crypto.exception.MalformedEncodingException;
import com.fieldcrypto.infrastructure.crypto.exception.UnknownDataTypeException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * AES-256-GCM authenticated encryption keyed by data type.
 *
 * <p>Uses a 16-byte nonce instead of the usual 12 bytes so envelopes stay
 * readable by the existing backend. The tag is split off the ciphertext and
 * every part is hex-encoded separately.
 *
 * <p>Security properties:
 * <ul>
 *   <li>Confidentiality and integrity via GCM</li>
 *   <li>Fresh random nonce per encryption</li>
 *   <li>Every authentication failure surfaces as the same {@link DecryptionFailedException}</li>
 * </ul>
 */
@Slf4j
public class AesGcmCipher {

    public static final int NONCE_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final KeyRing keyRing;
    private final SecureRandom secureRandom;

    public AesGcmCipher(KeyRing keyRing) {
        this(keyRing, new SecureRandom());
    }

    public AesGcmCipher(KeyRing keyRing, SecureRandom secureRandom) {
        this.keyRing = Objects.requireNonNull(keyRing, "Key ring must not be null");
        this.secureRandom = Objects.requireNonNull(secureRandom, "Secure random must not be null");
    }

    /**
     * Encrypts UTF-8 text under the key of {@code dataType}.
     *
     * @throws UnknownDataTypeException if no key is registered for the label
     */
    public EncryptedValue encrypt(String plaintext, String dataType) {
        Objects.requireNonNull(plaintext, "Plaintext must not be null");
        SecretKey key = resolveKey(dataType);

        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);

        byte[] ciphertextWithTag;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            // GCM produces ciphertext || auth_tag
            ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to encrypt data", e);
        }

        int ciphertextLength = ciphertextWithTag.length - TAG_LENGTH;
        byte[] ciphertext = Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength);
        byte[] authTag = Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length);

        log.debug("Encrypted {} bytes for data type {}", ciphertextLength, dataType);

        return EncryptedValue.builder()
            .ciphertext(HexCodec.encode(ciphertext))
            .nonce(HexCodec.encode(nonce))
            .authTag(HexCodec.encode(authTag))
            .build();
    }

    /**
     * Authenticates and decrypts an envelope.
     *
     * @throws UnknownDataTypeException if no key is registered for the label
     * @throws MalformedEncodingException on invalid hex or a nonce that is not 16 bytes
     * @throws DecryptionFailedException if authentication fails for any reason
     */
    public String decrypt(EncryptedValue encryptedValue, String dataType) {
        Objects.requireNonNull(encryptedValue, "Encrypted value must not be null");
        SecretKey key = resolveKey(dataType);

        byte[] ciphertext = HexCodec.decode("ciphertext", encryptedValue.getCiphertext());
        byte[] nonce = HexCodec.decode("nonce", encryptedValue.getNonce());
        byte[] authTag = HexCodec.decode("auth tag", encryptedValue.getAuthTag());

        if (nonce.length != NONCE_LENGTH) {
            throw new MalformedEncodingException(String.format(
                "Invalid nonce size: expected %d bytes, got %d", NONCE_LENGTH, nonce.length));
        }

        byte[] ciphertextWithTag = ByteBuffer.allocate(ciphertext.length + authTag.length)
            .put(ciphertext)
            .put(authTag)
            .array();

        Cipher cipher;
        try {
            cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to initialise decryption", e);
        }

        byte[] plaintext;
        try {
            plaintext = cipher.doFinal(ciphertextWithTag);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            // AEADBadTagException extends BadPaddingException
            log.debug("Authentication failed for data type {}", dataType);
            throw new DecryptionFailedException(e);
        }

        log.debug("Decrypted {} bytes for data type {}", plaintext.length, dataType);
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    private SecretKey resolveKey(String dataType) {
        return keyRing.find(dataType).orElseThrow(() -> new UnknownDataTypeException(dataType));
    }
}
