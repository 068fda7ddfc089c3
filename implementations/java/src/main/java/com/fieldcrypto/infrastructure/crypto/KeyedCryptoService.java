package com.fieldcrypto.infrastructure.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldcrypto.domain.model.EncryptedValue;
import com.fieldcrypto.infrastructure.audit.AuditService;
import com.fieldcrypto.infrastructure.crypto.exception.DecryptionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * {@link CryptoService} backed by a single {@link KeyRing}.
 *
 * Architecture:
 * - Keys provisioned once at startup, one 32-byte key per data type
 * - Layered keyed hashing for lookup columns ({@link FieldHasher})
 * - AES-256-GCM with 16-byte nonces for field encryption ({@link AesGcmCipher})
 * - AES-256-CBC decoding for frontend payloads ({@link LegacyCbcDecoder})
 *
 * Holds no mutable state, safe for concurrent use.
 */
@Service
@Slf4j
public class KeyedCryptoService implements CryptoService {

    static final String AUDIT_CATEGORY = "CRYPTO";

    private final FieldHasher fieldHasher;
    private final AesGcmCipher aesGcmCipher;
    private final LegacyCbcDecoder legacyCbcDecoder;
    private final AuditService auditService;

    public KeyedCryptoService(KeyRing keyRing, ObjectMapper objectMapper, AuditService auditService) {
        this.fieldHasher = new FieldHasher(keyRing);
        this.aesGcmCipher = new AesGcmCipher(keyRing);
        this.legacyCbcDecoder = new LegacyCbcDecoder(keyRing, objectMapper);
        this.auditService = auditService;
    }

    @Override
    public String hash(String text, String dataType) {
        return fieldHasher.hash(text, dataType);
    }

    @Override
    public EncryptedValue encrypt(String plaintext, String dataType) {
        return aesGcmCipher.encrypt(plaintext, dataType);
    }

    @Override
    public String decrypt(EncryptedValue encryptedValue, String dataType) {
        try {
            return aesGcmCipher.decrypt(encryptedValue, dataType);
        } catch (DecryptionFailedException e) {
            auditService.record(AUDIT_CATEGORY, "GCM_DECRYPTION_FAILED", dataType, null);
            throw e;
        }
    }

    @Override
    public Map<String, Object> decryptLegacyCbc(String ciphertextHex, String ivHex, String dataType) {
        try {
            return legacyCbcDecoder.decrypt(ciphertextHex, ivHex, dataType);
        } catch (DecryptionFailedException e) {
            auditService.record(AUDIT_CATEGORY, "CBC_DECRYPTION_FAILED", dataType, null);
            throw e;
        }
    }

    @Override
    public boolean verifyIntegrity(EncryptedValue encryptedValue, String dataType) {
        // GCM verifies the tag as part of decryption
        try {
            aesGcmCipher.decrypt(encryptedValue, dataType);
            return true;
        } catch (DecryptionFailedException e) {
            log.warn("Integrity check failed for data type {}", dataType);
            return false;
        }
    }
}
