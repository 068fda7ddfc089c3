package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.infrastructure.crypto.exception.InvalidKeySizeException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from data-type label to AES-256 key.
 *
 * <p>Built once from provisioned key material and validated eagerly: a single
 * key that is not exactly {@value #KEY_SIZE} bytes rejects the whole ring.
 * The ring performs no cryptography itself; {@link FieldHasher},
 * {@link AesGcmCipher} and {@link LegacyCbcDecoder} resolve their keys here.
 *
 * <p>Thread-safe: nothing is written after construction.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public final class KeyRing {

    /** AES-256 key length in bytes. */
    public static final int KEY_SIZE = 32;

    private static final String KEY_ALGORITHM = "AES";

    private final Map<String, SecretKey> keys;

    private KeyRing(Map<String, SecretKey> keys) {
        this.keys = Collections.unmodifiableMap(keys);
    }

    /**
     * Validates every entry and builds the ring.
     *
     * @param keyMaterial data-type label to raw key bytes
     * @return the validated ring
     * @throws InvalidKeySizeException if any key is not exactly 32 bytes
     */
    public static KeyRing of(Map<String, byte[]> keyMaterial) {
        Objects.requireNonNull(keyMaterial, "Key material must not be null");

        Map<String, SecretKey> validated = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : keyMaterial.entrySet()) {
            String dataType = Objects.requireNonNull(entry.getKey(), "Data type must not be null");
            byte[] key = entry.getValue();
            int size = key == null ? 0 : key.length;

            // SecretKeySpec rejects empty keys on its own, check first for a uniform error
            if (size != KEY_SIZE) {
                throw new InvalidKeySizeException(dataType, KEY_SIZE, size);
            }
            validated.put(dataType, new SecretKeySpec(key, KEY_ALGORITHM));
        }

        log.info("Key ring initialised with {} data type(s)", validated.size());
        return new KeyRing(validated);
    }

    /**
     * Looks up the key registered for a data type.
     *
     * @return the key, or empty if the label is not registered
     */
    public Optional<SecretKey> find(String dataType) {
        return dataType == null ? Optional.empty() : Optional.ofNullable(keys.get(dataType));
    }

    public Set<String> dataTypes() {
        return keys.keySet();
    }

    public int size() {
        return keys.size();
    }

    /**
     * Lists labels only, never key material.
     */
    @Override
    public String toString() {
        return "KeyRing" + keys.keySet();
    }
}
