package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.infrastructure.crypto.exception.MissingKeyException;
import com.fieldcrypto.infrastructure.crypto.exception.UnknownDataTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * Deterministic keyed hashing of sensitive fields for lookups.
 *
 * <p>Same text, data type and key always give the same hex digest; there is
 * no salt and no randomness.
 */
@Slf4j
@RequiredArgsConstructor
public class FieldHasher {

    private final KeyRing keyRing;

    /**
     * Hashes {@code text} with the composition and key bound to {@code dataType}.
     *
     * @throws UnknownDataTypeException if the label has no composition
     * @throws MissingKeyException if the label has no key in the ring
     */
    public String hash(String text, String dataType) {
        Objects.requireNonNull(text, "Text must not be null");

        HashedDataType hashedType = HashedDataType.fromLabel(dataType)
            .orElseThrow(() -> new UnknownDataTypeException(dataType));
        SecretKey key = keyRing.find(dataType)
            .orElseThrow(() -> new MissingKeyException(dataType));

        String digest = hashedType.composition().apply(text, HexCodec.encode(key.getEncoded()));

        log.debug("Hashed {} field with {}", dataType, hashedType.composition());
        return digest;
    }
}
