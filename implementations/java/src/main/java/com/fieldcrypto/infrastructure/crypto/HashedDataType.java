package com.fieldcrypto.infrastructure.crypto;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Data types that may be hashed, each bound to a fixed composition.
 *
 * <p>The enum constant name is the data-type label; the same label selects
 * the key in the {@link KeyRing}.
 */
public enum HashedDataType {

    // Users
    USER_NAME(HashComposition.HMAC_THEN_SHA512_SHA256),
    USER_TG(HashComposition.HMAC_THEN_SHA256_SHA512),
    USER_PHONE(HashComposition.DIGESTS_THEN_HMAC),
    USER_EMAIL(HashComposition.HMAC_THEN_SHA256_SHA512),
    BACKUP_EMAIL(HashComposition.HMAC_THEN_SHA256_SHA512),

    // Incidents
    INCIDENT_NAME(HashComposition.HMAC_THEN_SHA512_SHA256),
    INCIDENT_PHONE(HashComposition.HMAC_THEN_SHA256_SHA512),
    INCIDENT_TG(HashComposition.DIGESTS_THEN_HMAC),

    // Tokens and credentials
    VERIFY_TOKEN_STRING(HashComposition.DIGESTS_THEN_HMAC),
    PASS_RESET_TOKEN(HashComposition.HMAC_THEN_SHA256_SHA512),
    IDENTITY_KEY(HashComposition.HMAC_THEN_SHA256_SHA512),
    API_KEY(HashComposition.LAYERED_DIGESTS_THEN_HMAC);

    private static final Map<String, HashedDataType> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(HashedDataType::name, Function.identity()));

    private final HashComposition composition;

    HashedDataType(HashComposition composition) {
        this.composition = composition;
    }

    public HashComposition composition() {
        return composition;
    }

    /**
     * Resolves a label without throwing, unlike {@link #valueOf(String)}.
     */
    public static Optional<HashedDataType> fromLabel(String label) {
        return label == null ? Optional.empty() : Optional.ofNullable(BY_LABEL.get(label));
    }
}
