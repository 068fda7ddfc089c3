package com.fieldcrypto.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * AES-256-GCM envelope: ciphertext, nonce and authentication tag.
 *
 * <p>Each part is lowercase hex and encoded independently. None of them is
 * meaningful alone; decryption needs all three plus the key of the data type
 * that produced them.
 *
 * <p>JSON form is {@code {"encrypted": ..., "iv": ..., "authTag": ...}}, the
 * field names the frontend client exchanges.
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - cannot be modified after creation</li>
 *   <li>No plaintext or key material held by this class</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class EncryptedValue implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Ciphertext without the tag. Empty for an empty plaintext.
     */
    @JsonProperty("encrypted")
    private final String ciphertext;

    /**
     * 16-byte GCM nonce. Unique per encryption under a given key.
     */
    @JsonProperty("iv")
    private final String nonce;

    /**
     * 16-byte GCM authentication tag.
     */
    @JsonProperty("authTag")
    private final String authTag;

    @JsonCreator
    public EncryptedValue(
            @JsonProperty("encrypted") String ciphertext,
            @JsonProperty("iv") String nonce,
            @JsonProperty("authTag") String authTag) {

        this.ciphertext = Objects.requireNonNull(ciphertext, "Ciphertext must not be null");
        this.nonce = Objects.requireNonNull(nonce, "Nonce must not be null");
        this.authTag = Objects.requireNonNull(authTag, "Auth tag must not be null");
    }

    /**
     * Truncated for logging.
     */
    @Override
    public String toString() {
        String truncatedCiphertext = ciphertext.length() > 16
            ? ciphertext.substring(0, 16) + "..."
            : ciphertext;

        return String.format(
            "EncryptedValue[ciphertext=%s, nonce=%s, authTag=%s]",
            truncatedCiphertext,
            nonce,
            authTag
        );
    }

    /**
     * Builder for creating EncryptedValue instances.
     */
    public static final class Builder {
        private String ciphertext;
        private String nonce;
        private String authTag;

        public Builder ciphertext(String ciphertext) {
            this.ciphertext = ciphertext;
            return this;
        }

        public Builder nonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder authTag(String authTag) {
            this.authTag = authTag;
            return this;
        }

        public EncryptedValue build() {
            return new EncryptedValue(ciphertext, nonce, authTag);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
