package com.fieldcrypto.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Key material provisioned through configuration.
 *
 * <pre>
 * field-crypto:
 *   keys:
 *     - data-type: USER_EMAIL
 *       key: ${USER_EMAIL_KEY}
 * </pre>
 *
 * Keys are 32 bytes written as 64 hex characters. The length check itself is
 * left to the key ring so that it reports the offending data type.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "field-crypto")
public class CryptoKeyProperties {

    @Valid
    private List<KeyEntry> keys = new ArrayList<>();

    @Getter
    @Setter
    public static class KeyEntry {

        @NotBlank
        private String dataType;

        @NotBlank
        @Pattern(regexp = "^([0-9a-fA-F]{2})*$", message = "must be hex encoded")
        private String key;

        @Override
        public String toString() {
            return "KeyEntry[dataType=" + dataType + "]";
        }
    }
}
