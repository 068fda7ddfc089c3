package com.fieldcrypto.config;

import com.fieldcrypto.infrastructure.crypto.KeyRing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the key ring from {@link CryptoKeyProperties}.
 *
 * An invalid or duplicated key aborts context startup; no partially
 * provisioned service is ever exposed.
 */
@Configuration
@Slf4j
public class CryptoConfiguration {

    @Bean
    public KeyRing keyRing(CryptoKeyProperties properties) {
        Map<String, byte[]> keyMaterial = new LinkedHashMap<>();

        for (CryptoKeyProperties.KeyEntry entry : properties.getKeys()) {
            byte[] key = HexFormat.of().parseHex(entry.getKey());
            if (keyMaterial.putIfAbsent(entry.getDataType(), key) != null) {
                throw new IllegalStateException("Duplicate key configured for data type " + entry.getDataType());
            }
        }

        log.info("Loaded key material for data types {}", keyMaterial.keySet());
        return KeyRing.of(keyMaterial);
    }
}
