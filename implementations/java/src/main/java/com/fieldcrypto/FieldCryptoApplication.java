package com.fieldcrypto;

import com.fieldcrypto.infrastructure.crypto.KeyRing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Main application class for the field crypto service.
 *
 * <p>Provides keyed cryptography over a fixed set of named keys:
 *
 * <ul>
 *   <li><strong>Keyed Hashing</strong>: layered SHA-256/SHA-512/HMAC compositions per field type</li>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM with 16-byte nonces</li>
 *   <li><strong>Frontend Interop</strong>: AES-256-CBC + PKCS#7 payload decoding</li>
 * </ul>
 *
 * <p>Keys are bound from {@code field-crypto.keys}; startup fails if any of
 * them is invalid.
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class FieldCryptoApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(FieldCryptoApplication.class, args);

        KeyRing keyRing = context.getBean(KeyRing.class);
        log.info("Field crypto service ready: {} data type(s), AES-256-GCM, AES-256-CBC interop", keyRing.size());
    }
}
