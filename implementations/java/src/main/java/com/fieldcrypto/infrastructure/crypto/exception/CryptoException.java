package com.fieldcrypto.infrastructure.crypto.exception;

/**
 * Base exception for all keyed cryptographic operations.
 *
 * <p>Thrown directly only for unexpected provider failures; every expected
 * failure kind has its own subclass.
 *
 * @author Security Team
 * @since 1.0.0
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
