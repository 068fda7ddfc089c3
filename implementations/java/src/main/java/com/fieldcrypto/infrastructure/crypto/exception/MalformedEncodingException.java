package com.fieldcrypto.infrastructure.crypto.exception;

/**
 * Caller supplied invalid hex, or a nonce/IV of the wrong size.
 */
public class MalformedEncodingException extends CryptoException {

    public MalformedEncodingException(String message) {
        super(message);
    }

    public MalformedEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
