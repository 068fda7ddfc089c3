package com.fieldcrypto.infrastructure.crypto.exception;

/**
 * Decrypted bytes are not a JSON object.
 */
public class MalformedPayloadException extends CryptoException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
