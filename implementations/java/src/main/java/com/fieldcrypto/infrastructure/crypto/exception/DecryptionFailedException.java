package com.fieldcrypto.infrastructure.crypto.exception;

/**
 * Opaque decryption failure.
 *
 * <p>Covers GCM tag mismatch, invalid CBC padding and ciphertext of the wrong
 * length alike. The message is constant and never names the check that failed.
 */
public class DecryptionFailedException extends CryptoException {

    private static final String MESSAGE = "Decryption failed";

    public DecryptionFailedException() {
        super(MESSAGE);
    }

    public DecryptionFailedException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
