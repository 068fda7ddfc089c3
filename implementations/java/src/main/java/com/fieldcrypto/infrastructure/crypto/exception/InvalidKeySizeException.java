package com.fieldcrypto.infrastructure.crypto.exception;

import lombok.Getter;

/**
 * Raised while building a key ring when a key is not exactly 32 bytes.
 */
@Getter
public class InvalidKeySizeException extends CryptoException {

    private final String dataType;
    private final int actualSize;

    public InvalidKeySizeException(String dataType, int expectedSize, int actualSize) {
        super(String.format("Invalid key size for data type %s: expected %d bytes, got %d",
            dataType, expectedSize, actualSize));
        this.dataType = dataType;
        this.actualSize = actualSize;
    }
}
