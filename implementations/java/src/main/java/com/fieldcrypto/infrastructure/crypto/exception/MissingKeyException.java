package com.fieldcrypto.infrastructure.crypto.exception;

import lombok.Getter;

/**
 * The data type has a hash composition but no key was provisioned for it.
 */
@Getter
public class MissingKeyException extends CryptoException {

    private final String dataType;

    public MissingKeyException(String dataType) {
        super("Missing key for data type: " + dataType);
        this.dataType = dataType;
    }
}
