package com.fieldcrypto.infrastructure.crypto.exception;

import lombok.Getter;

@Getter
public class UnknownDataTypeException extends CryptoException {

    private final String dataType;

    public UnknownDataTypeException(String dataType) {
        super("Unknown data type: " + dataType);
        this.dataType = dataType;
    }
}
