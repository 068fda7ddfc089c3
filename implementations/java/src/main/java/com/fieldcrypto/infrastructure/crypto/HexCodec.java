package com.fieldcrypto.infrastructure.crypto;

import com.fieldcrypto.infrastructure.crypto.exception.MalformedEncodingException;

import java.util.HexFormat;

/**
 * Lowercase hex, the wire encoding for every binary field.
 */
final class HexCodec {

    private static final HexFormat HEX = HexFormat.of();

    private HexCodec() {
    }

    static String encode(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    /**
     * Decodes one named field.
     *
     * @throws MalformedEncodingException on null, odd-length or non-hex input
     */
    static byte[] decode(String field, String hex) {
        if (hex == null) {
            throw new MalformedEncodingException(field + " must not be null");
        }
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new MalformedEncodingException(field + " is not valid hex", e);
        }
    }
}
