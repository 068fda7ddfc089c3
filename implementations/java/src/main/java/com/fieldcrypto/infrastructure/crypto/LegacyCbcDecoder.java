package com.fieldcrypto.infrastructure.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fieldcrypto.infrastructure.crypto.exception.CryptoException;
import com.fieldcrypto.infrastructure.crypto.exception.DecryptionFailedException;
import com.fieldcrypto.infrastructure.crypto.exception.MalformedEncodingException;
import com.fieldcrypto.infrastructure.crypto.exception.MalformedPayloadException;
import com.fieldcrypto.infrastructure.crypto.exception.UnknownDataTypeException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Map;

/**
 * Decrypts AES-256-CBC payloads produced by the frontend client.
 *
 * <p>The client pads with PKCS#7 and sends ciphertext and IV as hex. Padding
 * is removed here by hand. CBC carries no authentication, so the padding check
 * is the only integrity signal available and a wrong key yields garbage rather
 * than a clean failure.
 */
@Slf4j
public class LegacyCbcDecoder {

    public static final int BLOCK_SIZE = 16;

    private static final String TRANSFORMATION = "AES/CBC/NoPadding";
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final KeyRing keyRing;
    private final ObjectReader jsonObjectReader;

    public LegacyCbcDecoder(KeyRing keyRing, ObjectMapper objectMapper) {
        this.keyRing = keyRing;
        // Anything after the object makes the whole payload invalid JSON
        this.jsonObjectReader = objectMapper.readerFor(JSON_OBJECT)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param ciphertextHex CBC ciphertext as hex
     * @param ivHex         16-byte IV as hex
     * @param dataType      label selecting the key
     * @return the decrypted JSON object
     * @throws UnknownDataTypeException if no key is registered for the label
     * @throws MalformedEncodingException on invalid hex or an IV that is not one block
     * @throws DecryptionFailedException on a partial block or invalid padding
     * @throws MalformedPayloadException if the plaintext is not a JSON object
     */
    public Map<String, Object> decrypt(String ciphertextHex, String ivHex, String dataType) {
        SecretKey key = keyRing.find(dataType)
            .orElseThrow(() -> new UnknownDataTypeException(dataType));

        byte[] encrypted = HexCodec.decode("ciphertext", ciphertextHex);
        byte[] iv = HexCodec.decode("IV", ivHex);

        if (iv.length != BLOCK_SIZE) {
            throw new MalformedEncodingException(String.format(
                "IV must be %d bytes for AES-CBC, got %d", BLOCK_SIZE, iv.length));
        }
        if (encrypted.length == 0 || encrypted.length % BLOCK_SIZE != 0) {
            throw new DecryptionFailedException();
        }

        byte[] decrypted;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
            decrypted = cipher.doFinal(encrypted);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to decrypt legacy payload", e);
        }

        byte[] plaintext = removePadding(decrypted);

        log.debug("Decrypted {} byte legacy payload for data type {}", plaintext.length, dataType);
        return parseObject(plaintext);
    }

    /**
     * Strips PKCS#7 padding.
     *
     * @throws DecryptionFailedException if the padding is not well formed
     */
    static byte[] removePadding(byte[] decrypted) {
        int padding = decrypted[decrypted.length - 1] & 0xFF;
        if (padding == 0 || padding > decrypted.length) {
            throw new DecryptionFailedException();
        }

        // Every padding byte must equal the padding length
        for (int i = decrypted.length - padding; i < decrypted.length; i++) {
            if ((decrypted[i] & 0xFF) != padding) {
                throw new DecryptionFailedException();
            }
        }

        return Arrays.copyOf(decrypted, decrypted.length - padding);
    }

    private Map<String, Object> parseObject(byte[] plaintext) {
        Map<String, Object> result;
        try {
            result = jsonObjectReader.readValue(plaintext);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Decrypted payload is not a JSON object", e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Failed to read decrypted payload", e);
        }

        // A bare JSON null deserialises without error
        if (result == null) {
            throw new MalformedPayloadException("Decrypted payload is not a JSON object");
        }
        return result;
    }
}
