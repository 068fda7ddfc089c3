package com.fieldcrypto.infrastructure.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldcrypto.infrastructure.crypto.exception.DecryptionFailedException;
import com.fieldcrypto.infrastructure.crypto.exception.MalformedEncodingException;
import com.fieldcrypto.infrastructure.crypto.exception.MalformedPayloadException;
import com.fieldcrypto.infrastructure.crypto.exception.UnknownDataTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LegacyCbcDecoderTest {

    private static final HexFormat HEX = HexFormat.of();

    private static final byte[] FRONT_KEY = HEX.parseHex("0102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f20");
    private static final String IV = "000102030405060708090a0b0c0d0e0f";
    private static final String ZERO_BLOCK = "00000000000000000000000000000000";

    private LegacyCbcDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new LegacyCbcDecoder(
            KeyRing.of(Map.of("FRONT_KEY_1", FRONT_KEY, "ZERO_KEY", new byte[32])),
            new ObjectMapper());
    }

    @Test
    void decrypts_frontend_payload() {
        // {"userId":42,"action":"login"} encrypted by the frontend client
        Map<String, Object> result = decoder.decrypt(
            "58e8431bb8ee801d3052f8941bcd89895ca6dfbefb69ecce1f69f5af7eab0373", IV, "FRONT_KEY_1");

        assertEquals(42, result.get("userId"));
        assertEquals("login", result.get("action"));
    }

    @Test
    void decrypts_payload_padded_with_full_block() throws Exception {
        // 16-byte plaintext gets a whole block of padding
        String payload = "{\"list\":[1,2,3]}";
        assertEquals(16, payload.length());

        Map<String, Object> result = decoder.decrypt(encryptCbc(payload, FRONT_KEY, HEX.parseHex(IV)), IV, "FRONT_KEY_1");

        assertEquals(List.of(1, 2, 3), result.get("list"));
    }

    @Test
    void accepts_uppercase_hex() {
        Map<String, Object> result = decoder.decrypt(
            "58E8431BB8EE801D3052F8941BCD89895CA6DFBEFB69ECCE1F69F5AF7EAB0373", IV.toUpperCase(), "FRONT_KEY_1");

        assertEquals(42, result.get("userId"));
    }

    @Test
    void all_zero_block_under_zero_key_fails_padding() {
        assertThrows(DecryptionFailedException.class,
            () -> decoder.decrypt(ZERO_BLOCK, ZERO_BLOCK, "ZERO_KEY"));
    }

    @Test
    void inconsistent_padding_bytes_fail() {
        // Plaintext ends in 03 03 02: length byte 2 but preceding byte differs
        assertThrows(DecryptionFailedException.class,
            () -> decoder.decrypt("8a15ff592fd773293ca27221a37be2ef", IV, "FRONT_KEY_1"));
    }

    @Test
    void remove_padding_checks_every_byte() {
        assertArrayEquals(new byte[] {7}, LegacyCbcDecoder.removePadding(new byte[] {7, 3, 3, 3}));
        assertArrayEquals(new byte[0], LegacyCbcDecoder.removePadding(new byte[] {2, 2}));

        assertThrows(DecryptionFailedException.class,
            () -> LegacyCbcDecoder.removePadding(new byte[] {7, 1, 3, 3}));
        assertThrows(DecryptionFailedException.class,
            () -> LegacyCbcDecoder.removePadding(new byte[] {7, 7, 7, 0}));
        assertThrows(DecryptionFailedException.class,
            () -> LegacyCbcDecoder.removePadding(new byte[] {5, 5, 5, 5}));
        assertThrows(DecryptionFailedException.class,
            () -> LegacyCbcDecoder.removePadding(new byte[] {1, 2, (byte) 0xFF}));
    }

    @Test
    void partial_block_fails_as_decryption_failure() {
        assertThrows(DecryptionFailedException.class,
            () -> decoder.decrypt("58e8431bb8ee801d3052f8941bcd8989" + "5c", IV, "FRONT_KEY_1"));
    }

    @Test
    void empty_ciphertext_fails_as_decryption_failure() {
        assertThrows(DecryptionFailedException.class, () -> decoder.decrypt("", IV, "FRONT_KEY_1"));
    }

    @Test
    void iv_of_wrong_size_is_malformed() {
        MalformedEncodingException ex = assertThrows(MalformedEncodingException.class,
            () -> decoder.decrypt(ZERO_BLOCK, "0001020304050607", "FRONT_KEY_1"));

        assertTrue(ex.getMessage().contains("16"));
    }

    @Test
    void invalid_hex_is_malformed() {
        assertThrows(MalformedEncodingException.class, () -> decoder.decrypt("xyz", IV, "FRONT_KEY_1"));
        assertThrows(MalformedEncodingException.class, () -> decoder.decrypt(ZERO_BLOCK, "g" + IV.substring(1), "FRONT_KEY_1"));
    }

    @Test
    void non_json_plaintext_is_malformed_payload() {
        // "not json" with valid padding
        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt("09252ed9c10b59481d2bf4eea2090a34", IV, "FRONT_KEY_1"));
    }

    @Test
    void json_that_is_not_an_object_is_malformed_payload() throws Exception {
        byte[] iv = HEX.parseHex(IV);

        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt(encryptCbc("[1,2,3]", FRONT_KEY, iv), IV, "FRONT_KEY_1"));
        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt(encryptCbc("null", FRONT_KEY, iv), IV, "FRONT_KEY_1"));
        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt(encryptCbc("", FRONT_KEY, iv), IV, "FRONT_KEY_1"));
    }

    @Test
    void trailing_data_after_object_is_malformed_payload() throws Exception {
        byte[] iv = HEX.parseHex(IV);

        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt(encryptCbc("{\"userId\":42} trailing", FRONT_KEY, iv), IV, "FRONT_KEY_1"));
        assertThrows(MalformedPayloadException.class,
            () -> decoder.decrypt(encryptCbc("{\"userId\":42}{\"userId\":43}", FRONT_KEY, iv), IV, "FRONT_KEY_1"));
    }

    @Test
    void surrounding_whitespace_is_accepted() throws Exception {
        Map<String, Object> result = decoder.decrypt(
            encryptCbc(" {\"userId\":42}\n", FRONT_KEY, HEX.parseHex(IV)), IV, "FRONT_KEY_1");

        assertEquals(42, result.get("userId"));
    }

    @Test
    void unknown_data_type_is_rejected() {
        assertThrows(UnknownDataTypeException.class, () -> decoder.decrypt(ZERO_BLOCK, IV, "UNKNOWN"));
    }

    private static String encryptCbc(String plaintext, byte[] key, byte[] iv) throws Exception {
        Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
        return HEX.formatHex(cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8)));
    }
}
