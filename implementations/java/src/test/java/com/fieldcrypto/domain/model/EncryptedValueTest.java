package com.fieldcrypto.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EncryptedValueTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serialises_with_frontend_field_names() throws Exception {
        EncryptedValue value = EncryptedValue.builder()
            .ciphertext("abcd")
            .nonce("00112233445566778899aabbccddeeff")
            .authTag("ffeeddccbbaa99887766554433221100")
            .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(value));

        assertEquals("abcd", json.get("encrypted").asText());
        assertEquals("00112233445566778899aabbccddeeff", json.get("iv").asText());
        assertEquals("ffeeddccbbaa99887766554433221100", json.get("authTag").asText());
        assertEquals(3, json.size());
    }

    @Test
    void deserialises_frontend_json() throws Exception {
        EncryptedValue value = objectMapper.readValue(
            "{\"encrypted\":\"abcd\",\"iv\":\"0011\",\"authTag\":\"2233\"}", EncryptedValue.class);

        assertEquals(new EncryptedValue("abcd", "0011", "2233"), value);
    }

    @Test
    void rejects_missing_parts() {
        assertThrows(NullPointerException.class, () -> new EncryptedValue(null, "00", "00"));
        assertThrows(NullPointerException.class, () -> EncryptedValue.builder().ciphertext("00").build());
    }

    @Test
    void to_string_truncates_ciphertext() {
        EncryptedValue value = new EncryptedValue("0123456789abcdef0123456789abcdef", "00", "11");

        assertEquals("EncryptedValue[ciphertext=0123456789abcdef..., nonce=00, authTag=11]", value.toString());
    }
}
