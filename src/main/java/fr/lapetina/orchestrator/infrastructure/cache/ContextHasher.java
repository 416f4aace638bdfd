package fr.lapetina.orchestrator.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic content hash of an arbitrary value.
 *
 * The value is rendered as JSON with sorted properties and map keys, then
 * digested with SHA-256. Equal values always produce the same hash whatever
 * the insertion order of their maps.
 */
public final class ContextHasher {

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper objectMapper;

    public ContextHasher() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .build();
    }

    /**
     * @return lowercase hex SHA-256 of the canonical JSON form
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String hash(Object value) {
        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized for hashing: " + e.getOriginalMessage(), e);
        }
        return sha256(canonical);
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
