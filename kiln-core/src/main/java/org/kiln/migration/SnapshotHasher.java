package org.kiln.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.kiln.error.KilnException;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.model.SchemaSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Deterministic SHA-256 hashes of snapshots and operation lists.
 */
public final class SnapshotHasher {
    private static final TypeReference<List<ChangeOperation>> OPERATIONS = new TypeReference<>() {};

    private static final ObjectMapper CANONICAL = canonicalMapper();

    private SnapshotHasher() {
    }

    /**
     * Mapper with sorted properties and map keys, so equal values always serialize to the
     * same bytes.
     */
    public static ObjectMapper canonicalMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .build();
    }

    public static String hash(SchemaSnapshot snapshot) {
        try {
            return sha256(CANONICAL.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            throw new KilnException("Failed to generate schema hash", e);
        }
    }

    public static String hash(List<ChangeOperation> operations) {
        try {
            return sha256(CANONICAL.writerFor(OPERATIONS).writeValueAsString(operations));
        } catch (JsonProcessingException e) {
            throw new KilnException("Failed to generate migration checksum", e);
        }
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
