package com.locplat.translation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;
import com.locplat.translation.model.FieldMappingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);

    private final MessageDigest digest;
    private final ObjectMapper canonicalMapper;

    /**
     * Initializes the SHA-256 message digest used for config hashing.
     */
    public ContentHashingService(ObjectMapper objectMapper) {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new RuntimeException("Failed to initialize hashing service", e);
        }
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * Calculates the SHA-256 hash of a given string content.
     *
     * @param content The string content to hash.
     * @return The SHA-256 hash as a hexadecimal string.
     */
    public synchronized String hash(String content) {
        if (content == null) {
            return null;
        }
        byte[] encodedhash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        return bytesToHex(encodedhash);
    }

    /**
     * Short non-cryptographic hash used only to keep cache keys compact.
     */
    public String fastHash(String content) {
        return Hashing.murmur3_128().hashString(content == null ? "" : content, StandardCharsets.UTF_8).toString();
    }

    /**
     * JSON with object keys sorted at every level, so equal documents hash equally.
     */
    public String canonicalJson(Object value) {
        try {
            Object plain = canonicalMapper.convertValue(value, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Could not serialize value for hashing, falling back to toString: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    /**
     * Hash over the config fields that influence extraction and reconstruction.
     * Any change to them makes previously cached extraction results stale.
     */
    public String configHash(FieldMappingConfig config) {
        Map<String, Object> relevant = new LinkedHashMap<>();
        relevant.put("field_paths", config.getFieldPaths());
        relevant.put("field_types", config.getFieldTypes());
        relevant.put("rtl_field_mapping", config.getRtlFieldMapping());
        relevant.put("batch_processing", config.isBatchProcessing());
        relevant.put("preserve_html_structure", config.isPreserveHtml());
        relevant.put("content_sanitization", config.isContentSanitization());
        relevant.put("translation_pattern", config.getTranslationPattern());
        relevant.put("primary_collection", config.getPrimaryCollection());
        return hash(canonicalJson(relevant));
    }

    /**
     * Converts a raw byte array into a lowercase hexadecimal string.
     */
    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
