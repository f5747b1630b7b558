package com.apicatalog.collectionsync.service.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 digest over {@code (verb, pathTemplate, exampleBody)}.
 *
 * The body is rendered as compact JSON in its own key order, so reordering fields changes the hash.
 * The same hasher is applied to generated descriptors and to request content read back from the
 * remote store.
 */
@Component
public class ContentHasher {

    private static final String SHA_256 = "SHA-256";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .disable(SerializationFeature.INDENT_OUTPUT);

    public String hash(String verb, String pathTemplate, Map<String, Object> exampleBody) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("verb", verb != null ? verb.toUpperCase() : null);
        canonical.put("path", pathTemplate);
        canonical.put("body", exampleBody);

        try {
            byte[] json = objectMapper.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance(SHA_256).digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Example body is not serializable: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(SHA_256 + " not available", e);
        }
    }

    public String render(Map<String, Object> exampleBody) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(exampleBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Example body is not serializable: " + e.getMessage(), e);
        }
    }
}
