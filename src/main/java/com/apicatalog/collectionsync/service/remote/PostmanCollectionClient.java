package com.apicatalog.collectionsync.service.remote;

import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.exception.RemoteApplyException;
import com.apicatalog.collectionsync.exception.TransientRemoteException;
import com.apicatalog.collectionsync.service.descriptor.ContentHasher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Supplier;

/**
 * REST client for a Postman collection.
 *
 * Requests are written with {@code {{base_url}}} (configurable) in front of the descriptor path and a
 * raw JSON body. On fetch the same prefix is stripped and the content hash is recomputed from verb,
 * path and parsed body, so an untouched request hashes exactly like its canonical descriptor.
 */
@Service
@Slf4j
public class PostmanCollectionClient implements CollectionStoreClient {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 502, 503, 504);
    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {};

    @Value("${catalog.collection.base-url:https://api.getpostman.com}")
    private String baseUrl;

    @Value("${catalog.collection.api-key:}")
    private String apiKey;

    @Value("${catalog.collection.id:}")
    private String collectionId;

    @Value("${catalog.collection.request-base-url:{{base_url}}}")
    private String requestBaseUrl;

    @Value("${catalog.collection.environment.name:Collection Sync}")
    private String environmentName;

    @Value("${catalog.collection.environment.target-url:http://localhost:8000}")
    private String environmentTargetUrl;

    private final RestTemplate restTemplate;
    private final ContentHasher contentHasher;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PostmanCollectionClient(@Qualifier("collectionRestTemplate") RestTemplate restTemplate,
                                   ContentHasher contentHasher) {
        this.restTemplate = restTemplate;
        this.contentHasher = contentHasher;
    }

    /**
     * Test connection to the collection endpoint
     */
    @Override
    public boolean testConnection() {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    collectionUri(), HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            return response.getStatusCode() == HttpStatus.OK;
        } catch (Exception e) {
            log.error("[Postman API] Connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // ========================= FETCH =========================

    @Override
    public TreeNode fetchTree() {
        String body = call("fetch collection", () -> restTemplate.exchange(
                collectionUri(), HttpMethod.GET, new HttpEntity<>(headers()), String.class).getBody());

        try {
            JsonNode collection = objectMapper.readTree(body == null ? "{}" : body).path("collection");
            String name = collection.path("info").path("name").asText("collection");
            List<TreeNode> children = readItems(collection.path("item"));
            log.info("[Postman API] Fetched collection '{}' with {} top-level items", name, children.size());
            return TreeNode.remoteFolder(name.isEmpty() ? "collection" : name, collectionId, children);
        } catch (JsonProcessingException e) {
            throw new RemoteApplyException("Collection response is not valid JSON: " + e.getOriginalMessage(), 200, e);
        }
    }

    private List<TreeNode> readItems(JsonNode items) {
        List<TreeNode> nodes = new ArrayList<>();
        if (!items.isArray()) {
            return nodes;
        }
        for (JsonNode item : items) {
            String name = item.path("name").asText("");
            if (name.isEmpty()) {
                log.warn("[Postman API] Skipping unnamed item {}", itemId(item));
                continue;
            }
            if (item.has("item")) {
                nodes.add(TreeNode.remoteFolder(name, itemId(item), readItems(item.path("item"))));
            } else {
                nodes.add(readRequest(name, item));
            }
        }
        return nodes;
    }

    private TreeNode readRequest(String name, JsonNode item) {
        JsonNode request = item.path("request");
        String verb = request.path("method").asText("GET").toUpperCase();
        JsonNode url = request.path("url");
        String rawUrl = url.isTextual() ? url.asText() : url.path("raw").asText("");
        String path = stripBaseUrl(rawUrl);

        Map<String, Object> body = null;
        String hash;
        String raw = request.path("body").path("raw").asText("");
        if (raw.isBlank()) {
            hash = contentHasher.hash(verb, path, null);
        } else {
            try {
                body = objectMapper.readValue(raw, BODY_TYPE);
                hash = contentHasher.hash(verb, path, body);
            } catch (JsonProcessingException e) {
                // hand-edited, non-JSON body; hash the text so it never matches a generated one
                hash = contentHasher.hash(verb, path, Map.of("raw", raw));
            }
        }

        EndpointDescriptor descriptor = EndpointDescriptor.builder()
                .name(name)
                .verb(verb)
                .pathTemplate(path)
                .description(request.path("description").asText(null))
                .exampleBody(body)
                .contentHash(hash)
                .build();
        return TreeNode.remoteLeaf(name, itemId(item), descriptor, hash);
    }

    private String stripBaseUrl(String rawUrl) {
        if (rawUrl.startsWith(requestBaseUrl)) {
            return rawUrl.substring(requestBaseUrl.length());
        }
        if (rawUrl.contains("://")) {
            try {
                return URI.create(rawUrl).getRawPath();
            } catch (IllegalArgumentException e) {
                return rawUrl;
            }
        }
        return rawUrl;
    }

    private static String itemId(JsonNode item) {
        if (item.hasNonNull("id")) {
            return item.get("id").asText();
        }
        return item.path("uid").asText(null);
    }

    // ========================= MUTATIONS =========================

    @Override
    public String createFolder(String parentFolderId, String name) {
        URI uri = childUri("folders", parentFolderId);
        Map<String, Object> payload = Map.of("name", name);
        JsonNode response = call("create folder '" + name + "'", () -> send(uri, HttpMethod.POST, payload));
        log.debug("[Postman API] Created folder '{}'", name);
        return createdId(response, "folder '" + name + "'");
    }

    @Override
    public String createRequest(String parentFolderId, EndpointDescriptor descriptor) {
        URI uri = childUri("requests", parentFolderId);
        Map<String, Object> payload = requestPayload(descriptor);
        JsonNode response = call("create request '" + descriptor.getName() + "'",
                () -> send(uri, HttpMethod.POST, payload));
        log.debug("[Postman API] Created request '{}'", descriptor.getName());
        return createdId(response, "request '" + descriptor.getName() + "'");
    }

    @Override
    public void updateRequest(String requestId, EndpointDescriptor descriptor) {
        URI uri = itemUri("requests", requestId);
        Map<String, Object> payload = requestPayload(descriptor);
        call("update request '" + descriptor.getName() + "'", () -> send(uri, HttpMethod.PUT, payload));
        log.debug("[Postman API] Updated request '{}'", descriptor.getName());
    }

    @Override
    public void deleteFolder(String folderId) {
        URI uri = itemUri("folders", folderId);
        call("delete folder " + folderId, () -> send(uri, HttpMethod.DELETE, null));
    }

    @Override
    public void deleteRequest(String requestId) {
        URI uri = itemUri("requests", requestId);
        call("delete request " + requestId, () -> send(uri, HttpMethod.DELETE, null));
    }

    // ========================= ENVIRONMENT =========================

    @Override
    public String createEnvironment() {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("environments")
                .build()
                .encode()
                .toUri();
        Map<String, Object> variable = new LinkedHashMap<>();
        variable.put("key", environmentVariable());
        variable.put("value", environmentTargetUrl);
        variable.put("enabled", true);
        Map<String, Object> environment = new LinkedHashMap<>();
        environment.put("name", environmentName);
        environment.put("values", List.of(variable));
        Map<String, Object> payload = Map.of("environment", environment);

        JsonNode response = call("create environment '" + environmentName + "'",
                () -> send(uri, HttpMethod.POST, payload));
        JsonNode id = response.path("environment").path("id");
        if (id.isMissingNode() || id.isNull()) {
            throw new RemoteApplyException("No id returned for created environment '" + environmentName + "'", 200);
        }
        log.info("[Postman API] Created environment '{}' ({} = {})",
                environmentName, environmentVariable(), environmentTargetUrl);
        return id.asText();
    }

    // {{base_url}} -> base_url; a literal URL prefix has no variable, so fall back to base_url
    String environmentVariable() {
        String prefix = requestBaseUrl.trim();
        if (prefix.startsWith("{{") && prefix.endsWith("}}") && prefix.length() > 4) {
            return prefix.substring(2, prefix.length() - 2).trim();
        }
        return "base_url";
    }

    private Map<String, Object> requestPayload(EndpointDescriptor descriptor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", descriptor.getName());
        payload.put("method", descriptor.getVerb());
        payload.put("url", requestBaseUrl + descriptor.getPathTemplate());
        payload.put("description", descriptor.getDescription());
        if (descriptor.getExampleBody() != null) {
            payload.put("dataMode", "raw");
            payload.put("rawModeData", contentHasher.render(descriptor.getExampleBody()));
            payload.put("headerData", List.of(Map.of("key", "Content-Type", "value", "application/json")));
        }
        return payload;
    }

    private JsonNode send(URI uri, HttpMethod method, Object payload) {
        ResponseEntity<String> response = restTemplate.exchange(
                uri, method, new HttpEntity<>(payload, headers()), String.class);
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApplyException("Response is not valid JSON: " + e.getOriginalMessage(),
                    response.getStatusCode().value(), e);
        }
    }

    private static String createdId(JsonNode response, String what) {
        JsonNode data = response.path("data");
        if (data.hasNonNull("id")) {
            return data.get("id").asText();
        }
        if (response.hasNonNull("model_id")) {
            return response.get("model_id").asText();
        }
        throw new RemoteApplyException("No id returned for created " + what, 200);
    }

    // ========================= HTTP PLUMBING =========================

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("X-Api-Key", apiKey);
        }
        return headers;
    }

    private URI collectionUri() {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("collections", collectionId)
                .build()
                .encode()
                .toUri();
    }

    private URI childUri(String kind, String parentFolderId) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("collections", collectionId, kind);
        if (parentFolderId != null && !parentFolderId.equals(collectionId)) {
            builder.queryParam("folder", parentFolderId);
        }
        return builder.build().encode().toUri();
    }

    private URI itemUri(String kind, String id) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("collections", collectionId, kind, id)
                .build()
                .encode()
                .toUri();
    }

    /**
     * Maps transport failures onto transient vs. rejected.
     */
    private <T> T call(String description, Supplier<T> action) {
        try {
            return action.get();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String message = description + " returned " + status;
            if (TRANSIENT_STATUSES.contains(status)) {
                Duration retryAfter = status == 429 ? retryAfter(e.getResponseHeaders()) : null;
                log.warn("[Postman API] {} (transient)", message);
                throw new TransientRemoteException(message, retryAfter, e);
            }
            log.error("[Postman API] {}: {}", message, e.getResponseBodyAsString());
            throw new RemoteApplyException(message, status, e);
        } catch (ResourceAccessException e) {
            log.warn("[Postman API] {} failed: {}", description, e.getMessage());
            throw new TransientRemoteException(description + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Retry-After as delta seconds or an HTTP date; null when absent or unreadable.
     */
    static Duration retryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(trimmed)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException e) {
                log.warn("[Postman API] Unreadable Retry-After '{}'", value);
                return null;
            }
        }
    }
}
