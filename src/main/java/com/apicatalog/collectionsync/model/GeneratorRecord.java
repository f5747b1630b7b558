package com.apicatalog.collectionsync.model;

import com.apicatalog.collectionsync.dto.ExtractionScope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One generation target (an owner type, a module or the whole registry) and what it last produced.
 * Active records together make up the catalog that gets synced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "api_generators")
@CompoundIndex(name = "target_idx", def = "{'generationType': 1, 'targetName': 1}", unique = true)
public class GeneratorRecord {

    public enum Status {
        ACTIVE,
        ERROR
    }

    public static final String ALL_TARGET = "*";

    @Id
    private String id;

    private ExtractionScope.Type generationType;

    private String targetName;

    private String moduleName;

    @Builder.Default
    private Status status = Status.ACTIVE;

    private int endpointCount;

    private String description;

    @Builder.Default
    private List<GeneratedEndpoint> endpoints = new ArrayList<>();

    private String lastError;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public ExtractionScope toScope() {
        return generationType == ExtractionScope.Type.ALL
                ? ExtractionScope.all()
                : ExtractionScope.of(generationType, targetName);
    }

    /**
     * Snapshot of one generated endpoint.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GeneratedEndpoint {
        private String ownerType;
        private String name;
        private String verb;
        private String path;
        private String contentHash;
    }
}
