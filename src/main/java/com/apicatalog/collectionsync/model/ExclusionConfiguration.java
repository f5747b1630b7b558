package com.apicatalog.collectionsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Set;

/**
 * Exclusion list stored in MongoDB so the generated bodies and scanned owner types
 * can be tuned without a redeploy.
 */
@Document(collection = "exclusion_configurations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionConfiguration {

    public static final String EXCLUDED_FIELD_NAMES = "EXCLUDED_FIELD_NAMES";
    public static final String EXCLUDED_FIELD_TYPES = "EXCLUDED_FIELD_TYPES";
    public static final String EXCLUDED_OWNER_TYPES = "EXCLUDED_OWNER_TYPES";

    public static final Set<String> CONFIG_TYPES =
            Set.of(EXCLUDED_FIELD_NAMES, EXCLUDED_FIELD_TYPES, EXCLUDED_OWNER_TYPES);

    @Id
    private String id;

    private String configType; // one of the EXCLUDED_* constants

    private Set<String> values;

    private String description;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private long version = 1L;
}
