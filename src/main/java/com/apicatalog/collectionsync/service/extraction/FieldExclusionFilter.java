package com.apicatalog.collectionsync.service.extraction;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides which fields are left out of generated request bodies.
 *
 * A field is excluded when it is flagged system or auditable, when its name is on the
 * excluded-name list, or when its data type is a layout-only type. Depends on nothing but
 * the {@link FieldSpec} itself.
 */
public final class FieldExclusionFilter implements Predicate<FieldSpec> {

    private static final FieldExclusionFilter FLAGS_ONLY =
            new FieldExclusionFilter(Collections.emptySet(), Collections.emptySet());

    private final Set<String> excludedNames;
    private final Set<String> excludedTypes;

    private FieldExclusionFilter(Set<String> excludedNames, Set<String> excludedTypes) {
        this.excludedNames = Set.copyOf(excludedNames);
        this.excludedTypes = Set.copyOf(excludedTypes);
    }

    /**
     * Filter that only honours the system and auditable flags.
     */
    public static FieldExclusionFilter flagsOnly() {
        return FLAGS_ONLY;
    }

    public static FieldExclusionFilter of(Set<String> excludedNames, Set<String> excludedTypes) {
        return new FieldExclusionFilter(
                excludedNames != null ? excludedNames : Collections.emptySet(),
                excludedTypes != null ? excludedTypes : Collections.emptySet());
    }

    /**
     * @return true when the field must not appear in a request body
     */
    @Override
    public boolean test(FieldSpec field) {
        return field.isSystem()
                || field.isAuditable()
                || excludedNames.contains(field.getName())
                || (field.getDataType() != null && excludedTypes.contains(field.getDataType()));
    }

    /**
     * Fields that make up a request body, declaration order preserved.
     */
    public List<FieldSpec> bodyFields(List<FieldSpec> fields) {
        return fields.stream()
                .filter(this.negate())
                .collect(Collectors.toList());
    }
}
