package com.apicatalog.collectionsync.service.descriptor;

import com.apicatalog.collectionsync.dto.DescriptorKind;
import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import com.apicatalog.collectionsync.service.extraction.FieldExclusionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Builds the endpoint descriptors of one owner type: five CRUD descriptors in fixed order
 * (List, Retrieve, Create, Update, Delete) followed by one POST descriptor per callable method.
 *
 * Output is a pure function of the input, hashes included.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EndpointDescriptorBuilder {

    private static final String GET = "GET";
    private static final String POST = "POST";
    private static final String PUT = "PUT";
    private static final String DELETE = "DELETE";

    private final DescriptorPathGenerator pathGenerator;
    private final ContentHasher contentHasher;

    /**
     * Build with the system/auditable flags as the only body filter.
     */
    public List<EndpointDescriptor> build(String ownerType, List<FieldSpec> fields, List<MethodSpec> methods) {
        return build(ownerType, fields, methods, FieldExclusionFilter.flagsOnly());
    }

    public List<EndpointDescriptor> build(String ownerType, List<FieldSpec> fields, List<MethodSpec> methods,
                                          FieldExclusionFilter filter) {
        if (ownerType == null || ownerType.isBlank()) {
            throw new IllegalArgumentException("Owner type is required");
        }
        List<FieldSpec> bodyFields = filter.bodyFields(fields != null ? fields : Collections.emptyList());

        String collectionPath = pathGenerator.collectionPath(ownerType);
        String itemPath = pathGenerator.itemPath(ownerType);

        List<EndpointDescriptor> descriptors = new ArrayList<>();
        descriptors.add(descriptor(ownerType, DescriptorKind.LIST, "List " + ownerType, GET, collectionPath,
                "Get list of " + ownerType + " records", null));
        descriptors.add(descriptor(ownerType, DescriptorKind.RETRIEVE, "Retrieve " + ownerType, GET, itemPath,
                "Get specific " + ownerType + " record by id", null));
        descriptors.add(descriptor(ownerType, DescriptorKind.CREATE, "Create " + ownerType, POST, collectionPath,
                "Create new " + ownerType + " record", recordBody(bodyFields)));
        descriptors.add(descriptor(ownerType, DescriptorKind.UPDATE, "Update " + ownerType, PUT, itemPath,
                "Update existing " + ownerType + " record", recordBody(bodyFields)));
        descriptors.add(descriptor(ownerType, DescriptorKind.DELETE, "Delete " + ownerType, DELETE, itemPath,
                "Delete " + ownerType + " record", null));

        for (MethodSpec method : methods != null ? methods : Collections.<MethodSpec>emptyList()) {
            descriptors.add(methodDescriptor(ownerType, method));
        }

        requireUniqueRoutes(ownerType, descriptors);
        log.debug("Built {} descriptors for {} ({} body fields)", descriptors.size(), ownerType, bodyFields.size());
        return Collections.unmodifiableList(descriptors);
    }

    private EndpointDescriptor methodDescriptor(String ownerType, MethodSpec method) {
        if (method.getName() == null || method.getName().isBlank()) {
            throw new IllegalArgumentException("Method of " + ownerType + " has no name");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("args", new ArrayList<>(method.getParameterNames()));

        String description = "Custom method: " + method.getName();
        if (method.getSourceLocation() != null) {
            description += " (" + method.getSourceLocation() + ")";
        }
        return descriptor(ownerType, DescriptorKind.METHOD, method.getName(), POST,
                pathGenerator.methodPath(ownerType, method.getName()), description, body);
    }

    private EndpointDescriptor descriptor(String ownerType, DescriptorKind kind, String name, String verb,
                                          String path, String description, Map<String, Object> body) {
        Map<String, Object> frozenBody = body != null ? Collections.unmodifiableMap(body) : null;
        return EndpointDescriptor.builder()
                .name(name)
                .ownerType(ownerType)
                .kind(kind)
                .verb(verb)
                .pathTemplate(path)
                .description(description)
                .exampleBody(frozenBody)
                .contentHash(contentHasher.hash(verb, path, frozenBody))
                .build();
    }

    private Map<String, Object> recordBody(List<FieldSpec> bodyFields) {
        Map<String, Object> body = new LinkedHashMap<>();
        for (FieldSpec field : bodyFields) {
            body.put(field.getName(), PlaceholderValues.forType(field.getDataType()));
        }
        return body;
    }

    // List/Create and Retrieve/Update/Delete share a path, so a route is verb + path.
    private void requireUniqueRoutes(String ownerType, List<EndpointDescriptor> descriptors) {
        Set<String> routes = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (EndpointDescriptor descriptor : descriptors) {
            if (!routes.add(descriptor.getVerb() + " " + descriptor.getPathTemplate())) {
                throw new IllegalStateException("Duplicate route for " + ownerType + ": "
                        + descriptor.getVerb() + " " + descriptor.getPathTemplate());
            }
            if (!names.add(descriptor.getName())) {
                throw new IllegalStateException("Duplicate descriptor name for " + ownerType + ": " + descriptor.getName());
            }
        }
    }
}
