package com.apicatalog.collectionsync.dto.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializable index of the schema registry, produced ahead of time by a registry scan.
 *
 * <pre>
 * modules:
 *   - name: Accounts
 *     types:
 *       - name: Invoice
 *         controller: accounts/doctype/invoice/invoice.py
 *         fields: [{name: amount, type: Currency}]
 *         methods: [{name: calculate_discount, parameters: [discount_percent]}]
 *     hooks:
 *       - {owner: Invoice, name: send_reminder, parameters: [days], source: accounts/hooks.py}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaIndex {

    @Builder.Default
    private List<ModuleEntry> modules = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModuleEntry {
        private String name;
        @Builder.Default
        private List<TypeEntry> types = new ArrayList<>();
        @Builder.Default
        private List<HookEntry> hooks = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TypeEntry {
        private String name;
        private String controller;      // source file of the type's controller
        @Builder.Default
        private List<FieldEntry> fields = new ArrayList<>();
        @Builder.Default
        private List<MethodEntry> methods = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldEntry {
        private String name;
        private String type;
        private boolean system;
        private boolean auditable;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MethodEntry {
        private String name;
        @Builder.Default
        private List<String> parameters = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HookEntry {
        private String owner;
        private String name;
        @Builder.Default
        private List<String> parameters = new ArrayList<>();
        private String source;          // hook file the callable is registered in
    }
}
