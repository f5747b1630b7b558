package com.apicatalog.collectionsync.service.descriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Example values for request bodies, chosen by field data type.
 */
final class PlaceholderValues {

    private static final Set<String> INTEGER_TYPES = Set.of("Int", "Check", "Duration", "Rating");
    private static final Set<String> DECIMAL_TYPES = Set.of("Float", "Currency", "Percent");
    private static final Set<String> TABLE_TYPES = Set.of("Table", "Table MultiSelect");

    private PlaceholderValues() {
    }

    static Object forType(String dataType) {
        if (dataType == null) {
            return "";
        }
        if (INTEGER_TYPES.contains(dataType)) {
            return 0;
        }
        if (DECIMAL_TYPES.contains(dataType)) {
            return 0.0;
        }
        if (TABLE_TYPES.contains(dataType)) {
            return new ArrayList<>();
        }
        if ("Geolocation".equals(dataType)) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("latitude", 0.0);
            point.put("longitude", 0.0);
            return point;
        }
        return "";
    }
}
