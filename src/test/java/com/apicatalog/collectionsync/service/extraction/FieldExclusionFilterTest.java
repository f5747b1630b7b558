package com.apicatalog.collectionsync.service.extraction;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FieldExclusionFilterTest {

    private static FieldSpec field(String name, String type) {
        return FieldSpec.builder().name(name).dataType(type).build();
    }

    @Test
    void excludesSystemAndAuditableFields_evenWithEmptyLists() {
        FieldExclusionFilter filter = FieldExclusionFilter.flagsOnly();

        assertThat(filter.test(FieldSpec.builder().name("owner").dataType("Data").system(true).build())).isTrue();
        assertThat(filter.test(FieldSpec.builder().name("modified").dataType("Datetime").auditable(true).build())).isTrue();
        assertThat(filter.test(field("amount", "Currency"))).isFalse();
    }

    @Test
    void excludesConfiguredNamesAndLayoutTypes() {
        FieldExclusionFilter filter = FieldExclusionFilter.of(Set.of("api_key"), Set.of("Section Break"));

        assertThat(filter.test(field("api_key", "Data"))).isTrue();
        assertThat(filter.test(field("details", "Section Break"))).isTrue();
        assertThat(filter.test(field("customer", "Link"))).isFalse();
    }

    @Test
    void bodyFields_keepsDeclarationOrder() {
        FieldExclusionFilter filter = FieldExclusionFilter.of(Set.of("idx"), Set.of());

        List<FieldSpec> body = filter.bodyFields(List.of(
                field("customer", "Link"),
                field("idx", "Int"),
                field("amount", "Currency"),
                field("posting_date", "Date")));

        assertThat(body).extracting(FieldSpec::getName).containsExactly("customer", "amount", "posting_date");
    }

    @Test
    void nullListsBehaveAsEmpty() {
        FieldExclusionFilter filter = FieldExclusionFilter.of(null, null);

        assertThat(filter.test(field("anything", null))).isFalse();
    }
}
