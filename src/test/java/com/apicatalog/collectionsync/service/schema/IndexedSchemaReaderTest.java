package com.apicatalog.collectionsync.service.schema;

import com.apicatalog.collectionsync.dto.schema.FieldSpec;
import com.apicatalog.collectionsync.dto.schema.MethodSource;
import com.apicatalog.collectionsync.dto.schema.MethodSpec;
import com.apicatalog.collectionsync.exception.ModuleNotFoundException;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.exception.SchemaIndexException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexedSchemaReaderTest {

    private static IndexedSchemaReader reader(String indexPath) {
        IndexedSchemaReader reader = new IndexedSchemaReader(new DefaultResourceLoader(), new ObjectMapper());
        ReflectionTestUtils.setField(reader, "indexPath", indexPath);
        return reader;
    }

    @Test
    void readsYamlIndex() {
        IndexedSchemaReader reader = reader("classpath:schema-index-test.yml");

        assertThat(reader.listModules()).containsExactly("Accounts", "Selling");
        assertThat(reader.listTypes("Accounts")).containsExactly("Invoice");
        assertThat(reader.listTypes(null)).containsExactly("Invoice", "Sales Order");
        assertThat(reader.getModule("Sales Order")).contains("Selling");
        assertThat(reader.exists("Invoice")).isTrue();
        assertThat(reader.exists("Quotation")).isFalse();
    }

    @Test
    void fieldsKeepDeclarationOrderAndFlags() {
        List<FieldSpec> fields = reader("classpath:schema-index-test.yml").getFields("Invoice");

        assertThat(fields).extracting(FieldSpec::getName).containsExactly("amount", "customer", "owner", "modified");
        assertThat(fields.get(2).isSystem()).isTrue();
        assertThat(fields.get(3).isAuditable()).isTrue();
        assertThat(fields.get(0).getDataType()).isEqualTo("Currency");
    }

    @Test
    void methodsAndHooksCarryTheirSource() {
        IndexedSchemaReader reader = reader("classpath:schema-index-test.yml");

        List<MethodSpec> methods = reader.getMethods("Invoice");
        assertThat(methods).singleElement().satisfies(method -> {
            assertThat(method.getName()).isEqualTo("calculate_discount");
            assertThat(method.getParameterNames()).containsExactly("discount_percent");
            assertThat(method.getSource()).isEqualTo(MethodSource.CONTROLLER);
            assertThat(method.getSourceLocation()).isEqualTo("accounts/doctype/invoice/invoice.py");
        });

        assertThat(reader.getHookMethods())
                .extracting(MethodSpec::getName)
                .containsExactly("calculate_discount", "send_reminder");
        assertThat(reader.getHookMethods()).allSatisfy(hook -> assertThat(hook.getSource()).isEqualTo(MethodSource.HOOK));
    }

    @Test
    void readsJsonIndex() {
        IndexedSchemaReader reader = reader("classpath:schema-index-test.json");

        assertThat(reader.listModules()).containsExactly("Stock");
        assertThat(reader.getFields("Item")).extracting(FieldSpec::getDataType).containsExactly("Data", "Float");
        assertThat(reader.getMethods("Item")).isEmpty();
    }

    @Test
    void unknownNamesRaiseNotFound() {
        IndexedSchemaReader reader = reader("classpath:schema-index-test.yml");

        assertThatThrownBy(() -> reader.getFields("Quotation"))
                .isInstanceOf(OwnerTypeNotFoundException.class);
        assertThatThrownBy(() -> reader.listTypes("Manufacturing"))
                .isInstanceOf(ModuleNotFoundException.class);
    }

    @Test
    void missingIndexFileFailsWithSchemaIndexException() {
        IndexedSchemaReader reader = reader("classpath:does-not-exist.yml");

        assertThatThrownBy(reader::listModules)
                .isInstanceOf(SchemaIndexException.class)
                .hasMessageContaining("does-not-exist.yml");
    }

    @Test
    void reload_picksUpFieldsAddedToTheIndexFile(@TempDir Path dir) throws IOException {
        Path index = dir.resolve("schema-index.yml");
        Files.writeString(index, indexWithInvoiceFields("amount"));
        IndexedSchemaReader reader = reader(index.toUri().toString());

        assertThat(reader.getFields("Invoice")).extracting(FieldSpec::getName).containsExactly("amount");

        Files.writeString(index, indexWithInvoiceFields("amount", "due_date"));
        assertThat(reader.getFields("Invoice")).hasSize(1);

        reader.reload();

        assertThat(reader.getFields("Invoice")).extracting(FieldSpec::getName).containsExactly("amount", "due_date");
    }

    private static String indexWithInvoiceFields(String... fieldNames) {
        StringBuilder yaml = new StringBuilder("modules:\n  - name: Accounts\n    types:\n      - name: Invoice\n        fields:\n");
        for (String fieldName : fieldNames) {
            yaml.append("          - {name: ").append(fieldName).append(", type: Data}\n");
        }
        return yaml.toString();
    }
}
