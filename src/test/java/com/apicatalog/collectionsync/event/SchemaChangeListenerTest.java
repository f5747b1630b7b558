package com.apicatalog.collectionsync.event;

import com.apicatalog.collectionsync.dto.ExtractionScope;
import com.apicatalog.collectionsync.dto.GenerationResult;
import com.apicatalog.collectionsync.dto.sync.SyncReport;
import com.apicatalog.collectionsync.dto.sync.SyncStatus;
import com.apicatalog.collectionsync.exception.OwnerTypeNotFoundException;
import com.apicatalog.collectionsync.exception.SchemaIndexException;
import com.apicatalog.collectionsync.exception.SyncInProgressException;
import com.apicatalog.collectionsync.service.ApiCatalogService;
import com.apicatalog.collectionsync.service.ExclusionConfigurationService;
import com.apicatalog.collectionsync.service.schema.SchemaReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchemaChangeListenerTest {

    @Mock
    private ApiCatalogService catalogService;

    @Mock
    private ExclusionConfigurationService exclusionConfigurationService;

    @Mock
    private SchemaReader schemaReader;

    @InjectMocks
    private SchemaChangeListener listener;

    @BeforeEach
    void setUp() {
        when(exclusionConfigurationService.getExcludedOwnerTypes()).thenReturn(Set.of("DocType"));
    }

    @Test
    void onSchemaChanged_regeneratesTheType() {
        when(catalogService.generate(ExtractionScope.singleType("Invoice")))
                .thenReturn(GenerationResult.builder().success(true).descriptorCount(5).build());

        listener.onSchemaChanged(new SchemaChangedEvent("Invoice"));

        verify(catalogService).generate(ExtractionScope.singleType("Invoice"));
        verify(catalogService, never()).synchronizeCatalog();
    }

    @Test
    void onSchemaChanged_rereadsTheIndexBeforeGenerating() {
        when(catalogService.generate(any())).thenReturn(GenerationResult.builder().success(true).build());

        listener.onSchemaChanged(new SchemaChangedEvent("Invoice"));

        InOrder inOrder = inOrder(schemaReader, catalogService);
        inOrder.verify(schemaReader).reload();
        inOrder.verify(catalogService).generate(ExtractionScope.singleType("Invoice"));
    }

    @Test
    void onSchemaChanged_unreadableIndex_skipsGeneration() {
        doThrow(new SchemaIndexException("index unreadable", new RuntimeException("io")))
                .when(schemaReader).reload();

        assertThatCode(() -> listener.onSchemaChanged(new SchemaChangedEvent("Invoice"))).doesNotThrowAnyException();

        verifyNoInteractions(catalogService);
    }

    @Test
    void onSchemaChanged_withAutoSync_syncsTheCatalog() {
        ReflectionTestUtils.setField(listener, "autoSync", true);
        when(catalogService.generate(any())).thenReturn(GenerationResult.builder().success(true).build());
        when(catalogService.synchronizeCatalog()).thenReturn(SyncReport.builder().status(SyncStatus.SUCCEEDED).build());

        listener.onSchemaChanged(new SchemaChangedEvent("Invoice"));

        verify(catalogService).synchronizeCatalog();
    }

    @Test
    void onSchemaChanged_excludedType_isIgnored() {
        listener.onSchemaChanged(new SchemaChangedEvent("DocType"));

        verifyNoInteractions(catalogService, schemaReader);
    }

    @Test
    void onSchemaChanged_unknownTypeOrBusySync_isLoggedNotThrown() {
        ReflectionTestUtils.setField(listener, "autoSync", true);
        when(catalogService.generate(ExtractionScope.singleType("Gone")))
                .thenThrow(new OwnerTypeNotFoundException("Gone"));
        when(catalogService.generate(ExtractionScope.singleType("Invoice")))
                .thenReturn(GenerationResult.builder().success(true).build());
        when(catalogService.synchronizeCatalog()).thenThrow(new SyncInProgressException());

        assertThatCode(() -> listener.onSchemaChanged(new SchemaChangedEvent("Gone"))).doesNotThrowAnyException();
        assertThatCode(() -> listener.onSchemaChanged(new SchemaChangedEvent("Invoice"))).doesNotThrowAnyException();
    }
}
