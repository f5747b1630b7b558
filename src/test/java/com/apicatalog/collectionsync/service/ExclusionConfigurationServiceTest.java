package com.apicatalog.collectionsync.service;

import com.apicatalog.collectionsync.model.ExclusionConfiguration;
import com.apicatalog.collectionsync.repository.ExclusionConfigurationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExclusionConfigurationServiceTest {

    @Mock
    private ExclusionConfigurationRepository configurationRepository;

    @InjectMocks
    private ExclusionConfigurationService configurationService;

    @Test
    void excludedFieldNames_comeFromTheActiveConfiguration() {
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_FIELD_NAMES, true))
                .thenReturn(Optional.of(ExclusionConfiguration.builder()
                        .configType(ExclusionConfiguration.EXCLUDED_FIELD_NAMES)
                        .values(Set.of("idx", "docstatus"))
                        .build()));

        assertThat(configurationService.getExcludedFieldNames()).containsExactlyInAnyOrder("idx", "docstatus");
    }

    @Test
    void missingConfiguration_meansNothingExcluded() {
        when(configurationRepository.findByConfigTypeAndActive(anyString(), anyBoolean())).thenReturn(Optional.empty());

        assertThat(configurationService.getExcludedOwnerTypes()).isEmpty();
    }

    @Test
    void initializeDefaults_seedsOnlyMissingLists() {
        when(configurationRepository.findByConfigTypeAndActive(anyString(), anyBoolean())).thenReturn(Optional.empty());
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_FIELD_TYPES, true))
                .thenReturn(Optional.of(new ExclusionConfiguration()));

        configurationService.initializeDefaultConfigurations();

        ArgumentCaptor<ExclusionConfiguration> captor = ArgumentCaptor.forClass(ExclusionConfiguration.class);
        verify(configurationRepository, times(2)).save(captor.capture());
        List<ExclusionConfiguration> saved = captor.getAllValues();
        assertThat(saved).extracting(ExclusionConfiguration::getConfigType).containsExactly(
                ExclusionConfiguration.EXCLUDED_FIELD_NAMES, ExclusionConfiguration.EXCLUDED_OWNER_TYPES);
        assertThat(saved.get(0).getValues()).contains("creation", "modified", "api_secret");
        assertThat(saved.get(1).getValues()).contains("DocType", "User");
    }

    @Test
    void update_replacesValuesAndBumpsVersion() {
        ExclusionConfiguration existing = ExclusionConfiguration.builder()
                .configType(ExclusionConfiguration.EXCLUDED_FIELD_NAMES)
                .values(Set.of("idx"))
                .version(3L)
                .build();
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_FIELD_NAMES, true))
                .thenReturn(Optional.of(existing));
        when(configurationRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        ExclusionConfiguration updated = configurationService.updateConfiguration(
                ExclusionConfiguration.EXCLUDED_FIELD_NAMES,
                ExclusionConfiguration.builder().values(Set.of("idx", "naming_series")).build());

        assertThat(updated.getValues()).containsExactlyInAnyOrder("idx", "naming_series");
        assertThat(updated.getVersion()).isEqualTo(4L);
    }

    @Test
    void update_unknownType_isRejected() {
        assertThatThrownBy(() -> configurationService.updateConfiguration("NOPE", new ExclusionConfiguration()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown exclusion list: NOPE");
        verifyNoInteractions(configurationRepository);
    }

    @Test
    void update_knownTypeWithoutActiveList_isRejected() {
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_FIELD_TYPES, true))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> configurationService.updateConfiguration(
                ExclusionConfiguration.EXCLUDED_FIELD_TYPES, new ExclusionConfiguration()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration not found");
    }

    @Test
    void update_trimsValuesAndDropsBlanks() {
        ExclusionConfiguration existing = ExclusionConfiguration.builder()
                .configType(ExclusionConfiguration.EXCLUDED_OWNER_TYPES)
                .values(Set.of("DocType"))
                .build();
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_OWNER_TYPES, true))
                .thenReturn(Optional.of(existing));
        when(configurationRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        ExclusionConfiguration updated = configurationService.updateConfiguration(
                ExclusionConfiguration.EXCLUDED_OWNER_TYPES,
                ExclusionConfiguration.builder().values(Set.of(" Web Page ", "DocType", "  ")).build());

        assertThat(updated.getValues()).containsExactly("DocType", "Web Page");
    }

    @Test
    void deactivate_marksConfigurationInactive() {
        ExclusionConfiguration existing = ExclusionConfiguration.builder()
                .configType(ExclusionConfiguration.EXCLUDED_OWNER_TYPES)
                .build();
        when(configurationRepository.findByConfigTypeAndActive(ExclusionConfiguration.EXCLUDED_OWNER_TYPES, true))
                .thenReturn(Optional.of(existing));

        configurationService.deactivateConfiguration(ExclusionConfiguration.EXCLUDED_OWNER_TYPES);

        assertThat(existing.isActive()).isFalse();
        assertThat(existing.getVersion()).isEqualTo(2L);
        verify(configurationRepository).save(existing);
    }
}
