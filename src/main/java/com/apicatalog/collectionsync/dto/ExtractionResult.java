package com.apicatalog.collectionsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {

    @Builder.Default
    private List<OwnerMetadata> owners = new ArrayList<>();

    @Builder.Default
    private List<ExtractionFailure> failures = new ArrayList<>();

    public boolean isEmpty() {
        return owners.isEmpty();
    }
}
