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
public class GenerationResult {

    private String scope;

    private boolean success;

    private int ownerCount;

    private int descriptorCount;

    @Builder.Default
    private List<ExtractionFailure> failures = new ArrayList<>();

    private String errorMessage;
}
