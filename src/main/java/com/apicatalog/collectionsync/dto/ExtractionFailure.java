package com.apicatalog.collectionsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An owner type that could not be extracted, built or assembled. Recorded, never fatal to the pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionFailure {
    private String ownerType;
    private String stage;           // EXTRACT, BUILD
    private String errorType;
    private String message;
}
