package com.apicatalog.collectionsync.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

    @NotNull(message = "Scope type is required")
    private ExtractionScope.Type scopeType;

    private String name;    // owner type or module; unused for ALL

    public ExtractionScope toScope() {
        return ExtractionScope.of(scopeType, name);
    }
}
