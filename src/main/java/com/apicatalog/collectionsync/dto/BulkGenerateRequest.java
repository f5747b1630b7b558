package com.apicatalog.collectionsync.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkGenerateRequest {

    @NotEmpty(message = "At least one owner type is required")
    private List<String> ownerTypes;
}
