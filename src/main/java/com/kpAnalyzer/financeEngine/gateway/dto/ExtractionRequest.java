package com.kpAnalyzer.financeEngine.gateway.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for financial extraction.
 * Empty text is accepted and yields an empty result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {
    
    @NotNull(message = "text cannot be null")
    private String text;
}
