package com.kpAnalyzer.financeEngine.gateway.controller;

import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionRequest;
import com.kpAnalyzer.financeEngine.gateway.dto.ExtractionResponse;
import com.kpAnalyzer.financeEngine.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller - thin HTTP layer over the extraction engine.
 */
@RestController
@RequestMapping("/api/v1/financials")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class FinancialExtractionController {
    
    private final GatewayService gatewayService;
    
    /**
     * Extracts financial data from proposal text.
     * 
     * @param request Request containing the document text
     * @return Extracted financials, statistics and validation
     */
    @PostMapping("/extract")
    public ResponseEntity<ExtractionResponse> extract(@Valid @RequestBody ExtractionRequest request) {
        return ResponseEntity.ok(gatewayService.processExtractionRequest(request));
    }
}
