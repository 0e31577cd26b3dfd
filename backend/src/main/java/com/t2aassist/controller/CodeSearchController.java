package com.t2aassist.controller;

import com.t2aassist.dto.mapper.CodeMapper;
import com.t2aassist.dto.request.CompatibilityCheckRequest;
import com.t2aassist.dto.response.*;
import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.snapshot.DataVersionMismatchException;
import com.t2aassist.service.CodeSearchService;
import com.t2aassist.service.CompatibilityCheckService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for CCAM code lookup.
 * Provides free-text search, code details, associations, compatibility checks and statistics.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class CodeSearchController {

    private final CodeSearchService searchService;
    private final CompatibilityCheckService checkService;
    private final CodeMapper codeMapper;
    private final int defaultLimit;
    private final int maxLimit;

    public CodeSearchController(
            CodeSearchService searchService,
            CompatibilityCheckService checkService,
            CodeMapper codeMapper,
            @Value("${t2a.search.default-limit:15}") int defaultLimit,
            @Value("${t2a.search.max-limit:50}") int maxLimit) {
        this.searchService = searchService;
        this.checkService = checkService;
        this.codeMapper = codeMapper;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    // ========================================================================
    // Search
    // ========================================================================

    /**
     * Search codes by free-text description. A blank query yields an empty result, not an error.
     */
    @GetMapping("/search")
    public ResponseEntity<SearchResponseDto> search(
            @RequestParam(defaultValue = "") String q,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false, defaultValue = "false") boolean includeRetired) {

        int effectiveLimit = Math.max(1, Math.min(limit != null ? limit : defaultLimit, maxLimit));
        return ResponseEntity.ok(codeMapper.toSearchResponse(
            searchService.search(q, effectiveLimit, includeRetired)));
    }

    // ========================================================================
    // Code details
    // ========================================================================

    /**
     * Get full details for a code, retired codes included.
     */
    @GetMapping("/codes/{code}")
    public ResponseEntity<CodeDto> getCode(@PathVariable String code) {
        CatalogCode found = searchService.getCode(code);
        return ResponseEntity.ok(codeMapper.toDto(found, searchService.getAssociationCount(found.id())));
    }

    /**
     * Get every code associated with a code, most trusted first.
     */
    @GetMapping("/codes/{code}/associations")
    public ResponseEntity<AssociationsResponseDto> getAssociations(@PathVariable String code) {
        CatalogCode found = searchService.getCode(code);
        return ResponseEntity.ok(codeMapper.toAssociationsResponse(found.id(), searchService.getAssociations(found.id())));
    }

    /**
     * Check whether a set of codes can be billed together.
     */
    @GetMapping("/check")
    public ResponseEntity<CompatibilityCheckDto> check(@RequestParam List<String> codes) {
        return checkCodes(codes);
    }

    @PostMapping("/check")
    public ResponseEntity<CompatibilityCheckDto> check(@Valid @RequestBody CompatibilityCheckRequest request) {
        return checkCodes(request.codes());
    }

    private ResponseEntity<CompatibilityCheckDto> checkCodes(List<String> codes) {
        List<String> cleaned = codes.stream()
            .map(CodeCatalog::normalizeId)
            .filter(c -> !c.isEmpty())
            .distinct()
            .toList();
        if (cleaned.size() < 2) {
            throw new IllegalArgumentException("At least 2 codes are required");
        }
        return ResponseEntity.ok(codeMapper.toCheckDto(cleaned, checkService.check(cleaned)));
    }

    /**
     * Get reference data statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<DataStatsDto> getStats() {
        return ResponseEntity.ok(codeMapper.toDto(searchService.getStats()));
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(DataVersionMismatchException.class)
    public ResponseEntity<Map<String, String>> handleVersionMismatch(DataVersionMismatchException ex) {
        log.warn("Compatibility check hit an inconsistent snapshot: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", ex.getMessage()));
    }
}
