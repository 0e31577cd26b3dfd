package com.t2aassist.controller;

import com.t2aassist.dto.mapper.CodeMapper;
import com.t2aassist.dto.request.BillingPlanRequest;
import com.t2aassist.dto.response.BillingPlanDto;
import com.t2aassist.engine.plan.InvalidPrincipalException;
import com.t2aassist.engine.snapshot.DataVersionMismatchException;
import com.t2aassist.service.BillingPlanService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for billing plans.
 */
@RestController
@RequestMapping("/api/billing-plan")
public class BillingPlanController {

    private final BillingPlanService planService;
    private final CodeMapper codeMapper;

    public BillingPlanController(BillingPlanService planService, CodeMapper codeMapper) {
        this.planService = planService;
        this.codeMapper = codeMapper;
    }

    /**
     * Build the billing plan for a principal code.
     *
     * @param exclude codes the user removed from the plan
     * @param force   codes the user wants even without a recorded association
     */
    @GetMapping("/{code}")
    public ResponseEntity<BillingPlanDto> getBillingPlan(
            @PathVariable String code,
            @RequestParam(required = false) List<String> exclude,
            @RequestParam(required = false) List<String> force) {

        return ResponseEntity.ok(codeMapper.toDto(planService.buildPlan(code, toSet(exclude), toSet(force))));
    }

    /**
     * Same as the GET variant, for override lists too long for a query string.
     */
    @PostMapping
    public ResponseEntity<BillingPlanDto> buildBillingPlan(@Valid @RequestBody BillingPlanRequest request) {
        return ResponseEntity.ok(codeMapper.toDto(
            planService.buildPlan(request.principal(), toSet(request.exclude()), toSet(request.force()))));
    }

    private static Set<String> toSet(List<String> values) {
        return values == null ? Set.of() : Set.copyOf(values);
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(InvalidPrincipalException.class)
    public ResponseEntity<Map<String, String>> handleInvalidPrincipal(InvalidPrincipalException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(Map.of(
                "error", ex.getMessage(),
                "code", ex.getCode(),
                "reason", ex.getReason().name().toLowerCase(Locale.ROOT)
            ));
    }

    @ExceptionHandler(DataVersionMismatchException.class)
    public ResponseEntity<Map<String, String>> handleVersionMismatch(DataVersionMismatchException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
