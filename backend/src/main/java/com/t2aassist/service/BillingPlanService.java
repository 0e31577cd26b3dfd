package com.t2aassist.service;

import com.t2aassist.engine.plan.BillingPlan;
import com.t2aassist.engine.plan.InvalidPrincipalException;
import com.t2aassist.engine.plan.PlanAssembler;
import com.t2aassist.engine.plan.PlanRequest;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Billing Plan Service
 *
 * Builds billing plans against the current data snapshot. Plans are never stored.
 */
@Service
@Slf4j
public class BillingPlanService {

    private final SnapshotHolder snapshotHolder;
    private final PlanAssembler planAssembler;

    public BillingPlanService(SnapshotHolder snapshotHolder, PlanAssembler planAssembler) {
        this.snapshotHolder = snapshotHolder;
        this.planAssembler = planAssembler;
    }

    /**
     * @throws InvalidPrincipalException if the principal is unknown or retired
     */
    public BillingPlan buildPlan(String principal, Set<String> excluded, Set<String> forced) {
        PlanRequest request = new PlanRequest(principal, excluded, forced);
        try {
            BillingPlan plan = planAssembler.buildPlan(snapshotHolder.current(), request);
            if (plan.staleReferences() > 0) {
                log.debug("Plan for {} skipped {} stale association targets", request.principal(), plan.staleReferences());
            }
            return plan;
        } catch (InvalidPrincipalException e) {
            log.info("Rejected plan request for {}: {}", e.getCode(), e.getReason());
            throw e;
        }
    }
}
