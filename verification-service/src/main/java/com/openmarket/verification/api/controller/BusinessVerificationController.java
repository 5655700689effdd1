package com.openmarket.verification.api.controller;

import com.openmarket.common.dto.BaseResponse;
import com.openmarket.verification.api.dto.ApproveBusinessRequest;
import com.openmarket.verification.api.dto.BusinessDecisionResponse;
import com.openmarket.verification.api.dto.BusinessSummaryResponse;
import com.openmarket.verification.api.dto.DecisionNotesRequest;
import com.openmarket.verification.domain.model.Priority;
import com.openmarket.verification.domain.model.VerificationStatus;
import com.openmarket.verification.domain.service.VerificationQueryService;
import com.openmarket.verification.orchestration.ApprovalOrchestrator;
import com.openmarket.verification.orchestration.BusinessDecisionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Admin endpoints for the business verification queue and business-level decisions.
 * Warnings (unverified documents, notification problems) travel in {@code BaseResponse.warnings}.
 */
@RestController
@RequestMapping("/api/v1/verification/businesses")
@RequiredArgsConstructor
public class BusinessVerificationController {

    private final VerificationQueryService queryService;
    private final ApprovalOrchestrator approvalOrchestrator;

    @GetMapping
    public ResponseEntity<BaseResponse<List<BusinessSummaryResponse>>> listBusinesses(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority) {
        List<BusinessSummaryResponse> businesses = queryService.listBusinesses(
                        status != null ? VerificationStatus.fromValue(status) : null,
                        priority != null ? Priority.fromValue(priority) : null)
                .stream()
                .map(BusinessSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(businesses));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BusinessSummaryResponse>> getBusiness(@PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(BusinessSummaryResponse.from(queryService.getBusiness(id))));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<BaseResponse<BusinessDecisionResponse>> approve(
            @PathVariable UUID id,
            @Valid @RequestBody ApproveBusinessRequest request) {
        return respond("Business approved",
                approvalOrchestrator.approveBusiness(id, request.approvedBy(), request.notes()));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<BusinessDecisionResponse>> reject(
            @PathVariable UUID id,
            @RequestBody DecisionNotesRequest request) {
        return respond("Business rejected",
                approvalOrchestrator.rejectBusiness(id, request.notes(), request.decidedBy()));
    }

    @PostMapping("/{id}/suspend")
    public ResponseEntity<BaseResponse<BusinessDecisionResponse>> suspend(
            @PathVariable UUID id,
            @RequestBody DecisionNotesRequest request) {
        return respond("Business suspended",
                approvalOrchestrator.suspendBusiness(id, request.notes(), request.decidedBy()));
    }

    @PostMapping("/{id}/reset")
    public ResponseEntity<BaseResponse<BusinessDecisionResponse>> resetToPending(
            @PathVariable UUID id,
            @RequestBody(required = false) DecisionNotesRequest request) {
        DecisionNotesRequest body = request != null ? request : new DecisionNotesRequest(null, null);
        return respond("Business reset to pending",
                approvalOrchestrator.resetBusinessToPending(id, body.notes(), body.decidedBy()));
    }

    private static ResponseEntity<BaseResponse<BusinessDecisionResponse>> respond(
            String message, BusinessDecisionResult result) {
        return ResponseEntity.ok(BaseResponse.success(message, BusinessDecisionResponse.from(result), result.warnings()));
    }
}
